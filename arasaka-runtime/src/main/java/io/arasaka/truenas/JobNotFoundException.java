/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas;

import com.fasterxml.jackson.databind.JsonNode;

public class JobNotFoundException extends RpcException {

    public static final String CODE = "JOB_NOT_FOUND";

    private final JsonNode jobId;

    public JobNotFoundException(JsonNode jobId) {
        super(CODE, "Job " + jobId + " not found");
        this.jobId = jobId;
    }

    public JsonNode jobId() {
        return jobId;
    }
}
