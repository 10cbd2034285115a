/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas;

import com.fasterxml.jackson.databind.JsonNode;

import io.arasaka.truenas.model.Job;

/**
 * A polled job reached the terminal failed state.
 */
public class JobFailedException extends RpcException {

    public static final String CODE = "JOB_FAILED";

    private final JsonNode jobId;
    private final JsonNode error;

    public JobFailedException(Job job) {
        super(CODE, "Job " + job.id() + " failed: " + RemoteException.describe(job.error()));
        this.jobId = job.id();
        this.error = job.error();
    }

    public JsonNode jobId() {
        return jobId;
    }

    /**
     * @return the error the server reported for the job
     */
    public JsonNode error() {
        return error;
    }
}
