/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.internal.rpc;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Something that can invoke a remote method and deliver its result.
 */
@FunctionalInterface
public interface RemoteCall {

    /**
     * @param method remote method name, for example {@code app.get_instance}
     * @param params positional parameters; each element is converted to JSON
     * @return future completing with the {@code result} payload
     */
    CompletableFuture<JsonNode> call(String method, List<?> params);
}
