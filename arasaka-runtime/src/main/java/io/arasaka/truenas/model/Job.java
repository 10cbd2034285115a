/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Latest polled snapshot of a server-side job, as returned by {@code core.get_jobs}.
 *
 * @param id the opaque job handle
 * @param state job state
 * @param progressPercent reported progress, when the server reports one
 * @param progressDescription reported progress description, when the server reports one
 * @param result job result, JSON null until the job succeeds
 * @param error job error, JSON null unless the job failed
 */
public record Job(
                  JsonNode id,
                  JobState state,
                  @Nullable Double progressPercent,
                  @Nullable String progressDescription,
                  JsonNode result,
                  JsonNode error) {

    public static Job fromJson(JsonNode node) {
        JsonNode progress = node.path("progress");
        JsonNode percent = progress.path("percent");
        JsonNode description = progress.path("description");
        return new Job(
                node.path("id").isMissingNode() ? NullNode.getInstance() : node.get("id"),
                JobState.fromWire(node.path("state").isTextual() ? node.get("state").asText() : null),
                percent.isNumber() ? percent.asDouble() : null,
                description.isTextual() ? description.asText() : null,
                valueOrNull(node, "result"),
                errorOf(node));
    }

    private static JsonNode valueOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null ? NullNode.getInstance() : value;
    }

    // failed jobs report a short message in "error" and sometimes the detail in "exception"
    private static JsonNode errorOf(JsonNode node) {
        JsonNode error = valueOrNull(node, "error");
        if (error.isNull() && node.hasNonNull("exception")) {
            return node.get("exception");
        }
        return error;
    }
}
