/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import io.arasaka.truenas.internal.util.Json;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Payload of {@code app.create}. Serialised with the server's snake_case field names.
 *
 * @param appName name of the app to create
 * @param customApp whether this is a custom (compose based) app
 * @param values catalog values, an empty object for custom apps
 * @param customComposeConfig compose configuration as a structured document
 * @param customComposeConfigString compose configuration as YAML text
 */
public record AppCreateRequest(
                               @JsonProperty("app_name") String appName,
                               @JsonProperty("custom_app") boolean customApp,
                               @JsonProperty("values") JsonNode values,
                               @JsonProperty("custom_compose_config") @Nullable JsonNode customComposeConfig,
                               @JsonProperty("custom_compose_config_string") @Nullable String customComposeConfigString) {

    public AppCreateRequest {
        Objects.requireNonNull(appName, "appName");
        if (appName.isBlank()) {
            throw new IllegalArgumentException("appName must not be blank");
        }
        if (values == null) {
            values = JsonNodeFactory.instance.objectNode();
        }
    }

    /**
     * A custom app described by a compose file's YAML text.
     */
    public static AppCreateRequest customCompose(String appName, String composeYaml) {
        return new AppCreateRequest(appName, true, JsonNodeFactory.instance.objectNode(), null, composeYaml);
    }

    public JsonNode toJson() {
        return Json.MAPPER.valueToTree(this);
    }
}
