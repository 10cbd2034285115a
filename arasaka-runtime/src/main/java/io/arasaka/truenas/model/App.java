/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.model;

import com.fasterxml.jackson.databind.JsonNode;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * An application instance as reported by {@code app.get_instance}.
 * The full server record is kept in {@link #raw()}; only the fields the deployment flow reads are lifted out.
 */
public record App(
                  String id,
                  String name,
                  AppState state,
                  boolean upgradeAvailable,
                  boolean imageUpdatesAvailable,
                  boolean customApp,
                  @Nullable String version,
                  @Nullable String humanVersion,
                  JsonNode raw) {

    public static App fromJson(JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("Expected an app record but got " + node.getNodeType());
        }
        String name = node.path("name").asText("");
        return new App(
                node.path("id").asText(name),
                name,
                AppState.fromWire(textOrNull(node, "state")),
                node.path("upgrade_available").asBoolean(false),
                node.path("image_updates_available").asBoolean(false),
                node.path("custom_app").asBoolean(false),
                textOrNull(node, "version"),
                textOrNull(node, "human_version"),
                node);
    }

    public boolean isRunning() {
        return state == AppState.RUNNING;
    }

    @Nullable
    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
