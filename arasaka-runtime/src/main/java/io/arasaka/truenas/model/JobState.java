/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.model;

import java.util.Locale;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Client view of a background job's state. The server distinguishes more states
 * ({@code WAITING}, {@code RUNNING}, {@code SUCCESS}, {@code FAILED}, {@code ABORTED}); the
 * poller only cares whether the job is still going. Matching is case-insensitive and accepts
 * {@code Succeeded} as well as {@code SUCCESS}.
 */
public enum JobState {
    RUNNING,
    SUCCEEDED,
    FAILED;

    public static JobState fromWire(@Nullable String state) {
        if (state == null) {
            return RUNNING;
        }
        return switch (state.toUpperCase(Locale.ROOT)) {
            case "SUCCESS", "SUCCEEDED" -> SUCCEEDED;
            case "FAILED", "ABORTED" -> FAILED;
            default -> RUNNING;
        };
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
