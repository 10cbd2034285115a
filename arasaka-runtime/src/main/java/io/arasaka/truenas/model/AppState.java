/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.model;

import java.util.Locale;

import edu.umd.cs.findbugs.annotations.Nullable;

public enum AppState {
    CRASHED,
    DEPLOYING,
    RUNNING,
    STOPPED,
    STOPPING,
    UNKNOWN;

    public static AppState fromWire(@Nullable String state) {
        if (state == null) {
            return UNKNOWN;
        }
        try {
            return valueOf(state.toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
