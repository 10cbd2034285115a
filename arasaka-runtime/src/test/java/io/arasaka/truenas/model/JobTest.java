/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import io.arasaka.truenas.internal.util.Json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobTest {

    @ParameterizedTest
    @CsvSource({ "SUCCESS,SUCCEEDED", "FAILED,FAILED", "ABORTED,FAILED", "RUNNING,RUNNING", "WAITING,RUNNING", "success,SUCCEEDED",
            "Succeeded,SUCCEEDED", "SUCCEEDED,SUCCEEDED", "Running,RUNNING", "Failed,FAILED" })
    void mapsServerStates(String wire, JobState expected) {
        assertEquals(expected, JobState.fromWire(wire));
    }

    @Test
    void missingStateIsStillRunning() {
        assertEquals(JobState.RUNNING, JobState.fromWire(null));
        assertFalse(JobState.RUNNING.isTerminal());
        assertTrue(JobState.FAILED.isTerminal());
    }

    @Test
    void readsProgress() throws Exception {
        Job job = Job.fromJson(Json.MAPPER.readTree(
                "{\"id\": 7, \"state\": \"RUNNING\", \"progress\": {\"percent\": 40, \"description\": \"Pulling images\"}}"));

        assertEquals(7, job.id().asInt());
        assertEquals(40.0, job.progressPercent());
        assertEquals("Pulling images", job.progressDescription());
        assertTrue(job.result().isNull());
    }

    @Test
    void errorFallsBackToException() throws Exception {
        Job job = Job.fromJson(Json.MAPPER.readTree(
                "{\"id\": 7, \"state\": \"FAILED\", \"error\": null, \"exception\": \"Traceback ...\"}"));

        assertEquals(JobState.FAILED, job.state());
        assertEquals("Traceback ...", job.error().asText());
    }

    @Test
    void progressIsOptional() throws Exception {
        Job job = Job.fromJson(Json.MAPPER.readTree("{\"id\": 7, \"state\": \"SUCCESS\", \"result\": {\"ok\": true}}"));

        assertNull(job.progressPercent());
        assertNull(job.progressDescription());
        assertTrue(job.result().get("ok").asBoolean());
    }
}
