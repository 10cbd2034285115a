/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.config;

import java.time.Duration;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import io.arasaka.truenas.internal.job.JobPoller;
import io.arasaka.truenas.internal.rpc.MessageCorrelator;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Settings for a {@link io.arasaka.truenas.TrueNasClient}.
 *
 * @param server the server and its credentials
 * @param callTimeout how long a call waits for its response; also bounds the handshake
 * @param jobPollInterval delay between job status queries
 * @param jobTimeout longest wait for a job; {@link Duration#ZERO} waits forever
 * @param logNetwork log bytes on the wire
 * @param logFrames log websocket frames
 */
public record ClientConfig(
                           ServerConfig server,
                           Duration callTimeout,
                           Duration jobPollInterval,
                           Duration jobTimeout,
                           boolean logNetwork,
                           boolean logFrames) {

    public ClientConfig {
        Objects.requireNonNull(server, "server");
        Objects.requireNonNull(callTimeout, "callTimeout");
        Objects.requireNonNull(jobPollInterval, "jobPollInterval");
        Objects.requireNonNull(jobTimeout, "jobTimeout");
    }

    @JsonCreator
    public static ClientConfig of(@JsonProperty("server") ServerConfig server,
                                  @JsonProperty("callTimeout") @JsonDeserialize(using = DurationDeserializer.class) @Nullable Duration callTimeout,
                                  @JsonProperty("jobPollInterval") @JsonDeserialize(using = DurationDeserializer.class) @Nullable Duration jobPollInterval,
                                  @JsonProperty("jobTimeout") @JsonDeserialize(using = DurationDeserializer.class) @Nullable Duration jobTimeout,
                                  @JsonProperty("logNetwork") @Nullable Boolean logNetwork,
                                  @JsonProperty("logFrames") @Nullable Boolean logFrames) {
        return new ClientConfig(
                server,
                callTimeout == null ? MessageCorrelator.DEFAULT_TIMEOUT : callTimeout,
                jobPollInterval == null ? JobPoller.DEFAULT_POLL_INTERVAL : jobPollInterval,
                jobTimeout == null ? JobPoller.DEFAULT_JOB_TIMEOUT : jobTimeout,
                logNetwork != null && logNetwork,
                logFrames != null && logFrames);
    }

    public static ClientConfig of(ServerConfig server) {
        return of(server, null, null, null, null, null);
    }

    public ClientConfig withCallTimeout(Duration timeout) {
        return new ClientConfig(server, timeout, jobPollInterval, jobTimeout, logNetwork, logFrames);
    }

    public ClientConfig withJobPolling(Duration pollInterval, Duration timeout) {
        return new ClientConfig(server, callTimeout, pollInterval, timeout, logNetwork, logFrames);
    }
}
