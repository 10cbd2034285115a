/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.internal.job;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.LongNode;

import io.micrometer.core.instrument.Counter;

import io.arasaka.truenas.JobFailedException;
import io.arasaka.truenas.JobNotFoundException;
import io.arasaka.truenas.RpcException;
import io.arasaka.truenas.RpcTimeoutException;
import io.arasaka.truenas.TransportException;
import io.arasaka.truenas.internal.rpc.RemoteCall;
import io.arasaka.truenas.internal.util.Metrics;
import io.arasaka.truenas.model.Job;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Waits for server-side jobs by querying their state at a fixed interval.
 *
 * <p>Polls are scheduled, never slept: no thread is held while a job runs. A wait ends when the
 * job succeeds (its {@code result}), fails ({@link JobFailedException}), is unknown to the server
 * ({@link JobNotFoundException}), outlives the job timeout ({@link RpcTimeoutException}) or a poll
 * fails for any reason other than its own timeout. A poll that times out is retried. Cancelling
 * the returned future stops the polling, and so does {@link #failAll(RpcException)}, which the
 * owner calls when the connection is lost.</p>
 */
public class JobPoller {

    private static final Logger LOGGER = LoggerFactory.getLogger(JobPoller.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);
    public static final Duration DEFAULT_JOB_TIMEOUT = Duration.ofMinutes(30);

    static final String JOBS_METHOD = "core.get_jobs";

    private final RemoteCall caller;
    private final ScheduledExecutorService scheduler;
    private final Duration pollInterval;
    private final @Nullable Duration jobTimeout;
    private final Counter pollCounter = Metrics.jobPollCounter();
    private final Set<JobWait> active = ConcurrentHashMap.newKeySet();

    /**
     * @param caller used to issue the job queries
     * @param scheduler schedules the polls
     * @param pollInterval delay between a poll's answer and the next poll
     * @param jobTimeout longest a single wait may last; null or zero waits forever
     */
    public JobPoller(RemoteCall caller, ScheduledExecutorService scheduler, Duration pollInterval, @Nullable Duration jobTimeout) {
        this.caller = Objects.requireNonNull(caller);
        this.scheduler = Objects.requireNonNull(scheduler);
        this.pollInterval = Objects.requireNonNull(pollInterval);
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
        }
        if (jobTimeout != null && jobTimeout.isNegative()) {
            throw new IllegalArgumentException("jobTimeout must not be negative: " + jobTimeout);
        }
        this.jobTimeout = jobTimeout == null || jobTimeout.isZero() ? null : jobTimeout;
    }

    public CompletableFuture<JsonNode> awaitJob(long jobId) {
        return awaitJob(LongNode.valueOf(jobId));
    }

    /**
     * Polls until the job is terminal. The first poll is issued immediately.
     *
     * @param jobId the job handle returned by the asynchronous method
     * @return future completing with the job's result
     */
    public CompletableFuture<JsonNode> awaitJob(JsonNode jobId) {
        Objects.requireNonNull(jobId, "jobId");
        if (jobId.isNull() || jobId.isMissingNode() || jobId.isContainerNode()) {
            throw new IllegalArgumentException("Not a job id: " + jobId);
        }
        JobWait wait = new JobWait(jobId);
        active.add(wait);
        wait.result.whenComplete((value, failure) -> active.remove(wait));
        LOGGER.debug("Waiting for job {}", jobId);
        wait.poll();
        return wait.result;
    }

    /**
     * Ends every wait in progress with the given cause.
     *
     * @param cause failure to deliver
     * @return number of waits ended
     */
    public int failAll(RpcException cause) {
        int failed = 0;
        for (JobWait wait : List.copyOf(active)) {
            if (wait.result.completeExceptionally(cause)) {
                failed++;
            }
        }
        if (failed > 0) {
            LOGGER.info("Stopped waiting for {} job(s): {}", failed, cause.getMessage());
        }
        return failed;
    }

    public int activeCount() {
        return active.size();
    }

    /**
     * One wait, from first poll to terminal outcome.
     */
    private final class JobWait {
        private final JsonNode jobId;
        private final CompletableFuture<JsonNode> result = new CompletableFuture<>();
        private final long startNanos = System.nanoTime();
        private final @Nullable Long deadlineNanos;
        private volatile int polls;
        private volatile @Nullable ScheduledFuture<?> next;

        private JobWait(JsonNode jobId) {
            this.jobId = jobId;
            this.deadlineNanos = jobTimeout == null ? null : startNanos + jobTimeout.toNanos();
            result.whenComplete((value, failure) -> {
                ScheduledFuture<?> scheduled = next;
                if (scheduled != null) {
                    scheduled.cancel(false);
                }
                if (result.isCancelled()) {
                    LOGGER.debug("Stopped waiting for job {} after {} poll(s)", jobId, polls);
                }
            });
        }

        private void poll() {
            if (result.isDone()) {
                return;
            }
            if (deadlineNanos != null && System.nanoTime() - deadlineNanos >= 0) {
                result.completeExceptionally(new RpcTimeoutException(
                        "Job " + jobId + " did not finish within " + jobTimeout.toMillis() + "ms"));
                return;
            }
            polls++;
            pollCounter.increment();
            caller.call(JOBS_METHOD, List.of(List.of(List.of("id", "=", jobId))))
                    .whenComplete(this::onPoll);
        }

        private void onPoll(@Nullable JsonNode jobs, @Nullable Throwable failure) {
            if (result.isDone()) {
                return;
            }
            if (failure != null) {
                Throwable cause = RpcException.unwrap(failure);
                if (cause instanceof RpcTimeoutException) {
                    LOGGER.warn("Poll {} for job {} timed out, retrying", polls, jobId);
                    scheduleNext();
                }
                else {
                    result.completeExceptionally(cause);
                }
                return;
            }
            if (jobs == null || !jobs.isArray() || jobs.isEmpty()) {
                result.completeExceptionally(new JobNotFoundException(jobId));
                return;
            }

            Job job = Job.fromJson(jobs.get(0));
            switch (job.state()) {
                case SUCCEEDED -> {
                    LOGGER.info("Job {} succeeded after {} poll(s)", jobId, polls);
                    result.complete(job.result());
                }
                case FAILED -> {
                    LOGGER.info("Job {} failed after {} poll(s)", jobId, polls);
                    result.completeExceptionally(new JobFailedException(job));
                }
                default -> {
                    if (job.progressPercent() != null) {
                        LOGGER.debug("Job {} at {}%: {}", jobId, job.progressPercent(), job.progressDescription());
                    }
                    scheduleNext();
                }
            }
        }

        private void scheduleNext() {
            long delayNanos = pollInterval.toNanos();
            if (deadlineNanos != null) {
                delayNanos = Math.max(0, Math.min(delayNanos, deadlineNanos - System.nanoTime()));
            }
            ScheduledFuture<?> scheduled;
            try {
                scheduled = scheduler.schedule(this::poll, delayNanos, TimeUnit.NANOSECONDS);
            }
            catch (RejectedExecutionException e) {
                result.completeExceptionally(new TransportException("Client closed while waiting for job " + jobId, e));
                return;
            }
            next = scheduled;
            if (result.isDone()) {
                scheduled.cancel(false);
            }
        }
    }

    @Override
    public String toString() {
        return "JobPoller{" +
                "pollInterval=" + pollInterval +
                ", jobTimeout=" + jobTimeout +
                '}';
    }
}
