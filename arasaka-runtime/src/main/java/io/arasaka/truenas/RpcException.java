/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Base type of every failure surfaced by {@link TrueNasClient}.
 *
 * <p>Failures are delivered by completing the future returned from the client exceptionally.
 * Each subtype carries a stable {@link #code()} so that callers can branch without
 * {@code instanceof} chains when logging or mapping to exit codes.</p>
 *
 * <table>
 *   <tr><th>Type</th><th>Scope</th></tr>
 *   <tr><td>{@link TransportException}</td><td>the whole connection</td></tr>
 *   <tr><td>{@link HandshakeException}</td><td>the whole connection</td></tr>
 *   <tr><td>{@link AuthenticationException}</td><td>the whole connection</td></tr>
 *   <tr><td>{@link RemoteException}</td><td>a single call</td></tr>
 *   <tr><td>{@link RpcTimeoutException}</td><td>a single call or job wait</td></tr>
 *   <tr><td>{@link JobFailedException}</td><td>a single job wait</td></tr>
 *   <tr><td>{@link JobNotFoundException}</td><td>a single job wait</td></tr>
 * </table>
 */
public class RpcException extends Exception {

    private final String code;

    public RpcException(String code, String message) {
        super(message);
        this.code = code;
    }

    public RpcException(String code, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Strips the {@link CompletionException} / {@link ExecutionException} wrappers that
     * {@link java.util.concurrent.CompletableFuture} adds, returning the failure that was
     * actually raised.
     *
     * @param throwable failure observed on a future
     * @return the innermost non-wrapper cause
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Blocking helper for synchronous callers: rethrows the typed failure behind a
     * {@link CompletionException} / {@link ExecutionException}.
     *
     * @param throwable failure observed on a future
     * @return never returns normally
     * @throws RpcException the unwrapped failure when it is an {@code RpcException}
     */
    public static RuntimeException rethrow(Throwable throwable) throws RpcException {
        Throwable cause = unwrap(throwable);
        if (cause instanceof RpcException rpcException) {
            throw rpcException;
        }
        if (cause instanceof RuntimeException runtimeException) {
            throw runtimeException;
        }
        if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        throw new CompletionException(cause);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "code='" + code + '\'' +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
