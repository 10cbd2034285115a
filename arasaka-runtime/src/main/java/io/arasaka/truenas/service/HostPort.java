/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.arasaka.truenas.service;

import java.util.Objects;

/**
 * A host and port pair.
 *
 * @param host host name or address
 * @param port port number
 */
public record HostPort(String host, int port) {

    public HostPort {
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port " + port + " is out of range");
        }
    }

    /**
     * Parses {@code host} or {@code host:port}, falling back to {@code defaultPort} when no port is given.
     * IPv6 literals must be bracketed when a port is given, e.g. {@code [::1]:8443}.
     */
    public static HostPort parse(String address, int defaultPort) {
        Objects.requireNonNull(address, "address");
        String trimmed = address.trim();
        if (trimmed.startsWith("[")) {
            int close = trimmed.indexOf(']');
            if (close < 0) {
                throw new IllegalArgumentException("Unterminated IPv6 literal in '" + address + "'");
            }
            String host = trimmed.substring(1, close);
            String rest = trimmed.substring(close + 1);
            return new HostPort(host, rest.startsWith(":") ? parsePort(rest.substring(1), address) : defaultPort);
        }
        int colon = trimmed.lastIndexOf(':');
        if (colon > 0 && trimmed.indexOf(':') == colon) {
            return new HostPort(trimmed.substring(0, colon), parsePort(trimmed.substring(colon + 1), address));
        }
        return new HostPort(trimmed, defaultPort);
    }

    private static int parsePort(String port, String address) {
        try {
            return Integer.parseInt(port);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in '" + address + "'", e);
        }
    }

    @Override
    public String toString() {
        return (host.indexOf(':') >= 0 ? "[" + host + "]" : host) + ":" + port;
    }
}
