/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.arasaka.truenas.service;

import java.net.URI;
import java.util.Objects;

// aka HostPort with the websocket path and Tls
public record ServiceEndpoint(HostPort hostPort, String path, boolean tls, boolean insecure) {

    public static final String DEFAULT_PATH = "/websocket";

    public ServiceEndpoint {
        Objects.requireNonNull(hostPort, "hostPort");
        Objects.requireNonNull(path, "path");
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
    }

    public static ServiceEndpoint of(String address, boolean tls) {
        return new ServiceEndpoint(HostPort.parse(address, tls ? 443 : 80), DEFAULT_PATH, tls, true);
    }

    public String host() {
        return hostPort.host();
    }

    public int port() {
        return hostPort.port();
    }

    public URI uri() {
        return URI.create((tls ? "wss" : "ws") + "://" + hostPort + path);
    }
}
