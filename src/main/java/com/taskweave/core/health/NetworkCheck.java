package com.taskweave.core.health;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * TCP reachability of the primary backend's service endpoint. Healthy when no
 * target host is configured.
 */
public class NetworkCheck implements HealthCheck {

    public static final String NAME = "network";

    private final String host;
    private final int port;
    private final int timeoutMs;

    public NetworkCheck(String host, int port, int timeoutMs) {
        this.host = host;
        this.port = port;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public HealthStatus check() {
        if (host == null || host.isBlank()) {
            return HealthStatus.healthy(NAME, "No target host configured");
        }
        try (var socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), timeoutMs);
            return HealthStatus.healthy(NAME, host + ":" + port + " reachable");
        } catch (IOException e) {
            return HealthStatus.critical(NAME, host + ":" + port + " unreachable: " + e.getMessage());
        }
    }
}
