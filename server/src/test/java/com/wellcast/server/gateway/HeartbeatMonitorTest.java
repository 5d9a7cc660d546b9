/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.gateway;

import com.wellcast.server.auth.AuthenticatedPrincipal;
import com.wellcast.server.dispatch.ReadingDispatcher;
import com.wellcast.server.metrics.GatewayMetrics;
import com.wellcast.server.registry.ConnectionRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class HeartbeatMonitorTest {

    private HeartbeatMonitor monitor;

    @AfterEach
    void tearDown() {
        if (monitor != null) monitor.stop();
    }

    @Test
    void closesSilentConnectionsOnSchedule() {
        ConnectionRegistry registry = new ConnectionRegistry();
        GatewaySettings settings = new GatewaySettings(Duration.ofSeconds(1), Duration.ofMillis(20), 2,
                Duration.ofSeconds(1), 1024);
        GatewayService gateway = new GatewayService(registry, new ReadingDispatcher(registry),
                token -> CompletableFuture.completedFuture(new AuthenticatedPrincipal("t1", "u1", "viewer")),
                settings, new GatewayMetrics(new SimpleMeterRegistry()), Runnable::run, Clock.systemUTC());
        RecordingChannel channel = new RecordingChannel();
        gateway.open(channel, "token");

        monitor = new HeartbeatMonitor(gateway);
        monitor.start();

        await().atMost(5, TimeUnit.SECONDS)
                .untilAsserted(() -> assertThat(channel.closedWith).isEqualTo(CloseReason.HEARTBEAT_TIMEOUT));
        assertThat(channel.pings.get()).isGreaterThanOrEqualTo(1);
        assertThat(registry.connectionCount()).isZero();
    }

    @Test
    void startAndStopAreIdempotent() {
        ConnectionRegistry registry = new ConnectionRegistry();
        GatewayService gateway = new GatewayService(registry, new ReadingDispatcher(registry),
                token -> new CompletableFuture<>(), GatewaySettings.defaults(),
                new GatewayMetrics(new SimpleMeterRegistry()), Runnable::run, Clock.systemUTC());
        monitor = new HeartbeatMonitor(gateway);

        monitor.start();
        monitor.start();
        assertThat(monitor.isRunning()).isTrue();

        monitor.stop();
        monitor.stop();
        assertThat(monitor.isRunning()).isFalse();
    }
}
