/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.web.lifecycle;

import com.wellcast.server.gateway.GatewayService;
import com.wellcast.server.gateway.HeartbeatMonitor;
import com.wellcast.server.registry.ConnectionRegistry;
import com.wellcast.server.subscriber.ReadingSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Tears the pipeline down in reverse order before Spring destroys the beans.
 * The broker client itself is closed afterwards by its bean destroy method.
 *
 * <pre>
 * Phase 1: Stop consuming readings from the broker
 * Phase 2: Stop heartbeat checks
 * Phase 3: Close client connections (1001 going away)
 * FINAL:   Shutdown Complete announcement
 * </pre>
 */
@Component
public class ShutdownOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ShutdownOrchestrator.class);

    private final ReadingSubscriber subscriber;
    private final HeartbeatMonitor heartbeatMonitor;
    private final GatewayService gateway;
    private final ConnectionRegistry registry;

    @Value("${wellcast.app-name:WellCast}")
    private String appName;

    @Value("${wellcast.version:1.0.0}")
    private String version;

    public ShutdownOrchestrator(ReadingSubscriber subscriber, HeartbeatMonitor heartbeatMonitor,
                                GatewayService gateway, ConnectionRegistry registry) {
        this.subscriber = subscriber;
        this.heartbeatMonitor = heartbeatMonitor;
        this.gateway = gateway;
        this.registry = registry;
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        Instant shutdownStart = Instant.now();
        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"));

        log.info("");
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║   SHUTDOWN INITIATED                                               ║");
        log.info("║   {} v{}{}║", appName, version, pad(appName + " v" + version, 64));
        log.info("║   Timestamp: {}{}║", timestamp, pad("Timestamp: " + timestamp, 64));
        log.info("╚════════════════════════════════════════════════════════════════════╝");
        log.info("");

        logShutdownPhase(1, "Stop Broker Subscription", "Unsubscribing from reading topics...");
        try {
            subscriber.stop();
            logShutdownPhaseComplete(1, "Subscriber stopped");
        } catch (RuntimeException e) {
            log.warn("  ⚠ Subscriber shutdown issue: {}", e.getMessage());
        }

        logShutdownPhase(2, "Stop Heartbeat Monitor", "Cancelling liveness checks...");
        heartbeatMonitor.stop();
        logShutdownPhaseComplete(2, "Heartbeat monitor stopped");

        logShutdownPhase(3, "Close Client Connections",
                gateway.getLocalConnectionCount() + " connection(s) will be told the server is going away...");
        try {
            gateway.shutdown();
            registry.clear();
            logShutdownPhaseComplete(3, "All client connections closed");
        } catch (RuntimeException e) {
            log.warn("  ⚠ Connection shutdown issue: {}", e.getMessage());
        }

        Duration elapsed = Duration.between(shutdownStart, Instant.now());
        log.info("");
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║   SHUTDOWN COMPLETE{}║", pad("SHUTDOWN COMPLETE", 64));
        log.info("║   Shutdown Time   : {} ms{}║", elapsed.toMillis(),
                pad("Shutdown Time   : " + elapsed.toMillis() + " ms", 64));
        log.info("╚════════════════════════════════════════════════════════════════════╝");
        log.info("");
    }

    private void logShutdownPhase(int number, String title, String description) {
        log.info("┌─ Shutdown Phase {}: {}", number, title);
        log.info("│  {}", description);
    }

    private void logShutdownPhaseComplete(int number, String detail) {
        log.info("└─ ✓ Phase {} complete: {}", number, detail);
    }

    private String pad(String text, int totalWidth) {
        int remaining = totalWidth - text.length();
        if (remaining <= 0) return " ";
        return " ".repeat(remaining);
    }
}
