/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.web.lifecycle;

import com.wellcast.messaging.core.BrokerClient;
import com.wellcast.server.gateway.GatewaySettings;
import com.wellcast.server.gateway.HeartbeatMonitor;
import com.wellcast.server.metrics.GatewayMetrics;
import com.wellcast.server.registry.ConnectionRegistry;
import com.wellcast.server.subscriber.ReadingSubscriber;
import com.wellcast.web.config.IngestApiKeys;
import com.wellcast.web.config.WebSocketConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Brings the pipeline up once Spring is ready, announcing each phase in the log.
 *
 * <pre>
 * Phase 1: Metrics binding (registry gauges)
 * Phase 2: Broker subscription (retries in the background if the broker is down)
 * Phase 3: Heartbeat monitor
 * FINAL:   System Ready announcement with endpoints
 * </pre>
 */
@Component
public class StartupOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(StartupOrchestrator.class);

    private final ConnectionRegistry registry;
    private final GatewayMetrics metrics;
    private final ReadingSubscriber subscriber;
    private final HeartbeatMonitor heartbeatMonitor;
    private final GatewaySettings gatewaySettings;
    private final BrokerClient broker;
    private final IngestApiKeys apiKeys;

    @Value("${wellcast.app-name:WellCast}")
    private String appName;

    @Value("${wellcast.version:1.0.0}")
    private String version;

    @Value("${server.port:8090}")
    private int serverPort;

    @Value("${wellcast.broker.type:IN_MEMORY}")
    private String brokerType;

    private final AtomicBoolean startupComplete = new AtomicBoolean(false);

    public StartupOrchestrator(ConnectionRegistry registry, GatewayMetrics metrics, ReadingSubscriber subscriber,
                               HeartbeatMonitor heartbeatMonitor, GatewaySettings gatewaySettings,
                               BrokerClient broker, IngestApiKeys apiKeys) {
        this.registry = registry;
        this.metrics = metrics;
        this.subscriber = subscriber;
        this.heartbeatMonitor = heartbeatMonitor;
        this.gatewaySettings = gatewaySettings;
        this.broker = broker;
        this.apiKeys = apiKeys;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!startupComplete.compareAndSet(false, true)) return;
        Instant startTime = Instant.now();

        logBanner("STARTUP INITIATED",
                appName + " v" + version + " - Starting initialization sequence...",
                "Timestamp: " + LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")));

        logPhase(1, "Metrics Binding", "Registering connection and subscription gauges...");
        metrics.bindRegistryGauges(registry::connectionCount, registry::subscriptionCount);
        logPhaseComplete(1, "Metrics Binding", "wellcast.connections.active, wellcast.subscriptions.active");

        logPhase(2, "Broker Subscription", "Subscribing to readings on " + brokerType + " broker...");
        subscriber.start();
        logPhaseComplete(2, "Broker Subscription",
                "Subscriber state: " + subscriber.getState(),
                "Broker state: " + broker.getState());

        logPhase(3, "Heartbeat Monitor", "Starting client liveness checks...");
        heartbeatMonitor.start();
        logPhaseComplete(3, "Heartbeat Monitor",
                "Interval: " + gatewaySettings.getHeartbeatInterval().toSeconds() + "s, max missed: "
                        + gatewaySettings.getMaxMissedHeartbeats());

        logSystemReady(Duration.between(startTime, Instant.now()));
    }

    // ─── Logging Helpers ────────────────────────────────────────────────

    private void logBanner(String title, String... lines) {
        log.info("");
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║  {}{}║", title, pad(title, 65));
        for (String line : lines) {
            log.info("║  {}{}║", line, pad(line, 65));
        }
        log.info("╚════════════════════════════════════════════════════════════════════╝");
        log.info("");
    }

    private void logPhase(int number, String title, String description) {
        log.info("");
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║  Phase {}: {}{}║", number, title, pad("Phase " + number + ": " + title, 59));
        log.info("║  {}{}║", description, pad(description, 65));
        log.info("╚════════════════════════════════════════════════════════════════════╝");
    }

    private void logPhaseComplete(int number, String title, String... details) {
        log.info("✓ Phase {} complete: {}", number, title);
        for (String detail : details) {
            log.info("  {}", detail);
        }
    }

    private void logSystemReady(Duration elapsed) {
        String baseUrl = "http://localhost:" + serverPort;
        String wsUrl = "ws://localhost:" + serverPort + WebSocketConfig.READINGS_PATH;
        String ingestUrl = baseUrl + "/api/v1/readings";
        String statsUrl = baseUrl + "/api/v1/gateway/stats";
        String healthUrl = baseUrl + "/actuator/health";

        log.info("");
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║   SYSTEM READY - {} v{}{}║", appName, version,
                pad("SYSTEM READY - " + appName + " v" + version, 64));
        log.info("╠════════════════════════════════════════════════════════════════════╣");
        log.info("║   WebSocket      : {}{}║", wsUrl, pad("WebSocket      : " + wsUrl, 64));
        log.info("║   Ingestion API  : {}{}║", ingestUrl, pad("Ingestion API  : " + ingestUrl, 64));
        log.info("║   Gateway Stats  : {}{}║", statsUrl, pad("Gateway Stats  : " + statsUrl, 64));
        log.info("║   Health Check   : {}{}║", healthUrl, pad("Health Check   : " + healthUrl, 64));
        log.info("╠════════════════════════════════════════════════════════════════════╣");
        String subscriberStr = "✓ Subscriber     : " + subscriber.getState();
        log.info("║   {}{}║", subscriberStr, pad(subscriberStr, 64));
        String brokerStr = "✓ Broker         : " + brokerType + " (" + broker.getState() + ")";
        log.info("║   {}{}║", brokerStr, pad(brokerStr, 64));
        String keysStr = "✓ Ingest Keys    : " + apiKeys.size() + " configured";
        log.info("║   {}{}║", keysStr, pad(keysStr, 64));
        log.info("║   Startup Time    : {} ms{}║", elapsed.toMillis(),
                pad("Startup Time    : " + elapsed.toMillis() + " ms", 64));
        log.info("╚════════════════════════════════════════════════════════════════════╝");
        log.info("");
    }

    private String pad(String text, int totalWidth) {
        int remaining = totalWidth - text.length();
        if (remaining <= 0) return " ";
        return " ".repeat(remaining);
    }
}
