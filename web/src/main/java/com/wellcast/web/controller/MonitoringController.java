/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.web.controller;

import com.wellcast.messaging.core.BrokerClient;
import com.wellcast.server.gateway.GatewayService;
import com.wellcast.server.gateway.HeartbeatMonitor;
import com.wellcast.server.metrics.GatewayMetrics;
import com.wellcast.server.registry.ConnectionRegistry;
import com.wellcast.server.registry.RegistrySnapshot;
import com.wellcast.server.subscriber.ReadingSubscriber;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/** Operational view of the gateway for dashboards and on-call. */
@RestController
@RequestMapping("/api/v1/gateway")
public class MonitoringController {

    private final ConnectionRegistry registry;
    private final GatewayService gateway;
    private final ReadingSubscriber subscriber;
    private final HeartbeatMonitor heartbeatMonitor;
    private final BrokerClient broker;
    private final GatewayMetrics metrics;

    public MonitoringController(ConnectionRegistry registry, GatewayService gateway, ReadingSubscriber subscriber,
                                HeartbeatMonitor heartbeatMonitor, BrokerClient broker, GatewayMetrics metrics) {
        this.registry = registry;
        this.gateway = gateway;
        this.subscriber = subscriber;
        this.heartbeatMonitor = heartbeatMonitor;
        this.broker = broker;
        this.metrics = metrics;
    }

    /** GET /api/v1/gateway/stats */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        RegistrySnapshot snapshot = registry.snapshot();
        BrokerClient.BrokerStats brokerStats = broker.getStats();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("connections", snapshot.connections());
        body.put("tenants", snapshot.tenants());
        body.put("subscriptions", snapshot.subscriptions());
        body.put("subscribed_wells", snapshot.subscribedWells());
        body.put("local_connections", gateway.getLocalConnectionCount());
        body.put("heartbeat_monitor", heartbeatMonitor.isRunning() ? "RUNNING" : "STOPPED");
        body.put("subscriber", Map.of(
                "state", subscriber.getState().name(),
                "reconnect_attempts", subscriber.getReconnectAttempts(),
                "reconnect_exhausted", metrics.isReconnectExhausted()));
        body.put("broker", Map.of(
                "state", broker.getState().name(),
                "published", brokerStats.messagesPublished(),
                "received", brokerStats.messagesReceived(),
                "errors", brokerStats.errors()));
        return ResponseEntity.ok(body);
    }
}
