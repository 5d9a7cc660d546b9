/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives {@link GatewayService#checkHeartbeats()} at the configured interval on
 * a single daemon thread.
 */
public class HeartbeatMonitor {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final GatewayService gateway;
    private final long intervalMs;
    private ScheduledExecutorService scheduler;

    public HeartbeatMonitor(GatewayService gateway) {
        this.gateway = gateway;
        this.intervalMs = gateway.getSettings().getHeartbeatInterval().toMillis();
    }

    public synchronized void start() {
        if (scheduler != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gateway-heartbeat");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Heartbeat monitor started (interval={}ms, maxMissed={})",
                intervalMs, gateway.getSettings().getMaxMissedHeartbeats());
    }

    public synchronized void stop() {
        if (scheduler == null) return;
        scheduler.shutdownNow();
        scheduler = null;
        log.info("Heartbeat monitor stopped");
    }

    public synchronized boolean isRunning() { return scheduler != null; }

    private void tick() {
        try {
            gateway.checkHeartbeats();
        } catch (RuntimeException e) {
            // an escaping exception would cancel the schedule
            log.error("Heartbeat check failed", e);
        }
    }
}
