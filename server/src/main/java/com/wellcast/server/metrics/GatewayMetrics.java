/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.TimeGauge;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Micrometer instrumentation for the reading pipeline and the client gateway.
 *
 * <h3>Metric Catalogue</h3>
 * <table>
 *   <tr><th>Metric</th><th>Type</th><th>Tags</th></tr>
 *   <tr><td>wellcast.readings.received</td><td>Counter</td><td>-</td></tr>
 *   <tr><td>wellcast.readings.dropped</td><td>Counter</td><td>reason</td></tr>
 *   <tr><td>wellcast.readings.delivered</td><td>Counter</td><td>-</td></tr>
 *   <tr><td>wellcast.readings.published</td><td>Counter</td><td>outcome</td></tr>
 *   <tr><td>wellcast.fanout.duration</td><td>Timer</td><td>-</td></tr>
 *   <tr><td>wellcast.socket.write.errors</td><td>Counter</td><td>-</td></tr>
 *   <tr><td>wellcast.auth.failures</td><td>Counter</td><td>reason</td></tr>
 *   <tr><td>wellcast.connections.opened</td><td>Counter</td><td>-</td></tr>
 *   <tr><td>wellcast.connections.closed</td><td>Counter</td><td>reason</td></tr>
 *   <tr><td>wellcast.connections.active</td><td>Gauge</td><td>-</td></tr>
 *   <tr><td>wellcast.subscriptions.active</td><td>Gauge</td><td>-</td></tr>
 *   <tr><td>wellcast.subscriber.reconnects</td><td>Counter</td><td>outcome</td></tr>
 *   <tr><td>wellcast.subscriber.reconnect.exhausted</td><td>Gauge</td><td>-</td></tr>
 *   <tr><td>wellcast.uptime.seconds</td><td>TimeGauge</td><td>-</td></tr>
 * </table>
 */
public class GatewayMetrics {

    private static final Logger log = LoggerFactory.getLogger(GatewayMetrics.class);

    public static final String DROP_DECODE = "decode";
    public static final String DROP_VALIDATION = "validation";
    public static final String DROP_TENANT_MISMATCH = "tenant_mismatch";
    public static final String DROP_TOPIC = "topic";

    private final MeterRegistry registry;
    private final Instant startupTime;

    private final AtomicInteger reconnectExhausted = new AtomicInteger(0);

    private final Counter readingsReceived;
    private final Counter readingsDelivered;
    private final Counter socketWriteErrors;
    private final Counter connectionsOpened;
    private final Timer fanoutTimer;

    // Tagged counters, cached for the hot paths
    private final Map<String, Counter> dropCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> authFailureCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> closeCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> publishCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> reconnectCounters = new ConcurrentHashMap<>();

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.startupTime = Instant.now();

        readingsReceived = Counter.builder("wellcast.readings.received")
                .description("Readings received from the broker")
                .register(registry);
        readingsDelivered = Counter.builder("wellcast.readings.delivered")
                .description("Reading frames handed to client sockets")
                .register(registry);
        socketWriteErrors = Counter.builder("wellcast.socket.write.errors")
                .description("Failed writes to client sockets")
                .register(registry);
        connectionsOpened = Counter.builder("wellcast.connections.opened")
                .description("Client connections accepted")
                .register(registry);
        fanoutTimer = Timer.builder("wellcast.fanout.duration")
                .description("Time to route one reading to its recipients")
                .register(registry);

        Gauge.builder("wellcast.subscriber.reconnect.exhausted", reconnectExhausted, AtomicInteger::get)
                .description("1 when the broker subscriber gave up reconnecting")
                .register(registry);

        TimeGauge.builder("wellcast.uptime.seconds", this, TimeUnit.SECONDS,
                        m -> Duration.between(startupTime, Instant.now()).toSeconds())
                .description("WellCast uptime in seconds")
                .register(registry);

        log.info("GatewayMetrics initialized");
    }

    /** Register live gauges over the connection registry. */
    public void bindRegistryGauges(Supplier<Number> connections, Supplier<Number> subscriptions) {
        Gauge.builder("wellcast.connections.active", connections)
                .description("Connections currently registered")
                .register(registry);
        Gauge.builder("wellcast.subscriptions.active", subscriptions)
                .description("Well subscriptions currently registered")
                .register(registry);
    }

    // ─── Subscriber ────────────────────────────────────────────────────────

    public void readingReceived() { readingsReceived.increment(); }

    public void readingDropped(String reason) {
        dropCounters.computeIfAbsent(reason, r ->
                Counter.builder("wellcast.readings.dropped")
                        .description("Readings discarded before dispatch")
                        .tag("reason", r)
                        .register(registry)
        ).increment();
    }

    public void reconnectAttempt(boolean success) {
        String outcome = success ? "success" : "failure";
        reconnectCounters.computeIfAbsent(outcome, o ->
                Counter.builder("wellcast.subscriber.reconnects")
                        .description("Broker reconnect attempts by the subscriber")
                        .tag("outcome", o)
                        .register(registry)
        ).increment();
    }

    public void setReconnectExhausted(boolean exhausted) { reconnectExhausted.set(exhausted ? 1 : 0); }

    public boolean isReconnectExhausted() { return reconnectExhausted.get() == 1; }

    // ─── Publisher ─────────────────────────────────────────────────────────

    public void readingsPublished(int count) { publishCounter("published").increment(count); }

    public void readingsRejected(int count) { publishCounter("rejected").increment(count); }

    private Counter publishCounter(String outcome) {
        return publishCounters.computeIfAbsent(outcome, o ->
                Counter.builder("wellcast.readings.published")
                        .description("Readings offered for publishing")
                        .tag("outcome", o)
                        .register(registry));
    }

    // ─── Gateway ───────────────────────────────────────────────────────────

    public void connectionOpened() { connectionsOpened.increment(); }

    public void connectionClosed(String reason) {
        closeCounters.computeIfAbsent(reason, r ->
                Counter.builder("wellcast.connections.closed")
                        .description("Client connections closed")
                        .tag("reason", r)
                        .register(registry)
        ).increment();
    }

    public void authFailure(String reason) {
        authFailureCounters.computeIfAbsent(reason, r ->
                Counter.builder("wellcast.auth.failures")
                        .description("Rejected client handshakes")
                        .tag("reason", r)
                        .register(registry)
        ).increment();
    }

    public void readingDelivered() { readingsDelivered.increment(); }

    public void socketWriteFailed() { socketWriteErrors.increment(); }

    public void recordFanout(long nanos) { fanoutTimer.record(nanos, TimeUnit.NANOSECONDS); }

    public MeterRegistry getRegistry() { return registry; }
}
