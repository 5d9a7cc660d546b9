/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.subscriber;

import com.wellcast.common.exception.BrokerConnectionException;
import com.wellcast.common.exception.TenantMismatchException;
import com.wellcast.common.exception.ValidationException;
import com.wellcast.common.model.Reading;
import com.wellcast.common.topic.ReadingTopics;
import com.wellcast.common.util.ExponentialBackoff;
import com.wellcast.common.util.JsonUtil;
import com.wellcast.common.validation.ReadingValidator;
import com.wellcast.messaging.core.BrokerClient;
import com.wellcast.messaging.core.ConnectionState;
import com.wellcast.messaging.core.MessageEnvelope;
import com.wellcast.server.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Holds the gateway's single wildcard subscription to every tenant topic and
 * turns broker messages into checked readings for the {@link ReadingSink}.
 *
 * <p>Each message is decoded, validated and compared against the tenant of the
 * topic it arrived on; a payload claiming another tenant is a forgery and is
 * discarded with a security warning. When the broker connection drops the
 * subscriber reconnects with exponential backoff and re-issues the pattern
 * subscription. Readings published during the gap are lost.</p>
 */
public class ReadingSubscriber {

    private static final Logger log = LoggerFactory.getLogger(ReadingSubscriber.class);

    private final BrokerClient broker;
    private final ReadingValidator validator;
    private final ReadingSink sink;
    private final ExponentialBackoff backoff;
    private final GatewayMetrics metrics;

    private final Object lock = new Object();
    private volatile SubscriberState state = SubscriberState.STOPPED;
    private boolean running;              // guarded by lock
    private int attempts;                 // guarded by lock
    private ScheduledFuture<?> pending;   // guarded by lock
    private ScheduledExecutorService reconnectExecutor;
    private boolean listenerAdded;

    public ReadingSubscriber(BrokerClient broker, ReadingValidator validator, ReadingSink sink,
                             SubscriberSettings settings, GatewayMetrics metrics) {
        this.broker = broker;
        this.validator = validator;
        this.sink = sink;
        this.backoff = settings.getBackoff();
        this.metrics = metrics;
    }

    /**
     * Subscribe to {@value ReadingTopics#ALL_TENANTS_PATTERN}. If the broker is not
     * reachable yet the first attempt is retried in the background.
     */
    public void start() {
        synchronized (lock) {
            if (running) return;
            running = true;
            attempts = 0;
            metrics.setReconnectExhausted(false);
            reconnectExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "reading-subscriber-reconnect");
                t.setDaemon(true);
                return t;
            });
            if (!listenerAdded) {
                broker.addStateListener(this::onBrokerState);
                listenerAdded = true;
            }
        }
        try {
            connectAndSubscribe();
            log.info("Reading subscriber started on {}", ReadingTopics.ALL_TENANTS_PATTERN);
        } catch (BrokerConnectionException e) {
            log.warn("Broker unavailable at startup: {}", e.getMessage());
            scheduleReconnect();
        }
    }

    public void stop() {
        synchronized (lock) {
            if (!running) return;
            running = false;
            if (pending != null) pending.cancel(false);
            pending = null;
            reconnectExecutor.shutdownNow();
            state = SubscriberState.STOPPED;
        }
        if (broker.isConnected()) {
            broker.unsubscribePattern(ReadingTopics.ALL_TENANTS_PATTERN);
        }
        log.info("Reading subscriber stopped");
    }

    public SubscriberState getState() { return state; }

    public int getReconnectAttempts() {
        synchronized (lock) {
            return attempts;
        }
    }

    private void connectAndSubscribe() {
        broker.connect();
        broker.subscribePattern(ReadingTopics.ALL_TENANTS_PATTERN, this::onMessage);
        boolean stillRunning;
        synchronized (lock) {
            stillRunning = running;
            if (running) {
                attempts = 0;
                state = SubscriberState.SUBSCRIBED;
            }
        }
        if (!stillRunning) {
            broker.unsubscribePattern(ReadingTopics.ALL_TENANTS_PATTERN);
        }
    }

    private void onBrokerState(ConnectionState brokerState, Throwable cause) {
        if (brokerState != ConnectionState.DISCONNECTED || state != SubscriberState.SUBSCRIBED) return;
        log.warn("Broker connection lost: {}", cause != null ? cause.getMessage() : "unknown cause");
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        synchronized (lock) {
            if (!running || (pending != null && !pending.isDone())) return;
            if (backoff.isExhausted(attempts)) {
                state = SubscriberState.FAILED;
                metrics.setReconnectExhausted(true);
                log.error("ALARM: broker reconnect abandoned after {} attempts; gateway receives no readings",
                        attempts);
                return;
            }
            attempts++;
            Duration delay = backoff.delayFor(attempts);
            state = SubscriberState.RECONNECTING;
            log.info("Reconnecting to broker in {} ms (attempt {})", delay.toMillis(), attempts);
            pending = reconnectExecutor.schedule(this::attemptReconnect, delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void attemptReconnect() {
        int attempt;
        synchronized (lock) {
            pending = null;
            attempt = attempts;
        }
        try {
            connectAndSubscribe();
            metrics.reconnectAttempt(true);
            log.info("Broker subscription restored after {} attempt(s)", attempt);
        } catch (BrokerConnectionException e) {
            metrics.reconnectAttempt(false);
            log.warn("Broker reconnect attempt {} failed: {}", attempt, e.getMessage());
            scheduleReconnect();
        } catch (IllegalStateException e) {
            log.error("Broker client closed; reconnect loop stopped", e);
            synchronized (lock) {
                running = false;
                state = SubscriberState.FAILED;
            }
            metrics.setReconnectExhausted(true);
        }
    }

    void onMessage(MessageEnvelope envelope) {
        metrics.readingReceived();
        Optional<String> topicTenant = ReadingTopics.tenantOf(envelope.getTopic());
        if (topicTenant.isEmpty()) {
            log.warn("Dropped message on unexpected topic '{}'", envelope.getTopic());
            metrics.readingDropped(GatewayMetrics.DROP_TOPIC);
            return;
        }

        Reading reading;
        try {
            Map<String, Object> raw = JsonUtil.toMap(envelope.getPayload());
            reading = validator.validate(raw);
        } catch (ValidationException e) {
            log.warn("Dropped invalid reading on {}: {}", envelope.getTopic(), e.getMessage());
            metrics.readingDropped(GatewayMetrics.DROP_VALIDATION);
            return;
        } catch (IllegalArgumentException e) {
            log.warn("Dropped undecodable payload on {}: {}", envelope.getTopic(), e.getMessage());
            metrics.readingDropped(GatewayMetrics.DROP_DECODE);
            return;
        }

        if (!reading.tenantId().equals(topicTenant.get())) {
            TenantMismatchException mismatch =
                    new TenantMismatchException(envelope.getTopic(), topicTenant.get(), reading.tenantId());
            log.warn("SECURITY: {} (well={}, source={})", mismatch.getMessage(),
                    reading.wellId(), reading.sourceConnectionId());
            metrics.readingDropped(GatewayMetrics.DROP_TENANT_MISMATCH);
            return;
        }

        try {
            sink.onReading(reading);
        } catch (RuntimeException e) {
            log.error("Dispatch of reading for tenant {} failed", reading.tenantId(), e);
        }
    }
}
