/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.messaging.core;

import com.wellcast.common.exception.BrokerConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base broker client with connection state tracking, pattern listener
 * bookkeeping, local wildcard dispatch and statistics. Subclasses implement
 * doConnect(), doDisconnect(), doPublish(), doSubscribe() and doUnsubscribe(),
 * call {@link #deliver} for every inbound message and {@link #connectionLost}
 * when the transport fails underneath them.
 */
public abstract class AbstractBrokerClient implements BrokerClient {

    protected final Logger log = LoggerFactory.getLogger(getClass());
    protected final Map<String, Object> config;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final Map<String, MessageListener> patternListeners = new ConcurrentHashMap<>();
    private final List<BrokerStateListener> stateListeners = new CopyOnWriteArrayList<>();
    private final AtomicLong publishedCount = new AtomicLong();
    private final AtomicLong receivedCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();

    protected AbstractBrokerClient(Map<String, Object> config) {
        this.config = config != null ? Map.copyOf(config) : Map.of();
    }

    @Override
    public synchronized void connect() {
        ConnectionState current = state.get();
        if (current == ConnectionState.CLOSING || current == ConnectionState.CLOSED) {
            throw new IllegalStateException("Broker client is closed");
        }
        if (current == ConnectionState.CONNECTED) return;

        transition(ConnectionState.CONNECTING, null);
        try {
            doConnect();
        } catch (RuntimeException e) {
            safeDisconnect();
            transition(ConnectionState.DISCONNECTED, e);
            if (e instanceof BrokerConnectionException bce) throw bce;
            throw new BrokerConnectionException("Broker connect failed: " + e.getMessage(), e);
        }
        transition(ConnectionState.CONNECTED, null);
        log.info("Broker client connected");
    }

    @Override
    public CompletableFuture<Void> publish(String topic, String payload) {
        return publishBatch(topic, List.of(payload));
    }

    @Override
    public CompletableFuture<Void> publishBatch(String topic, List<String> payloads) {
        if (payloads.isEmpty()) return CompletableFuture.completedFuture(null);
        if (!isConnected()) {
            errorCount.incrementAndGet();
            return CompletableFuture.failedFuture(
                    new BrokerConnectionException("Broker not connected; cannot publish to '" + topic + "'"));
        }
        CompletableFuture<Void> sent;
        try {
            sent = doPublish(topic, payloads);
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }
        return sent.handle((ok, ex) -> {
            if (ex == null) {
                publishedCount.addAndGet(payloads.size());
                return null;
            }
            errorCount.incrementAndGet();
            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof BrokerConnectionException bce) throw bce;
            throw new BrokerConnectionException("Publish to '" + topic + "' failed: " + cause.getMessage(), cause);
        });
    }

    @Override
    public void subscribePattern(String pattern, MessageListener listener) {
        if (!isConnected()) {
            throw new BrokerConnectionException("Broker not connected; cannot subscribe to '" + pattern + "'");
        }
        MessageListener previous = patternListeners.put(pattern, listener);
        if (previous == null) {
            try {
                doSubscribe(pattern);
            } catch (RuntimeException e) {
                patternListeners.remove(pattern);
                throw new BrokerConnectionException("Subscribe to '" + pattern + "' failed: " + e.getMessage(), e);
            }
        }
        log.info("Subscribed to pattern: {}", pattern);
    }

    @Override
    public void unsubscribePattern(String pattern) {
        if (patternListeners.remove(pattern) != null && isConnected()) {
            doUnsubscribe(pattern);
        }
        log.info("Unsubscribed from pattern: {}", pattern);
    }

    @Override
    public boolean isConnected() { return state.get() == ConnectionState.CONNECTED; }

    @Override
    public ConnectionState getState() { return state.get(); }

    @Override
    public void addStateListener(BrokerStateListener listener) { stateListeners.add(listener); }

    @Override
    public BrokerStats getStats() {
        return new BrokerStats(publishedCount.get(), receivedCount.get(), errorCount.get(), isConnected());
    }

    @Override
    public synchronized void close() {
        ConnectionState current = state.get();
        if (current == ConnectionState.CLOSING || current == ConnectionState.CLOSED) return;
        transition(ConnectionState.CLOSING, null);
        patternListeners.clear();
        safeDisconnect();
        transition(ConnectionState.CLOSED, null);
        log.info("Broker client closed");
    }

    /** Called by subclasses when a raw message arrives from the broker. */
    protected void deliver(String topic, String payload) {
        receivedCount.incrementAndGet();
        MessageEnvelope envelope = null;
        for (Map.Entry<String, MessageListener> entry : patternListeners.entrySet()) {
            if (!TopicPatterns.matches(entry.getKey(), topic)) continue;
            if (envelope == null) envelope = new MessageEnvelope(topic, payload);
            try {
                entry.getValue().onMessage(envelope);
            } catch (RuntimeException e) {
                errorCount.incrementAndGet();
                log.error("Listener error on topic '{}'", topic, e);
            }
        }
    }

    /**
     * Called by subclasses when the transport fails. Drops all pattern
     * subscriptions and moves to DISCONNECTED exactly once per connection.
     */
    protected void connectionLost(Throwable cause) {
        if (!state.compareAndSet(ConnectionState.CONNECTED, ConnectionState.DISCONNECTED)) return;
        errorCount.incrementAndGet();
        log.warn("Broker connection lost: {}", cause != null ? cause.getMessage() : "unknown");
        patternListeners.clear();
        safeDisconnect();
        notifyListeners(ConnectionState.DISCONNECTED, cause);
    }

    private void transition(ConnectionState next, Throwable cause) {
        state.set(next);
        notifyListeners(next, cause);
    }

    private void notifyListeners(ConnectionState next, Throwable cause) {
        for (BrokerStateListener l : stateListeners) {
            try {
                l.onStateChange(next, cause);
            } catch (RuntimeException e) {
                log.warn("Broker state listener failed", e);
            }
        }
    }

    private void safeDisconnect() {
        try {
            doDisconnect();
        } catch (RuntimeException e) {
            log.warn("Error while disconnecting broker transport", e);
        }
    }

    protected String configString(String key, String defaultValue) {
        Object v = config.get(key);
        return v == null || String.valueOf(v).isBlank() ? defaultValue : String.valueOf(v);
    }

    protected int configInt(String key, int defaultValue) {
        Object v = config.get(key);
        if (v == null) return defaultValue;
        if (v instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric broker setting {}={}", key, v);
            return defaultValue;
        }
    }

    protected abstract void doConnect();
    protected abstract void doDisconnect();
    protected abstract CompletableFuture<Void> doPublish(String topic, List<String> payloads);
    protected abstract void doSubscribe(String pattern);
    protected abstract void doUnsubscribe(String pattern);
}
