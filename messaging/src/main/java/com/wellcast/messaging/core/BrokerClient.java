/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.messaging.core;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Capability interface over a topic-based publish/subscribe transport with
 * wildcard subscriptions. Implementations exist for an in-process broker,
 * ActiveMQ and Kafka.
 *
 * <p>No ordering is guaranteed between messages from different publishers.
 * Futures returned by the publish methods fail with
 * {@link com.wellcast.common.exception.BrokerConnectionException} when the
 * transport is unavailable; nothing is retried or buffered here.</p>
 */
public interface BrokerClient extends AutoCloseable {

    /**
     * Open (or re-open) the transport connection.
     *
     * @throws com.wellcast.common.exception.BrokerConnectionException if the broker cannot be reached
     */
    void connect();

    /** Publish one payload to a topic. Completes when the transport accepted it. */
    CompletableFuture<Void> publish(String topic, String payload);

    /**
     * Publish several payloads to one topic in a single transport call where the
     * transport supports it. The future fails as a whole if any payload was not accepted.
     */
    CompletableFuture<Void> publishBatch(String topic, List<String> payloads);

    /**
     * Subscribe to every topic matching a {@code *} wildcard pattern. Subscribing the
     * same pattern again replaces its listener. Subscriptions do not survive a
     * connection loss; callers re-issue them after reconnecting.
     */
    void subscribePattern(String pattern, MessageListener listener);

    void unsubscribePattern(String pattern);

    boolean isConnected();

    ConnectionState getState();

    void addStateListener(BrokerStateListener listener);

    BrokerStats getStats();

    @Override
    void close();

    record BrokerStats(long messagesPublished, long messagesReceived, long errors, boolean connected) {}
}
