/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.messaging.inmemory;

import com.wellcast.common.exception.BrokerConnectionException;
import com.wellcast.messaging.core.AbstractBrokerClient;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * BrokerClient over an {@link InMemoryBroker}. Used for single-node deployments
 * and tests; wildcard matching happens locally in {@link AbstractBrokerClient}.
 */
public class InMemoryBrokerClient extends AbstractBrokerClient {

    private final InMemoryBroker broker;
    private final boolean ownsBroker;

    /** Client on a shared hub; the caller closes the hub. */
    public InMemoryBrokerClient(InMemoryBroker broker) {
        this(broker, false);
    }

    private InMemoryBrokerClient(InMemoryBroker broker, boolean ownsBroker) {
        super(Map.of());
        this.broker = broker;
        this.ownsBroker = ownsBroker;
    }

    /** Client with a private hub that is closed together with the client. */
    public static InMemoryBrokerClient standalone() {
        return new InMemoryBrokerClient(new InMemoryBroker(), true);
    }

    @Override
    public synchronized void close() {
        super.close();
        if (ownsBroker) broker.close();
    }

    @Override
    protected void doConnect() {
        broker.register(this);
    }

    @Override
    protected void doDisconnect() {
        broker.unregister(this);
    }

    @Override
    protected CompletableFuture<Void> doPublish(String topic, List<String> payloads) {
        try {
            broker.publish(topic, payloads);
            return CompletableFuture.completedFuture(null);
        } catch (BrokerConnectionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    protected void doSubscribe(String pattern) {
        // matching is local
    }

    @Override
    protected void doUnsubscribe(String pattern) {
        // matching is local
    }

    void receive(String topic, String payload) {
        if (isConnected()) deliver(topic, payload);
    }

    InMemoryBroker broker() { return broker; }

    void brokerWentDown() {
        connectionLost(new BrokerConnectionException("In-memory broker unavailable"));
    }
}
