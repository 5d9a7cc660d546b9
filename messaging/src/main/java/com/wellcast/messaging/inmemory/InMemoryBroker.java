/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.messaging.inmemory;

import com.wellcast.common.exception.BrokerConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * In-process pub/sub hub shared by any number of {@link InMemoryBrokerClient}s.
 * Every message is offered to every connected client, which matches it against
 * its own pattern subscriptions. Delivery runs on a single dispatch thread by
 * default, so each client sees one publisher's messages in publish order.
 *
 * <p>{@link #setAvailable(boolean)} simulates a broker outage: clients are
 * disconnected and further connects and publishes fail until it is restored.</p>
 */
public class InMemoryBroker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBroker.class);

    private final Set<InMemoryBrokerClient> clients = ConcurrentHashMap.newKeySet();
    private final Executor deliveryExecutor;
    private final ExecutorService ownedExecutor;
    private volatile boolean available = true;

    public InMemoryBroker() {
        this.ownedExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "inmemory-broker-dispatch");
            t.setDaemon(true);
            return t;
        });
        this.deliveryExecutor = ownedExecutor;
    }

    /** Uses the given executor for delivery, e.g. a direct executor in tests. */
    public InMemoryBroker(Executor deliveryExecutor) {
        this.deliveryExecutor = deliveryExecutor;
        this.ownedExecutor = null;
    }

    void register(InMemoryBrokerClient client) {
        if (!available) throw new BrokerConnectionException("In-memory broker is unavailable");
        clients.add(client);
    }

    void unregister(InMemoryBrokerClient client) {
        clients.remove(client);
    }

    void publish(String topic, List<String> payloads) {
        if (!available) throw new BrokerConnectionException("In-memory broker is unavailable");
        for (InMemoryBrokerClient client : clients) {
            for (String payload : payloads) {
                deliveryExecutor.execute(() -> client.receive(topic, payload));
            }
        }
    }

    public boolean isAvailable() { return available; }

    public void setAvailable(boolean available) {
        this.available = available;
        if (!available) {
            log.warn("In-memory broker going down; disconnecting {} clients", clients.size());
            for (InMemoryBrokerClient client : Set.copyOf(clients)) {
                client.brokerWentDown();
            }
        } else {
            log.info("In-memory broker available again");
        }
    }

    boolean isDispatchShutdown() {
        return ownedExecutor != null && ownedExecutor.isShutdown();
    }

    @Override
    public void close() {
        clients.clear();
        if (ownedExecutor != null) ownedExecutor.shutdownNow();
    }
}
