/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Routing index of the locally connected clients: which connections belong to a
 * tenant, and which connections subscribed to a given well of that tenant.
 *
 * <p>Holds connection identifiers only; sockets stay with the gateway. Well keys
 * are scoped by tenant, so tenants that happen to share a well id never see each
 * other's subscribers.</p>
 *
 * <p>Thread-safe. Both indexes are updated with {@code ConcurrentHashMap.compute},
 * and every mutation touching one connection runs under that connection's
 * membership monitor, so add, subscribe and remove for the same connection are
 * linearizable. Queries return immutable snapshots.</p>
 */
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, Set<String>> tenantIndex = new ConcurrentHashMap<>();
    private final Map<WellKey, Set<String>> wellIndex = new ConcurrentHashMap<>();
    private final Map<String, Membership> memberships = new ConcurrentHashMap<>();

    private final AtomicInteger connectionCount = new AtomicInteger();
    private final AtomicInteger subscriptionCount = new AtomicInteger();

    private record WellKey(String tenantId, String wellId) {}

    /** Per-connection record; wells and live are guarded by the instance monitor. */
    private static final class Membership {
        private final String tenantId;
        private final Set<String> wells = new HashSet<>();
        private boolean live = true;

        private Membership(String tenantId) {
            this.tenantId = tenantId;
        }
    }

    /**
     * Register a connection under its tenant.
     *
     * @return false if the connection is already registered under the same tenant
     * @throws IllegalStateException if it is registered under a different tenant
     */
    public boolean addConnection(String tenantId, String connectionId) {
        requireText(tenantId, "tenantId");
        requireText(connectionId, "connectionId");
        Membership membership = new Membership(tenantId);
        while (true) {
            Membership existing = memberships.putIfAbsent(connectionId, membership);
            if (existing == null) break;
            synchronized (existing) {
                if (existing.live) {
                    if (!existing.tenantId.equals(tenantId)) {
                        throw new IllegalStateException("Connection " + connectionId
                                + " is already registered for another tenant");
                    }
                    return false;
                }
            }
            // leftover of a removal still in progress
            memberships.remove(connectionId, existing);
        }
        synchronized (membership) {
            // removed before it was indexed
            if (!membership.live) return false;
            addTo(tenantIndex, tenantId, connectionId);
            connectionCount.incrementAndGet();
        }
        log.debug("Registered connection {} for tenant {}", connectionId, tenantId);
        return true;
    }

    /**
     * Remove a connection and every well subscription it holds. Idempotent.
     *
     * @return true if this call removed it
     */
    public boolean removeConnection(String connectionId) {
        if (connectionId == null) return false;
        Membership membership = memberships.get(connectionId);
        if (membership == null) return false;
        int purged;
        synchronized (membership) {
            if (!membership.live) return false;
            membership.live = false;
            for (String wellId : membership.wells) {
                removeFrom(wellIndex, new WellKey(membership.tenantId, wellId), connectionId);
            }
            purged = membership.wells.size();
            membership.wells.clear();
            subscriptionCount.addAndGet(-purged);
            // only counted once addConnection indexed it
            if (removeFrom(tenantIndex, membership.tenantId, connectionId)) {
                connectionCount.decrementAndGet();
            }
        }
        memberships.remove(connectionId, membership);
        log.debug("Removed connection {} ({} well subscriptions purged)", connectionId, purged);
        return true;
    }

    /**
     * Subscribe a registered connection to one well of its own tenant.
     *
     * @return true if the subscription was added, false if it already existed
     *         or the connection is not registered
     */
    public boolean subscribeWell(String connectionId, String wellId) {
        requireText(wellId, "wellId");
        Membership membership = memberships.get(connectionId);
        if (membership == null) return false;
        synchronized (membership) {
            if (!membership.live || !membership.wells.add(wellId)) return false;
            addTo(wellIndex, new WellKey(membership.tenantId, wellId), connectionId);
            subscriptionCount.incrementAndGet();
        }
        return true;
    }

    /**
     * @return true if the subscription existed and was removed
     */
    public boolean unsubscribeWell(String connectionId, String wellId) {
        if (wellId == null) return false;
        Membership membership = memberships.get(connectionId);
        if (membership == null) return false;
        synchronized (membership) {
            if (!membership.live || !membership.wells.remove(wellId)) return false;
            removeFrom(wellIndex, new WellKey(membership.tenantId, wellId), connectionId);
            subscriptionCount.decrementAndGet();
        }
        return true;
    }

    public Set<String> tenantConnections(String tenantId) {
        return snapshotOf(tenantIndex.get(tenantId));
    }

    public Set<String> wellSubscribers(String tenantId, String wellId) {
        if (tenantId == null || wellId == null) return Set.of();
        return snapshotOf(wellIndex.get(new WellKey(tenantId, wellId)));
    }

    public Set<String> wellsOf(String connectionId) {
        Membership membership = memberships.get(connectionId);
        if (membership == null) return Set.of();
        synchronized (membership) {
            return membership.live ? Set.copyOf(membership.wells) : Set.of();
        }
    }

    public Optional<String> tenantOf(String connectionId) {
        Membership membership = memberships.get(connectionId);
        if (membership == null) return Optional.empty();
        synchronized (membership) {
            return membership.live ? Optional.of(membership.tenantId) : Optional.empty();
        }
    }

    public boolean isRegistered(String connectionId) {
        return tenantOf(connectionId).isPresent();
    }

    public int connectionCount() { return connectionCount.get(); }

    public int subscriptionCount() { return subscriptionCount.get(); }

    public int tenantCount() { return tenantIndex.size(); }

    public RegistrySnapshot snapshot() {
        return new RegistrySnapshot(connectionCount.get(), tenantIndex.size(),
                subscriptionCount.get(), wellIndex.size());
    }

    /** Remove every connection, e.g. on gateway shutdown. */
    public void clear() {
        for (String connectionId : Set.copyOf(memberships.keySet())) {
            removeConnection(connectionId);
        }
    }

    private static <K> void addTo(Map<K, Set<String>> index, K key, String connectionId) {
        index.compute(key, (k, ids) -> {
            Set<String> set = ids != null ? ids : ConcurrentHashMap.newKeySet();
            set.add(connectionId);
            return set;
        });
    }

    private static <K> boolean removeFrom(Map<K, Set<String>> index, K key, String connectionId) {
        boolean[] removed = new boolean[1];
        index.computeIfPresent(key, (k, ids) -> {
            removed[0] = ids.remove(connectionId);
            return ids.isEmpty() ? null : ids;
        });
        return removed[0];
    }

    private static Set<String> snapshotOf(Set<String> ids) {
        return ids == null ? Set.of() : Set.copyOf(ids);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
