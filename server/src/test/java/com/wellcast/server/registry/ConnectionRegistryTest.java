/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.registry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionRegistryTest {

    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
    }

    @Nested
    class Connections {

        @Test
        void addIndexesConnectionUnderTenant() {
            assertThat(registry.addConnection("t1", "c1")).isTrue();
            assertThat(registry.addConnection("t1", "c2")).isTrue();

            assertThat(registry.tenantConnections("t1")).containsExactlyInAnyOrder("c1", "c2");
            assertThat(registry.tenantOf("c1")).contains("t1");
            assertThat(registry.connectionCount()).isEqualTo(2);
            assertThat(registry.tenantCount()).isEqualTo(1);
        }

        @Test
        void addingTwiceIsNoOp() {
            registry.addConnection("t1", "c1");

            assertThat(registry.addConnection("t1", "c1")).isFalse();
            assertThat(registry.connectionCount()).isEqualTo(1);
        }

        @Test
        void connectionCannotMoveToAnotherTenant() {
            registry.addConnection("t1", "c1");

            assertThatThrownBy(() -> registry.addConnection("t2", "c1"))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(registry.tenantConnections("t2")).isEmpty();
        }

        @Test
        void rejectsBlankIds() {
            assertThatThrownBy(() -> registry.addConnection(" ", "c1")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> registry.addConnection("t1", null)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Removing twice has the same effect as removing once")
        void removalIsIdempotent() {
            registry.addConnection("t1", "c1");
            registry.addConnection("t1", "c2");
            registry.subscribeWell("c1", "w1");
            registry.subscribeWell("c1", "w2");

            assertThat(registry.removeConnection("c1")).isTrue();
            RegistrySnapshot afterFirst = registry.snapshot();
            assertThat(registry.removeConnection("c1")).isFalse();

            assertThat(registry.snapshot()).isEqualTo(afterFirst);
            assertThat(afterFirst.connections()).isEqualTo(1);
            assertThat(afterFirst.subscriptions()).isZero();
            assertThat(registry.wellSubscribers("t1", "w1")).isEmpty();
            assertThat(registry.tenantConnections("t1")).containsExactly("c2");
        }

        @Test
        void removingUnknownConnectionIsHarmless() {
            assertThat(registry.removeConnection("nope")).isFalse();
            assertThat(registry.removeConnection(null)).isFalse();
            assertThat(registry.connectionCount()).isZero();
        }

        @Test
        void lastConnectionOfTenantDropsTheTenant() {
            registry.addConnection("t1", "c1");
            registry.removeConnection("c1");

            assertThat(registry.tenantCount()).isZero();
            assertThat(registry.tenantConnections("t1")).isEmpty();
        }

        @Test
        void idCanBeReusedAfterRemoval() {
            registry.addConnection("t1", "c1");
            registry.removeConnection("c1");

            assertThat(registry.addConnection("t2", "c1")).isTrue();
            assertThat(registry.tenantOf("c1")).contains("t2");
        }

        @Test
        void clearRemovesEverything() {
            registry.addConnection("t1", "c1");
            registry.addConnection("t2", "c2");
            registry.subscribeWell("c2", "w1");

            registry.clear();

            assertThat(registry.snapshot()).isEqualTo(new RegistrySnapshot(0, 0, 0, 0));
        }
    }

    @Nested
    class Wells {

        @BeforeEach
        void connect() {
            registry.addConnection("t1", "c1");
            registry.addConnection("t2", "c3");
        }

        @Test
        void subscribeAndUnsubscribe() {
            assertThat(registry.subscribeWell("c1", "w1")).isTrue();
            assertThat(registry.subscribeWell("c1", "w1")).isFalse();
            assertThat(registry.wellSubscribers("t1", "w1")).containsExactly("c1");
            assertThat(registry.wellsOf("c1")).containsExactly("w1");
            assertThat(registry.subscriptionCount()).isEqualTo(1);

            assertThat(registry.unsubscribeWell("c1", "w1")).isTrue();
            assertThat(registry.unsubscribeWell("c1", "w1")).isFalse();
            assertThat(registry.wellSubscribers("t1", "w1")).isEmpty();
            assertThat(registry.subscriptionCount()).isZero();
        }

        @Test
        @DisplayName("The same well id in two tenants are different wells")
        void wellKeysAreTenantScoped() {
            registry.subscribeWell("c1", "w1");
            registry.subscribeWell("c3", "w1");

            assertThat(registry.wellSubscribers("t1", "w1")).containsExactly("c1");
            assertThat(registry.wellSubscribers("t2", "w1")).containsExactly("c3");
            assertThat(registry.snapshot().subscribedWells()).isEqualTo(2);
        }

        @Test
        void unknownConnectionCannotSubscribe() {
            assertThat(registry.subscribeWell("ghost", "w1")).isFalse();
            assertThat(registry.wellSubscribers("t1", "w1")).isEmpty();
            assertThat(registry.subscriptionCount()).isZero();
        }

        @Test
        void returnedSetsAreSnapshots() {
            registry.subscribeWell("c1", "w1");
            var before = registry.wellSubscribers("t1", "w1");

            registry.removeConnection("c1");

            assertThat(before).containsExactly("c1");
            assertThatThrownBy(() -> before.add("x")).isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Test
    @DisplayName("Concurrent churn leaves no stale membership and no negative counters")
    void concurrentChurnLeavesConsistentState() throws Exception {
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int worker = t;
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < perThread; i++) {
                        String id = "c-" + worker + "-" + i;
                        String tenant = "t" + (i % 3);
                        registry.addConnection(tenant, id);
                        registry.subscribeWell(id, "w" + (i % 5));
                        registry.subscribeWell(id, "w" + ((i + 1) % 5));
                        registry.unsubscribeWell(id, "w" + (i % 5));
                        registry.removeConnection(id);
                        registry.removeConnection(id);
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(registry.snapshot()).isEqualTo(new RegistrySnapshot(0, 0, 0, 0));
    }

    @Test
    void concurrentSubscribeAndRemoveOfSameConnection() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 200; round++) {
                String id = "c" + round;
                registry.addConnection("t1", id);
                CountDownLatch go = new CountDownLatch(1);
                Future<?> subscriber = pool.submit(() -> {
                    go.await();
                    for (int w = 0; w < 20; w++) registry.subscribeWell(id, "w" + w);
                    return null;
                });
                Future<?> remover = pool.submit(() -> {
                    go.await();
                    registry.removeConnection(id);
                    return null;
                });
                go.countDown();
                subscriber.get(10, TimeUnit.SECONDS);
                remover.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(registry.snapshot()).isEqualTo(new RegistrySnapshot(0, 0, 0, 0));
    }

    @Test
    @DisplayName("Removal racing registration of the same id never drives the count negative")
    void removalRacingRegistrationKeepsCountInStep() throws Exception {
        AtomicReference<String> current = new AtomicReference<>();
        AtomicBoolean done = new AtomicBoolean();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> remover = pool.submit(() -> {
                while (!done.get()) {
                    String id = current.get();
                    if (id != null) registry.removeConnection(id);
                }
                return null;
            });
            Future<?> adder = pool.submit(() -> {
                for (int n = 0; n < 20_000; n++) {
                    String id = "c" + n;
                    current.set(id);
                    registry.addConnection("t1", id);
                    assertThat(registry.connectionCount()).isGreaterThanOrEqualTo(0);
                }
                done.set(true);
                return null;
            });
            adder.get(30, TimeUnit.SECONDS);
            remover.get(30, TimeUnit.SECONDS);
        } finally {
            done.set(true);
            pool.shutdownNow();
        }

        assertThat(registry.connectionCount()).isGreaterThanOrEqualTo(0);
        assertThat(registry.connectionCount()).isEqualTo(registry.tenantConnections("t1").size());

        registry.clear();
        assertThat(registry.snapshot()).isEqualTo(new RegistrySnapshot(0, 0, 0, 0));
    }
}
