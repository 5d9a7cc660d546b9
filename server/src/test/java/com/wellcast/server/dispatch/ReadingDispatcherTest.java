/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.dispatch;

import com.wellcast.server.registry.ConnectionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.wellcast.server.support.TestReadings.reading;
import static org.assertj.core.api.Assertions.assertThat;

class ReadingDispatcherTest {

    private ConnectionRegistry registry;
    private ReadingDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
        dispatcher = new ReadingDispatcher(registry);
        registry.addConnection("t1", "c1");
        registry.addConnection("t1", "c2");
        registry.addConnection("t2", "c3");
        registry.subscribeWell("c1", "w1");
    }

    @Test
    @DisplayName("Well subscribers shadow tenant-wide delivery")
    void wellSubscribersShadowTenant() {
        assertThat(dispatcher.recipientsFor(reading("t1", "w1"))).containsExactly("c1");
    }

    @Test
    @DisplayName("A well nobody subscribed to reaches the whole tenant")
    void unsubscribedWellFallsBackToTenant() {
        assertThat(dispatcher.recipientsFor(reading("t1", "w2"))).containsExactlyInAnyOrder("c1", "c2");
    }

    @Test
    void otherTenantNeverReceives() {
        assertThat(dispatcher.recipientsFor(reading("t1", "w1"))).doesNotContain("c3");
        assertThat(dispatcher.recipientsFor(reading("t1", "w2"))).doesNotContain("c3");
        assertThat(dispatcher.recipientsFor(reading("t2", "w2"))).containsExactly("c3");
    }

    @Test
    void sameWellIdInOtherTenantDoesNotShadow() {
        // t2 has no subscriber to its own w1, so c3 gets it tenant-wide
        assertThat(dispatcher.recipientsFor(reading("t2", "w1"))).containsExactly("c3");
    }

    @Test
    void fallsBackOnceLastSubscriberLeaves() {
        registry.unsubscribeWell("c1", "w1");

        assertThat(dispatcher.recipientsFor(reading("t1", "w1"))).containsExactlyInAnyOrder("c1", "c2");
    }

    @Test
    void unknownTenantHasNoRecipients() {
        assertThat(dispatcher.recipientsFor(reading("t9", "w1"))).isEmpty();
    }
}
