/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.gateway;

import com.wellcast.common.exception.AuthenticationException;
import com.wellcast.common.protocol.FrameTypes;
import com.wellcast.common.protocol.WireFrame;
import com.wellcast.server.auth.AuthenticatedPrincipal;
import com.wellcast.server.auth.TokenVerifier;
import com.wellcast.server.dispatch.ReadingDispatcher;
import com.wellcast.server.metrics.GatewayMetrics;
import com.wellcast.server.registry.ConnectionRegistry;
import com.wellcast.server.registry.RegistrySnapshot;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static com.wellcast.server.support.TestReadings.reading;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class GatewayServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:05Z");

    private ConnectionRegistry registry;
    private SimpleMeterRegistry meters;
    private GatewayService gateway;

    /** Tokens are "tenant:user"; "bad" is rejected, "slow" never completes. */
    private final TokenVerifier verifier = token -> {
        if (token.equals("slow")) return new CompletableFuture<>();
        if (token.equals("bad")) {
            return CompletableFuture.failedFuture(new AuthenticationException("Invalid token: signature"));
        }
        String[] parts = token.split(":");
        return CompletableFuture.completedFuture(new AuthenticatedPrincipal(parts[0], parts[1], "viewer"));
    };

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
        meters = new SimpleMeterRegistry();
        GatewaySettings settings = new GatewaySettings(Duration.ofMillis(100), Duration.ofSeconds(30), 3,
                Duration.ofSeconds(1), 64 * 1024);
        gateway = new GatewayService(registry, new ReadingDispatcher(registry), verifier, settings,
                new GatewayMetrics(meters), Runnable::run, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private ClientConnection connect(RecordingChannel channel, String token) {
        ClientConnection connection = gateway.open(channel, token);
        assertThat(connection.getState()).isEqualTo(SessionState.ACTIVE);
        return connection;
    }

    private static String subscribe(String wellId) {
        return WireFrame.of(FrameTypes.SUBSCRIBE_WELL, Map.of("well_id", wellId)).toJson();
    }

    @Nested
    class Handshake {

        @Test
        void validTokenActivatesAndAcknowledges() {
            RecordingChannel channel = new RecordingChannel();

            ClientConnection connection = connect(channel, "t1:alice");

            assertThat(connection.getTenantId()).isEqualTo("t1");
            assertThat(connection.getUserId()).isEqualTo("alice");
            assertThat(registry.tenantConnections("t1")).containsExactly(connection.getConnectionId());
            WireFrame ack = channel.last();
            assertThat(ack.type()).isEqualTo(FrameTypes.CONNECTED);
            assertThat(ack.text("tenant_id")).isEqualTo("t1");
            assertThat(ack.text("timestamp")).isEqualTo(NOW.toString());
        }

        @Test
        @DisplayName("A rejected token gets one AUTH_FAILED frame, then the socket is closed")
        void rejectedTokenClosesWithAuthFailed() {
            RecordingChannel channel = new RecordingChannel();

            ClientConnection connection = gateway.open(channel, "bad");

            assertThat(channel.frames()).singleElement().satisfies(f -> {
                assertThat(f.type()).isEqualTo(FrameTypes.ERROR);
                assertThat(f.text("code")).isEqualTo(FrameTypes.AUTH_FAILED);
            });
            assertThat(channel.closedWith).isEqualTo(CloseReason.AUTH_FAILED);
            assertThat(connection.getState()).isEqualTo(SessionState.CLOSED);
            assertThat(registry.connectionCount()).isZero();
            assertThat(gateway.getLocalConnectionCount()).isZero();
            assertThat(meters.get("wellcast.auth.failures").tag("reason", "invalid").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        void missingTokenIsRejected() {
            RecordingChannel channel = new RecordingChannel();

            gateway.open(channel, null);

            assertThat(channel.last().text("code")).isEqualTo(FrameTypes.AUTH_FAILED);
            assertThat(channel.closedWith).isEqualTo(CloseReason.AUTH_FAILED);
        }

        @Test
        void verifierTimeoutIsRejected() {
            RecordingChannel channel = new RecordingChannel();

            ClientConnection connection = gateway.open(channel, "slow");

            assertThat(connection.getState()).isEqualTo(SessionState.HANDSHAKING);
            await().atMost(5, TimeUnit.SECONDS)
                    .untilAsserted(() -> assertThat(channel.closedWith).isEqualTo(CloseReason.AUTH_FAILED));
            assertThat(channel.last().text("code")).isEqualTo(FrameTypes.AUTH_FAILED);
        }

        @Test
        void framesBeforeActiveAreRefused() {
            RecordingChannel channel = new RecordingChannel();
            ClientConnection connection = gateway.open(channel, "slow");

            gateway.onText(connection, subscribe("w1"));

            assertThat(channel.last().text("code")).isEqualTo(FrameTypes.NOT_ACTIVE);
            assertThat(registry.subscriptionCount()).isZero();
            gateway.close(connection, CloseReason.CLIENT_CLOSED);
        }

        @Test
        void closeDuringVerificationNeverRegisters() {
            CompletableFuture<AuthenticatedPrincipal> pending = new CompletableFuture<>();
            GatewayService slowGateway = new GatewayService(registry, new ReadingDispatcher(registry),
                    token -> pending, GatewaySettings.defaults(), new GatewayMetrics(meters), Runnable::run,
                    Clock.systemUTC());
            RecordingChannel channel = new RecordingChannel();
            ClientConnection connection = slowGateway.open(channel, "t1:alice");

            slowGateway.onTransportClosed(connection, false);
            pending.complete(new AuthenticatedPrincipal("t1", "alice", "viewer"));

            assertThat(connection.getState()).isEqualTo(SessionState.CLOSED);
            assertThat(registry.connectionCount()).isZero();
            assertThat(channel.sent).isEmpty();
        }
    }

    @Nested
    class ActiveFrames {

        private RecordingChannel channel;
        private ClientConnection connection;

        @BeforeEach
        void open() {
            channel = new RecordingChannel();
            connection = connect(channel, "t1:alice");
        }

        @Test
        void subscribeAndUnsubscribeAreAcknowledged() {
            gateway.onText(connection, subscribe("w1"));

            assertThat(channel.last().type()).isEqualTo(FrameTypes.SUBSCRIBED);
            assertThat(channel.last().text("well_id")).isEqualTo("w1");
            assertThat(registry.wellSubscribers("t1", "w1")).containsExactly(connection.getConnectionId());
            assertThat(connection.getSubscribedWells()).containsExactly("w1");

            gateway.onText(connection, "{\"type\":\"unsubscribe-well\",\"well_id\":\"w1\"}");

            assertThat(channel.last().type()).isEqualTo(FrameTypes.UNSUBSCRIBED);
            assertThat(registry.wellSubscribers("t1", "w1")).isEmpty();
            assertThat(connection.getSubscribedWells()).isEmpty();
        }

        @Test
        void duplicateSubscribeIsAcknowledgedOnce() {
            gateway.onText(connection, subscribe("w1"));
            gateway.onText(connection, subscribe("w1"));

            assertThat(channel.framesOfType(FrameTypes.SUBSCRIBED)).hasSize(2);
            assertThat(registry.subscriptionCount()).isEqualTo(1);
        }

        @Test
        void missingWellIdIsInvalid() {
            gateway.onText(connection, "{\"type\":\"subscribe-well\",\"data\":{}}");

            assertThat(channel.last().text("code")).isEqualTo(FrameTypes.INVALID_FRAME);
        }

        @Test
        void malformedAndUnknownFramesAreInvalid() {
            gateway.onText(connection, "{{{");
            gateway.onText(connection, "{\"type\":\"teleport\"}");

            assertThat(channel.framesOfType(FrameTypes.ERROR))
                    .extracting(f -> f.text("code"))
                    .containsExactly(FrameTypes.INVALID_FRAME, FrameTypes.INVALID_FRAME);
            assertThat(connection.isActive()).isTrue();
        }

        @Test
        void pingIsAnsweredWithPong() {
            gateway.onText(connection, "{\"type\":\"ping\"}");

            assertThat(channel.last().type()).isEqualTo(FrameTypes.PONG);
        }
    }

    @Nested
    class FanOut {

        private RecordingChannel c1;
        private RecordingChannel c2;
        private RecordingChannel c3;

        @BeforeEach
        void openExampleTopology() {
            c1 = new RecordingChannel();
            c2 = new RecordingChannel();
            c3 = new RecordingChannel();
            gateway.onText(connect(c1, "t1:alice"), subscribe("w1"));
            connect(c2, "t1:bob");
            connect(c3, "t2:carol");
            c1.sent.clear();
            c2.sent.clear();
            c3.sent.clear();
        }

        @Test
        @DisplayName("Subscribed well goes to its subscribers only; other wells reach the whole tenant")
        void exampleScenario() {
            gateway.onReading(reading("t1", "w1"));

            assertThat(c1.framesOfType(FrameTypes.READING)).singleElement()
                    .satisfies(f -> assertThat(f.data()).containsEntry("well_id", "w1")
                            .containsEntry("tag_name", "pressure")
                            .containsEntry("value", 120.5));
            assertThat(c2.sent).isEmpty();
            assertThat(c3.sent).isEmpty();

            gateway.onReading(reading("t1", "w2"));

            assertThat(c1.framesOfType(FrameTypes.READING)).hasSize(2);
            assertThat(c2.framesOfType(FrameTypes.READING)).singleElement()
                    .satisfies(f -> assertThat(f.data()).containsEntry("well_id", "w2"));
            assertThat(c3.sent).isEmpty();
        }

        @Test
        @DisplayName("One broken socket does not stop delivery to the others")
        void writeFailureIsIsolated() {
            c1.failWrites = true;
            gateway.onReading(reading("t1", "w2"));

            assertThat(c2.framesOfType(FrameTypes.READING)).hasSize(1);
            assertThat(c1.closedWith).isEqualTo(CloseReason.TRANSPORT_ERROR);
            assertThat(registry.tenantConnections("t1")).hasSize(1);
            assertThat(meters.get("wellcast.socket.write.errors").counter().count()).isEqualTo(1.0);
        }

        @Test
        void closedConnectionNoLongerReceives() {
            ClientConnection bob = gateway.getConnections().stream()
                    .filter(c -> "bob".equals(c.getUserId())).findFirst().orElseThrow();
            gateway.onTransportClosed(bob, false);

            gateway.onReading(reading("t1", "w2"));

            assertThat(c2.sent).isEmpty();
            assertThat(c1.framesOfType(FrameTypes.READING)).hasSize(1);
        }
    }

    @Nested
    class Teardown {

        @Test
        @DisplayName("Closing twice unregisters once")
        void doubleCloseIsIdempotent() {
            RecordingChannel channel = new RecordingChannel();
            ClientConnection connection = connect(channel, "t1:alice");
            gateway.onText(connection, subscribe("w1"));
            connect(new RecordingChannel(), "t1:bob");

            gateway.onTransportClosed(connection, true);
            RegistrySnapshot once = registry.snapshot();
            gateway.close(connection, CloseReason.CLIENT_CLOSED);

            assertThat(registry.snapshot()).isEqualTo(once);
            assertThat(once.connections()).isEqualTo(1);
            assertThat(once.subscriptions()).isZero();
            assertThat(channel.closeCalls.get()).isEqualTo(1);
            assertThat(channel.closedWith).isEqualTo(CloseReason.TRANSPORT_ERROR);
            assertThat(connection.getSubscribedWells()).isEmpty();
        }

        @Test
        void shutdownClosesEverything() {
            RecordingChannel a = new RecordingChannel();
            RecordingChannel b = new RecordingChannel();
            connect(a, "t1:alice");
            connect(b, "t2:bob");

            gateway.shutdown();

            assertThat(a.closedWith).isEqualTo(CloseReason.SHUTDOWN);
            assertThat(b.closedWith).isEqualTo(CloseReason.SHUTDOWN);
            assertThat(registry.connectionCount()).isZero();
        }
    }

    @Nested
    class Heartbeats {

        @Test
        void silentConnectionIsClosedAfterMaxMisses() {
            RecordingChannel channel = new RecordingChannel();
            ClientConnection connection = connect(channel, "t1:alice");

            gateway.checkHeartbeats(); // activity from the handshake
            gateway.checkHeartbeats();
            gateway.checkHeartbeats();
            assertThat(connection.isActive()).isTrue();
            assertThat(connection.getMissedHeartbeats()).isEqualTo(2);
            assertThat(channel.pings.get()).isEqualTo(3);

            gateway.checkHeartbeats();

            assertThat(channel.closedWith).isEqualTo(CloseReason.HEARTBEAT_TIMEOUT);
            assertThat(registry.connectionCount()).isZero();
        }

        @Test
        void pongResetsTheMissCounter() {
            RecordingChannel channel = new RecordingChannel();
            ClientConnection connection = connect(channel, "t1:alice");

            for (int i = 0; i < 10; i++) {
                gateway.checkHeartbeats();
                gateway.onPong(connection);
            }

            assertThat(connection.isActive()).isTrue();
            assertThat(connection.getMissedHeartbeats()).isZero();
        }

        @Test
        void failedPingClosesConnection() {
            RecordingChannel channel = new RecordingChannel();
            connect(channel, "t1:alice");
            channel.failWrites = true;

            gateway.checkHeartbeats();

            assertThat(channel.closedWith).isEqualTo(CloseReason.TRANSPORT_ERROR);
        }
    }
}
