/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.client;

import com.wellcast.client.transport.ClientTransport;
import com.wellcast.client.transport.TransportListener;
import com.wellcast.client.transport.TransportSession;
import com.wellcast.common.model.Reading;
import com.wellcast.common.protocol.FrameTypes;
import com.wellcast.common.protocol.WireFrame;
import com.wellcast.common.util.ExponentialBackoff;
import com.wellcast.common.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps a client connected to the gateway and its well subscriptions in force.
 *
 * <p>State machine: DISCONNECTED, CONNECTING, CONNECTED and RECONNECTING. The
 * set of wells the application asked for lives here, independent of any
 * transport session, and is replayed each time the gateway confirms a new
 * session with its {@code connected} frame. A lost session schedules a new
 * attempt after an exponential backoff delay. An {@code AUTH_FAILED} error ends
 * the cycle, since retrying with the same credential cannot succeed.</p>
 *
 * <p>Thread-safe. Timers and listener callbacks run on one daemon thread.</p>
 */
public class ReconnectManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReconnectManager.class);

    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

    private final ClientTransport transport;
    private final ExponentialBackoff backoff;
    private final ClientListener listener;
    private final ScheduledExecutorService scheduler;

    private final Object lock = new Object();
    private ReconnectState state = ReconnectState.DISCONNECTED;   // guarded by lock
    private final Set<String> wells = new LinkedHashSet<>();      // guarded by lock
    private TransportSession session;                             // guarded by lock
    private ScheduledFuture<?> reconnectTimer;                    // guarded by lock
    private long generation;                                      // guarded by lock
    private int attempts;                                         // guarded by lock
    private boolean confirmed;                                    // guarded by lock

    public ReconnectManager(ClientTransport transport, ExponentialBackoff backoff, ClientListener listener) {
        this.transport = transport;
        this.backoff = backoff;
        this.listener = listener;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "wellcast-client");
            t.setDaemon(true);
            return t;
        });
    }

    public ReconnectManager(ClientTransport transport, ClientListener listener) {
        this(transport, ExponentialBackoff.unbounded(DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY), listener);
    }

    // ─── Application API ───────────────────────────────────────────────────

    /** Start connecting. No effect unless DISCONNECTED. */
    public void connect() {
        synchronized (lock) {
            if (state != ReconnectState.DISCONNECTED) return;
            attempts = 0;
            openSession();
        }
    }

    /** Stop from any state: cancel a pending retry and close the session. */
    public void disconnect() {
        synchronized (lock) {
            generation++;
            cancelTimer();
            closeSession();
            attempts = 0;
            setState(ReconnectState.DISCONNECTED);
        }
    }

    public void subscribeWell(String wellId) {
        synchronized (lock) {
            if (wells.add(wellId) && state == ReconnectState.CONNECTED) {
                sendWellFrame(FrameTypes.SUBSCRIBE_WELL, wellId);
            }
        }
    }

    public void unsubscribeWell(String wellId) {
        synchronized (lock) {
            if (wells.remove(wellId) && state == ReconnectState.CONNECTED) {
                sendWellFrame(FrameTypes.UNSUBSCRIBE_WELL, wellId);
            }
        }
    }

    public ReconnectState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public Set<String> getWells() {
        synchronized (lock) {
            return Set.copyOf(wells);
        }
    }

    /** Reconnect attempts since the last established session. */
    public int getAttempts() {
        synchronized (lock) {
            return attempts;
        }
    }

    @Override
    public void close() {
        disconnect();
        scheduler.shutdown();
    }

    // ─── State machine ─────────────────────────────────────────────────────

    // caller holds lock
    private void openSession() {
        setState(ReconnectState.CONNECTING);
        confirmed = false;
        long gen = ++generation;
        CompletableFuture<TransportSession> opening;
        try {
            opening = transport.connect(new SessionListener(gen));
        } catch (RuntimeException e) {
            log.warn("Connection attempt failed: {}", e.getMessage());
            scheduleReconnect();
            return;
        }
        opening.whenComplete((opened, ex) -> onSessionOpened(gen, opened, ex));
    }

    private void onSessionOpened(long gen, TransportSession opened, Throwable ex) {
        synchronized (lock) {
            if (gen != generation) {
                if (opened != null) opened.close();
                return;
            }
            if (ex != null) {
                log.warn("Connection attempt failed: {}", ex.getMessage());
                scheduleReconnect();
                return;
            }
            session = opened;
            // the connected frame may race the completion of the open
            if (confirmed) enterConnected();
        }
    }

    private void onFrame(long gen, String text) {
        WireFrame frame;
        try {
            frame = WireFrame.parse(text);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed frame from gateway: {}", e.getMessage());
            return;
        }
        switch (frame.type()) {
            case FrameTypes.CONNECTED -> onConnected(gen);
            case FrameTypes.READING -> onReading(frame);
            case FrameTypes.ERROR -> onErrorFrame(gen, frame);
            default -> log.debug("Gateway frame: {}", frame.type());
        }
    }

    private void onConnected(long gen) {
        synchronized (lock) {
            if (gen != generation || confirmed) return;
            confirmed = true;
            if (session != null) enterConnected();
        }
    }

    // caller holds lock
    private void enterConnected() {
        attempts = 0;
        setState(ReconnectState.CONNECTED);
        for (String wellId : wells) {
            sendWellFrame(FrameTypes.SUBSCRIBE_WELL, wellId);
        }
        log.info("Connected; replayed {} well subscription(s)", wells.size());
    }

    private void onReading(WireFrame frame) {
        Reading reading;
        try {
            reading = JsonUtil.mapper().convertValue(frame.data(), Reading.class);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring undecodable reading: {}", e.getMessage());
            return;
        }
        post(() -> listener.onReading(reading));
    }

    private void onErrorFrame(long gen, WireFrame frame) {
        String code = frame.text("code");
        String message = frame.text("message");
        if (FrameTypes.AUTH_FAILED.equals(code)) {
            synchronized (lock) {
                if (gen != generation) return;
                log.error("Gateway rejected credentials ({}); not reconnecting", message);
                generation++;
                cancelTimer();
                closeSession();
                setState(ReconnectState.DISCONNECTED);
            }
        } else {
            log.warn("Gateway error {}: {}", code, message);
        }
        post(() -> listener.onError(code, message));
    }

    private void onSessionLost(long gen, String why) {
        synchronized (lock) {
            if (gen != generation || state == ReconnectState.DISCONNECTED) return;
            log.warn("Session lost: {}", why);
            generation++;
            closeSession();
            scheduleReconnect();
        }
    }

    // caller holds lock
    private void scheduleReconnect() {
        if (backoff.isExhausted(attempts)) {
            log.error("Giving up after {} reconnect attempts", attempts);
            setState(ReconnectState.DISCONNECTED);
            return;
        }
        attempts++;
        Duration delay = backoff.delayFor(attempts);
        setState(ReconnectState.RECONNECTING);
        long gen = generation;
        log.info("Reconnecting in {} ms (attempt {})", delay.toMillis(), attempts);
        reconnectTimer = scheduler.schedule(() -> {
            synchronized (lock) {
                if (gen != generation || state != ReconnectState.RECONNECTING) return;
                reconnectTimer = null;
                openSession();
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    // caller holds lock
    private void sendWellFrame(String type, String wellId) {
        TransportSession current = session;
        if (current == null) return;
        current.send(WireFrame.of(type, Map.of("well_id", wellId)).toJson())
                .whenComplete((ok, ex) -> {
                    if (ex != null) log.warn("Sending {} for well {} failed: {}", type, wellId, ex.getMessage());
                });
    }

    // caller holds lock
    private void cancelTimer() {
        if (reconnectTimer != null) {
            reconnectTimer.cancel(false);
            reconnectTimer = null;
        }
    }

    // caller holds lock
    private void closeSession() {
        if (session != null) {
            session.close();
            session = null;
        }
    }

    // caller holds lock
    private void setState(ReconnectState next) {
        ReconnectState previous = state;
        if (previous == next) return;
        state = next;
        log.debug("Client state {} -> {}", previous, next);
        post(() -> listener.onStateChange(previous, next));
    }

    private void post(Runnable event) {
        try {
            scheduler.execute(() -> {
                try {
                    event.run();
                } catch (RuntimeException e) {
                    log.error("Client listener failed", e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Manager closed; event dropped");
        }
    }

    private final class SessionListener implements TransportListener {

        private final long gen;

        private SessionListener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onText(String text) { onFrame(gen, text); }

        @Override
        public void onClosed(int statusCode, String reason) {
            onSessionLost(gen, "closed (" + statusCode + (reason == null || reason.isEmpty() ? "" : " " + reason) + ")");
        }

        @Override
        public void onError(Throwable error) { onSessionLost(gen, String.valueOf(error.getMessage())); }
    }
}
