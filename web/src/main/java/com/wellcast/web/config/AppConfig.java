/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.web.config;

import com.wellcast.common.validation.ReadingValidator;
import com.wellcast.messaging.config.BrokerClientFactory;
import com.wellcast.messaging.config.BrokerSettings;
import com.wellcast.messaging.core.BrokerClient;
import com.wellcast.server.auth.JwtTokenVerifier;
import com.wellcast.server.auth.TokenVerifier;
import com.wellcast.server.dispatch.ReadingDispatcher;
import com.wellcast.server.gateway.GatewayService;
import com.wellcast.server.gateway.GatewaySettings;
import com.wellcast.server.gateway.HeartbeatMonitor;
import com.wellcast.server.metrics.GatewayMetrics;
import com.wellcast.server.publisher.ReadingPublisher;
import com.wellcast.server.registry.ConnectionRegistry;
import com.wellcast.server.subscriber.ReadingSubscriber;
import com.wellcast.server.subscriber.SubscriberSettings;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the pipeline from {@code application.properties}. Everything below the
 * web layer is plain Java; this class is the only place Spring meets it.
 */
@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    // --- Broker ---
    @Value("${wellcast.broker.type:IN_MEMORY}")
    private String brokerType;

    @Value("${wellcast.broker.activemq.broker-url:tcp://localhost:61616}")
    private String activemqBrokerUrl;

    @Value("${wellcast.broker.activemq.username:}")
    private String activemqUsername;

    @Value("${wellcast.broker.activemq.password:}")
    private String activemqPassword;

    @Value("${wellcast.broker.kafka.bootstrap-servers:localhost:9092}")
    private String kafkaBootstrapServers;

    @Value("${wellcast.broker.kafka.group-id:}")
    private String kafkaGroupId;

    @Value("${wellcast.broker.kafka.acks:all}")
    private String kafkaAcks;

    // --- Validation ---
    @Value("${wellcast.validation.max-future-skew:5m}")
    private Duration maxFutureSkew;

    // --- Auth ---
    @Value("${wellcast.auth.jwt-secret}")
    private String jwtSecret;

    @Value("${wellcast.auth.threads:4}")
    private int authThreads;

    @Value("${wellcast.auth.queue-capacity:1000}")
    private int authQueueCapacity;

    // --- Gateway ---
    @Value("${wellcast.gateway.auth-timeout:5s}")
    private Duration authTimeout;

    @Value("${wellcast.gateway.heartbeat-interval:30s}")
    private Duration heartbeatInterval;

    @Value("${wellcast.gateway.max-missed-heartbeats:3}")
    private int maxMissedHeartbeats;

    @Value("${wellcast.gateway.send-time-limit:10s}")
    private Duration sendTimeLimit;

    @Value("${wellcast.gateway.send-buffer-size:524288}")
    private int sendBufferSize;

    @Value("${wellcast.gateway.fanout-threads:8}")
    private int fanoutThreads;

    // --- Subscriber ---
    @Value("${wellcast.subscriber.base-delay:1s}")
    private Duration subscriberBaseDelay;

    @Value("${wellcast.subscriber.max-delay:30s}")
    private Duration subscriberMaxDelay;

    @Value("${wellcast.subscriber.max-attempts:20}")
    private int subscriberMaxAttempts;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BrokerSettings brokerSettings() {
        BrokerSettings.BrokerType type = BrokerSettings.parseType(brokerType);
        Map<String, Object> props = new HashMap<>();
        switch (type) {
            case ACTIVEMQ -> {
                props.put("broker_url", activemqBrokerUrl);
                if (!activemqUsername.isBlank()) props.put("username", activemqUsername);
                if (!activemqPassword.isBlank()) props.put("password", activemqPassword);
            }
            case KAFKA -> {
                props.put("bootstrap_servers", kafkaBootstrapServers);
                props.put("acks", kafkaAcks);
                if (!kafkaGroupId.isBlank()) props.put("group_id", kafkaGroupId);
            }
            case IN_MEMORY -> { }
        }
        BrokerSettings settings = new BrokerSettings(type, props);
        log.info("Broker: {}", settings);
        return settings;
    }

    @Bean(destroyMethod = "close")
    public BrokerClient brokerClient(BrokerSettings brokerSettings) {
        return BrokerClientFactory.create(brokerSettings);
    }

    @Bean
    public GatewayMetrics gatewayMetrics(MeterRegistry meterRegistry) {
        return new GatewayMetrics(meterRegistry);
    }

    @Bean
    public ReadingValidator readingValidator(Clock clock) {
        return new ReadingValidator(clock, maxFutureSkew);
    }

    @Bean
    public ReadingPublisher readingPublisher(BrokerClient brokerClient, ReadingValidator readingValidator,
                                             GatewayMetrics gatewayMetrics) {
        return new ReadingPublisher(brokerClient, readingValidator, gatewayMetrics);
    }

    @Bean
    public ConnectionRegistry connectionRegistry() {
        return new ConnectionRegistry();
    }

    @Bean
    public ReadingDispatcher readingDispatcher(ConnectionRegistry connectionRegistry) {
        return new ReadingDispatcher(connectionRegistry);
    }

    /** Bounded pool so a slow token check can never exhaust socket I/O threads. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService authExecutor() {
        return new ThreadPoolExecutor(authThreads, authThreads, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(authQueueCapacity), daemonThreads("gateway-auth"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fanoutExecutor() {
        return Executors.newFixedThreadPool(fanoutThreads, daemonThreads("gateway-fanout"));
    }

    @Bean
    public TokenVerifier tokenVerifier(@Qualifier("authExecutor") ExecutorService authExecutor) {
        return JwtTokenVerifier.hmac(jwtSecret, authExecutor);
    }

    @Bean
    public GatewaySettings gatewaySettings() {
        return new GatewaySettings(authTimeout, heartbeatInterval, maxMissedHeartbeats,
                sendTimeLimit, sendBufferSize);
    }

    @Bean
    public GatewayService gatewayService(ConnectionRegistry connectionRegistry, ReadingDispatcher readingDispatcher,
                                         TokenVerifier tokenVerifier, GatewaySettings gatewaySettings,
                                         GatewayMetrics gatewayMetrics,
                                         @Qualifier("fanoutExecutor") ExecutorService fanoutExecutor,
                                         Clock clock) {
        return new GatewayService(connectionRegistry, readingDispatcher, tokenVerifier, gatewaySettings,
                gatewayMetrics, fanoutExecutor, clock);
    }

    @Bean
    public HeartbeatMonitor heartbeatMonitor(GatewayService gatewayService) {
        return new HeartbeatMonitor(gatewayService);
    }

    @Bean
    public SubscriberSettings subscriberSettings() {
        return new SubscriberSettings(subscriberBaseDelay, subscriberMaxDelay, subscriberMaxAttempts);
    }

    @Bean
    public ReadingSubscriber readingSubscriber(BrokerClient brokerClient, ReadingValidator readingValidator,
                                               GatewayService gatewayService, SubscriberSettings subscriberSettings,
                                               GatewayMetrics gatewayMetrics) {
        return new ReadingSubscriber(brokerClient, readingValidator, gatewayService, subscriberSettings,
                gatewayMetrics);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
