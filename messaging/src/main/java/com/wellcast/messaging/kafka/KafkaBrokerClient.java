/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.messaging.kafka;

import com.wellcast.common.exception.BrokerConnectionException;
import com.wellcast.messaging.core.AbstractBrokerClient;
import com.wellcast.messaging.core.TopicPatterns;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Kafka-based BrokerClient. Kafka topic names cannot contain {@code :}, so
 * logical topics map to dot-separated names. Wildcard patterns become a regex
 * pattern subscription.
 *
 * <p>Every instance uses its own consumer group (unless {@code group_id} is
 * configured) so that every gateway process sees every reading. KafkaConsumer is
 * not thread-safe: subscription changes are handed to the poll thread, which
 * applies them between polls.</p>
 */
public class KafkaBrokerClient extends AbstractBrokerClient {

    static final char SEPARATOR = '.';

    private final Set<String> patterns = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean subscriptionDirty = new AtomicBoolean(false);

    private KafkaProducer<String, String> producer;
    private KafkaConsumer<String, String> consumer;
    private ExecutorService pollExecutor;
    private volatile boolean running = false;
    private volatile Thread pollThread;

    public KafkaBrokerClient(Map<String, Object> config) {
        super(config);
    }

    @Override
    protected void doConnect() {
        String bootstrap = configString("bootstrap_servers", "localhost:9092");

        Properties producerProps = new Properties();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrap);
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        producerProps.put(ProducerConfig.ACKS_CONFIG, configString("acks", "1"));
        producerProps.put(ProducerConfig.LINGER_MS_CONFIG, configString("linger_ms", "5"));
        producerProps.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, configString("max_block_ms", "5000"));
        producerProps.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, configString("delivery_timeout_ms", "30000"));
        producerProps.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, configString("request_timeout_ms", "15000"));

        Properties consumerProps = new Properties();
        consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrap);
        consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG,
                configString("group_id", "wellcast-gateway-" + UUID.randomUUID().toString().substring(0, 8)));
        consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        // live fan-out only: no replay of what was published while we were away
        consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        consumerProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
        consumerProps.put(ConsumerConfig.METADATA_MAX_AGE_CONFIG, configString("metadata_max_age_ms", "30000"));
        consumerProps.put(ConsumerConfig.RECONNECT_BACKOFF_MS_CONFIG, configString("reconnect_backoff_ms", "1000"));
        consumerProps.put(ConsumerConfig.RECONNECT_BACKOFF_MAX_MS_CONFIG, configString("reconnect_backoff_max_ms", "30000"));

        try {
            producer = new KafkaProducer<>(producerProps);
            consumer = new KafkaConsumer<>(consumerProps);
            // fails fast when no broker is reachable
            consumer.listTopics(Duration.ofMillis(configInt("connect_timeout_ms", 10000)));
        } catch (KafkaException e) {
            if (consumer != null) {
                consumer.close(Duration.ZERO);
                consumer = null;
            }
            throw new BrokerConnectionException("Failed to connect to Kafka at " + bootstrap, e);
        }

        running = true;
        subscriptionDirty.set(!patterns.isEmpty());
        pollExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "kafka-poll");
            t.setDaemon(true);
            return t;
        });
        KafkaConsumer<String, String> pollConsumer = consumer;
        pollExecutor.submit(() -> pollLoop(pollConsumer));
        log.info("Kafka client connected to {}", bootstrap);
    }

    private void pollLoop(KafkaConsumer<String, String> pollConsumer) {
        pollThread = Thread.currentThread();
        try {
            while (running) {
                if (subscriptionDirty.getAndSet(false)) applySubscription(pollConsumer);
                if (pollConsumer.subscription().isEmpty()) {
                    Thread.sleep(100);
                    continue;
                }
                ConsumerRecords<String, String> records = pollConsumer.poll(Duration.ofMillis(200));
                for (ConsumerRecord<String, String> record : records) {
                    deliver(TopicPatterns.fromNative(record.topic(), SEPARATOR), record.value());
                }
            }
        } catch (WakeupException e) {
            if (running) connectionLost(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (KafkaException e) {
            log.error("Kafka poll error", e);
            running = false;
            connectionLost(e);
        } finally {
            try {
                pollConsumer.close(Duration.ofSeconds(5));
            } catch (KafkaException e) {
                log.debug("Error closing Kafka consumer", e);
            }
        }
    }

    private void applySubscription(KafkaConsumer<String, String> pollConsumer) {
        if (patterns.isEmpty()) {
            pollConsumer.unsubscribe();
            return;
        }
        String regex = patterns.stream()
                .map(p -> TopicPatterns.globToRegex(TopicPatterns.toNative(p, SEPARATOR)).pattern())
                .map(r -> "(?:" + r + ")")
                .collect(Collectors.joining("|"));
        pollConsumer.subscribe(Pattern.compile(regex));
        log.info("Kafka subscribed to topic pattern {}", regex);
    }

    @Override
    protected CompletableFuture<Void> doPublish(String topic, List<String> payloads) {
        String nativeTopic = TopicPatterns.toNative(topic, SEPARATOR);
        List<CompletableFuture<Void>> acks = new ArrayList<>(payloads.size());
        for (String payload : payloads) {
            CompletableFuture<Void> ack = new CompletableFuture<>();
            producer.send(new ProducerRecord<>(nativeTopic, payload), (metadata, exception) -> {
                if (exception != null) ack.completeExceptionally(exception);
                else ack.complete(null);
            });
            acks.add(ack);
        }
        if (payloads.size() > 1) producer.flush();
        return CompletableFuture.allOf(acks.toArray(new CompletableFuture[0]));
    }

    @Override
    protected void doSubscribe(String pattern) {
        patterns.add(pattern);
        subscriptionDirty.set(true);
    }

    @Override
    protected void doUnsubscribe(String pattern) {
        patterns.remove(pattern);
        subscriptionDirty.set(true);
    }

    @Override
    protected void doDisconnect() {
        running = false;
        patterns.clear();
        if (consumer != null) consumer.wakeup();
        if (pollExecutor != null) {
            pollExecutor.shutdown();
            // the poll thread itself reports connection loss and must not wait on itself
            if (Thread.currentThread() != pollThread) {
                try {
                    if (!pollExecutor.awaitTermination(5, TimeUnit.SECONDS)) pollExecutor.shutdownNow();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            pollExecutor = null;
        }
        if (producer != null) {
            producer.close(Duration.ofSeconds(5));
            producer = null;
        }
        consumer = null;
    }
}
