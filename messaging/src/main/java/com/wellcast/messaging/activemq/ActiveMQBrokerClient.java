/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.messaging.activemq;

import com.wellcast.common.exception.BrokerConnectionException;
import com.wellcast.messaging.core.AbstractBrokerClient;
import com.wellcast.messaging.core.TopicPatterns;
import jakarta.jms.Connection;
import jakarta.jms.DeliveryMode;
import jakarta.jms.JMSException;
import jakarta.jms.MessageConsumer;
import jakarta.jms.MessageProducer;
import jakarta.jms.Session;
import jakarta.jms.TextMessage;
import jakarta.jms.Topic;
import org.apache.activemq.ActiveMQConnectionFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * ActiveMQ-based BrokerClient using JMS topics. Logical topics map to
 * dot-separated JMS topics ({@code readings:t1} becomes {@code readings.t1}),
 * so {@code readings:*} becomes the ActiveMQ wildcard {@code readings.*}.
 *
 * <p>JMS sessions are single-threaded: all publishing goes through one
 * executor thread. Batches are sent in a transacted session and committed
 * together, so a batch is either fully accepted or rolled back.</p>
 */
public class ActiveMQBrokerClient extends AbstractBrokerClient {

    static final char SEPARATOR = '.';

    private final ExecutorService publishExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "activemq-publish");
        t.setDaemon(true);
        return t;
    });
    private final Map<String, MessageConsumer> consumers = new ConcurrentHashMap<>();

    private Connection connection;
    private Session producerSession;
    private Session batchSession;
    private Session consumerSession;

    public ActiveMQBrokerClient(Map<String, Object> config) {
        super(config);
    }

    @Override
    protected void doConnect() {
        String brokerUrl = configString("broker_url", "tcp://localhost:61616");
        try {
            ActiveMQConnectionFactory factory = new ActiveMQConnectionFactory(brokerUrl);
            connection = factory.createConnection(configString("username", "admin"), configString("password", "admin"));
            connection.setExceptionListener(ex -> {
                log.error("ActiveMQ connection error", ex);
                connectionLost(ex);
            });
            producerSession = connection.createSession(false, Session.AUTO_ACKNOWLEDGE);
            batchSession = connection.createSession(true, Session.SESSION_TRANSACTED);
            consumerSession = connection.createSession(false, Session.AUTO_ACKNOWLEDGE);
            connection.start();
            log.info("ActiveMQ client connected to {}", brokerUrl);
        } catch (JMSException e) {
            throw new BrokerConnectionException(
                    "Failed to connect to ActiveMQ at " + brokerUrl, e);
        }
    }

    @Override
    protected CompletableFuture<Void> doPublish(String topic, List<String> payloads) {
        String nativeTopic = TopicPatterns.toNative(topic, SEPARATOR);
        return CompletableFuture.runAsync(() -> {
            try {
                if (payloads.size() == 1) {
                    send(producerSession, nativeTopic, payloads);
                } else {
                    try {
                        send(batchSession, nativeTopic, payloads);
                        batchSession.commit();
                    } catch (JMSException e) {
                        batchSession.rollback();
                        throw e;
                    }
                }
            } catch (JMSException e) {
                throw new IllegalStateException("ActiveMQ publish failed", e);
            }
        }, publishExecutor);
    }

    private void send(Session session, String nativeTopic, List<String> payloads) throws JMSException {
        MessageProducer producer = session.createProducer(session.createTopic(nativeTopic));
        try {
            producer.setDeliveryMode(DeliveryMode.NON_PERSISTENT);
            for (String payload : payloads) {
                producer.send(session.createTextMessage(payload));
            }
        } finally {
            producer.close();
        }
    }

    @Override
    protected void doSubscribe(String pattern) {
        try {
            Topic destination = consumerSession.createTopic(TopicPatterns.toNative(pattern, SEPARATOR));
            MessageConsumer consumer = consumerSession.createConsumer(destination);
            consumer.setMessageListener(jmsMessage -> {
                try {
                    if (jmsMessage instanceof TextMessage txt && jmsMessage.getJMSDestination() instanceof Topic t) {
                        deliver(TopicPatterns.fromNative(t.getTopicName(), SEPARATOR), txt.getText());
                    } else {
                        log.warn("Ignoring non-text ActiveMQ message on pattern {}", pattern);
                    }
                } catch (JMSException e) {
                    log.error("Error processing ActiveMQ message", e);
                }
            });
            consumers.put(pattern, consumer);
        } catch (JMSException e) {
            throw new IllegalStateException("Failed to subscribe to " + pattern, e);
        }
    }

    @Override
    protected void doUnsubscribe(String pattern) {
        MessageConsumer consumer = consumers.remove(pattern);
        if (consumer != null) {
            try {
                consumer.close();
            } catch (JMSException e) {
                log.warn("Error closing consumer for {}", pattern, e);
            }
        }
    }

    @Override
    protected void doDisconnect() {
        for (Map.Entry<String, MessageConsumer> entry : consumers.entrySet()) {
            try {
                entry.getValue().close();
            } catch (JMSException e) {
                log.debug("Error closing consumer for {}", entry.getKey(), e);
            }
        }
        consumers.clear();
        if (connection != null) {
            try {
                // closing the connection closes its sessions
                connection.close();
            } catch (JMSException e) {
                log.warn("Error closing ActiveMQ connection", e);
            }
            connection = null;
        }
    }

    @Override
    public synchronized void close() {
        super.close();
        publishExecutor.shutdownNow();
    }
}
