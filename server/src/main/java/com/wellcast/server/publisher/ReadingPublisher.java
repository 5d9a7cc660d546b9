/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.publisher;

import com.wellcast.common.exception.BrokerConnectionException;
import com.wellcast.common.exception.ValidationException;
import com.wellcast.common.model.Reading;
import com.wellcast.common.util.JsonUtil;
import com.wellcast.common.validation.ReadingValidator;
import com.wellcast.messaging.core.BrokerClient;
import com.wellcast.server.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ingestion-side entry point: validates readings and publishes them to their
 * tenant topic. Does not retry or buffer; callers see broker failures through the
 * returned futures.
 */
public class ReadingPublisher {

    private static final Logger log = LoggerFactory.getLogger(ReadingPublisher.class);

    private final BrokerClient broker;
    private final ReadingValidator validator;
    private final GatewayMetrics metrics;

    public ReadingPublisher(BrokerClient broker, ReadingValidator validator, GatewayMetrics metrics) {
        this.broker = broker;
        this.validator = validator;
        this.metrics = metrics;
    }

    public CompletableFuture<Void> publish(Reading reading) {
        return publishValidated(() -> validator.validate(reading));
    }

    /** Publish an untyped candidate, e.g. a decoded JSON body. */
    public CompletableFuture<Void> publish(Map<String, ?> candidate) {
        return publishValidated(() -> validator.validate(candidate));
    }

    public CompletableFuture<PublishBatchResult> publishBatch(List<Reading> readings) {
        List<ValidationStep> steps = new ArrayList<>(readings.size());
        for (Reading reading : readings) {
            steps.add(() -> validator.validate(reading));
        }
        return publishAll(steps);
    }

    /** Batch variant for untyped candidates. */
    public CompletableFuture<PublishBatchResult> publishCandidates(List<? extends Map<String, ?>> candidates) {
        List<ValidationStep> steps = new ArrayList<>(candidates.size());
        for (Map<String, ?> candidate : candidates) {
            steps.add(() -> validator.validate(candidate));
        }
        return publishAll(steps);
    }

    @FunctionalInterface
    private interface ValidationStep {
        Reading validate();
    }

    private record Pending(int index, Reading reading) {}

    private CompletableFuture<Void> publishValidated(ValidationStep step) {
        Reading reading;
        try {
            reading = step.validate();
        } catch (ValidationException e) {
            log.warn("Rejected reading: {}", e.getMessage());
            metrics.readingsRejected(1);
            return CompletableFuture.failedFuture(e);
        }
        return broker.publish(reading.topic(), JsonUtil.toJson(reading))
                .handle((ok, ex) -> {
                    if (ex != null) {
                        metrics.readingsRejected(1);
                        throw new CompletionException(asBrokerFailure(ex));
                    }
                    metrics.readingsPublished(1);
                    return null;
                });
    }

    private CompletableFuture<PublishBatchResult> publishAll(List<ValidationStep> steps) {
        ConcurrentLinkedQueue<PublishBatchResult.FailedReading> failures = new ConcurrentLinkedQueue<>();
        Map<String, List<Pending>> byTopic = new LinkedHashMap<>();

        for (int i = 0; i < steps.size(); i++) {
            try {
                Reading reading = steps.get(i).validate();
                byTopic.computeIfAbsent(reading.topic(), t -> new ArrayList<>()).add(new Pending(i, reading));
            } catch (ValidationException e) {
                log.warn("Rejected reading #{} of batch: {}", i, e.getMessage());
                failures.add(new PublishBatchResult.FailedReading(i, null, e));
            }
        }

        AtomicInteger published = new AtomicInteger();
        List<CompletableFuture<Void>> groups = new ArrayList<>(byTopic.size());
        byTopic.forEach((topic, group) -> {
            List<String> payloads = new ArrayList<>(group.size());
            for (Pending p : group) payloads.add(JsonUtil.toJson(p.reading()));
            groups.add(broker.publishBatch(topic, payloads).handle((ok, ex) -> {
                if (ex == null) {
                    published.addAndGet(group.size());
                } else {
                    BrokerConnectionException cause = asBrokerFailure(ex);
                    log.warn("Publishing {} readings to {} failed: {}", group.size(), topic, cause.getMessage());
                    for (Pending p : group) {
                        failures.add(new PublishBatchResult.FailedReading(p.index(), p.reading(), cause));
                    }
                }
                return null;
            }));
        });

        return CompletableFuture.allOf(groups.toArray(new CompletableFuture[0])).thenApply(v -> {
            List<PublishBatchResult.FailedReading> failed = new ArrayList<>(failures);
            failed.sort(Comparator.comparingInt(PublishBatchResult.FailedReading::index));
            metrics.readingsPublished(published.get());
            metrics.readingsRejected(failed.size());
            return new PublishBatchResult(published.get(), failed);
        });
    }

    private static BrokerConnectionException asBrokerFailure(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof BrokerConnectionException bce) return bce;
        return new BrokerConnectionException("Publish failed: " + cause.getMessage(), cause);
    }
}
