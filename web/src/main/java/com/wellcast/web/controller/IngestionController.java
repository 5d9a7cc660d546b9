/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.web.controller;

import com.wellcast.common.exception.AuthenticationException;
import com.wellcast.common.exception.BrokerConnectionException;
import com.wellcast.server.publisher.PublishBatchResult;
import com.wellcast.server.publisher.ReadingPublisher;
import com.wellcast.web.config.IngestApiKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Ingestion endpoints used by protocol adapters (Modbus, OPC-UA, ...) to push
 * readings into the pipeline. Callers authenticate with an {@code X-API-Key}.
 */
@RestController
@RequestMapping("/api/v1/readings")
public class IngestionController {

    private static final Logger log = LoggerFactory.getLogger(IngestionController.class);

    private final ReadingPublisher publisher;
    private final IngestApiKeys apiKeys;

    public IngestionController(ReadingPublisher publisher, IngestApiKeys apiKeys) {
        this.publisher = publisher;
        this.apiKeys = apiKeys;
    }

    /** POST /api/v1/readings - validate and publish one reading. */
    @PostMapping
    public CompletableFuture<ResponseEntity<Map<String, Object>>> publish(
            @RequestHeader(value = IngestApiKeys.HEADER, required = false) String apiKey,
            @RequestBody Map<String, Object> reading) {
        requireApiKey(apiKey);
        return publisher.publish(reading)
                .thenApply(ok -> ResponseEntity.status(HttpStatus.ACCEPTED)
                        .body(Map.<String, Object>of("status", "accepted")));
    }

    /**
     * POST /api/v1/readings/batch - publish an array of readings. Invalid
     * entries are reported by index; the rest are still published.
     */
    @PostMapping("/batch")
    public CompletableFuture<ResponseEntity<Map<String, Object>>> publishBatch(
            @RequestHeader(value = IngestApiKeys.HEADER, required = false) String apiKey,
            @RequestBody List<Map<String, Object>> readings) {
        requireApiKey(apiKey);
        return publisher.publishCandidates(readings).thenApply(this::toResponse);
    }

    private ResponseEntity<Map<String, Object>> toResponse(PublishBatchResult result) {
        List<Map<String, Object>> failed = new ArrayList<>(result.failed().size());
        boolean brokerDown = false;
        for (PublishBatchResult.FailedReading f : result.failed()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("index", f.index());
            entry.put("code", f.cause().getErrorCode());
            entry.put("message", f.cause().getMessage());
            failed.add(entry);
            brokerDown |= f.cause() instanceof BrokerConnectionException;
        }
        if (!result.isComplete()) {
            log.info("Batch of {} published {} reading(s), {} failed",
                    result.total(), result.published(), failed.size());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("published", result.published());
        body.put("failed", failed);
        // nothing got through and the broker is at least partly to blame
        HttpStatus status = result.published() == 0 && brokerDown
                ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status).body(body);
    }

    private void requireApiKey(String apiKey) {
        if (!apiKeys.isValid(apiKey)) {
            throw new AuthenticationException("Missing or invalid " + IngestApiKeys.HEADER);
        }
    }
}
