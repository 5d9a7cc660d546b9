/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.web.controller;

import com.wellcast.common.exception.AuthenticationException;
import com.wellcast.common.exception.BrokerConnectionException;
import com.wellcast.common.exception.ValidationException;
import com.wellcast.server.publisher.PublishBatchResult;
import com.wellcast.server.publisher.PublishBatchResult.FailedReading;
import com.wellcast.server.publisher.ReadingPublisher;
import com.wellcast.web.config.IngestApiKeys;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class IngestionControllerTest {

    private static final String KEY = "adapter-key";

    private final ReadingPublisher publisher = mock(ReadingPublisher.class);
    private final IngestionController controller =
            new IngestionController(publisher, new IngestApiKeys(new String[]{KEY}));

    @Test
    void rejectsMissingApiKeyBeforePublishing() {
        assertThatThrownBy(() -> controller.publish(null, Map.of()))
                .isInstanceOf(AuthenticationException.class);
        assertThatThrownBy(() -> controller.publishBatch("wrong", List.of()))
                .isInstanceOf(AuthenticationException.class);
        verifyNoInteractions(publisher);
    }

    @Test
    void singleReadingIsAccepted() {
        when(publisher.publish(anyMap())).thenReturn(CompletableFuture.completedFuture(null));

        ResponseEntity<Map<String, Object>> response = controller.publish(KEY, Map.of("well_id", "W1")).join();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
    }

    @Test
    void partialBatchReportsFailuresByIndex() {
        ValidationException invalid = new ValidationException("well_id", "required field is missing");
        when(publisher.publishCandidates(anyList())).thenReturn(CompletableFuture.completedFuture(
                new PublishBatchResult(2, List.of(new FailedReading(1, null, invalid)))));

        ResponseEntity<Map<String, Object>> response =
                controller.publishBatch(KEY, List.of(Map.of(), Map.of(), Map.of())).join();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(response.getBody()).containsEntry("published", 2);
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> failed = (List<Map<String, Object>>) response.getBody().get("failed");
        assertThat(failed).singleElement().satisfies(f -> {
            assertThat(f).containsEntry("index", 1);
            assertThat(f).containsEntry("code", "WC_VALIDATION_FAILED");
        });
    }

    @Test
    void batchLostToBrokerIsServiceUnavailable() {
        BrokerConnectionException down = new BrokerConnectionException("Broker not connected");
        when(publisher.publishCandidates(anyList())).thenReturn(CompletableFuture.completedFuture(
                new PublishBatchResult(0, List.of(new FailedReading(0, null, down)))));

        ResponseEntity<Map<String, Object>> response = controller.publishBatch(KEY, List.of(Map.of())).join();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void batchOfOnlyInvalidReadingsIsStillAccepted() {
        ValidationException invalid = new ValidationException("value", "must be finite");
        when(publisher.publishCandidates(anyList())).thenReturn(CompletableFuture.completedFuture(
                new PublishBatchResult(0, List.of(new FailedReading(0, null, invalid)))));

        ResponseEntity<Map<String, Object>> response = controller.publishBatch(KEY, List.of(Map.of())).join();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
    }
}
