/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.publisher;

import com.wellcast.common.exception.WellCastException;
import com.wellcast.common.model.Reading;

import java.util.List;

/**
 * Outcome of {@link ReadingPublisher#publishBatch}: how many readings reached the
 * broker, and every one that did not, with its position in the input and cause.
 */
public record PublishBatchResult(int published, List<FailedReading> failed) {

    public PublishBatchResult {
        failed = List.copyOf(failed);
    }

    public boolean isComplete() { return failed.isEmpty(); }

    public int total() { return published + failed.size(); }

    /**
     * @param reading the validated reading, or null when validation itself failed
     */
    public record FailedReading(int index, Reading reading, WellCastException cause) {}
}
