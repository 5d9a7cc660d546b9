/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.common.exception;

/**
 * A candidate reading failed validation. {@link #getField()} names the first failing field.
 */
public class ValidationException extends WellCastException {
    private final String field;

    public ValidationException(String field, String message) {
        super("WC_VALIDATION_FAILED", "Invalid field '" + field + "': " + message);
        this.field = field;
    }

    public String getField() { return field; }
}
