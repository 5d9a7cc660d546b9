/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.common.exception;

/**
 * Base exception for all WellCast errors. Carries a stable error code that is
 * surfaced to clients in error frames and REST error bodies.
 */
public class WellCastException extends RuntimeException {
    private final String errorCode;

    public WellCastException(String message) {
        super(message);
        this.errorCode = "WC_GENERIC";
    }

    public WellCastException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public WellCastException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}
