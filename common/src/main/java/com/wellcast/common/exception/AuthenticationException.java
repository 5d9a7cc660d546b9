/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.common.exception;

public class AuthenticationException extends WellCastException {
    public AuthenticationException(String message) {
        super("WC_AUTH_FAILED", message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super("WC_AUTH_FAILED", message, cause);
    }
}
