/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.common.exception;

/**
 * Transient failure talking to the message broker. The only error class that is
 * retried automatically, and only on the subscribing side.
 */
public class BrokerConnectionException extends WellCastException {
    public BrokerConnectionException(String message) {
        super("WC_BROKER_UNAVAILABLE", message);
    }

    public BrokerConnectionException(String message, Throwable cause) {
        super("WC_BROKER_UNAVAILABLE", message, cause);
    }
}
