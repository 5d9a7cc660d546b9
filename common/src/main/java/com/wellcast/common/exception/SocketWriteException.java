/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.common.exception;

public class SocketWriteException extends WellCastException {
    private final String connectionId;

    public SocketWriteException(String connectionId, Throwable cause) {
        super("WC_SOCKET_WRITE_FAILED", "Write to connection '" + connectionId + "' failed", cause);
        this.connectionId = connectionId;
    }

    public String getConnectionId() { return connectionId; }
}
