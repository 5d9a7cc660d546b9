/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.client.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Opens sessions to the gateway. Each call produces a fresh session; the future
 * fails if the connection cannot be established.
 */
public interface ClientTransport {

    CompletableFuture<TransportSession> connect(TransportListener listener);
}
