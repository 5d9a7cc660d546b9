/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.client.transport;

import java.util.concurrent.CompletableFuture;

public interface TransportSession {

    CompletableFuture<Void> send(String text);

    void close();
}
