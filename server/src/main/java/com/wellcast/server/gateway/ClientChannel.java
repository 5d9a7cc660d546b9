/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.gateway;

import java.io.IOException;

/**
 * The gateway's handle on one client socket. Implementations must allow
 * {@link #send} from several threads at once.
 */
public interface ClientChannel {

    void send(String frame) throws IOException;

    /** Transport-level ping; the peer answers with a pong. */
    void sendPing() throws IOException;

    /** Close the socket, discarding anything still buffered. Safe to call twice. */
    void close(CloseReason reason);

    boolean isOpen();

    String remoteAddress();
}
