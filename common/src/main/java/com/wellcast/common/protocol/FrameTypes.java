/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.common.protocol;

/**
 * Frame type names and error codes of the client WebSocket protocol.
 */
public final class FrameTypes {

    // client -> server
    public static final String SUBSCRIBE_WELL = "subscribe-well";
    public static final String UNSUBSCRIBE_WELL = "unsubscribe-well";
    public static final String PING = "ping";

    // server -> client
    public static final String CONNECTED = "connected";
    public static final String SUBSCRIBED = "subscribed";
    public static final String UNSUBSCRIBED = "unsubscribed";
    public static final String READING = "reading";
    public static final String ERROR = "error";
    public static final String PONG = "pong";

    // error codes carried in error frames
    public static final String AUTH_FAILED = "AUTH_FAILED";
    public static final String NOT_ACTIVE = "NOT_ACTIVE";
    public static final String INVALID_FRAME = "INVALID_FRAME";

    private FrameTypes() {}
}
