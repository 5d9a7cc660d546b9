/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.web.config;

import com.wellcast.web.websocket.BearerTokenHandshakeInterceptor;
import com.wellcast.web.websocket.ReadingWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String READINGS_PATH = "/ws/readings";

    private final ReadingWebSocketHandler readingWebSocketHandler;

    @Value("${wellcast.gateway.allowed-origins:*}")
    private String[] allowedOrigins;

    public WebSocketConfig(ReadingWebSocketHandler readingWebSocketHandler) {
        this.readingWebSocketHandler = readingWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(readingWebSocketHandler, READINGS_PATH)
                .addInterceptors(new BearerTokenHandshakeInterceptor())
                .setAllowedOriginPatterns(allowedOrigins);
    }
}
