/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.web.websocket;

import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Copies the bearer token from the upgrade request into the session
 * attributes. The token is not checked here: the upgrade always proceeds so
 * the gateway can reject a bad token with an AUTH_FAILED frame.
 *
 * <p>Browsers cannot set headers on a WebSocket upgrade, so the
 * {@code token} and {@code access_token} query parameters are accepted as
 * well. The header wins when both are present.</p>
 */
public class BearerTokenHandshakeInterceptor implements HandshakeInterceptor {

    public static final String TOKEN_ATTRIBUTE = "wellcast.bearerToken";

    private static final String BEARER_PREFIX = "Bearer ";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String token = extractToken(request.getHeaders(), request.getURI());
        if (token != null) {
            attributes.put(TOKEN_ATTRIBUTE, token);
        }
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
    }

    /** @return the raw token, or null when the request carries none */
    public static String extractToken(HttpHeaders headers, URI uri) {
        String authorization = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) return token;
        }
        if (uri == null) return null;
        MultiValueMap<String, String> params = UriComponentsBuilder.fromUri(uri).build().getQueryParams();
        for (String name : new String[]{"token", "access_token"}) {
            String raw = params.getFirst(name);
            if (raw == null) continue;
            String value = UriUtils.decode(raw, StandardCharsets.UTF_8).trim();
            if (!value.isEmpty()) return value;
        }
        return null;
    }
}
