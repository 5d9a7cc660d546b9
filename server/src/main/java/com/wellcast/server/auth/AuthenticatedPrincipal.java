/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.auth;

/**
 * Identity established by a verified bearer token. Becomes the immutable
 * identity of a client connection.
 */
public record AuthenticatedPrincipal(String tenantId, String userId, String role) {
}
