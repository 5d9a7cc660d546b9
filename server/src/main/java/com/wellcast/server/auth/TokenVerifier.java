/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.auth;

import java.util.concurrent.CompletableFuture;

/**
 * Boundary to the external token issuer. Implementations must not block the
 * calling thread; the future fails with an
 * {@link com.wellcast.common.exception.AuthenticationException} for a rejected token.
 */
public interface TokenVerifier {

    CompletableFuture<AuthenticatedPrincipal> verify(String bearerToken);
}
