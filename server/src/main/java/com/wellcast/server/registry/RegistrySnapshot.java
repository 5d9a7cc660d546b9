/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.registry;

/**
 * Point-in-time counts taken from a {@link ConnectionRegistry}.
 */
public record RegistrySnapshot(int connections, int tenants, int subscriptions, int subscribedWells) {
}
