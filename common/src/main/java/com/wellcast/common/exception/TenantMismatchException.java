/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.common.exception;

public class TenantMismatchException extends WellCastException {
    private final String topicTenant;
    private final String payloadTenant;

    public TenantMismatchException(String topic, String topicTenant, String payloadTenant) {
        super("WC_TENANT_MISMATCH",
              "Payload tenant '" + payloadTenant + "' does not match topic '" + topic + "'");
        this.topicTenant = topicTenant;
        this.payloadTenant = payloadTenant;
    }

    public String getTopicTenant() { return topicTenant; }
    public String getPayloadTenant() { return payloadTenant; }
}
