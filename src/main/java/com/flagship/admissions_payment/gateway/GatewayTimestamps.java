package com.flagship.admissions_payment.gateway;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Parses the ISO-8601 timestamps the gateway sends ("2024-05-01T10:15:30.000Z",
 * "2024-05-01T10:15:30+01:00").
 */
public final class GatewayTimestamps {

    private GatewayTimestamps() {
    }

    /**
     * @return the instant, or null when the value is absent or unparseable
     */
    public static Instant parse(String value) {
        if (value == null || value.isBlank() || "null".equals(value)) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
