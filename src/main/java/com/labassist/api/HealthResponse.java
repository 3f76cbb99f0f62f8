package com.labassist.api;

import java.time.OffsetDateTime;
import java.util.Map;

public record HealthResponse(
        String status,
        OffsetDateTime timestamp,
        Map<String, String> services
) {
}
