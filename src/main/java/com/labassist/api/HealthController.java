package com.labassist.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Slf4j
public class HealthController {

    static final String NAME = "Agentic Lab Assistant";
    static final String VERSION = "0.1.0";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public HealthController(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @GetMapping("/")
    public Map<String, String> root() {
        Map<String, String> info = new LinkedHashMap<>();
        info.put("name", NAME);
        info.put("version", VERSION);
        info.put("requests", "/requests");
        info.put("health", "/health");
        return info;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        Map<String, String> services = new LinkedHashMap<>();
        services.put("database", checkDatabase());
        boolean healthy = services.values().stream().allMatch("healthy"::equals);
        return new HealthResponse(healthy ? "healthy" : "degraded", OffsetDateTime.now(clock), services);
    }

    private String checkDatabase() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return "healthy";
        } catch (RuntimeException ex) {
            log.warn("Database health check failed: {}", ex.getMessage());
            return "unhealthy";
        }
    }
}
