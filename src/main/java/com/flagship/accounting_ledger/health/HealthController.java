package com.flagship.accounting_ledger.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Readiness for load balancers. The ledger can serve requests only when its
 * database answers; Redis and Kafka outages are visible under /actuator/health
 * but do not take the service out of rotation.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectProvider<Flyway> flyway;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean databaseUp = databaseAnswers();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", databaseUp ? "UP" : "DOWN");
        body.put("database", databaseUp ? "UP" : "DOWN");
        if (databaseUp) {
            body.put("schemaVersion", schemaVersion());
        }
        body.put("timestamp", clock.instant().toString());

        return ResponseEntity.status(databaseUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private boolean databaseAnswers() {
        try {
            Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return one != null && one == 1;
        } catch (DataAccessException e) {
            log.warn("Ledger database unavailable: {}", e.getMessage());
            return false;
        }
    }

    private String schemaVersion() {
        Flyway migrations = flyway.getIfAvailable();
        if (migrations == null) {
            return "unknown";
        }
        MigrationInfo current = migrations.info().current();
        return current != null ? current.getVersion().getVersion() : "none";
    }
}
