package com.flagship.tip_ledger.health;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated liveness probe: the service is up when the ledger database answers.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;

    public HealthController(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean ledgerReachable = ledgerDatabaseReachable();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", ledgerReachable ? "UP" : "DOWN");
        response.put("ledgerDatabase", ledgerReachable ? "UP" : "DOWN");
        response.put("timestamp", Instant.now().toString());

        return ledgerReachable ? ResponseEntity.ok(response) : ResponseEntity.status(503).body(response);
    }

    private boolean ledgerDatabaseReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            return false;
        }
    }
}
