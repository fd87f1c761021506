package com.flagship.shipping_workflow.health;

import com.flagship.shipping_workflow.config.WorkflowProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Load balancer health check. A user can only talk to the bot while sessions can be
 * read and written, so this checks the session store and nothing else.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final WorkflowProperties properties;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        WorkflowProperties.StoreType store = properties.getSession().getStore();
        boolean sessionsUp = store == WorkflowProperties.StoreType.MEMORY || databaseReachable();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", sessionsUp ? "UP" : "DOWN");
        body.put("sessionStore", store.name().toLowerCase());
        body.put("sessionTtlSeconds", properties.getSession().getTtl().getSeconds());
        body.put("timestamp", clock.instant().toString());

        return ResponseEntity.status(sessionsUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private boolean databaseReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            return false;
        }
    }
}
