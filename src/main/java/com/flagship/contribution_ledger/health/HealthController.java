package com.flagship.contribution_ledger.health;

import com.flagship.contribution_ledger.storage.StorageHandle;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain liveness endpoint reporting whether the ledger file answers a trivial query.
 * Unlike the Actuator health endpoint, this does not require authorization.
 */
@RestController
public class HealthController {

    private final StorageHandle storageHandle;

    public HealthController(StorageHandle storageHandle) {
        this.storageHandle = storageHandle;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean storageHealthy = storageHandle.isHealthy();
        response.put("storage", storageHealthy ? "UP" : "DOWN");
        response.put("database", storageHandle.getDatabasePath().toString());

        if (!storageHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }
}
