package com.costguard.anomaly.health;

import com.costguard.anomaly.config.CostGuardProperties;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness check for the detector. Also reports where billing data is read from and where run documents go, so a
 * deployment left on the in-memory fallbacks is visible without reading the startup logs.
 */
@RestController
public class HealthzController {

    private final CostGuardProperties properties;

    public HealthzController(CostGuardProperties properties) {
        this.properties = properties;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> healthz() {
        return Map.of(
                "status", "UP",
                "billingProvider", properties.billing().provider(),
                "reportStore", properties.storage().hasBucket() ? "s3" : "in-memory"
        );
    }
}
