package com.costwatch.analysis.health;

import com.costwatch.analysis.monitoring.InMemoryCostRecordSource;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Plain liveness check for load balancers; Actuator stays the detailed view.
 */
@RestController
public class HealthzController {

    private final InMemoryCostRecordSource recordSource;

    public HealthzController(InMemoryCostRecordSource recordSource) {
        this.recordSource = recordSource;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> healthz() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("bufferedRecords", recordSource.size());
        return body;
    }
}
