package com.costwatch.anomaly.controller;

import com.costwatch.anomaly.repository.DailyCostRepository;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated liveness endpoint. {@code hasData=false} means ingestion has not
 * loaded any cost rows yet, so every detection run will come back empty.
 */
@RestController
public class HealthzController {

    private final DailyCostRepository repository;

    public HealthzController(DailyCostRepository repository) {
        this.repository = repository;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> healthz() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("store", repository.storeType());
        body.put("hasData", repository.hasData());
        return body;
    }
}
