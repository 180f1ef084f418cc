package com.example.runbookops.controller;

import com.example.runbookops.config.RunbookOpsProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final RunbookOpsProperties properties;
    private final Clock clock;

    @GetMapping("/healthz")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("time", clock.instant());
        body.put("service", properties.getServiceName());
        return ResponseEntity.ok(body);
    }
}
