package com.example.runbookops.controller;

import com.example.runbookops.dispatch.WorkerHeartbeat;
import com.example.runbookops.dispatch.WorkerRegistryService;
import com.example.runbookops.domain.WorkerRegistration;
import com.example.runbookops.worker.WorkerHeartbeatClient;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Worker registry: heartbeats in, current registrations out.
 */
@RestController
@RequestMapping("/workers")
@RequiredArgsConstructor
public class WorkerController {

    private final WorkerRegistryService registryService;

    @PostMapping("/register")
    public ResponseEntity<Map<String, Object>> register(
            @RequestHeader(value = WorkerHeartbeatClient.SHARED_SECRET_HEADER, required = false) String key,
            @RequestBody(required = false) WorkerHeartbeat heartbeat) {
        WorkerRegistration registration = registryService.register(key, heartbeat);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("capability", registration.getCapability());
        body.put("worker_id", registration.getWorkerId());
        body.put("queue", registration.getQueueName());
        body.put("lastSeen", registration.getLastSeen());
        return ResponseEntity.ok(body);
    }

    @GetMapping
    public ResponseEntity<List<WorkerRegistration>> list() {
        return ResponseEntity.ok(registryService.listAll());
    }
}
