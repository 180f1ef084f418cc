package com.example.runbookops.controller;

import com.example.runbookops.exception.ValidationException;
import com.example.runbookops.worker.ActiveRun;
import com.example.runbookops.worker.ExecutionEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Runs active on this worker instance.
 */
@RestController
@RequestMapping("/processes")
@RequiredArgsConstructor
public class ProcessController {

    private final ExecutionEngine engine;
    private final Clock clock;

    @GetMapping
    public ResponseEntity<Map<String, Object>> list(@RequestParam(required = false) String q) {
        String needle = q == null || q.isBlank() ? null : q.trim().toLowerCase(Locale.ROOT);
        List<ActiveRun> runs = engine.activeRuns().stream()
                .filter(r -> needle == null || Stream.of(r.getExecId(), r.getSchemaId(), r.getName(), r.getRunbook())
                        .anyMatch(v -> v != null && v.toLowerCase(Locale.ROOT).contains(needle)))
                .sorted(Comparator.comparing(ActiveRun::getStartedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("time", clock.instant());
        body.put("count", runs.size());
        body.put("runs", runs);
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/stop")
    public ResponseEntity<Map<String, String>> stop(@RequestParam(name = "exec_id", required = false) String execId) {
        if (execId == null || execId.isBlank()) {
            throw new ValidationException("Missing exec_id");
        }
        if (!engine.stop(execId.trim())) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("status", "not_found", "exec_id", execId));
        }
        return ResponseEntity.ok(Map.of("status", "stopped", "exec_id", execId));
    }
}
