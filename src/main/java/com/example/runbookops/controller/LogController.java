package com.example.runbookops.controller;

import com.example.runbookops.domain.ExecutionRecord;
import com.example.runbookops.exception.NotFoundException;
import com.example.runbookops.service.ExecutionLogService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read access to the execution log.
 */
@RestController
@RequestMapping("/logs")
@RequiredArgsConstructor
public class LogController {

    private final ExecutionLogService logService;

    @GetMapping("/query")
    public ResponseEntity<Map<String, Object>> query(@RequestParam(required = false) String partitionKey,
                                                     @RequestParam(required = false) String execId,
                                                     @RequestParam(required = false) String status,
                                                     @RequestParam(required = false) String q,
                                                     @RequestParam(required = false) String from,
                                                     @RequestParam(required = false) String to,
                                                     @RequestParam(required = false) String order,
                                                     @RequestParam(required = false) Integer limit) {
        List<ExecutionRecord> rows = logService.query(ExecutionLogService.LogQuery.builder()
                .partitionKey(partitionKey)
                .execId(execId)
                .status(status)
                .q(q)
                .from(from)
                .to(to)
                .order(order)
                .limit(limit)
                .build());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("partitionKey", partitionKey.trim());
        body.put("count", rows.size());
        body.put("items", rows);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{partitionKey}/{execId}")
    public ResponseEntity<List<ExecutionRecord>> execution(@PathVariable String partitionKey,
                                                           @PathVariable String execId) {
        List<ExecutionRecord> rows = logService.findExecution(partitionKey, execId);
        if (rows.isEmpty()) {
            throw new NotFoundException("No log entries for " + execId + " in " + partitionKey);
        }
        return ResponseEntity.ok(rows);
    }
}
