package com.example.runbookops.controller;

import com.example.runbookops.domain.ExecutionStatus;
import com.example.runbookops.service.AlertContext;
import com.example.runbookops.service.AlertPayloadParser;
import com.example.runbookops.service.TriggerService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Alert and manual trigger endpoint.
 */
@Slf4j
@RestController
@RequestMapping("/api/trigger")
@RequiredArgsConstructor
public class TriggerController {

    private final AlertPayloadParser parser;
    private final TriggerService triggerService;

    @RequestMapping(method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<Map<String, Object>> trigger(@RequestParam(required = false) String id,
                                                       @RequestBody(required = false) JsonNode body) {
        AlertContext alert = parser.parse(id, body);
        String baseUrl = ServletUriComponentsBuilder.fromCurrentContextPath().toUriString();
        TriggerService.TriggerResult result = triggerService.trigger(alert, baseUrl);

        Map<String, Object> logRef = new LinkedHashMap<>();
        logRef.put("partitionKey", result.getPartitionKey());
        logRef.put("exec_id", result.getExecId());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", result.getStatus().wireValue());
        response.put("schema", result.getSchemaId());
        response.put("response", result.getMessage());
        response.put("log", logRef);
        if (result.getApproval() != null) {
            response.put("approve", result.getApproval().getApprove());
            response.put("reject", result.getApproval().getReject());
            response.put("expires_at", result.getApproval().getExpiresAt());
        }

        HttpStatus code = result.getStatus() == ExecutionStatus.ERROR ? HttpStatus.INTERNAL_SERVER_ERROR : HttpStatus.ACCEPTED;
        return ResponseEntity.status(code).body(response);
    }
}
