package com.example.runbookops.controller;

import com.example.runbookops.approval.ApprovalDecision;
import com.example.runbookops.approval.ApprovalGateService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.HtmlUtils;

/**
 * Targets of the signed approve/reject links.
 */
@RestController
@RequestMapping("/approvals/{partitionKey}/{execId}")
@RequiredArgsConstructor
public class ApprovalController {

    public static final String APPROVER_HEADER = "X-Approver";

    private final ApprovalGateService approvalGate;

    @GetMapping("/approve")
    public ResponseEntity<String> approve(@PathVariable String partitionKey,
                                         @PathVariable String execId,
                                         @RequestParam(required = false) String p,
                                         @RequestParam(required = false) String s,
                                         @RequestHeader(value = APPROVER_HEADER, required = false) String approver) {
        return page("Approved", approvalGate.approve(partitionKey, execId, p, s, approver));
    }

    @GetMapping("/reject")
    public ResponseEntity<String> reject(@PathVariable String partitionKey,
                                        @PathVariable String execId,
                                        @RequestParam(required = false) String p,
                                        @RequestParam(required = false) String s,
                                        @RequestHeader(value = APPROVER_HEADER, required = false) String approver) {
        return page("Rejected", approvalGate.reject(partitionKey, execId, p, s, approver));
    }

    private static ResponseEntity<String> page(String title, ApprovalDecision decision) {
        String html = "<!doctype html><html><head><meta charset=\"utf-8\"><title>" + title + "</title></head>"
                + "<body><h2>" + title + "</h2>"
                + "<p>Execution <code>" + HtmlUtils.htmlEscape(decision.getExecId()) + "</code>"
                + " for schema <code>" + HtmlUtils.htmlEscape(String.valueOf(decision.getSchemaId())) + "</code></p>"
                + "<p>" + HtmlUtils.htmlEscape(decision.getMessage()) + "</p>"
                + "</body></html>";
        return ResponseEntity.ok().contentType(MediaType.TEXT_HTML).body(html);
    }
}
