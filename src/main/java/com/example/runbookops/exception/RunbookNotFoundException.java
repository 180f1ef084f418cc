package com.example.runbookops.exception;

import org.springframework.http.HttpStatus;

/**
 * Every script source was tried and none returned the runbook.
 */
public class RunbookNotFoundException extends RunbookOpsException {

    public RunbookNotFoundException(String runbook) {
        super(HttpStatus.NOT_FOUND, "Runbook not found in any source: " + runbook);
    }
}
