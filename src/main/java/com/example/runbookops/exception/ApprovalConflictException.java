package com.example.runbookops.exception;

import org.springframework.http.HttpStatus;

public class ApprovalConflictException extends RunbookOpsException {

    public ApprovalConflictException(String execId) {
        super(HttpStatus.CONFLICT, "Already decided or executed for this ExecId: " + execId);
    }
}
