package com.example.runbookops.approval;

import com.example.runbookops.domain.ExecutionStatus;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ApprovalDecision {
    private String execId;
    private String schemaId;
    private ExecutionStatus status;
    private String decidedBy;
    private String message;
}
