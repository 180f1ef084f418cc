package com.example.runbookops.approval;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Payload embedded in approve/reject links. Never persisted; its integrity comes from the signature.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApprovalToken {

    private String execId;

    private String schemaId;

    /** Expiry as an ISO-8601 instant. */
    private String exp;

    @Builder.Default
    private Map<String, String> resourceInfo = new HashMap<>();

    @Builder.Default
    private Map<String, String> routingInfo = new HashMap<>();

    private String monitorCondition;

    private String severity;

    /** Capability the approver saw; the approved job is dispatched there. */
    private String workerCapability;

    /** Partition of the pending record. Links replayed against another partition are refused. */
    private String callbackKey;

    /** Requested-at stamp of the pending record, reused by the decision records. */
    private String requestedAt;
}
