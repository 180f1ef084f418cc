package com.example.runbookops.approval;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result of opening an approval: where to approve or reject, and until when.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalTicket {

    @JsonProperty("exec_id")
    private String execId;

    private String partitionKey;

    private String approve;

    private String reject;

    @JsonProperty("expires_at")
    private Instant expiresAt;
}
