package com.example.runbookops.approval;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Encoded payload {@code p} and its hex signature {@code s}, as they appear in approval URLs.
 */
@Data
@AllArgsConstructor
public class SignedApprovalToken {
    private String payload;
    private String signature;
}
