package com.example.runbookops.controller;

import com.example.runbookops.approval.ApprovalDecision;
import com.example.runbookops.approval.ApprovalGateService;
import com.example.runbookops.domain.ExecutionStatus;
import com.example.runbookops.exception.ApprovalConflictException;
import com.example.runbookops.exception.InvalidApprovalTokenException;
import com.example.runbookops.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = ApprovalController.class)
@Import(FixedClockConfig.class)
class ApprovalControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    ApprovalGateService approvalGate;

    @Test
    void approvePassesApproverAndRendersPage() throws Exception {
        when(approvalGate.approve("20260304", "exec-1", "payload", "sig", "alice@example.com"))
                .thenReturn(new ApprovalDecision("exec-1", "restart-api", ExecutionStatus.ACCEPTED,
                        "alice@example.com", "Approved by alice@example.com; dispatched to worker <w-1>"));

        mvc.perform(get("/approvals/20260304/exec-1/approve")
                        .param("p", "payload")
                        .param("s", "sig")
                        .header(ApprovalController.APPROVER_HEADER, "alice@example.com"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/html"))
                .andExpect(content().string(containsString("&lt;w-1&gt;")))
                .andExpect(content().string(not(containsString("<w-1>"))));
    }

    @Test
    void secondDecisionIsAConflict() throws Exception {
        when(approvalGate.approve(eq("20260304"), eq("exec-1"), any(), any(), isNull()))
                .thenThrow(new ApprovalConflictException("exec-1"));

        mvc.perform(get("/approvals/20260304/exec-1/approve").param("p", "payload").param("s", "sig"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value(409));
    }

    @Test
    void tamperedLinkIsUnauthorized() throws Exception {
        when(approvalGate.reject(eq("20260304"), eq("exec-1"), any(), any(), isNull()))
                .thenThrow(new InvalidApprovalTokenException());

        mvc.perform(get("/approvals/20260304/exec-1/reject").param("p", "payload").param("s", "forged"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value(InvalidApprovalTokenException.MESSAGE));
    }

    @Test
    void missingParametersAreABadRequest() throws Exception {
        when(approvalGate.reject(eq("20260304"), eq("exec-1"), isNull(), isNull(), isNull()))
                .thenThrow(new ValidationException("Missing approval parameters p and s"));

        mvc.perform(get("/approvals/20260304/exec-1/reject"))
                .andExpect(status().isBadRequest());
    }
}
