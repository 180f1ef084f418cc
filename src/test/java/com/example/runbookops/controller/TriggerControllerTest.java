package com.example.runbookops.controller;

import com.example.runbookops.approval.ApprovalTicket;
import com.example.runbookops.domain.ExecutionStatus;
import com.example.runbookops.exception.SchemaNotFoundException;
import com.example.runbookops.service.AlertContext;
import com.example.runbookops.service.AlertPayloadParser;
import com.example.runbookops.service.TriggerService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = TriggerController.class)
@Import({AlertPayloadParser.class, FixedClockConfig.class})
class TriggerControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    TriggerService triggerService;

    @Test
    void acceptedTriggerReturns202WithLogReference() throws Exception {
        when(triggerService.trigger(any(AlertContext.class), eq("http://localhost"))).thenReturn(
                new TriggerService.TriggerResult(ExecutionStatus.ACCEPTED, "exec-1", "20260304", "restart-api",
                        "Dispatched to worker w-1 (runbook-jobs-aks)", null));

        mvc.perform(post("/api/trigger")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"alertId\":\"restart-api\",\"severity\":\"Sev2\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("accepted"))
                .andExpect(jsonPath("$.schema").value("restart-api"))
                .andExpect(jsonPath("$.log.partitionKey").value("20260304"))
                .andExpect(jsonPath("$.log.exec_id").value("exec-1"))
                .andExpect(jsonPath("$.approve").doesNotExist());

        ArgumentCaptor<AlertContext> alert = ArgumentCaptor.forClass(AlertContext.class);
        verify(triggerService).trigger(alert.capture(), eq("http://localhost"));
        assertEquals("restart-api", alert.getValue().getSchemaId());
        assertEquals("Sev2", alert.getValue().getSeverity());
    }

    @Test
    void pendingApprovalReturnsDecisionLinks() throws Exception {
        ApprovalTicket ticket = ApprovalTicket.builder()
                .execId("exec-2")
                .partitionKey("20260304")
                .approve("http://localhost/approvals/20260304/exec-2/approve?p=x&s=y")
                .reject("http://localhost/approvals/20260304/exec-2/reject?p=x&s=y")
                .expiresAt(Instant.parse("2026-03-04T11:00:00Z"))
                .build();
        when(triggerService.trigger(any(AlertContext.class), any())).thenReturn(
                new TriggerService.TriggerResult(ExecutionStatus.PENDING, "exec-2", "20260304", "restart-api",
                        "Job is pending approval", ticket));

        mvc.perform(get("/api/trigger").param("id", "restart-api"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.approve").value(ticket.getApprove()))
                .andExpect(jsonPath("$.reject").value(ticket.getReject()))
                .andExpect(jsonPath("$.expires_at").exists());
    }

    @Test
    void dispatchErrorReturns500() throws Exception {
        when(triggerService.trigger(any(AlertContext.class), any())).thenReturn(
                new TriggerService.TriggerResult(ExecutionStatus.ERROR, "exec-3", "20260304", "restart-api",
                        "No worker available for capability aks", null));

        mvc.perform(get("/api/trigger").param("id", "restart-api"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.response").value("No worker available for capability aks"));
    }

    @Test
    void unknownSchemaIsNotFound() throws Exception {
        when(triggerService.trigger(any(AlertContext.class), any())).thenThrow(new SchemaNotFoundException("nope"));

        mvc.perform(get("/api/trigger").param("id", "nope"))
                .andExpect(status().isNotFound());
    }
}
