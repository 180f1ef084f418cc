package com.example.runbookops.controller;

import com.example.runbookops.dispatch.WorkerHeartbeat;
import com.example.runbookops.dispatch.WorkerRegistryService;
import com.example.runbookops.domain.WorkerRegistration;
import com.example.runbookops.exception.UnauthorizedException;
import com.example.runbookops.worker.WorkerHeartbeatClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = WorkerController.class)
@Import(FixedClockConfig.class)
class WorkerControllerTest {

    private static final String HEARTBEAT = "{\"capability\":\"aks\",\"worker_id\":\"w-1\",\"queue\":\"runbook-jobs-aks\",\"load\":2}";

    @Autowired
    MockMvc mvc;

    @MockBean
    WorkerRegistryService registryService;

    @Test
    void heartbeatWithKeyRegistersTheWorker() throws Exception {
        WorkerRegistration registration = WorkerRegistration.builder()
                .capability("aks").workerId("w-1").queueName("runbook-jobs-aks")
                .lastSeen(Instant.parse("2026-03-04T10:00:00Z")).load(2).build();
        when(registryService.register(eq("secret"), argThat((WorkerHeartbeat h) ->
                "w-1".equals(h.getWorkerId()) && "runbook-jobs-aks".equals(h.getQueue()))))
                .thenReturn(registration);

        mvc.perform(post("/workers/register")
                        .header(WorkerHeartbeatClient.SHARED_SECRET_HEADER, "secret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(HEARTBEAT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.worker_id").value("w-1"))
                .andExpect(jsonPath("$.queue").value("runbook-jobs-aks"));
    }

    @Test
    void heartbeatWithoutKeyIsUnauthorized() throws Exception {
        when(registryService.register(isNull(), any())).thenThrow(new UnauthorizedException("Unauthorized"));

        mvc.perform(post("/workers/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(HEARTBEAT))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void listsRegistrations() throws Exception {
        when(registryService.listAll()).thenReturn(List.of(WorkerRegistration.builder()
                .capability("aks").workerId("w-1").queueName("runbook-jobs-aks").build()));

        mvc.perform(get("/workers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].workerId").value("w-1"));
    }
}
