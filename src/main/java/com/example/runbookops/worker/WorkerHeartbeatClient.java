package com.example.runbookops.worker;

import com.example.runbookops.config.RunbookOpsProperties;
import com.example.runbookops.dispatch.WorkerHeartbeat;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Announces this worker to the orchestrator's registry.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkerHeartbeatClient {

    public static final String SHARED_SECRET_HEADER = "x-runbook-ops-key";
    private static final MediaType JSON = MediaType.get("application/json");

    private final RunbookOpsProperties properties;
    private final WorkerIdentity identity;
    private final ActiveRunRegistry registry;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Scheduled(initialDelay = 0, fixedDelayString = "${runbook-ops.worker.heartbeat-interval-seconds:60}",
            timeUnit = TimeUnit.SECONDS)
    public void beat() {
        if (!properties.getWorker().isEnabled()) {
            return;
        }
        send();
    }

    /**
     * @return true when the orchestrator accepted the heartbeat
     */
    public boolean send() {
        WorkerHeartbeat heartbeat = WorkerHeartbeat.builder()
                .capability(identity.getCapability())
                .workerId(identity.getWorkerId())
                .queue(identity.getQueueName())
                .region(identity.getRegion())
                .load(registry.size())
                .build();
        String url = trimSlash(properties.getWorker().getOrchestratorUrl()) + "/workers/register";
        try {
            String json = objectMapper.writeValueAsString(heartbeat);
            Request request = new Request.Builder()
                    .url(url)
                    .header(SHARED_SECRET_HEADER, properties.getWorkers().getSharedSecret())
                    .post(RequestBody.create(json, JSON))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    log.warn("Heartbeat to {} rejected: HTTP {}", url, response.code());
                    return false;
                }
                log.debug("Heartbeat sent for {}/{}", identity.getCapability(), identity.getWorkerId());
                return true;
            }
        } catch (Exception e) {
            log.warn("Heartbeat to {} failed: {}", url, e.getMessage());
            return false;
        }
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
