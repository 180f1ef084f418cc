package com.example.runbookops.worker;

import com.example.runbookops.config.RunbookOpsProperties;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * Capability, id and queue this instance serves, with defaults filled in.
 */
@Slf4j
@Getter
@Component
public class WorkerIdentity {

    private final String capability;
    private final String workerId;
    private final String queueName;
    private final String region;

    public WorkerIdentity(RunbookOpsProperties properties) {
        RunbookOpsProperties.WorkerConfig worker = properties.getWorker();
        this.capability = blank(worker.getCapability()) ? "local" : worker.getCapability().trim();
        this.workerId = blank(worker.getWorkerId()) ? hostName() : worker.getWorkerId().trim();
        this.queueName = blank(worker.getQueueName()) ? "runbook-jobs-" + capability : worker.getQueueName().trim();
        this.region = blank(worker.getRegion()) ? "" : worker.getRegion().trim();
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String fallback = "worker-" + UUID.randomUUID().toString().substring(0, 8);
            log.warn("Host name unavailable, using worker id {}", fallback);
            return fallback;
        }
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }
}
