package com.example.runbookops.dispatch;

import com.example.runbookops.config.RunbookOpsProperties;
import com.example.runbookops.domain.WorkerRegistration;
import com.example.runbookops.exception.UnauthorizedException;
import com.example.runbookops.exception.ValidationException;
import com.example.runbookops.repository.WorkerRegistrationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class WorkerRegistryServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private WorkerRegistrationRepository repository;

    private RunbookOpsProperties properties;

    @BeforeEach
    void setUp() {
        properties = new RunbookOpsProperties();
        properties.getWorkers().setSharedSecret("worker-key");
    }

    private WorkerRegistryService serviceAt(Instant instant) {
        return new WorkerRegistryService(repository, properties, Clock.fixed(instant, ZoneOffset.UTC));
    }

    private static WorkerHeartbeat heartbeat(String id) {
        return WorkerHeartbeat.builder().capability("aks").workerId(id).queue("jobs-" + id).region("westeurope").build();
    }

    @Test
    void heartbeatUpsertsLastSeen() {
        serviceAt(NOW).register("worker-key", heartbeat("w1"));
        serviceAt(NOW.plusSeconds(45)).register("worker-key", heartbeat("w1"));

        List<WorkerRegistration> all = repository.findAll();
        assertEquals(1, all.size());
        assertEquals(NOW.plusSeconds(45), all.get(0).getLastSeen());
        assertEquals("jobs-w1", all.get(0).getQueueName());
    }

    @Test
    void wrongOrMissingKeyIsRejected() {
        assertThrows(UnauthorizedException.class, () -> serviceAt(NOW).register("nope", heartbeat("w1")));
        assertThrows(UnauthorizedException.class, () -> serviceAt(NOW).register(null, heartbeat("w1")));
        assertEquals(0, repository.count());
    }

    @Test
    void unconfiguredSecretRejectsEveryone() {
        properties.getWorkers().setSharedSecret("");

        assertThrows(UnauthorizedException.class, () -> serviceAt(NOW).register("", heartbeat("w1")));
    }

    @Test
    void missingFieldsAreBadRequest() {
        WorkerHeartbeat noQueue = WorkerHeartbeat.builder().capability("aks").workerId("w1").build();

        assertThrows(ValidationException.class, () -> serviceAt(NOW).register("worker-key", noQueue));
        assertThrows(ValidationException.class, () -> serviceAt(NOW).register("worker-key", null));
    }

    @Test
    void garbageCollectionRemovesOnlyWorkersPastTheLivenessWindow() {
        serviceAt(NOW.minus(Duration.ofMinutes(6))).register("worker-key", heartbeat("gone"));
        serviceAt(NOW.minus(Duration.ofMinutes(4))).register("worker-key", heartbeat("quiet"));
        serviceAt(NOW).register("worker-key", heartbeat("live"));

        int removed = serviceAt(NOW).collectStaleWorkers();

        assertEquals(1, removed);
        assertEquals(List.of("live", "quiet"),
                repository.findAll().stream().map(WorkerRegistration::getWorkerId).sorted().toList());
    }
}
