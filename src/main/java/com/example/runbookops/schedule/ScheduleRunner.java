package com.example.runbookops.schedule;

import com.example.runbookops.config.RunbookOpsProperties;
import com.example.runbookops.domain.ExecutionStatus;
import com.example.runbookops.domain.ScheduleDefinition;
import com.example.runbookops.message.JobMessage;
import com.example.runbookops.repository.ScheduleDefinitionRepository;
import com.example.runbookops.service.ExecutionLogService;
import com.example.runbookops.service.TriggerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Fires schedules whose cron expression matches the current minute.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduleRunner {

    private final ScheduleDefinitionRepository repository;
    private final TriggerService triggerService;
    private final ExecutionLogService logService;
    private final RunbookOpsProperties properties;

    @Scheduled(cron = "0 * * * * *")
    public void tick() {
        if (!properties.getOrchestrator().isEnabled() || !properties.getOrchestrator().isSchedulesEnabled()) {
            return;
        }
        runDue(logService.now());
    }

    /**
     * Dispatches every enabled schedule due in the minute containing {@code now}.
     *
     * @return the results of the dispatches made
     */
    public List<TriggerService.TriggerResult> runDue(Instant now) {
        ZoneId zone = ZoneId.of(properties.getTimeZone());
        ZonedDateTime minute = now.atZone(zone).truncatedTo(ChronoUnit.MINUTES);
        Instant minuteStart = minute.toInstant();

        List<TriggerService.TriggerResult> results = new ArrayList<>();
        for (ScheduleDefinition schedule : repository.findByEnabledTrue()) {
            if (schedule.getLastRun() != null && !schedule.getLastRun().isBefore(minuteStart)) {
                continue;
            }
            CronExpression cron;
            try {
                cron = CronExpression.parse(schedule.getCron());
            } catch (IllegalArgumentException e) {
                log.warn("Schedule {} has an invalid cron expression: {}", schedule.getId(), e.getMessage());
                continue;
            }
            if (!cron.matchesAnySecondOf(minute)) {
                continue;
            }

            schedule.setLastRun(now);
            repository.save(schedule);
            log.info("Schedule {} ({}) due at {}", schedule.getId(), schedule.getCron(), minute);
            results.add(triggerService.dispatchAndRecord(job(schedule, now), logService.partitionKey(now), now,
                    ExecutionStatus.SCHEDULED));
        }
        return results;
    }

    private JobMessage job(ScheduleDefinition schedule, Instant now) {
        return JobMessage.builder()
                .runbook(schedule.getRunbook())
                .runArgs(schedule.getRunArgs() != null ? schedule.getRunArgs() : "")
                .id(schedule.getId())
                .name(schedule.getName())
                .requestedAt(logService.formatRequestedAt(now))
                .execId(UUID.randomUUID().toString())
                .oncall("false")
                .worker(schedule.getWorker())
                .build();
    }
}
