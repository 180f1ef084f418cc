package com.example.runbookops.service;

import com.example.runbookops.config.RunbookOpsProperties;
import com.example.runbookops.domain.ExecutionRecord;
import com.example.runbookops.domain.ExecutionStatus;
import com.example.runbookops.exception.ValidationException;
import com.example.runbookops.repository.ExecutionRecordRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Append-only execution log, partitioned by day.
 */
@Slf4j
@Service
public class ExecutionLogService {

    private static final DateTimeFormatter PARTITION = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter REQUESTED_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ExecutionRecordRepository repository;
    private final RunbookOpsProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final ZoneId zone;

    public ExecutionLogService(ExecutionRecordRepository repository, RunbookOpsProperties properties,
                               MeterRegistry meterRegistry, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.zone = ZoneId.of(properties.getTimeZone());
    }

    public Instant now() {
        return clock.instant();
    }

    public String partitionKey(Instant instant) {
        return PARTITION.format(instant.atZone(zone));
    }

    public String todayPartitionKey() {
        return partitionKey(now());
    }

    public String formatRequestedAt(Instant instant) {
        return REQUESTED_AT.format(instant.atZone(zone));
    }

    /**
     * Parses a {@code yyyy-MM-dd HH:mm:ss} stamp or an ISO instant; falls back to now.
     */
    public Instant parseRequestedAt(String value) {
        if (value == null || value.isBlank()) return now();
        try {
            return LocalDateTime.parse(value.trim(), REQUESTED_AT).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(value.trim());
            } catch (DateTimeParseException ignored) {
                log.debug("Unparsable requestedAt '{}', using now", value);
                return now();
            }
        }
    }

    /**
     * Appends a record. The row key defaults to a random UUID and the log is truncated to the table cap.
     */
    public ExecutionRecord append(ExecutionRecord record) {
        if (record.getRowKey() == null) {
            record.setRowKey(UUID.randomUUID().toString());
        }
        if (record.getPartitionKey() == null) {
            record.setPartitionKey(todayPartitionKey());
        }
        if (record.getRequestedAt() == null) {
            record.setRequestedAt(now());
        }
        record.setId(null);
        record.setRecordedAt(now());
        record.setLog(truncate(record.getLog(), properties.getLogs().getMaxTableChars()));
        ExecutionRecord saved = repository.save(record);
        meterRegistry.counter("runbook_ops.executions", "status", record.getStatus().wireValue()).increment();
        log.info("[{}] Recorded status {} in partition {}", record.getExecId(),
                record.getStatus().wireValue(), record.getPartitionKey());
        return saved;
    }

    /**
     * True unless some row for {@code execId} in the partition carries a status other than pending.
     */
    public boolean onlyPending(String partitionKey, String execId) {
        return repository.findByPartitionKeyAndExecIdOrderByRecordedAtAsc(partitionKey, execId).stream()
                .allMatch(r -> r.getStatus() == ExecutionStatus.PENDING);
    }

    public List<ExecutionRecord> findExecution(String partitionKey, String execId) {
        return repository.findByPartitionKeyAndExecIdOrderByRecordedAtAsc(partitionKey, execId);
    }

    public List<ExecutionRecord> query(LogQuery query) {
        if (query.getPartitionKey() == null || query.getPartitionKey().isBlank()) {
            throw new ValidationException("partitionKey is required");
        }
        int limit = query.getLimit() == null ? properties.getLogs().getDefaultQueryLimit() : query.getLimit();
        limit = Math.max(1, Math.min(properties.getLogs().getMaxQueryLimit(), limit));

        ExecutionStatus status = null;
        if (query.getStatus() != null && !query.getStatus().isBlank()) {
            try {
                status = ExecutionStatus.fromWire(query.getStatus());
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Unknown status: " + query.getStatus());
            }
        }
        Instant from = query.getFrom() == null || query.getFrom().isBlank() ? null : parseBound(query.getFrom());
        Instant to = query.getTo() == null || query.getTo().isBlank() ? null : parseBound(query.getTo());
        String needle = query.getQ() == null || query.getQ().isBlank() ? null : query.getQ().toLowerCase(Locale.ROOT);
        ExecutionStatus wanted = status;

        Stream<ExecutionRecord> rows = repository.findByPartitionKey(query.getPartitionKey().trim()).stream()
                .filter(r -> query.getExecId() == null || query.getExecId().isBlank() || query.getExecId().equals(r.getExecId()))
                .filter(r -> wanted == null || r.getStatus() == wanted)
                .filter(r -> from == null || !r.getRequestedAt().isBefore(from))
                .filter(r -> to == null || !r.getRequestedAt().isAfter(to))
                .filter(r -> needle == null || contains(r, needle));

        Comparator<ExecutionRecord> order = Comparator.comparing(ExecutionRecord::getRequestedAt)
                .thenComparing(ExecutionRecord::getRecordedAt);
        if (!"asc".equalsIgnoreCase(query.getOrder())) {
            order = order.reversed();
        }
        return rows.sorted(order).limit(limit).toList();
    }

    private Instant parseBound(String value) {
        try {
            return LocalDateTime.parse(value.trim(), REQUESTED_AT).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(value.trim());
            } catch (DateTimeParseException e2) {
                throw new ValidationException("Invalid time bound: " + value);
            }
        }
    }

    private static boolean contains(ExecutionRecord r, String needle) {
        return Stream.of(r.getName(), r.getSchemaId(), r.getRunbook(), r.getRunArgs(), r.getLog(), r.getExecId())
                .anyMatch(v -> v != null && v.toLowerCase(Locale.ROOT).contains(needle));
    }

    static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max);
    }

    @Data
    @Builder
    public static class LogQuery {
        private String partitionKey;
        private String execId;
        private String status;
        private String q;
        private String from;
        private String to;
        private String order;
        private Integer limit;
    }
}
