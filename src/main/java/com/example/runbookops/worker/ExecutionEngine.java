package com.example.runbookops.worker;

import com.example.runbookops.config.RunbookOpsProperties;
import com.example.runbookops.domain.ExecutionStatus;
import com.example.runbookops.exception.RunbookNotFoundException;
import com.example.runbookops.message.JobMessage;
import com.example.runbookops.message.ResourceInfo;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs runbook jobs as subprocesses on this worker.
 *
 * <p>Every job ends with exactly one outcome on the notification queue: skipped for a duplicate of
 * an active run, error when the job could not start, succeeded or failed by exit code, or stopped.
 * A run stopped through {@link #stop(String)} is reported by the stop call with the output captured
 * so far; the run itself then reports nothing.
 */
@Slf4j
@Service
public class ExecutionEngine {

    /** Exit code of a JVM-launched child killed by SIGTERM (128 + 15). */
    static final int SIGTERM_EXIT = 143;

    private final ActiveRunRegistry registry;
    private final RunbookSourceResolver sourceResolver;
    private final ClusterLoginRunner clusterLogin;
    private final OutcomePublisher publisher;
    private final RunbookOpsProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public ExecutionEngine(ActiveRunRegistry registry, RunbookSourceResolver sourceResolver,
                           ClusterLoginRunner clusterLogin, OutcomePublisher publisher,
                           RunbookOpsProperties properties, MeterRegistry meterRegistry, Clock clock) {
        this.registry = registry;
        this.sourceResolver = sourceResolver;
        this.clusterLogin = clusterLogin;
        this.publisher = publisher;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public ExecutionStatus process(JobMessage job) {
        ActiveRun run = ActiveRun.builder()
                .execId(job.getExecId())
                .schemaId(job.getId())
                .name(job.getName())
                .runbook(job.getRunbook())
                .runArgs(job.getRunArgs())
                .worker(job.getWorker())
                .requestedAt(job.getRequestedAt())
                .startedAt(clock.instant())
                .resourceInfo(job.getResourceInfo() != null ? job.getResourceInfo() : new HashMap<>())
                .job(job)
                .build();

        if (!registry.tryRegister(run)) {
            log.warn("[{}] Skipping {}: the same runbook with the same arguments is already running",
                    job.getExecId(), job.getRunbook());
            return report(job, ExecutionStatus.SKIPPED,
                    "Skipped: " + job.getRunbook() + " " + nullToEmpty(job.getRunArgs()).trim()
                            + " is already running on this worker");
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        ResolvedScript script = null;
        try {
            if (clusterLogin.required(run.getResourceInfo())) {
                String loginOutput = clusterLogin.login(job.getExecId(), run.getResourceInfo());
                run.getOutput().append(loginOutput);
            }
            script = sourceResolver.resolve(job.getRunbook());
            List<String> command = command(script, job.getRunArgs());
            return execute(job, run, command);
        } catch (ClusterLoginException | RunbookNotFoundException e) {
            log.error("[{}] {}", job.getExecId(), e.getMessage());
            return finish(job, run, ExecutionStatus.ERROR, run.getOutput() + e.getMessage());
        } catch (IOException | RuntimeException e) {
            log.error("[{}] Could not start {}: {}", job.getExecId(), job.getRunbook(), e.getMessage());
            return finish(job, run, ExecutionStatus.ERROR, "Could not start runbook: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            Process process = run.getProcess();
            if (process != null) process.destroyForcibly();
            return finish(job, run, ExecutionStatus.ERROR, run.getOutput() + "\nInterrupted while running");
        } finally {
            sample.stop(Timer.builder("runbook_ops.run.duration")
                    .tag("runbook", nullToEmpty(job.getRunbook()))
                    .register(meterRegistry));
            registry.remove(job.getExecId());
            sourceResolver.cleanup(script);
        }
    }

    /**
     * Terminates the run: SIGTERM, a grace period, then SIGKILL. Reports it as stopped.
     *
     * @return false when no run with that id has a live process here, or it already reported its outcome
     */
    public boolean stop(String execId) {
        ActiveRun run = registry.get(execId).orElse(null);
        if (run == null || run.getProcess() == null || run.isReported()) {
            return false;
        }
        run.setStopRequested(true);
        run.setStatus("stopping");
        Process process = run.getProcess();
        log.info("[{}] Stop requested for {}", execId, run.getRunbook());
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(properties.getWorker().getStopGraceSeconds(), TimeUnit.SECONDS)) {
                log.warn("[{}] Still running after {}s, killing", execId, properties.getWorker().getStopGraceSeconds());
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
        if (!run.claimReport()) {
            log.info("[{}] Run finished on its own before the stop took effect", execId);
            return false;
        }
        run.setStatus(ExecutionStatus.STOPPED.wireValue());
        report(run.getJob(), ExecutionStatus.STOPPED, "Stopped on request\n" + run.getOutput());
        return true;
    }

    public List<ActiveRun> activeRuns() {
        return registry.snapshot();
    }

    private ExecutionStatus execute(JobMessage job, ActiveRun run, List<String> command)
            throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.environment().putAll(environment(job));
        log.info("[{}] Running {}", job.getExecId(), String.join(" ", command));
        Process process = pb.start();
        run.setProcess(process);

        Thread stderr = new Thread(() -> pump(process.getErrorStream(), run, job.getExecId()),
                "runbook-stderr-" + job.getExecId());
        stderr.setDaemon(true);
        stderr.start();
        pump(process.getInputStream(), run, job.getExecId());
        int exitCode = process.waitFor();
        stderr.join(TimeUnit.SECONDS.toMillis(5));

        if (run.isStopRequested()) {
            return ExecutionStatus.STOPPED;
        }
        if (exitCode == SIGTERM_EXIT || exitCode == -15) {
            log.info("[{}] Terminated by SIGTERM", job.getExecId());
            return finish(job, run, ExecutionStatus.STOPPED, "Terminated\n" + run.getOutput());
        }
        if (exitCode == 0) {
            return finish(job, run, ExecutionStatus.SUCCEEDED, run.getOutput().toString());
        }
        log.warn("[{}] {} exited with code {}", job.getExecId(), job.getRunbook(), exitCode);
        return finish(job, run, ExecutionStatus.FAILED, run.getOutput() + "\nExit code: " + exitCode);
    }

    private void pump(InputStream stream, ActiveRun run, String execId) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                run.getOutput().append(line).append('\n');
                log.debug("[{}] {}", execId, line);
            }
        } catch (IOException e) {
            log.debug("[{}] Output stream closed: {}", execId, e.getMessage());
        }
    }

    private List<String> command(ResolvedScript script, String runArgs) {
        List<String> command = new ArrayList<>();
        if (script.isPython()) {
            command.add(properties.getWorker().getPythonCommand());
            command.add(script.path().toString());
        } else if (script.path().toFile().canExecute()) {
            command.add(script.path().toString());
        } else {
            command.add("sh");
            command.add(script.path().toString());
        }
        command.addAll(ShellWords.split(runArgs));
        return command;
    }

    static Map<String, String> environment(JobMessage job) {
        Map<String, String> info = job.getResourceInfo() != null ? job.getResourceInfo() : Map.of();
        Map<String, String> env = new HashMap<>();
        env.put("MONITOR_CONDITION", nullToEmpty(job.getMonitorCondition()));
        env.put("RESOURCE_NAME", nullToEmpty(info.get(ResourceInfo.RESOURCE_NAME)));
        env.put("RESOURCE_RG", nullToEmpty(info.get(ResourceInfo.RESOURCE_RG)));
        env.put("RESOURCE_ID", nullToEmpty(info.get(ResourceInfo.RESOURCE_ID)));
        env.put("AKS_NAMESPACE", nullToEmpty(info.get(ResourceInfo.AKS_NAMESPACE)));
        env.put("AKS_POD", nullToEmpty(info.get(ResourceInfo.AKS_POD)));
        env.put("AKS_DEPLOYMENT", nullToEmpty(info.get(ResourceInfo.AKS_DEPLOYMENT)));
        env.put("AKS_JOB", nullToEmpty(info.get(ResourceInfo.AKS_JOB)));
        env.put("AKS_HPA", nullToEmpty(info.get(ResourceInfo.AKS_HPA)));
        return env;
    }

    private ExecutionStatus finish(JobMessage job, ActiveRun run, ExecutionStatus status, String logs) {
        if (!run.claimReport()) {
            return run.isStopRequested() ? ExecutionStatus.STOPPED : status;
        }
        run.setStatus(status.wireValue());
        return report(job, status, logs);
    }

    private ExecutionStatus report(JobMessage job, ExecutionStatus status, String logs) {
        meterRegistry.counter("runbook_ops.runs", "status", status.wireValue()).increment();
        publisher.publish(job, status, logs);
        return status;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
