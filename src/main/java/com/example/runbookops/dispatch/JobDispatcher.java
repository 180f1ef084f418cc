package com.example.runbookops.dispatch;

import com.example.runbookops.domain.WorkerRegistration;
import com.example.runbookops.exception.DispatchException;
import com.example.runbookops.message.JobMessage;
import com.example.runbookops.queue.DurableQueue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Hands a job to the queue of a live worker with the job's capability.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobDispatcher {

    private final WorkerSelector selector;
    private final DurableQueue queue;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    /**
     * @return the worker the job was queued for
     * @throws DispatchException when no worker is live or the enqueue fails
     */
    public WorkerRegistration dispatch(JobMessage job) {
        WorkerRegistration worker;
        try {
            worker = selector.selectWorker(job.getWorker());
        } catch (DispatchException e) {
            meterRegistry.counter("runbook_ops.dispatches", "result", "no_worker").increment();
            throw e;
        }
        try {
            queue.enqueue(worker.getQueueName(), objectMapper.writeValueAsString(job));
        } catch (JsonProcessingException e) {
            meterRegistry.counter("runbook_ops.dispatches", "result", "failed").increment();
            throw new DispatchException("Failed to encode job " + job.getExecId(), e);
        } catch (RuntimeException e) {
            meterRegistry.counter("runbook_ops.dispatches", "result", "failed").increment();
            throw new DispatchException("Failed to enqueue job on " + worker.getQueueName() + ": " + e.getMessage(), e);
        }
        meterRegistry.counter("runbook_ops.dispatches", "result", "queued").increment();
        log.info("[{}] Dispatched {} to worker {} via queue {}",
                job.getExecId(), job.getRunbook(), worker.getWorkerId(), worker.getQueueName());
        return worker;
    }
}
