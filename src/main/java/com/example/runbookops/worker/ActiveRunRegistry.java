package com.example.runbookops.worker;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs active on this instance. One lock guards the map; it is held only for each mutation or read.
 */
@Component
public class ActiveRunRegistry {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ActiveRun> runs = new LinkedHashMap<>();

    /**
     * Registers {@code run} unless an active run has the same name, runbook and arguments.
     *
     * @return false when the run is a duplicate and was not registered
     */
    public boolean tryRegister(ActiveRun run) {
        lock.lock();
        try {
            for (ActiveRun active : runs.values()) {
                if (active.sameWorkAs(run)) {
                    return false;
                }
            }
            runs.put(run.getExecId(), run);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Optional<ActiveRun> get(String execId) {
        lock.lock();
        try {
            return Optional.ofNullable(runs.get(execId));
        } finally {
            lock.unlock();
        }
    }

    public void remove(String execId) {
        lock.lock();
        try {
            runs.remove(execId);
        } finally {
            lock.unlock();
        }
    }

    public List<ActiveRun> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(runs.values());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return runs.size();
        } finally {
            lock.unlock();
        }
    }
}
