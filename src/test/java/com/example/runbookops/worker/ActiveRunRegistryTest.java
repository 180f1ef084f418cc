package com.example.runbookops.worker;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ActiveRunRegistryTest {

    private static ActiveRun run(String execId, String runArgs) {
        return ActiveRun.builder().execId(execId).name("Restart API").runbook("restart.sh").runArgs(runArgs).build();
    }

    @Test
    void sameNameRunbookAndArgsIsDuplicate() {
        ActiveRunRegistry registry = new ActiveRunRegistry();

        assertTrue(registry.tryRegister(run("e1", "--ns a")));
        assertFalse(registry.tryRegister(run("e2", "--ns a")));
        assertTrue(registry.tryRegister(run("e3", "--ns b")));
        assertEquals(2, registry.size());
    }

    @Test
    void removedRunFreesItsSlot() {
        ActiveRunRegistry registry = new ActiveRunRegistry();
        registry.tryRegister(run("e1", null));
        registry.remove("e1");

        assertTrue(registry.tryRegister(run("e2", "")));
        assertTrue(registry.get("e1").isEmpty());
        assertTrue(registry.get("e2").isPresent());
    }

    @Test
    void concurrentDuplicatesRegisterExactlyOnce() throws Exception {
        ActiveRunRegistry registry = new ActiveRunRegistry();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < 32; i++) {
            String execId = "e" + i;
            results.add(pool.submit(() -> {
                start.await();
                return registry.tryRegister(run(execId, "--same"));
            }));
        }
        start.countDown();

        int registered = 0;
        for (Future<Boolean> result : results) {
            if (result.get(5, TimeUnit.SECONDS)) registered++;
        }
        pool.shutdownNow();

        assertEquals(1, registered);
        assertEquals(1, registry.snapshot().size());
    }

    @Test
    void toStringLeavesOutRunOutputAndJob() {
        ActiveRun run = run("e1", "--ns a");
        run.getOutput().append("db-password=hunter2\n");

        String text = run.toString();

        assertTrue(text.contains("e1"), text);
        assertFalse(text.contains("hunter2"), text);
        assertFalse(text.contains("job="), text);
        assertFalse(text.contains("process="), text);
    }
}
