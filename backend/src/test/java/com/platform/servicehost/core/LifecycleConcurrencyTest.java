package com.platform.servicehost.core;

import com.platform.servicehost.error.ErrorCode;
import com.platform.servicehost.model.OperationResult;
import com.platform.servicehost.model.ServiceRecord;
import com.platform.servicehost.state.ServiceStatus;
import com.platform.servicehost.support.TestEnvironment;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Concurrent lifecycle calls against the fake OS with a control latency.
 */
class LifecycleConcurrencyTest {

    private static final long CONTROL_LATENCY_MS = 300;

    @TempDir
    Path tempDir;

    private TestEnvironment env;
    private ExecutorService pool;

    @BeforeEach
    void setUp() throws Exception {
        env = new TestEnvironment(tempDir);
        pool = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() throws Exception {
        pool.shutdownNow();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    }

    @Test
    void differentServices_shouldProceedInParallel() throws Exception {
        String first = env.orchestrator.create(env.request("Parallel One", false)).value().getId();
        String second = env.orchestrator.create(env.request("Parallel Two", false)).value().getId();
        env.serviceControl.setLatencyMs(CONTROL_LATENCY_MS);

        CountDownLatch go = new CountDownLatch(1);
        long started = System.nanoTime();
        Future<OperationResult<ServiceRecord>> a = pool.submit(awaiting(go, () -> env.orchestrator.start(first)));
        Future<OperationResult<ServiceRecord>> b = pool.submit(awaiting(go, () -> env.orchestrator.start(second)));
        go.countDown();

        assertTrue(a.get(5, TimeUnit.SECONDS).success());
        assertTrue(b.get(5, TimeUnit.SECONDS).success());
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        assertTrue(elapsedMs < 2 * CONTROL_LATENCY_MS, "starts ran one after another: " + elapsedMs + " ms");
        assertEquals(ServiceStatus.RUNNING, env.store.get(first).orElseThrow().getStatus());
        assertEquals(ServiceStatus.RUNNING, env.store.get(second).orElseThrow().getStatus());
    }

    @Test
    void sameService_shouldLetExactlyOneOperationThrough() throws Exception {
        String id = env.orchestrator.create(env.request("Contended", false)).value().getId();
        env.serviceControl.setLatencyMs(CONTROL_LATENCY_MS);
        int controlBefore = env.serviceControl.controlCalls();

        CountDownLatch go = new CountDownLatch(1);
        List<Future<OperationResult<ServiceRecord>>> futures = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            futures.add(pool.submit(awaiting(go, () -> env.orchestrator.start(id))));
        }
        go.countDown();

        int succeeded = 0;
        int rejected = 0;
        for (Future<OperationResult<ServiceRecord>> future : futures) {
            OperationResult<ServiceRecord> result = future.get(5, TimeUnit.SECONDS);
            if (result.success()) {
                succeeded++;
            } else {
                assertTrue(result.errorCode() == ErrorCode.OPERATION_IN_PROGRESS
                    || result.errorCode() == ErrorCode.OPERATION_CONFLICT, result.errorCode().name());
                rejected++;
            }
        }

        assertEquals(1, succeeded);
        assertEquals(2, rejected);
        assertEquals(controlBefore + 1, env.serviceControl.controlCalls());
        assertEquals(ServiceStatus.RUNNING, env.store.get(id).orElseThrow().getStatus());
    }

    private static <T> Callable<T> awaiting(CountDownLatch go, Callable<T> body) {
        return () -> {
            go.await();
            return body.call();
        };
    }
}
