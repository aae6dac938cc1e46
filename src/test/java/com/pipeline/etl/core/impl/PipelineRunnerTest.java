package com.pipeline.etl.core.impl;

import com.pipeline.etl.model.ExecutionOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(20)
class PipelineRunnerTest {

    private final PipelineRunner runner = new PipelineRunner(2, 2000);
    private final ExecutorService callers = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
        runner.shutdown(1000);
    }

    private static ExecutionOutcome done(String name) {
        return ExecutionOutcome.of(name, ExecutionOutcome.Status.COMPLETED, "ok");
    }

    @Test
    void testRun_returnsBodyOutcome() {
        ExecutionOutcome outcome = runner.run("orders", () -> done("orders"));

        assertEquals(ExecutionOutcome.Status.COMPLETED, outcome.getStatus());
        assertFalse(runner.isRunning("orders"));
        assertEquals(1, runner.getTotalExecuted());
        assertEquals(0, runner.getTotalFailed());
    }

    @Test
    void testRun_sameNameExclusiveOtherNamesConcurrent() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<ExecutionOutcome> first = callers.submit(() -> runner.run("orders", () -> {
            entered.countDown();
            release.await();
            return done("orders");
        }));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertTrue(runner.isRunning("orders"));
        assertEquals(ExecutionOutcome.Status.ALREADY_RUNNING,
                runner.run("orders", () -> done("orders")).getStatus());
        assertEquals(ExecutionOutcome.Status.COMPLETED,
                runner.run("invoices", () -> done("invoices")).getStatus());

        release.countDown();
        assertEquals(ExecutionOutcome.Status.COMPLETED, first.get(5, TimeUnit.SECONDS).getStatus());
        assertEquals(0, runner.getActiveCount());
    }

    @Test
    void testRun_timeoutInterruptsAndReleases() throws Exception {
        AtomicReference<Boolean> interrupted = new AtomicReference<>(false);
        PipelineRunner fast = new PipelineRunner(1, 100);
        try {
            ExecutionOutcome outcome = fast.run("slow", () -> {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    interrupted.set(true);
                    throw e;
                }
                return done("slow");
            });

            assertEquals(ExecutionOutcome.Status.TIMED_OUT, outcome.getStatus());
            assertEquals(1, fast.getTotalFailed());
            awaitReleased(fast, "slow");
            assertTrue(interrupted.get());
            assertEquals(ExecutionOutcome.Status.COMPLETED, fast.run("slow", () -> done("slow")).getStatus());
        } finally {
            fast.shutdown(1000);
        }
    }

    @Test
    void testRun_timedOutWorkerIgnoringInterruptKeepsSlot() throws Exception {
        PipelineRunner fast = new PipelineRunner(2, 200);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        Callable<ExecutionOutcome> stubborn = tracked(concurrent, maxConcurrent, () -> {
            // 模拟不响应中断的阻塞I/O
            boolean released = false;
            while (!released) {
                try {
                    released = release.await(50, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    released = false;
                }
            }
            return done("X");
        });
        try {
            assertEquals(ExecutionOutcome.Status.TIMED_OUT, fast.run("X", stubborn).getStatus());

            assertTrue(fast.isRunning("X"), "Slot must stay reserved while the worker is still executing");
            assertEquals(ExecutionOutcome.Status.ALREADY_RUNNING,
                    fast.run("X", tracked(concurrent, maxConcurrent, () -> done("X"))).getStatus());

            release.countDown();
            awaitReleased(fast, "X");
            assertEquals(ExecutionOutcome.Status.COMPLETED,
                    fast.run("X", tracked(concurrent, maxConcurrent, () -> done("X"))).getStatus());
            assertEquals(1, maxConcurrent.get(), "Executions of X must never overlap");
        } finally {
            release.countDown();
            fast.shutdown(1000);
        }
    }

    private static Callable<ExecutionOutcome> tracked(AtomicInteger concurrent, AtomicInteger maxConcurrent,
                                                      Callable<ExecutionOutcome> body) {
        return () -> {
            maxConcurrent.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
            try {
                return body.call();
            } finally {
                concurrent.decrementAndGet();
            }
        };
    }

    private static void awaitReleased(PipelineRunner runner, String name) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (runner.isRunning(name)) {
            if (System.currentTimeMillis() > deadline) {
                fail("Slot of '" + name + "' was not released within 5s");
            }
            Thread.sleep(20);
        }
    }

    @Test
    void testRun_bodyExceptionBecomesFailure() {
        ExecutionOutcome outcome = runner.run("orders", () -> {
            throw new IllegalStateException("boom");
        });

        assertEquals(ExecutionOutcome.Status.FAILED, outcome.getStatus());
        assertEquals("boom", outcome.getMessage());
        assertFalse(runner.isRunning("orders"));
        assertEquals(1, runner.getTotalFailed());
    }

    @Test
    void testRun_afterShutdownRejected() {
        runner.shutdown(100);

        ExecutionOutcome outcome = runner.run("orders", () -> done("orders"));

        assertEquals(ExecutionOutcome.Status.FAILED, outcome.getStatus());
        assertFalse(runner.isRunning("orders"));
    }
}
