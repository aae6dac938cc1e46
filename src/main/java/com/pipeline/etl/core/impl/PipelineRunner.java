package com.pipeline.etl.core.impl;

import com.pipeline.etl.model.ExecutionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 管道执行器。
 *
 * 同名管道至多一个执行：执行前在运行集合中做原子预占（CAS插入），
 * 预占失败直接返回already_running。槽位在工作线程退出执行体时释放，
 * 提交被拒绝时由调用线程释放。
 * 执行体在工作线程池中运行，超过单次执行时限则中断并立即返回timed_out；
 * 不响应中断的执行体继续占用槽位直到真正结束。
 */
public class PipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private final ThreadPoolExecutor workerPool;
    private final long executionTimeoutMs;

    /** 当前正在执行的管道名称 */
    private final Set<String> running = ConcurrentHashMap.newKeySet();

    private final AtomicInteger totalExecuted = new AtomicInteger(0);
    private final AtomicInteger totalFailed = new AtomicInteger(0);

    /**
     * @param parallelism        常驻工作线程数，并发更多管道时按需扩展
     * @param executionTimeoutMs 单次执行时限（毫秒）
     */
    public PipelineRunner(int parallelism, long executionTimeoutMs) {
        AtomicInteger threadIndex = new AtomicInteger(0);
        this.workerPool = new ThreadPoolExecutor(
                Math.max(1, parallelism), Integer.MAX_VALUE,
                60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                r -> {
                    Thread t = new Thread(r, "pipeline-worker-" + threadIndex.incrementAndGet());
                    t.setDaemon(true);
                    t.setUncaughtExceptionHandler((th, e) ->
                            log.error("Uncaught exception in worker thread {}: {}", th.getName(), e.getMessage(), e));
                    return t;
                });
        this.executionTimeoutMs = executionTimeoutMs;
        log.info("PipelineRunner initialized. Parallelism: {}, Timeout: {}ms", parallelism, executionTimeoutMs);
    }

    /**
     * 同步执行一次管道。
     *
     * @param name 管道名称，用于互斥
     * @param body 执行体，在工作线程中运行
     * @return 执行体的结果；已在运行时为ALREADY_RUNNING，超时为TIMED_OUT，执行体抛出异常为FAILED
     */
    public ExecutionOutcome run(String name, Callable<ExecutionOutcome> body) {
        if (!running.add(name)) {
            log.warn("Pipeline '{}' is already running, skipping.", name);
            return ExecutionOutcome.of(name, ExecutionOutcome.Status.ALREADY_RUNNING,
                    "Pipeline '" + name + "' is already running");
        }

        long startTime = System.currentTimeMillis();
        AtomicBoolean started = new AtomicBoolean(false);
        // 槽位在结果可见之前释放，调用方拿到结果后即可再次执行
        FutureTask<ExecutionOutcome> future = new FutureTask<>(() -> {
            started.set(true);
            try {
                return body.call();
            } finally {
                running.remove(name);
            }
        });
        try {
            workerPool.execute(() -> {
                future.run();
                // 开始前即被取消时执行体不会运行
                if (!started.get()) {
                    running.remove(name);
                }
            });
        } catch (RejectedExecutionException e) {
            running.remove(name);
            log.error("Pipeline '{}' rejected: runner is shut down.", name);
            return ExecutionOutcome.failed(name, null, "Runner is shut down");
        }

        try {
            ExecutionOutcome outcome = future.get(executionTimeoutMs, TimeUnit.MILLISECONDS);
            totalExecuted.incrementAndGet();
            if (!outcome.isSuccess()) {
                totalFailed.incrementAndGet();
            }
            log.debug("Pipeline '{}' finished in {}ms with {}", name,
                    System.currentTimeMillis() - startTime, outcome.getStatus());
            return outcome;

        } catch (TimeoutException e) {
            future.cancel(true);
            totalExecuted.incrementAndGet();
            totalFailed.incrementAndGet();
            log.error("Pipeline '{}' exceeded execution timeout of {}ms, cancelled. Slot is held until the worker exits.",
                    name, executionTimeoutMs);
            return ExecutionOutcome.of(name, ExecutionOutcome.Status.TIMED_OUT,
                    "Execution exceeded timeout of " + executionTimeoutMs + "ms");

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            totalExecuted.incrementAndGet();
            totalFailed.incrementAndGet();
            log.error("Pipeline '{}' failed: {}", name, cause.getMessage(), cause);
            return ExecutionOutcome.failed(name, null, String.valueOf(cause.getMessage()));

        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            totalFailed.incrementAndGet();
            log.warn("Interrupted while waiting for pipeline '{}', execution cancelled.", name);
            return ExecutionOutcome.failed(name, null, "Interrupted while waiting for execution");
        }
    }

    public boolean isRunning(String name) {
        return running.contains(name);
    }

    public Set<String> getRunning() {
        return Set.copyOf(running);
    }

    /**
     * 不再接受新的执行，有界等待进行中的执行完成，不强制中断
     */
    public void shutdown(long timeoutMs) {
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("{} pipeline executions still running after {}ms.", running.size(), timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for pipeline executions to finish.");
        }
        log.info("PipelineRunner shut down. Executed: {}, Failed: {}", totalExecuted.get(), totalFailed.get());
    }

    public int getTotalExecuted() { return totalExecuted.get(); }
    public int getTotalFailed() { return totalFailed.get(); }
    public int getActiveCount() { return running.size(); }
}
