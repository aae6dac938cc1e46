package com.pipeline.etl.core.impl;

import com.pipeline.etl.core.ComponentFactory;
import com.pipeline.etl.core.PipelineScheduler;
import com.pipeline.etl.core.PipelineStore;
import com.pipeline.etl.core.QualityMonitor;
import com.pipeline.etl.exception.ConfigurationException;
import com.pipeline.etl.exception.PipelineException;
import com.pipeline.etl.exception.PipelineStoreException;
import com.pipeline.etl.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 管道调度器默认实现。
 *
 * 注册表和触发器只由单个调度线程（pipeline-scheduler）访问：节拍检查和所有注册表读写
 * 都作为命令提交到该线程串行执行。节拍只做内存判断，到期的管道交给分派线程池，
 * 经PipelineRunner在工作线程中执行；同名互斥由PipelineRunner保证。
 *
 * 注册表每次修改生成带序号的快照，由调用线程写回配置文件，旧快照不会覆盖新快照。
 */
public class DefaultPipelineScheduler implements PipelineScheduler {

    private static final Logger log = LoggerFactory.getLogger(DefaultPipelineScheduler.class);

    /** 合法的状态转换表 */
    private static final Map<ScheduleStatus, Set<ScheduleStatus>> VALID_TRANSITIONS =
            new EnumMap<>(ScheduleStatus.class);

    static {
        VALID_TRANSITIONS.put(ScheduleStatus.SCHEDULED, EnumSet.of(ScheduleStatus.RUNNING));
        VALID_TRANSITIONS.put(ScheduleStatus.RUNNING,
                EnumSet.of(ScheduleStatus.COMPLETED, ScheduleStatus.FAILED));
        VALID_TRANSITIONS.put(ScheduleStatus.COMPLETED, EnumSet.of(ScheduleStatus.SCHEDULED));
        VALID_TRANSITIONS.put(ScheduleStatus.FAILED, EnumSet.of(ScheduleStatus.SCHEDULED));
    }

    private final ScheduleConfigRepository repository;
    private final ComponentFactory componentFactory;
    private final PipelineStore store;
    private final QualityMonitor qualityMonitor;
    private final PipelineRunner runner;
    private final Clock clock;
    private final ZoneId zone;
    private final long tickIntervalMs;
    private final long shutdownTimeoutMs;

    /** 以下三项只在调度线程中访问 */
    private final Map<String, ScheduledPipeline> registry;
    private final Map<String, ScheduleTrigger> triggers = new LinkedHashMap<>();
    private long registryVersion = 0;

    private final ScheduledExecutorService loop;
    private final ExecutorService dispatchPool;
    private volatile Thread loopThread;
    private volatile ScheduledFuture<?> tickFuture;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public DefaultPipelineScheduler(ScheduleConfigRepository repository, ComponentFactory componentFactory,
                                    PipelineStore store, QualityMonitor qualityMonitor, PipelineRunner runner,
                                    long tickIntervalMs, long shutdownTimeoutMs, Clock clock) {
        this.repository = repository;
        this.componentFactory = componentFactory;
        this.store = store;
        this.qualityMonitor = qualityMonitor;
        this.runner = runner;
        this.clock = clock;
        this.zone = clock.getZone();
        this.tickIntervalMs = tickIntervalMs;
        this.shutdownTimeoutMs = shutdownTimeoutMs;

        this.loop = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pipeline-scheduler");
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
        AtomicInteger dispatchIndex = new AtomicInteger(0);
        this.dispatchPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "pipeline-dispatch-" + dispatchIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        this.registry = repository.load();
        for (ScheduledPipeline pipeline : registry.values()) {
            // 上次进程退出时未结束的执行
            if (pipeline.getStatus() == null || pipeline.getStatus() == ScheduleStatus.RUNNING) {
                pipeline.setStatus(ScheduleStatus.SCHEDULED);
            }
            registerTrigger(pipeline);
        }
        log.info("DefaultPipelineScheduler initialized with {} pipelines. Tick: {}ms", registry.size(), tickIntervalMs);
    }

    // ==================== 生命周期 ====================

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Scheduler is already running.");
            return;
        }
        call(() -> {
            triggers.clear();
            registry.values().forEach(this::registerTrigger);
            return null;
        });
        tickFuture = loop.scheduleAtFixedRate(this::tickSafely, tickIntervalMs, tickIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Scheduler started.");
        logEvent("scheduler_started", null, "Scheduler started", null);
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        ScheduledFuture<?> future = tickFuture;
        if (future != null) {
            future.cancel(false);
        }
        // 等待进行中的节拍结束
        Future<?> barrier = loop.submit(triggers::clear);
        try {
            barrier.get(shutdownTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Scheduler loop did not finish within {}ms.", shutdownTimeoutMs);
        } catch (ExecutionException e) {
            log.error("Error while stopping scheduler loop: {}", e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping scheduler loop.");
        }
        log.info("Scheduler stopped. {} pipelines still executing.", runner.getActiveCount());
        logEvent("scheduler_stopped", null, "Scheduler stopped", null);
    }

    @Override
    public void shutdown() {
        stop();
        dispatchPool.shutdown();
        try {
            if (!dispatchPool.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Dispatched executions still running after {}ms.", shutdownTimeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for dispatched executions.");
        }
        runner.shutdown(shutdownTimeoutMs);
        loop.shutdown();
        log.info("Scheduler shut down.");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    // ==================== 注册表管理 ====================

    @Override
    public void addPipeline(String name, PipelineConfig pipelineConfig, ScheduleSpec schedule, boolean enabled) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pipeline name must not be null or blank");
        }
        if (pipelineConfig == null) {
            throw new IllegalArgumentException("PipelineConfig must not be null for pipeline: " + name);
        }
        if (schedule == null) {
            throw new ConfigurationException("Schedule must not be null for pipeline: " + name);
        }
        schedule.validate();
        // 组件配置错误在注册时暴露
        EtlPipeline.fromConfig(name, pipelineConfig, componentFactory, store, clock);

        RegistrySnapshot snapshot = call(() -> {
            ScheduledPipeline entry = new ScheduledPipeline(name, pipelineConfig, schedule, enabled);
            ScheduledPipeline existing = registry.get(name);
            if (existing != null) {
                entry.setLastRun(existing.getLastRun());
                entry.setRunCount(existing.getRunCount());
                entry.setSuccessCount(existing.getSuccessCount());
                entry.setFailureCount(existing.getFailureCount());
                entry.setLastErrorMessage(existing.getLastErrorMessage());
            }
            registry.put(name, entry);
            triggers.remove(name);
            registerTrigger(entry);
            return snapshot();
        });
        persist(snapshot);

        log.info("Pipeline '{}' added. Schedule: {}, Enabled: {}", name, schedule.getType().getValue(), enabled);
        logEvent("pipeline_added", name, "Pipeline added", schedule.getType().getValue());
    }

    @Override
    public void enablePipeline(String name) {
        persist(call(() -> {
            ScheduledPipeline entry = requirePipeline(name);
            entry.setEnabled(true);
            triggers.remove(name);
            registerTrigger(entry);
            return snapshot();
        }));
        log.info("Pipeline '{}' enabled.", name);
        logEvent("pipeline_enabled", name, "Pipeline enabled", null);
    }

    @Override
    public void disablePipeline(String name) {
        persist(call(() -> {
            ScheduledPipeline entry = requirePipeline(name);
            entry.setEnabled(false);
            triggers.remove(name);
            return snapshot();
        }));
        log.info("Pipeline '{}' disabled.", name);
        logEvent("pipeline_disabled", name, "Pipeline disabled", null);
    }

    // ==================== 执行 ====================

    @Override
    public ExecutionOutcome executePipeline(String name, boolean manual) {
        ScheduledPipeline entry = call(() -> {
            ScheduledPipeline p = registry.get(name);
            return p != null ? p.copy() : null;
        });
        if (entry == null) {
            log.warn("Pipeline '{}' not found.", name);
            return ExecutionOutcome.of(name, ExecutionOutcome.Status.NOT_FOUND, "Pipeline '" + name + "' not found");
        }
        if (!entry.isEnabled() && !manual) {
            log.info("Pipeline '{}' is disabled, skipping.", name);
            return ExecutionOutcome.of(name, ExecutionOutcome.Status.DISABLED, "Pipeline '" + name + "' is disabled");
        }

        log.info("Executing pipeline '{}' ({}).", name, manual ? "manual" : "scheduled");
        ExecutionOutcome outcome = runner.run(name, () -> runPipeline(name, entry.getPipelineConfig()));
        if (outcome.getStatus() == ExecutionOutcome.Status.ALREADY_RUNNING) {
            return outcome;
        }
        recordCompletion(name, outcome);
        return outcome;
    }

    /**
     * 执行体，运行在工作线程中
     */
    private ExecutionOutcome runPipeline(String name, PipelineConfig config) {
        persist(call(() -> markRunning(name)));

        if (config == null) {
            return ExecutionOutcome.failed(name, null, "Pipeline '" + name + "' has no pipeline configuration");
        }
        EtlPipeline pipeline;
        try {
            pipeline = EtlPipeline.fromConfig(name, config, componentFactory, store, clock);
        } catch (ConfigurationException e) {
            log.error("Pipeline '{}' configuration invalid: {}", name, e.getMessage());
            return ExecutionOutcome.failed(name, null, e.getMessage());
        }

        ExecutionOutcome outcome;
        try {
            outcome = ExecutionOutcome.finished(pipeline.execute());
        } catch (PipelineException e) {
            outcome = ExecutionOutcome.failed(name, pipeline.getLastResult(), e.getMessage());
        }

        if (outcome.getResult() != null) {
            monitorQuality(name, pipeline, outcome.getResult());
        }
        return outcome;
    }

    private void monitorQuality(String name, EtlPipeline pipeline, ExecutionResult result) {
        PipelinePolicy policy = pipeline.getPolicy();
        Dataset output = pipeline.getLastOutput();
        if (qualityMonitor == null || !policy.isQualityMonitoring() || output == null) {
            return;
        }
        String tableName = policy.getTableName() != null ? policy.getTableName() : name;
        try {
            qualityMonitor.analyze(output, name, tableName);
            qualityMonitor.recordHealthScore(name, result.getExecutionId());
        } catch (PipelineException e) {
            log.error("Quality monitoring failed for pipeline '{}': {}", name, e.getMessage(), e);
            logEvent("quality_monitoring_error", name, e.getMessage(), result.getExecutionId());
        }
    }

    /**
     * 执行结束后的记账：运行计数、状态、下一次触发时间，以及pipeline_metrics
     */
    private void recordCompletion(String name, ExecutionOutcome outcome) {
        boolean success = outcome.isSuccess();
        CompletionSnapshot completion = call(() -> {
            ScheduledPipeline entry = registry.get(name);
            if (entry == null) {
                return null;
            }
            if (entry.getStatus() != ScheduleStatus.RUNNING) {
                transition(entry, ScheduleStatus.RUNNING);
            }
            entry.setRunCount(entry.getRunCount() + 1);
            if (success) {
                entry.setSuccessCount(entry.getSuccessCount() + 1);
                entry.setLastErrorMessage(null);
                transition(entry, ScheduleStatus.COMPLETED);
            } else {
                entry.setFailureCount(entry.getFailureCount() + 1);
                entry.setLastErrorMessage(outcome.getMessage());
                transition(entry, ScheduleStatus.FAILED);
            }
            ScheduleTrigger trigger = triggers.get(name);
            if (trigger != null) {
                entry.setNextRun(trigger.getNextRun());
            }
            return new CompletionSnapshot(entry.copy(), snapshot());
        });
        if (completion == null) {
            log.warn("Pipeline '{}' was removed during execution.", name);
            return;
        }
        persist(completion.registry);

        ScheduledPipeline entry = completion.pipeline;
        Instant now = clock.instant();
        double duration = outcome.getResult() != null ? outcome.getResult().getDurationSeconds() : 0.0;
        try {
            store.savePipelineMetric(name, "duration_seconds", duration, now);
            store.savePipelineMetric(name, "success_rate", entry.getSuccessRate(), now);
            store.savePipelineMetric(name, "total_runs", entry.getRunCount(), now);
            store.savePipelineMetric(name, "total_failures", entry.getFailureCount(), now);
        } catch (PipelineStoreException e) {
            log.error("Failed to save metrics for pipeline '{}': {}", name, e.getMessage(), e);
        }

        if (success) {
            log.info("Pipeline '{}' completed. Runs: {}, Success rate: {}", name,
                    entry.getRunCount(), String.format("%.2f", entry.getSuccessRate()));
        } else {
            log.error("Pipeline '{}' finished with {}: {}", name, outcome.getStatus().getValue(), outcome.getMessage());
            logEvent("execution_error", name, outcome.getMessage(), outcome.getStatus().getValue());
        }
    }

    /** 调度线程中执行 */
    private RegistrySnapshot markRunning(String name) {
        ScheduledPipeline entry = registry.get(name);
        if (entry == null) {
            return null;
        }
        if (entry.getStatus() == ScheduleStatus.COMPLETED || entry.getStatus() == ScheduleStatus.FAILED) {
            transition(entry, ScheduleStatus.SCHEDULED);
        }
        transition(entry, ScheduleStatus.RUNNING);
        entry.setLastRun(clock.instant());
        return snapshot();
    }

    // ==================== 查询 ====================

    @Override
    public ScheduledPipeline getPipelineStatus(String name) {
        return call(() -> {
            ScheduledPipeline entry = registry.get(name);
            return entry != null ? entry.copy() : null;
        });
    }

    @Override
    public List<ScheduledPipeline> getAllPipelineStatus() {
        return call(() -> {
            List<ScheduledPipeline> result = new ArrayList<>();
            registry.values().forEach(p -> result.add(p.copy()));
            return result;
        });
    }

    @Override
    public SchedulerMetricsReport getMetrics(String pipelineName, int days) {
        Instant since = clock.instant().minus(Duration.ofDays(days));
        List<ExecutionResult> executions = store.getExecutions(pipelineName, since);

        Map<String, List<ExecutionResult>> byPipeline = new TreeMap<>();
        for (ExecutionResult r : executions) {
            byPipeline.computeIfAbsent(r.getPipelineName(), k -> new ArrayList<>()).add(r);
        }
        List<PipelineExecutionSummary> summaries = new ArrayList<>();
        byPipeline.forEach((name, results) -> {
            long successful = results.stream().filter(r -> r.getStatus() == ExecutionStatus.COMPLETED).count();
            double avgDuration = results.stream().mapToDouble(ExecutionResult::getDurationSeconds).average().orElse(0.0);
            long records = results.stream().mapToLong(ExecutionResult::getTotalRecordsProcessed).sum();
            summaries.add(new PipelineExecutionSummary(name, results.size(), successful, avgDuration, records));
        });

        int[] counts = call(() -> new int[]{
                registry.size(),
                (int) registry.values().stream().filter(ScheduledPipeline::isEnabled).count()
        });
        return new SchedulerMetricsReport(days, summaries, counts[0], counts[1], runner.getRunning().size());
    }

    // ==================== 调度循环 ====================

    /**
     * 立即执行一次节拍检查并等待其完成
     */
    void triggerTick() {
        call(() -> {
            tick();
            return null;
        });
    }

    private void tickSafely() {
        try {
            tick();
        } catch (RuntimeException e) {
            // 异常会终止scheduleAtFixedRate，记录后继续下一拍
            log.error("Scheduler tick failed: {}", e.getMessage(), e);
        }
    }

    /** 调度线程中执行，不做I/O */
    private void tick() {
        Instant now = clock.instant();
        for (Map.Entry<String, ScheduleTrigger> e : triggers.entrySet()) {
            String name = e.getKey();
            ScheduleTrigger trigger = e.getValue();
            ScheduledPipeline entry = registry.get(name);
            if (entry == null || !entry.isEnabled()) {
                continue;
            }
            if (entry.getStatus() == ScheduleStatus.COMPLETED || entry.getStatus() == ScheduleStatus.FAILED) {
                transition(entry, ScheduleStatus.SCHEDULED);
            }
            if (!trigger.isDue(now)) {
                continue;
            }
            trigger.advance(now);
            entry.setNextRun(trigger.getNextRun());
            if (runner.isRunning(name)) {
                log.debug("Pipeline '{}' is still running, trigger skipped.", name);
                continue;
            }
            try {
                dispatchPool.execute(() -> executePipeline(name, false));
                log.debug("Pipeline '{}' dispatched. Next run: {}", name, trigger.getNextRun());
            } catch (RejectedExecutionException ex) {
                log.warn("Pipeline '{}' not dispatched: scheduler is shutting down.", name);
            }
        }
    }

    /** 调度线程中执行 */
    private void registerTrigger(ScheduledPipeline entry) {
        if (!entry.isEnabled()) {
            return;
        }
        ScheduleSpec spec = entry.getSchedule();
        if (spec != null && spec.getType() == ScheduleType.CRON) {
            log.warn("Cron schedules are not supported, pipeline '{}' will only run manually.", entry.getName());
            return;
        }
        if (!ScheduleTrigger.isSupported(spec)) {
            log.warn("Pipeline '{}' has no valid schedule, it will only run manually.", entry.getName());
            return;
        }
        try {
            ScheduleTrigger trigger = new ScheduleTrigger(spec, zone, clock.instant());
            triggers.put(entry.getName(), trigger);
            entry.setNextRun(trigger.getNextRun());
        } catch (ConfigurationException e) {
            log.error("Invalid schedule for pipeline '{}': {}", entry.getName(), e.getMessage());
        }
    }

    /** 调度线程中执行 */
    private boolean transition(ScheduledPipeline entry, ScheduleStatus target) {
        ScheduleStatus current = entry.getStatus();
        Set<ScheduleStatus> allowed = VALID_TRANSITIONS.getOrDefault(current, Collections.emptySet());
        if (!allowed.contains(target)) {
            log.warn("Invalid status transition for pipeline '{}': {} -> {}", entry.getName(), current, target);
            return false;
        }
        entry.setStatus(target);
        log.debug("Pipeline '{}' status: {} -> {}", entry.getName(), current, target);
        return true;
    }

    private ScheduledPipeline requirePipeline(String name) {
        ScheduledPipeline entry = registry.get(name);
        if (entry == null) {
            throw new IllegalArgumentException("Pipeline '" + name + "' not found");
        }
        return entry;
    }

    // ==================== 命令与持久化 ====================

    /** 调度线程中执行 */
    private RegistrySnapshot snapshot() {
        Map<String, ScheduledPipeline> copy = new LinkedHashMap<>();
        registry.forEach((name, p) -> copy.put(name, p.copy()));
        return new RegistrySnapshot(++registryVersion, copy);
    }

    private void persist(RegistrySnapshot snapshot) {
        if (snapshot == null) {
            return;
        }
        try {
            repository.save(snapshot.version, snapshot.pipelines);
        } catch (ConfigurationException e) {
            log.error("Failed to persist scheduler registry: {}", e.getMessage(), e);
            logEvent("persistence_error", null, e.getMessage(), null);
        }
    }

    /**
     * 在调度线程中执行命令并等待结果。已在调度线程中时直接执行。
     */
    private <T> T call(Callable<T> command) {
        try {
            if (Thread.currentThread() == loopThread) {
                return command.call();
            }
            return loop.submit(command).get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new PipelineException("Scheduler command failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("Interrupted while waiting for scheduler command", e);
        } catch (RejectedExecutionException e) {
            throw new PipelineException("Scheduler is shut down", e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new PipelineException("Scheduler command failed: " + e.getMessage(), e);
        }
    }

    private void logEvent(String eventType, String pipelineName, String message, String details) {
        try {
            store.logSchedulerEvent(eventType, pipelineName, message, details);
        } catch (PipelineStoreException e) {
            log.error("Failed to log scheduler event '{}': {}", eventType, e.getMessage(), e);
        }
    }

    private static final class RegistrySnapshot {
        private final long version;
        private final Map<String, ScheduledPipeline> pipelines;

        private RegistrySnapshot(long version, Map<String, ScheduledPipeline> pipelines) {
            this.version = version;
            this.pipelines = pipelines;
        }
    }

    private static final class CompletionSnapshot {
        private final ScheduledPipeline pipeline;
        private final RegistrySnapshot registry;

        private CompletionSnapshot(ScheduledPipeline pipeline, RegistrySnapshot registry) {
            this.pipeline = pipeline;
            this.registry = registry;
        }
    }
}
