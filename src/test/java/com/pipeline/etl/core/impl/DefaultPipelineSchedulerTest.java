package com.pipeline.etl.core.impl;

import com.pipeline.etl.MutableClock;
import com.pipeline.etl.exception.ConfigurationException;
import com.pipeline.etl.model.*;
import com.pipeline.etl.storage.SQLitePipelineStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(30)
class DefaultPipelineSchedulerTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SQLitePipelineStore store;
    private ConnectorRegistry connectors;
    private DefaultQualityMonitor monitor;
    private DefaultComponentFactory factory;
    private Path scheduleFile;
    private DefaultPipelineScheduler scheduler;
    private final List<Dataset> loaded = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-04T08:00:00Z")).autoAdvance(Duration.ofMillis(1));
        store = new SQLitePipelineStore(tempDir.resolve("metrics.db").toString(), clock);
        connectors = new ConnectorRegistry();
        connectors.registerSource("orders_db", () -> orders());
        connectors.registerSink("warehouse", data -> loaded.add(data));
        monitor = new DefaultQualityMonitor(store, QualityThresholds.defaults(), clock);
        factory = new DefaultComponentFactory(connectors, monitor, clock);
        scheduleFile = tempDir.resolve("pipeline_schedules.json");
        scheduler = newScheduler(new PipelineRunner(2, 10_000));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
        store.close();
    }

    private DefaultPipelineScheduler newScheduler(PipelineRunner runner) {
        // 节拍间隔足够长，测试中通过triggerTick驱动
        return new DefaultPipelineScheduler(new ScheduleConfigRepository(scheduleFile), factory, store, monitor,
                runner, 3_600_000L, 2000L, clock);
    }

    private static Dataset orders() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("order_no", "SO-" + i);
            row.put("amount", 10.0 * i);
            rows.add(row);
        }
        return Dataset.fromRows(rows);
    }

    private static PipelineConfig pipeline(String source) {
        PipelineConfig config = new PipelineConfig();
        config.setExtractors(List.of(new ComponentConfig("source", "ConnectorExtractor",
                Map.of("connector", source), null)));
        config.setLoaders(List.of(new ComponentConfig("sink", "ConnectorLoader",
                Map.of("connector", "warehouse"), null)));
        return config;
    }

    private int executionCount(String name) {
        return store.getExecutions(name, Instant.EPOCH).size();
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within 5s");
            }
            Thread.sleep(20);
        }
    }

    @Test
    void testExecutePipeline_manualRunRecordsEverything() {
        scheduler.addPipeline("orders", pipeline("orders_db"), ScheduleSpec.interval(60), true);

        ExecutionOutcome outcome = scheduler.executePipeline("orders", true);

        assertEquals(ExecutionOutcome.Status.COMPLETED, outcome.getStatus());
        assertTrue(outcome.isSuccess());
        assertEquals(1, loaded.size());

        ScheduledPipeline status = scheduler.getPipelineStatus("orders");
        assertEquals(ScheduleStatus.COMPLETED, status.getStatus());
        assertEquals(1, status.getRunCount());
        assertEquals(1, status.getSuccessCount());
        assertEquals(0, status.getFailureCount());
        assertNotNull(status.getLastRun());
        assertNotNull(status.getNextRun());

        assertEquals(1, executionCount("orders"));
        Map<String, Double> metrics = store.getLatestPipelineMetrics("orders");
        assertEquals(1.0, metrics.get("total_runs"));
        assertEquals(1.0, metrics.get("success_rate"));
        assertEquals(0.0, metrics.get("total_failures"));
        assertTrue(metrics.containsKey("duration_seconds"));

        // 质量监控随执行运行并记录健康分
        assertFalse(store.getQualityMetrics("orders", Instant.EPOCH).isEmpty());
        assertEquals(1, store.getHealthTrend("orders", Instant.EPOCH).size());
    }

    @Test
    void testExecutePipeline_unknownNameIsNotFound() {
        ExecutionOutcome outcome = scheduler.executePipeline("ghost", true);

        assertEquals(ExecutionOutcome.Status.NOT_FOUND, outcome.getStatus());
        assertFalse(outcome.isExecuted());
        assertNull(scheduler.getPipelineStatus("ghost"));
    }

    @Test
    void testExecutePipeline_concurrentCallsRunOnce() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        connectors.registerSource("slow_db", () -> {
            entered.countDown();
            assertTrue(release.await(10, TimeUnit.SECONDS));
            return orders();
        });
        scheduler.addPipeline("X", pipeline("slow_db"), ScheduleSpec.interval(60), true);

        AtomicReference<ExecutionOutcome> first = new AtomicReference<>();
        Thread caller = new Thread(() -> first.set(scheduler.executePipeline("X", true)), "first-caller");
        caller.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        ExecutionOutcome second = scheduler.executePipeline("X", true);
        assertEquals(ExecutionOutcome.Status.ALREADY_RUNNING, second.getStatus());
        assertEquals(ScheduleStatus.RUNNING, scheduler.getPipelineStatus("X").getStatus());

        release.countDown();
        caller.join(5000);

        assertEquals(ExecutionOutcome.Status.COMPLETED, first.get().getStatus());
        assertEquals(1, executionCount("X"), "Only one execution record may exist");
        assertEquals(1, scheduler.getPipelineStatus("X").getRunCount());
    }

    @Test
    void testDisablePipeline_countersKeptAndTriggersIgnored() throws Exception {
        scheduler.addPipeline("orders", pipeline("orders_db"), ScheduleSpec.interval(60), true);
        scheduler.executePipeline("orders", true);
        scheduler.executePipeline("orders", true);

        scheduler.disablePipeline("orders");

        ScheduledPipeline status = scheduler.getPipelineStatus("orders");
        assertFalse(status.isEnabled());
        assertEquals(2, status.getRunCount());
        assertEquals(2, status.getSuccessCount());
        assertEquals(0, status.getFailureCount());

        clock.advance(Duration.ofHours(3));
        scheduler.triggerTick();
        Thread.sleep(200);
        assertEquals(2, executionCount("orders"));

        ExecutionOutcome scheduled = scheduler.executePipeline("orders", false);
        assertEquals(ExecutionOutcome.Status.DISABLED, scheduled.getStatus());
        assertEquals(2, scheduler.getPipelineStatus("orders").getRunCount());

        // 手动触发忽略禁用标志
        assertEquals(ExecutionOutcome.Status.COMPLETED, scheduler.executePipeline("orders", true).getStatus());
        assertEquals(3, scheduler.getPipelineStatus("orders").getRunCount());
    }

    @Test
    void testTick_dispatchesDuePipelines() throws Exception {
        scheduler.addPipeline("orders", pipeline("orders_db"), ScheduleSpec.interval(30), true);
        scheduler.addPipeline("nightly", pipeline("orders_db"), ScheduleSpec.daily("02:00"), true);
        Instant firstDue = scheduler.getPipelineStatus("orders").getNextRun();

        scheduler.triggerTick();
        Thread.sleep(100);
        assertEquals(0, executionCount("orders"), "Interval pipelines first run one interval after registration");

        clock.advance(Duration.ofMinutes(31));
        scheduler.triggerTick();

        awaitCondition(() -> scheduler.getPipelineStatus("orders").getRunCount() == 1);
        assertEquals(1, executionCount("orders"));
        assertEquals(0, executionCount("nightly"));
        assertTrue(scheduler.getPipelineStatus("orders").getNextRun().isAfter(firstDue));
    }

    @Test
    void testExecutePipeline_failureRecorded() {
        connectors.registerSource("broken_db", () -> {
            throw new java.io.IOException("connection reset");
        });
        scheduler.addPipeline("broken", pipeline("broken_db"), ScheduleSpec.interval(60), true);

        ExecutionOutcome outcome = scheduler.executePipeline("broken", true);

        assertEquals(ExecutionOutcome.Status.FAILED, outcome.getStatus());
        assertNotNull(outcome.getResult());
        assertEquals(ExecutionStatus.FAILED, outcome.getResult().getStatus());

        ScheduledPipeline status = scheduler.getPipelineStatus("broken");
        assertEquals(ScheduleStatus.FAILED, status.getStatus());
        assertEquals(1, status.getFailureCount());
        assertTrue(status.getLastErrorMessage().contains("connection reset"));
        assertEquals(0.0, status.getSuccessRate(), 1e-9);

        assertTrue(store.getSchedulerEvents("broken", 10).stream()
                .anyMatch(e -> e.getEventType().equals("execution_error")));
        assertEquals(1, executionCount("broken"));
    }

    @Test
    void testExecutePipeline_timeoutRecordedAsFailure() throws Exception {
        scheduler.shutdown();
        scheduler = newScheduler(new PipelineRunner(1, 200));
        CountDownLatch never = new CountDownLatch(1);
        connectors.registerSource("hanging_db", () -> {
            never.await();
            return orders();
        });
        scheduler.addPipeline("hanging", pipeline("hanging_db"), ScheduleSpec.interval(60), true);

        ExecutionOutcome outcome = scheduler.executePipeline("hanging", true);

        assertEquals(ExecutionOutcome.Status.TIMED_OUT, outcome.getStatus());
        ScheduledPipeline status = scheduler.getPipelineStatus("hanging");
        assertEquals(1, status.getFailureCount());
        assertEquals(ScheduleStatus.FAILED, status.getStatus());
        // 被中断的工作线程退出后才释放槽位
        awaitCondition(() -> scheduler.getMetrics("hanging", 1).getRunningPipelines() == 0);
    }

    @Test
    void testRegistry_persistedAcrossRestarts() {
        scheduler.addPipeline("orders", pipeline("orders_db"), ScheduleSpec.weekly("friday", "18:30"), true);
        scheduler.executePipeline("orders", true);
        scheduler.disablePipeline("orders");
        scheduler.shutdown();

        scheduler = newScheduler(new PipelineRunner(1, 10_000));

        ScheduledPipeline restored = scheduler.getPipelineStatus("orders");
        assertNotNull(restored);
        assertFalse(restored.isEnabled());
        assertEquals(1, restored.getRunCount());
        assertEquals(1, restored.getSuccessCount());
        assertEquals(ScheduleType.WEEKLY, restored.getSchedule().getType());
        assertEquals("ConnectorExtractor", restored.getPipelineConfig().getExtractors().get(0).getClassName());
    }

    @Test
    void testRegistry_runningStatusResetOnLoad() {
        ScheduledPipeline stale = new ScheduledPipeline("orders", pipeline("orders_db"), ScheduleSpec.interval(15), true);
        stale.setStatus(ScheduleStatus.RUNNING);
        stale.setRunCount(7);
        new ScheduleConfigRepository(scheduleFile).save(1, Map.of("orders", stale));

        scheduler.shutdown();
        scheduler = newScheduler(new PipelineRunner(1, 10_000));

        ScheduledPipeline status = scheduler.getPipelineStatus("orders");
        assertEquals(ScheduleStatus.SCHEDULED, status.getStatus());
        assertEquals(7, status.getRunCount());
        assertEquals(ExecutionOutcome.Status.COMPLETED, scheduler.executePipeline("orders", false).getStatus());
    }

    @Test
    void testEnableDisable_unknownNameRejected() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.enablePipeline("ghost"));
        assertThrows(IllegalArgumentException.class, () -> scheduler.disablePipeline("ghost"));
    }

    @Test
    void testAddPipeline_invalidConfigurationRejected() {
        PipelineConfig unknownKind = pipeline("orders_db");
        unknownKind.setExtractors(List.of(new ComponentConfig("source", "FtpExtractor", null, null)));

        assertThrows(ConfigurationException.class,
                () -> scheduler.addPipeline("bad", unknownKind, ScheduleSpec.interval(60), true));
        assertThrows(ConfigurationException.class,
                () -> scheduler.addPipeline("bad", pipeline("orders_db"), ScheduleSpec.interval(0), true));
        assertThrows(ConfigurationException.class,
                () -> scheduler.addPipeline("bad", pipeline("orders_db"), ScheduleSpec.daily("25:99"), true));
        assertTrue(scheduler.getAllPipelineStatus().isEmpty());
    }

    @Test
    void testAddPipeline_cronRegisteredButNeverTriggered() throws Exception {
        scheduler.addPipeline("cron", pipeline("orders_db"), ScheduleSpec.cron("0 2 * * *"), true);

        clock.advance(Duration.ofDays(2));
        scheduler.triggerTick();
        Thread.sleep(100);

        assertEquals(0, executionCount("cron"));
        assertNull(scheduler.getPipelineStatus("cron").getNextRun());
        assertEquals(ExecutionOutcome.Status.COMPLETED, scheduler.executePipeline("cron", true).getStatus());
    }

    @Test
    void testGetMetrics_summarizesExecutions() {
        scheduler.addPipeline("orders", pipeline("orders_db"), ScheduleSpec.interval(60), true);
        scheduler.addPipeline("paused", pipeline("orders_db"), ScheduleSpec.interval(60), false);
        scheduler.executePipeline("orders", true);
        scheduler.executePipeline("orders", true);

        SchedulerMetricsReport report = scheduler.getMetrics(null, 7);

        assertEquals(7, report.getPeriodDays());
        assertEquals(2, report.getTotalPipelines());
        assertEquals(1, report.getActivePipelines());
        assertEquals(0, report.getRunningPipelines());
        assertEquals(1, report.getExecutions().size());
        PipelineExecutionSummary summary = report.getExecutions().get(0);
        assertEquals("orders", summary.getPipelineName());
        assertEquals(2, summary.getTotalExecutions());
        assertEquals(2, summary.getSuccessfulExecutions());
        assertEquals(1.0, summary.getSuccessRate(), 1e-9);
        // 抽取5行、加载5行
        assertEquals(20, summary.getTotalRecordsProcessed());
    }

    @Test
    void testStartStop_lifecycleEvents() {
        assertFalse(scheduler.isRunning());
        scheduler.start();
        scheduler.start();
        assertTrue(scheduler.isRunning());
        scheduler.stop();
        assertFalse(scheduler.isRunning());

        List<String> events = new ArrayList<>();
        store.getSchedulerEvents(null, 10).forEach(e -> events.add(e.getEventType()));
        assertTrue(events.contains("scheduler_started"));
        assertTrue(events.contains("scheduler_stopped"));
        assertEquals(1, events.stream().filter("scheduler_started"::equals).count());
    }
}
