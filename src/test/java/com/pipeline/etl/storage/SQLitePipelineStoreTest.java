package com.pipeline.etl.storage;

import com.pipeline.etl.MutableClock;
import com.pipeline.etl.exception.PipelineStoreException;
import com.pipeline.etl.model.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SQLitePipelineStoreTest {

    @TempDir
    Path tempDir;

    private SQLitePipelineStore store;
    private final Instant t0 = Instant.parse("2024-03-01T09:30:00Z");

    @BeforeEach
    void setUp() {
        store = new SQLitePipelineStore(tempDir.resolve("nested/dir/metrics.db").toString());
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private Alert alert(String id, AlertLevel level, double actual) {
        return new Alert(id, level, "Data Quality Alert: completeness_email",
                "Column 'email' completeness: " + actual, "members", "completeness_email", 0.95, actual, t0);
    }

    @Test
    void testConstruct_createsParentDirectories() {
        assertTrue(Files.isDirectory(tempDir.resolve("nested/dir")));
    }

    @Test
    void testSaveAlert_sameIdReplacesExistingRecord() {
        store.saveAlert(alert("a1", AlertLevel.WARNING, 0.90));
        store.saveAlert(alert("a1", AlertLevel.CRITICAL, 0.40));

        List<Alert> alerts = store.getAlerts(null, null, 100);
        assertEquals(1, alerts.size(), "An alert id is stored at most once");
        assertEquals(AlertLevel.CRITICAL, alerts.get(0).getLevel());
        assertEquals(0.40, store.getAlert("a1").getActualValue(), 1e-9);
    }

    @Test
    void testAlerts_filterAcknowledgeAndCount() {
        store.saveAlert(alert("a1", AlertLevel.WARNING, 0.90));
        store.saveAlert(alert("a2", AlertLevel.CRITICAL, 0.30));

        assertTrue(store.acknowledgeAlert("a1", "ops", t0.plusSeconds(60)));
        assertFalse(store.acknowledgeAlert("missing", "ops", t0));

        assertEquals(1, store.getAlerts(false, null, 100).size());
        assertEquals("a2", store.getAlerts(null, AlertLevel.CRITICAL, 100).get(0).getId());
        Alert acknowledged = store.getAlert("a1");
        assertTrue(acknowledged.isAcknowledged());
        assertEquals("ops", acknowledged.getAcknowledgedBy());
        assertEquals(t0.plusSeconds(60), acknowledged.getAcknowledgedAt());

        Map<AlertLevel, Long> active = store.countActiveAlertsByLevel(t0.minusSeconds(1));
        assertEquals(Map.of(AlertLevel.CRITICAL, 1L), active);
        assertNull(store.getAlert("missing"));
    }

    @Test
    void testExecutions_roundTripWithComponentMetrics() {
        ComponentMetrics extract = new ComponentMetrics("source", ComponentRole.EXTRACTOR);
        extract.setStatus(ComponentStatus.COMPLETED);
        extract.setRecordsProcessed(120);
        extract.setStartTime(t0);
        ComponentMetrics load = new ComponentMetrics("sink", ComponentRole.LOADER);
        load.setStatus(ComponentStatus.FAILED);
        load.addError("connection refused");

        ExecutionResult result = new ExecutionResult("exec-1", "orders");
        result.setStartTime(t0);
        result.setEndTime(t0.plusSeconds(3));
        result.setStatus(ExecutionStatus.PARTIAL);
        result.setDurationSeconds(3.0);
        result.setTotalComponents(2);
        result.setSuccessfulComponents(1);
        result.setFailedComponents(1);
        result.setErrorMessage("Loader 'sink' failed: connection refused");
        result.setComponentMetrics(List.of(extract, load));
        store.saveExecution(result);

        ExecutionResult older = new ExecutionResult("exec-0", "orders");
        older.setStartTime(t0.minus(Duration.ofDays(10)));
        older.setStatus(ExecutionStatus.COMPLETED);
        store.saveExecution(older);

        List<ExecutionResult> recent = store.getExecutions("orders", t0.minus(Duration.ofDays(1)));
        assertEquals(1, recent.size());
        ExecutionResult loaded = recent.get(0);
        assertEquals(ExecutionStatus.PARTIAL, loaded.getStatus());
        assertEquals(t0.plusSeconds(3), loaded.getEndTime());
        assertEquals(120, loaded.getTotalRecordsProcessed());
        assertEquals(List.of("connection refused"), loaded.getComponentMetrics().get(1).getErrors());
        assertEquals(ComponentRole.LOADER, loaded.getComponentMetrics().get(1).getRole());

        List<ExecutionResult> all = store.getExecutions(null, Instant.EPOCH);
        assertEquals(List.of("exec-1", "exec-0"), List.of(all.get(0).getExecutionId(), all.get(1).getExecutionId()));
    }

    @Test
    void testQualityMetrics_filteredByPipelineAndTime() {
        store.saveQualityMetrics(List.of(
                new QualityMetric("orders", "orders", "row_uniqueness", 1.0, 0.98, MetricType.UNIQUENESS,
                        MetricStatus.PASS, "ok", t0),
                new QualityMetric("members", "members", "completeness_email", 0.9, 0.95, MetricType.COMPLETENESS,
                        MetricStatus.FAIL, "low", t0),
                new QualityMetric("orders", "orders", "old", 0.5, 0.98, MetricType.ACCURACY,
                        MetricStatus.FAIL, "old", t0.minus(Duration.ofDays(2)))));

        List<QualityMetric> orders = store.getQualityMetrics("orders", t0.minus(Duration.ofDays(1)));
        assertEquals(1, orders.size());
        assertEquals(MetricType.UNIQUENESS, orders.get(0).getMetricType());
        assertEquals(MetricStatus.PASS, orders.get(0).getStatus());
        assertEquals(t0, orders.get(0).getTimestamp());

        assertEquals(2, store.getQualityMetrics(null, t0).size());
    }

    @Test
    void testDataProfile_latestSnapshotReturned() {
        ColumnProfile email = new ColumnProfile("email", ColumnType.STRING);
        email.setNullCount(10);
        email.setNullPercentage(0.1);
        email.setSampleValues(List.of("a@example.com", "b@example.com"));
        ColumnProfile age = new ColumnProfile("age", ColumnType.INTEGER);
        age.setMeanValue(41.5);
        age.setStdDev(null);

        Map<String, ColumnProfile> older = new LinkedHashMap<>();
        older.put("email", new ColumnProfile("email", ColumnType.STRING));
        store.saveDataProfile("members", "members", new DataProfile(5, 1, 0, older, t0.minusSeconds(3600)));

        Map<String, ColumnProfile> columns = new LinkedHashMap<>();
        columns.put("email", email);
        columns.put("age", age);
        store.saveDataProfile("members", "members", new DataProfile(100, 2, 3, columns, t0));

        DataProfile latest = store.getLatestDataProfile("members", "members");
        assertEquals(100, latest.getTotalRows());
        assertEquals(3, latest.getDuplicateRows());
        assertEquals(2, latest.getTotalColumns());
        assertEquals(List.of("a@example.com", "b@example.com"), latest.getColumn("email").getSampleValues());
        assertEquals(ColumnType.INTEGER, latest.getColumn("age").getDataType());
        assertEquals(41.5, latest.getColumn("age").getMeanValue(), 1e-9);
        assertNull(latest.getColumn("age").getStdDev());
        assertNull(store.getLatestDataProfile("members", "unknown"));
    }

    @Test
    void testHealthTrend_groupedByUtcDay() {
        store.saveHealthScore("orders", "e1", 0.8, t0);
        store.saveHealthScore("orders", "e2", 1.0, t0.plusSeconds(3600));
        store.saveHealthScore("orders", "e3", 0.6, t0.plus(Duration.ofDays(1)));
        store.saveHealthScore("members", "e4", 0.1, t0);

        List<HealthTrendPoint> trend = store.getHealthTrend("orders", t0.minusSeconds(1));

        assertEquals(2, trend.size());
        assertEquals(LocalDate.of(2024, 3, 1), trend.get(0).getDate());
        assertEquals(0.9, trend.get(0).getAvgHealthScore(), 1e-9);
        assertEquals(0.6, trend.get(1).getAvgHealthScore(), 1e-9);
        assertEquals(2, store.getHealthTrend(null, t0.minusSeconds(1)).size());
    }

    @Test
    void testPipelineMetricsAndEvents() {
        store.savePipelineMetric("orders", "success_rate", 0.5, t0);
        store.savePipelineMetric("orders", "success_rate", 0.75, t0.plusSeconds(60));
        store.savePipelineMetric("orders", "total_runs", 4, t0.plusSeconds(60));

        assertEquals(Map.of("success_rate", 0.75, "total_runs", 4.0), store.getLatestPipelineMetrics("orders"));

        store.logSchedulerEvent("pipeline_added", "orders", "Pipeline added", "interval");
        store.logSchedulerEvent("scheduler_started", null, "Scheduler started", null);

        List<SchedulerEvent> events = store.getSchedulerEvents(null, 10);
        assertEquals(2, events.size());
        assertEquals("scheduler_started", events.get(0).getEventType());
        assertEquals(1, store.getSchedulerEvents("orders", 10).size());
    }

    @Test
    void testLogSchedulerEvent_timestampTakenFromClock() {
        MutableClock clock = new MutableClock(t0);
        SQLitePipelineStore clocked = new SQLitePipelineStore(tempDir.resolve("clocked.db").toString(), clock);
        try {
            clocked.logSchedulerEvent("pipeline_added", "orders", "Pipeline added", null);
            clock.advance(Duration.ofMinutes(5));
            clocked.logSchedulerEvent("pipeline_removed", "orders", "Pipeline removed", null);

            List<SchedulerEvent> events = clocked.getSchedulerEvents("orders", 10);
            assertEquals(t0.plus(Duration.ofMinutes(5)), events.get(0).getTimestamp());
            assertEquals(t0, events.get(1).getTimestamp());
        } finally {
            clocked.close();
        }
    }

    @Test
    void testClosedStoreRaisesStoreException() {
        store.close();
        assertThrows(PipelineStoreException.class, () -> store.getAlerts(null, null, 10));
    }
}
