package com.pipeline.etl.core.impl;

import com.pipeline.etl.MutableClock;
import com.pipeline.etl.model.*;
import com.pipeline.etl.storage.SQLitePipelineStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DefaultQualityMonitorTest {

    @TempDir
    Path tempDir;

    private SQLitePipelineStore store;
    private MutableClock clock;
    private DefaultQualityMonitor monitor;

    @BeforeEach
    void setUp() {
        store = new SQLitePipelineStore(tempDir.resolve("metrics.db").toString());
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        monitor = new DefaultQualityMonitor(store, QualityThresholds.defaults(), clock);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    /**
     * 100行会员数据，email列前nonNullEmails行有值，其余为空
     */
    private Dataset members(int nonNullEmails) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("name", "Member " + i);
            row.put("email", i < nonNullEmails ? "member" + i + "@example.com" : null);
            row.put("city", i % 2 == 0 ? "Lisbon" : "Porto");
            rows.add(row);
        }
        return Dataset.fromRows(rows);
    }

    private static Map<String, QualityMetric> byName(List<QualityMetric> metrics) {
        return metrics.stream().collect(Collectors.toMap(QualityMetric::getName, m -> m));
    }

    @Test
    void testAnalyze_columnCompletenessBelowThresholdRaisesOneWarning() {
        List<QualityMetric> metrics = monitor.analyze(members(90), "members", "members");

        QualityMetric email = byName(metrics).get("completeness_email");
        assertEquals(0.90, email.getValue(), 1e-9);
        assertEquals(MetricStatus.FAIL, email.getStatus());
        assertEquals(MetricStatus.PASS, byName(metrics).get("overall_completeness").getStatus());
        assertEquals(1, metrics.stream().filter(QualityMetric::isFailed).count());

        List<Alert> alerts = monitor.getAlerts(null, null);
        assertEquals(1, alerts.size());
        Alert alert = alerts.get(0);
        assertEquals(AlertLevel.WARNING, alert.getLevel());
        assertEquals("completeness_email", alert.getMetricName());
        assertEquals("Data Quality Alert: completeness_email", alert.getTitle());
        assertTrue(alert.getMessage().endsWith("(Threshold: 95.00%)"));
        assertEquals(0.90, alert.getActualValue(), 1e-9);
        assertEquals(DefaultQualityMonitor.alertId("members", "completeness_email", clock.instant()), alert.getId());
    }

    @Test
    void testAnalyze_severeCompletenessGapIsCritical() {
        monitor.analyze(members(40), "members", "members");

        Alert alert = monitor.getAlerts(null, null).stream()
                .filter(a -> a.getMetricName().equals("completeness_email"))
                .findFirst()
                .orElseThrow();
        assertEquals(AlertLevel.CRITICAL, alert.getLevel());
        assertEquals(0.40, alert.getActualValue(), 1e-9);
    }

    @Test
    void testLevelFor_tierBoundaries() {
        Instant now = clock.instant();
        assertEquals(AlertLevel.WARNING, DefaultQualityMonitor.levelFor(new QualityMetric("p", "t", "m", 0.80, 1.0,
                MetricType.ACCURACY, MetricStatus.FAIL, "", now)));
        assertEquals(AlertLevel.ERROR, DefaultQualityMonitor.levelFor(new QualityMetric("p", "t", "m", 0.79, 1.0,
                MetricType.ACCURACY, MetricStatus.FAIL, "", now)));
        assertEquals(AlertLevel.CRITICAL, DefaultQualityMonitor.levelFor(new QualityMetric("p", "t", "m", 0.49, 1.0,
                MetricType.ACCURACY, MetricStatus.FAIL, "", now)));
        // 时效性按 阈值/实际 计算
        assertEquals(AlertLevel.CRITICAL, DefaultQualityMonitor.levelFor(new QualityMetric("p", "t", "m", 60, 24,
                MetricType.TIMELINESS, MetricStatus.FAIL, "", now)));
    }

    @Test
    void testAnalyze_validityUniquenessAndConsistency() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("customer_id", i < 8 ? i : 7);
            // 最后两行完全相同
            row.put("phone", i == 0 ? "call me" : "555-123-000" + Math.min(i, 8));
            rows.add(row);
        }

        Map<String, QualityMetric> metrics = byName(monitor.analyze(Dataset.fromRows(rows), "crm", null));

        assertEquals(0.9, metrics.get("phone_validity_phone").getValue(), 1e-9);
        assertEquals(MetricType.VALIDITY, metrics.get("phone_validity_phone").getMetricType());
        assertEquals(0.8, metrics.get("uniqueness_customer_id").getValue(), 1e-9);
        assertEquals(1.0, metrics.get("fk_consistency_customer_id").getValue(), 1e-9);
        assertEquals(1.0, metrics.get("type_consistency_customer_id").getValue(), 1e-9);
        assertEquals(0.9, metrics.get("row_uniqueness").getValue(), 1e-9);
        assertEquals("crm", metrics.get("row_uniqueness").getTableName());
    }

    @Test
    void testAnalyze_staleTimestampsFailTimeliness() {
        Dataset data = Dataset.fromRows(List.of(
                Map.of("sku", "A", "updated_at", clock.instant().minus(Duration.ofHours(72))),
                Map.of("sku", "B", "updated_at", clock.instant().minus(Duration.ofHours(60)))));

        QualityMetric freshness = byName(monitor.analyze(data, "inventory", "stock")).get("freshness_updated_at");

        assertEquals(60.0, freshness.getValue(), 1e-9);
        assertEquals(24.0, freshness.getThreshold(), 1e-9);
        assertEquals(MetricStatus.FAIL, freshness.getStatus());
        assertEquals(AlertLevel.CRITICAL, monitor.getAlerts(false, null).stream()
                .filter(a -> a.getMetricName().equals("freshness_updated_at"))
                .findFirst().orElseThrow().getLevel());
    }

    @Test
    void testAnalyze_emptyDatasetProducesNothing() {
        assertTrue(monitor.analyze(Dataset.empty(), "members", "members").isEmpty());
        assertTrue(store.getQualityMetrics("members", Instant.EPOCH).isEmpty());
    }

    @Test
    void testHealthScore_neutralWithoutMetrics() {
        assertEquals(1.0, monitor.calculateHealthScore("members"), 1e-9);
        assertEquals(1.0, monitor.calculateHealthScore(null), 1e-9);
    }

    @Test
    void testHealthScore_weightedOverPresentTypesOnly() {
        Instant now = clock.instant();
        monitor.recordMetrics(List.of(
                new QualityMetric("orders", "orders", "completeness_a", 0.8, 0.5, MetricType.COMPLETENESS,
                        MetricStatus.PASS, "", now),
                new QualityMetric("orders", "orders", "range_b", 1.0, 0.5, MetricType.ACCURACY,
                        MetricStatus.PASS, "", now),
                new QualityMetric("orders", "orders", "freshness_c", 200.0, 24.0, MetricType.TIMELINESS,
                        MetricStatus.FAIL, "", now)));

        assertEquals(0.9, monitor.calculateHealthScore("orders"), 1e-9);

        // 窗口之外的指标不计入
        clock.advance(Duration.ofHours(25));
        assertEquals(1.0, monitor.calculateHealthScore("orders"), 1e-9);
    }

    @Test
    void testRecordRuleResults_createsRuleMetricsAndAlerts() {
        RuleResult failed = new RuleResult("email_present", "not_null", "email", false, 30, 0.7, 1.0,
                MetricType.COMPLETENESS, RuleSeverity.ERROR, "Column 'email' has 30 null values");
        RuleResult passed = new RuleResult("id_unique", "unique", "id", true, 0, 1.0, 1.0,
                MetricType.UNIQUENESS, RuleSeverity.ERROR, "Column 'id' has 0 duplicate values");

        List<QualityMetric> metrics = monitor.recordRuleResults("orders", null, List.of(failed, passed));

        assertEquals(List.of("rule_email_present", "rule_id_unique"),
                metrics.stream().map(QualityMetric::getName).collect(Collectors.toList()));
        assertEquals("orders", metrics.get(0).getTableName());
        List<Alert> alerts = monitor.getAlerts(false, AlertLevel.ERROR);
        assertEquals(1, alerts.size());
        assertEquals("rule_email_present", alerts.get(0).getMetricName());
    }

    @Test
    void testGenerateReport_summarizesMetricsAlertsAndTrend() {
        monitor.analyze(members(90), "members", "members");
        monitor.recordHealthScore("members", "exec-1");

        QualityReport report = monitor.generateReport(7);

        assertEquals(7, report.getPeriodDays());
        assertEquals(clock.instant(), report.getGeneratedAt());
        MetricTypeSummary completeness = report.getSummary(MetricType.COMPLETENESS);
        assertEquals(4, completeness.getTotalChecks());
        assertEquals(3, completeness.getPassedChecks());
        assertEquals(0.90, completeness.getMinValue(), 1e-9);
        assertEquals(1, report.getActiveAlerts());
        assertEquals(1L, report.getActiveAlertsByLevel().get(AlertLevel.WARNING).longValue());
        assertEquals(1, report.getHealthTrend().size());
        assertEquals(report.getHealthTrend().get(0).getAvgHealthScore(), report.getOverallHealthScore(), 1e-9);
        assertTrue(report.getOverallQualityScore() < 1.0);
    }

    @Test
    void testGenerateReport_emptyStoreDefaults() {
        QualityReport report = monitor.generateReport();

        assertEquals(7, report.getPeriodDays());
        assertEquals(0, report.getTotalChecks());
        assertEquals(1.0, report.getOverallQualityScore(), 1e-9);
        assertEquals(1.0, report.getOverallHealthScore(), 1e-9);
    }

    @Test
    void testAcknowledgeAlert() {
        monitor.analyze(members(90), "members", "members");
        String alertId = monitor.getAlerts(false, null).get(0).getId();

        assertTrue(monitor.acknowledgeAlert(alertId, "oncall"));
        assertFalse(monitor.acknowledgeAlert("missing", "oncall"));

        assertTrue(monitor.getAlerts(false, null).isEmpty());
        Alert acknowledged = monitor.getAlerts(true, null).get(0);
        assertEquals("oncall", acknowledged.getAcknowledgedBy());
        assertEquals(clock.instant(), acknowledged.getAcknowledgedAt());
        assertEquals(0, monitor.generateReport(7).getActiveAlerts());
    }
}
