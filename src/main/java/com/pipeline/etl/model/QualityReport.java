package com.pipeline.etl.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 质量报告：按指标类型的通过率、按级别的活跃告警数和每日健康分趋势
 */
public class QualityReport {
    private final Instant generatedAt;
    private final int periodDays;
    private final Map<MetricType, MetricTypeSummary> metricSummaries;
    private final Map<AlertLevel, Long> activeAlertsByLevel;
    private final List<HealthTrendPoint> healthTrend;

    public QualityReport(Instant generatedAt, int periodDays,
                         Map<MetricType, MetricTypeSummary> metricSummaries,
                         Map<AlertLevel, Long> activeAlertsByLevel,
                         List<HealthTrendPoint> healthTrend) {
        this.generatedAt = generatedAt;
        this.periodDays = periodDays;
        this.metricSummaries = metricSummaries.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(metricSummaries));
        this.activeAlertsByLevel = activeAlertsByLevel.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(activeAlertsByLevel));
        this.healthTrend = List.copyOf(healthTrend);
    }

    /** 各类型平均值的均值，无数据时为1.0 */
    public double getOverallQualityScore() {
        return metricSummaries.values().stream()
                .mapToDouble(MetricTypeSummary::getAvgValue)
                .average()
                .orElse(1.0);
    }

    /** 趋势点平均值，无数据时为1.0 */
    public double getOverallHealthScore() {
        return healthTrend.stream()
                .mapToDouble(HealthTrendPoint::getAvgHealthScore)
                .average()
                .orElse(1.0);
    }

    public long getTotalChecks() {
        return metricSummaries.values().stream().mapToLong(MetricTypeSummary::getTotalChecks).sum();
    }

    public long getPassedChecks() {
        return metricSummaries.values().stream().mapToLong(MetricTypeSummary::getPassedChecks).sum();
    }

    public long getActiveAlerts() {
        return activeAlertsByLevel.values().stream().mapToLong(Long::longValue).sum();
    }

    public MetricTypeSummary getSummary(MetricType type) {
        return metricSummaries.get(type);
    }

    public Instant getGeneratedAt() { return generatedAt; }
    public int getPeriodDays() { return periodDays; }
    public Map<MetricType, MetricTypeSummary> getMetricSummaries() { return metricSummaries; }
    public Map<AlertLevel, Long> getActiveAlertsByLevel() { return activeAlertsByLevel; }
    public List<HealthTrendPoint> getHealthTrend() { return healthTrend; }
}
