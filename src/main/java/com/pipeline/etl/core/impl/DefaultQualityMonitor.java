package com.pipeline.etl.core.impl;

import com.pipeline.etl.core.PipelineStore;
import com.pipeline.etl.core.QualityMonitor;
import com.pipeline.etl.model.*;
import com.pipeline.etl.quality.DataProfiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 质量监控默认实现。
 *
 * 每次分析计算完整性、有效性、唯一性、一致性和时效性指标，
 * 低于阈值的指标按偏离程度分级生成告警（actual/threshold &lt; 0.5 critical，&lt; 0.8 error，其余warning），
 * 告警id由(管道, 指标, 时间戳)确定，重复评估不会产生重复告警。
 */
public class DefaultQualityMonitor implements QualityMonitor {

    private static final Logger log = LoggerFactory.getLogger(DefaultQualityMonitor.class);

    /** 健康分权重，时效性不参与 */
    private static final Map<MetricType, Double> HEALTH_WEIGHTS = new EnumMap<>(MetricType.class);

    static {
        HEALTH_WEIGHTS.put(MetricType.COMPLETENESS, 0.25);
        HEALTH_WEIGHTS.put(MetricType.ACCURACY, 0.25);
        HEALTH_WEIGHTS.put(MetricType.VALIDITY, 0.20);
        HEALTH_WEIGHTS.put(MetricType.CONSISTENCY, 0.15);
        HEALTH_WEIGHTS.put(MetricType.UNIQUENESS, 0.15);
    }

    private static final int MAX_ALERTS = 100;

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
    private static final Pattern PHONE_PATTERN =
            Pattern.compile("^\\+?1?[-.\\s]?\\(?[0-9]{3}\\)?[-.\\s]?[0-9]{3}[-.\\s]?[0-9]{4}$");

    private static final List<String> DATE_TOKENS = List.of("date", "time", "created", "updated");
    private static final List<String> UNIQUE_TOKENS = List.of("id", "email", "isbn", "code");
    private static final List<String> FRESHNESS_TOKENS = List.of("updated", "created", "timestamp");

    private final PipelineStore store;
    private final QualityThresholds thresholds;
    private final Duration healthWindow;
    private final int defaultReportDays;
    private final Clock clock;
    private final DataProfiler profiler = new DataProfiler();

    public DefaultQualityMonitor(PipelineStore store, QualityThresholds thresholds, Clock clock) {
        this(store, thresholds, Duration.ofHours(24), 7, clock);
    }

    public DefaultQualityMonitor(PipelineStore store, QualityThresholds thresholds,
                                 Duration healthWindow, int defaultReportDays, Clock clock) {
        this.store = store;
        this.thresholds = thresholds != null ? thresholds : QualityThresholds.defaults();
        this.healthWindow = healthWindow;
        this.defaultReportDays = defaultReportDays;
        this.clock = clock;
        log.info("QualityMonitor initialized. Thresholds: {}, health window: {}h",
                this.thresholds, healthWindow.toHours());
    }

    // ==================== 数据分析 ====================

    @Override
    public List<QualityMetric> analyze(Dataset data, String pipelineName, String tableName) {
        String table = tableName != null ? tableName : pipelineName;
        if (data == null || data.isEmpty() || data.columnCount() == 0) {
            log.warn("Skipping quality analysis for '{}/{}': dataset is empty.", pipelineName, table);
            return Collections.emptyList();
        }

        // 同一次分析的所有指标共享一个时间戳
        Instant now = clock.instant();
        MetricBuilder builder = new MetricBuilder(pipelineName, table, now);

        analyzeCompleteness(data, builder);
        analyzeValidity(data, builder);
        analyzeUniqueness(data, builder);
        analyzeConsistency(data, builder);
        analyzeTimeliness(data, builder, now);

        List<QualityMetric> metrics = builder.metrics;
        List<Alert> alerts = recordMetrics(metrics);
        recordDataProfile(pipelineName, table, profiler.profile(data, now));

        log.info("Quality analysis for '{}/{}': {} metrics, {} failed, {} alerts.",
                pipelineName, table, metrics.size(),
                metrics.stream().filter(QualityMetric::isFailed).count(), alerts.size());
        return metrics;
    }

    private void analyzeCompleteness(Dataset data, MetricBuilder builder) {
        double threshold = thresholds.getCompleteness();
        double overall = (double) data.nonNullCellCount() / data.cellCount();
        builder.ratio("overall_completeness", MetricType.COMPLETENESS, overall, threshold,
                String.format("Overall data completeness: %.2f%%", overall * 100));

        for (String column : data.getColumns()) {
            double completeness = (double) data.nonNullCount(column) / data.size();
            builder.ratio("completeness_" + column, MetricType.COMPLETENESS, completeness, threshold,
                    String.format("Column '%s' completeness: %.2f%%", column, completeness * 100));
        }
    }

    private void analyzeValidity(Dataset data, MetricBuilder builder) {
        double threshold = thresholds.getValidity();
        for (String column : data.getColumns()) {
            String lower = column.toLowerCase();
            if (lower.contains("email")) {
                validityMetric(data, column, "email", v -> EMAIL_PATTERN.matcher(v.toString()).matches(),
                        threshold, builder);
            }
            if (lower.contains("phone")) {
                validityMetric(data, column, "phone", v -> PHONE_PATTERN.matcher(v.toString()).matches(),
                        threshold, builder);
            }
            if (containsAny(lower, DATE_TOKENS)) {
                validityMetric(data, column, "date", v -> ColumnType.toInstant(v) != null, threshold, builder);
            }
        }
    }

    private void validityMetric(Dataset data, String column, String kind,
                                Predicate<Object> check, double threshold, MetricBuilder builder) {
        long total = 0;
        long valid = 0;
        for (Object value : data.getColumnValues(column)) {
            if (value == null) continue;
            total++;
            if (check.test(value)) valid++;
        }
        // 全为空的列没有可判断的值，由完整性指标反映
        if (total == 0) return;
        double validity = (double) valid / total;
        String label = Character.toUpperCase(kind.charAt(0)) + kind.substring(1);
        builder.ratio(kind + "_validity_" + column, MetricType.VALIDITY, validity, threshold,
                String.format("%s validity for '%s': %.2f%%", label, column, validity * 100));
    }

    private void analyzeUniqueness(Dataset data, MetricBuilder builder) {
        double threshold = thresholds.getUniqueness();
        for (String column : data.getColumns()) {
            if (!containsAny(column.toLowerCase(), UNIQUE_TOKENS)) continue;
            List<Object> values = data.getColumnValues(column).stream()
                    .filter(Objects::nonNull)
                    .collect(Collectors.toList());
            if (values.isEmpty()) continue;
            long unique = new HashSet<>(values).size();
            double uniqueness = (double) unique / values.size();
            builder.ratio("uniqueness_" + column, MetricType.UNIQUENESS, uniqueness, threshold,
                    String.format("Uniqueness for '%s': %.2f%% (%d/%d)", column, uniqueness * 100, unique, values.size()));
        }

        long duplicates = data.duplicateRowCount();
        double rowUniqueness = (double) (data.size() - duplicates) / data.size();
        builder.ratio("row_uniqueness", MetricType.UNIQUENESS, rowUniqueness, threshold,
                String.format("Row uniqueness: %.2f%% (%d duplicates)", rowUniqueness * 100, duplicates));
    }

    private void analyzeConsistency(Dataset data, MetricBuilder builder) {
        double threshold = thresholds.getConsistency();

        // 外键列非空比例，近似引用完整性
        for (String column : data.getColumns()) {
            if (!column.endsWith("_id")) continue;
            double consistency = (double) data.nonNullCount(column) / data.size();
            builder.ratio("fk_consistency_" + column, MetricType.CONSISTENCY, consistency, threshold,
                    String.format("Foreign key consistency for '%s': %.2f%%", column, consistency * 100));
        }

        for (String column : data.getColumns()) {
            ColumnType type = data.getColumnType(column);
            long total = 0;
            long consistent = 0;
            for (Object value : data.getColumnValues(column)) {
                if (value == null) continue;
                total++;
                if (type.isCoercible(value)) consistent++;
            }
            if (total == 0) continue;
            double consistency = (double) consistent / total;
            builder.ratio("type_consistency_" + column, MetricType.CONSISTENCY, consistency, threshold,
                    String.format("Type consistency for '%s' (%s): %.2f%%", column, type, consistency * 100));
        }
    }

    private void analyzeTimeliness(Dataset data, MetricBuilder builder, Instant now) {
        double maxAgeHours = thresholds.getTimelinessHours();
        for (String column : data.getColumns()) {
            if (!containsAny(column.toLowerCase(), FRESHNESS_TOKENS)) continue;
            Instant newest = null;
            for (Object value : data.getColumnValues(column)) {
                Instant instant = ColumnType.toInstant(value);
                if (instant != null && (newest == null || instant.isAfter(newest))) {
                    newest = instant;
                }
            }
            if (newest == null) continue;
            double ageHours = Math.max(0, Duration.between(newest, now).toMillis() / 3_600_000.0);
            MetricStatus status = ageHours <= maxAgeHours ? MetricStatus.PASS : MetricStatus.FAIL;
            builder.add("freshness_" + column, MetricType.TIMELINESS, ageHours, maxAgeHours, status,
                    String.format("Newest value in '%s' is %.1f hours old", column, ageHours));
        }
    }

    private static boolean containsAny(String text, List<String> tokens) {
        for (String token : tokens) {
            if (text.contains(token)) return true;
        }
        return false;
    }

    /**
     * 收集同一次分析产生的指标
     */
    private static final class MetricBuilder {
        private final String pipelineName;
        private final String tableName;
        private final Instant timestamp;
        private final List<QualityMetric> metrics = new ArrayList<>();

        MetricBuilder(String pipelineName, String tableName, Instant timestamp) {
            this.pipelineName = pipelineName;
            this.tableName = tableName;
            this.timestamp = timestamp;
        }

        void ratio(String name, MetricType type, double value, double threshold, String message) {
            add(name, type, value, threshold, value >= threshold ? MetricStatus.PASS : MetricStatus.FAIL, message);
        }

        void add(String name, MetricType type, double value, double threshold, MetricStatus status, String message) {
            metrics.add(new QualityMetric(pipelineName, tableName, name, value, threshold, type, status,
                    message, timestamp));
        }
    }

    // ==================== 指标记录与告警 ====================

    @Override
    public List<Alert> recordMetrics(List<QualityMetric> metrics) {
        if (metrics.isEmpty()) {
            return Collections.emptyList();
        }
        store.saveQualityMetrics(metrics);

        List<Alert> alerts = new ArrayList<>();
        for (QualityMetric metric : metrics) {
            if (!metric.isFailed()) continue;
            Alert alert = createAlert(metric);
            store.saveAlert(alert);
            alerts.add(alert);
            log.warn("Quality alert [{}] for pipeline '{}': {}",
                    alert.getLevel().getValue(), alert.getPipelineName(), alert.getMessage());
        }
        return alerts;
    }

    /**
     * 按偏离程度确定告警级别。比率型指标取 actual/threshold，时效性取 threshold/actual。
     */
    static AlertLevel levelFor(QualityMetric metric) {
        double ratio;
        if (metric.getMetricType() == MetricType.TIMELINESS) {
            ratio = metric.getValue() <= 0 ? 1.0 : metric.getThreshold() / metric.getValue();
        } else {
            ratio = metric.getThreshold() <= 0 ? 1.0 : metric.getValue() / metric.getThreshold();
        }
        if (ratio < 0.5) return AlertLevel.CRITICAL;
        if (ratio < 0.8) return AlertLevel.ERROR;
        return AlertLevel.WARNING;
    }

    static String alertId(String pipelineName, String metricName, Instant timestamp) {
        return HashIds.md5Hex(pipelineName + "_" + metricName + "_" + timestamp);
    }

    private Alert createAlert(QualityMetric metric) {
        String thresholdText = metric.getMetricType() == MetricType.TIMELINESS
                ? String.format("%.1fh", metric.getThreshold())
                : String.format("%.2f%%", metric.getThreshold() * 100);
        return new Alert(
                alertId(metric.getPipelineName(), metric.getName(), metric.getTimestamp()),
                levelFor(metric),
                "Data Quality Alert: " + metric.getName(),
                metric.getMessage() + " (Threshold: " + thresholdText + ")",
                metric.getPipelineName(),
                metric.getName(),
                metric.getThreshold(),
                metric.getValue(),
                metric.getTimestamp());
    }

    @Override
    public List<QualityMetric> recordRuleResults(String pipelineName, String tableName, List<RuleResult> results) {
        Instant now = clock.instant();
        String table = tableName != null ? tableName : pipelineName;
        List<QualityMetric> metrics = new ArrayList<>();
        for (RuleResult result : results) {
            metrics.add(new QualityMetric(pipelineName, table, "rule_" + result.getRuleName(),
                    result.getScore(), result.getThreshold(), result.getMetricType(),
                    result.isPassed() ? MetricStatus.PASS : MetricStatus.FAIL,
                    result.getMessage(), now));
        }
        recordMetrics(metrics);
        return metrics;
    }

    @Override
    public void recordDataProfile(String pipelineName, String tableName, DataProfile profile) {
        store.saveDataProfile(pipelineName, tableName != null ? tableName : pipelineName, profile);
        log.debug("Data profile stored for '{}/{}': {} columns.", pipelineName, tableName, profile.getTotalColumns());
    }

    // ==================== 健康分 ====================

    @Override
    public double calculateHealthScore(String pipelineName) {
        Instant since = clock.instant().minus(healthWindow);
        Map<MetricType, double[]> sums = new EnumMap<>(MetricType.class);
        for (QualityMetric metric : store.getQualityMetrics(pipelineName, since)) {
            if (!HEALTH_WEIGHTS.containsKey(metric.getMetricType())) continue;
            double[] acc = sums.computeIfAbsent(metric.getMetricType(), t -> new double[2]);
            acc[0] += metric.getValue();
            acc[1] += 1;
        }
        if (sums.isEmpty()) {
            return 1.0;
        }

        double weighted = 0;
        double totalWeight = 0;
        for (Map.Entry<MetricType, double[]> entry : sums.entrySet()) {
            double weight = HEALTH_WEIGHTS.get(entry.getKey());
            weighted += entry.getValue()[0] / entry.getValue()[1] * weight;
            totalWeight += weight;
        }
        return weighted / totalWeight;
    }

    @Override
    public double recordHealthScore(String pipelineName, String executionId) {
        double score = calculateHealthScore(pipelineName);
        store.saveHealthScore(pipelineName, executionId, score, clock.instant());
        log.info("Pipeline '{}' health score: {}", pipelineName, String.format("%.3f", score));
        return score;
    }

    // ==================== 报告与告警查询 ====================

    @Override
    public QualityReport generateReport(int days) {
        Instant now = clock.instant();
        Instant since = now.minus(Duration.ofDays(days));

        Map<MetricType, List<QualityMetric>> byType = store.getQualityMetrics(null, since).stream()
                .collect(Collectors.groupingBy(QualityMetric::getMetricType,
                        () -> new EnumMap<>(MetricType.class), Collectors.toList()));

        Map<MetricType, MetricTypeSummary> summaries = new EnumMap<>(MetricType.class);
        for (Map.Entry<MetricType, List<QualityMetric>> entry : byType.entrySet()) {
            List<QualityMetric> metrics = entry.getValue();
            DoubleSummaryStatistics stats = metrics.stream().mapToDouble(QualityMetric::getValue).summaryStatistics();
            long passed = metrics.stream().filter(m -> !m.isFailed()).count();
            summaries.put(entry.getKey(), new MetricTypeSummary(entry.getKey(), metrics.size(), passed,
                    stats.getAverage(), stats.getMin(), stats.getMax()));
        }

        QualityReport report = new QualityReport(now, days, summaries,
                store.countActiveAlertsByLevel(since),
                store.getHealthTrend(null, since));
        log.info("Quality report generated for last {} days: {} checks, {} active alerts.",
                days, report.getTotalChecks(), report.getActiveAlerts());
        return report;
    }

    @Override
    public QualityReport generateReport() {
        return generateReport(defaultReportDays);
    }

    @Override
    public List<Alert> getAlerts(Boolean acknowledged, AlertLevel level) {
        return store.getAlerts(acknowledged, level, MAX_ALERTS);
    }

    @Override
    public boolean acknowledgeAlert(String alertId, String acknowledgedBy) {
        boolean updated = store.acknowledgeAlert(alertId, acknowledgedBy, clock.instant());
        if (updated) {
            log.info("Alert {} acknowledged by {}", alertId, acknowledgedBy);
        } else {
            log.warn("Alert {} not found, nothing to acknowledge.", alertId);
        }
        return updated;
    }

    public QualityThresholds getThresholds() { return thresholds; }
}
