package com.pipeline.etl.model;

/**
 * 报告周期内某一指标类型的汇总
 */
public class MetricTypeSummary {
    private final MetricType metricType;
    private final long totalChecks;
    private final long passedChecks;
    private final double avgValue;
    private final double minValue;
    private final double maxValue;

    public MetricTypeSummary(MetricType metricType, long totalChecks, long passedChecks,
                             double avgValue, double minValue, double maxValue) {
        this.metricType = metricType;
        this.totalChecks = totalChecks;
        this.passedChecks = passedChecks;
        this.avgValue = avgValue;
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    public double getPassRate() {
        return totalChecks == 0 ? 1.0 : (double) passedChecks / totalChecks;
    }

    public MetricType getMetricType() { return metricType; }
    public long getTotalChecks() { return totalChecks; }
    public long getPassedChecks() { return passedChecks; }
    public double getAvgValue() { return avgValue; }
    public double getMinValue() { return minValue; }
    public double getMaxValue() { return maxValue; }
}
