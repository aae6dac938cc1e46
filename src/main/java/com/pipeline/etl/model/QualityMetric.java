package com.pipeline.etl.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * 一次质量度量的结果。创建后不可变。
 */
public class QualityMetric implements Serializable {
    private final String pipelineName;
    private final String tableName;
    private final String name;
    /** 比率型指标取值[0,1]；时效性指标单位为小时 */
    private final double value;
    private final double threshold;
    private final MetricType metricType;
    private final MetricStatus status;
    private final String message;
    private final Instant timestamp;

    public QualityMetric(String pipelineName, String tableName, String name, double value,
                         double threshold, MetricType metricType, MetricStatus status,
                         String message, Instant timestamp) {
        this.pipelineName = pipelineName;
        this.tableName = tableName;
        this.name = Objects.requireNonNull(name, "metric name must not be null");
        this.value = value;
        this.threshold = threshold;
        this.metricType = Objects.requireNonNull(metricType, "metric type must not be null");
        this.status = Objects.requireNonNull(status, "metric status must not be null");
        this.message = message;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public boolean isFailed() {
        return status == MetricStatus.FAIL;
    }

    public String getPipelineName() { return pipelineName; }
    public String getTableName() { return tableName; }
    public String getName() { return name; }
    public double getValue() { return value; }
    public double getThreshold() { return threshold; }
    public MetricType getMetricType() { return metricType; }
    public MetricStatus getStatus() { return status; }
    public String getMessage() { return message; }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return "QualityMetric{" + name + "=" + value + ", threshold=" + threshold
                + ", type=" + metricType.getValue() + ", status=" + status.getValue() + "}";
    }
}
