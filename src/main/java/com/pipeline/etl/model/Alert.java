package com.pipeline.etl.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * 质量指标越限告警。
 * id由(管道, 指标, 时间戳)确定性生成；确认是唯一允许的修改。
 */
public class Alert implements Serializable {
    private final String id;
    private final AlertLevel level;
    private final String title;
    private final String message;
    private final String pipelineName;
    private final String metricName;
    private final double threshold;
    private final double actualValue;
    private final Instant timestamp;
    private boolean acknowledged;
    private Instant acknowledgedAt;
    private String acknowledgedBy;

    public Alert(String id, AlertLevel level, String title, String message, String pipelineName,
                 String metricName, double threshold, double actualValue, Instant timestamp) {
        this.id = id;
        this.level = level;
        this.title = title;
        this.message = message;
        this.pipelineName = pipelineName;
        this.metricName = metricName;
        this.threshold = threshold;
        this.actualValue = actualValue;
        this.timestamp = timestamp;
    }

    public void acknowledge(String by, Instant at) {
        this.acknowledged = true;
        this.acknowledgedBy = by;
        this.acknowledgedAt = at;
    }

    public String getId() { return id; }
    public AlertLevel getLevel() { return level; }
    public String getTitle() { return title; }
    public String getMessage() { return message; }
    public String getPipelineName() { return pipelineName; }
    public String getMetricName() { return metricName; }
    public double getThreshold() { return threshold; }
    public double getActualValue() { return actualValue; }
    public Instant getTimestamp() { return timestamp; }
    public boolean isAcknowledged() { return acknowledged; }
    public Instant getAcknowledgedAt() { return acknowledgedAt; }
    public String getAcknowledgedBy() { return acknowledgedBy; }
}
