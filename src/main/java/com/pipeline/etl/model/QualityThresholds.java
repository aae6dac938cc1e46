package com.pipeline.etl.model;

/**
 * 各类质量指标的告警阈值。比率型指标低于阈值为失败，时效性（小时）高于阈值为失败。
 */
public class QualityThresholds {
    private double completeness = 0.95;
    private double accuracy = 0.98;
    private double consistency = 0.95;
    private double validity = 0.99;
    private double uniqueness = 0.98;
    private double timelinessHours = 24;

    public static QualityThresholds defaults() {
        return new QualityThresholds();
    }

    public double forType(MetricType type) {
        switch (type) {
            case COMPLETENESS: return completeness;
            case ACCURACY: return accuracy;
            case CONSISTENCY: return consistency;
            case VALIDITY: return validity;
            case UNIQUENESS: return uniqueness;
            case TIMELINESS: return timelinessHours;
            default: throw new IllegalArgumentException("Unknown metric type: " + type);
        }
    }

    public double getCompleteness() { return completeness; }
    public void setCompleteness(double completeness) { this.completeness = completeness; }
    public double getAccuracy() { return accuracy; }
    public void setAccuracy(double accuracy) { this.accuracy = accuracy; }
    public double getConsistency() { return consistency; }
    public void setConsistency(double consistency) { this.consistency = consistency; }
    public double getValidity() { return validity; }
    public void setValidity(double validity) { this.validity = validity; }
    public double getUniqueness() { return uniqueness; }
    public void setUniqueness(double uniqueness) { this.uniqueness = uniqueness; }
    public double getTimelinessHours() { return timelinessHours; }
    public void setTimelinessHours(double timelinessHours) { this.timelinessHours = timelinessHours; }

    @Override
    public String toString() {
        return "QualityThresholds{completeness=" + completeness + ", accuracy=" + accuracy
                + ", consistency=" + consistency + ", validity=" + validity
                + ", uniqueness=" + uniqueness + ", timeliness=" + timelinessHours + "h}";
    }
}
