package com.pipeline.etl.model;

/**
 * 质量指标判定结果
 */
public enum MetricStatus {
    PASS,
    FAIL;

    public String getValue() {
        return name().toLowerCase();
    }

    public static MetricStatus fromValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
