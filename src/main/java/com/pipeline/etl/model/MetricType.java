package com.pipeline.etl.model;

/**
 * 质量指标类别
 */
public enum MetricType {
    COMPLETENESS,
    ACCURACY,
    CONSISTENCY,
    /** 单位为小时，数值越小越好 */
    TIMELINESS,
    VALIDITY,
    UNIQUENESS;

    public String getValue() {
        return name().toLowerCase();
    }

    public static MetricType fromValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
