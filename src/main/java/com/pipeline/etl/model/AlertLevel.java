package com.pipeline.etl.model;

/**
 * 告警级别，按严重程度递增
 */
public enum AlertLevel {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    public String getValue() {
        return name().toLowerCase();
    }

    public static AlertLevel fromValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
