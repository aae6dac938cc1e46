package com.pipeline.etl.quality;

import com.pipeline.etl.exception.ConfigurationException;
import com.pipeline.etl.model.MetricType;

/**
 * 质量规则种类（封闭集合）及其对应的指标类别
 */
public enum RuleType {
    NOT_NULL("not_null", MetricType.COMPLETENESS),
    UNIQUE("unique", MetricType.UNIQUENESS),
    RANGE("range", MetricType.ACCURACY),
    PATTERN("pattern", MetricType.VALIDITY),
    COMPLETENESS("completeness", MetricType.COMPLETENESS);

    private final String value;
    private final MetricType metricType;

    RuleType(String value, MetricType metricType) {
        this.value = value;
        this.metricType = metricType;
    }

    public String getValue() { return value; }
    public MetricType getMetricType() { return metricType; }

    public static RuleType fromValue(String value) {
        if (value != null) {
            for (RuleType type : values()) {
                if (type.value.equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new ConfigurationException("Unknown quality rule type: " + value);
    }
}
