package com.pipeline.etl.model;

/**
 * 质量规则严重级别。
 * WARNING只记录不阻断；ERROR使校验结果不通过，严格模式下中止组件。
 */
public enum RuleSeverity {
    WARNING,
    ERROR;

    public String getValue() {
        return name().toLowerCase();
    }

    public static RuleSeverity fromValue(String value) {
        if (value == null || value.isBlank()) return WARNING;
        return valueOf(value.trim().toUpperCase());
    }
}
