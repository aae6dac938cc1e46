package com.pipeline.etl.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 管道单次执行的状态
 */
public enum ExecutionStatus {
    PENDING,
    RUNNING,
    /** 全部组件执行成功 */
    COMPLETED,
    /** 未中止，但存在失败或被跳过的组件 */
    PARTIAL,
    /** 执行中止 */
    FAILED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    public static ExecutionStatus fromValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
