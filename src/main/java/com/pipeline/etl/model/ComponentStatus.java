package com.pipeline.etl.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 组件执行状态
 */
public enum ComponentStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    /** 上游组件失败，本组件未被调用 */
    SKIPPED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
