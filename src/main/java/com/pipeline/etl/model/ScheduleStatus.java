package com.pipeline.etl.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 调度管道状态：scheduled → running → {completed, failed} → scheduled
 */
public enum ScheduleStatus {
    SCHEDULED,
    RUNNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
