package com.pipeline.etl.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 调度触发方式
 */
public enum ScheduleType {
    /** 固定间隔（分钟） */
    INTERVAL,
    /** 每天指定时刻 */
    DAILY,
    /** 每周指定星期几的指定时刻 */
    WEEKLY,
    /** 暂不支持，配置后不会注册触发器 */
    CRON;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
