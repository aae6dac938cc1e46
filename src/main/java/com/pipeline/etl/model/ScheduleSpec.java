package com.pipeline.etl.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pipeline.etl.exception.ConfigurationException;

import java.io.Serializable;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;

/**
 * 调度规则：{type, interval | time | day}
 */
public class ScheduleSpec implements Serializable {
    private ScheduleType type = ScheduleType.INTERVAL;
    /** 间隔分钟数，INTERVAL使用 */
    @JsonProperty("interval")
    private Integer intervalMinutes;
    /** HH:mm，DAILY/WEEKLY使用 */
    private String time;
    /** 星期名称（monday...sunday），WEEKLY使用 */
    private String day;
    /** cron表达式，仅保存 */
    private String expression;

    public ScheduleSpec() {}

    public static ScheduleSpec interval(int minutes) {
        ScheduleSpec spec = new ScheduleSpec();
        spec.type = ScheduleType.INTERVAL;
        spec.intervalMinutes = minutes;
        return spec;
    }

    public static ScheduleSpec daily(String time) {
        ScheduleSpec spec = new ScheduleSpec();
        spec.type = ScheduleType.DAILY;
        spec.time = time;
        return spec;
    }

    public static ScheduleSpec weekly(String day, String time) {
        ScheduleSpec spec = new ScheduleSpec();
        spec.type = ScheduleType.WEEKLY;
        spec.day = day;
        spec.time = time;
        return spec;
    }

    public static ScheduleSpec cron(String expression) {
        ScheduleSpec spec = new ScheduleSpec();
        spec.type = ScheduleType.CRON;
        spec.expression = expression;
        return spec;
    }

    /**
     * 校验字段组合，缺省值与原调度配置一致：间隔60分钟、时刻02:00、星期一
     */
    public void validate() {
        if (type == null) {
            throw new ConfigurationException("Schedule type is required");
        }
        switch (type) {
            case INTERVAL:
                if (getIntervalMinutesOrDefault() <= 0) {
                    throw new ConfigurationException("Schedule interval must be positive, got: " + intervalMinutes);
                }
                break;
            case WEEKLY:
                getDayOfWeek();
                getLocalTime();
                break;
            case DAILY:
                getLocalTime();
                break;
            case CRON:
            default:
                break;
        }
    }

    @JsonIgnore
    public int getIntervalMinutesOrDefault() {
        return intervalMinutes == null ? 60 : intervalMinutes;
    }

    @JsonIgnore
    public LocalTime getLocalTime() {
        String text = (time == null || time.isBlank()) ? "02:00" : time.trim();
        try {
            return LocalTime.parse(text);
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Invalid schedule time '" + text + "', expected HH:mm", e);
        }
    }

    @JsonIgnore
    public DayOfWeek getDayOfWeek() {
        String text = (day == null || day.isBlank()) ? "monday" : day.trim();
        try {
            return DayOfWeek.valueOf(text.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid schedule day '" + text + "'", e);
        }
    }

    public ScheduleType getType() { return type; }
    public void setType(ScheduleType type) { this.type = type; }
    public Integer getIntervalMinutes() { return intervalMinutes; }
    public void setIntervalMinutes(Integer intervalMinutes) { this.intervalMinutes = intervalMinutes; }
    public String getTime() { return time; }
    public void setTime(String time) { this.time = time; }
    public String getDay() { return day; }
    public void setDay(String day) { this.day = day; }
    public String getExpression() { return expression; }
    public void setExpression(String expression) { this.expression = expression; }

    @Override
    public String toString() {
        switch (type) {
            case INTERVAL: return "every " + getIntervalMinutesOrDefault() + " minutes";
            case DAILY: return "daily at " + time;
            case WEEKLY: return "weekly on " + day + " at " + time;
            default: return "cron '" + expression + "'";
        }
    }
}
