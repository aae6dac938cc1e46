package com.pipeline.etl.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 单个组件的执行指标，随组件一次执行而更新
 */
public class ComponentMetrics implements Serializable {
    private String componentName;
    private ComponentRole role;
    private Instant startTime;
    private Instant endTime;
    /** 执行耗时（秒） */
    private Double duration;
    private ComponentStatus status = ComponentStatus.PENDING;
    private long recordsProcessed;
    private int attempts;
    private List<String> errors = new ArrayList<>();
    private List<String> warnings = new ArrayList<>();

    public ComponentMetrics() {}

    public ComponentMetrics(String componentName, ComponentRole role) {
        this.componentName = componentName;
        this.role = role;
    }

    public void addError(String error) {
        this.errors.add(error);
    }

    public void addWarning(String warning) {
        this.warnings.add(warning);
    }

    /** 生成当前状态的独立副本，供执行记录保存 */
    public ComponentMetrics copy() {
        ComponentMetrics copy = new ComponentMetrics(componentName, role);
        copy.startTime = startTime;
        copy.endTime = endTime;
        copy.duration = duration;
        copy.status = status;
        copy.recordsProcessed = recordsProcessed;
        copy.attempts = attempts;
        copy.errors = new ArrayList<>(errors);
        copy.warnings = new ArrayList<>(warnings);
        return copy;
    }

    public String getComponentName() { return componentName; }
    public void setComponentName(String componentName) { this.componentName = componentName; }
    public ComponentRole getRole() { return role; }
    public void setRole(ComponentRole role) { this.role = role; }
    public Instant getStartTime() { return startTime; }
    public void setStartTime(Instant startTime) { this.startTime = startTime; }
    public Instant getEndTime() { return endTime; }
    public void setEndTime(Instant endTime) { this.endTime = endTime; }
    public Double getDuration() { return duration; }
    public void setDuration(Double duration) { this.duration = duration; }
    public ComponentStatus getStatus() { return status; }
    public void setStatus(ComponentStatus status) { this.status = status; }
    public long getRecordsProcessed() { return recordsProcessed; }
    public void setRecordsProcessed(long recordsProcessed) { this.recordsProcessed = recordsProcessed; }
    public int getAttempts() { return attempts; }
    public void setAttempts(int attempts) { this.attempts = attempts; }
    public List<String> getErrors() { return errors; }
    public void setErrors(List<String> errors) { this.errors = errors; }
    public List<String> getWarnings() { return warnings; }
    public void setWarnings(List<String> warnings) { this.warnings = warnings; }
}
