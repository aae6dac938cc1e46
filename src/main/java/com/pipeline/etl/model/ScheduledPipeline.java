package com.pipeline.etl.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * 调度管道实体，封装管道定义、调度规则与运行计数
 */
public class ScheduledPipeline implements Serializable {
    @JsonIgnore
    private String name;
    @JsonProperty("pipeline")
    private PipelineConfig pipelineConfig;
    private ScheduleSpec schedule;
    private boolean enabled = true;
    private ScheduleStatus status = ScheduleStatus.SCHEDULED;
    private Instant lastRun;
    private Instant nextRun;
    private long runCount;
    private long successCount;
    private long failureCount;
    private String lastErrorMessage;

    public ScheduledPipeline() {}

    public ScheduledPipeline(String name, PipelineConfig pipelineConfig, ScheduleSpec schedule, boolean enabled) {
        this.name = name;
        this.pipelineConfig = pipelineConfig;
        this.schedule = schedule;
        this.enabled = enabled;
    }

    @JsonIgnore
    public double getSuccessRate() {
        return (double) successCount / Math.max(runCount, 1);
    }

    /** 浅拷贝快照，管道定义与调度规则对象共享 */
    public ScheduledPipeline copy() {
        ScheduledPipeline copy = new ScheduledPipeline(name, pipelineConfig, schedule, enabled);
        copy.status = status;
        copy.lastRun = lastRun;
        copy.nextRun = nextRun;
        copy.runCount = runCount;
        copy.successCount = successCount;
        copy.failureCount = failureCount;
        copy.lastErrorMessage = lastErrorMessage;
        return copy;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public PipelineConfig getPipelineConfig() { return pipelineConfig; }
    public void setPipelineConfig(PipelineConfig pipelineConfig) { this.pipelineConfig = pipelineConfig; }
    public ScheduleSpec getSchedule() { return schedule; }
    public void setSchedule(ScheduleSpec schedule) { this.schedule = schedule; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public ScheduleStatus getStatus() { return status; }
    public void setStatus(ScheduleStatus status) { this.status = status; }
    public Instant getLastRun() { return lastRun; }
    public void setLastRun(Instant lastRun) { this.lastRun = lastRun; }
    public Instant getNextRun() { return nextRun; }
    public void setNextRun(Instant nextRun) { this.nextRun = nextRun; }
    public long getRunCount() { return runCount; }
    public void setRunCount(long runCount) { this.runCount = runCount; }
    public long getSuccessCount() { return successCount; }
    public void setSuccessCount(long successCount) { this.successCount = successCount; }
    public long getFailureCount() { return failureCount; }
    public void setFailureCount(long failureCount) { this.failureCount = failureCount; }
    public String getLastErrorMessage() { return lastErrorMessage; }
    public void setLastErrorMessage(String lastErrorMessage) { this.lastErrorMessage = lastErrorMessage; }
}
