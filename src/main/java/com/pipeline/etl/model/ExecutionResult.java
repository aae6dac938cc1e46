package com.pipeline.etl.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 管道单次执行记录。
 * 执行结束后由编排器定稿（组件指标为副本），此后不再修改。
 */
public class ExecutionResult implements Serializable {
    private String executionId;
    private String pipelineName;
    private Instant startTime;
    private Instant endTime;
    private ExecutionStatus status = ExecutionStatus.PENDING;
    private double durationSeconds;
    private int totalComponents;
    private int successfulComponents;
    private int failedComponents;
    private List<ComponentMetrics> componentMetrics = new ArrayList<>();
    /** 中止原因或首个组件错误 */
    private String errorMessage;

    public ExecutionResult() {}

    public ExecutionResult(String executionId, String pipelineName) {
        this.executionId = executionId;
        this.pipelineName = pipelineName;
    }

    /** 各组件处理的记录数之和 */
    public long getTotalRecordsProcessed() {
        long total = 0;
        for (ComponentMetrics m : componentMetrics) {
            total += m.getRecordsProcessed();
        }
        return total;
    }

    public String getExecutionId() { return executionId; }
    public void setExecutionId(String executionId) { this.executionId = executionId; }
    public String getPipelineName() { return pipelineName; }
    public void setPipelineName(String pipelineName) { this.pipelineName = pipelineName; }
    public Instant getStartTime() { return startTime; }
    public void setStartTime(Instant startTime) { this.startTime = startTime; }
    public Instant getEndTime() { return endTime; }
    public void setEndTime(Instant endTime) { this.endTime = endTime; }
    public ExecutionStatus getStatus() { return status; }
    public void setStatus(ExecutionStatus status) { this.status = status; }
    public double getDurationSeconds() { return durationSeconds; }
    public void setDurationSeconds(double durationSeconds) { this.durationSeconds = durationSeconds; }
    public int getTotalComponents() { return totalComponents; }
    public void setTotalComponents(int totalComponents) { this.totalComponents = totalComponents; }
    public int getSuccessfulComponents() { return successfulComponents; }
    public void setSuccessfulComponents(int successfulComponents) { this.successfulComponents = successfulComponents; }
    public int getFailedComponents() { return failedComponents; }
    public void setFailedComponents(int failedComponents) { this.failedComponents = failedComponents; }
    public List<ComponentMetrics> getComponentMetrics() { return Collections.unmodifiableList(componentMetrics); }
    public void setComponentMetrics(List<ComponentMetrics> componentMetrics) { this.componentMetrics = new ArrayList<>(componentMetrics); }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
}
