package com.pipeline.etl.model;

import java.util.List;

/**
 * 调度器运行指标：各管道执行汇总与注册表概况
 */
public class SchedulerMetricsReport {
    private final int periodDays;
    private final List<PipelineExecutionSummary> executions;
    private final int totalPipelines;
    private final int activePipelines;
    private final int runningPipelines;

    public SchedulerMetricsReport(int periodDays, List<PipelineExecutionSummary> executions,
                                  int totalPipelines, int activePipelines, int runningPipelines) {
        this.periodDays = periodDays;
        this.executions = List.copyOf(executions);
        this.totalPipelines = totalPipelines;
        this.activePipelines = activePipelines;
        this.runningPipelines = runningPipelines;
    }

    public int getPeriodDays() { return periodDays; }
    public List<PipelineExecutionSummary> getExecutions() { return executions; }
    public int getTotalPipelines() { return totalPipelines; }
    public int getActivePipelines() { return activePipelines; }
    public int getRunningPipelines() { return runningPipelines; }
}
