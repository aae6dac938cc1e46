package com.pipeline.etl.model;

/**
 * 单个管道在统计周期内的执行汇总
 */
public class PipelineExecutionSummary {
    private final String pipelineName;
    private final long totalExecutions;
    private final long successfulExecutions;
    private final double avgDurationSeconds;
    private final long totalRecordsProcessed;

    public PipelineExecutionSummary(String pipelineName, long totalExecutions, long successfulExecutions,
                                    double avgDurationSeconds, long totalRecordsProcessed) {
        this.pipelineName = pipelineName;
        this.totalExecutions = totalExecutions;
        this.successfulExecutions = successfulExecutions;
        this.avgDurationSeconds = avgDurationSeconds;
        this.totalRecordsProcessed = totalRecordsProcessed;
    }

    public double getSuccessRate() {
        return (double) successfulExecutions / Math.max(totalExecutions, 1);
    }

    public String getPipelineName() { return pipelineName; }
    public long getTotalExecutions() { return totalExecutions; }
    public long getSuccessfulExecutions() { return successfulExecutions; }
    public double getAvgDurationSeconds() { return avgDurationSeconds; }
    public long getTotalRecordsProcessed() { return totalRecordsProcessed; }
}
