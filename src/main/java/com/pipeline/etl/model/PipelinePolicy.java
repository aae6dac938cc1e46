package com.pipeline.etl.model;

import java.io.Serializable;

/**
 * 管道执行策略
 */
public class PipelinePolicy implements Serializable {
    /** 组件失败时是否立即中止并向调用方抛出，默认true */
    private boolean stopOnError = true;
    /** 组件失败后的额外重试次数 */
    private int maxRetries = 0;
    /** 调度执行完成后是否对最终数据集做质量分析，默认true */
    private boolean qualityMonitoring = true;
    /** 质量记录中使用的表名，缺省为管道名 */
    private String tableName;

    public PipelinePolicy() {}

    public PipelinePolicy(boolean stopOnError, int maxRetries) {
        this.stopOnError = stopOnError;
        this.maxRetries = maxRetries;
    }

    public static PipelinePolicy defaults() {
        return new PipelinePolicy();
    }

    public boolean isStopOnError() { return stopOnError; }
    public void setStopOnError(boolean stopOnError) { this.stopOnError = stopOnError; }
    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public boolean isQualityMonitoring() { return qualityMonitoring; }
    public void setQualityMonitoring(boolean qualityMonitoring) { this.qualityMonitoring = qualityMonitoring; }
    public String getTableName() { return tableName; }
    public void setTableName(String tableName) { this.tableName = tableName; }
}
