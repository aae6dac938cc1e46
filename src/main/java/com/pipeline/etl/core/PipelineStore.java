package com.pipeline.etl.core;

import com.pipeline.etl.model.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 执行记录、质量指标、告警、数据画像和调度事件的持久化接口。
 *
 * 实现必须在并发写入下保持安全，调度器的多个工作线程会同时写入。
 * 所有存储失败以PipelineStoreException抛出。
 */
public interface PipelineStore extends AutoCloseable {

    // ==================== 执行记录 ====================

    /**
     * 保存一次执行结果（含各组件指标）。同一execution_id重复保存会覆盖。
     */
    void saveExecution(ExecutionResult result);

    /**
     * 查询执行记录，按开始时间倒序。
     *
     * @param pipelineName 管道名称，null表示全部管道
     * @param since        起始时间（含）
     */
    List<ExecutionResult> getExecutions(String pipelineName, Instant since);

    // ==================== 质量指标与告警 ====================

    void saveQualityMetrics(List<QualityMetric> metrics);

    /**
     * @param pipelineName 管道名称，null表示全部管道
     */
    List<QualityMetric> getQualityMetrics(String pipelineName, Instant since);

    /**
     * 以insert-or-replace方式保存告警，相同id只保留一条。
     */
    void saveAlert(Alert alert);

    Alert getAlert(String alertId);

    /**
     * @param acknowledged 确认状态过滤，null表示不过滤
     * @param level        级别过滤，null表示不过滤
     * @param limit        最大返回条数
     * @return 按时间倒序的告警
     */
    List<Alert> getAlerts(Boolean acknowledged, AlertLevel level, int limit);

    /**
     * @return 告警不存在时返回false
     */
    boolean acknowledgeAlert(String alertId, String acknowledgedBy, Instant acknowledgedAt);

    /**
     * 统计未确认告警数量，按级别分组
     */
    Map<AlertLevel, Long> countActiveAlertsByLevel(Instant since);

    // ==================== 数据画像与健康分 ====================

    void saveDataProfile(String pipelineName, String tableName, DataProfile profile);

    /**
     * @return 指定表最近一次画像，没有时返回null
     */
    DataProfile getLatestDataProfile(String pipelineName, String tableName);

    void saveHealthScore(String pipelineName, String executionId, double score, Instant timestamp);

    /**
     * 按天（UTC）聚合健康分均值，按日期升序
     *
     * @param pipelineName 管道名称，null表示全部管道
     */
    List<HealthTrendPoint> getHealthTrend(String pipelineName, Instant since);

    // ==================== 调度指标与事件 ====================

    void savePipelineMetric(String pipelineName, String metricName, double value, Instant timestamp);

    /**
     * @return 每个指标名最近一次的取值
     */
    Map<String, Double> getLatestPipelineMetrics(String pipelineName);

    void logSchedulerEvent(String eventType, String pipelineName, String message, String details);

    /**
     * @param pipelineName 管道名称，null表示全部
     * @return 按时间倒序的事件
     */
    List<SchedulerEvent> getSchedulerEvents(String pipelineName, int limit);

    @Override
    void close();
}
