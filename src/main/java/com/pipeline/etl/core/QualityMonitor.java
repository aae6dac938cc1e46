package com.pipeline.etl.core;

import com.pipeline.etl.model.*;

import java.util.List;

/**
 * 质量监控接口：把数据集和规则评估结果转成质量指标、告警与健康分。
 */
public interface QualityMonitor {

    /**
     * 对数据集做完整性、有效性、唯一性、一致性和时效性分析。
     * 指标、越限告警和数据画像都会持久化。
     *
     * @param tableName 表名，null时使用管道名
     * @return 本次产生的全部指标
     */
    List<QualityMetric> analyze(Dataset data, String pipelineName, String tableName);

    /**
     * 持久化一组已计算好的指标，并为其中失败的指标生成告警。
     *
     * @return 生成的告警
     */
    List<Alert> recordMetrics(List<QualityMetric> metrics);

    /**
     * 把规则评估结果转成 rule_&lt;名称&gt; 指标后记录。
     */
    List<QualityMetric> recordRuleResults(String pipelineName, String tableName, List<RuleResult> results);

    void recordDataProfile(String pipelineName, String tableName, DataProfile profile);

    /**
     * 计算尾部窗口内的加权健康分，窗口内没有数据时为1.0。不写入历史。
     */
    double calculateHealthScore(String pipelineName);

    /**
     * 计算健康分并追加到健康分历史。
     */
    double recordHealthScore(String pipelineName, String executionId);

    QualityReport generateReport(int days);

    QualityReport generateReport();

    /**
     * @param acknowledged null表示不过滤
     * @param level        null表示不过滤
     */
    List<Alert> getAlerts(Boolean acknowledged, AlertLevel level);

    boolean acknowledgeAlert(String alertId, String acknowledgedBy);
}
