package com.pipeline.etl.model;

import java.io.Serializable;

/**
 * 单条质量规则的评估结果
 */
public class RuleResult implements Serializable {
    private final String ruleName;
    private final String ruleType;
    private final String column;
    private final boolean passed;
    private final long violationCount;
    /** 合格比例，完整性规则为非空单元格占比 */
    private final double score;
    private final double threshold;
    private final MetricType metricType;
    private final RuleSeverity severity;
    private final String message;

    public RuleResult(String ruleName, String ruleType, String column, boolean passed,
                      long violationCount, double score, double threshold,
                      MetricType metricType, RuleSeverity severity, String message) {
        this.ruleName = ruleName;
        this.ruleType = ruleType;
        this.column = column;
        this.passed = passed;
        this.violationCount = violationCount;
        this.score = score;
        this.threshold = threshold;
        this.metricType = metricType;
        this.severity = severity;
        this.message = message;
    }

    public boolean isBlocking() {
        return !passed && severity == RuleSeverity.ERROR;
    }

    public String getRuleName() { return ruleName; }
    public String getRuleType() { return ruleType; }
    public String getColumn() { return column; }
    public boolean isPassed() { return passed; }
    public long getViolationCount() { return violationCount; }
    public double getScore() { return score; }
    public double getThreshold() { return threshold; }
    public MetricType getMetricType() { return metricType; }
    public RuleSeverity getSeverity() { return severity; }
    public String getMessage() { return message; }
}
