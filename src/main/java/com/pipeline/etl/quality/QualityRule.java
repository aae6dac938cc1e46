package com.pipeline.etl.quality;

import com.pipeline.etl.exception.ConfigurationException;
import com.pipeline.etl.model.ConfigMaps;
import com.pipeline.etl.model.Dataset;
import com.pipeline.etl.model.RuleResult;
import com.pipeline.etl.model.RuleSeverity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 质量规则基类。
 * 规则种类是封闭的：NotNull / Unique / Range / Pattern / Completeness，
 * 由 {@link #fromConfig(Map)} 在构造阶段穷举解析。
 */
public abstract class QualityRule {

    private static final Logger log = LoggerFactory.getLogger(QualityRule.class);

    private final String name;
    private final RuleSeverity severity;

    protected QualityRule(String name, RuleSeverity severity) {
        this.name = name;
        this.severity = severity == null ? RuleSeverity.WARNING : severity;
    }

    public abstract RuleType getType();

    /** 规则作用的列；数据集级规则返回null */
    public abstract String getColumn();

    /**
     * 对数据集求值，不抛出异常。
     * 规则引用的列不存在或求值出错时，返回error级别的失败结果，
     * 严格模式下由校验器按阻断性失败处理，否则只记录。
     */
    public final RuleResult evaluate(Dataset data) {
        String column = getColumn();
        if (column != null && !data.hasColumn(column)) {
            log.warn("Rule '{}' references unknown column '{}'.", name, column);
            return executionFailure(data, "Column '" + column + "' not found in dataset");
        }
        try {
            return check(data);
        } catch (RuntimeException e) {
            log.warn("Rule '{}' failed to evaluate: {}", name, e.getMessage(), e);
            return executionFailure(data, String.valueOf(e.getMessage()));
        }
    }

    /**
     * 规则本身的求值逻辑，列已确认存在
     */
    protected abstract RuleResult check(Dataset data);

    public String getName() { return name; }
    public RuleSeverity getSeverity() { return severity; }

    private RuleResult executionFailure(Dataset data, String reason) {
        return new RuleResult(name, getType().getValue(), getColumn(), false, data.size(), 0.0, 1.0,
                getType().getMetricType(), RuleSeverity.ERROR, "Rule execution failed: " + reason);
    }

    /** 违规比例转换为得分，空数据集得分为1 */
    protected static double scoreOf(long violations, int rows) {
        return rows == 0 ? 1.0 : 1.0 - (double) violations / rows;
    }

    protected RuleResult result(long violations, double score, double threshold, boolean passed, String message) {
        return new RuleResult(name, getType().getValue(), getColumn(), passed, violations, score, threshold,
                getType().getMetricType(), severity, message);
    }

    /**
     * 解析规则配置：{name, type, column, severity, min, max, pattern, threshold}
     *
     * @throws ConfigurationException 种类未知或缺少必需字段
     */
    public static QualityRule fromConfig(Map<String, Object> config) {
        RuleType type = RuleType.fromValue(ConfigMaps.getString(config, "type", null));
        String name = ConfigMaps.getString(config, "name", type.getValue());
        String owner = "rule '" + name + "'";

        RuleSeverity severity;
        try {
            severity = RuleSeverity.fromValue(ConfigMaps.getString(config, "severity", null));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid severity for " + owner + ": " + config.get("severity"), e);
        }

        switch (type) {
            case NOT_NULL:
                return new NotNullRule(name, ConfigMaps.requireString(config, "column", owner), severity);
            case UNIQUE:
                return new UniqueRule(name, ConfigMaps.requireString(config, "column", owner), severity);
            case RANGE:
                return new RangeRule(name, ConfigMaps.requireString(config, "column", owner),
                        ConfigMaps.getDouble(config, "min", null),
                        ConfigMaps.getDouble(config, "max", null), severity);
            case PATTERN:
                String regex = ConfigMaps.requireString(config, "pattern", owner);
                try {
                    return new PatternRule(name, ConfigMaps.requireString(config, "column", owner),
                            Pattern.compile(regex), severity);
                } catch (PatternSyntaxException e) {
                    throw new ConfigurationException("Invalid pattern for " + owner + ": " + regex, e);
                }
            case COMPLETENESS:
                return new CompletenessRule(name, ConfigMaps.getDouble(config, "threshold", 0.95), severity);
            default:
                throw new ConfigurationException("Unsupported quality rule type: " + type);
        }
    }

    @Override
    public String toString() {
        return getType().getValue() + "(" + name + (getColumn() != null ? ", " + getColumn() : "") + ")";
    }
}
