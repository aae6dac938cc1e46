package com.pipeline.etl.quality;

import com.pipeline.etl.model.Dataset;
import com.pipeline.etl.model.RuleResult;
import com.pipeline.etl.model.RuleSeverity;

/**
 * 数据集级规则：非空单元格占比不低于阈值。没有单元格时占比为0。
 */
public class CompletenessRule extends QualityRule {

    private final double threshold;

    public CompletenessRule(String name, double threshold, RuleSeverity severity) {
        super(name, severity);
        this.threshold = threshold;
    }

    @Override
    public RuleType getType() {
        return RuleType.COMPLETENESS;
    }

    @Override
    public String getColumn() {
        return null;
    }

    public double getThreshold() { return threshold; }

    @Override
    protected RuleResult check(Dataset data) {
        long total = data.cellCount();
        long nonNull = data.nonNullCellCount();
        double completeness = total == 0 ? 0.0 : (double) nonNull / total;
        return result(total - nonNull, completeness, threshold, completeness >= threshold,
                String.format("Data completeness is %.2f%% (threshold: %.2f%%)", completeness * 100, threshold * 100));
    }
}
