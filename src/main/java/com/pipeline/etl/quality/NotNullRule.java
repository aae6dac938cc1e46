package com.pipeline.etl.quality;

import com.pipeline.etl.model.Dataset;
import com.pipeline.etl.model.RuleResult;
import com.pipeline.etl.model.RuleSeverity;

/**
 * 列不允许出现空值
 */
public class NotNullRule extends QualityRule {

    private final String column;

    public NotNullRule(String name, String column, RuleSeverity severity) {
        super(name, severity);
        this.column = column;
    }

    @Override
    public RuleType getType() {
        return RuleType.NOT_NULL;
    }

    @Override
    public String getColumn() {
        return column;
    }

    @Override
    protected RuleResult check(Dataset data) {
        long nulls = data.size() - data.nonNullCount(column);
        return result(nulls, scoreOf(nulls, data.size()), 1.0, nulls == 0,
                String.format("Column '%s' has %d null values", column, nulls));
    }
}
