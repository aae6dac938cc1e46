package com.pipeline.etl.quality;

import com.pipeline.etl.model.ColumnType;
import com.pipeline.etl.model.Dataset;
import com.pipeline.etl.model.RuleResult;
import com.pipeline.etl.model.RuleSeverity;

/**
 * 数值必须落在[min, max]内，任一边界可省略。
 * 空值不计；非数值计为越界。
 */
public class RangeRule extends QualityRule {

    private final String column;
    private final Double min;
    private final Double max;

    public RangeRule(String name, String column, Double min, Double max, RuleSeverity severity) {
        super(name, severity);
        this.column = column;
        this.min = min;
        this.max = max;
    }

    @Override
    public RuleType getType() {
        return RuleType.RANGE;
    }

    @Override
    public String getColumn() {
        return column;
    }

    public Double getMin() { return min; }
    public Double getMax() { return max; }

    @Override
    protected RuleResult check(Dataset data) {
        long outOfRange = 0;
        for (Object value : data.getColumnValues(column)) {
            if (value == null) continue;
            Double d = ColumnType.toDouble(value);
            if (d == null || (min != null && d < min) || (max != null && d > max)) {
                outOfRange++;
            }
        }
        return result(outOfRange, scoreOf(outOfRange, data.size()), 1.0, outOfRange == 0,
                String.format("Column '%s' has %d values out of range [%s, %s]", column, outOfRange, min, max));
    }
}
