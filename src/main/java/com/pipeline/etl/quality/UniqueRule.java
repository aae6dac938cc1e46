package com.pipeline.etl.quality;

import com.pipeline.etl.model.Dataset;
import com.pipeline.etl.model.RuleResult;
import com.pipeline.etl.model.RuleSeverity;

import java.util.HashSet;
import java.util.Set;

/**
 * 列的非空值不允许重复。违规数为重复出现的次数（首次出现不计）。
 */
public class UniqueRule extends QualityRule {

    private final String column;

    public UniqueRule(String name, String column, RuleSeverity severity) {
        super(name, severity);
        this.column = column;
    }

    @Override
    public RuleType getType() {
        return RuleType.UNIQUE;
    }

    @Override
    public String getColumn() {
        return column;
    }

    @Override
    protected RuleResult check(Dataset data) {
        Set<Object> seen = new HashSet<>();
        long duplicates = 0;
        for (Object value : data.getColumnValues(column)) {
            if (value != null && !seen.add(value)) duplicates++;
        }
        return result(duplicates, scoreOf(duplicates, data.size()), 1.0, duplicates == 0,
                String.format("Column '%s' has %d duplicate values", column, duplicates));
    }
}
