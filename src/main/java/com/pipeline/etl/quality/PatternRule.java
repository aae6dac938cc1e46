package com.pipeline.etl.quality;

import com.pipeline.etl.model.Dataset;
import com.pipeline.etl.model.RuleResult;
import com.pipeline.etl.model.RuleSeverity;

import java.util.regex.Pattern;

/**
 * 非空值的字符串形式必须从开头匹配正则（lookingAt语义，需要整串匹配时在表达式中写$）。
 */
public class PatternRule extends QualityRule {

    private final String column;
    private final Pattern pattern;

    public PatternRule(String name, String column, Pattern pattern, RuleSeverity severity) {
        super(name, severity);
        this.column = column;
        this.pattern = pattern;
    }

    @Override
    public RuleType getType() {
        return RuleType.PATTERN;
    }

    @Override
    public String getColumn() {
        return column;
    }

    public Pattern getPattern() { return pattern; }

    @Override
    protected RuleResult check(Dataset data) {
        long invalid = 0;
        for (Object value : data.getColumnValues(column)) {
            if (value != null && !pattern.matcher(value.toString()).lookingAt()) {
                invalid++;
            }
        }
        return result(invalid, scoreOf(invalid, data.size()), 1.0, invalid == 0,
                String.format("Column '%s' has %d values not matching pattern '%s'", column, invalid, pattern.pattern()));
    }
}
