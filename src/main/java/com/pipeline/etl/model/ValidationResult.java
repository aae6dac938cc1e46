package com.pipeline.etl.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 规则集评估汇总。
 * 仅当存在未通过的error级规则时passed为false；warning级失败只记录在warnings中。
 */
public class ValidationResult implements Serializable {
    private boolean passed = true;
    private int passedRules;
    private int failedRules;
    private final List<RuleResult> ruleResults = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private DataProfile dataProfile;

    public ValidationResult() {}

    public void addRuleResult(RuleResult result) {
        ruleResults.add(result);
        if (result.isPassed()) {
            passedRules++;
            return;
        }
        failedRules++;
        if (result.getSeverity() == RuleSeverity.ERROR) {
            errors.add(result.getMessage());
            passed = false;
        } else {
            warnings.add(result.getMessage());
        }
    }

    public boolean isPassed() { return passed; }
    public int getTotalRules() { return ruleResults.size(); }
    public int getPassedRules() { return passedRules; }
    public int getFailedRules() { return failedRules; }
    public List<RuleResult> getRuleResults() { return Collections.unmodifiableList(ruleResults); }
    public List<String> getErrors() { return Collections.unmodifiableList(errors); }
    public List<String> getWarnings() { return Collections.unmodifiableList(warnings); }
    public DataProfile getDataProfile() { return dataProfile; }
    public void setDataProfile(DataProfile dataProfile) { this.dataProfile = dataProfile; }
}
