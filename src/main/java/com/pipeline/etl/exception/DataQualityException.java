package com.pipeline.etl.exception;

import java.util.Collections;
import java.util.List;

/**
 * 严格模式下error级别的质量规则未通过时抛出。
 * 携带未通过规则的描述信息，便于事后排查。
 */
public class DataQualityException extends PipelineException {

    private final List<String> failedRules;

    public DataQualityException(String message, List<String> failedRules) {
        super(message);
        this.failedRules = failedRules == null ? Collections.emptyList() : List.copyOf(failedRules);
    }

    public List<String> getFailedRules() { return failedRules; }
}
