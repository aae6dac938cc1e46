package com.pipeline.etl.exception;

/**
 * 配置引用了未知的组件类型、规则类型或缺少必选参数
 */
public class ConfigurationException extends PipelineException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
