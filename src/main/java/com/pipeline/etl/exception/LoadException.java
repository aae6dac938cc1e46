package com.pipeline.etl.exception;

/**
 * 加载组件执行失败，包括加载器返回false的情况
 */
public class LoadException extends PipelineException {

    public LoadException(String message) {
        super(message);
    }

    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
