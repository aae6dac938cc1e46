package com.pipeline.etl.exception;

/**
 * 抽取组件执行失败
 */
public class ExtractionException extends PipelineException {

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
