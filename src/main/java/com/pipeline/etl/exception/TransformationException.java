package com.pipeline.etl.exception;

/**
 * 转换组件执行失败
 */
public class TransformationException extends PipelineException {

    public TransformationException(String message, Throwable cause) {
        super(message, cause);
    }
}
