package com.pipeline.etl.exception;

/**
 * 指标/告警/执行记录存储层的读写失败
 */
public class PipelineStoreException extends PipelineException {

    public PipelineStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
