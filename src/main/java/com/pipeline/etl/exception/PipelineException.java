package com.pipeline.etl.exception;

/**
 * ETL管道异常基类。
 * 组件级异常（抽取/转换/加载）、数据质量异常和配置异常均为其子类。
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
