package com.pipeline.etl.model;

/**
 * 调度器执行请求的结构化结果。
 * 未找到、已禁用、正在运行属于正常情况，以状态值返回而不是抛出异常。
 */
public class ExecutionOutcome {

    public enum Status {
        NOT_FOUND,
        DISABLED,
        ALREADY_RUNNING,
        COMPLETED,
        PARTIAL,
        FAILED,
        TIMED_OUT;

        public String getValue() {
            return name().toLowerCase();
        }
    }

    private final String pipelineName;
    private final Status status;
    private final ExecutionResult result;
    private final String message;

    private ExecutionOutcome(String pipelineName, Status status, ExecutionResult result, String message) {
        this.pipelineName = pipelineName;
        this.status = status;
        this.result = result;
        this.message = message;
    }

    public static ExecutionOutcome of(String pipelineName, Status status, String message) {
        return new ExecutionOutcome(pipelineName, status, null, message);
    }

    public static ExecutionOutcome finished(ExecutionResult result) {
        Status status;
        switch (result.getStatus()) {
            case COMPLETED: status = Status.COMPLETED; break;
            case PARTIAL: status = Status.PARTIAL; break;
            default: status = Status.FAILED; break;
        }
        return new ExecutionOutcome(result.getPipelineName(), status, result, result.getErrorMessage());
    }

    public static ExecutionOutcome failed(String pipelineName, ExecutionResult result, String message) {
        return new ExecutionOutcome(pipelineName, Status.FAILED, result, message);
    }

    /** 只有全部组件成功才计为成功运行 */
    public boolean isSuccess() {
        return status == Status.COMPLETED;
    }

    /** 是否真正执行过管道（成功、部分成功、失败或超时） */
    public boolean isExecuted() {
        return status == Status.COMPLETED || status == Status.PARTIAL
                || status == Status.FAILED || status == Status.TIMED_OUT;
    }

    public String getPipelineName() { return pipelineName; }
    public Status getStatus() { return status; }
    public ExecutionResult getResult() { return result; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return "ExecutionOutcome{pipeline='" + pipelineName + "', status=" + status.getValue()
                + (message != null ? ", message='" + message + "'" : "") + "}";
    }
}
