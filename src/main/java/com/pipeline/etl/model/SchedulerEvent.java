package com.pipeline.etl.model;

import java.time.Instant;

/**
 * 调度事件日志条目
 */
public class SchedulerEvent {
    private final String eventType;
    private final String pipelineName;
    private final String message;
    private final String details;
    private final Instant timestamp;

    public SchedulerEvent(String eventType, String pipelineName, String message, String details, Instant timestamp) {
        this.eventType = eventType;
        this.pipelineName = pipelineName;
        this.message = message;
        this.details = details;
        this.timestamp = timestamp;
    }

    public String getEventType() { return eventType; }
    public String getPipelineName() { return pipelineName; }
    public String getMessage() { return message; }
    public String getDetails() { return details; }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return timestamp + " [" + eventType + "] " + (pipelineName != null ? pipelineName + ": " : "") + message;
    }
}
