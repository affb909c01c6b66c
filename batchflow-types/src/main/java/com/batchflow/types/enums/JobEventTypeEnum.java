package com.batchflow.types.enums;

/**
 * 作业事件类型（推送流 + SSE）。
 */
public enum JobEventTypeEnum {

    JOB_ADDED("job_added"),
    JOB_UPDATED("job_updated"),
    JOB_REMOVED("job_removed"),
    STATS_UPDATED("stats_updated"),
    /**
     * 订阅者积压超限，之前的事件已丢弃，需拉取快照对账
     */
    RESYNC_REQUIRED("resync_required");

    private final String eventName;

    JobEventTypeEnum(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }
}
