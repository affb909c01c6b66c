package com.batchflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 批处理作业状态枚举
 *
 * <p>pending -> running -> {paused, completed, failed, cancelled}; paused -> {running, cancelled}.</p>
 */
public enum JobStatusEnum {

    /**
     * 待启动 - 作业已创建，任务均为 pending
     */
    PENDING("pending"),

    /**
     * 运行中 - 调度器正在派发任务
     */
    RUNNING("running"),

    /**
     * 暂停 - 不再派发新任务，在途任务照常回写
     */
    PAUSED("paused"),

    /**
     * 已完成
     */
    COMPLETED("completed"),

    /**
     * 失败
     */
    FAILED("failed"),

    /**
     * 已取消
     */
    CANCELLED("cancelled");

    private final String code;

    JobStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public static JobStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (JobStatusEnum status : JobStatusEnum.values()) {
            if (status.code.equalsIgnoreCase(code.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status code: " + code);
    }
}
