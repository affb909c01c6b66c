package com.batchflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 任务状态枚举
 */
public enum TaskStatusEnum {

    /**
     * 待处理 - 等待调度器派发（含等待重试）
     */
    PENDING("pending"),

    /**
     * 运行中 - 已交给 Task Runner 执行
     */
    RUNNING("running"),

    /**
     * 已完成
     */
    COMPLETED("completed"),

    /**
     * 失败 - 重试次数耗尽
     */
    FAILED("failed"),

    /**
     * 已跳过 - 作业被取消或因失败阈值提前终止
     */
    SKIPPED("skipped");

    private final String code;

    TaskStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    public static TaskStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TaskStatusEnum status : TaskStatusEnum.values()) {
            if (status.code.equalsIgnoreCase(code.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status code: " + code);
    }
}
