package com.batchflow.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义系统中所有API响应的响应码和对应描述信息。
 * </p>
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 当前状态不允许该操作 */
    INVALID_STATE("0003", "状态不允许"),

    /** 作业或任务不存在 */
    NOT_FOUND("0004", "资源不存在"),

    /** 任务执行失败 */
    TASK_EXECUTION_FAILED("0005", "任务执行失败"),

    /** 任务重试次数耗尽 */
    RETRY_EXHAUSTED("0006", "重试次数耗尽"),

    /** 并发上限被突破（调度器缺陷） */
    CONCURRENCY_LIMIT_VIOLATION("0007", "并发上限被突破");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
