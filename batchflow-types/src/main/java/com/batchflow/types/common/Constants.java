package com.batchflow.types.common;

/**
 * 全局常量。
 */
public final class Constants {

    private Constants() {
    }

    /** 未上报细粒度进度的运行中任务按 50% 计入作业进度 */
    public static final int DEFAULT_PARTIAL_CREDIT = 50;

    public static final int DEFAULT_MAX_RETRIES = 3;

    public static final int DEFAULT_CONCURRENCY_LIMIT = 4;

    public static final long DEFAULT_TASK_TIMEOUT_MS = 300_000L;

    public static final int MAX_PAGE_SIZE = 500;

    public static final String DEFAULT_OWNER_ID = "system";
}
