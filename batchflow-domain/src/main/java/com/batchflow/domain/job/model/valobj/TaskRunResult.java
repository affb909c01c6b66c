package com.batchflow.domain.job.model.valobj;

/**
 * Task Runner 执行结果。Runner 也可以直接抛出异常表示失败。
 */
public record TaskRunResult(boolean success, String output, String error) {

    public static TaskRunResult success(String output) {
        return new TaskRunResult(true, output, null);
    }

    public static TaskRunResult failure(String error) {
        return new TaskRunResult(false, null, error);
    }
}
