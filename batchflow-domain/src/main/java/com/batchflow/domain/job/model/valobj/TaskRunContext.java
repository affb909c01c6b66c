package com.batchflow.domain.job.model.valobj;

import com.batchflow.domain.job.model.entity.JobTaskEntity;

import java.time.Instant;
import java.util.Map;
import java.util.function.IntConsumer;

/**
 * Task Runner 执行上下文。
 *
 * @param jobId            作业 ID
 * @param jobType          作业类型
 * @param task             派发时的任务快照 (副本)
 * @param attempt          执行代际
 * @param deadline         本次执行截止时间
 * @param abortSignal      中止信号
 * @param progressReporter 进度上报 (0-100)
 */
public record TaskRunContext(Long jobId,
                             String jobType,
                             JobTaskEntity task,
                             int attempt,
                             Instant deadline,
                             AbortSignal abortSignal,
                             IntConsumer progressReporter) {

    public Map<String, Object> payload() {
        return task == null ? null : task.getPayload();
    }

    public boolean isAborted() {
        return abortSignal != null && abortSignal.isAborted();
    }

    public void reportProgress(int percent) {
        if (progressReporter != null) {
            progressReporter.accept(percent);
        }
    }
}
