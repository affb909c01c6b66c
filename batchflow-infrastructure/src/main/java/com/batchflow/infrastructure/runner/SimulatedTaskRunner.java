package com.batchflow.infrastructure.runner;

import com.batchflow.domain.job.adapter.gateway.ITaskRunner;
import com.batchflow.domain.job.model.valobj.TaskRunContext;
import com.batchflow.domain.job.model.valobj.TaskRunResult;
import com.batchflow.types.exception.TaskExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * 默认作业类型 (default) 的模拟 Runner。
 * <p>
 * payload 约定：durationMs 总耗时，steps 进度上报次数，failAttempts 前 N 次执行失败，output 成功输出。
 * 每一步都会检查中止信号与截止时间。
 * </p>
 */
@Slf4j
@Component
public class SimulatedTaskRunner implements ITaskRunner {

    public static final String TASK_TYPE = "default";

    private static final int DEFAULT_STEPS = 4;

    @Override
    public String taskType() {
        return TASK_TYPE;
    }

    @Override
    public TaskRunResult execute(TaskRunContext context) throws Exception {
        Map<String, Object> payload = context.payload();
        long durationMs = longOf(payload, "durationMs", 0L);
        int steps = (int) Math.max(1L, longOf(payload, "steps", DEFAULT_STEPS));
        long failAttempts = longOf(payload, "failAttempts", 0L);

        long stepMs = durationMs / steps;
        for (int step = 1; step <= steps; step++) {
            if (context.isAborted()) {
                return TaskRunResult.failure("Aborted: " + context.abortSignal().getReason());
            }
            if (context.deadline() != null && Instant.now().isAfter(context.deadline())) {
                return TaskRunResult.failure("Deadline exceeded");
            }
            if (stepMs > 0) {
                Thread.sleep(stepMs);
            }
            context.reportProgress(step * 100 / steps);
        }
        if (context.attempt() <= failAttempts) {
            throw new TaskExecutionException("Simulated failure on attempt " + context.attempt());
        }
        Object output = payload == null ? null : payload.get("output");
        log.debug("Simulated task finished. jobId={}, taskId={}, attempt={}",
                context.jobId(), context.task() == null ? null : context.task().getId(), context.attempt());
        return TaskRunResult.success(output == null ? "ok" : String.valueOf(output));
    }

    private long longOf(Map<String, Object> payload, String key, long defaultValue) {
        Object value = payload == null ? null : payload.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String && !((String) value).isBlank()) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException ex) {
                throw new TaskExecutionException("Invalid payload value for " + key + ": " + value);
            }
        }
        return defaultValue;
    }
}
