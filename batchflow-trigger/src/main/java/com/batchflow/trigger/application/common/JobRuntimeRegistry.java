package com.batchflow.trigger.application.common;

import com.batchflow.domain.job.model.valobj.AbortSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 作业运行时状态 (不落库)：在途执行、中止信号与调度熔断标记。
 * <p>
 * 所有写操作由调用方在作业锁内完成。
 * </p>
 */
@Slf4j
@Component
public class JobRuntimeRegistry {

    private final ConcurrentMap<Long, JobRuntime> runtimes = new ConcurrentHashMap<>();

    public void register(Long jobId, Long taskId, int attempt, AbortSignal signal) {
        runtime(jobId).inFlight.put(taskId, new InFlightAttempt(taskId, attempt, signal));
    }

    /**
     * 移除在途记录，仅当执行代际匹配时生效
     *
     * @return 被移除的记录；已被取消清理或代际不匹配时为 null
     */
    public InFlightAttempt complete(Long jobId, Long taskId, int attempt) {
        JobRuntime runtime = runtimes.get(jobId);
        if (runtime == null) {
            return null;
        }
        InFlightAttempt current = runtime.inFlight.get(taskId);
        if (current == null || current.attempt() != attempt) {
            return null;
        }
        runtime.inFlight.remove(taskId, current);
        return current;
    }

    public int inFlightCount(Long jobId) {
        JobRuntime runtime = runtimes.get(jobId);
        return runtime == null ? 0 : runtime.inFlight.size();
    }

    /**
     * 向所有在途执行发出中止信号并清空在途集合，不等待执行结束
     *
     * @return 被中止的执行数
     */
    public int abortAll(Long jobId, String reason) {
        JobRuntime runtime = runtimes.get(jobId);
        if (runtime == null || runtime.inFlight.isEmpty()) {
            return 0;
        }
        int aborted = 0;
        for (Map.Entry<Long, InFlightAttempt> entry : runtime.inFlight.entrySet()) {
            entry.getValue().signal().abort(reason);
            aborted++;
        }
        runtime.inFlight.clear();
        return aborted;
    }

    public void halt(Long jobId, String reason) {
        JobRuntime runtime = runtime(jobId);
        runtime.halted = true;
        runtime.haltReason = reason;
    }

    public boolean isHalted(Long jobId) {
        JobRuntime runtime = runtimes.get(jobId);
        return runtime != null && runtime.halted;
    }

    /**
     * 重新启动前清除熔断标记
     */
    public void reset(Long jobId) {
        JobRuntime runtime = runtimes.get(jobId);
        if (runtime != null && runtime.halted) {
            log.info("Job scheduling halt cleared. jobId={}, previousReason={}", jobId, runtime.haltReason);
            runtime.halted = false;
            runtime.haltReason = null;
        }
    }

    public void remove(Long jobId) {
        JobRuntime runtime = runtimes.remove(jobId);
        if (runtime != null) {
            runtime.inFlight.values().forEach(attempt -> attempt.signal().abort("Job removed"));
        }
    }

    private JobRuntime runtime(Long jobId) {
        return runtimes.computeIfAbsent(jobId, key -> new JobRuntime());
    }

    public record InFlightAttempt(Long taskId, int attempt, AbortSignal signal) {
    }

    private static final class JobRuntime {
        private final ConcurrentMap<Long, InFlightAttempt> inFlight = new ConcurrentHashMap<>();
        private volatile boolean halted;
        private volatile String haltReason;
    }
}
