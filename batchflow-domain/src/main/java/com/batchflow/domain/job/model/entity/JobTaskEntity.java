package com.batchflow.domain.job.model.entity;

import com.batchflow.types.enums.TaskStatusEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 作业任务领域实体
 */
@Data
public class JobTaskEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 所属作业 ID
     */
    private Long jobId;

    /**
     * 默认排序序号
     */
    private Integer index;

    /**
     * 插入顺序，index 相同时作为次序
     */
    private Long sequence;

    /**
     * 任务名称
     */
    private String name;

    /**
     * 输入载荷 (不透明)
     */
    private Map<String, Object> payload;

    /**
     * 状态
     */
    private TaskStatusEnum status;

    /**
     * 已重试次数，仅在执行失败时递增
     */
    private Integer retryCount;

    /**
     * 最大重试次数
     */
    private Integer maxRetries;

    /**
     * 执行代际（每次派发递增），用于丢弃过期回写
     */
    private Integer executionAttempt;

    /**
     * 延迟重试的最早执行时间
     */
    private LocalDateTime nextAttemptAt;

    /**
     * 执行进度 0-100 (Runner 上报，可空)
     */
    private Integer progress;

    /**
     * 最近一次错误
     */
    private String error;

    /**
     * 执行结果
     */
    private String result;

    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime updatedAt;

    public void validate() {
        if (jobId == null) {
            throw new IllegalStateException("Job ID cannot be null");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
        if (maxRetries == null || maxRetries < 0) {
            throw new IllegalStateException("Max retries cannot be negative");
        }
        if (valueOf(retryCount) > maxRetries) {
            throw new IllegalStateException("Retry count cannot exceed max retries");
        }
    }

    /**
     * 是否可被派发：pending 且无延迟或已到期
     */
    public boolean isDue(LocalDateTime now) {
        if (status != TaskStatusEnum.PENDING) {
            return false;
        }
        return nextAttemptAt == null || !nextAttemptAt.isAfter(now);
    }

    /**
     * 派发执行：pending -> running，执行代际递增
     */
    public int dispatch(LocalDateTime now) {
        if (this.status != TaskStatusEnum.PENDING) {
            throw new IllegalStateException("Task must be in PENDING status to be dispatched");
        }
        this.status = TaskStatusEnum.RUNNING;
        this.executionAttempt = valueOf(this.executionAttempt) + 1;
        this.nextAttemptAt = null;
        this.progress = null;
        this.startedAt = now;
        this.updatedAt = now;
        return this.executionAttempt;
    }

    /**
     * 执行器拒绝时撤回派发，不计入重试
     */
    public void revertDispatch() {
        if (this.status != TaskStatusEnum.RUNNING) {
            throw new IllegalStateException("Only running tasks can be reverted");
        }
        this.status = TaskStatusEnum.PENDING;
        this.startedAt = null;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 完成任务
     */
    public void complete(String result) {
        if (this.status != TaskStatusEnum.RUNNING) {
            throw new IllegalStateException("Task must be in RUNNING status to complete");
        }
        LocalDateTime now = LocalDateTime.now();
        this.status = TaskStatusEnum.COMPLETED;
        this.result = result;
        this.error = null;
        this.progress = 100;
        this.completedAt = now;
        this.updatedAt = now;
    }

    /**
     * 失败后重新排队，retryCount 递增
     */
    public void requeue(String error, LocalDateTime nextAttemptAt) {
        if (this.status != TaskStatusEnum.RUNNING) {
            throw new IllegalStateException("Task must be in RUNNING status to be requeued");
        }
        if (valueOf(this.retryCount) >= valueOf(this.maxRetries)) {
            throw new IllegalStateException("Max retries exceeded");
        }
        this.retryCount = valueOf(this.retryCount) + 1;
        this.status = TaskStatusEnum.PENDING;
        this.error = error;
        this.progress = null;
        this.nextAttemptAt = nextAttemptAt;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 重试耗尽，终态失败
     */
    public void fail(String error) {
        if (this.status != TaskStatusEnum.RUNNING) {
            throw new IllegalStateException("Task must be in RUNNING status to fail");
        }
        LocalDateTime now = LocalDateTime.now();
        this.status = TaskStatusEnum.FAILED;
        this.error = error;
        this.completedAt = now;
        this.updatedAt = now;
    }

    /**
     * 跳过 (取消或提前终止)，不计入重试
     */
    public void skip(String reason) {
        if (this.status != null && this.status.isTerminal()) {
            throw new IllegalStateException("Finished tasks cannot be skipped");
        }
        LocalDateTime now = LocalDateTime.now();
        this.status = TaskStatusEnum.SKIPPED;
        this.error = reason;
        this.nextAttemptAt = null;
        this.completedAt = now;
        this.updatedAt = now;
    }

    /**
     * 重置为待处理：用于作业重试与单任务手动重试
     */
    public void resetForRetry() {
        if (this.status != TaskStatusEnum.FAILED && this.status != TaskStatusEnum.SKIPPED) {
            throw new IllegalStateException("Only failed or skipped tasks can be reset");
        }
        this.status = TaskStatusEnum.PENDING;
        this.retryCount = 0;
        this.error = null;
        this.result = null;
        this.progress = null;
        this.nextAttemptAt = null;
        this.startedAt = null;
        this.completedAt = null;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * Runner 上报进度，裁剪到 [0, 100]
     */
    public void reportProgress(int percent) {
        if (this.status != TaskStatusEnum.RUNNING) {
            return;
        }
        this.progress = Math.max(0, Math.min(100, percent));
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 回写是否属于当前执行代际
     */
    public boolean isCurrentAttempt(int attempt) {
        return this.status == TaskStatusEnum.RUNNING && valueOf(this.executionAttempt) == attempt;
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public JobTaskEntity copy() {
        JobTaskEntity copy = new JobTaskEntity();
        copy.setId(id);
        copy.setJobId(jobId);
        copy.setIndex(index);
        copy.setSequence(sequence);
        copy.setName(name);
        copy.setPayload(payload == null ? null : new LinkedHashMap<>(payload));
        copy.setStatus(status);
        copy.setRetryCount(retryCount);
        copy.setMaxRetries(maxRetries);
        copy.setExecutionAttempt(executionAttempt);
        copy.setNextAttemptAt(nextAttemptAt);
        copy.setProgress(progress);
        copy.setError(error);
        copy.setResult(result);
        copy.setCreatedAt(createdAt);
        copy.setStartedAt(startedAt);
        copy.setCompletedAt(completedAt);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }

    private static int valueOf(Integer value) {
        return value == null ? 0 : value;
    }
}
