package com.batchflow.domain.job.model.entity;

import com.batchflow.types.enums.CompletionPolicyEnum;
import com.batchflow.types.enums.JobPriorityEnum;
import com.batchflow.types.enums.JobStatusEnum;
import com.batchflow.types.exception.InvalidStateException;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 批处理作业领域实体
 */
@Data
public class BatchJobEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 作业名称
     */
    private String name;

    /**
     * 作业类型 (选择 Task Runner)
     */
    private String type;

    /**
     * 优先级
     */
    private JobPriorityEnum priority;

    /**
     * 状态
     */
    private JobStatusEnum status;

    /**
     * 任务总数
     */
    private Integer tasksTotal;

    /**
     * 已完成任务数
     */
    private Integer tasksCompleted;

    /**
     * 失败任务数 (重试耗尽)
     */
    private Integer tasksFailed;

    /**
     * 跳过任务数 (取消或提前终止)
     */
    private Integer tasksSkipped;

    /**
     * 进度 0-100，保留两位小数
     */
    private Double progress;

    /**
     * 单作业并发上限
     */
    private Integer concurrencyLimit;

    /**
     * 任务默认最大重试次数
     */
    private Integer maxRetries;

    /**
     * 单次执行超时 (毫秒)
     */
    private Long taskTimeoutMs;

    /**
     * 完成判定策略
     */
    private CompletionPolicyEnum completionPolicy;

    /**
     * 失败比例阈值 (0-1，可空)
     */
    private Double failureRatioThreshold;

    /**
     * 所属用户
     */
    private String ownerId;

    /**
     * 标签
     */
    private List<String> tags;

    /**
     * 错误摘要
     */
    private String errorSummary;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime updatedAt;

    /**
     * 验证作业是否有效
     */
    public void validate() {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalStateException("Job name cannot be empty");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
        if (concurrencyLimit == null || concurrencyLimit < 1) {
            throw new IllegalStateException("Concurrency limit must be at least 1");
        }
        if (maxRetries == null || maxRetries < 0) {
            throw new IllegalStateException("Max retries cannot be negative");
        }
        if (failureRatioThreshold != null && (failureRatioThreshold < 0D || failureRatioThreshold > 1D)) {
            throw new IllegalStateException("Failure ratio threshold must be within [0, 1]");
        }
    }

    /**
     * 启动：pending -> running，进度重置
     */
    public void start() {
        if (this.status != JobStatusEnum.PENDING) {
            throw new InvalidStateException("Only pending jobs can be started, jobId=" + id + ", status=" + codeOf(status));
        }
        LocalDateTime now = LocalDateTime.now();
        this.status = JobStatusEnum.RUNNING;
        this.startedAt = now;
        this.completedAt = null;
        this.progress = 0D;
        this.updatedAt = now;
    }

    /**
     * 暂停执行
     */
    public void pause() {
        if (this.status != JobStatusEnum.RUNNING) {
            throw new InvalidStateException("Only running jobs can be paused, jobId=" + id + ", status=" + codeOf(status));
        }
        this.status = JobStatusEnum.PAUSED;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 恢复执行
     */
    public void resume() {
        if (this.status != JobStatusEnum.PAUSED) {
            throw new InvalidStateException("Only paused jobs can be resumed, jobId=" + id + ", status=" + codeOf(status));
        }
        this.status = JobStatusEnum.RUNNING;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 取消：pending/running/paused -> cancelled
     */
    public void cancel() {
        if (this.status == null || this.status.isTerminal()) {
            throw new InvalidStateException("Cannot cancel finished jobs, jobId=" + id + ", status=" + codeOf(status));
        }
        LocalDateTime now = LocalDateTime.now();
        this.status = JobStatusEnum.CANCELLED;
        this.completedAt = now;
        this.updatedAt = now;
    }

    /**
     * 自动完成，仅运行中作业
     */
    public void complete() {
        if (this.status != JobStatusEnum.RUNNING) {
            throw new InvalidStateException("Only running jobs can be completed, jobId=" + id + ", status=" + codeOf(status));
        }
        LocalDateTime now = LocalDateTime.now();
        this.status = JobStatusEnum.COMPLETED;
        this.completedAt = now;
        this.updatedAt = now;
    }

    /**
     * 标记为失败，仅运行中作业
     */
    public void fail(String errorSummary) {
        if (this.status != JobStatusEnum.RUNNING) {
            throw new InvalidStateException("Only running jobs can fail, jobId=" + id + ", status=" + codeOf(status));
        }
        LocalDateTime now = LocalDateTime.now();
        this.status = JobStatusEnum.FAILED;
        this.errorSummary = errorSummary;
        this.completedAt = now;
        this.updatedAt = now;
    }

    /**
     * 重试：failed/cancelled -> pending，清空时间戳与错误
     */
    public void resetForRetry() {
        if (this.status != JobStatusEnum.FAILED && this.status != JobStatusEnum.CANCELLED) {
            throw new InvalidStateException("Only failed or cancelled jobs can be retried, jobId=" + id
                    + ", status=" + codeOf(status));
        }
        this.status = JobStatusEnum.PENDING;
        this.startedAt = null;
        this.completedAt = null;
        this.errorSummary = null;
        this.progress = 0D;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 删除前校验：仅终态作业可删除
     */
    public void assertDeletable() {
        if (!isTerminal()) {
            throw new InvalidStateException("Only finished jobs can be deleted, jobId=" + id + ", status=" + codeOf(status));
        }
    }

    /**
     * 写入任务计数
     */
    public void applyCounters(int completed, int failed, int skipped) {
        this.tasksCompleted = completed;
        this.tasksFailed = failed;
        this.tasksSkipped = skipped;
    }

    /**
     * 更新进度；运行中或暂停时取历史最高值
     */
    public void updateProgress(double candidate) {
        double current = this.progress == null ? 0D : this.progress;
        if (isActive() && candidate < current) {
            return;
        }
        this.progress = candidate;
    }

    public int pendingOrRunningCount() {
        return valueOf(tasksTotal) - valueOf(tasksCompleted) - valueOf(tasksFailed) - valueOf(tasksSkipped);
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public boolean isActive() {
        return status == JobStatusEnum.RUNNING || status == JobStatusEnum.PAUSED;
    }

    public boolean isRunning() {
        return status == JobStatusEnum.RUNNING;
    }

    /**
     * 增加版本号 (用于乐观锁)
     */
    public void incrementVersion() {
        this.version = valueOf(this.version) + 1;
        this.updatedAt = LocalDateTime.now();
    }

    public BatchJobEntity copy() {
        BatchJobEntity copy = new BatchJobEntity();
        copy.setId(id);
        copy.setName(name);
        copy.setType(type);
        copy.setPriority(priority);
        copy.setStatus(status);
        copy.setTasksTotal(tasksTotal);
        copy.setTasksCompleted(tasksCompleted);
        copy.setTasksFailed(tasksFailed);
        copy.setTasksSkipped(tasksSkipped);
        copy.setProgress(progress);
        copy.setConcurrencyLimit(concurrencyLimit);
        copy.setMaxRetries(maxRetries);
        copy.setTaskTimeoutMs(taskTimeoutMs);
        copy.setCompletionPolicy(completionPolicy);
        copy.setFailureRatioThreshold(failureRatioThreshold);
        copy.setOwnerId(ownerId);
        copy.setTags(tags == null ? null : new ArrayList<>(tags));
        copy.setErrorSummary(errorSummary);
        copy.setVersion(version);
        copy.setCreatedAt(createdAt);
        copy.setStartedAt(startedAt);
        copy.setCompletedAt(completedAt);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }

    private static int valueOf(Integer value) {
        return value == null ? 0 : value;
    }

    private static String codeOf(JobStatusEnum status) {
        return status == null ? null : status.getCode();
    }
}
