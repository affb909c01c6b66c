package com.batchflow.domain.job.service;

import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.domain.job.model.entity.JobTaskEntity;
import com.batchflow.domain.job.model.valobj.JobStatsSnapshot;
import com.batchflow.types.enums.TaskStatusEnum;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 作业统计领域服务。
 */
@Service
public class JobStatsDomainService {

    /**
     * @param jobs                   参与统计的作业
     * @param tasks                  上述作业的任务
     * @param now                    统计时间
     * @param throughputWindow       吞吐量统计窗口
     * @param globalConcurrencyLimit 全局并发上限，0 表示不限
     */
    public JobStatsSnapshot compute(List<BatchJobEntity> jobs,
                                    List<JobTaskEntity> tasks,
                                    LocalDateTime now,
                                    Duration throughputWindow,
                                    int globalConcurrencyLimit) {
        JobStatsSnapshot.JobStatsSnapshotBuilder builder = JobStatsSnapshot.builder().capturedAt(now);
        Map<Long, BatchJobEntity> jobById = new HashMap<>();
        long pendingJobs = 0;
        long runningJobs = 0;
        long pausedJobs = 0;
        long completedJobs = 0;
        long failedJobs = 0;
        long cancelledJobs = 0;
        long queueWaitTotal = 0;
        long queueWaitSamples = 0;
        long parallelism = 0;
        if (jobs != null) {
            for (BatchJobEntity job : jobs) {
                if (job == null || job.getStatus() == null) {
                    continue;
                }
                jobById.put(job.getId(), job);
                switch (job.getStatus()) {
                    case PENDING -> pendingJobs++;
                    case RUNNING -> {
                        runningJobs++;
                        parallelism += job.getConcurrencyLimit() == null ? 1 : Math.max(1, job.getConcurrencyLimit());
                    }
                    case PAUSED -> pausedJobs++;
                    case COMPLETED -> completedJobs++;
                    case FAILED -> failedJobs++;
                    case CANCELLED -> cancelledJobs++;
                }
                if (job.getCreatedAt() != null && job.getStartedAt() != null) {
                    queueWaitTotal += Math.max(0L, Duration.between(job.getCreatedAt(), job.getStartedAt()).toMillis());
                    queueWaitSamples++;
                }
            }
        }
        builder.totalJobs(jobById.size())
                .pendingJobs(pendingJobs)
                .runningJobs(runningJobs)
                .pausedJobs(pausedJobs)
                .completedJobs(completedJobs)
                .failedJobs(failedJobs)
                .cancelledJobs(cancelledJobs)
                .averageQueueWaitMs(queueWaitSamples == 0 ? null : queueWaitTotal / queueWaitSamples);

        long pendingTasks = 0;
        long runningTasks = 0;
        long completedTasks = 0;
        long failedTasks = 0;
        long skippedTasks = 0;
        long remaining = 0;
        long durationTotal = 0;
        long durationSamples = 0;
        long completedInWindow = 0;
        Duration window = throughputWindow == null || throughputWindow.isZero() || throughputWindow.isNegative()
                ? Duration.ofHours(1)
                : throughputWindow;
        LocalDateTime windowStart = now.minus(window);
        if (tasks != null) {
            for (JobTaskEntity task : tasks) {
                if (task == null || task.getStatus() == null) {
                    continue;
                }
                TaskStatusEnum status = task.getStatus();
                switch (status) {
                    case PENDING -> pendingTasks++;
                    case RUNNING -> runningTasks++;
                    case COMPLETED -> completedTasks++;
                    case FAILED -> failedTasks++;
                    case SKIPPED -> skippedTasks++;
                }
                if (!status.isTerminal()) {
                    BatchJobEntity owner = jobById.get(task.getJobId());
                    if (owner == null || !owner.isTerminal()) {
                        remaining++;
                    }
                }
                if (status == TaskStatusEnum.COMPLETED && task.getCompletedAt() != null) {
                    if (task.getStartedAt() != null) {
                        durationTotal += Math.max(0L, Duration.between(task.getStartedAt(), task.getCompletedAt()).toMillis());
                        durationSamples++;
                    }
                    if (!task.getCompletedAt().isBefore(windowStart)) {
                        completedInWindow++;
                    }
                }
            }
        }
        Long averageDuration = durationSamples == 0 ? null : durationTotal / durationSamples;
        double hours = window.toMillis() / 3_600_000D;
        double throughput = BigDecimal.valueOf(completedInWindow / hours).setScale(2, RoundingMode.HALF_UP).doubleValue();

        builder.totalTasks(tasks == null ? 0 : tasks.size())
                .pendingTasks(pendingTasks)
                .runningTasks(runningTasks)
                .completedTasks(completedTasks)
                .failedTasks(failedTasks)
                .skippedTasks(skippedTasks)
                .averageTaskDurationMs(averageDuration)
                .throughputPerHour(throughput)
                .estimatedTimeRemainingMs(estimateRemaining(remaining, averageDuration, parallelism, globalConcurrencyLimit));
        return builder.build();
    }

    private Long estimateRemaining(long remaining, Long averageDuration, long parallelism, int globalConcurrencyLimit) {
        if (averageDuration == null) {
            return null;
        }
        if (remaining <= 0) {
            return 0L;
        }
        long effective = Math.max(1L, parallelism);
        if (globalConcurrencyLimit > 0) {
            effective = Math.min(effective, globalConcurrencyLimit);
        }
        return remaining * averageDuration / effective;
    }
}
