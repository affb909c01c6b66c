package com.batchflow.test.domain;

import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.domain.job.model.entity.JobTaskEntity;
import com.batchflow.domain.job.model.valobj.JobStatsSnapshot;
import com.batchflow.domain.job.service.JobStatsDomainService;
import com.batchflow.types.enums.JobStatusEnum;
import com.batchflow.types.enums.TaskStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

public class JobStatsDomainServiceTest {

    private final JobStatsDomainService service = new JobStatsDomainService();
    private final LocalDateTime now = LocalDateTime.of(2026, 3, 1, 12, 0);

    @Test
    public void shouldAggregateCountsDurationsAndEstimate() {
        BatchJobEntity running = job(1L, JobStatusEnum.RUNNING, 2, now.minusMinutes(10), now.minusMinutes(8));
        BatchJobEntity cancelled = job(2L, JobStatusEnum.CANCELLED, 1, now.minusMinutes(10), now.minusMinutes(6));
        List<JobTaskEntity> tasks = List.of(
                completed(1L, now.minusMinutes(5), 2000L),
                completed(1L, now.minusMinutes(3), 4000L),
                task(1L, TaskStatusEnum.RUNNING),
                task(1L, TaskStatusEnum.PENDING),
                task(1L, TaskStatusEnum.PENDING),
                task(2L, TaskStatusEnum.SKIPPED),
                task(2L, TaskStatusEnum.PENDING));

        JobStatsSnapshot stats = service.compute(List.of(running, cancelled), tasks, now, Duration.ofMinutes(30), 0);

        Assertions.assertEquals(2L, stats.getTotalJobs());
        Assertions.assertEquals(1L, stats.getRunningJobs());
        Assertions.assertEquals(1L, stats.getCancelledJobs());
        Assertions.assertEquals(7L, stats.getTotalTasks());
        Assertions.assertEquals(2L, stats.getCompletedTasks());
        Assertions.assertEquals(3L, stats.getPendingTasks());
        Assertions.assertEquals(3000L, stats.getAverageTaskDurationMs());
        Assertions.assertEquals(180_000L, stats.getAverageQueueWaitMs());
        Assertions.assertEquals(4D, stats.getThroughputPerHour());
        // 剩余 3 个任务 (取消作业的 pending 不计) * 3000ms / 并行度 2
        Assertions.assertEquals(4500L, stats.getEstimatedTimeRemainingMs());
    }

    @Test
    public void shouldCapParallelismByGlobalLimit() {
        BatchJobEntity running = job(1L, JobStatusEnum.RUNNING, 4, now.minusMinutes(2), now.minusMinutes(1));
        List<JobTaskEntity> tasks = List.of(completed(1L, now.minusSeconds(10), 1000L),
                task(1L, TaskStatusEnum.PENDING), task(1L, TaskStatusEnum.PENDING));

        JobStatsSnapshot stats = service.compute(List.of(running), tasks, now, Duration.ofHours(1), 1);

        Assertions.assertEquals(2000L, stats.getEstimatedTimeRemainingMs());
    }

    @Test
    public void shouldLeaveEstimateEmptyWithoutCompletedSamples() {
        BatchJobEntity pending = job(1L, JobStatusEnum.PENDING, 2, now.minusMinutes(1), null);

        JobStatsSnapshot stats = service.compute(List.of(pending), List.of(task(1L, TaskStatusEnum.PENDING)),
                now, Duration.ofHours(1), 0);

        Assertions.assertNull(stats.getEstimatedTimeRemainingMs());
        Assertions.assertNull(stats.getAverageQueueWaitMs());
        Assertions.assertEquals(0D, stats.getThroughputPerHour());
    }

    private BatchJobEntity job(Long id, JobStatusEnum status, int limit, LocalDateTime createdAt, LocalDateTime startedAt) {
        BatchJobEntity job = new BatchJobEntity();
        job.setId(id);
        job.setStatus(status);
        job.setConcurrencyLimit(limit);
        job.setCreatedAt(createdAt);
        job.setStartedAt(startedAt);
        return job;
    }

    private JobTaskEntity task(Long jobId, TaskStatusEnum status) {
        JobTaskEntity task = new JobTaskEntity();
        task.setJobId(jobId);
        task.setStatus(status);
        return task;
    }

    private JobTaskEntity completed(Long jobId, LocalDateTime completedAt, long durationMs) {
        JobTaskEntity task = task(jobId, TaskStatusEnum.COMPLETED);
        task.setCompletedAt(completedAt);
        task.setStartedAt(completedAt.minusNanos(durationMs * 1_000_000L));
        return task;
    }
}
