package com.batchflow.test.domain;

import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.domain.job.model.entity.JobTaskEntity;
import com.batchflow.domain.job.model.valobj.TaskCounters;
import com.batchflow.domain.job.service.JobProgressDomainService;
import com.batchflow.types.enums.JobStatusEnum;
import com.batchflow.types.enums.TaskStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class JobProgressDomainServiceTest {

    private final JobProgressDomainService service = new JobProgressDomainService();

    @Test
    public void shouldGiveHalfCreditToRunningTasksWithoutReportedProgress() {
        TaskCounters counters = service.count(List.of(
                task(TaskStatusEnum.COMPLETED, null),
                task(TaskStatusEnum.FAILED, null),
                task(TaskStatusEnum.RUNNING, null),
                task(TaskStatusEnum.PENDING, null)));

        Assertions.assertEquals(4, counters.total());
        Assertions.assertEquals(1, counters.running());
        Assertions.assertEquals(62.5D, service.computeProgress(counters));
    }

    @Test
    public void shouldUseReportedProgressOfRunningTasks() {
        TaskCounters counters = service.count(List.of(
                task(TaskStatusEnum.RUNNING, 20),
                task(TaskStatusEnum.RUNNING, 130),
                task(TaskStatusEnum.PENDING, null)));

        // (0/3)*100 + (20 + 100)/3
        Assertions.assertEquals(40D, service.computeProgress(counters));
    }

    @Test
    public void shouldCountSkippedTasksAsProcessed() {
        TaskCounters counters = service.count(List.of(
                task(TaskStatusEnum.FAILED, null),
                task(TaskStatusEnum.FAILED, null),
                task(TaskStatusEnum.SKIPPED, null),
                task(TaskStatusEnum.SKIPPED, null),
                task(TaskStatusEnum.SKIPPED, null)));

        Assertions.assertTrue(counters.allTerminal());
        Assertions.assertEquals(100D, service.computeProgress(counters));

        TaskCounters partial = service.count(List.of(
                task(TaskStatusEnum.SKIPPED, null),
                task(TaskStatusEnum.PENDING, null),
                task(TaskStatusEnum.PENDING, null)));
        Assertions.assertEquals(33.33D, service.computeProgress(partial));
    }

    @Test
    public void shouldReturnZeroForEmptyJob() {
        Assertions.assertEquals(0D, service.computeProgress(service.count(List.of())));
    }

    @Test
    public void shouldKeepProgressMonotonicWhileRunning() {
        BatchJobEntity job = new BatchJobEntity();
        job.setStatus(JobStatusEnum.RUNNING);
        job.setProgress(0D);

        service.applyTo(job, List.of(task(TaskStatusEnum.RUNNING, 80), task(TaskStatusEnum.PENDING, null)));
        Assertions.assertEquals(40D, job.getProgress());

        // 失败后重新排队，原始计算值回落，对外进度保持不变
        service.applyTo(job, List.of(task(TaskStatusEnum.PENDING, null), task(TaskStatusEnum.PENDING, null)));
        Assertions.assertEquals(40D, job.getProgress());
        Assertions.assertEquals(0, job.getTasksCompleted());
    }

    @Test
    public void shouldRecomputeProgressOnceTerminal() {
        BatchJobEntity job = new BatchJobEntity();
        job.setStatus(JobStatusEnum.CANCELLED);
        job.setProgress(25D);

        service.applyTo(job, List.of(task(TaskStatusEnum.SKIPPED, null), task(TaskStatusEnum.COMPLETED, null)));

        Assertions.assertEquals(100D, job.getProgress());
        Assertions.assertEquals(1, job.getTasksSkipped());
        Assertions.assertEquals(1, job.getTasksCompleted());
        Assertions.assertEquals(2, job.getTasksTotal());
    }

    private JobTaskEntity task(TaskStatusEnum status, Integer progress) {
        JobTaskEntity task = new JobTaskEntity();
        task.setStatus(status);
        task.setProgress(progress);
        return task;
    }
}
