package com.batchflow.test.domain;

import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.domain.job.model.entity.JobTaskEntity;
import com.batchflow.types.enums.JobStatusEnum;
import com.batchflow.types.enums.ResponseCode;
import com.batchflow.types.enums.TaskStatusEnum;
import com.batchflow.types.exception.InvalidStateException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

public class JobLifecycleStateMachineTest {

    @Test
    public void shouldWalkThroughPauseResumeAndCancel() {
        BatchJobEntity job = job(JobStatusEnum.PENDING);

        job.start();
        Assertions.assertEquals(JobStatusEnum.RUNNING, job.getStatus());
        Assertions.assertNotNull(job.getStartedAt());

        job.pause();
        Assertions.assertEquals(JobStatusEnum.PAUSED, job.getStatus());
        job.resume();
        Assertions.assertEquals(JobStatusEnum.RUNNING, job.getStatus());

        job.cancel();
        Assertions.assertEquals(JobStatusEnum.CANCELLED, job.getStatus());
        Assertions.assertNotNull(job.getCompletedAt());
    }

    @Test
    public void shouldRejectInvalidTransitionsWithInvalidState() {
        InvalidStateException pause = Assertions.assertThrows(InvalidStateException.class,
                () -> job(JobStatusEnum.PENDING).pause());
        Assertions.assertEquals(ResponseCode.INVALID_STATE.getCode(), pause.getCode());

        Assertions.assertThrows(InvalidStateException.class, () -> job(JobStatusEnum.RUNNING).resume());
        Assertions.assertThrows(InvalidStateException.class, () -> job(JobStatusEnum.COMPLETED).cancel());
        Assertions.assertThrows(InvalidStateException.class, () -> job(JobStatusEnum.RUNNING).resetForRetry());
        Assertions.assertThrows(InvalidStateException.class, () -> job(JobStatusEnum.PAUSED).assertDeletable());
        Assertions.assertThrows(InvalidStateException.class, () -> job(JobStatusEnum.RUNNING).start());
    }

    @Test
    public void shouldClearTimestampsWhenRetried() {
        BatchJobEntity job = job(JobStatusEnum.FAILED);
        job.setStartedAt(LocalDateTime.now().minusMinutes(1));
        job.setCompletedAt(LocalDateTime.now());
        job.setErrorSummary("No task completed successfully");

        job.resetForRetry();

        Assertions.assertEquals(JobStatusEnum.PENDING, job.getStatus());
        Assertions.assertNull(job.getStartedAt());
        Assertions.assertNull(job.getCompletedAt());
        Assertions.assertNull(job.getErrorSummary());
    }

    @Test
    public void shouldIncrementRetryCountOnlyOnFailedAttempts() {
        JobTaskEntity task = task(1);

        int attempt = task.dispatch(LocalDateTime.now());
        task.requeue("boom", null);
        Assertions.assertEquals(1, task.getRetryCount());
        Assertions.assertEquals(TaskStatusEnum.PENDING, task.getStatus());
        Assertions.assertFalse(task.isCurrentAttempt(attempt));

        int second = task.dispatch(LocalDateTime.now());
        Assertions.assertEquals(attempt + 1, second);
        Assertions.assertThrows(IllegalStateException.class, () -> task.requeue("boom again", null));
        task.fail("exhausted");
        Assertions.assertEquals(TaskStatusEnum.FAILED, task.getStatus());
        Assertions.assertEquals(1, task.getRetryCount());
    }

    @Test
    public void shouldNotCountSkipAsRetry() {
        JobTaskEntity task = task(2);
        task.dispatch(LocalDateTime.now());

        task.skip("Cancelled by operator");

        Assertions.assertEquals(0, task.getRetryCount());
        Assertions.assertTrue(task.isTerminal());
        Assertions.assertThrows(IllegalStateException.class, () -> task.skip("again"));
    }

    @Test
    public void shouldDelayDueTimeUntilNextAttempt() {
        JobTaskEntity task = task(1);
        LocalDateTime now = LocalDateTime.now();
        task.dispatch(now);
        task.requeue("boom", now.plusSeconds(5));

        Assertions.assertFalse(task.isDue(now));
        Assertions.assertTrue(task.isDue(now.plusSeconds(5)));
    }

    @Test
    public void shouldResetFailedTaskForFreshAttempt() {
        JobTaskEntity task = task(0);
        task.dispatch(LocalDateTime.now());
        task.fail("boom");

        task.resetForRetry();

        Assertions.assertEquals(TaskStatusEnum.PENDING, task.getStatus());
        Assertions.assertEquals(0, task.getRetryCount());
        Assertions.assertNull(task.getError());
        Assertions.assertEquals(1, task.getExecutionAttempt());
    }

    private BatchJobEntity job(JobStatusEnum status) {
        BatchJobEntity job = new BatchJobEntity();
        job.setId(7L);
        job.setName("job");
        job.setStatus(status);
        return job;
    }

    private JobTaskEntity task(int maxRetries) {
        JobTaskEntity task = new JobTaskEntity();
        task.setId(1L);
        task.setJobId(7L);
        task.setStatus(TaskStatusEnum.PENDING);
        task.setRetryCount(0);
        task.setMaxRetries(maxRetries);
        task.setExecutionAttempt(0);
        return task;
    }
}
