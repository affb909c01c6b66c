package com.batchflow.test;

import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.domain.job.model.entity.JobEventEntity;
import com.batchflow.domain.job.model.entity.JobTaskEntity;
import com.batchflow.domain.job.service.BackoffFunction;
import com.batchflow.test.support.FakeTaskRunner;
import com.batchflow.test.support.OrchestratorTestFixture;
import com.batchflow.types.enums.CompletionPolicyEnum;
import com.batchflow.types.enums.JobEventTypeEnum;
import com.batchflow.types.enums.JobStatusEnum;
import com.batchflow.types.enums.TaskStatusEnum;
import com.batchflow.types.exception.InvalidStateException;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.stream.Collectors;

import static com.batchflow.test.support.OrchestratorTestFixture.await;

/**
 * 编排器端到端场景：真实线程池 + 可编排 Runner。
 */
@Slf4j
public class JobOrchestratorScenarioTest {

    private final FakeTaskRunner runner = new FakeTaskRunner();
    private OrchestratorTestFixture fixture;

    @AfterEach
    public void tearDown() {
        if (fixture != null) {
            fixture.close();
        }
    }

    @Test
    public void shouldCompleteJobAfterRetryingFailedTask() {
        runner.failTimes(1, 1);
        fixture = new OrchestratorTestFixture(runner);
        Long jobId = fixture.createJob(4, 2, 1);

        fixture.orchestrator.startJob(jobId);
        await("job completed", () -> fixture.job(jobId).getStatus() == JobStatusEnum.COMPLETED);

        BatchJobEntity job = fixture.job(jobId);
        Assertions.assertEquals(4, job.getTasksCompleted());
        Assertions.assertEquals(0, job.getTasksFailed());
        Assertions.assertEquals(0, job.getTasksSkipped());
        Assertions.assertEquals(100D, job.getProgress(), 0.001);
        Assertions.assertNotNull(job.getCompletedAt());
        Assertions.assertTrue(runner.maxObservedConcurrency() <= 2,
                "observed concurrency " + runner.maxObservedConcurrency());
        Assertions.assertEquals(2, runner.invocations(1));

        JobTaskEntity retried = fixture.tasks(jobId).get(1);
        Assertions.assertEquals(1, retried.getRetryCount());
        Assertions.assertEquals(TaskStatusEnum.COMPLETED, retried.getStatus());
        fixture.assertCounterInvariant(jobId);
        log.info("测试结果: job={}", job);
    }

    @Test
    public void shouldFailJobWhenEveryTaskExhaustsRetries() {
        runner.failAll();
        fixture = new OrchestratorTestFixture(runner);
        Long jobId = fixture.createJob(3, 3, 0);

        fixture.orchestrator.startJob(jobId);
        await("job failed", () -> fixture.job(jobId).getStatus() == JobStatusEnum.FAILED);

        BatchJobEntity job = fixture.job(jobId);
        Assertions.assertEquals(3, job.getTasksFailed());
        Assertions.assertEquals(0, job.getTasksCompleted());
        Assertions.assertNotNull(job.getErrorSummary());
        Assertions.assertEquals(3, runner.totalInvocations());
        for (JobTaskEntity task : fixture.tasks(jobId)) {
            Assertions.assertEquals(TaskStatusEnum.FAILED, task.getStatus());
            Assertions.assertEquals(0, task.getRetryCount());
            Assertions.assertTrue(task.getError().contains("boom"), task.getError());
        }
        fixture.assertCounterInvariant(jobId);
    }

    @Test
    public void shouldSkipEveryTaskAndIgnoreLateResultsWhenCancelled() {
        CountDownLatch gate = runner.gateAll();
        fixture = new OrchestratorTestFixture(runner);
        Long jobId = fixture.createJob(5, 2, 0);

        fixture.orchestrator.startJob(jobId);
        await("two tasks running", () -> runner.running() == 2);

        BatchJobEntity cancelled = fixture.orchestrator.cancelJob(jobId);
        Assertions.assertEquals(JobStatusEnum.CANCELLED, cancelled.getStatus());
        Assertions.assertEquals(5, cancelled.getTasksSkipped());
        Assertions.assertEquals(0, fixture.runtimeRegistry.inFlightCount(jobId));

        gate.countDown();
        await("runners drained", () -> runner.running() == 0);
        sleep(100L);

        BatchJobEntity job = fixture.job(jobId);
        Assertions.assertEquals(JobStatusEnum.CANCELLED, job.getStatus());
        Assertions.assertEquals(0, job.getTasksCompleted());
        Assertions.assertEquals(5, job.getTasksSkipped());
        Assertions.assertEquals(100D, job.getProgress(), 0.001);
        Assertions.assertEquals(2, runner.totalInvocations());
        fixture.tasks(jobId).forEach(task -> Assertions.assertEquals(TaskStatusEnum.SKIPPED, task.getStatus()));
        fixture.assertCounterInvariant(jobId);
    }

    @Test
    public void shouldReachFullProgressWhenFailureThresholdStopsJobEarly() {
        runner.failTimes(0, 1);
        fixture = new OrchestratorTestFixture(runner);
        Long jobId = fixture.orchestrator.createJob(OrchestratorTestFixture.command("fragile", 4, 1, 0)
                .failureRatioThreshold(0.1D)
                .autoStart(true)
                .build());

        await("job failed", () -> fixture.job(jobId).getStatus() == JobStatusEnum.FAILED);

        BatchJobEntity job = fixture.job(jobId);
        Assertions.assertEquals(1, job.getTasksFailed());
        Assertions.assertEquals(3, job.getTasksSkipped());
        Assertions.assertEquals(100D, job.getProgress(), 0.001);
        Assertions.assertEquals(1, runner.totalInvocations());
        fixture.assertCounterInvariant(jobId);
    }

    @Test
    public void shouldKeepCountersConsistentWithTasksOnEveryJobUpdate() {
        runner.failTimes(1, 1).failTimes(3, 2);
        fixture = new OrchestratorTestFixture(runner, 0, BackoffFunction.none(), 1000, 300_000L, true);
        List<String> violations = new CopyOnWriteArrayList<>();
        List<Long> checked = new CopyOnWriteArrayList<>();
        fixture.orchestrator.subscribe(event -> {
            if (event.getEventType() != JobEventTypeEnum.JOB_UPDATED || event.getJob() == null) {
                return;
            }
            BatchJobEntity snapshot = event.getJob();
            long unfinished = fixture.tasks(event.getJobId()).stream()
                    .filter(task -> task.getStatus() == TaskStatusEnum.PENDING || task.getStatus() == TaskStatusEnum.RUNNING)
                    .count();
            int accounted = snapshot.getTasksCompleted() + snapshot.getTasksFailed() + snapshot.getTasksSkipped()
                    + (int) unfinished;
            if (accounted != snapshot.getTasksTotal()) {
                violations.add("sequence " + event.getSequence() + ": " + accounted + " != " + snapshot.getTasksTotal());
            }
            checked.add(event.getSequence());
        });

        Long finished = fixture.createJob(6, 2, 1);
        fixture.orchestrator.startJob(finished);
        await("job finished", () -> fixture.job(finished).isTerminal());

        CountDownLatch gate = runner.gateAll();
        Long cancelled = fixture.createJob(4, 2, 0);
        fixture.orchestrator.startJob(cancelled);
        await("two tasks running", () -> runner.running() == 2);
        fixture.orchestrator.cancelJob(cancelled);
        gate.countDown();
        await("runners drained", () -> runner.running() == 0);

        Assertions.assertTrue(violations.isEmpty(), violations.toString());
        Assertions.assertTrue(checked.size() >= 6, "checked events " + checked.size());
        BatchJobEntity job = fixture.job(finished);
        Assertions.assertEquals(JobStatusEnum.COMPLETED, job.getStatus());
        Assertions.assertEquals(5, job.getTasksCompleted());
        Assertions.assertEquals(1, job.getTasksFailed());
        Assertions.assertEquals(JobStatusEnum.CANCELLED, fixture.job(cancelled).getStatus());
    }

    @Test
    public void shouldRestoreSchedulingStateWhenPauseIsFollowedByResume() {
        CountDownLatch gate = runner.gateAll();
        fixture = new OrchestratorTestFixture(runner);
        Long jobId = fixture.createJob(5, 2, 0);
        fixture.orchestrator.startJob(jobId);
        await("two tasks running", () -> runner.running() == 2);

        Map<Long, String> statusesBefore = schedulingState(jobId);
        List<Long> eligibleBefore = eligibleTaskIds(jobId);
        int inFlightBefore = fixture.runtimeRegistry.inFlightCount(jobId);

        fixture.orchestrator.pauseJob(jobId);
        BatchJobEntity resumed = fixture.orchestrator.resumeJob(jobId);

        Assertions.assertEquals(JobStatusEnum.RUNNING, resumed.getStatus());
        Assertions.assertEquals(statusesBefore, schedulingState(jobId));
        Assertions.assertEquals(eligibleBefore, eligibleTaskIds(jobId));
        Assertions.assertEquals(inFlightBefore, fixture.runtimeRegistry.inFlightCount(jobId));
        Assertions.assertEquals(2, runner.totalInvocations());
        Assertions.assertEquals(3, eligibleBefore.size());

        gate.countDown();
        await("job completed", () -> fixture.job(jobId).getStatus() == JobStatusEnum.COMPLETED);
        Assertions.assertEquals(5, runner.totalInvocations());
    }

    /**
     * taskId -> status/executionAttempt/retryCount
     */
    private Map<Long, String> schedulingState(Long jobId) {
        return fixture.tasks(jobId).stream().collect(Collectors.toMap(JobTaskEntity::getId,
                task -> task.getStatus().getCode() + "/" + task.getExecutionAttempt() + "/" + task.getRetryCount()));
    }

    private List<Long> eligibleTaskIds(Long jobId) {
        LocalDateTime now = LocalDateTime.now();
        return fixture.tasks(jobId).stream()
                .filter(task -> task.isDue(now))
                .map(JobTaskEntity::getId)
                .collect(Collectors.toList());
    }

    @Test
    public void shouldRejectDeletingActiveJob() {
        CountDownLatch gate = runner.gateAll();
        fixture = new OrchestratorTestFixture(runner);
        Long jobId = fixture.createJob(2, 1, 0);
        fixture.orchestrator.startJob(jobId);
        await("task running", () -> runner.running() == 1);

        Assertions.assertThrows(InvalidStateException.class, () -> fixture.orchestrator.deleteJob(jobId));

        BatchJobEntity job = fixture.job(jobId);
        Assertions.assertNotNull(job);
        Assertions.assertEquals(JobStatusEnum.RUNNING, job.getStatus());
        Assertions.assertEquals(2, fixture.tasks(jobId).size());

        gate.countDown();
        await("job completed", () -> fixture.job(jobId).getStatus() == JobStatusEnum.COMPLETED);
        fixture.orchestrator.deleteJob(jobId);
        Assertions.assertNull(fixture.job(jobId));
        Assertions.assertTrue(fixture.tasks(jobId).isEmpty());
    }

    @Test
    public void shouldHoldDispatchWhilePausedAndKeepProgressMonotonic() {
        CountDownLatch gate = runner.gateAll();
        fixture = new OrchestratorTestFixture(runner);
        Long jobId = fixture.createJob(3, 1, 0);
        List<JobEventEntity> events = new CopyOnWriteArrayList<>();
        fixture.orchestrator.subscribe(event -> {
            if (jobId.equals(event.getJobId()) && event.getJob() != null) {
                events.add(event);
            }
        });

        fixture.orchestrator.startJob(jobId);
        await("first task running", () -> runner.running() == 1);
        fixture.orchestrator.pauseJob(jobId);

        gate.countDown();
        await("in-flight result applied while paused", () -> fixture.job(jobId).getTasksCompleted() == 1);
        sleep(150L);
        Assertions.assertEquals(JobStatusEnum.PAUSED, fixture.job(jobId).getStatus());
        Assertions.assertEquals(1, runner.totalInvocations());

        fixture.orchestrator.resumeJob(jobId);
        await("job completed", () -> fixture.job(jobId).getStatus() == JobStatusEnum.COMPLETED);
        await("completion event delivered", () -> events.stream()
                .anyMatch(event -> event.getJob().getStatus() == JobStatusEnum.COMPLETED));

        double previous = -1D;
        long previousSequence = 0L;
        for (JobEventEntity event : events) {
            Assertions.assertTrue(event.getSequence() > previousSequence, "events out of order");
            Assertions.assertTrue(event.getJob().getProgress() >= previous,
                    "progress went backwards at sequence " + event.getSequence());
            previous = event.getJob().getProgress();
            previousSequence = event.getSequence();
        }
        Assertions.assertEquals(100D, previous, 0.001);
    }

    @Test
    public void shouldRerunOnlyUnfinishedTasksWhenJobRetried() {
        runner.failTimes(0, 1).failTimes(1, 1);
        fixture = new OrchestratorTestFixture(runner);
        Long jobId = fixture.orchestrator.createJob(OrchestratorTestFixture.command("strict", 3, 1, 0)
                .completionPolicy(CompletionPolicyEnum.ALL_SUCCESS)
                .autoStart(true)
                .build());

        await("job failed", () -> fixture.job(jobId).getStatus() == JobStatusEnum.FAILED);
        Assertions.assertEquals(1, fixture.job(jobId).getTasksCompleted());
        Assertions.assertEquals(2, fixture.job(jobId).getTasksFailed());

        BatchJobEntity retried = fixture.orchestrator.retryJob(jobId);
        Assertions.assertNotEquals(JobStatusEnum.FAILED, retried.getStatus());
        await("job completed after retry", () -> fixture.job(jobId).getStatus() == JobStatusEnum.COMPLETED);

        BatchJobEntity job = fixture.job(jobId);
        Assertions.assertEquals(3, job.getTasksCompleted());
        Assertions.assertEquals(0, job.getTasksFailed());
        Assertions.assertNull(job.getErrorSummary());
        Assertions.assertEquals(1, runner.invocations(2));
        Assertions.assertEquals(2, runner.invocations(0));
        fixture.assertCounterInvariant(jobId);
    }

    @Test
    public void shouldRetrySingleFailedTaskInsideRunningJob() {
        runner.failTimes(0, 1);
        CountDownLatch second = runner.gate(1);
        fixture = new OrchestratorTestFixture(runner);
        Long jobId = fixture.createJob(2, 1, 0);

        fixture.orchestrator.startJob(jobId);
        await("second task running", () -> runner.invocations(1) == 1);
        JobTaskEntity failed = fixture.tasks(jobId).get(0);
        Assertions.assertEquals(TaskStatusEnum.FAILED, failed.getStatus());
        Assertions.assertEquals(JobStatusEnum.RUNNING, fixture.job(jobId).getStatus());

        Long runningTaskId = fixture.tasks(jobId).get(1).getId();
        Assertions.assertThrows(InvalidStateException.class,
                () -> fixture.orchestrator.retryTask(jobId, runningTaskId));

        JobTaskEntity reset = fixture.orchestrator.retryTask(jobId, failed.getId());
        Assertions.assertEquals(TaskStatusEnum.PENDING, reset.getStatus());
        Assertions.assertEquals(0, fixture.job(jobId).getTasksFailed());

        second.countDown();
        await("job completed", () -> fixture.job(jobId).getStatus() == JobStatusEnum.COMPLETED);
        Assertions.assertEquals(2, fixture.job(jobId).getTasksCompleted());
        Assertions.assertEquals(2, runner.invocations(0));
    }

    @Test
    public void shouldFailAttemptThatExceedsTimeout() {
        runner.gate(0);
        fixture = new OrchestratorTestFixture(runner);
        Long jobId = fixture.orchestrator.createJob(OrchestratorTestFixture.command("slow", 1, 1, 0)
                .taskTimeoutMs(100L)
                .autoStart(true)
                .build());

        await("job failed", () -> fixture.job(jobId).getStatus() == JobStatusEnum.FAILED);

        JobTaskEntity task = fixture.tasks(jobId).get(0);
        Assertions.assertEquals(TaskStatusEnum.FAILED, task.getStatus());
        Assertions.assertTrue(task.getError().contains("timed out"), task.getError());
        Assertions.assertEquals(0, fixture.runtimeRegistry.inFlightCount(jobId));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            Assertions.fail("Interrupted");
        }
    }
}
