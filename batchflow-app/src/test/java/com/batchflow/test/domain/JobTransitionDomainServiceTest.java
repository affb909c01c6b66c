package com.batchflow.test.domain;

import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.domain.job.model.valobj.TaskCounters;
import com.batchflow.domain.job.service.JobTransitionDomainService;
import com.batchflow.types.enums.BatchActionEnum;
import com.batchflow.types.enums.CompletionPolicyEnum;
import com.batchflow.types.enums.JobStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class JobTransitionDomainServiceTest {

    private final JobTransitionDomainService service = new JobTransitionDomainService();

    @Test
    public void shouldCompleteEmptyRunningJob() {
        JobTransitionDomainService.Transition transition = service.resolveTransition(runningJob(null, null),
                TaskCounters.empty());

        Assertions.assertEquals(JobStatusEnum.COMPLETED, transition.target());
    }

    @Test
    public void shouldWaitWhileTasksRemainNonTerminal() {
        TaskCounters counters = new TaskCounters(3, 1, 1, 1, 0, 0, 50D);

        Assertions.assertNull(service.resolveTransition(runningJob(null, null), counters));
    }

    @Test
    public void shouldCompleteWithAnySuccessWhenSomeTasksFailed() {
        TaskCounters counters = new TaskCounters(3, 0, 0, 1, 2, 0, 0D);

        Assertions.assertEquals(JobStatusEnum.COMPLETED,
                service.resolveTransition(runningJob(CompletionPolicyEnum.ANY_SUCCESS, null), counters).target());
    }

    @Test
    public void shouldFailWithAnySuccessWhenNothingCompleted() {
        TaskCounters counters = new TaskCounters(3, 0, 0, 0, 3, 0, 0D);

        JobTransitionDomainService.Transition transition =
                service.resolveTransition(runningJob(CompletionPolicyEnum.ANY_SUCCESS, null), counters);

        Assertions.assertEquals(JobStatusEnum.FAILED, transition.target());
        Assertions.assertNotNull(transition.reason());
    }

    @Test
    public void shouldFailWithAllSuccessWhenOneTaskFailed() {
        TaskCounters counters = new TaskCounters(3, 0, 0, 2, 1, 0, 0D);

        Assertions.assertEquals(JobStatusEnum.FAILED,
                service.resolveTransition(runningJob(CompletionPolicyEnum.ALL_SUCCESS, null), counters).target());
    }

    @Test
    public void shouldFailEarlyWhenFailureRatioExceeded() {
        TaskCounters counters = new TaskCounters(4, 1, 1, 0, 2, 0, 50D);

        JobTransitionDomainService.Transition transition =
                service.resolveTransition(runningJob(CompletionPolicyEnum.ANY_SUCCESS, 0.25D), counters);

        Assertions.assertEquals(JobStatusEnum.FAILED, transition.target());
        Assertions.assertTrue(transition.skipRemaining());
    }

    @Test
    public void shouldIgnoreNonRunningJobs() {
        BatchJobEntity paused = runningJob(null, null);
        paused.setStatus(JobStatusEnum.PAUSED);

        Assertions.assertNull(service.resolveTransition(paused, new TaskCounters(1, 0, 0, 1, 0, 0, 0D)));
    }

    @Test
    public void shouldFollowLifecycleStateMachineForActions() {
        Assertions.assertTrue(service.isActionAllowed(BatchActionEnum.CANCEL, JobStatusEnum.PAUSED));
        Assertions.assertFalse(service.isActionAllowed(BatchActionEnum.CANCEL, JobStatusEnum.COMPLETED));
        Assertions.assertTrue(service.isActionAllowed(BatchActionEnum.RETRY, JobStatusEnum.CANCELLED));
        Assertions.assertFalse(service.isActionAllowed(BatchActionEnum.DELETE, JobStatusEnum.RUNNING));
        Assertions.assertFalse(service.isActionAllowed(BatchActionEnum.RESUME, JobStatusEnum.RUNNING));
    }

    private BatchJobEntity runningJob(CompletionPolicyEnum policy, Double threshold) {
        BatchJobEntity job = new BatchJobEntity();
        job.setId(1L);
        job.setStatus(JobStatusEnum.RUNNING);
        job.setCompletionPolicy(policy);
        job.setFailureRatioThreshold(threshold);
        return job;
    }
}
