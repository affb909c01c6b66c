package com.batchflow.test;

import com.batchflow.domain.job.adapter.repository.IBatchJobRepository;
import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.domain.job.model.valobj.JobQuery;
import com.batchflow.domain.job.model.valobj.JobStatsSnapshot;
import com.batchflow.trigger.application.command.JobLifecycleCommandService;
import com.batchflow.trigger.application.query.JobQueryService;
import com.batchflow.trigger.event.JobEventPublisher;
import com.batchflow.trigger.job.JobRetentionDaemon;
import com.batchflow.trigger.job.JobStatsBroadcastDaemon;
import com.batchflow.trigger.job.TaskDispatchDaemon;
import com.batchflow.trigger.job.TaskDispatcher;
import com.batchflow.types.enums.JobStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class JobDaemonTest {

    @Test
    public void shouldKeepSweepingWhenOneJobFailsToDispatch() {
        IBatchJobRepository jobRepository = mock(IBatchJobRepository.class);
        TaskDispatcher dispatcher = mock(TaskDispatcher.class);
        when(jobRepository.findByStatus(JobStatusEnum.RUNNING)).thenReturn(List.of(job(1L), job(2L), job(3L)));
        when(dispatcher.dispatch(1L)).thenReturn(1);
        when(dispatcher.dispatch(2L)).thenThrow(new IllegalStateException("lock poisoned"));
        when(dispatcher.dispatch(3L)).thenReturn(2);

        new TaskDispatchDaemon(jobRepository, dispatcher).sweep();

        verify(dispatcher).dispatch(1L);
        verify(dispatcher).dispatch(2L);
        verify(dispatcher).dispatch(3L);
    }

    @Test
    public void shouldSkipSweepWithoutRunningJobs() {
        IBatchJobRepository jobRepository = mock(IBatchJobRepository.class);
        TaskDispatcher dispatcher = mock(TaskDispatcher.class);
        when(jobRepository.findByStatus(JobStatusEnum.RUNNING)).thenReturn(Collections.emptyList());

        new TaskDispatchDaemon(jobRepository, dispatcher).sweep();

        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    public void shouldPurgeWithConfiguredTtlAndSwallowFailures() {
        JobLifecycleCommandService lifecycleService = mock(JobLifecycleCommandService.class);
        when(lifecycleService.purgeFinishedJobs(Duration.ofHours(24))).thenThrow(new IllegalStateException("boom"));

        JobRetentionDaemon daemon = new JobRetentionDaemon(lifecycleService, Duration.ofHours(24));
        daemon.purge();
        daemon.purge();

        verify(lifecycleService, times(2)).purgeFinishedJobs(Duration.ofHours(24));
        new JobRetentionDaemon(lifecycleService, null).purge();
        verify(lifecycleService, times(2)).purgeFinishedJobs(any());
    }

    @Test
    public void shouldIgnoreCaptureTimeWhenComparingStats() {
        JobQueryService queryService = mock(JobQueryService.class);
        JobEventPublisher publisher = mock(JobEventPublisher.class);
        JobStatsSnapshot first = JobStatsSnapshot.builder().totalJobs(2L).capturedAt(LocalDateTime.now()).build();
        JobStatsSnapshot sameCounts = JobStatsSnapshot.builder().totalJobs(2L)
                .capturedAt(LocalDateTime.now().plusSeconds(5)).build();
        JobStatsSnapshot changed = JobStatsSnapshot.builder().totalJobs(3L).capturedAt(LocalDateTime.now()).build();
        when(queryService.getStats(any(JobQuery.class))).thenReturn(first, sameCounts, changed);

        JobStatsBroadcastDaemon daemon = new JobStatsBroadcastDaemon(queryService, publisher);

        Assertions.assertTrue(daemon.broadcastIfChanged());
        Assertions.assertFalse(daemon.broadcastIfChanged());
        Assertions.assertTrue(daemon.broadcastIfChanged());
        verify(publisher).publishStats(first);
        verify(publisher).publishStats(changed);
        verify(publisher, times(2)).publishStats(any());
    }

    private BatchJobEntity job(Long id) {
        BatchJobEntity job = new BatchJobEntity();
        job.setId(id);
        job.setStatus(JobStatusEnum.RUNNING);
        return job;
    }
}
