package com.batchflow.trigger.service;

import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.domain.job.model.entity.JobEventEntity;
import com.batchflow.domain.job.model.entity.JobTaskEntity;
import com.batchflow.domain.job.model.valobj.BatchActionItemResult;
import com.batchflow.domain.job.model.valobj.JobCreateCommand;
import com.batchflow.domain.job.model.valobj.JobQuery;
import com.batchflow.domain.job.model.valobj.JobSnapshot;
import com.batchflow.domain.job.model.valobj.JobStatsSnapshot;
import com.batchflow.domain.job.model.valobj.JobView;
import com.batchflow.trigger.application.command.JobCreateCommandService;
import com.batchflow.trigger.application.command.JobLifecycleCommandService;
import com.batchflow.trigger.application.query.JobQueryService;
import com.batchflow.trigger.event.JobEventPublisher;
import com.batchflow.trigger.event.JobEventReplay;
import com.batchflow.trigger.event.JobEventSubscription;
import com.batchflow.trigger.event.JobSnapshotPoller;
import com.batchflow.types.enums.BatchActionEnum;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * 编排器对外门面：聚合作业创建、生命周期控制、查询与事件订阅。
 */
@Service
public class JobOrchestratorService {

    private final JobCreateCommandService jobCreateCommandService;
    private final JobLifecycleCommandService jobLifecycleCommandService;
    private final JobQueryService jobQueryService;
    private final JobEventPublisher jobEventPublisher;
    private final JobSnapshotPoller jobSnapshotPoller;

    public JobOrchestratorService(JobCreateCommandService jobCreateCommandService,
                                  JobLifecycleCommandService jobLifecycleCommandService,
                                  JobQueryService jobQueryService,
                                  JobEventPublisher jobEventPublisher,
                                  JobSnapshotPoller jobSnapshotPoller) {
        this.jobCreateCommandService = jobCreateCommandService;
        this.jobLifecycleCommandService = jobLifecycleCommandService;
        this.jobQueryService = jobQueryService;
        this.jobEventPublisher = jobEventPublisher;
        this.jobSnapshotPoller = jobSnapshotPoller;
    }

    public Long createJob(JobCreateCommand command) {
        BatchJobEntity job = jobCreateCommandService.createJob(command);
        if (command.isAutoStart()) {
            jobLifecycleCommandService.start(job.getId());
        }
        return job.getId();
    }

    public List<BatchJobEntity> listJobs(JobQuery query) {
        return jobQueryService.listJobs(query);
    }

    public JobView getJob(Long jobId) {
        return jobQueryService.getJob(jobId);
    }

    public BatchJobEntity startJob(Long jobId) {
        return jobLifecycleCommandService.start(jobId);
    }

    public BatchJobEntity pauseJob(Long jobId) {
        return jobLifecycleCommandService.pause(jobId);
    }

    public BatchJobEntity resumeJob(Long jobId) {
        return jobLifecycleCommandService.resume(jobId);
    }

    public BatchJobEntity cancelJob(Long jobId) {
        return jobLifecycleCommandService.cancel(jobId);
    }

    public BatchJobEntity retryJob(Long jobId) {
        return jobLifecycleCommandService.retry(jobId);
    }

    public void deleteJob(Long jobId) {
        jobLifecycleCommandService.delete(jobId);
    }

    public JobTaskEntity retryTask(Long jobId, Long taskId) {
        return jobLifecycleCommandService.retryTask(jobId, taskId);
    }

    public List<BatchActionItemResult> batchAction(BatchActionEnum action, List<Long> jobIds) {
        return jobLifecycleCommandService.batchAction(action, jobIds);
    }

    public JobEventSubscription subscribe(Consumer<JobEventEntity> consumer) {
        return jobEventPublisher.subscribe(consumer);
    }

    public JobEventReplay replayEvents(long afterSequence) {
        return jobEventPublisher.replay(afterSequence);
    }

    public JobStatsSnapshot getStats(JobQuery query) {
        return jobQueryService.getStats(query);
    }

    public JobSnapshot snapshot() {
        return jobQueryService.snapshot();
    }

    public JobSnapshotPoller.PollingHandle pollSnapshots(Duration interval, Consumer<JobSnapshot> consumer) {
        return jobSnapshotPoller.poll(interval, consumer);
    }

    public int purgeFinishedJobs(Duration olderThan) {
        return jobLifecycleCommandService.purgeFinishedJobs(olderThan);
    }
}
