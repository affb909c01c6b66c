package com.batchflow.trigger.application.command;

import com.batchflow.domain.job.adapter.repository.IBatchJobRepository;
import com.batchflow.domain.job.adapter.repository.IJobTaskRepository;
import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.domain.job.model.entity.JobTaskEntity;
import com.batchflow.domain.job.model.valobj.TaskCounters;
import com.batchflow.domain.job.service.JobProgressDomainService;
import com.batchflow.domain.job.service.JobTransitionDomainService;
import com.batchflow.trigger.application.common.JobRuntimeRegistry;
import com.batchflow.trigger.event.JobEventPublisher;
import com.batchflow.types.enums.JobStatusEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Job 状态同步写用例：重算计数与进度、推进自动终态、落库并发布 job_updated。
 * <p>
 * 调用方必须持有该作业的锁，并传入锁内读取的作业实体。
 * </p>
 */
@Slf4j
@Service
public class JobStateSyncApplicationService {

    private final IBatchJobRepository batchJobRepository;
    private final IJobTaskRepository jobTaskRepository;
    private final JobProgressDomainService jobProgressDomainService;
    private final JobTransitionDomainService jobTransitionDomainService;
    private final JobRuntimeRegistry jobRuntimeRegistry;
    private final JobEventPublisher jobEventPublisher;

    public JobStateSyncApplicationService(IBatchJobRepository batchJobRepository,
                                          IJobTaskRepository jobTaskRepository,
                                          JobProgressDomainService jobProgressDomainService,
                                          JobTransitionDomainService jobTransitionDomainService,
                                          JobRuntimeRegistry jobRuntimeRegistry,
                                          JobEventPublisher jobEventPublisher) {
        this.batchJobRepository = batchJobRepository;
        this.jobTaskRepository = jobTaskRepository;
        this.jobProgressDomainService = jobProgressDomainService;
        this.jobTransitionDomainService = jobTransitionDomainService;
        this.jobRuntimeRegistry = jobRuntimeRegistry;
        this.jobEventPublisher = jobEventPublisher;
    }

    /**
     * @param job           锁内读取并可能已被调用方修改的作业
     * @param changedFields 调用方已修改的字段
     */
    public SyncResult recompute(BatchJobEntity job, Collection<String> changedFields) {
        Set<String> fields = new LinkedHashSet<>();
        if (changedFields != null) {
            fields.addAll(changedFields);
        }
        JobStatusEnum previousStatus = job.getStatus();
        BatchJobEntity before = job.copy();

        TaskCounters counters = jobProgressDomainService.applyTo(job, jobTaskRepository.findByJobId(job.getId()));
        JobTransitionDomainService.Transition transition = jobTransitionDomainService.resolveTransition(job, counters);
        if (transition != null) {
            if (transition.skipRemaining()) {
                int skipped = skipRemaining(job.getId(), transition.reason());
                int aborted = jobRuntimeRegistry.abortAll(job.getId(), transition.reason());
                log.warn("Job failing early, remaining tasks skipped. jobId={}, skipped={}, aborted={}, reason={}",
                        job.getId(), skipped, aborted, transition.reason());
                counters = jobProgressDomainService.applyTo(job, jobTaskRepository.findByJobId(job.getId()));
            }
            jobTransitionDomainService.transit(job, transition);
            log.info("Job auto transitioned. jobId={}, from={}, to={}, completed={}, failed={}, skipped={}, reason={}",
                    job.getId(), previousStatus, job.getStatus(), counters.completed(), counters.failed(),
                    counters.skipped(), transition.reason());
        }
        collectChangedFields(before, job, fields);
        if (fields.isEmpty()) {
            return new SyncResult(job, previousStatus, counters, false);
        }
        batchJobRepository.update(job);
        jobEventPublisher.publishJobUpdated(job, fields);
        return new SyncResult(job, previousStatus, counters, true);
    }

    private int skipRemaining(Long jobId, String reason) {
        List<JobTaskEntity> tasks = jobTaskRepository.findByJobId(jobId);
        int skipped = 0;
        for (JobTaskEntity task : tasks) {
            if (task.isTerminal()) {
                continue;
            }
            task.skip(reason);
            jobTaskRepository.update(task);
            skipped++;
        }
        return skipped;
    }

    private void collectChangedFields(BatchJobEntity before, BatchJobEntity after, Set<String> fields) {
        addIfChanged(fields, "status", before.getStatus(), after.getStatus());
        addIfChanged(fields, "tasksTotal", before.getTasksTotal(), after.getTasksTotal());
        addIfChanged(fields, "tasksCompleted", before.getTasksCompleted(), after.getTasksCompleted());
        addIfChanged(fields, "tasksFailed", before.getTasksFailed(), after.getTasksFailed());
        addIfChanged(fields, "tasksSkipped", before.getTasksSkipped(), after.getTasksSkipped());
        addIfChanged(fields, "progress", before.getProgress(), after.getProgress());
        addIfChanged(fields, "completedAt", before.getCompletedAt(), after.getCompletedAt());
        addIfChanged(fields, "errorSummary", before.getErrorSummary(), after.getErrorSummary());
    }

    private void addIfChanged(Set<String> fields, String name, Object before, Object after) {
        if (!Objects.equals(before, after)) {
            fields.add(name);
        }
    }

    /**
     * @param job            同步后的作业 (已落库时 version 已递增)
     * @param previousStatus 同步前状态
     * @param counters       最新任务计数
     * @param persisted      是否有字段变化并已落库发布
     */
    public record SyncResult(BatchJobEntity job, JobStatusEnum previousStatus, TaskCounters counters, boolean persisted) {

        public boolean transitioned() {
            return previousStatus != job.getStatus();
        }
    }
}
