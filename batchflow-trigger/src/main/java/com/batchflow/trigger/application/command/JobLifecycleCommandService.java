package com.batchflow.trigger.application.command;

import com.batchflow.domain.job.adapter.repository.IBatchJobRepository;
import com.batchflow.domain.job.adapter.repository.IJobTaskRepository;
import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.domain.job.model.entity.JobTaskEntity;
import com.batchflow.domain.job.model.valobj.BatchActionItemResult;
import com.batchflow.trigger.application.common.JobLockManager;
import com.batchflow.trigger.application.common.JobRuntimeRegistry;
import com.batchflow.trigger.event.JobEventPublisher;
import com.batchflow.trigger.job.TaskDispatcher;
import com.batchflow.types.enums.BatchActionEnum;
import com.batchflow.types.enums.BatchOutcomeEnum;
import com.batchflow.types.enums.ResponseCode;
import com.batchflow.types.enums.TaskStatusEnum;
import com.batchflow.types.exception.AppException;
import com.batchflow.types.exception.InvalidStateException;
import com.batchflow.types.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * 作业生命周期写用例：start / pause / resume / cancel / retry / delete，单个与批量。
 */
@Slf4j
@Service
public class JobLifecycleCommandService {

    private static final String CANCEL_REASON = "Cancelled by operator";

    private final IBatchJobRepository batchJobRepository;
    private final IJobTaskRepository jobTaskRepository;
    private final JobStateSyncApplicationService jobStateSyncApplicationService;
    private final JobLockManager jobLockManager;
    private final JobRuntimeRegistry jobRuntimeRegistry;
    private final JobEventPublisher jobEventPublisher;
    private final TaskDispatcher taskDispatcher;

    public JobLifecycleCommandService(IBatchJobRepository batchJobRepository,
                                      IJobTaskRepository jobTaskRepository,
                                      JobStateSyncApplicationService jobStateSyncApplicationService,
                                      JobLockManager jobLockManager,
                                      JobRuntimeRegistry jobRuntimeRegistry,
                                      JobEventPublisher jobEventPublisher,
                                      TaskDispatcher taskDispatcher) {
        this.batchJobRepository = batchJobRepository;
        this.jobTaskRepository = jobTaskRepository;
        this.jobStateSyncApplicationService = jobStateSyncApplicationService;
        this.jobLockManager = jobLockManager;
        this.jobRuntimeRegistry = jobRuntimeRegistry;
        this.jobEventPublisher = jobEventPublisher;
        this.taskDispatcher = taskDispatcher;
    }

    public BatchJobEntity start(Long jobId) {
        BatchJobEntity job = jobLockManager.withLock(jobId, () -> {
            BatchJobEntity current = requireJob(jobId);
            current.start();
            jobRuntimeRegistry.reset(jobId);
            log.info("Job started. jobId={}, tasksTotal={}, concurrencyLimit={}",
                    jobId, current.getTasksTotal(), current.getConcurrencyLimit());
            return jobStateSyncApplicationService.recompute(current, List.of("status", "startedAt", "progress")).job();
        });
        return afterRunnable(job);
    }

    public BatchJobEntity pause(Long jobId) {
        return jobLockManager.withLock(jobId, () -> {
            BatchJobEntity current = requireJob(jobId);
            current.pause();
            log.info("Job paused. jobId={}, inFlight={}", jobId, jobRuntimeRegistry.inFlightCount(jobId));
            return jobStateSyncApplicationService.recompute(current, List.of("status")).job();
        });
    }

    public BatchJobEntity resume(Long jobId) {
        BatchJobEntity job = jobLockManager.withLock(jobId, () -> {
            BatchJobEntity current = requireJob(jobId);
            current.resume();
            log.info("Job resumed. jobId={}, inFlight={}", jobId, jobRuntimeRegistry.inFlightCount(jobId));
            return jobStateSyncApplicationService.recompute(current, List.of("status")).job();
        });
        return afterRunnable(job);
    }

    public BatchJobEntity cancel(Long jobId) {
        return jobLockManager.withLock(jobId, () -> {
            BatchJobEntity current = requireJob(jobId);
            current.cancel();
            int skipped = 0;
            for (JobTaskEntity task : jobTaskRepository.findByJobId(jobId)) {
                if (task.isTerminal()) {
                    continue;
                }
                task.skip(CANCEL_REASON);
                jobTaskRepository.update(task);
                skipped++;
            }
            int aborted = jobRuntimeRegistry.abortAll(jobId, CANCEL_REASON);
            log.info("Job cancelled. jobId={}, skippedTasks={}, abortedAttempts={}", jobId, skipped, aborted);
            return jobStateSyncApplicationService.recompute(current, List.of("status", "completedAt")).job();
        });
    }

    public BatchJobEntity retry(Long jobId) {
        BatchJobEntity job = jobLockManager.withLock(jobId, () -> {
            BatchJobEntity current = requireJob(jobId);
            current.resetForRetry();
            int reset = 0;
            for (JobTaskEntity task : jobTaskRepository.findByJobId(jobId)) {
                if (task.getStatus() == TaskStatusEnum.FAILED || task.getStatus() == TaskStatusEnum.SKIPPED) {
                    task.resetForRetry();
                    jobTaskRepository.update(task);
                    reset++;
                }
            }
            current.applyCounters(valueOf(current.getTasksCompleted()), 0, 0);
            jobRuntimeRegistry.abortAll(jobId, "Job retried");
            jobRuntimeRegistry.reset(jobId);
            current.start();
            log.info("Job retried. jobId={}, resetTasks={}, keptCompleted={}", jobId, reset, current.getTasksCompleted());
            return jobStateSyncApplicationService.recompute(current,
                    List.of("status", "startedAt", "completedAt", "errorSummary", "progress")).job();
        });
        return afterRunnable(job);
    }

    public void delete(Long jobId) {
        jobLockManager.runWithLock(jobId, () -> {
            BatchJobEntity current = requireJob(jobId);
            current.assertDeletable();
            int removedTasks = jobTaskRepository.deleteByJobId(jobId);
            batchJobRepository.deleteById(jobId);
            jobRuntimeRegistry.remove(jobId);
            jobEventPublisher.publishJobRemoved(jobId);
            log.info("Job deleted. jobId={}, status={}, removedTasks={}", jobId, current.getStatus(), removedTasks);
        });
        jobLockManager.release(jobId);
    }

    /**
     * 手动重试运行中 (或暂停中) 作业内一个终态失败的任务，作业状态不变
     */
    public JobTaskEntity retryTask(Long jobId, Long taskId) {
        JobTaskEntity task = jobLockManager.withLock(jobId, () -> {
            BatchJobEntity current = requireJob(jobId);
            if (!current.isActive()) {
                throw new InvalidStateException("Tasks can only be retried inside running or paused jobs, jobId="
                        + jobId + ", status=" + current.getStatus().getCode());
            }
            JobTaskEntity target = jobTaskRepository.findById(taskId);
            if (target == null || !Objects.equals(target.getJobId(), jobId)) {
                throw NotFoundException.task(jobId, taskId);
            }
            if (target.getStatus() != TaskStatusEnum.FAILED) {
                throw new InvalidStateException("Only failed tasks can be retried, taskId=" + taskId
                        + ", status=" + target.getStatus().getCode());
            }
            target.resetForRetry();
            jobTaskRepository.update(target);
            log.info("Task retried manually. jobId={}, taskId={}", jobId, taskId);
            jobStateSyncApplicationService.recompute(current, Collections.emptyList());
            return target;
        });
        taskDispatcher.dispatch(jobId);
        return task;
    }

    /**
     * 批量操作：id 去重保序，逐个独立执行，单个失败不影响其它作业
     */
    public List<BatchActionItemResult> batchAction(BatchActionEnum action, List<Long> jobIds) {
        if (action == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "Batch action cannot be null");
        }
        if (jobIds == null || jobIds.isEmpty()) {
            return Collections.emptyList();
        }
        List<BatchActionItemResult> results = new ArrayList<>();
        for (Long jobId : new LinkedHashSet<>(jobIds)) {
            if (jobId == null) {
                continue;
            }
            results.add(applySafely(action, jobId));
        }
        log.info("Batch action finished. action={}, requested={}, processed={}, applied={}",
                action, jobIds.size(), results.size(),
                results.stream().filter(result -> result.outcome() == BatchOutcomeEnum.APPLIED).count());
        return results;
    }

    /**
     * 删除 completedAt 早于 now - olderThan 的终态作业
     *
     * @return 删除的作业数
     */
    public int purgeFinishedJobs(Duration olderThan) {
        if (olderThan == null || olderThan.isNegative() || olderThan.isZero()) {
            return 0;
        }
        LocalDateTime threshold = LocalDateTime.now().minus(olderThan);
        int purged = 0;
        for (BatchJobEntity job : batchJobRepository.findFinishedBefore(threshold)) {
            try {
                delete(job.getId());
                purged++;
            } catch (AppException ex) {
                log.debug("Skip purging job. jobId={}, code={}, error={}", job.getId(), ex.getCode(), ex.getMessage());
            }
        }
        if (purged > 0) {
            log.info("Finished jobs purged. count={}, olderThan={}", purged, olderThan);
        }
        return purged;
    }

    private BatchActionItemResult applySafely(BatchActionEnum action, Long jobId) {
        try {
            BatchJobEntity job = apply(action, jobId);
            return BatchActionItemResult.applied(jobId, job == null ? null : job.getStatus());
        } catch (InvalidStateException ex) {
            BatchJobEntity job = batchJobRepository.findById(jobId);
            return BatchActionItemResult.skipped(jobId, job == null ? null : job.getStatus(), ex.getCode(), ex.getMessage());
        } catch (AppException ex) {
            return BatchActionItemResult.error(jobId, ex.getCode(), ex.getMessage());
        } catch (Exception ex) {
            log.warn("Batch action failed unexpectedly. action={}, jobId={}, error={}", action, jobId, ex.getMessage(), ex);
            return BatchActionItemResult.error(jobId, ResponseCode.UN_ERROR.getCode(), ex.getMessage());
        }
    }

    private BatchJobEntity apply(BatchActionEnum action, Long jobId) {
        return switch (action) {
            case START -> start(jobId);
            case PAUSE -> pause(jobId);
            case RESUME -> resume(jobId);
            case CANCEL -> cancel(jobId);
            case RETRY -> retry(jobId);
            case DELETE -> {
                delete(jobId);
                yield null;
            }
        };
    }

    private BatchJobEntity afterRunnable(BatchJobEntity job) {
        if (job != null && job.isRunning()) {
            taskDispatcher.dispatch(job.getId());
        }
        return job;
    }

    private BatchJobEntity requireJob(Long jobId) {
        BatchJobEntity job = jobId == null ? null : batchJobRepository.findById(jobId);
        if (job == null) {
            throw NotFoundException.job(jobId);
        }
        return job;
    }

    private int valueOf(Integer value) {
        return value == null ? 0 : value;
    }
}
