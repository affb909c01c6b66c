package com.batchflow.trigger.job;

import com.batchflow.domain.job.adapter.gateway.ITaskRunner;
import com.batchflow.domain.job.adapter.gateway.ITaskRunnerRegistry;
import com.batchflow.domain.job.adapter.repository.IBatchJobRepository;
import com.batchflow.domain.job.adapter.repository.IJobTaskRepository;
import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.domain.job.model.entity.JobTaskEntity;
import com.batchflow.domain.job.model.valobj.AbortSignal;
import com.batchflow.domain.job.model.valobj.RetryDecision;
import com.batchflow.domain.job.model.valobj.TaskRunContext;
import com.batchflow.domain.job.model.valobj.TaskRunResult;
import com.batchflow.domain.job.service.RetryPolicy;
import com.batchflow.trigger.application.command.JobStateSyncApplicationService;
import com.batchflow.trigger.application.common.JobLockManager;
import com.batchflow.trigger.application.common.JobRuntimeRegistry;
import com.batchflow.types.common.Constants;
import com.batchflow.types.enums.JobPriorityEnum;
import com.batchflow.types.enums.JobStatusEnum;
import com.batchflow.types.exception.ConcurrencyLimitViolationException;
import com.batchflow.types.exception.RetryExhaustedException;
import com.batchflow.types.exception.TaskExecutionException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 任务调度器：为运行中的作业派发到期任务、回收执行结果并驱动重试。
 * <p>
 * 派发决策在作业锁内完成，Runner 调用在 taskExecutionWorker 线程池执行，锁外提交。
 * 执行结果回到作业锁内按执行代际校验后落库，过期结果直接丢弃。
 * 开启全局并发上限时，释放的全局额度按优先级权重、最近获得额度时间、startedAt 依次分配给等待中的作业。
 * </p>
 */
@Slf4j
@Component
public class TaskDispatcher {

    private final IBatchJobRepository batchJobRepository;
    private final IJobTaskRepository jobTaskRepository;
    private final ITaskRunnerRegistry taskRunnerRegistry;
    private final RetryPolicy retryPolicy;
    private final JobStateSyncApplicationService jobStateSyncApplicationService;
    private final JobLockManager jobLockManager;
    private final JobRuntimeRegistry jobRuntimeRegistry;
    private final Executor taskExecutionWorker;
    private final TaskScheduler daemonScheduler;
    private final int globalConcurrencyLimit;
    private final long defaultTaskTimeoutMs;
    private final AtomicInteger globalInFlight = new AtomicInteger();
    private final AtomicLong grantSequence = new AtomicLong();
    private final Map<Long, Long> lastGrantByJob = new ConcurrentHashMap<>();

    private final Counter dispatchCounter;
    private final Counter successCounter;
    private final Counter failureCounter;
    private final Counter timeoutCounter;
    private final Counter retryCounter;
    private final Counter exhaustedCounter;
    private final Counter staleResultCounter;
    private final Counter rejectedCounter;

    public TaskDispatcher(IBatchJobRepository batchJobRepository,
                          IJobTaskRepository jobTaskRepository,
                          ITaskRunnerRegistry taskRunnerRegistry,
                          RetryPolicy retryPolicy,
                          JobStateSyncApplicationService jobStateSyncApplicationService,
                          JobLockManager jobLockManager,
                          JobRuntimeRegistry jobRuntimeRegistry,
                          @Qualifier("taskExecutionWorker") Executor taskExecutionWorker,
                          @Qualifier("daemonScheduler") TaskScheduler daemonScheduler,
                          @Value("${batchflow.scheduler.global-concurrency-limit:0}") int globalConcurrencyLimit,
                          @Value("${batchflow.job.default-task-timeout-ms:300000}") long defaultTaskTimeoutMs) {
        this.batchJobRepository = batchJobRepository;
        this.jobTaskRepository = jobTaskRepository;
        this.taskRunnerRegistry = taskRunnerRegistry;
        this.retryPolicy = retryPolicy;
        this.jobStateSyncApplicationService = jobStateSyncApplicationService;
        this.jobLockManager = jobLockManager;
        this.jobRuntimeRegistry = jobRuntimeRegistry;
        this.taskExecutionWorker = taskExecutionWorker;
        this.daemonScheduler = daemonScheduler;
        this.globalConcurrencyLimit = Math.max(globalConcurrencyLimit, 0);
        this.defaultTaskTimeoutMs = defaultTaskTimeoutMs > 0 ? defaultTaskTimeoutMs : Constants.DEFAULT_TASK_TIMEOUT_MS;
        this.dispatchCounter = Counter.builder("batchflow.task.dispatch.total").register(Metrics.globalRegistry);
        this.successCounter = Counter.builder("batchflow.task.success.total").register(Metrics.globalRegistry);
        this.failureCounter = Counter.builder("batchflow.task.failure.total").register(Metrics.globalRegistry);
        this.timeoutCounter = Counter.builder("batchflow.task.timeout.total").register(Metrics.globalRegistry);
        this.retryCounter = Counter.builder("batchflow.task.retry.total").register(Metrics.globalRegistry);
        this.exhaustedCounter = Counter.builder("batchflow.task.retry.exhausted.total").register(Metrics.globalRegistry);
        this.staleResultCounter = Counter.builder("batchflow.task.result.stale.total").register(Metrics.globalRegistry);
        this.rejectedCounter = Counter.builder("batchflow.task.dispatch.rejected.total").register(Metrics.globalRegistry);
    }

    /**
     * 为作业派发到期任务，直到填满并发额度
     *
     * @return 本次派发的任务数
     */
    public int dispatch(Long jobId) {
        return dispatch(jobId, Integer.MAX_VALUE);
    }

    /**
     * 按优先级把空闲的全局额度逐个分配给运行中作业。
     * <p>
     * 每分配一个任务重新排序：权重高者优先，同权重中最久未获得额度的作业优先，再按 startedAt、id。
     * 未开启全局上限时等价于依次调用 {@link #dispatch(Long)}。
     * </p>
     *
     * @return 本次派发的任务数
     */
    public int dispatchByPriority() {
        List<BatchJobEntity> candidates = new ArrayList<>(batchJobRepository.findByStatus(JobStatusEnum.RUNNING));
        if (candidates.isEmpty()) {
            return 0;
        }
        if (!isGlobalLimitEnabled()) {
            int dispatched = 0;
            candidates.sort(dispatchOrder());
            for (BatchJobEntity job : candidates) {
                dispatched += dispatchQuietly(job.getId(), Integer.MAX_VALUE);
            }
            return dispatched;
        }
        int dispatched = 0;
        while (!candidates.isEmpty() && globalInFlight.get() < globalConcurrencyLimit) {
            candidates.sort(dispatchOrder());
            boolean granted = false;
            List<BatchJobEntity> exhausted = new ArrayList<>();
            for (BatchJobEntity job : candidates) {
                int launched = dispatchQuietly(job.getId(), 1);
                if (launched > 0) {
                    dispatched += launched;
                    granted = true;
                    break;
                }
                exhausted.add(job);
                if (globalInFlight.get() >= globalConcurrencyLimit) {
                    break;
                }
            }
            candidates.removeAll(exhausted);
            if (!granted) {
                break;
            }
        }
        if (dispatched > 0) {
            log.debug("Global slots granted by priority. dispatched={}, globalInFlight={}, limit={}",
                    dispatched, globalInFlight.get(), globalConcurrencyLimit);
        }
        return dispatched;
    }

    public boolean isGlobalLimitEnabled() {
        return globalConcurrencyLimit > 0;
    }

    public int globalInFlight() {
        return globalInFlight.get();
    }

    private int dispatch(Long jobId, int maxLaunches) {
        if (jobId == null) {
            return 0;
        }
        List<Launch> launches = jobLockManager.withLock(jobId, () -> planLaunches(jobId, maxLaunches));
        for (Launch launch : launches) {
            launch(launch);
        }
        return launches.size();
    }

    private int dispatchQuietly(Long jobId, int maxLaunches) {
        try {
            return dispatch(jobId, maxLaunches);
        } catch (Exception ex) {
            log.warn("Dispatch failed for job. jobId={}, error={}", jobId, ex.getMessage());
            return 0;
        }
    }

    private Comparator<BatchJobEntity> dispatchOrder() {
        return Comparator.comparingInt((BatchJobEntity job) -> priorityWeight(job.getPriority())).reversed()
                .thenComparingLong(job -> lastGrantByJob.getOrDefault(job.getId(), 0L))
                .thenComparing(BatchJobEntity::getStartedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(BatchJobEntity::getId, Comparator.nullsLast(Comparator.naturalOrder()));
    }

    private int priorityWeight(JobPriorityEnum priority) {
        return (priority == null ? JobPriorityEnum.NORMAL : priority).getWeight();
    }

    private List<Launch> planLaunches(Long jobId, int maxLaunches) {
        BatchJobEntity job = batchJobRepository.findById(jobId);
        if (job == null || !job.isRunning()) {
            lastGrantByJob.remove(jobId);
            return Collections.emptyList();
        }
        if (jobRuntimeRegistry.isHalted(jobId)) {
            log.debug("Skip dispatch because job scheduling is halted. jobId={}", jobId);
            return Collections.emptyList();
        }
        int limit = Math.max(1, job.getConcurrencyLimit() == null ? 1 : job.getConcurrencyLimit());
        int inFlight = jobRuntimeRegistry.inFlightCount(jobId);
        if (inFlight > limit) {
            ConcurrencyLimitViolationException violation = new ConcurrencyLimitViolationException(jobId, inFlight, limit);
            jobRuntimeRegistry.halt(jobId, violation.getMessage());
            log.error("Job scheduling halted. jobId={}, code={}, error={}", jobId, violation.getCode(), violation.getMessage());
            return Collections.emptyList();
        }
        int slots = Math.min(limit - inFlight, maxLaunches);
        if (slots <= 0) {
            return Collections.emptyList();
        }

        LocalDateTime now = LocalDateTime.now();
        long timeoutMs = job.getTaskTimeoutMs() != null && job.getTaskTimeoutMs() > 0
                ? job.getTaskTimeoutMs()
                : defaultTaskTimeoutMs;
        List<Launch> launches = new ArrayList<>();
        for (JobTaskEntity task : jobTaskRepository.findByJobId(jobId)) {
            if (launches.size() >= slots) {
                break;
            }
            if (!task.isDue(now)) {
                continue;
            }
            if (!tryAcquireGlobalSlot()) {
                log.debug("Global concurrency limit reached. jobId={}, globalInFlight={}, limit={}",
                        jobId, globalInFlight.get(), globalConcurrencyLimit);
                break;
            }
            int attempt = task.dispatch(now);
            jobTaskRepository.update(task);
            AbortSignal signal = new AbortSignal();
            jobRuntimeRegistry.register(jobId, task.getId(), attempt, signal);
            launches.add(new Launch(jobId, job.getType(), task.copy(), attempt, signal, timeoutMs));
            dispatchCounter.increment();
        }
        if (!launches.isEmpty()) {
            lastGrantByJob.put(jobId, grantSequence.incrementAndGet());
            jobStateSyncApplicationService.recompute(job, Collections.emptyList());
            log.debug("Tasks dispatched. jobId={}, dispatched={}, inFlight={}, limit={}",
                    jobId, launches.size(), jobRuntimeRegistry.inFlightCount(jobId), limit);
        }
        return launches;
    }

    private void launch(Launch launch) {
        ITaskRunner runner = taskRunnerRegistry.resolve(launch.jobType());
        Instant deadline = Instant.now().plusMillis(launch.timeoutMs());
        TaskRunContext context = new TaskRunContext(launch.jobId(), launch.jobType(), launch.task(), launch.attempt(),
                deadline, launch.signal(),
                percent -> reportProgress(launch.jobId(), launch.task().getId(), launch.attempt(), percent));
        CompletableFuture<TaskRunResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> runTask(runner, context), taskExecutionWorker);
        } catch (RejectedExecutionException ex) {
            releaseGlobalSlot();
            rejectedCounter.increment();
            onRejected(launch, ex);
            return;
        }
        future.orTimeout(launch.timeoutMs(), TimeUnit.MILLISECONDS)
                .whenComplete((result, error) -> {
                    releaseGlobalSlot();
                    onAttemptFinished(launch, result, error);
                });
    }

    private TaskRunResult runTask(ITaskRunner runner, TaskRunContext context) {
        if (runner == null) {
            throw new TaskExecutionException("No task runner registered for type: " + context.jobType());
        }
        TaskRunResult result;
        try {
            result = runner.execute(context);
        } catch (TaskExecutionException ex) {
            throw ex;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TaskExecutionException("Task runner interrupted", ex);
        } catch (Exception ex) {
            throw new TaskExecutionException(StringUtils.defaultIfBlank(ex.getMessage(), ex.getClass().getSimpleName()), ex);
        }
        if (result == null) {
            return TaskRunResult.success(null);
        }
        if (!result.success()) {
            throw new TaskExecutionException(StringUtils.defaultIfBlank(result.error(), "Task runner reported failure"));
        }
        return result;
    }

    private void onAttemptFinished(Launch launch, TaskRunResult result, Throwable error) {
        boolean redispatch;
        try {
            redispatch = jobLockManager.withLock(launch.jobId(), () -> applyAttemptResult(launch, result, unwrap(error)));
        } catch (Exception ex) {
            log.warn("Failed to apply task result. jobId={}, taskId={}, attempt={}, error={}",
                    launch.jobId(), launch.task().getId(), launch.attempt(), ex.getMessage(), ex);
            redispatch = false;
        }
        if (isGlobalLimitEnabled()) {
            safeDispatchByPriority();
        } else if (redispatch) {
            safeDispatch(launch.jobId());
        }
    }

    private boolean applyAttemptResult(Launch launch, TaskRunResult result, Throwable error) {
        Long jobId = launch.jobId();
        Long taskId = launch.task().getId();
        JobRuntimeRegistry.InFlightAttempt inFlight = jobRuntimeRegistry.complete(jobId, taskId, launch.attempt());
        if (error instanceof TimeoutException) {
            launch.signal().abort("Attempt timed out after " + launch.timeoutMs() + "ms");
        }
        BatchJobEntity job = batchJobRepository.findById(jobId);
        JobTaskEntity task = job == null ? null : jobTaskRepository.findById(taskId);
        if (task == null || !task.isCurrentAttempt(launch.attempt())) {
            staleResultCounter.increment();
            log.debug("Stale task result discarded. jobId={}, taskId={}, attempt={}, tracked={}, taskStatus={}",
                    jobId, taskId, launch.attempt(), inFlight != null, task == null ? null : task.getStatus());
            return false;
        }

        if (error == null) {
            task.complete(result == null ? null : result.output());
            jobTaskRepository.update(task);
            successCounter.increment();
            log.debug("Task completed. jobId={}, taskId={}, attempt={}", jobId, taskId, launch.attempt());
        } else {
            handleFailure(job, task, describe(error, launch.timeoutMs()), error instanceof TimeoutException);
        }
        JobStateSyncApplicationService.SyncResult sync = jobStateSyncApplicationService.recompute(job,
                Collections.emptyList());
        return sync.job().isRunning();
    }

    private void handleFailure(BatchJobEntity job, JobTaskEntity task, String reason, boolean timedOut) {
        failureCounter.increment();
        if (timedOut) {
            timeoutCounter.increment();
        }
        int retryCount = task.getRetryCount() == null ? 0 : task.getRetryCount();
        int maxRetries = task.getMaxRetries() == null ? 0 : task.getMaxRetries();
        RetryDecision decision = retryPolicy.decide(retryCount, maxRetries, reason);
        if (decision.isRetry()) {
            LocalDateTime nextAttemptAt = decision.getKind() == RetryDecision.Kind.RETRY_AFTER_DELAY
                    ? LocalDateTime.now().plusNanos(TimeUnit.MILLISECONDS.toNanos(decision.getDelayMs()))
                    : null;
            task.requeue(reason, nextAttemptAt);
            jobTaskRepository.update(task);
            retryCounter.increment();
            log.info("Task attempt failed, retrying. jobId={}, taskId={}, retryCount={}, maxRetries={}, decision={}, error={}",
                    job.getId(), task.getId(), task.getRetryCount(), maxRetries, decision, reason);
            if (nextAttemptAt != null) {
                scheduleWakeUp(job.getId(), decision.getDelayMs());
            }
            return;
        }
        RetryExhaustedException exhausted = new RetryExhaustedException(task.getId(), retryCount + 1, reason);
        task.fail(exhausted.getMessage());
        jobTaskRepository.update(task);
        exhaustedCounter.increment();
        log.warn("Task failed permanently. jobId={}, taskId={}, retryCount={}, code={}, error={}",
                job.getId(), task.getId(), retryCount, exhausted.getCode(), reason);
    }

    private void reportProgress(Long jobId, Long taskId, int attempt, int percent) {
        try {
            jobLockManager.runWithLock(jobId, () -> {
                BatchJobEntity job = batchJobRepository.findById(jobId);
                JobTaskEntity task = job == null ? null : jobTaskRepository.findById(taskId);
                if (task == null || !task.isCurrentAttempt(attempt)) {
                    return;
                }
                task.reportProgress(percent);
                jobTaskRepository.update(task);
                jobStateSyncApplicationService.recompute(job, Collections.emptyList());
            });
        } catch (Exception ex) {
            log.debug("Task progress report ignored. jobId={}, taskId={}, attempt={}, error={}",
                    jobId, taskId, attempt, ex.getMessage());
        }
    }

    private void onRejected(Launch launch, RejectedExecutionException ex) {
        Long jobId = launch.jobId();
        Long taskId = launch.task().getId();
        jobLockManager.runWithLock(jobId, () -> {
            jobRuntimeRegistry.complete(jobId, taskId, launch.attempt());
            BatchJobEntity job = batchJobRepository.findById(jobId);
            JobTaskEntity task = job == null ? null : jobTaskRepository.findById(taskId);
            if (task == null || !task.isCurrentAttempt(launch.attempt())) {
                return;
            }
            task.revertDispatch();
            jobTaskRepository.update(task);
            jobStateSyncApplicationService.recompute(job, Collections.emptyList());
        });
        log.warn("Task execution rejected by worker pool, task returned to pending. jobId={}, taskId={}, error={}",
                jobId, taskId, ex.getMessage());
    }

    private void scheduleWakeUp(Long jobId, long delayMs) {
        try {
            daemonScheduler.schedule(() -> safeDispatch(jobId), Instant.now().plusMillis(delayMs));
        } catch (RejectedExecutionException ex) {
            log.debug("Retry wake-up not scheduled, relying on dispatch daemon. jobId={}, error={}", jobId, ex.getMessage());
        }
    }

    private void safeDispatch(Long jobId) {
        try {
            dispatch(jobId);
        } catch (Exception ex) {
            log.warn("Task dispatch failed. jobId={}, error={}", jobId, ex.getMessage(), ex);
        }
    }

    private void safeDispatchByPriority() {
        try {
            dispatchByPriority();
        } catch (Exception ex) {
            log.warn("Priority dispatch failed. error={}", ex.getMessage(), ex);
        }
    }

    private boolean tryAcquireGlobalSlot() {
        if (globalConcurrencyLimit <= 0) {
            globalInFlight.incrementAndGet();
            return true;
        }
        while (true) {
            int current = globalInFlight.get();
            if (current >= globalConcurrencyLimit) {
                return false;
            }
            if (globalInFlight.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    private void releaseGlobalSlot() {
        globalInFlight.updateAndGet(current -> Math.max(0, current - 1));
    }

    private Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private String describe(Throwable error, long timeoutMs) {
        if (error instanceof TimeoutException) {
            return "Attempt timed out after " + timeoutMs + "ms";
        }
        return StringUtils.defaultIfBlank(error.getMessage(), error.getClass().getSimpleName());
    }

    private record Launch(Long jobId, String jobType, JobTaskEntity task, int attempt, AbortSignal signal, long timeoutMs) {
    }
}
