package com.batchflow.trigger.application.command;

import com.batchflow.domain.job.adapter.repository.IBatchJobRepository;
import com.batchflow.domain.job.adapter.repository.IJobTaskRepository;
import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.domain.job.model.entity.JobTaskEntity;
import com.batchflow.domain.job.model.valobj.JobCreateCommand;
import com.batchflow.trigger.event.JobEventPublisher;
import com.batchflow.types.common.Constants;
import com.batchflow.types.enums.CompletionPolicyEnum;
import com.batchflow.types.enums.JobPriorityEnum;
import com.batchflow.types.enums.JobStatusEnum;
import com.batchflow.types.enums.ResponseCode;
import com.batchflow.types.enums.TaskStatusEnum;
import com.batchflow.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * 作业创建写用例：校验参数、填充默认值、保存作业与任务并发布 job_added。
 */
@Slf4j
@Service
public class JobCreateCommandService {

    private static final String DEFAULT_JOB_TYPE = "default";

    private final IBatchJobRepository batchJobRepository;
    private final IJobTaskRepository jobTaskRepository;
    private final JobEventPublisher jobEventPublisher;
    private final int defaultConcurrencyLimit;
    private final int defaultMaxRetries;
    private final long defaultTaskTimeoutMs;
    private final CompletionPolicyEnum defaultCompletionPolicy;

    public JobCreateCommandService(IBatchJobRepository batchJobRepository,
                                   IJobTaskRepository jobTaskRepository,
                                   JobEventPublisher jobEventPublisher,
                                   @Value("${batchflow.job.default-concurrency-limit:4}") int defaultConcurrencyLimit,
                                   @Value("${batchflow.job.default-max-retries:3}") int defaultMaxRetries,
                                   @Value("${batchflow.job.default-task-timeout-ms:300000}") long defaultTaskTimeoutMs,
                                   @Value("${batchflow.job.default-completion-policy:ANY_SUCCESS}") String defaultCompletionPolicy) {
        this.batchJobRepository = batchJobRepository;
        this.jobTaskRepository = jobTaskRepository;
        this.jobEventPublisher = jobEventPublisher;
        this.defaultConcurrencyLimit = defaultConcurrencyLimit > 0 ? defaultConcurrencyLimit : Constants.DEFAULT_CONCURRENCY_LIMIT;
        this.defaultMaxRetries = defaultMaxRetries >= 0 ? defaultMaxRetries : Constants.DEFAULT_MAX_RETRIES;
        this.defaultTaskTimeoutMs = defaultTaskTimeoutMs > 0 ? defaultTaskTimeoutMs : Constants.DEFAULT_TASK_TIMEOUT_MS;
        CompletionPolicyEnum policy = CompletionPolicyEnum.fromCode(defaultCompletionPolicy);
        this.defaultCompletionPolicy = policy == null ? CompletionPolicyEnum.ANY_SUCCESS : policy;
    }

    public BatchJobEntity createJob(JobCreateCommand command) {
        validate(command);
        BatchJobEntity job = new BatchJobEntity();
        job.setName(command.getName().trim());
        job.setType(StringUtils.defaultIfBlank(StringUtils.trim(command.getType()), DEFAULT_JOB_TYPE));
        job.setPriority(command.getPriority() == null ? JobPriorityEnum.NORMAL : command.getPriority());
        job.setStatus(JobStatusEnum.PENDING);
        job.setOwnerId(StringUtils.defaultIfBlank(command.getOwnerId(), Constants.DEFAULT_OWNER_ID));
        job.setTags(normalizeTags(command.getTags()));
        job.setConcurrencyLimit(command.getConcurrencyLimit() == null ? defaultConcurrencyLimit : command.getConcurrencyLimit());
        job.setMaxRetries(command.getMaxRetries() == null ? defaultMaxRetries : command.getMaxRetries());
        job.setTaskTimeoutMs(command.getTaskTimeoutMs() == null ? defaultTaskTimeoutMs : command.getTaskTimeoutMs());
        job.setCompletionPolicy(command.getCompletionPolicy() == null ? defaultCompletionPolicy : command.getCompletionPolicy());
        job.setFailureRatioThreshold(command.getFailureRatioThreshold());
        List<JobCreateCommand.TaskSpec> specs = command.getTasks() == null ? Collections.emptyList() : command.getTasks();
        job.setTasksTotal(specs.size());
        job.applyCounters(0, 0, 0);
        job.setProgress(0D);

        BatchJobEntity saved = batchJobRepository.save(job);
        List<JobTaskEntity> tasks = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            tasks.add(buildTask(saved, specs.get(i), i));
        }
        jobTaskRepository.batchSave(tasks);
        jobEventPublisher.publishJobAdded(saved);
        log.info("Job created. jobId={}, name={}, type={}, tasksTotal={}, concurrencyLimit={}, maxRetries={}",
                saved.getId(), saved.getName(), saved.getType(), saved.getTasksTotal(),
                saved.getConcurrencyLimit(), saved.getMaxRetries());
        return saved;
    }

    private JobTaskEntity buildTask(BatchJobEntity job, JobCreateCommand.TaskSpec spec, int position) {
        JobTaskEntity task = new JobTaskEntity();
        task.setJobId(job.getId());
        task.setIndex(spec.getIndex() == null ? position : spec.getIndex());
        task.setName(StringUtils.defaultIfBlank(spec.getName(), job.getName() + "#" + (position + 1)));
        task.setPayload(spec.getPayload() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(spec.getPayload()));
        task.setStatus(TaskStatusEnum.PENDING);
        task.setRetryCount(0);
        task.setMaxRetries(spec.getMaxRetries() == null ? job.getMaxRetries() : spec.getMaxRetries());
        task.setExecutionAttempt(0);
        return task;
    }

    private void validate(JobCreateCommand command) {
        if (command == null) {
            throw illegal("Job create command cannot be null");
        }
        if (StringUtils.isBlank(command.getName())) {
            throw illegal("Job name cannot be empty");
        }
        if (command.getConcurrencyLimit() != null && command.getConcurrencyLimit() < 1) {
            throw illegal("concurrencyLimit must be at least 1");
        }
        if (command.getMaxRetries() != null && command.getMaxRetries() < 0) {
            throw illegal("maxRetries cannot be negative");
        }
        if (command.getTaskTimeoutMs() != null && command.getTaskTimeoutMs() <= 0) {
            throw illegal("taskTimeoutMs must be positive");
        }
        Double threshold = command.getFailureRatioThreshold();
        if (threshold != null && (threshold.isNaN() || threshold < 0D || threshold > 1D)) {
            throw illegal("failureRatioThreshold must be within [0, 1]");
        }
        if (command.getTasks() != null) {
            for (JobCreateCommand.TaskSpec spec : command.getTasks()) {
                if (spec == null) {
                    throw illegal("Task definition cannot be null");
                }
                if (spec.getMaxRetries() != null && spec.getMaxRetries() < 0) {
                    throw illegal("Task maxRetries cannot be negative");
                }
            }
        }
    }

    private List<String> normalizeTags(List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return new ArrayList<>();
        }
        List<String> normalized = new ArrayList<>();
        for (String tag : tags) {
            String value = StringUtils.trimToNull(tag);
            if (value != null && !normalized.contains(value)) {
                normalized.add(value);
            }
        }
        return normalized;
    }

    private AppException illegal(String message) {
        return new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), message);
    }
}
