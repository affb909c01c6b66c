package com.batchflow.infrastructure.repository.job;

import com.batchflow.domain.job.adapter.repository.IJobTaskRepository;
import com.batchflow.domain.job.model.entity.JobTaskEntity;
import com.batchflow.infrastructure.dao.po.JobTaskPO;
import com.batchflow.infrastructure.util.JsonCodec;
import com.batchflow.types.enums.TaskStatusEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 任务仓储实现 (进程内存储)。
 * <p>
 * 按作业分桶保存，作业删除时整桶移除。payload 以 JSON 保存，读取时重新解析。
 * </p>
 */
@Slf4j
@Repository
public class JobTaskRepositoryImpl implements IJobTaskRepository {

    private static final Comparator<JobTaskPO> EXECUTION_ORDER = Comparator
            .comparing(JobTaskPO::getTaskIndex, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(JobTaskPO::getSequence, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ConcurrentMap<Long, ConcurrentMap<Long, JobTaskPO>> tasksByJob = new ConcurrentHashMap<>();
    private final ConcurrentMap<Long, Long> jobIdByTaskId = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong();
    private final AtomicLong sequenceGenerator = new AtomicLong();
    private final JsonCodec jsonCodec;

    public JobTaskRepositoryImpl(JsonCodec jsonCodec) {
        this.jsonCodec = jsonCodec;
    }

    @Override
    public List<JobTaskEntity> batchSave(List<JobTaskEntity> entities) {
        if (entities == null || entities.isEmpty()) {
            return new ArrayList<>();
        }
        List<JobTaskEntity> saved = new ArrayList<>(entities.size());
        LocalDateTime now = LocalDateTime.now();
        for (JobTaskEntity entity : entities) {
            entity.validate();
            entity.setId(idGenerator.incrementAndGet());
            entity.setSequence(sequenceGenerator.incrementAndGet());
            if (entity.getCreatedAt() == null) {
                entity.setCreatedAt(now);
            }
            entity.setUpdatedAt(now);
            JobTaskPO po = toPO(entity);
            tasksByJob.computeIfAbsent(po.getJobId(), key -> new ConcurrentHashMap<>()).put(po.getId(), po);
            jobIdByTaskId.put(po.getId(), po.getJobId());
            saved.add(toEntity(po));
        }
        return saved;
    }

    @Override
    public JobTaskEntity update(JobTaskEntity entity) {
        entity.validate();
        Map<Long, JobTaskPO> bucket = tasksByJob.get(entity.getJobId());
        if (bucket == null || !bucket.containsKey(entity.getId())) {
            throw new IllegalStateException("JobTask not found for update: " + entity.getId());
        }
        entity.setUpdatedAt(LocalDateTime.now());
        JobTaskPO po = toPO(entity);
        bucket.put(po.getId(), po);
        return toEntity(po);
    }

    @Override
    public JobTaskEntity findById(Long id) {
        if (id == null) {
            return null;
        }
        Long jobId = jobIdByTaskId.get(id);
        if (jobId == null) {
            return null;
        }
        Map<Long, JobTaskPO> bucket = tasksByJob.get(jobId);
        JobTaskPO po = bucket == null ? null : bucket.get(id);
        return po == null ? null : toEntity(po);
    }

    @Override
    public List<JobTaskEntity> findByJobId(Long jobId) {
        Map<Long, JobTaskPO> bucket = jobId == null ? null : tasksByJob.get(jobId);
        if (bucket == null) {
            return new ArrayList<>();
        }
        return bucket.values().stream()
                .sorted(EXECUTION_ORDER)
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<JobTaskEntity> findByJobIdAndStatus(Long jobId, TaskStatusEnum status) {
        if (status == null) {
            return new ArrayList<>();
        }
        return findByJobId(jobId).stream()
                .filter(task -> task.getStatus() == status)
                .collect(Collectors.toList());
    }

    @Override
    public List<JobTaskEntity> findAll() {
        return tasksByJob.values().stream()
                .flatMap(bucket -> bucket.values().stream())
                .sorted(Comparator.comparing(JobTaskPO::getJobId).thenComparing(EXECUTION_ORDER))
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public int deleteByJobId(Long jobId) {
        Map<Long, JobTaskPO> removed = jobId == null ? null : tasksByJob.remove(jobId);
        if (removed == null) {
            return 0;
        }
        removed.keySet().forEach(jobIdByTaskId::remove);
        log.debug("Job tasks removed. jobId={}, count={}", jobId, removed.size());
        return removed.size();
    }

    private JobTaskPO toPO(JobTaskEntity entity) {
        JobTaskPO po = new JobTaskPO();
        po.setId(entity.getId());
        po.setJobId(entity.getJobId());
        po.setTaskIndex(entity.getIndex());
        po.setSequence(entity.getSequence());
        po.setName(entity.getName());
        po.setPayload(jsonCodec.writeValue(entity.getPayload()));
        po.setStatus(entity.getStatus() == null ? null : entity.getStatus().getCode());
        po.setRetryCount(entity.getRetryCount());
        po.setMaxRetries(entity.getMaxRetries());
        po.setExecutionAttempt(entity.getExecutionAttempt());
        po.setNextAttemptAt(entity.getNextAttemptAt());
        po.setProgress(entity.getProgress());
        po.setError(entity.getError());
        po.setResult(entity.getResult());
        po.setCreatedAt(entity.getCreatedAt());
        po.setStartedAt(entity.getStartedAt());
        po.setCompletedAt(entity.getCompletedAt());
        po.setUpdatedAt(entity.getUpdatedAt());
        return po;
    }

    private JobTaskEntity toEntity(JobTaskPO po) {
        JobTaskEntity entity = new JobTaskEntity();
        entity.setId(po.getId());
        entity.setJobId(po.getJobId());
        entity.setIndex(po.getTaskIndex());
        entity.setSequence(po.getSequence());
        entity.setName(po.getName());
        entity.setPayload(jsonCodec.readMap(po.getPayload()));
        entity.setStatus(TaskStatusEnum.fromCode(po.getStatus()));
        entity.setRetryCount(po.getRetryCount());
        entity.setMaxRetries(po.getMaxRetries());
        entity.setExecutionAttempt(po.getExecutionAttempt());
        entity.setNextAttemptAt(po.getNextAttemptAt());
        entity.setProgress(po.getProgress());
        entity.setError(po.getError());
        entity.setResult(po.getResult());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setStartedAt(po.getStartedAt());
        entity.setCompletedAt(po.getCompletedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }
}
