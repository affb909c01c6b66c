package com.batchflow.infrastructure.repository.job;

import com.batchflow.domain.job.adapter.repository.IBatchJobRepository;
import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.infrastructure.dao.po.BatchJobPO;
import com.batchflow.infrastructure.util.JsonCodec;
import com.batchflow.types.enums.CompletionPolicyEnum;
import com.batchflow.types.enums.JobPriorityEnum;
import com.batchflow.types.enums.JobStatusEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 作业仓储实现 (进程内存储)。
 * <p>
 * 以 PO 形式保存，读写都经过 Entity/PO 转换，调用方拿到的实体与存储互不影响。
 * update 按 version 做乐观锁校验。
 * </p>
 */
@Slf4j
@Repository
public class BatchJobRepositoryImpl implements IBatchJobRepository {

    private final ConcurrentMap<Long, BatchJobPO> store = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong();
    private final JsonCodec jsonCodec;

    public BatchJobRepositoryImpl(JsonCodec jsonCodec) {
        this.jsonCodec = jsonCodec;
    }

    @Override
    public BatchJobEntity save(BatchJobEntity entity) {
        entity.validate();
        LocalDateTime now = LocalDateTime.now();
        entity.setId(idGenerator.incrementAndGet());
        entity.setVersion(0);
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(now);
        }
        entity.setUpdatedAt(now);
        BatchJobPO po = toPO(entity);
        store.put(po.getId(), po);
        return toEntity(po);
    }

    @Override
    public BatchJobEntity update(BatchJobEntity entity) {
        entity.validate();
        Integer expectedVersion = entity.getVersion();
        BatchJobPO updated = store.computeIfPresent(entity.getId(), (id, current) -> {
            if (!current.getVersion().equals(expectedVersion)) {
                return current;
            }
            entity.incrementVersion();
            return toPO(entity);
        });
        if (updated == null) {
            throw new IllegalStateException("BatchJob not found for update: " + entity.getId());
        }
        if (!updated.getVersion().equals(entity.getVersion())) {
            throw new IllegalStateException("Optimistic lock failed for BatchJob: " + entity.getId()
                    + ", expectedVersion=" + expectedVersion + ", actualVersion=" + updated.getVersion());
        }
        return toEntity(updated);
    }

    @Override
    public boolean deleteById(Long id) {
        boolean removed = id != null && store.remove(id) != null;
        if (removed) {
            log.debug("Batch job removed. jobId={}", id);
        }
        return removed;
    }

    @Override
    public BatchJobEntity findById(Long id) {
        if (id == null) {
            return null;
        }
        BatchJobPO po = store.get(id);
        return po == null ? null : toEntity(po);
    }

    @Override
    public List<BatchJobEntity> findAll() {
        return store.values().stream()
                .sorted(Comparator.comparing(BatchJobPO::getId))
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<BatchJobEntity> findByStatus(JobStatusEnum status) {
        if (status == null) {
            return new ArrayList<>();
        }
        return store.values().stream()
                .filter(po -> status.getCode().equals(po.getStatus()))
                .sorted(Comparator.comparing(BatchJobPO::getId))
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<BatchJobEntity> findFinishedBefore(LocalDateTime threshold) {
        if (threshold == null) {
            return new ArrayList<>();
        }
        return store.values().stream()
                .filter(po -> po.getCompletedAt() != null && po.getCompletedAt().isBefore(threshold))
                .map(this::toEntity)
                .filter(BatchJobEntity::isTerminal)
                .sorted(Comparator.comparing(BatchJobEntity::getId))
                .collect(Collectors.toList());
    }

    private BatchJobPO toPO(BatchJobEntity entity) {
        BatchJobPO po = new BatchJobPO();
        po.setId(entity.getId());
        po.setName(entity.getName());
        po.setType(entity.getType());
        po.setPriority(entity.getPriority() == null ? null : entity.getPriority().getCode());
        po.setStatus(entity.getStatus() == null ? null : entity.getStatus().getCode());
        po.setTasksTotal(entity.getTasksTotal());
        po.setTasksCompleted(entity.getTasksCompleted());
        po.setTasksFailed(entity.getTasksFailed());
        po.setTasksSkipped(entity.getTasksSkipped());
        po.setProgress(entity.getProgress());
        po.setConcurrencyLimit(entity.getConcurrencyLimit());
        po.setMaxRetries(entity.getMaxRetries());
        po.setTaskTimeoutMs(entity.getTaskTimeoutMs());
        po.setCompletionPolicy(entity.getCompletionPolicy() == null ? null : entity.getCompletionPolicy().name());
        po.setFailureRatioThreshold(entity.getFailureRatioThreshold());
        po.setOwnerId(entity.getOwnerId());
        po.setTags(jsonCodec.writeValue(entity.getTags()));
        po.setErrorSummary(entity.getErrorSummary());
        po.setVersion(entity.getVersion());
        po.setCreatedAt(entity.getCreatedAt());
        po.setStartedAt(entity.getStartedAt());
        po.setCompletedAt(entity.getCompletedAt());
        po.setUpdatedAt(entity.getUpdatedAt());
        return po;
    }

    private BatchJobEntity toEntity(BatchJobPO po) {
        BatchJobEntity entity = new BatchJobEntity();
        entity.setId(po.getId());
        entity.setName(po.getName());
        entity.setType(po.getType());
        entity.setPriority(JobPriorityEnum.fromCode(po.getPriority()));
        entity.setStatus(JobStatusEnum.fromCode(po.getStatus()));
        entity.setTasksTotal(po.getTasksTotal());
        entity.setTasksCompleted(po.getTasksCompleted());
        entity.setTasksFailed(po.getTasksFailed());
        entity.setTasksSkipped(po.getTasksSkipped());
        entity.setProgress(po.getProgress());
        entity.setConcurrencyLimit(po.getConcurrencyLimit());
        entity.setMaxRetries(po.getMaxRetries());
        entity.setTaskTimeoutMs(po.getTaskTimeoutMs());
        entity.setCompletionPolicy(CompletionPolicyEnum.fromCode(po.getCompletionPolicy()));
        entity.setFailureRatioThreshold(po.getFailureRatioThreshold());
        entity.setOwnerId(po.getOwnerId());
        List<String> tags = jsonCodec.readStringList(po.getTags());
        entity.setTags(tags == null ? new ArrayList<>() : tags);
        entity.setErrorSummary(po.getErrorSummary());
        entity.setVersion(po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setStartedAt(po.getStartedAt());
        entity.setCompletedAt(po.getCompletedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }
}
