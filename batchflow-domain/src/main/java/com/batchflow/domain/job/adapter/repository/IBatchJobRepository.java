package com.batchflow.domain.job.adapter.repository;

import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.types.enums.JobStatusEnum;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 作业仓储接口
 */
public interface IBatchJobRepository {

    /**
     * 保存作业 (分配 ID)
     */
    BatchJobEntity save(BatchJobEntity entity);

    /**
     * 更新作业 (带乐观锁)
     */
    BatchJobEntity update(BatchJobEntity entity);

    /**
     * 根据 ID 删除
     */
    boolean deleteById(Long id);

    /**
     * 根据 ID 查询
     */
    BatchJobEntity findById(Long id);

    /**
     * 查询所有作业
     */
    List<BatchJobEntity> findAll();

    /**
     * 根据状态查询
     */
    List<BatchJobEntity> findByStatus(JobStatusEnum status);

    /**
     * 查询在指定时间之前结束的终态作业 (用于清理)
     */
    List<BatchJobEntity> findFinishedBefore(LocalDateTime threshold);
}
