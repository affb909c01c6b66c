package com.batchflow.domain.job.adapter.repository;

import com.batchflow.domain.job.model.entity.JobTaskEntity;
import com.batchflow.types.enums.TaskStatusEnum;

import java.util.List;

/**
 * 任务仓储接口
 */
public interface IJobTaskRepository {

    /**
     * 批量保存任务 (分配 ID 与插入序号)
     */
    List<JobTaskEntity> batchSave(List<JobTaskEntity> entities);

    /**
     * 更新任务
     */
    JobTaskEntity update(JobTaskEntity entity);

    /**
     * 根据 ID 查询
     */
    JobTaskEntity findById(Long id);

    /**
     * 根据作业 ID 查询，按 index、sequence 升序
     */
    List<JobTaskEntity> findByJobId(Long jobId);

    /**
     * 根据作业 ID 和状态查询
     */
    List<JobTaskEntity> findByJobIdAndStatus(Long jobId, TaskStatusEnum status);

    /**
     * 查询所有任务
     */
    List<JobTaskEntity> findAll();

    /**
     * 级联删除作业下所有任务
     */
    int deleteByJobId(Long jobId);
}
