package com.batchflow.domain.job.model.valobj;

import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.domain.job.model.entity.JobTaskEntity;

import java.util.List;

/**
 * 作业详情视图：作业 + 按执行顺序排列的任务。
 */
public record JobView(BatchJobEntity job, List<JobTaskEntity> tasks) {
}
