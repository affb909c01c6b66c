package com.batchflow.domain.job.model.valobj;

import com.batchflow.domain.job.model.entity.BatchJobEntity;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 全量快照：拉取模式消费者据此对账。
 *
 * @param sequence 快照生成时已发布的最新事件序号
 */
public record JobSnapshot(long sequence, List<BatchJobEntity> jobs, JobStatsSnapshot stats, LocalDateTime capturedAt) {
}
