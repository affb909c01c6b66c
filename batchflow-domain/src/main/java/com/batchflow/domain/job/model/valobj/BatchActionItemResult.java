package com.batchflow.domain.job.model.valobj;

import com.batchflow.types.enums.BatchOutcomeEnum;
import com.batchflow.types.enums.JobStatusEnum;

/**
 * 批量操作中单个作业的处理结果。
 */
public record BatchActionItemResult(Long jobId,
                                    BatchOutcomeEnum outcome,
                                    JobStatusEnum status,
                                    String errorCode,
                                    String errorMessage) {

    public static BatchActionItemResult applied(Long jobId, JobStatusEnum status) {
        return new BatchActionItemResult(jobId, BatchOutcomeEnum.APPLIED, status, null, null);
    }

    public static BatchActionItemResult skipped(Long jobId, JobStatusEnum status, String code, String message) {
        return new BatchActionItemResult(jobId, BatchOutcomeEnum.SKIPPED_INVALID_STATE, status, code, message);
    }

    public static BatchActionItemResult error(Long jobId, String code, String message) {
        return new BatchActionItemResult(jobId, BatchOutcomeEnum.ERROR, null, code, message);
    }
}
