package com.batchflow.types.exception;

import com.batchflow.types.enums.ResponseCode;

/**
 * 作业在途任务数超过并发上限，属于调度器缺陷，只停止该作业的调度。
 */
public class ConcurrencyLimitViolationException extends AppException {

    private static final long serialVersionUID = 1908367340912845567L;

    public ConcurrencyLimitViolationException(Long jobId, int inFlight, int limit) {
        super(ResponseCode.CONCURRENCY_LIMIT_VIOLATION.getCode(),
                "Concurrency limit violated: jobId=" + jobId + ", inFlight=" + inFlight + ", limit=" + limit);
    }
}
