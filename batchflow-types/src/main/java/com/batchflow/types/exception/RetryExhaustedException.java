package com.batchflow.types.exception;

import com.batchflow.types.enums.ResponseCode;

/**
 * 任务重试次数耗尽。作为任务终态错误记录，不抛给调用方。
 */
public class RetryExhaustedException extends AppException {

    private static final long serialVersionUID = -6408130853140785511L;

    public RetryExhaustedException(Long taskId, int attempts, String lastError) {
        super(ResponseCode.RETRY_EXHAUSTED.getCode(),
                "Retries exhausted after " + attempts + " attempt(s), taskId=" + taskId
                        + (lastError == null ? "" : ", lastError=" + lastError));
    }
}
