package com.batchflow.types.exception;

import com.batchflow.types.enums.ResponseCode;

/**
 * Task Runner 执行失败，由重试策略吸收，不会抛给调用方。
 */
public class TaskExecutionException extends AppException {

    private static final long serialVersionUID = 8124870216315340931L;

    public TaskExecutionException(String message) {
        super(ResponseCode.TASK_EXECUTION_FAILED.getCode(), message);
    }

    public TaskExecutionException(String message, Throwable cause) {
        super(ResponseCode.TASK_EXECUTION_FAILED.getCode(), message, cause);
    }
}
