package com.batchflow.types.exception;

import com.batchflow.types.enums.ResponseCode;

/**
 * 作业或任务不存在。
 */
public class NotFoundException extends AppException {

    private static final long serialVersionUID = 3964702815561173048L;

    public NotFoundException(String message) {
        super(ResponseCode.NOT_FOUND.getCode(), message);
    }

    public static NotFoundException job(Long jobId) {
        return new NotFoundException("Job not found: " + jobId);
    }

    public static NotFoundException task(Long jobId, Long taskId) {
        return new NotFoundException("Task not found: jobId=" + jobId + ", taskId=" + taskId);
    }
}
