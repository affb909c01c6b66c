package com.batchflow.types.exception;

import com.batchflow.types.enums.ResponseCode;

/**
 * 当前作业状态不允许请求的操作。
 */
public class InvalidStateException extends AppException {

    private static final long serialVersionUID = -2781937437461201146L;

    public InvalidStateException(String message) {
        super(ResponseCode.INVALID_STATE.getCode(), message);
    }
}
