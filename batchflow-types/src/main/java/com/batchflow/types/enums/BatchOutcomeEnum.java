package com.batchflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 批量操作中单个作业的处理结果。
 */
public enum BatchOutcomeEnum {

    APPLIED("applied"),
    SKIPPED_INVALID_STATE("skipped-invalid-state"),
    ERROR("error");

    private final String code;

    BatchOutcomeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
