package com.batchflow.api.dto;

import lombok.Data;

/**
 * 批量操作中单个作业的结果。
 */
@Data
public class BatchActionResultDTO {

    private Long jobId;
    private String outcome;
    private String status;
    private String errorCode;
    private String errorMessage;
}
