package com.batchflow.api.dto;

import lombok.Data;

/**
 * 作业创建响应 DTO。
 */
@Data
public class JobCreateResponseDTO {

    private Long jobId;
    private String status;
    private Integer tasksTotal;
}
