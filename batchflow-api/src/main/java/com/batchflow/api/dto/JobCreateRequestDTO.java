package com.batchflow.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 作业创建请求 DTO。
 */
@Data
public class JobCreateRequestDTO {

    private String name;
    private String type;
    private String priority;
    private String ownerId;
    private List<String> tags;
    private Integer concurrencyLimit;
    private Integer maxRetries;
    private Long taskTimeoutMs;
    private String completionPolicy;
    private Double failureRatioThreshold;
    private Boolean autoStart;
    private List<TaskCreateRequestDTO> tasks;
}
