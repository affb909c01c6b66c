package com.batchflow.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * 作业内单个任务的创建参数。
 */
@Data
public class TaskCreateRequestDTO {

    private String name;
    private Integer index;
    private Integer maxRetries;
    private Map<String, Object> payload;
}
