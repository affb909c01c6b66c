package com.batchflow.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 任务详情 DTO。
 */
@Data
public class TaskDetailDTO {

    private Long taskId;
    private Long jobId;
    private Integer index;
    private String name;
    private String status;
    private Map<String, Object> payload;
    private Integer retryCount;
    private Integer maxRetries;
    private Integer executionAttempt;
    private Integer progress;
    private String error;
    private String result;
    private LocalDateTime nextAttemptAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
}
