package com.batchflow.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 作业详情 DTO，包含任务列表。
 */
@Data
public class JobDetailDTO {

    private Long jobId;
    private String name;
    private String type;
    private String priority;
    private String status;
    private String ownerId;
    private List<String> tags;
    private Integer tasksTotal;
    private Integer tasksCompleted;
    private Integer tasksFailed;
    private Integer tasksSkipped;
    private Double progress;
    private Integer concurrencyLimit;
    private Integer maxRetries;
    private Long taskTimeoutMs;
    private String completionPolicy;
    private Double failureRatioThreshold;
    private String errorSummary;
    private Integer version;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime updatedAt;
    private List<TaskDetailDTO> tasks;
}
