package com.batchflow.infrastructure.dao.po;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 作业存储对象。枚举以 code 存储，标签以 JSON 存储。
 */
@Data
public class BatchJobPO {

    private Long id;
    private String name;
    private String type;
    private String priority;
    private String status;
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
    private String ownerId;
    private String tags;
    private String errorSummary;
    private Integer version;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime updatedAt;
}
