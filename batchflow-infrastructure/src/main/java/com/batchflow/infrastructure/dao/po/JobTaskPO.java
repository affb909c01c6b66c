package com.batchflow.infrastructure.dao.po;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 任务存储对象。payload 以 JSON 存储。
 */
@Data
public class JobTaskPO {

    private Long id;
    private Long jobId;
    private Integer taskIndex;
    private Long sequence;
    private String name;
    private String payload;
    private String status;
    private Integer retryCount;
    private Integer maxRetries;
    private Integer executionAttempt;
    private LocalDateTime nextAttemptAt;
    private Integer progress;
    private String error;
    private String result;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime updatedAt;
}
