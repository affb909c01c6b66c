package com.batchflow.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 作业列表项 DTO。
 */
@Data
public class JobSummaryDTO {

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
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime updatedAt;
}
