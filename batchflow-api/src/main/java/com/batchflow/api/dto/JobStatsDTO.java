package com.batchflow.api.dto;

import lombok.Data;

/**
 * 作业统计 DTO。
 */
@Data
public class JobStatsDTO {

    private Long totalJobs;
    private Long pendingJobs;
    private Long runningJobs;
    private Long pausedJobs;
    private Long completedJobs;
    private Long failedJobs;
    private Long cancelledJobs;
    private Long totalTasks;
    private Long completedTasks;
    private Long failedTasks;
    private Long skippedTasks;
    private Long runningTasks;
    private Long pendingTasks;
    private Double throughputPerHour;
    private Long averageTaskDurationMs;
    private Long averageQueueWaitMs;
    private Long estimatedTimeRemainingMs;
}
