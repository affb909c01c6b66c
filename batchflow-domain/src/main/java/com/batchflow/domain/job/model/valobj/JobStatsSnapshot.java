package com.batchflow.domain.job.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 作业统计快照，实时计算，不落库。equals 不比较采集时间，用于判断统计是否变化。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = "capturedAt")
public class JobStatsSnapshot {

    private long totalJobs;
    private long pendingJobs;
    private long runningJobs;
    private long pausedJobs;
    private long completedJobs;
    private long failedJobs;
    private long cancelledJobs;

    private long totalTasks;
    private long pendingTasks;
    private long runningTasks;
    private long completedTasks;
    private long failedTasks;
    private long skippedTasks;

    /**
     * 最近窗口内每小时完成任务数
     */
    private double throughputPerHour;

    /**
     * 平均任务执行耗时，无样本时为空
     */
    private Long averageTaskDurationMs;

    /**
     * 作业平均排队时长 (创建到启动)，无样本时为空
     */
    private Long averageQueueWaitMs;

    /**
     * 剩余时间估算，无平均耗时时为空
     */
    private Long estimatedTimeRemainingMs;

    private LocalDateTime capturedAt;
}
