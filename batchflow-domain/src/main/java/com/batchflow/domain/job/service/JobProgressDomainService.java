package com.batchflow.domain.job.service;

import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.domain.job.model.entity.JobTaskEntity;
import com.batchflow.domain.job.model.valobj.TaskCounters;
import com.batchflow.types.common.Constants;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 进度聚合领域服务：统计任务计数并计算作业进度。
 * <p>
 * progress = processed / total * 100 + Σ(running.progress ?? 50) / total，
 * processed 为 completed + failed + skipped，即已进入终态的任务数。结果裁剪到 [0, 100] 并保留两位小数。
 * </p>
 */
@Service
public class JobProgressDomainService {

    public TaskCounters count(List<JobTaskEntity> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            return TaskCounters.empty();
        }
        int pending = 0;
        int running = 0;
        int completed = 0;
        int failed = 0;
        int skipped = 0;
        double runningCredit = 0D;
        for (JobTaskEntity task : tasks) {
            if (task == null || task.getStatus() == null) {
                continue;
            }
            switch (task.getStatus()) {
                case PENDING -> pending++;
                case RUNNING -> {
                    running++;
                    Integer reported = task.getProgress();
                    runningCredit += reported == null ? Constants.DEFAULT_PARTIAL_CREDIT : clamp(reported);
                }
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
            }
        }
        return new TaskCounters(tasks.size(), pending, running, completed, failed, skipped, runningCredit);
    }

    public double computeProgress(TaskCounters counters) {
        if (counters == null || counters.total() <= 0) {
            return 0D;
        }
        double total = counters.total();
        double processed = counters.completed() + counters.failed() + counters.skipped();
        double raw = processed / total * 100D + counters.runningCredit() / total;
        double clamped = Math.max(0D, Math.min(100D, raw));
        return BigDecimal.valueOf(clamped).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * 将计数与进度写回作业。运行中或暂停时进度取历史最高值，终态作业按当前计数重算。
     *
     * @return 本次计算出的计数
     */
    public TaskCounters applyTo(BatchJobEntity job, List<JobTaskEntity> tasks) {
        TaskCounters counters = count(tasks);
        job.setTasksTotal(counters.total());
        job.applyCounters(counters.completed(), counters.failed(), counters.skipped());
        job.updateProgress(computeProgress(counters));
        return counters;
    }

    private double clamp(int value) {
        return Math.max(0, Math.min(100, value));
    }
}
