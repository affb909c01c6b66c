package com.batchflow.domain.job.model.valobj;

/**
 * 作业下任务状态计数。
 *
 * @param total            任务总数
 * @param pending          待处理数
 * @param running          运行中数
 * @param completed        完成数
 * @param failed           终态失败数
 * @param skipped          跳过数
 * @param runningCredit    运行中任务的进度贡献之和 (单位：百分比，未上报按 50 计)
 */
public record TaskCounters(int total,
                           int pending,
                           int running,
                           int completed,
                           int failed,
                           int skipped,
                           double runningCredit) {

    public int terminal() {
        return completed + failed + skipped;
    }

    public boolean allTerminal() {
        return terminal() == total;
    }

    public static TaskCounters empty() {
        return new TaskCounters(0, 0, 0, 0, 0, 0, 0D);
    }
}
