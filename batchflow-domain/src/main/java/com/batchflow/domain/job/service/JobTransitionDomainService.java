package com.batchflow.domain.job.service;

import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.domain.job.model.valobj.TaskCounters;
import com.batchflow.types.enums.BatchActionEnum;
import com.batchflow.types.enums.CompletionPolicyEnum;
import com.batchflow.types.enums.JobStatusEnum;
import org.springframework.stereotype.Service;

/**
 * Job 状态推进领域服务：根据任务计数决定运行中作业的自动终态，并判定操作许可。
 */
@Service
public class JobTransitionDomainService {

    /**
     * 仅对 running 作业求值；无需迁移时返回 null。
     */
    public Transition resolveTransition(BatchJobEntity job, TaskCounters counters) {
        if (job == null || counters == null || !job.isRunning()) {
            return null;
        }
        int total = counters.total();
        if (total <= 0) {
            return new Transition(JobStatusEnum.COMPLETED, null, false);
        }

        Double threshold = job.getFailureRatioThreshold();
        if (threshold != null && counters.failed() > 0) {
            double ratio = (double) counters.failed() / total;
            if (ratio > threshold) {
                String reason = String.format("Failure ratio %.2f exceeded threshold %.2f (%d/%d tasks failed)",
                        ratio, threshold, counters.failed(), total);
                return new Transition(JobStatusEnum.FAILED, reason, !counters.allTerminal());
            }
        }

        if (!counters.allTerminal()) {
            return null;
        }
        CompletionPolicyEnum policy = job.getCompletionPolicy() == null
                ? CompletionPolicyEnum.ANY_SUCCESS
                : job.getCompletionPolicy();
        if (policy == CompletionPolicyEnum.ALL_SUCCESS) {
            if (counters.completed() == total) {
                return new Transition(JobStatusEnum.COMPLETED, null, false);
            }
            return new Transition(JobStatusEnum.FAILED,
                    (total - counters.completed()) + " of " + total + " task(s) did not complete", false);
        }
        if (counters.completed() > 0) {
            return new Transition(JobStatusEnum.COMPLETED, null, false);
        }
        return new Transition(JobStatusEnum.FAILED, "No task completed successfully (" + counters.failed()
                + " failed, " + counters.skipped() + " skipped)", false);
    }

    public void transit(BatchJobEntity job, Transition transition) {
        if (job == null || transition == null) {
            return;
        }
        if (transition.target() == JobStatusEnum.COMPLETED) {
            job.complete();
            return;
        }
        if (transition.target() == JobStatusEnum.FAILED) {
            job.fail(transition.reason());
        }
    }

    /**
     * 操作许可：与生命周期状态机保持一致，用于批量操作预判与前端按钮可用性。
     */
    public boolean isActionAllowed(BatchActionEnum action, JobStatusEnum status) {
        if (action == null || status == null) {
            return false;
        }
        return switch (action) {
            case START -> status == JobStatusEnum.PENDING;
            case PAUSE -> status == JobStatusEnum.RUNNING;
            case RESUME -> status == JobStatusEnum.PAUSED;
            case CANCEL -> !status.isTerminal();
            case RETRY -> status == JobStatusEnum.FAILED || status == JobStatusEnum.CANCELLED;
            case DELETE -> status.isTerminal();
        };
    }

    /**
     * @param target        目标状态
     * @param reason        失败原因，完成时为空
     * @param skipRemaining 是否需要跳过剩余任务并中止在途执行
     */
    public record Transition(JobStatusEnum target, String reason, boolean skipRemaining) {
    }
}
