package com.batchflow.trigger.job;

import com.batchflow.domain.job.adapter.repository.IBatchJobRepository;
import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.types.enums.JobStatusEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 调度兜底守护进程：周期扫描运行中作业，补派因全局额度或延迟重试而搁置的任务。
 * 开启全局并发上限时按优先级分配额度。
 */
@Slf4j
@Component
public class TaskDispatchDaemon {

    private final IBatchJobRepository batchJobRepository;
    private final TaskDispatcher taskDispatcher;

    public TaskDispatchDaemon(IBatchJobRepository batchJobRepository, TaskDispatcher taskDispatcher) {
        this.batchJobRepository = batchJobRepository;
        this.taskDispatcher = taskDispatcher;
    }

    @Scheduled(fixedDelayString = "${batchflow.scheduler.poll-interval-ms:1000}", scheduler = "daemonScheduler")
    public void sweep() {
        List<BatchJobEntity> runningJobs = batchJobRepository.findByStatus(JobStatusEnum.RUNNING);
        if (runningJobs.isEmpty()) {
            return;
        }
        if (taskDispatcher.isGlobalLimitEnabled()) {
            int granted = taskDispatcher.dispatchByPriority();
            if (granted > 0) {
                log.debug("Dispatch sweep finished by priority. runningJobs={}, dispatched={}", runningJobs.size(), granted);
            }
            return;
        }
        int dispatched = 0;
        for (BatchJobEntity job : runningJobs) {
            try {
                dispatched += taskDispatcher.dispatch(job.getId());
            } catch (Exception ex) {
                log.warn("Dispatch sweep failed for job. jobId={}, error={}", job.getId(), ex.getMessage());
            }
        }
        if (dispatched > 0) {
            log.debug("Dispatch sweep finished. runningJobs={}, dispatched={}", runningJobs.size(), dispatched);
        }
    }
}
