package com.batchflow.trigger.job;

import com.batchflow.trigger.application.command.JobLifecycleCommandService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 终态作业清理守护进程，finished-ttl 为 0 时关闭。
 */
@Slf4j
@Component
public class JobRetentionDaemon {

    private final JobLifecycleCommandService jobLifecycleCommandService;
    private final Duration finishedTtl;

    public JobRetentionDaemon(JobLifecycleCommandService jobLifecycleCommandService,
                              @Value("${batchflow.retention.finished-ttl:0}") Duration finishedTtl) {
        this.jobLifecycleCommandService = jobLifecycleCommandService;
        this.finishedTtl = finishedTtl == null ? Duration.ZERO : finishedTtl;
    }

    @Scheduled(fixedDelayString = "${batchflow.retention.sweep-interval-ms:60000}", scheduler = "daemonScheduler")
    public void purge() {
        if (finishedTtl.isZero() || finishedTtl.isNegative()) {
            return;
        }
        try {
            int purged = jobLifecycleCommandService.purgeFinishedJobs(finishedTtl);
            log.debug("Retention sweep finished. purged={}, ttl={}", purged, finishedTtl);
        } catch (Exception ex) {
            log.warn("Finished job purge failed. ttl={}, error={}", finishedTtl, ex.getMessage());
        }
    }
}
