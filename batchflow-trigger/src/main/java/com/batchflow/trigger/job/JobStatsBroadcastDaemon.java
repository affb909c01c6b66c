package com.batchflow.trigger.job;

import com.batchflow.domain.job.model.valobj.JobQuery;
import com.batchflow.domain.job.model.valobj.JobStatsSnapshot;
import com.batchflow.trigger.application.query.JobQueryService;
import com.batchflow.trigger.event.JobEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * 统计广播守护进程：统计变化时发布 stats_updated 事件。
 */
@Slf4j
@Component
public class JobStatsBroadcastDaemon {

    private final JobQueryService jobQueryService;
    private final JobEventPublisher jobEventPublisher;
    private volatile JobStatsSnapshot lastBroadcast;

    public JobStatsBroadcastDaemon(JobQueryService jobQueryService, JobEventPublisher jobEventPublisher) {
        this.jobQueryService = jobQueryService;
        this.jobEventPublisher = jobEventPublisher;
    }

    @Scheduled(fixedDelayString = "${batchflow.event.stats-interval-ms:5000}", scheduler = "daemonScheduler")
    public void broadcast() {
        try {
            broadcastIfChanged();
        } catch (Exception ex) {
            log.warn("Stats broadcast failed. error={}", ex.getMessage());
        }
    }

    /**
     * @return 是否发布了新的统计事件
     */
    public boolean broadcastIfChanged() {
        JobStatsSnapshot stats = jobQueryService.getStats(JobQuery.all());
        if (Objects.equals(stats, lastBroadcast)) {
            return false;
        }
        lastBroadcast = stats;
        jobEventPublisher.publishStats(stats);
        return true;
    }
}
