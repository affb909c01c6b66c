package com.batchflow.trigger.event;

import com.batchflow.domain.job.model.valobj.JobSnapshot;
import com.batchflow.trigger.application.query.JobQueryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * 拉模式快照轮询器：按固定间隔向消费者投递全量快照。
 */
@Slf4j
@Component
public class JobSnapshotPoller {

    private final JobQueryService jobQueryService;
    private final TaskScheduler daemonScheduler;

    public JobSnapshotPoller(JobQueryService jobQueryService,
                             @Qualifier("daemonScheduler") TaskScheduler daemonScheduler) {
        this.jobQueryService = jobQueryService;
        this.daemonScheduler = daemonScheduler;
    }

    public PollingHandle poll(Duration interval, Consumer<JobSnapshot> consumer) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Polling interval must be positive");
        }
        if (consumer == null) {
            throw new IllegalArgumentException("Snapshot consumer cannot be null");
        }
        ScheduledFuture<?> future = daemonScheduler.scheduleWithFixedDelay(() -> deliver(consumer), interval);
        log.debug("Snapshot polling started. intervalMs={}", interval.toMillis());
        return new PollingHandle(future);
    }

    private void deliver(Consumer<JobSnapshot> consumer) {
        try {
            consumer.accept(jobQueryService.snapshot());
        } catch (Exception ex) {
            log.warn("Snapshot delivery failed. error={}", ex.getMessage());
        }
    }

    public static final class PollingHandle {

        private final ScheduledFuture<?> future;

        private PollingHandle(ScheduledFuture<?> future) {
            this.future = future;
        }

        public void cancel() {
            future.cancel(false);
        }

        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
