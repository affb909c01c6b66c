package com.batchflow.trigger.event;

import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.domain.job.model.entity.JobEventEntity;
import com.batchflow.domain.job.model.valobj.JobStatsSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 作业事件发布器：分配全局序号、保留有限历史、按订阅者有序异步推送。
 * <p>
 * 序号分配、入历史与入各订阅者队列在同一把短锁内完成，因此每个订阅者看到的顺序与序号一致。
 * 单个订阅者抛出异常只记录日志，不影响其它订阅者。
 * 每个订阅者的待推送积压上限与历史窗口相同；超限时清空积压并改投一条 resync_required 标记，
 * 订阅者收到后应拉取快照对账。
 * </p>
 */
@Slf4j
@Component
public class JobEventPublisher {

    private static final int DEFAULT_HISTORY_SIZE = 1000;

    private final Object publishLock = new Object();
    private final Deque<JobEventEntity> history = new ArrayDeque<>();
    private final ConcurrentMap<String, Subscriber> subscribers = new ConcurrentHashMap<>();
    private final Executor pushExecutor;
    private final int historySize;
    private long lastSequence;
    private long evictedUpTo;
    private final AtomicLong backlogOverflows = new AtomicLong();

    public JobEventPublisher(@Value("${batchflow.event.history-size:1000}") int historySize,
                             @Qualifier("jobEventPushExecutor") Executor pushExecutor) {
        this.historySize = historySize > 0 ? historySize : DEFAULT_HISTORY_SIZE;
        this.pushExecutor = pushExecutor;
    }

    public JobEventEntity publishJobAdded(BatchJobEntity job) {
        return publish(JobEventEntity.jobAdded(job));
    }

    public JobEventEntity publishJobUpdated(BatchJobEntity job, Collection<String> changedFields) {
        return publish(JobEventEntity.jobUpdated(job, changedFields == null ? null : new ArrayList<>(changedFields)));
    }

    public JobEventEntity publishJobRemoved(Long jobId) {
        return publish(JobEventEntity.jobRemoved(jobId));
    }

    public JobEventEntity publishStats(JobStatsSnapshot stats) {
        return publish(JobEventEntity.statsUpdated(stats));
    }

    private JobEventEntity publish(JobEventEntity event) {
        synchronized (publishLock) {
            event.setSequence(++lastSequence);
            event.setCreatedAt(LocalDateTime.now());
            history.addLast(event);
            while (history.size() > historySize) {
                JobEventEntity evicted = history.pollFirst();
                evictedUpTo = evicted == null ? evictedUpTo : evicted.getSequence();
            }
            for (Subscriber subscriber : subscribers.values()) {
                subscriber.enqueue(event);
            }
        }
        log.debug("Job event published. sequence={}, eventType={}, jobId={}, changedFields={}",
                event.getSequence(), event.getEventType(), event.getJobId(), event.getChangedFields());
        return event;
    }

    /**
     * 注册推送订阅。消费过慢导致积压超限时会收到 {@code RESYNC_REQUIRED}，此前未送达的事件不再补发。
     */
    public JobEventSubscription subscribe(Consumer<JobEventEntity> consumer) {
        if (consumer == null) {
            throw new IllegalArgumentException("Event consumer cannot be null");
        }
        String subscriberId = UUID.randomUUID().toString();
        Subscriber subscriber = new Subscriber(subscriberId, consumer);
        subscribers.put(subscriberId, subscriber);
        log.debug("Job event subscriber added. subscriberId={}, subscribers={}", subscriberId, subscribers.size());
        return subscriber;
    }

    public void unsubscribe(String subscriberId) {
        if (subscriberId == null) {
            return;
        }
        Subscriber removed = subscribers.remove(subscriberId);
        if (removed != null) {
            removed.close();
            log.debug("Job event subscriber removed. subscriberId={}, subscribers={}", subscriberId, subscribers.size());
        }
    }

    /**
     * 回放 afterSequence 之后仍保留的事件
     */
    public JobEventReplay replay(long afterSequence) {
        synchronized (publishLock) {
            List<JobEventEntity> events = new ArrayList<>();
            for (JobEventEntity event : history) {
                if (event.getSequence() > afterSequence) {
                    events.add(event);
                }
            }
            return new JobEventReplay(events, afterSequence < evictedUpTo, lastSequence);
        }
    }

    public long latestSequence() {
        synchronized (publishLock) {
            return lastSequence;
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /**
     * 所有订阅者累计的积压溢出次数
     */
    public long backlogOverflowCount() {
        return backlogOverflows.get();
    }

    private final class Subscriber implements JobEventSubscription {

        private final String id;
        private final Consumer<JobEventEntity> consumer;
        private final Deque<JobEventEntity> queue = new ArrayDeque<>();
        private final AtomicBoolean draining = new AtomicBoolean(false);
        private volatile boolean closed;

        private Subscriber(String id, Consumer<JobEventEntity> consumer) {
            this.id = id;
            this.consumer = consumer;
        }

        @Override
        public String subscriberId() {
            return id;
        }

        @Override
        public void unsubscribe() {
            JobEventPublisher.this.unsubscribe(id);
        }

        private void enqueue(JobEventEntity event) {
            if (closed) {
                return;
            }
            int dropped = 0;
            synchronized (queue) {
                if (queue.size() >= historySize) {
                    dropped = queue.size();
                    queue.clear();
                    queue.addLast(JobEventEntity.resyncRequired(event.getSequence()));
                } else {
                    queue.addLast(event);
                }
            }
            if (dropped > 0) {
                backlogOverflows.incrementAndGet();
                log.warn("Job event backlog overflow, subscriber must resync from snapshot. subscriberId={}, dropped={}, throughSequence={}",
                        id, dropped + 1, event.getSequence());
            }
            scheduleDrain();
        }

        private JobEventEntity poll() {
            synchronized (queue) {
                return queue.pollFirst();
            }
        }

        private int pending() {
            synchronized (queue) {
                return queue.size();
            }
        }

        private void scheduleDrain() {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                pushExecutor.execute(this::drain);
            } catch (RejectedExecutionException ex) {
                draining.set(false);
                log.warn("Job event push rejected. subscriberId={}, pending={}, error={}", id, pending(), ex.getMessage());
            }
        }

        private void drain() {
            try {
                JobEventEntity event;
                while (!closed && (event = poll()) != null) {
                    try {
                        consumer.accept(event);
                    } catch (Exception ex) {
                        log.debug("Job event dispatch failed. subscriberId={}, sequence={}, error={}",
                                id, event.getSequence(), ex.getMessage());
                    }
                }
            } finally {
                draining.set(false);
            }
            if (!closed && pending() > 0) {
                scheduleDrain();
            }
        }

        private void close() {
            closed = true;
            synchronized (queue) {
                queue.clear();
            }
        }
    }
}
