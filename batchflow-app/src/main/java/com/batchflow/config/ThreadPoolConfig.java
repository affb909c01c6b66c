package com.batchflow.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置类。
 * <p>
 * taskExecutionWorker 只运行 Runner 调用，jobEventPushExecutor 负责事件向订阅者推送，两者互不占用。
 * </p>
 */
@Slf4j
@Configuration
public class ThreadPoolConfig {

    /**
     * 任务执行线程池，被拒绝的任务会退回 pending 由调度守护进程补派
     */
    @Bean(name = "taskExecutionWorker", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "taskExecutionWorker")
    public ThreadPoolExecutor taskExecutionWorker(
            @Value("${executor.worker.core-size:8}") int coreSize,
            @Value("${executor.worker.max-size:8}") int maxSize,
            @Value("${executor.worker.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${executor.worker.queue-capacity:1024}") int queueCapacity,
            @Value("${executor.worker.rejection-policy:AbortPolicy}") String rejectionPolicy,
            @Value("${executor.worker.thread-name-prefix:task-exec-worker-}") String threadNamePrefix) {
        return buildExecutor(coreSize, maxSize, keepAliveSeconds, queueCapacity, rejectionPolicy, threadNamePrefix, false);
    }

    @Bean(name = "jobEventPushExecutor", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "jobEventPushExecutor")
    public ThreadPoolExecutor jobEventPushExecutor(
            @Value("${executor.event-push.core-size:4}") int coreSize,
            @Value("${executor.event-push.queue-capacity:10000}") int queueCapacity,
            @Value("${executor.event-push.thread-name-prefix:job-event-push-}") String threadNamePrefix) {
        return buildExecutor(coreSize, coreSize, 60L, queueCapacity, "AbortPolicy", threadNamePrefix, true);
    }

    private ThreadPoolExecutor buildExecutor(int coreSize,
                                             int maxSize,
                                             long keepAliveSeconds,
                                             int queueCapacity,
                                             String rejectionPolicy,
                                             String threadNamePrefix,
                                             boolean daemon) {
        int normalizedCoreSize = Math.max(coreSize, 1);
        int normalizedMaxSize = Math.max(maxSize, normalizedCoreSize);
        int normalizedQueueCapacity = Math.max(queueCapacity, 0);
        BlockingQueue<Runnable> queue = normalizedQueueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(normalizedQueueCapacity);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadNamePrefix + threadIndex.incrementAndGet());
            thread.setDaemon(daemon);
            return thread;
        };
        return new ThreadPoolExecutor(
                normalizedCoreSize,
                normalizedMaxSize,
                Math.max(keepAliveSeconds, 0L),
                TimeUnit.SECONDS,
                queue,
                threadFactory,
                buildRejectedExecutionHandler(rejectionPolicy));
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unsupported rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }
}
