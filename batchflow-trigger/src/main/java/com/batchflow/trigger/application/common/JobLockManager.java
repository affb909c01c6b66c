package com.batchflow.trigger.application.common;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 作业级互斥：同一作业的所有状态变更串行执行，不同作业互不阻塞。
 * <p>
 * 锁可重入；临界区内只做内存状态变更与事件入队，不调用 Task Runner。
 * </p>
 */
@Component
public class JobLockManager {

    private final ConcurrentMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(Long jobId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(jobId, key -> new ReentrantLock(true));
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runWithLock(Long jobId, Runnable action) {
        withLock(jobId, () -> {
            action.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread(Long jobId) {
        ReentrantLock lock = locks.get(jobId);
        return lock != null && lock.isHeldByCurrentThread();
    }

    /**
     * 作业删除后释放锁对象
     */
    public void release(Long jobId) {
        locks.computeIfPresent(jobId, (key, lock) -> lock.isLocked() || lock.hasQueuedThreads() ? lock : null);
    }
}
