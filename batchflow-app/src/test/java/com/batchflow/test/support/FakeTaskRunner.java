package com.batchflow.test.support;

import com.batchflow.domain.job.adapter.gateway.ITaskRunner;
import com.batchflow.domain.job.model.valobj.TaskRunContext;
import com.batchflow.domain.job.model.valobj.TaskRunResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 可编排行为的测试 Runner：按任务 index 配置失败次数与阻塞闸门，并记录并发峰值。
 */
public class FakeTaskRunner implements ITaskRunner {

    public static final String TASK_TYPE = "fake";

    private final Map<Integer, Integer> failuresByIndex = new ConcurrentHashMap<>();
    private final Map<Integer, CountDownLatch> gatesByIndex = new ConcurrentHashMap<>();
    private final Map<Integer, AtomicInteger> invocationsByIndex = new ConcurrentHashMap<>();
    private final List<Integer> startedIndexes = new CopyOnWriteArrayList<>();
    private final List<Long> startedJobIds = new CopyOnWriteArrayList<>();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger();
    private volatile CountDownLatch globalGate;
    private volatile boolean failAll;

    @Override
    public String taskType() {
        return TASK_TYPE;
    }

    @Override
    public TaskRunResult execute(TaskRunContext context) throws Exception {
        int index = context.task().getIndex();
        startedIndexes.add(index);
        startedJobIds.add(context.jobId());
        int attempt = invocationsByIndex.computeIfAbsent(index, key -> new AtomicInteger()).incrementAndGet();
        int current = running.incrementAndGet();
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
        try {
            CountDownLatch gate = gatesByIndex.getOrDefault(index, globalGate);
            if (gate != null && !gate.await(10, TimeUnit.SECONDS)) {
                return TaskRunResult.failure("gate timeout");
            }
            if (failAll || attempt <= failuresByIndex.getOrDefault(index, 0)) {
                throw new IllegalStateException("boom task " + index + " attempt " + attempt);
            }
            return TaskRunResult.success("done-" + index);
        } finally {
            running.decrementAndGet();
        }
    }

    public FakeTaskRunner failTimes(int index, int times) {
        failuresByIndex.put(index, times);
        return this;
    }

    public FakeTaskRunner failAll() {
        this.failAll = true;
        return this;
    }

    public CountDownLatch gate(int index) {
        return gatesByIndex.computeIfAbsent(index, key -> new CountDownLatch(1));
    }

    public CountDownLatch gateAll() {
        CountDownLatch gate = new CountDownLatch(1);
        this.globalGate = gate;
        return gate;
    }

    public int invocations(int index) {
        AtomicInteger counter = invocationsByIndex.get(index);
        return counter == null ? 0 : counter.get();
    }

    public int totalInvocations() {
        return startedIndexes.size();
    }

    /**
     * 按启动顺序记录的作业 id
     */
    public List<Long> startedJobIds() {
        return List.copyOf(startedJobIds);
    }

    public int running() {
        return running.get();
    }

    public int maxObservedConcurrency() {
        return maxObservedConcurrency.get();
    }
}
