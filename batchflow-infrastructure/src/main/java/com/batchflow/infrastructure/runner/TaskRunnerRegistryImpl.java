package com.batchflow.infrastructure.runner;

import com.batchflow.domain.job.adapter.gateway.ITaskRunner;
import com.batchflow.domain.job.adapter.gateway.ITaskRunnerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Task Runner 注册表：收集容器中的所有 {@link ITaskRunner}，按类型 (忽略大小写) 索引。
 */
@Slf4j
@Component
public class TaskRunnerRegistryImpl implements ITaskRunnerRegistry {

    private final Map<String, ITaskRunner> runnersByType = new ConcurrentHashMap<>();

    public TaskRunnerRegistryImpl(List<ITaskRunner> runners) {
        for (ITaskRunner runner : runners == null ? Collections.<ITaskRunner>emptyList() : runners) {
            register(runner);
        }
    }

    public void register(ITaskRunner runner) {
        if (runner == null || StringUtils.isBlank(runner.taskType())) {
            return;
        }
        String key = normalize(runner.taskType());
        ITaskRunner previous = runnersByType.put(key, runner);
        if (previous != null && previous != runner) {
            log.warn("Task runner replaced. taskType={}, previous={}, current={}",
                    key, previous.getClass().getSimpleName(), runner.getClass().getSimpleName());
        } else {
            log.info("Task runner registered. taskType={}, runner={}", key, runner.getClass().getSimpleName());
        }
    }

    @Override
    public ITaskRunner resolve(String taskType) {
        if (StringUtils.isBlank(taskType)) {
            return null;
        }
        return runnersByType.get(normalize(taskType));
    }

    private String normalize(String taskType) {
        return taskType.trim().toLowerCase();
    }
}
