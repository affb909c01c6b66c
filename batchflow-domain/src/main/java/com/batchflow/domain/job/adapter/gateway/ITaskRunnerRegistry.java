package com.batchflow.domain.job.adapter.gateway;

/**
 * 按作业类型查找 Task Runner。
 */
public interface ITaskRunnerRegistry {

    /**
     * @return 对应类型的 Runner；未注册时返回 null
     */
    ITaskRunner resolve(String taskType);
}
