package com.batchflow.domain.job.service;

import com.batchflow.domain.job.model.valobj.RetryDecision;

/**
 * 任务失败后的重试决策。
 */
public interface RetryPolicy {

    /**
     * @param retryCount 失败前已重试次数
     * @param maxRetries 最大重试次数
     * @param lastError  本次失败原因
     */
    RetryDecision decide(int retryCount, int maxRetries, String lastError);
}
