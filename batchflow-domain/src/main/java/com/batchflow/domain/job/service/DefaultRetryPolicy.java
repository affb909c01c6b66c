package com.batchflow.domain.job.service;

import com.batchflow.domain.job.model.valobj.RetryDecision;
import org.springframework.stereotype.Service;

/**
 * 默认重试策略：retryCount 小于 maxRetries 时重试，延迟由退避函数决定。
 */
@Service
public class DefaultRetryPolicy implements RetryPolicy {

    private final BackoffFunction backoffFunction;

    public DefaultRetryPolicy(BackoffFunction backoffFunction) {
        this.backoffFunction = backoffFunction == null ? BackoffFunction.none() : backoffFunction;
    }

    @Override
    public RetryDecision decide(int retryCount, int maxRetries, String lastError) {
        if (retryCount >= Math.max(0, maxRetries)) {
            return RetryDecision.giveUp();
        }
        long delay = backoffFunction.delayMs(retryCount + 1);
        return delay > 0 ? RetryDecision.retryAfter(delay) : RetryDecision.retryNow();
    }
}
