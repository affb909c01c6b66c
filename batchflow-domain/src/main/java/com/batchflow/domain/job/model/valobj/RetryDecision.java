package com.batchflow.domain.job.model.valobj;

import lombok.Getter;

/**
 * 重试决策：立即重试 / 延迟重试 / 放弃。
 */
@Getter
public final class RetryDecision {

    public enum Kind {
        RETRY_NOW,
        RETRY_AFTER_DELAY,
        GIVE_UP
    }

    private static final RetryDecision RETRY_NOW = new RetryDecision(Kind.RETRY_NOW, 0L);
    private static final RetryDecision GIVE_UP = new RetryDecision(Kind.GIVE_UP, 0L);

    private final Kind kind;
    private final long delayMs;

    private RetryDecision(Kind kind, long delayMs) {
        this.kind = kind;
        this.delayMs = delayMs;
    }

    public static RetryDecision retryNow() {
        return RETRY_NOW;
    }

    public static RetryDecision retryAfter(long delayMs) {
        if (delayMs <= 0) {
            return RETRY_NOW;
        }
        return new RetryDecision(Kind.RETRY_AFTER_DELAY, delayMs);
    }

    public static RetryDecision giveUp() {
        return GIVE_UP;
    }

    public boolean isRetry() {
        return kind != Kind.GIVE_UP;
    }

    @Override
    public String toString() {
        return kind == Kind.RETRY_AFTER_DELAY ? kind + "(" + delayMs + "ms)" : kind.name();
    }
}
