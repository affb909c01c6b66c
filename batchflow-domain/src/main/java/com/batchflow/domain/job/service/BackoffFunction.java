package com.batchflow.domain.job.service;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 重试退避函数：根据即将进行的重试序号 (从 1 开始) 计算延迟毫秒数。
 */
@FunctionalInterface
public interface BackoffFunction {

    long delayMs(int retryNumber);

    static BackoffFunction none() {
        return retryNumber -> 0L;
    }

    static BackoffFunction fixed(long delayMs) {
        long normalized = Math.max(0L, delayMs);
        return retryNumber -> normalized;
    }

    static BackoffFunction linear(long baseDelayMs, long maxDelayMs) {
        long base = Math.max(0L, baseDelayMs);
        return retryNumber -> cap(base * Math.max(1, retryNumber), maxDelayMs);
    }

    static BackoffFunction exponential(long baseDelayMs, double multiplier, long maxDelayMs, boolean jitter) {
        return exponential(baseDelayMs, multiplier, maxDelayMs, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * base * multiplier^(n-1)，不超过 maxDelayMs；开启抖动时乘以 [0.5, 1.0) 的随机系数。
     */
    static BackoffFunction exponential(long baseDelayMs,
                                       double multiplier,
                                       long maxDelayMs,
                                       boolean jitter,
                                       DoubleSupplier random) {
        long base = Math.max(0L, baseDelayMs);
        double factor = multiplier < 1D ? 1D : multiplier;
        return retryNumber -> {
            double raw = base * Math.pow(factor, Math.max(0, retryNumber - 1));
            long delay = cap(raw >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) raw, maxDelayMs);
            if (jitter && delay > 0) {
                delay = (long) (delay * (0.5D + random.getAsDouble() * 0.5D));
            }
            return delay;
        };
    }

    /**
     * 按配置名构造：none | fixed | linear | exponential
     */
    static BackoffFunction of(String kind, long baseDelayMs, long maxDelayMs, double multiplier, boolean jitter) {
        String normalized = kind == null ? "none" : kind.trim().toLowerCase();
        return switch (normalized) {
            case "", "none" -> none();
            case "fixed" -> fixed(baseDelayMs);
            case "linear" -> linear(baseDelayMs, maxDelayMs);
            case "exponential" -> exponential(baseDelayMs, multiplier, maxDelayMs, jitter);
            default -> throw new IllegalArgumentException("Unknown backoff kind: " + kind);
        };
    }

    private static long cap(long delay, long maxDelayMs) {
        if (maxDelayMs > 0 && delay > maxDelayMs) {
            return maxDelayMs;
        }
        return delay;
    }
}
