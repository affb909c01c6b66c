package com.batchflow.config;

import com.batchflow.domain.job.service.BackoffFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 重试退避配置：按 batchflow.retry.* 构造 BackoffFunction。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(OrchestratorProperties.class)
public class RetryPolicyConfig {

    @Bean
    public BackoffFunction backoffFunction(OrchestratorProperties properties) {
        OrchestratorProperties.Retry retry = properties.getRetry();
        BackoffFunction backoff = BackoffFunction.of(retry.getBackoff(),
                Math.max(retry.getBaseDelayMs(), 0L),
                Math.max(retry.getMaxDelayMs(), 0L),
                retry.getMultiplier() < 1.0D ? 1.0D : retry.getMultiplier(),
                retry.isJitter());
        log.info("Retry backoff configured. backoff={}, baseDelayMs={}, maxDelayMs={}, multiplier={}, jitter={}",
                retry.getBackoff(), retry.getBaseDelayMs(), retry.getMaxDelayMs(), retry.getMultiplier(), retry.isJitter());
        return backoff;
    }
}
