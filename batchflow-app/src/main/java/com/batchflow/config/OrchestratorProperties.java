package com.batchflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 编排器配置属性，前缀 batchflow。
 * <p>
 * 退避参数在此集中绑定；其余调度与事件参数由各组件通过 @Value 直接读取，默认值与这里保持一致。
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "batchflow")
public class OrchestratorProperties {

    private Retry retry = new Retry();

    @Data
    public static class Retry {

        /** none | fixed | linear | exponential，默认立即重试 */
        private String backoff = "none";

        private long baseDelayMs = 1000L;

        /** 0 表示不封顶 */
        private long maxDelayMs = 60_000L;

        private double multiplier = 2.0D;

        private boolean jitter = false;
    }
}
