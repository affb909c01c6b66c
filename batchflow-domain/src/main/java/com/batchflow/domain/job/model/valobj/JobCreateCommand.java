package com.batchflow.domain.job.model.valobj;

import com.batchflow.types.enums.CompletionPolicyEnum;
import com.batchflow.types.enums.JobPriorityEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 作业创建命令。未指定的参数取配置默认值。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobCreateCommand {

    private String name;
    private String type;
    private JobPriorityEnum priority;
    private String ownerId;
    private List<String> tags;
    private Integer concurrencyLimit;
    private Integer maxRetries;
    private Long taskTimeoutMs;
    private CompletionPolicyEnum completionPolicy;
    private Double failureRatioThreshold;
    private boolean autoStart;
    private List<TaskSpec> tasks;

    /**
     * 单个任务定义
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TaskSpec {
        private String name;
        private Integer index;
        private Integer maxRetries;
        private Map<String, Object> payload;
    }
}
