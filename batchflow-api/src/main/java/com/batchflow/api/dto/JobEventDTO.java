package com.batchflow.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 作业事件 DTO（SSE 推送）。
 */
@Data
public class JobEventDTO {

    private Long sequence;
    private String eventType;
    private Long jobId;
    private List<String> changedFields;
    private JobSummaryDTO job;
    private JobStatsDTO stats;
    private LocalDateTime createdAt;
}
