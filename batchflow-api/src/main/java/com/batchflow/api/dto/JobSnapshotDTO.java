package com.batchflow.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 全量快照 DTO，供轮询消费者对账。
 */
@Data
public class JobSnapshotDTO {

    private Long sequence;
    private List<JobSummaryDTO> jobs;
    private JobStatsDTO stats;
    private LocalDateTime capturedAt;
}
