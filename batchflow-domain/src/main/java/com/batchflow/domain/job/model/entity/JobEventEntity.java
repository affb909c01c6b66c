package com.batchflow.domain.job.model.entity;

import com.batchflow.domain.job.model.valobj.JobStatsSnapshot;
import com.batchflow.types.enums.JobEventTypeEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

/**
 * 作业增量事件。sequence 全局单调递增，由发布器分配。
 */
@Data
public class JobEventEntity {

    private Long sequence;
    private JobEventTypeEnum eventType;
    private Long jobId;
    private List<String> changedFields;

    /**
     * 事件发生时的作业快照 (job_removed / stats_updated 时为空)
     */
    private BatchJobEntity job;

    /**
     * 统计快照 (仅 stats_updated)
     */
    private JobStatsSnapshot stats;

    private LocalDateTime createdAt;

    public void validate() {
        if (eventType == null) {
            throw new IllegalStateException("Event type cannot be null");
        }
        boolean jobScoped = eventType != JobEventTypeEnum.STATS_UPDATED
                && eventType != JobEventTypeEnum.RESYNC_REQUIRED;
        if (jobScoped && jobId == null) {
            throw new IllegalStateException("Job ID cannot be null");
        }
    }

    public static JobEventEntity jobAdded(BatchJobEntity job) {
        return ofJob(JobEventTypeEnum.JOB_ADDED, job, Collections.emptyList());
    }

    public static JobEventEntity jobUpdated(BatchJobEntity job, List<String> changedFields) {
        return ofJob(JobEventTypeEnum.JOB_UPDATED, job, changedFields);
    }

    public static JobEventEntity jobRemoved(Long jobId) {
        JobEventEntity event = new JobEventEntity();
        event.setEventType(JobEventTypeEnum.JOB_REMOVED);
        event.setJobId(jobId);
        event.setChangedFields(Collections.emptyList());
        event.validate();
        return event;
    }

    public static JobEventEntity statsUpdated(JobStatsSnapshot stats) {
        JobEventEntity event = new JobEventEntity();
        event.setEventType(JobEventTypeEnum.STATS_UPDATED);
        event.setStats(stats);
        event.setChangedFields(Collections.emptyList());
        event.validate();
        return event;
    }

    /**
     * 积压丢弃标记，sequence 为最后一个被丢弃事件的序号，不占用新序号
     */
    public static JobEventEntity resyncRequired(Long droppedThroughSequence) {
        JobEventEntity event = new JobEventEntity();
        event.setEventType(JobEventTypeEnum.RESYNC_REQUIRED);
        event.setSequence(droppedThroughSequence);
        event.setChangedFields(Collections.emptyList());
        event.setCreatedAt(LocalDateTime.now());
        event.validate();
        return event;
    }

    private static JobEventEntity ofJob(JobEventTypeEnum type, BatchJobEntity job, List<String> changedFields) {
        JobEventEntity event = new JobEventEntity();
        event.setEventType(type);
        event.setJobId(job == null ? null : job.getId());
        event.setJob(job == null ? null : job.copy());
        event.setChangedFields(changedFields == null ? Collections.emptyList() : List.copyOf(changedFields));
        event.validate();
        return event;
    }
}
