package com.batchflow.trigger.application.common;

import com.batchflow.api.dto.BatchActionResultDTO;
import com.batchflow.api.dto.JobDetailDTO;
import com.batchflow.api.dto.JobEventDTO;
import com.batchflow.api.dto.JobSnapshotDTO;
import com.batchflow.api.dto.JobStatsDTO;
import com.batchflow.api.dto.JobSummaryDTO;
import com.batchflow.api.dto.TaskDetailDTO;
import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.domain.job.model.entity.JobEventEntity;
import com.batchflow.domain.job.model.entity.JobTaskEntity;
import com.batchflow.domain.job.model.valobj.BatchActionItemResult;
import com.batchflow.domain.job.model.valobj.JobSnapshot;
import com.batchflow.domain.job.model.valobj.JobStatsSnapshot;
import com.batchflow.domain.job.model.valobj.JobView;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 作业视图组装器：统一实体到 API DTO 的映射。
 */
@Component
public class JobViewAssembler {

    public JobSummaryDTO toSummaryDTO(BatchJobEntity job) {
        if (job == null) {
            return null;
        }
        JobSummaryDTO dto = new JobSummaryDTO();
        dto.setJobId(job.getId());
        dto.setName(job.getName());
        dto.setType(job.getType());
        dto.setPriority(job.getPriority() == null ? null : job.getPriority().getCode());
        dto.setStatus(job.getStatus() == null ? null : job.getStatus().getCode());
        dto.setOwnerId(job.getOwnerId());
        dto.setTags(job.getTags() == null ? null : new ArrayList<>(job.getTags()));
        dto.setTasksTotal(job.getTasksTotal());
        dto.setTasksCompleted(job.getTasksCompleted());
        dto.setTasksFailed(job.getTasksFailed());
        dto.setTasksSkipped(job.getTasksSkipped());
        dto.setProgress(job.getProgress());
        dto.setCreatedAt(job.getCreatedAt());
        dto.setStartedAt(job.getStartedAt());
        dto.setCompletedAt(job.getCompletedAt());
        dto.setUpdatedAt(job.getUpdatedAt());
        return dto;
    }

    public List<JobSummaryDTO> toSummaryDTOs(List<BatchJobEntity> jobs) {
        if (jobs == null || jobs.isEmpty()) {
            return Collections.emptyList();
        }
        return jobs.stream()
                .filter(Objects::nonNull)
                .map(this::toSummaryDTO)
                .collect(Collectors.toList());
    }

    public JobDetailDTO toDetailDTO(JobView view) {
        if (view == null || view.job() == null) {
            return null;
        }
        BatchJobEntity job = view.job();
        JobDetailDTO dto = new JobDetailDTO();
        dto.setJobId(job.getId());
        dto.setName(job.getName());
        dto.setType(job.getType());
        dto.setPriority(job.getPriority() == null ? null : job.getPriority().getCode());
        dto.setStatus(job.getStatus() == null ? null : job.getStatus().getCode());
        dto.setOwnerId(job.getOwnerId());
        dto.setTags(job.getTags() == null ? null : new ArrayList<>(job.getTags()));
        dto.setTasksTotal(job.getTasksTotal());
        dto.setTasksCompleted(job.getTasksCompleted());
        dto.setTasksFailed(job.getTasksFailed());
        dto.setTasksSkipped(job.getTasksSkipped());
        dto.setProgress(job.getProgress());
        dto.setConcurrencyLimit(job.getConcurrencyLimit());
        dto.setMaxRetries(job.getMaxRetries());
        dto.setTaskTimeoutMs(job.getTaskTimeoutMs());
        dto.setCompletionPolicy(job.getCompletionPolicy() == null ? null : job.getCompletionPolicy().name());
        dto.setFailureRatioThreshold(job.getFailureRatioThreshold());
        dto.setErrorSummary(job.getErrorSummary());
        dto.setVersion(job.getVersion());
        dto.setCreatedAt(job.getCreatedAt());
        dto.setStartedAt(job.getStartedAt());
        dto.setCompletedAt(job.getCompletedAt());
        dto.setUpdatedAt(job.getUpdatedAt());
        List<JobTaskEntity> tasks = view.tasks() == null ? Collections.emptyList() : view.tasks();
        dto.setTasks(tasks.stream().map(this::toTaskDetailDTO).collect(Collectors.toList()));
        return dto;
    }

    public TaskDetailDTO toTaskDetailDTO(JobTaskEntity task) {
        if (task == null) {
            return null;
        }
        TaskDetailDTO dto = new TaskDetailDTO();
        dto.setTaskId(task.getId());
        dto.setJobId(task.getJobId());
        dto.setIndex(task.getIndex());
        dto.setName(task.getName());
        dto.setStatus(task.getStatus() == null ? null : task.getStatus().getCode());
        dto.setPayload(task.getPayload());
        dto.setRetryCount(task.getRetryCount());
        dto.setMaxRetries(task.getMaxRetries());
        dto.setExecutionAttempt(task.getExecutionAttempt());
        dto.setProgress(task.getProgress());
        dto.setError(task.getError());
        dto.setResult(task.getResult());
        dto.setNextAttemptAt(task.getNextAttemptAt());
        dto.setStartedAt(task.getStartedAt());
        dto.setCompletedAt(task.getCompletedAt());
        return dto;
    }

    public JobStatsDTO toStatsDTO(JobStatsSnapshot stats) {
        if (stats == null) {
            return null;
        }
        JobStatsDTO dto = new JobStatsDTO();
        dto.setTotalJobs(stats.getTotalJobs());
        dto.setPendingJobs(stats.getPendingJobs());
        dto.setRunningJobs(stats.getRunningJobs());
        dto.setPausedJobs(stats.getPausedJobs());
        dto.setCompletedJobs(stats.getCompletedJobs());
        dto.setFailedJobs(stats.getFailedJobs());
        dto.setCancelledJobs(stats.getCancelledJobs());
        dto.setTotalTasks(stats.getTotalTasks());
        dto.setPendingTasks(stats.getPendingTasks());
        dto.setRunningTasks(stats.getRunningTasks());
        dto.setCompletedTasks(stats.getCompletedTasks());
        dto.setFailedTasks(stats.getFailedTasks());
        dto.setSkippedTasks(stats.getSkippedTasks());
        dto.setThroughputPerHour(stats.getThroughputPerHour());
        dto.setAverageTaskDurationMs(stats.getAverageTaskDurationMs());
        dto.setAverageQueueWaitMs(stats.getAverageQueueWaitMs());
        dto.setEstimatedTimeRemainingMs(stats.getEstimatedTimeRemainingMs());
        return dto;
    }

    public JobEventDTO toEventDTO(JobEventEntity event) {
        if (event == null) {
            return null;
        }
        JobEventDTO dto = new JobEventDTO();
        dto.setSequence(event.getSequence());
        dto.setEventType(event.getEventType() == null ? null : event.getEventType().getEventName());
        dto.setJobId(event.getJobId());
        dto.setChangedFields(event.getChangedFields());
        dto.setJob(toSummaryDTO(event.getJob()));
        dto.setStats(toStatsDTO(event.getStats()));
        dto.setCreatedAt(event.getCreatedAt());
        return dto;
    }

    public JobSnapshotDTO toSnapshotDTO(JobSnapshot snapshot) {
        if (snapshot == null) {
            return null;
        }
        JobSnapshotDTO dto = new JobSnapshotDTO();
        dto.setSequence(snapshot.sequence());
        dto.setJobs(toSummaryDTOs(snapshot.jobs()));
        dto.setStats(toStatsDTO(snapshot.stats()));
        dto.setCapturedAt(snapshot.capturedAt());
        return dto;
    }

    public BatchActionResultDTO toBatchResultDTO(BatchActionItemResult result) {
        BatchActionResultDTO dto = new BatchActionResultDTO();
        dto.setJobId(result.jobId());
        dto.setOutcome(result.outcome() == null ? null : result.outcome().getCode());
        dto.setStatus(result.status() == null ? null : result.status().getCode());
        dto.setErrorCode(result.errorCode());
        dto.setErrorMessage(result.errorMessage());
        return dto;
    }
}
