package com.batchflow.trigger.http;

import com.batchflow.api.dto.BatchActionRequestDTO;
import com.batchflow.api.dto.BatchActionResultDTO;
import com.batchflow.api.dto.JobCreateRequestDTO;
import com.batchflow.api.dto.JobCreateResponseDTO;
import com.batchflow.api.dto.JobDetailDTO;
import com.batchflow.api.dto.JobSnapshotDTO;
import com.batchflow.api.dto.JobStatsDTO;
import com.batchflow.api.dto.JobSummaryDTO;
import com.batchflow.api.dto.TaskCreateRequestDTO;
import com.batchflow.api.dto.TaskDetailDTO;
import com.batchflow.api.response.Response;
import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.domain.job.model.valobj.BatchActionItemResult;
import com.batchflow.domain.job.model.valobj.JobCreateCommand;
import com.batchflow.domain.job.model.valobj.JobQuery;
import com.batchflow.trigger.application.common.JobViewAssembler;
import com.batchflow.trigger.service.JobOrchestratorService;
import com.batchflow.types.enums.BatchActionEnum;
import com.batchflow.types.enums.CompletionPolicyEnum;
import com.batchflow.types.enums.JobPriorityEnum;
import com.batchflow.types.enums.JobSortFieldEnum;
import com.batchflow.types.enums.JobStatusEnum;
import com.batchflow.types.enums.ResponseCode;
import com.batchflow.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 作业管理 API：创建、查询、生命周期控制与批量操作。
 */
@RestController
@RequestMapping("/api/jobs")
public class JobController {

    private final JobOrchestratorService jobOrchestratorService;
    private final JobViewAssembler jobViewAssembler;

    public JobController(JobOrchestratorService jobOrchestratorService, JobViewAssembler jobViewAssembler) {
        this.jobOrchestratorService = jobOrchestratorService;
        this.jobViewAssembler = jobViewAssembler;
    }

    @PostMapping
    public Response<JobCreateResponseDTO> createJob(@RequestBody JobCreateRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "Request body cannot be empty");
        }
        Long jobId = jobOrchestratorService.createJob(toCommand(request));
        BatchJobEntity job = jobOrchestratorService.getJob(jobId).job();
        JobCreateResponseDTO data = new JobCreateResponseDTO();
        data.setJobId(jobId);
        data.setStatus(job.getStatus() == null ? null : job.getStatus().getCode());
        data.setTasksTotal(job.getTasksTotal());
        return success(data);
    }

    @GetMapping
    public Response<List<JobSummaryDTO>> listJobs(@RequestParam(value = "status", required = false) String status,
                                                  @RequestParam(value = "priority", required = false) String priority,
                                                  @RequestParam(value = "type", required = false) String type,
                                                  @RequestParam(value = "ownerId", required = false) String ownerId,
                                                  @RequestParam(value = "tag", required = false) String tag,
                                                  @RequestParam(value = "keyword", required = false) String keyword,
                                                  @RequestParam(value = "sortBy", required = false) String sortBy,
                                                  @RequestParam(value = "sortOrder", required = false) String sortOrder,
                                                  @RequestParam(value = "offset", required = false) Integer offset,
                                                  @RequestParam(value = "limit", required = false) Integer limit) {
        JobQuery query = JobQuery.builder()
                .statuses(parseStatuses(status))
                .priority(JobPriorityEnum.fromCode(priority))
                .type(StringUtils.trimToNull(type))
                .ownerId(StringUtils.trimToNull(ownerId))
                .tag(StringUtils.trimToNull(tag))
                .keyword(StringUtils.trimToNull(keyword))
                .sortBy(JobSortFieldEnum.fromField(sortBy))
                .ascending(parseAscending(sortOrder))
                .offset(offset)
                .limit(limit)
                .build();
        return success(jobViewAssembler.toSummaryDTOs(jobOrchestratorService.listJobs(query)));
    }

    @GetMapping("/stats")
    public Response<JobStatsDTO> getStats(@RequestParam(value = "status", required = false) String status,
                                          @RequestParam(value = "type", required = false) String type,
                                          @RequestParam(value = "ownerId", required = false) String ownerId,
                                          @RequestParam(value = "tag", required = false) String tag) {
        JobQuery query = JobQuery.builder()
                .statuses(parseStatuses(status))
                .type(StringUtils.trimToNull(type))
                .ownerId(StringUtils.trimToNull(ownerId))
                .tag(StringUtils.trimToNull(tag))
                .build();
        return success(jobViewAssembler.toStatsDTO(jobOrchestratorService.getStats(query)));
    }

    @GetMapping("/snapshot")
    public Response<JobSnapshotDTO> getSnapshot() {
        return success(jobViewAssembler.toSnapshotDTO(jobOrchestratorService.snapshot()));
    }

    @GetMapping("/{id}")
    public Response<JobDetailDTO> getJob(@PathVariable("id") Long jobId) {
        return success(jobViewAssembler.toDetailDTO(jobOrchestratorService.getJob(jobId)));
    }

    @PostMapping("/{id}/{action}")
    public Response<JobSummaryDTO> applyAction(@PathVariable("id") Long jobId,
                                               @PathVariable("action") String action) {
        BatchActionEnum jobAction = BatchActionEnum.fromCode(action);
        BatchJobEntity job;
        switch (jobAction) {
            case START:
                job = jobOrchestratorService.startJob(jobId);
                break;
            case PAUSE:
                job = jobOrchestratorService.pauseJob(jobId);
                break;
            case RESUME:
                job = jobOrchestratorService.resumeJob(jobId);
                break;
            case CANCEL:
                job = jobOrchestratorService.cancelJob(jobId);
                break;
            case RETRY:
                job = jobOrchestratorService.retryJob(jobId);
                break;
            default:
                throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(),
                        "Use DELETE /api/jobs/{id} to delete a job");
        }
        return success(jobViewAssembler.toSummaryDTO(job));
    }

    @DeleteMapping("/{id}")
    public Response<Boolean> deleteJob(@PathVariable("id") Long jobId) {
        jobOrchestratorService.deleteJob(jobId);
        return success(Boolean.TRUE);
    }

    @PostMapping("/{id}/tasks/{taskId}/retry")
    public Response<TaskDetailDTO> retryTask(@PathVariable("id") Long jobId,
                                             @PathVariable("taskId") Long taskId) {
        return success(jobViewAssembler.toTaskDetailDTO(jobOrchestratorService.retryTask(jobId, taskId)));
    }

    @PostMapping("/batch")
    public Response<List<BatchActionResultDTO>> batchAction(@RequestBody BatchActionRequestDTO request) {
        if (request == null || StringUtils.isBlank(request.getAction())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "Batch action cannot be empty");
        }
        List<BatchActionItemResult> results = jobOrchestratorService.batchAction(
                BatchActionEnum.fromCode(request.getAction()), request.getJobIds());
        return success(results.stream().map(jobViewAssembler::toBatchResultDTO).collect(Collectors.toList()));
    }

    private JobCreateCommand toCommand(JobCreateRequestDTO request) {
        List<JobCreateCommand.TaskSpec> tasks = new ArrayList<>();
        List<TaskCreateRequestDTO> taskRequests = request.getTasks() == null ? Collections.emptyList() : request.getTasks();
        for (TaskCreateRequestDTO taskRequest : taskRequests) {
            if (taskRequest == null) {
                throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "Task definition cannot be null");
            }
            tasks.add(JobCreateCommand.TaskSpec.builder()
                    .name(taskRequest.getName())
                    .index(taskRequest.getIndex())
                    .maxRetries(taskRequest.getMaxRetries())
                    .payload(taskRequest.getPayload())
                    .build());
        }
        return JobCreateCommand.builder()
                .name(request.getName())
                .type(request.getType())
                .priority(JobPriorityEnum.fromCode(request.getPriority()))
                .ownerId(request.getOwnerId())
                .tags(request.getTags())
                .concurrencyLimit(request.getConcurrencyLimit())
                .maxRetries(request.getMaxRetries())
                .taskTimeoutMs(request.getTaskTimeoutMs())
                .completionPolicy(CompletionPolicyEnum.fromCode(request.getCompletionPolicy()))
                .failureRatioThreshold(request.getFailureRatioThreshold())
                .autoStart(Boolean.TRUE.equals(request.getAutoStart()))
                .tasks(tasks)
                .build();
    }

    private Set<JobStatusEnum> parseStatuses(String status) {
        if (StringUtils.isBlank(status)) {
            return null;
        }
        Set<JobStatusEnum> statuses = EnumSet.noneOf(JobStatusEnum.class);
        for (String code : StringUtils.split(status, ',')) {
            if (StringUtils.isNotBlank(code)) {
                statuses.add(JobStatusEnum.fromCode(code.trim()));
            }
        }
        return statuses.isEmpty() ? null : statuses;
    }

    private boolean parseAscending(String sortOrder) {
        if (StringUtils.isBlank(sortOrder)) {
            return false;
        }
        String normalized = sortOrder.trim().toLowerCase();
        if ("asc".equals(normalized)) {
            return true;
        }
        if ("desc".equals(normalized)) {
            return false;
        }
        throw new IllegalArgumentException("sortOrder must be asc or desc: " + sortOrder);
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
