package com.batchflow.trigger.application.query;

import com.batchflow.domain.job.adapter.repository.IBatchJobRepository;
import com.batchflow.domain.job.adapter.repository.IJobTaskRepository;
import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.domain.job.model.entity.JobTaskEntity;
import com.batchflow.domain.job.model.valobj.JobQuery;
import com.batchflow.domain.job.model.valobj.JobSnapshot;
import com.batchflow.domain.job.model.valobj.JobStatsSnapshot;
import com.batchflow.domain.job.model.valobj.JobView;
import com.batchflow.domain.job.service.JobQueryDomainService;
import com.batchflow.domain.job.service.JobStatsDomainService;
import com.batchflow.trigger.application.common.JobLockManager;
import com.batchflow.trigger.event.JobEventPublisher;
import com.batchflow.types.exception.NotFoundException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 作业读用例：列表、详情、统计与全量快照。
 */
@Service
public class JobQueryService {

    private final IBatchJobRepository batchJobRepository;
    private final IJobTaskRepository jobTaskRepository;
    private final JobQueryDomainService jobQueryDomainService;
    private final JobStatsDomainService jobStatsDomainService;
    private final JobEventPublisher jobEventPublisher;
    private final JobLockManager jobLockManager;
    private final Duration throughputWindow;
    private final int globalConcurrencyLimit;

    public JobQueryService(IBatchJobRepository batchJobRepository,
                           IJobTaskRepository jobTaskRepository,
                           JobQueryDomainService jobQueryDomainService,
                           JobStatsDomainService jobStatsDomainService,
                           JobEventPublisher jobEventPublisher,
                           JobLockManager jobLockManager,
                           @Value("${batchflow.stats.throughput-window-minutes:60}") long throughputWindowMinutes,
                           @Value("${batchflow.scheduler.global-concurrency-limit:0}") int globalConcurrencyLimit) {
        this.batchJobRepository = batchJobRepository;
        this.jobTaskRepository = jobTaskRepository;
        this.jobQueryDomainService = jobQueryDomainService;
        this.jobStatsDomainService = jobStatsDomainService;
        this.jobEventPublisher = jobEventPublisher;
        this.jobLockManager = jobLockManager;
        this.throughputWindow = Duration.ofMinutes(throughputWindowMinutes > 0 ? throughputWindowMinutes : 60);
        this.globalConcurrencyLimit = Math.max(globalConcurrencyLimit, 0);
    }

    public List<BatchJobEntity> listJobs(JobQuery query) {
        return jobQueryDomainService.apply(batchJobRepository.findAll(), query);
    }

    /**
     * 作业与任务在同一把作业锁内读取，计数与任务列表一致
     */
    public JobView getJob(Long jobId) {
        if (jobId == null || batchJobRepository.findById(jobId) == null) {
            throw NotFoundException.job(jobId);
        }
        JobView view = jobLockManager.withLock(jobId, () -> {
            BatchJobEntity job = batchJobRepository.findById(jobId);
            return job == null ? null : new JobView(job, jobTaskRepository.findByJobId(jobId));
        });
        if (view == null) {
            jobLockManager.release(jobId);
            throw NotFoundException.job(jobId);
        }
        return view;
    }

    /**
     * 统计范围由 query 的过滤条件决定，分页与排序参数被忽略
     */
    public JobStatsSnapshot getStats(JobQuery query) {
        List<BatchJobEntity> jobs = new ArrayList<>();
        for (BatchJobEntity job : batchJobRepository.findAll()) {
            if (query == null || jobQueryDomainService.matches(job, query)) {
                jobs.add(job);
            }
        }
        return computeStats(jobs);
    }

    public JobSnapshot snapshot() {
        long sequence = jobEventPublisher.latestSequence();
        List<BatchJobEntity> jobs = batchJobRepository.findAll();
        return new JobSnapshot(sequence, jobs, computeStats(jobs), LocalDateTime.now());
    }

    private JobStatsSnapshot computeStats(List<BatchJobEntity> jobs) {
        Set<Long> jobIds = new HashSet<>();
        for (BatchJobEntity job : jobs) {
            jobIds.add(job.getId());
        }
        List<JobTaskEntity> tasks = new ArrayList<>();
        for (JobTaskEntity task : jobTaskRepository.findAll()) {
            if (jobIds.contains(task.getJobId())) {
                tasks.add(task);
            }
        }
        return jobStatsDomainService.compute(jobs, tasks, LocalDateTime.now(), throughputWindow, globalConcurrencyLimit);
    }
}
