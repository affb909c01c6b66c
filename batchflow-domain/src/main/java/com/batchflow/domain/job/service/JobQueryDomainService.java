package com.batchflow.domain.job.service;

import com.batchflow.domain.job.model.entity.BatchJobEntity;
import com.batchflow.domain.job.model.valobj.JobQuery;
import com.batchflow.types.common.Constants;
import com.batchflow.types.enums.JobSortFieldEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * 作业查询领域服务：过滤、关键字搜索、排序与分页。
 */
@Service
public class JobQueryDomainService {

    public List<BatchJobEntity> apply(List<BatchJobEntity> jobs, JobQuery query) {
        if (jobs == null || jobs.isEmpty()) {
            return Collections.emptyList();
        }
        JobQuery normalized = query == null ? JobQuery.all() : query;
        List<BatchJobEntity> matched = new ArrayList<>();
        for (BatchJobEntity job : jobs) {
            if (job != null && matches(job, normalized)) {
                matched.add(job);
            }
        }
        matched.sort(comparator(normalized));
        return page(matched, normalized.getOffset(), normalized.getLimit());
    }

    public boolean matches(BatchJobEntity job, JobQuery query) {
        if (query.getStatuses() != null && !query.getStatuses().isEmpty()
                && !query.getStatuses().contains(job.getStatus())) {
            return false;
        }
        if (query.getPriority() != null && query.getPriority() != job.getPriority()) {
            return false;
        }
        if (StringUtils.isNotBlank(query.getType()) && !StringUtils.equalsIgnoreCase(query.getType(), job.getType())) {
            return false;
        }
        if (StringUtils.isNotBlank(query.getOwnerId()) && !StringUtils.equals(query.getOwnerId(), job.getOwnerId())) {
            return false;
        }
        if (StringUtils.isNotBlank(query.getTag()) && !hasTag(job, query.getTag())) {
            return false;
        }
        if (StringUtils.isNotBlank(query.getKeyword())) {
            String keyword = query.getKeyword().trim();
            return StringUtils.containsIgnoreCase(job.getName(), keyword)
                    || StringUtils.containsIgnoreCase(job.getType(), keyword)
                    || hasTagContaining(job, keyword);
        }
        return true;
    }

    private Comparator<BatchJobEntity> comparator(JobQuery query) {
        JobSortFieldEnum sortBy = query.getSortBy() == null ? JobSortFieldEnum.CREATED_AT : query.getSortBy();
        Comparator<BatchJobEntity> primary = switch (sortBy) {
            case CREATED_AT -> nullsLast(BatchJobEntity::getCreatedAt, query.isAscending());
            case STARTED_AT -> nullsLast(BatchJobEntity::getStartedAt, query.isAscending());
            case COMPLETED_AT -> nullsLast(BatchJobEntity::getCompletedAt, query.isAscending());
            case NAME -> nullsLast(job -> job.getName() == null ? null : job.getName().toLowerCase(), query.isAscending());
            case PRIORITY -> nullsLast(job -> job.getPriority() == null ? null : job.getPriority().getWeight(),
                    query.isAscending());
            case STATUS -> nullsLast(job -> job.getStatus() == null ? null : job.getStatus().ordinal(), query.isAscending());
            case PROGRESS -> nullsLast(BatchJobEntity::getProgress, query.isAscending());
        };
        Comparator<BatchJobEntity> byId = Comparator.comparing(BatchJobEntity::getId,
                Comparator.nullsLast(Comparator.naturalOrder()));
        return primary.thenComparing(query.isAscending() ? byId : byId.reversed());
    }

    private <T extends Comparable<? super T>> Comparator<BatchJobEntity> nullsLast(Function<BatchJobEntity, T> extractor,
                                                                                   boolean ascending) {
        Comparator<T> order = ascending ? Comparator.<T>naturalOrder() : Comparator.<T>reverseOrder();
        return Comparator.comparing(extractor, Comparator.nullsLast(order));
    }

    private List<BatchJobEntity> page(List<BatchJobEntity> jobs, Integer offset, Integer limit) {
        int from = offset == null || offset < 0 ? 0 : offset;
        if (from >= jobs.size()) {
            return Collections.emptyList();
        }
        int size = limit == null || limit <= 0 ? Constants.MAX_PAGE_SIZE : Math.min(limit, Constants.MAX_PAGE_SIZE);
        int to = (int) Math.min((long) from + size, jobs.size());
        return new ArrayList<>(jobs.subList(from, to));
    }

    private boolean hasTag(BatchJobEntity job, String tag) {
        if (job.getTags() == null) {
            return false;
        }
        for (String candidate : job.getTags()) {
            if (StringUtils.equalsIgnoreCase(candidate, tag.trim())) {
                return true;
            }
        }
        return false;
    }

    private boolean hasTagContaining(BatchJobEntity job, String keyword) {
        if (job.getTags() == null) {
            return false;
        }
        for (String candidate : job.getTags()) {
            if (StringUtils.containsIgnoreCase(candidate, keyword)) {
                return true;
            }
        }
        return false;
    }
}
