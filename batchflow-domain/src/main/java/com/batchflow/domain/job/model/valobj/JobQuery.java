package com.batchflow.domain.job.model.valobj;

import com.batchflow.types.enums.JobPriorityEnum;
import com.batchflow.types.enums.JobSortFieldEnum;
import com.batchflow.types.enums.JobStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * 作业列表查询条件。所有条件可空，空值表示不过滤。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobQuery {

    private Set<JobStatusEnum> statuses;
    private JobPriorityEnum priority;
    private String type;
    private String ownerId;
    private String tag;

    /**
     * 名称/类型/标签关键字，忽略大小写
     */
    private String keyword;

    private JobSortFieldEnum sortBy;

    /**
     * 默认降序
     */
    private boolean ascending;

    private Integer offset;
    private Integer limit;

    public static JobQuery all() {
        return new JobQuery();
    }
}
