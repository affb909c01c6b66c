package com.batchflow.trigger.event;

import com.batchflow.domain.job.model.entity.JobEventEntity;

import java.util.List;

/**
 * 历史回放结果。
 *
 * @param events         游标之后仍保留的事件，按序号升序
 * @param gap            游标已滑出保留窗口，消费者需通过快照对账
 * @param latestSequence 当前最新序号
 */
public record JobEventReplay(List<JobEventEntity> events, boolean gap, long latestSequence) {
}
