/**
 * Job 领域 - 批处理作业编排域
 *
 * <p>职责：作业生命周期、任务重试策略、进度聚合、作业查询与统计</p>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.batchflow.domain.job.model.entity.BatchJobEntity}</li>
 * </ul>
 *
 * <h3>核心实体</h3>
 * <ul>
 *   <li>BatchJob - 作业，独占其任务</li>
 *   <li>JobTask - 任务，可独立重试</li>
 *   <li>JobEvent - 作业增量事件</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>JobProgressDomainService - 计数与进度聚合</li>
 *   <li>JobTransitionDomainService - 自动状态推进与操作许可</li>
 *   <li>DefaultRetryPolicy - 失败重试决策</li>
 *   <li>JobQueryDomainService / JobStatsDomainService - 过滤排序与统计</li>
 * </ul>
 */
package com.batchflow.domain.job;
