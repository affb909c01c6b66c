package com.batchflow.domain.job.adapter.gateway;

import com.batchflow.domain.job.model.valobj.TaskRunContext;
import com.batchflow.domain.job.model.valobj.TaskRunResult;

/**
 * 任务执行边界：承载单个任务的实际工作。
 * <p>
 * 实现在工作线程中被调用，可以阻塞；应定期检查 {@link TaskRunContext#isAborted()}，
 * 抛出异常或返回失败结果都会交给重试策略处理。
 * </p>
 */
public interface ITaskRunner {

    /**
     * 支持的作业类型
     */
    String taskType();

    TaskRunResult execute(TaskRunContext context) throws Exception;
}
