package com.batchflow.domain.job.model.valobj;

/**
 * 单次执行的中止信号。取消、超时或提前终止时置位，Runner 自行轮询。
 */
public final class AbortSignal {

    private volatile boolean aborted;
    private volatile String reason;

    public void abort(String reason) {
        if (aborted) {
            return;
        }
        this.reason = reason;
        this.aborted = true;
    }

    public boolean isAborted() {
        return aborted;
    }

    public String getReason() {
        return reason;
    }
}
