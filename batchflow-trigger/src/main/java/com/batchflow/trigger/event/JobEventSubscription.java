package com.batchflow.trigger.event;

/**
 * 推送订阅句柄。
 */
public interface JobEventSubscription {

    String subscriberId();

    /**
     * 取消订阅；已入队但未投递的事件被丢弃。重复调用无副作用。
     */
    void unsubscribe();
}
