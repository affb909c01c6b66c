package com.batchflow.trigger.http;

import com.batchflow.domain.job.model.entity.JobEventEntity;
import com.batchflow.domain.job.model.valobj.JobSnapshot;
import com.batchflow.trigger.application.common.JobViewAssembler;
import com.batchflow.trigger.event.JobEventReplay;
import com.batchflow.trigger.event.JobEventSubscription;
import com.batchflow.trigger.service.JobOrchestratorService;
import com.batchflow.types.enums.JobEventTypeEnum;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 作业 SSE 增量流：连接时按 Last-Event-ID 回放，游标超出历史窗口时先下发全量快照。
 */
@Slf4j
@RestController
@RequestMapping("/api/jobs")
public class JobStreamController {

    static final String EVENT_READY = "stream_ready";
    static final String EVENT_SNAPSHOT = "snapshot";
    static final String EVENT_HEARTBEAT = "heartbeat";

    private final JobOrchestratorService jobOrchestratorService;
    private final JobViewAssembler jobViewAssembler;
    private final ConcurrentMap<String, SubscriberState> subscribers = new ConcurrentHashMap<>();
    private final long emitterTimeoutMs;
    private final Counter pushAttemptCounter;
    private final Counter pushFailCounter;
    private final Counter replayGapCounter;
    private final Counter resyncCounter;

    public JobStreamController(JobOrchestratorService jobOrchestratorService,
                               JobViewAssembler jobViewAssembler,
                               ObjectProvider<MeterRegistry> meterRegistryProvider,
                               @Value("${batchflow.sse.emitter-timeout-ms:1800000}") long emitterTimeoutMs) {
        this.jobOrchestratorService = jobOrchestratorService;
        this.jobViewAssembler = jobViewAssembler;
        this.emitterTimeoutMs = emitterTimeoutMs > 0 ? emitterTimeoutMs : 30L * 60L * 1000L;
        MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new);
        this.pushAttemptCounter = Counter.builder("batchflow.sse.push.attempt.total").register(meterRegistry);
        this.pushFailCounter = Counter.builder("batchflow.sse.push.fail.total").register(meterRegistry);
        this.replayGapCounter = Counter.builder("batchflow.sse.replay.gap.total").register(meterRegistry);
        this.resyncCounter = Counter.builder("batchflow.sse.resync.total").register(meterRegistry);
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(value = "lastEventId", required = false) Long lastEventIdParam,
                             @RequestHeader(value = "Last-Event-ID", required = false) String lastEventIdHeader) {
        SseEmitter emitter = new SseEmitter(emitterTimeoutMs);
        String streamId = UUID.randomUUID().toString();
        long cursor = resolveCursor(lastEventIdParam, lastEventIdHeader);
        SubscriberState state = new SubscriberState(emitter, cursor);
        subscribers.put(streamId, state);

        emitter.onCompletion(() -> removeSubscriber(streamId));
        emitter.onTimeout(() -> removeSubscriber(streamId));
        emitter.onError(ex -> removeSubscriber(streamId));

        synchronized (state) {
            // 先订阅再回放，回放与实时事件按序号去重
            state.subscription = jobOrchestratorService.subscribe(event -> deliverEvent(streamId, event));
            sendEvent(emitter, EVENT_READY, Map.of("lastEventId", cursor), null);
            if (cursor <= 0L) {
                sendSnapshot(state);
            } else {
                replay(streamId, state);
            }
        }
        return emitter;
    }

    private void replay(String streamId, SubscriberState state) {
        JobEventReplay replay = jobOrchestratorService.replayEvents(state.lastEventId.get());
        if (replay.gap()) {
            replayGapCounter.increment();
            log.debug("SSE cursor fell out of history window, sending snapshot. streamId={}, cursor={}, latest={}",
                    streamId, state.lastEventId.get(), replay.latestSequence());
            sendSnapshot(state);
            return;
        }
        for (JobEventEntity event : replay.events()) {
            if (!deliverLocked(state, event)) {
                removeSubscriber(streamId);
                return;
            }
        }
    }

    private boolean sendSnapshot(SubscriberState state) {
        JobSnapshot snapshot = jobOrchestratorService.snapshot();
        if (!sendEvent(state.emitter, EVENT_SNAPSHOT, jobViewAssembler.toSnapshotDTO(snapshot), snapshot.sequence())) {
            return false;
        }
        state.lastEventId.updateAndGet(previous -> Math.max(previous, snapshot.sequence()));
        return true;
    }

    private void deliverEvent(String streamId, JobEventEntity event) {
        SubscriberState state = subscribers.get(streamId);
        if (state == null || event == null || event.getSequence() == null) {
            return;
        }
        synchronized (state) {
            if (!deliverLocked(state, event)) {
                removeSubscriber(streamId);
            }
        }
    }

    private boolean deliverLocked(SubscriberState state, JobEventEntity event) {
        long sequence = event.getSequence();
        if (sequence <= state.lastEventId.get()) {
            return true;
        }
        if (event.getEventType() == JobEventTypeEnum.RESYNC_REQUIRED) {
            resyncCounter.increment();
            log.debug("SSE subscriber backlog dropped, sending snapshot. throughSequence={}", sequence);
            if (!sendSnapshot(state)) {
                return false;
            }
            state.lastEventId.updateAndGet(previous -> Math.max(previous, sequence));
            return true;
        }
        String name = event.getEventType() == null ? "job_event" : event.getEventType().getEventName();
        if (!sendEvent(state.emitter, name, jobViewAssembler.toEventDTO(event), sequence)) {
            return false;
        }
        state.lastEventId.set(sequence);
        return true;
    }

    @Scheduled(fixedDelayString = "${batchflow.sse.heartbeat-interval-ms:10000}", scheduler = "daemonScheduler")
    public void emitHeartbeat() {
        if (subscribers.isEmpty()) {
            return;
        }
        for (Map.Entry<String, SubscriberState> entry : subscribers.entrySet()) {
            SubscriberState state = entry.getValue();
            boolean sent;
            synchronized (state) {
                sent = sendEvent(state.emitter, EVENT_HEARTBEAT, Map.of("lastEventId", state.lastEventId.get()), null);
            }
            if (!sent) {
                removeSubscriber(entry.getKey());
            }
        }
    }

    public int activeStreams() {
        return subscribers.size();
    }

    private long resolveCursor(Long lastEventIdParam, String lastEventIdHeader) {
        long headerCursor = parseCursor(lastEventIdHeader);
        if (headerCursor > 0L) {
            return headerCursor;
        }
        return lastEventIdParam == null ? 0L : Math.max(lastEventIdParam, 0L);
    }

    private long parseCursor(String cursorText) {
        if (cursorText == null || cursorText.isBlank()) {
            return 0L;
        }
        try {
            return Math.max(Long.parseLong(cursorText.trim()), 0L);
        } catch (NumberFormatException ex) {
            log.debug("Invalid Last-Event-ID ignored. value={}", cursorText);
            return 0L;
        }
    }

    private void removeSubscriber(String streamId) {
        SubscriberState state = subscribers.remove(streamId);
        if (state != null && state.subscription != null) {
            state.subscription.unsubscribe();
        }
    }

    private boolean sendEvent(SseEmitter emitter, String name, Object data, Long eventId) {
        pushAttemptCounter.increment();
        try {
            SseEmitter.SseEventBuilder builder = SseEmitter.event().name(name).data(data);
            if (eventId != null) {
                builder.id(String.valueOf(eventId));
            }
            emitter.send(builder);
            return true;
        } catch (IOException | RuntimeException ex) {
            pushFailCounter.increment();
            log.debug("SSE send failed. event={}, error={}", name, ex.getMessage());
            return false;
        }
    }

    @PreDestroy
    public void shutdown() {
        for (String streamId : subscribers.keySet()) {
            SubscriberState state = subscribers.get(streamId);
            removeSubscriber(streamId);
            if (state != null) {
                state.emitter.complete();
            }
        }
    }

    private static final class SubscriberState {
        private final SseEmitter emitter;
        private final AtomicLong lastEventId;
        private volatile JobEventSubscription subscription;

        private SubscriberState(SseEmitter emitter, long lastEventId) {
            this.emitter = emitter;
            this.lastEventId = new AtomicLong(Math.max(lastEventId, 0L));
        }
    }
}
