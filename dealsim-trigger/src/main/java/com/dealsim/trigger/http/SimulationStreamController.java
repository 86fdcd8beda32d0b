package com.dealsim.trigger.http;

import com.dealsim.domain.queue.model.valobj.SimulationEvent;
import com.dealsim.trigger.application.query.SimulationQueueQueryService;
import com.dealsim.trigger.event.SimulationEventPublisher;
import com.google.common.util.concurrent.MoreExecutors;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Live SSE stream of one queue's events. Events published while nobody listens are not replayed.
 * <p>
 * Pushes share one pool, but each subscriber drains through its own sequential executor, so a
 * subscriber receives events in publish order.
 * </p>
 */
@Slf4j
@RestController
@RequestMapping("/api/simulation")
public class SimulationStreamController {

    private final SimulationEventPublisher simulationEventPublisher;
    private final SimulationQueueQueryService simulationQueueQueryService;
    private final ConcurrentMap<Long, ConcurrentMap<String, SseEmitter>> subscribersByQueue;
    private final ExecutorService pushExecutor;
    private final long emitterTimeoutMs;
    private final Counter ssePushAttemptCounter;
    private final Counter ssePushFailCounter;

    public SimulationStreamController(SimulationEventPublisher simulationEventPublisher,
                                      SimulationQueueQueryService simulationQueueQueryService,
                                      ObjectProvider<MeterRegistry> meterRegistryProvider,
                                      @Value("${sse.emitter-timeout-ms:1800000}") long emitterTimeoutMs) {
        this.simulationEventPublisher = simulationEventPublisher;
        this.simulationQueueQueryService = simulationQueueQueryService;
        this.subscribersByQueue = new ConcurrentHashMap<>();
        this.emitterTimeoutMs = emitterTimeoutMs <= 0 ? 30L * 60L * 1000L : emitterTimeoutMs;
        this.pushExecutor = Executors.newFixedThreadPool(4, runnable -> {
            Thread thread = new Thread(runnable, "simulation-stream-push");
            thread.setDaemon(true);
            return thread;
        });
        MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new);
        this.ssePushAttemptCounter = Counter.builder("simulation.sse.push.attempt.total").register(meterRegistry);
        this.ssePushFailCounter = Counter.builder("simulation.sse.push.fail.total").register(meterRegistry);
    }

    @GetMapping(value = "/queues/{id}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamQueue(@PathVariable("id") Long queueId) {
        SseEmitter emitter = new SseEmitter(emitterTimeoutMs);
        String subscriberId = UUID.randomUUID().toString();
        subscribersByQueue.computeIfAbsent(queueId, key -> new ConcurrentHashMap<>()).put(subscriberId, emitter);

        emitter.onCompletion(() -> removeSubscriber(queueId, subscriberId));
        emitter.onTimeout(() -> removeSubscriber(queueId, subscriberId));
        emitter.onError(ex -> removeSubscriber(queueId, subscriberId));

        sendEvent(emitter, "stream_ready", Map.of("queueId", queueId));
        sendSnapshot(queueId, emitter);
        Executor subscriberPushes = MoreExecutors.newSequentialExecutor(pushExecutor);
        simulationEventPublisher.subscribe(queueId, subscriberId, event -> {
            if (event == null) {
                return;
            }
            try {
                subscriberPushes.execute(() -> deliverEvent(queueId, subscriberId, event));
            } catch (RejectedExecutionException ex) {
                log.warn("SSE push rejected, dropping subscriber. queueId={}, subscriberId={}", queueId, subscriberId);
                removeSubscriber(queueId, subscriberId);
            }
        });
        return emitter;
    }

    @Scheduled(fixedDelayString = "${sse.heartbeat-interval-ms:15000}", scheduler = "daemonScheduler")
    public void emitHeartbeat() {
        if (subscribersByQueue.isEmpty()) {
            return;
        }
        for (Map.Entry<Long, ConcurrentMap<String, SseEmitter>> entry : subscribersByQueue.entrySet()) {
            Long queueId = entry.getKey();
            for (Map.Entry<String, SseEmitter> subscriber : entry.getValue().entrySet()) {
                if (!sendEvent(subscriber.getValue(), "heartbeat", Map.of("queueId", queueId))) {
                    removeSubscriber(queueId, subscriber.getKey());
                }
            }
        }
    }

    private void deliverEvent(Long queueId, String subscriberId, SimulationEvent event) {
        ConcurrentMap<String, SseEmitter> subscribers = subscribersByQueue.get(queueId);
        SseEmitter emitter = subscribers == null ? null : subscribers.get(subscriberId);
        if (emitter == null) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("queueId", event.getQueueId());
        payload.put("negotiationId", event.getNegotiationId());
        payload.put("timestamp", event.getTimestamp() == null ? null : event.getTimestamp().toString());
        payload.put("data", event.getData());
        synchronized (emitter) {
            if (!sendEvent(emitter, event.getType().getEventName(), payload)) {
                removeSubscriber(queueId, subscriberId);
            }
        }
    }

    private void sendSnapshot(Long queueId, SseEmitter emitter) {
        try {
            sendEvent(emitter, "queue_snapshot", simulationQueueQueryService.getQueueStatus(queueId));
        } catch (Exception ex) {
            log.debug("Queue snapshot unavailable. queueId={}, error={}", queueId, ex.getMessage());
        }
    }

    private void removeSubscriber(Long queueId, String subscriberId) {
        ConcurrentMap<String, SseEmitter> subscribers = subscribersByQueue.get(queueId);
        if (subscribers != null) {
            subscribers.remove(subscriberId);
            if (subscribers.isEmpty()) {
                subscribersByQueue.remove(queueId, subscribers);
            }
        }
        simulationEventPublisher.unsubscribe(queueId, subscriberId);
    }

    private boolean sendEvent(SseEmitter emitter, String name, Object data) {
        ssePushAttemptCounter.increment();
        try {
            emitter.send(SseEmitter.event().name(name).data(data));
            return true;
        } catch (IOException | RuntimeException ex) {
            ssePushFailCounter.increment();
            log.debug("SSE send failed: {}", ex.getMessage());
            return false;
        }
    }

    @PreDestroy
    public void shutdown() {
        pushExecutor.shutdownNow();
    }
}
