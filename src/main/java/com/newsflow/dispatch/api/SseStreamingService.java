package com.newsflow.dispatch.api;

import com.newsflow.core.events.EngineEvent;
import com.newsflow.core.events.EventBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Streams {@link EventBus} events of one run to an {@link SseEmitter}.
 * <p>
 * Each emitter subscribes to its run on connect and unsubscribes on completion,
 * timeout or error. The emitter is completed once the run completes or fails; a run
 * that suspends for review keeps its stream open so the events after the approval
 * arrive on the same connection. A heartbeat comment keeps idle connections open
 * through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes, long enough for a review round trip. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    static final Set<String> TERMINAL_EVENTS = Set.of("run.completed", "run.failed");

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // the emitter's own callbacks clean up closed connections
                log.debug("Heartbeat skipped for run {}: {}", registration.runId(), e.getMessage());
            }
        }
    }

    /**
     * Creates an emitter that receives every event published for {@code runId} from now on.
     */
    public SseEmitter createEmitter(String runId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        EventBus.Subscription subscription = eventBus.subscribe(runId, event -> forward(emitter, event));
        var registration = new EmitterRegistration(runId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for run {}", runId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for run {}: {}", runId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to confirm SSE connection for run {}: {}", runId, e.getMessage());
        }

        log.info("SSE emitter created for run {} (timeout={}ms)", runId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    /** The SSE data frame for an event. */
    static Map<String, Object> frame(EngineEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("runId", event.runId());
        if (event.node() != null) {
            data.put("node", event.node());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return data;
    }

    private void forward(SseEmitter emitter, EngineEvent event) {
        try {
            emitter.send(SseEmitter.event().name(event.eventType()).data(frame(event)));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for run {}: {}", event.eventType(), event.runId(), e.getMessage());
            return;
        }
        if (TERMINAL_EVENTS.contains(event.eventType())) {
            emitter.complete();
            activeRegistrations.stream()
                    .filter(r -> r.emitter() == emitter)
                    .findFirst()
                    .ifPresent(this::cleanup);
        }
    }

    private void cleanup(EmitterRegistration registration) {
        if (activeRegistrations.remove(registration)) {
            registration.subscription().unsubscribe();
            log.debug("Cleaned up SSE registration for run {}", registration.runId());
        }
    }

    private record EmitterRegistration(String runId, SseEmitter emitter, EventBus.Subscription subscription) {}
}
