package com.keystone.dispatch.api;

import com.keystone.core.events.EventBus;
import com.keystone.core.events.EventTypes;
import com.keystone.core.events.PipelineEvent;
import com.keystone.core.model.AttemptState;
import com.keystone.core.model.Verdict;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Streams the pipeline events of one submission to SSE clients.
 * <p>
 * Streams are completed once the submission can no longer change: a REJECT verdict
 * or an attempt that ends COMPLETED. Failed and rolled-back attempts keep the stream
 * open since the submission may be integrated again.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;
    private static final long KEEPALIVE_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;
    private final Map<String, List<Stream>> streamsBySubmission = new ConcurrentHashMap<>();
    private final ScheduledExecutorService keepalive = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-keepalive");
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
    void start() {
        keepalive.scheduleAtFixedRate(this::pingAll, KEEPALIVE_SECONDS, KEEPALIVE_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stop() {
        keepalive.shutdownNow();
        streamsBySubmission.values().forEach(streams -> streams.forEach(s -> s.emitter().complete()));
        streamsBySubmission.clear();
    }

    public SseEmitter createEmitter(String submissionId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        Stream[] holder = new Stream[1];
        EventBus.Subscription subscription = eventBus.subscribe(submissionId, event -> forward(holder[0], event));
        Stream stream = new Stream(submissionId, emitter, subscription);
        holder[0] = stream;
        streamsBySubmission.computeIfAbsent(submissionId, k -> new CopyOnWriteArrayList<>()).add(stream);

        emitter.onCompletion(() -> detach(stream));
        emitter.onTimeout(() -> detach(stream));
        emitter.onError(ex -> {
            log.debug("SSE stream for {} failed: {}", submissionId, ex.getMessage());
            detach(stream);
        });

        try {
            emitter.send(SseEmitter.event().comment("subscribed " + submissionId));
        } catch (IOException e) {
            log.debug("SSE client for {} went away before the first write", submissionId);
            detach(stream);
        }
        return emitter;
    }

    public int activeEmitterCount() {
        return streamsBySubmission.values().stream().mapToInt(List::size).sum();
    }

    int activeEmitterCount(String submissionId) {
        List<Stream> streams = streamsBySubmission.get(submissionId);
        return streams == null ? 0 : streams.size();
    }

    /** True for the events after which nothing more will be published for the submission. */
    static boolean isFinal(PipelineEvent event) {
        Object value = switch (event.eventType()) {
            case EventTypes.VERIFICATION_COMPLETED -> event.payload().get("verdict");
            case EventTypes.INTEGRATION_COMPLETED -> event.payload().get("state");
            default -> null;
        };
        return Verdict.REJECT.name().equals(value) || AttemptState.COMPLETED.name().equals(value);
    }

    private void forward(Stream stream, PipelineEvent event) {
        if (stream == null) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("submissionId", event.submissionId());
        if (event.attemptId() != null) {
            data.put("attemptId", event.attemptId());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        try {
            stream.emitter().send(SseEmitter.event().name(event.eventType()).data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping {} for {}: {}", event.eventType(), event.submissionId(), e.getMessage());
            detach(stream);
            return;
        }
        if (isFinal(event)) {
            stream.emitter().complete();
            detach(stream);
        }
    }

    private void pingAll() {
        streamsBySubmission.values().forEach(streams -> streams.forEach(stream -> {
            try {
                stream.emitter().send(SseEmitter.event().comment("keepalive"));
            } catch (IOException | IllegalStateException e) {
                detach(stream);
            }
        }));
    }

    private void detach(Stream stream) {
        stream.subscription().unsubscribe();
        streamsBySubmission.computeIfPresent(stream.submissionId(), (id, streams) -> {
            streams.remove(stream);
            return streams.isEmpty() ? null : streams;
        });
    }

    private record Stream(String submissionId, SseEmitter emitter, EventBus.Subscription subscription) {}
}
