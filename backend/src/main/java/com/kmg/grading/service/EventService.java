package com.kmg.grading.service;

import com.kmg.grading.dto.EventMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans batch and job lifecycle events out to Server-Sent-Event subscribers.
 */
@Service
public class EventService {
    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public EventService(Clock clock) {
        this.clock = clock;
    }

    public SseEmitter subscribe() {
        return register(new SseEmitter(0L));
    }

    SseEmitter register(SseEmitter emitter) {
        emitters.add(emitter);

        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(ex -> emitters.remove(emitter));

        return emitter;
    }

    public void publish(String type, String batchId, String message, Object payload) {
        EventMessage event = new EventMessage(type, batchId, message, OffsetDateTime.now(clock).toString(), payload);
        log.debug("{} [{}] {}", type, batchId, message);
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event().name(type).data(event));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping SSE subscriber after send failure: {}", e.getMessage());
                emitters.remove(emitter);
            }
        }
    }
}
