package me.golemcore.sessions.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.sessions.domain.model.MemoryChangedEvent;
import me.golemcore.sessions.domain.model.SessionEvent;
import me.golemcore.sessions.domain.model.SessionEventType;
import me.golemcore.sessions.infrastructure.event.SpringEventBus;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fans session events out to the global stream, per-session streams and the
 * application event bus.
 *
 * <p>
 * Streams are hot: subscribers only see events emitted after they subscribe.
 * A slow subscriber misses events rather than blocking publishers.
 */
@Service
@Slf4j
public class SessionEventPublisher {

    private final SpringEventBus eventBus;
    private final Clock clock;
    private final Sinks.Many<SessionEvent> globalSink = Sinks.many().multicast().directBestEffort();
    private final Map<String, Sinks.Many<SessionEvent>> sessionSinks = new ConcurrentHashMap<>();

    public SessionEventPublisher(SpringEventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public SessionEvent emit(SessionEventType type, String sessionId, Map<String, Object> payload) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("session_id", sessionId);
        if (payload != null) {
            body.putAll(payload);
        }
        SessionEvent event = SessionEvent.builder()
                .type(type)
                .timestamp(clock.instant())
                .sessionId(sessionId)
                .payload(body)
                .build();

        if (type.isGlobal()) {
            emitTo(globalSink, event);
        }
        if (type.isSessionScoped() && sessionId != null) {
            Sinks.Many<SessionEvent> sink = sessionSinks.get(sessionId);
            if (sink != null) {
                emitTo(sink, event);
            }
        }
        try {
            eventBus.publish(event);
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[Events] Listener failed for {}: {}", type.value(), e.getMessage());
        }
        return event;
    }

    public Flux<SessionEvent> globalEvents() {
        return globalSink.asFlux();
    }

    /**
     * Stream of events for one session. Completes when the session is closed.
     */
    public Flux<SessionEvent> sessionEvents(String sessionId) {
        return sessionSinks.computeIfAbsent(sessionId, id -> Sinks.many().multicast().directBestEffort())
                .asFlux();
    }

    /**
     * Completes and drops the per-session stream.
     */
    public void closeSession(String sessionId) {
        Sinks.Many<SessionEvent> sink = sessionSinks.remove(sessionId);
        if (sink != null) {
            synchronized (sink) {
                sink.tryEmitComplete();
            }
        }
    }

    @EventListener
    public void onMemoryChanged(MemoryChangedEvent event) {
        if (event.kind() == MemoryChangedEvent.Kind.STORED || event.kind() == MemoryChangedEvent.Kind.UPDATED) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("memory_id", event.memoryId());
            payload.put("type", event.type() != null ? event.type().value() : null);
            emit(SessionEventType.MEMORY_STORED, event.sessionId(), payload);
        }
    }

    private static void emitTo(Sinks.Many<SessionEvent> sink, SessionEvent event) {
        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(event);
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("[Events] Dropped {} for {}: {}", event.type().value(), event.sessionId(), result);
        }
    }
}
