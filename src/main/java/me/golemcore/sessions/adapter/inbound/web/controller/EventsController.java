package me.golemcore.sessions.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.sessions.domain.model.SessionEvent;
import me.golemcore.sessions.domain.service.SessionEventPublisher;
import me.golemcore.sessions.domain.service.SessionLifecycleService;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * Server-sent event streams for global and per-session notifications.
 */
@RestController
@RequiredArgsConstructor
public class EventsController {

    private final SessionEventPublisher eventPublisher;
    private final SessionLifecycleService lifecycleService;

    @GetMapping(value = "/api/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<SessionEvent>> globalEvents() {
        return eventPublisher.globalEvents().map(this::toSse);
    }

    @GetMapping(value = "/api/sessions/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<SessionEvent>> sessionEvents(@PathVariable String id) {
        lifecycleService.getInfo(id).orElseThrow();
        return eventPublisher.sessionEvents(id).map(this::toSse);
    }

    private ServerSentEvent<SessionEvent> toSse(SessionEvent event) {
        return ServerSentEvent.<SessionEvent>builder()
                .event(event.type().value())
                .data(event)
                .build();
    }
}
