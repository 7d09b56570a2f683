package me.golemcore.sessions.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sessions.adapter.inbound.web.dto.CreateSessionRequest;
import me.golemcore.sessions.adapter.inbound.web.dto.MessageDto;
import me.golemcore.sessions.adapter.inbound.web.dto.PromoteRequest;
import me.golemcore.sessions.adapter.inbound.web.dto.SavedSessionDto;
import me.golemcore.sessions.adapter.inbound.web.dto.SendMessageRequest;
import me.golemcore.sessions.adapter.inbound.web.dto.SessionDto;
import me.golemcore.sessions.domain.model.CreateSessionOptions;
import me.golemcore.sessions.domain.model.EnrichOptions;
import me.golemcore.sessions.domain.model.EnrichedContext;
import me.golemcore.sessions.domain.model.ErrorCode;
import me.golemcore.sessions.domain.model.Message;
import me.golemcore.sessions.domain.model.MemoryType;
import me.golemcore.sessions.domain.model.MessageRole;
import me.golemcore.sessions.domain.model.PendingMemoryItem;
import me.golemcore.sessions.domain.model.PromotionOptions;
import me.golemcore.sessions.domain.model.PromotionResult;
import me.golemcore.sessions.domain.model.RetrievalQuery;
import me.golemcore.sessions.domain.model.SavedSession;
import me.golemcore.sessions.domain.model.ScoredMemory;
import me.golemcore.sessions.domain.model.SessionConfig;
import me.golemcore.sessions.domain.model.SessionException;
import me.golemcore.sessions.domain.model.SessionState;
import me.golemcore.sessions.domain.model.SessionUpdate;
import me.golemcore.sessions.domain.service.MemoryPromotionService;
import me.golemcore.sessions.domain.service.SessionLifecycleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Sessions management, conversation, working context and memory endpoints.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionsController {

    private static final int DEFAULT_MESSAGE_LIMIT = 20;

    private final SessionLifecycleService lifecycleService;
    private final MemoryPromotionService promotionService;

    // ==================== sessions ====================

    @PostMapping
    public Mono<ResponseEntity<SessionDto>> createSession(@RequestBody(required = false) CreateSessionRequest request) {
        return blocking(() -> {
            String sessionId = lifecycleService.create(toOptions(request)).orElseThrow();
            SessionState state = lifecycleService.getInfo(sessionId).orElseThrow();
            return ResponseEntity.status(HttpStatus.CREATED).body(toDto(state));
        });
    }

    @GetMapping
    public Mono<ResponseEntity<List<SessionDto>>> listSessions() {
        List<SessionDto> sessions = lifecycleService.list().stream()
                .map(this::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(sessions));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<SessionDto>> getSession(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(toDto(lifecycleService.getInfo(id).orElseThrow())));
    }

    @PatchMapping("/{id}")
    public Mono<ResponseEntity<SessionDto>> updateSession(@PathVariable String id, @RequestBody SessionUpdate update) {
        return Mono.just(ResponseEntity.ok(toDto(lifecycleService.update(id, update).orElseThrow())));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> terminateSession(@PathVariable String id) {
        return blocking(() -> {
            lifecycleService.terminate(id).orElseThrow();
            return ResponseEntity.noContent().build();
        });
    }

    @PostMapping("/{id}/idle")
    public Mono<ResponseEntity<SessionDto>> markIdle(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(toDto(lifecycleService.markIdle(id).orElseThrow())));
    }

    @PostMapping("/{id}/activate")
    public Mono<ResponseEntity<SessionDto>> markActive(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(toDto(lifecycleService.markActive(id).orElseThrow())));
    }

    // ==================== conversation ====================

    @PostMapping("/{id}/messages")
    public Mono<ResponseEntity<MessageDto>> sendMessage(@PathVariable String id,
            @RequestBody SendMessageRequest request) {
        if (request == null || request.getContent() == null) {
            throw new SessionException(ErrorCode.MISSING_FIELDS, "Message content is required",
                    Map.of("missing", List.of("content")));
        }
        MessageRole role = request.getRole() != null ? MessageRole.fromValue(request.getRole()) : MessageRole.USER;
        return blocking(() -> {
            Message message = lifecycleService.sendMessage(id, role, request.getContent()).orElseThrow();
            return ResponseEntity.status(HttpStatus.CREATED).body(toDto(message));
        });
    }

    @GetMapping("/{id}/messages")
    public Mono<ResponseEntity<List<MessageDto>>> recentMessages(@PathVariable String id,
            @RequestParam(required = false) Integer limit) {
        int effective = limit != null && limit > 0 ? limit : DEFAULT_MESSAGE_LIMIT;
        return blocking(() -> ResponseEntity.ok(lifecycleService.recentMessages(id, effective).orElseThrow()
                .stream()
                .map(this::toDto)
                .toList()));
    }

    @DeleteMapping("/{id}/messages")
    public Mono<ResponseEntity<Void>> clearConversation(@PathVariable String id) {
        return blocking(() -> {
            lifecycleService.clearConversation(id).orElseThrow();
            return ResponseEntity.noContent().build();
        });
    }

    // ==================== working context ====================

    @PutMapping("/{id}/context/{key}")
    public Mono<ResponseEntity<Map<String, Object>>> putContext(@PathVariable String id, @PathVariable String key,
            @RequestBody Object value) {
        return blocking(() -> {
            Optional<String> evicted = lifecycleService.putContext(id, key, value).orElseThrow();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("key", key);
            body.put("evicted", evicted.orElse(null));
            return ResponseEntity.ok(body);
        });
    }

    @GetMapping("/{id}/context")
    public Mono<ResponseEntity<Map<String, Object>>> listContext(@PathVariable String id) {
        return blocking(() -> ResponseEntity.ok(lifecycleService.listContext(id).orElseThrow()));
    }

    @GetMapping("/{id}/context/{key}")
    public Mono<ResponseEntity<Object>> getContext(@PathVariable String id, @PathVariable String key) {
        return blocking(() -> {
            Object value = lifecycleService.getContext(id, key).orElseThrow();
            if (value == null) {
                return ResponseEntity.notFound().build();
            }
            return ResponseEntity.ok(value);
        });
    }

    @DeleteMapping("/{id}/context/{key}")
    public Mono<ResponseEntity<Void>> deleteContext(@PathVariable String id, @PathVariable String key) {
        return blocking(() -> {
            boolean removed = lifecycleService.deleteContext(id, key).orElseThrow();
            return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
        });
    }

    // ==================== memory ====================

    @PostMapping("/{id}/memories/pending")
    public Mono<ResponseEntity<PendingMemoryItem>> enqueueMemory(@PathVariable String id,
            @RequestBody Map<String, Object> body) {
        PendingMemoryItem item = toPendingItem(body);
        return blocking(() -> ResponseEntity.status(HttpStatus.CREATED)
                .body(lifecycleService.enqueueMemory(id, item).orElseThrow()));
    }

    @GetMapping("/{id}/memories/pending")
    public Mono<ResponseEntity<List<PendingMemoryItem>>> pendingMemories(@PathVariable String id) {
        return blocking(() -> ResponseEntity.ok(lifecycleService.pendingMemories(id).orElseThrow()));
    }

    @GetMapping("/{id}/memories/summary")
    public Mono<ResponseEntity<Map<String, Object>>> shortTermSummary(@PathVariable String id) {
        return blocking(() -> ResponseEntity.ok(lifecycleService.shortTermSummary(id).orElseThrow()));
    }

    @PostMapping("/{id}/memories/promote")
    public Mono<ResponseEntity<PromotionResult>> promote(@PathVariable String id,
            @RequestBody(required = false) PromoteRequest request) {
        return blocking(() -> {
            PromotionResult result;
            if (request != null && Boolean.TRUE.equals(request.getAll())) {
                result = lifecycleService.promoteAll(id).orElseThrow();
            } else {
                result = lifecycleService.promote(id, toPromotionOptions(request)).orElseThrow();
            }
            return ResponseEntity.ok(result);
        });
    }

    @GetMapping("/{id}/memories/search")
    public Mono<ResponseEntity<List<ScoredMemory>>> search(@PathVariable String id,
            @RequestParam(required = false) String keywords,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) Double minImportance,
            @RequestParam(required = false) Integer limit) {
        RetrievalQuery query = toQuery(keywords, type, minImportance, limit);
        return blocking(() -> ResponseEntity.ok(lifecycleService.search(id, query).orElseThrow()));
    }

    @GetMapping("/{id}/memories/context")
    public Mono<ResponseEntity<EnrichedContext>> enrichContext(@PathVariable String id,
            @RequestParam(required = false) String keywords,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) Double minImportance,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer maxTokens,
            @RequestParam(required = false) String groupBy) {
        RetrievalQuery query = toQuery(keywords, type, minImportance, limit);
        EnrichOptions options = EnrichOptions.builder()
                .maxTokens(maxTokens)
                .groupBy(parseGroupBy(groupBy))
                .build();
        return blocking(() -> ResponseEntity.ok(lifecycleService.enrichContext(id, query, options).orElseThrow()));
    }

    // ==================== saved sessions ====================

    @PostMapping("/{id}/save")
    public Mono<ResponseEntity<SavedSessionDto>> saveSession(@PathVariable String id) {
        return blocking(() -> ResponseEntity.ok(toDto(lifecycleService.save(id).orElseThrow())));
    }

    @GetMapping("/saved")
    public Mono<ResponseEntity<List<SavedSessionDto>>> listSaved() {
        return blocking(() -> ResponseEntity.ok(lifecycleService.listSaved().orElseThrow().stream()
                .map(this::toDto)
                .toList()));
    }

    @PostMapping("/saved/{savedId}/restore")
    public Mono<ResponseEntity<SessionDto>> restoreSession(@PathVariable String savedId) {
        return blocking(() -> {
            String sessionId = lifecycleService.restore(savedId).orElseThrow();
            SessionState state = lifecycleService.getInfo(sessionId).orElseThrow();
            return ResponseEntity.status(HttpStatus.CREATED).body(toDto(state));
        });
    }

    @DeleteMapping("/saved/{savedId}")
    public Mono<ResponseEntity<Void>> deleteSaved(@PathVariable String savedId) {
        return blocking(() -> {
            lifecycleService.deleteSaved(savedId).orElseThrow();
            return ResponseEntity.noContent().build();
        });
    }

    // ==================== mapping ====================

    private <T> Mono<T> blocking(Callable<T> action) {
        return Mono.fromCallable(action).subscribeOn(Schedulers.boundedElastic());
    }

    private CreateSessionOptions toOptions(CreateSessionRequest request) {
        if (request == null) {
            return CreateSessionOptions.defaults();
        }
        SessionConfig config = new SessionConfig();
        if (request.getMaxConversations() != null) {
            config.setMaxConversations(request.getMaxConversations());
        }
        if (request.getTimeoutMinutes() != null) {
            config.setTimeoutMinutes(request.getTimeoutMinutes());
        }
        if (request.getPersistenceEnabled() != null) {
            config.setPersistenceEnabled(request.getPersistenceEnabled());
        }
        if (request.getFeatures() != null) {
            config.setFeatures(new LinkedHashSet<>(request.getFeatures()));
        }
        return CreateSessionOptions.builder()
                .config(config)
                .llmConfig(request.getLlmConfig() != null
                        ? new LinkedHashMap<>(request.getLlmConfig())
                        : new LinkedHashMap<>())
                .metadata(request.getMetadata() != null
                        ? new LinkedHashMap<>(request.getMetadata())
                        : new LinkedHashMap<>())
                .build();
    }

    private PendingMemoryItem toPendingItem(Map<String, Object> body) {
        if (body == null) {
            throw new SessionException(ErrorCode.MISSING_FIELDS, "Request body is required",
                    Map.of("missing", List.of("id", "data")));
        }
        PendingMemoryItem.PendingMemoryItemBuilder builder = PendingMemoryItem.builder();
        Object id = body.get("id");
        if (id != null) {
            builder.id(id.toString());
        }
        Object type = body.get("type");
        if (type != null) {
            builder.type(MemoryType.parse(type.toString())
                    .orElseThrow(() -> new SessionException(ErrorCode.INVALID_TYPE,
                            "Unknown memory type: " + type, Map.of("type", type.toString()))));
        }
        if (body.containsKey("data")) {
            builder.data(body.get("data"));
        }
        Object importance = body.get("importance");
        if (importance instanceof Number number) {
            builder.importance(number.doubleValue());
        } else if (importance != null) {
            throw new SessionException(ErrorCode.INVALID_IMPORTANCE, "Importance must be a number",
                    Map.of("importance", importance.toString()));
        }
        return builder.build();
    }

    private PromotionOptions toPromotionOptions(PromoteRequest request) {
        PromotionOptions defaults = promotionService.defaultOptions();
        if (request == null) {
            return defaults;
        }
        PromotionOptions.PromotionOptionsBuilder builder = defaults.toBuilder();
        if (request.getMinImportance() != null) {
            builder.minImportance(request.getMinImportance());
        }
        if (request.getMaxAgeSeconds() != null) {
            builder.maxAgeSeconds(request.getMaxAgeSeconds());
        }
        if (request.getMinConfidence() != null) {
            builder.minConfidence(request.getMinConfidence());
        }
        if (request.getBatchSize() != null) {
            builder.batchSize(request.getBatchSize());
        }
        return builder.build();
    }

    private RetrievalQuery toQuery(String keywords, String type, Double minImportance, Integer limit) {
        List<String> parsedKeywords = new ArrayList<>();
        if (keywords != null && !keywords.isBlank()) {
            Arrays.stream(keywords.split("[,\\s]+"))
                    .filter(keyword -> !keyword.isBlank())
                    .forEach(parsedKeywords::add);
        }
        MemoryType parsedType = null;
        if (type != null && !type.isBlank()) {
            parsedType = MemoryType.parse(type)
                    .orElseThrow(() -> new SessionException(ErrorCode.INVALID_TYPE, "Unknown memory type: " + type,
                            Map.of("type", type)));
        }
        return RetrievalQuery.builder()
                .keywords(parsedKeywords)
                .type(parsedType)
                .minImportance(minImportance)
                .limit(limit)
                .build();
    }

    private EnrichOptions.GroupBy parseGroupBy(String groupBy) {
        if (groupBy == null || groupBy.isBlank()) {
            return EnrichOptions.GroupBy.NONE;
        }
        try {
            return EnrichOptions.GroupBy.valueOf(groupBy.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new SessionException(ErrorCode.INVALID_TYPE, "Unknown grouping: " + groupBy,
                    Map.of("group_by", groupBy));
        }
    }

    private SessionDto toDto(SessionState state) {
        SessionConfig config = state.getConfig() != null ? state.getConfig() : new SessionConfig();
        return SessionDto.builder()
                .sessionId(state.getSessionId())
                .status(state.getStatus().value())
                .maxConversations(config.getMaxConversations())
                .timeoutMinutes(config.getTimeoutMinutes())
                .persistenceEnabled(config.isPersistenceEnabled())
                .features(config.getFeatures())
                .llmConfig(state.getLlmConfig())
                .metadata(state.getMetadata())
                .createdAt(state.getCreatedAt())
                .updatedAt(state.getUpdatedAt())
                .activeTasks(state.getActiveTasks())
                .conversationCount(state.getConversationCount())
                .error(state.getError())
                .build();
    }

    private MessageDto toDto(Message message) {
        return MessageDto.builder()
                .role(message.getRole().value())
                .content(message.getContent())
                .timestamp(message.getTimestamp())
                .estimatedTokens(message.getEstimatedTokens())
                .build();
    }

    private SavedSessionDto toDto(SavedSession saved) {
        SessionState state = saved.getState();
        return SavedSessionDto.builder()
                .sessionId(saved.getSessionId())
                .status(state != null && state.getStatus() != null ? state.getStatus().value() : null)
                .conversationCount(state != null ? state.getConversationCount() : 0)
                .metadata(state != null ? state.getMetadata() : Map.of())
                .savedAt(saved.getSavedAt())
                .build();
    }
}
