package me.golemcore.sessions.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionDto {
    private String sessionId;
    private String status;
    private int maxConversations;
    private int timeoutMinutes;
    private boolean persistenceEnabled;
    private Set<String> features;
    private Map<String, Object> llmConfig;
    private Map<String, Object> metadata;
    private Instant createdAt;
    private Instant updatedAt;
    private List<String> activeTasks;
    private int conversationCount;
    private String error;
}
