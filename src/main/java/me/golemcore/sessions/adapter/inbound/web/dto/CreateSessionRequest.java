package me.golemcore.sessions.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSessionRequest {
    private Integer maxConversations;
    private Integer timeoutMinutes;
    private Boolean persistenceEnabled;
    private List<String> features;
    private Map<String, Object> llmConfig;
    private Map<String, Object> metadata;
}
