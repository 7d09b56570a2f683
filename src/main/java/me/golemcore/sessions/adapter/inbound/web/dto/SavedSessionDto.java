package me.golemcore.sessions.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SavedSessionDto {
    private String sessionId;
    private String status;
    private int conversationCount;
    private Map<String, Object> metadata;
    private Instant savedAt;
}
