package me.golemcore.sessions.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Promotion request. {@code all=true} promotes every pending item regardless
 * of the criteria; unset criteria fall back to the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromoteRequest {
    private Boolean all;
    private Double minImportance;
    private Long maxAgeSeconds;
    private Double minConfidence;
    private Integer batchSize;
}
