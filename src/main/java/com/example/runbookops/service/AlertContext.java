package com.example.runbookops.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * What an inbound alert contributes to a job besides the schema itself.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertContext {

    private String schemaId;
    private String monitorCondition;
    private String severity;
    @Builder.Default
    private Map<String, String> resourceInfo = new HashMap<>();
    @Builder.Default
    private Map<String, String> routingInfo = new HashMap<>();

    public static AlertContext manual(String schemaId) {
        return AlertContext.builder().schemaId(schemaId).build();
    }
}
