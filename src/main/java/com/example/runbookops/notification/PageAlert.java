package com.example.runbookops.notification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Paging alert. With {@code close} set, the alert identified by {@code alias} is closed instead of created.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageAlert {
    private String message;
    private String alias;
    private String priority;
    private String description;
    @Builder.Default
    private Map<String, String> details = new HashMap<>();
    private boolean close;
}
