package com.example.runbookops.routing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * One entry of a rule's {@code then} list, before credentials are resolved.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActionSpec {
    private ActionType type;
    private String team;
    private String channel;
    @ToString.Exclude
    private String token;
    @ToString.Exclude
    private String apiKey;
}
