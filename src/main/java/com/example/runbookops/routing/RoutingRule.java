package com.example.runbookops.routing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RoutingRule {

    @Builder.Default
    private RuleCondition when = new RuleCondition();

    @Builder.Default
    private List<ActionSpec> then = new ArrayList<>();
}
