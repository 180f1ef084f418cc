package com.example.runbookops.routing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * The {@code when} clause of a routing rule. Every predicate that is set must hold.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RuleCondition {

    /** {@code "*"} matches every context, status included. */
    private String any;

    /** Null means true: only final statuses match. */
    private Boolean finalOnly;

    private List<String> statusIn;

    private String resourceId;
    private String resourceGroup;
    private String resourceName;
    private String subscriptionId;
    private String namespace;
    private String schemaName;
    private String oncall;

    private String resourceGroupPrefix;

    /** "true" or "false". An alert has a parsable severity or a failure status. */
    private String isAlert;

    /** SevN bounds, inclusive. Lower numbers are more severe. */
    private String severityMin;
    private String severityMax;
}
