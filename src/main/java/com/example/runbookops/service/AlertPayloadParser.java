package com.example.runbookops.service;

import com.example.runbookops.message.ResourceInfo;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns an inbound alert into an {@link AlertContext}.
 *
 * <p>Understands the Azure Monitor common alert schema, Alertmanager webhooks and plain
 * {@code {"schemaId": ...}} bodies. An explicit {@code id} query parameter always wins and
 * makes the trigger a manual one, without resource information.
 */
@Slf4j
@Component
public class AlertPayloadParser {

    private static final String AZURE_COMMON_SCHEMA = "azureMonitorCommonAlertSchema";
    private static final Set<String> HINT_KEYS = Set.of(
            ResourceInfo.HINT_TEAM, ResourceInfo.HINT_SLACK_CHANNEL,
            ResourceInfo.HINT_SLACK_TOKEN, ResourceInfo.HINT_OPSGENIE_TOKEN);
    private static final Map<String, String> DIMENSIONS = Map.of(
            "namespace", ResourceInfo.AKS_NAMESPACE,
            "pod", ResourceInfo.AKS_POD,
            "deployment", ResourceInfo.AKS_DEPLOYMENT,
            "job", ResourceInfo.AKS_JOB,
            "horizontalpodautoscaler", ResourceInfo.AKS_HPA);

    public AlertContext parse(String idParam, JsonNode body) {
        if (idParam != null && !idParam.isBlank()) {
            return AlertContext.manual(idParam.trim());
        }
        if (body == null || body.isNull() || body.isMissingNode()) {
            return AlertContext.builder().build();
        }
        if (AZURE_COMMON_SCHEMA.equalsIgnoreCase(text(body, "schemaId")) || body.path("data").has("essentials")) {
            return parseAzure(body);
        }
        if (body.has("alerts") && body.get("alerts").isArray()) {
            return parseAlertmanager(body);
        }
        AlertContext context = AlertContext.builder()
                .schemaId(firstNonBlank(text(body, "alertId"), text(body, "schemaId"), text(body, "id")))
                .monitorCondition(text(body, "monitorCondition"))
                .severity(text(body, "severity"))
                .build();
        copyHints(body, context.getRoutingInfo());
        copyHints(body.path("routing_info"), context.getRoutingInfo());
        return context;
    }

    private AlertContext parseAzure(JsonNode body) {
        JsonNode data = body.path("data");
        JsonNode essentials = data.path("essentials");
        JsonNode custom = data.path("customProperties");

        AlertContext context = AlertContext.builder()
                .schemaId(firstNonBlank(text(body, "alertId"), text(custom, "schemaId"),
                        text(custom, "alertId"), text(essentials, "alertRule")))
                .monitorCondition(text(essentials, "monitorCondition"))
                .severity(text(essentials, "severity"))
                .build();

        JsonNode targets = essentials.path("alertTargetIDs");
        String resourceId = targets.isArray() && targets.size() > 0 ? targets.get(0).asText(null) : null;
        if (resourceId != null && !resourceId.isBlank()) {
            Map<String, String> info = context.getResourceInfo();
            info.put(ResourceInfo.RESOURCE_ID, resourceId);
            info.put(ResourceInfo.RESOURCE_NAME, lastSegment(resourceId));
            String group = segmentAfter(resourceId, "resourcegroups");
            if (group != null) info.put(ResourceInfo.RESOURCE_RG, group);

            for (JsonNode condition : data.path("alertContext").path("condition").path("allOf")) {
                for (JsonNode dimension : condition.path("dimensions")) {
                    String key = DIMENSIONS.get(dimension.path("name").asText("").toLowerCase(Locale.ROOT));
                    String value = dimension.path("value").asText(null);
                    if (key != null && value != null && !value.isBlank()) {
                        info.putIfAbsent(key, value);
                    }
                }
            }
        }
        copyHints(custom, context.getRoutingInfo());
        log.debug("Parsed Azure alert for schema {} on {}", context.getSchemaId(), resourceId);
        return context;
    }

    private AlertContext parseAlertmanager(JsonNode body) {
        JsonNode first = body.get("alerts").size() > 0 ? body.get("alerts").get(0) : body;
        JsonNode labels = first.path("labels");
        JsonNode common = body.path("commonLabels");

        String status = firstNonBlank(text(first, "status"), text(body, "status"));
        AlertContext context = AlertContext.builder()
                .schemaId(firstNonBlank(text(labels, "schemaId"), text(common, "schemaId"), text(labels, "alertname")))
                .monitorCondition("resolved".equalsIgnoreCase(status) ? "Resolved" : "Fired")
                .severity(text(labels, "severity"))
                .build();

        Map<String, String> info = context.getResourceInfo();
        String resourceName = firstNonBlank(text(labels, "resource_name"), text(labels, "cluster"));
        if (resourceName != null) {
            info.put(ResourceInfo.RESOURCE_NAME, resourceName);
            putIfPresent(info, ResourceInfo.RESOURCE_RG, firstNonBlank(text(labels, "resource_group"), text(labels, "resource_rg")));
            putIfPresent(info, ResourceInfo.RESOURCE_ID, text(labels, "resource_id"));
            DIMENSIONS.forEach((label, key) -> putIfPresent(info, key, text(labels, label)));
        }
        copyHints(labels, context.getRoutingInfo());
        copyHints(first.path("annotations"), context.getRoutingInfo());
        return context;
    }

    private static void copyHints(JsonNode node, Map<String, String> target) {
        if (node == null || !node.isObject()) return;
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (HINT_KEYS.contains(field.getKey()) && field.getValue().isValueNode()) {
                String value = field.getValue().asText();
                if (!value.isBlank()) target.put(field.getKey(), value.trim());
            }
        }
    }

    private static void putIfPresent(Map<String, String> target, String key, String value) {
        if (value != null && !value.isBlank()) target.put(key, value);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) return null;
        String s = value.asText().trim();
        return s.isEmpty() ? null : s;
    }

    static String lastSegment(String resourceId) {
        String trimmed = resourceId.endsWith("/") ? resourceId.substring(0, resourceId.length() - 1) : resourceId;
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    static String segmentAfter(String resourceId, String marker) {
        String[] parts = resourceId.split("/");
        for (int i = 0; i < parts.length - 1; i++) {
            if (parts[i].equalsIgnoreCase(marker)) return parts[i + 1];
        }
        return null;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }
}
