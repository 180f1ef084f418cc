package com.example.runbookops.service;

import com.example.runbookops.message.ResourceInfo;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AlertPayloadParserTest {

    private final AlertPayloadParser parser = new AlertPayloadParser();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private JsonNode json(String body) throws Exception {
        return objectMapper.readTree(body);
    }

    @Test
    void idParameterMakesAManualTrigger() throws Exception {
        AlertContext context = parser.parse(" restart-api ", json("{\"alertId\":\"other\",\"severity\":\"Sev1\"}"));

        assertEquals("restart-api", context.getSchemaId());
        assertNull(context.getSeverity());
        assertTrue(context.getResourceInfo().isEmpty());
    }

    @Test
    void missingBodyYieldsNoSchema() {
        assertNull(parser.parse(null, null).getSchemaId());
    }

    @Test
    void azureCommonSchemaExtractsResourceAndDimensions() throws Exception {
        String body = "{\"schemaId\":\"azureMonitorCommonAlertSchema\",\"data\":{"
                + "\"essentials\":{\"alertRule\":\"pod-restarts\",\"severity\":\"Sev2\",\"monitorCondition\":\"Fired\","
                + "\"alertTargetIDs\":[\"/subscriptions/s1/resourceGroups/rg-prod/providers/Microsoft.ContainerService/managedClusters/aks-prod\"]},"
                + "\"alertContext\":{\"condition\":{\"allOf\":[{\"dimensions\":["
                + "{\"name\":\"Namespace\",\"value\":\"payments\"},{\"name\":\"deployment\",\"value\":\"api\"},"
                + "{\"name\":\"node\",\"value\":\"n1\"}]}]}},"
                + "\"customProperties\":{\"schemaId\":\"restart-api\",\"team\":\"payments\",\"unrelated\":\"x\"}}}";

        AlertContext context = parser.parse(null, json(body));

        assertEquals("restart-api", context.getSchemaId());
        assertEquals("Sev2", context.getSeverity());
        assertEquals("Fired", context.getMonitorCondition());
        assertEquals("aks-prod", context.getResourceInfo().get(ResourceInfo.RESOURCE_NAME));
        assertEquals("rg-prod", context.getResourceInfo().get(ResourceInfo.RESOURCE_RG));
        assertEquals("payments", context.getResourceInfo().get(ResourceInfo.AKS_NAMESPACE));
        assertEquals("api", context.getResourceInfo().get(ResourceInfo.AKS_DEPLOYMENT));
        assertEquals(5, context.getResourceInfo().size());
        assertEquals("payments", context.getRoutingInfo().get(ResourceInfo.HINT_TEAM));
        assertFalse(context.getRoutingInfo().containsKey("unrelated"));
    }

    @Test
    void azureAlertFallsBackToRuleName() throws Exception {
        String body = "{\"data\":{\"essentials\":{\"alertRule\":\"disk-full\",\"alertTargetIDs\":[]}}}";

        AlertContext context = parser.parse(null, json(body));

        assertEquals("disk-full", context.getSchemaId());
        assertTrue(context.getResourceInfo().isEmpty());
    }

    @Test
    void alertmanagerWebhookUsesFirstAlertLabels() throws Exception {
        String body = "{\"status\":\"firing\",\"alerts\":[{\"status\":\"resolved\",\"labels\":{"
                + "\"alertname\":\"KubePodCrashLooping\",\"schemaId\":\"restart-api\",\"severity\":\"Sev1\","
                + "\"cluster\":\"aks-prod\",\"resource_group\":\"rg-prod\",\"namespace\":\"payments\",\"pod\":\"api-1\"},"
                + "\"annotations\":{\"slack_channel\":\"#payments\"}}]}";

        AlertContext context = parser.parse(null, json(body));

        assertEquals("restart-api", context.getSchemaId());
        assertEquals("Resolved", context.getMonitorCondition());
        assertEquals("Sev1", context.getSeverity());
        assertEquals("aks-prod", context.getResourceInfo().get(ResourceInfo.RESOURCE_NAME));
        assertEquals("rg-prod", context.getResourceInfo().get(ResourceInfo.RESOURCE_RG));
        assertEquals("api-1", context.getResourceInfo().get(ResourceInfo.AKS_POD));
        assertEquals("#payments", context.getRoutingInfo().get(ResourceInfo.HINT_SLACK_CHANNEL));
    }

    @Test
    void plainBodyAcceptsAlertIdAndRoutingInfo() throws Exception {
        String body = "{\"alertId\":\"restart-api\",\"severity\":\"Sev3\",\"monitorCondition\":\"Fired\","
                + "\"routing_info\":{\"opsgenie_token\":\" key-1 \",\"team\":\"\"}}";

        AlertContext context = parser.parse("", json(body));

        assertEquals("restart-api", context.getSchemaId());
        assertEquals("Sev3", context.getSeverity());
        assertEquals("key-1", context.getRoutingInfo().get(ResourceInfo.HINT_OPSGENIE_TOKEN));
        assertFalse(context.getRoutingInfo().containsKey(ResourceInfo.HINT_TEAM));
    }

    @Test
    void resourceIdSegments() {
        String id = "/subscriptions/s1/resourcegroups/rg-a/providers/x/y/name-1/";

        assertEquals("name-1", AlertPayloadParser.lastSegment(id));
        assertEquals("rg-a", AlertPayloadParser.segmentAfter(id, "resourceGroups"));
        assertNull(AlertPayloadParser.segmentAfter("/a/b", "resourcegroups"));
    }
}
