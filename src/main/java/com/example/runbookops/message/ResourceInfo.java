package com.example.runbookops.message;

/**
 * Keys of the {@code resource_info} and {@code routing_info} maps carried on jobs and outcomes.
 */
public final class ResourceInfo {

    public static final String RESOURCE_NAME = "resource_name";
    public static final String RESOURCE_RG = "resource_rg";
    public static final String RESOURCE_ID = "resource_id";
    public static final String AKS_NAMESPACE = "aks_namespace";
    public static final String AKS_POD = "aks_pod";
    public static final String AKS_DEPLOYMENT = "aks_deployment";
    public static final String AKS_JOB = "aks_job";
    public static final String AKS_HPA = "aks_horizontalpodautoscaler";

    public static final String HINT_TEAM = "team";
    public static final String HINT_SLACK_CHANNEL = "slack_channel";
    public static final String HINT_SLACK_TOKEN = "slack_token";
    public static final String HINT_OPSGENIE_TOKEN = "opsgenie_token";

    private ResourceInfo() {
    }
}
