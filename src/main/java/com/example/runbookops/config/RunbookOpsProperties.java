package com.example.runbookops.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Central configuration for Runbook Ops.
 * Maps to the 'runbook-ops' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "runbook-ops")
public class RunbookOpsProperties {

    private String serviceName = "runbook-ops";
    /** Zone used for log partition keys and requestedAt stamps. */
    private String timeZone = "UTC";

    private OrchestratorConfig orchestrator = new OrchestratorConfig();
    private ApprovalConfig approval = new ApprovalConfig();
    private WorkersConfig workers = new WorkersConfig();
    private WorkerConfig worker = new WorkerConfig();
    private RoutingConfig routing = new RoutingConfig();
    private NotificationConfig notifications = new NotificationConfig();
    private LogsConfig logs = new LogsConfig();
    private QueueConfig queue = new QueueConfig();

    @Data
    public static class OrchestratorConfig {
        private boolean enabled = true;
        /** Base URL used in approval links. Falls back to the inbound request URL when empty. */
        private String publicBaseUrl = "";
        private String notificationQueue = "runbook-notifications";
        private long outcomePollIntervalMs = 1000;
        private boolean schedulesEnabled = true;
    }

    @Data
    public static class ApprovalConfig {
        private String secret = "";
        private int ttlMinutes = 60;
    }

    @Data
    public static class WorkersConfig {
        private String sharedSecret = "";
        private int freshnessWindowMinutes = 3;
        private int livenessWindowMinutes = 5;
        private int gcIntervalSeconds = 60;
    }

    @Data
    public static class WorkerConfig {
        private boolean enabled = false;
        private String capability = "";
        private String workerId = "";
        private String queueName = "";
        private String region = "";
        private String orchestratorUrl = "http://localhost:8080";
        private int heartbeatIntervalSeconds = 60;
        private long pollIntervalMs = 1000;
        private int concurrency = 4;
        private String devScriptPath = "";
        private String clusterLoginScript = "scripts/cluster-login.sh";
        private int clusterLoginTimeoutSeconds = 300;
        private String pythonCommand = "python3";
        private int stopGraceSeconds = 10;
        private int maxLogBodyBytes = 65536;
        private GithubConfig github = new GithubConfig();

        @Data
        public static class GithubConfig {
            private String repo = "";
            private String branch = "main";
            private String pathPrefix = "src/runbooks";
            private String token = "";
            private String apiUrl = "https://api.github.com";
            private String rawUrl = "https://raw.githubusercontent.com";
        }
    }

    @Data
    public static class RoutingConfig {
        /** Optional YAML or JSON rules file, used when the settings table holds no rules. */
        private String rulesFile = "";
        private int cacheSeconds = 60;
        private String defaultTeam = "default";
        private String defaultSlackChannel = "#runbook-ops-default";
    }

    @Data
    public static class NotificationConfig {
        private SlackConfig slack = new SlackConfig();
        private OpsgenieConfig opsgenie = new OpsgenieConfig();

        @Data
        public static class SlackConfig {
            private String apiUrl = "https://slack.com/api/chat.postMessage";
            /** Token and channel used for approval requests and decision notes. */
            private String token = "";
            private String channel = "";
            private int logPreviewChars = 1500;
        }

        @Data
        public static class OpsgenieConfig {
            private String apiUrl = "https://api.opsgenie.com/v2/alerts";
        }
    }

    @Data
    public static class LogsConfig {
        private int maxTableChars = 32000;
        private int defaultQueryLimit = 200;
        private int maxQueryLimit = 5000;
    }

    @Data
    public static class QueueConfig {
        private int visibilityTimeoutSeconds = 900;
        /** How often a worker renews the claim on messages it is still running. */
        private long leaseRenewIntervalMs = 300000;
    }
}
