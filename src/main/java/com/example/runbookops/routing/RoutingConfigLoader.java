package com.example.runbookops.routing;

import com.example.runbookops.config.RunbookOpsProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * Loads the routing rules from the {@code ROUTING_RULES} setting (settings table or environment),
 * then the configured rules file, then the built-in fallback. Missing defaults are filled in.
 */
@Slf4j
@Component
public class RoutingConfigLoader {

    public static final String ROUTING_RULES_KEY = "ROUTING_RULES";

    private final SettingsLookup settings;
    private final RunbookOpsProperties properties;
    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final LoadingCache<String, RoutingConfig> cache;

    public RoutingConfigLoader(SettingsLookup settings, RunbookOpsProperties properties, ObjectMapper objectMapper) {
        this.settings = settings;
        this.properties = properties;
        this.jsonMapper = objectMapper;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofSeconds(Math.max(0, properties.getRouting().getCacheSeconds())))
                .maximumSize(1)
                .build(key -> loadUncached());
    }

    public RoutingConfig load() {
        return cache.get(ROUTING_RULES_KEY);
    }

    public void invalidate() {
        cache.invalidateAll();
        settings.invalidate();
    }

    RoutingConfig loadUncached() {
        String raw = settings.get(ROUTING_RULES_KEY);
        if (raw != null) {
            try {
                return normalize(jsonMapper.readValue(raw, RoutingConfig.class));
            } catch (IOException e) {
                log.error("Invalid ROUTING_RULES JSON, using fallback configuration: {}", e.getMessage());
                return fallback();
            }
        }

        String rulesFile = properties.getRouting().getRulesFile();
        if (rulesFile != null && !rulesFile.isBlank()) {
            File file = new File(rulesFile);
            if (file.isFile()) {
                try {
                    RoutingConfig config = yamlMapper.readValue(file, RoutingConfig.class);
                    log.info("Loaded routing rules from {}", rulesFile);
                    return normalize(config);
                } catch (IOException e) {
                    log.error("Failed to load routing rules file {}: {}", rulesFile, e.getMessage());
                    return fallback();
                }
            }
            log.warn("Routing rules file {} not found", rulesFile);
        }

        log.info("ROUTING_RULES not set: using fallback configuration");
        return fallback();
    }

    /**
     * Alerts that failed go to Opsgenie and Slack; everything else goes to Slack.
     */
    public RoutingConfig fallback() {
        RoutingRule alerts = RoutingRule.builder()
                .when(RuleCondition.builder()
                        .isAlert("true")
                        .statusIn(List.of("failed", "error", "routed"))
                        .build())
                .then(new ArrayList<>(List.of(
                        ActionSpec.builder().type(ActionType.OPSGENIE).build(),
                        ActionSpec.builder().type(ActionType.SLACK).build())))
                .build();
        RoutingRule everything = RoutingRule.builder()
                .when(RuleCondition.builder().any("*").build())
                .then(new ArrayList<>(List.of(ActionSpec.builder().type(ActionType.SLACK).build())))
                .build();
        return normalize(RoutingConfig.builder()
                .rules(new ArrayList<>(List.of(alerts, everything)))
                .build());
    }

    private RoutingConfig normalize(RoutingConfig config) {
        if (config.getDefaults() == null) config.setDefaults(new RoutingConfig.TeamRouting());
        RoutingConfig.TeamRouting defaults = config.getDefaults();
        if (defaults.getOpsgenie() == null) defaults.setOpsgenie(new RoutingConfig.Target());
        if (defaults.getSlack() == null) defaults.setSlack(new RoutingConfig.Target());
        if (isBlank(defaults.getOpsgenie().getTeam())) {
            defaults.getOpsgenie().setTeam(properties.getRouting().getDefaultTeam());
        }
        if (isBlank(defaults.getSlack().getChannel())) {
            String channel = settings.get("SLACK_CHANNEL_DEFAULT");
            defaults.getSlack().setChannel(channel != null ? channel : properties.getRouting().getDefaultSlackChannel());
        }
        if (config.getTeams() == null) config.setTeams(new HashMap<>());
        if (config.getRules() == null || config.getRules().isEmpty()) {
            config.setRules(fallback().getRules());
        }

        for (RoutingRule rule : config.getRules()) {
            if (rule.getWhen() == null) rule.setWhen(new RuleCondition());
            List<ActionSpec> supported = new ArrayList<>();
            for (ActionSpec spec : rule.getThen() == null ? List.<ActionSpec>of() : rule.getThen()) {
                if (spec == null || spec.getType() == null) {
                    log.warn("Ignoring unsupported routing action type in rule {}", rule.getWhen());
                    continue;
                }
                supported.add(spec);
            }
            rule.setThen(supported);
        }
        return config;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
