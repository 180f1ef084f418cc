package com.example.runbookops.routing;

import com.example.runbookops.config.RunbookOpsProperties;
import com.example.runbookops.domain.SettingEntry;
import com.example.runbookops.repository.SettingEntryRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Reads a global setting from the settings table, falling back to the environment.
 * Values are trimmed and stripped of surrounding quotes; table hits are cached briefly.
 */
@Slf4j
@Component
public class SettingsLookup {

    private final SettingEntryRepository repository;
    private final Environment environment;
    private final Cache<String, Optional<String>> tableCache;

    public SettingsLookup(SettingEntryRepository repository, Environment environment,
                          RunbookOpsProperties properties) {
        this.repository = repository;
        this.environment = environment;
        this.tableCache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofSeconds(Math.max(0, properties.getRouting().getCacheSeconds())))
                .maximumSize(500)
                .build();
    }

    public String get(String key) {
        String fromTable = tableCache.get(key, this::readTable).orElse(null);
        if (fromTable != null) {
            return fromTable;
        }
        return clean(environment.getProperty(key));
    }

    public void invalidate() {
        tableCache.invalidateAll();
    }

    private Optional<String> readTable(String key) {
        try {
            return repository.findById(key).map(SettingEntry::getValue).map(SettingsLookup::clean);
        } catch (Exception e) {
            log.warn("Could not read setting {} from the settings table: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    static String clean(String value) {
        if (value == null) return null;
        String v = value.trim();
        while (v.length() >= 1 && (v.startsWith("\"") || v.startsWith("'"))) v = v.substring(1);
        while (v.length() >= 1 && (v.endsWith("\"") || v.endsWith("'"))) v = v.substring(0, v.length() - 1);
        v = v.trim();
        return v.isEmpty() ? null : v;
    }
}
