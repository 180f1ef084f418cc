package com.example.runbookops.routing;

import com.example.runbookops.config.RunbookOpsProperties;
import com.example.runbookops.domain.SettingEntry;
import com.example.runbookops.repository.SettingEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CredentialResolverTest {

    private MockEnvironment environment;
    private SettingEntryRepository repository;
    private CredentialResolver credentials;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment();
        repository = mock(SettingEntryRepository.class);
        credentials = new CredentialResolver(new SettingsLookup(repository, environment, new RunbookOpsProperties()));
    }

    @Test
    void teamSlackTokenIsPreferredOverTheDefault() {
        environment.setProperty("SLACK_TOKEN_DATA_PLATFORM", "xoxb-data");
        environment.setProperty("SLACK_TOKEN_DEFAULT", "xoxb-default");

        assertEquals("xoxb-data", credentials.slackToken("data-platform"));
        assertEquals("xoxb-data", credentials.slackToken(" Data-Platform "));
        assertEquals("xoxb-default", credentials.slackToken("payments"));
        assertEquals("xoxb-default", credentials.slackToken(null));
        assertEquals("xoxb-default", credentials.slackToken(""));
    }

    @Test
    void opsgenieKeyFallsBackFromTeamToDefaultToGlobal() {
        environment.setProperty("OPSGENIE_API_KEY", "key-global");
        assertEquals("key-global", credentials.opsgenieApiKey("payments"));

        environment.setProperty("OPSGENIE_API_KEY_DEFAULT", "key-default");
        assertEquals("key-default", credentials.opsgenieApiKey("payments"));
        assertEquals("key-default", credentials.opsgenieApiKey(null));

        environment.setProperty("OPSGENIE_API_KEY_PAYMENTS", "key-payments");
        assertEquals("key-payments", credentials.opsgenieApiKey("payments"));
    }

    @Test
    void missingCredentialsResolveToNull() {
        environment.setProperty("SLACK_TOKEN_DEFAULT", "  ");

        assertNull(credentials.slackToken("payments"));
        assertNull(credentials.opsgenieApiKey("payments"));
    }

    @Test
    void settingsTableOverridesTheEnvironmentAndIsUnquoted() {
        environment.setProperty("OPSGENIE_API_KEY_DEFAULT", "key-env");
        when(repository.findById("OPSGENIE_API_KEY_DEFAULT"))
                .thenReturn(Optional.of(SettingEntry.builder().key("OPSGENIE_API_KEY_DEFAULT").value("\"key-table\"").build()));

        assertEquals("key-table", credentials.opsgenieApiKey("payments"));
    }
}
