package com.example.runbookops.worker;

import com.example.runbookops.config.RunbookOpsProperties;
import com.example.runbookops.exception.RunbookNotFoundException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Locates a runbook script: the local dev directory first, then the GitHub contents API,
 * then raw.githubusercontent.com. Each remote source is tried with a Bearer token, without
 * credentials and with the legacy {@code token} scheme. Any refusal, miss or I/O error moves on to the
 * next scheme; a source is given up only when every scheme failed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunbookSourceResolver {

    private static final String USER_AGENT = "runbook-ops-worker";

    private final RunbookOpsProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public ResolvedScript resolve(String runbook) {
        if (runbook == null || runbook.isBlank()) {
            throw new RunbookNotFoundException(String.valueOf(runbook));
        }
        String script = runbook.trim();

        Path local = localPath(script);
        if (local != null) {
            log.info("Using local runbook {}", local);
            return new ResolvedScript(local, "local", false);
        }

        RunbookOpsProperties.WorkerConfig.GithubConfig github = properties.getWorker().getGithub();
        if (github.getRepo() == null || github.getRepo().isBlank()) {
            log.warn("Runbook {} not found locally and no repository is configured", script);
            throw new RunbookNotFoundException(script);
        }

        String path = repoPath(github.getPathPrefix(), script);
        byte[] body = fromContentsApi(github, path);
        String source = "contents-api";
        if (body == null) {
            body = fromRaw(github, path);
            source = "raw";
        }
        if (body == null) {
            throw new RunbookNotFoundException(script);
        }

        try {
            Path file = writeTemp(script, body);
            log.info("Downloaded runbook {} from {} to {}", script, source, file);
            return new ResolvedScript(file, source, true);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to store runbook " + script + ": " + e.getMessage(), e);
        }
    }

    /** Deletes a downloaded script; local dev scripts are left alone. */
    public void cleanup(ResolvedScript script) {
        if (script == null || !script.temporary()) return;
        try {
            Files.deleteIfExists(script.path());
        } catch (IOException e) {
            log.warn("Could not delete temporary runbook {}: {}", script.path(), e.getMessage());
        }
    }

    private Path localPath(String script) {
        String dev = properties.getWorker().getDevScriptPath();
        if (dev == null || dev.isBlank()) return null;
        Path base = Paths.get(dev).toAbsolutePath().normalize();
        Path candidate = base.resolve(script).normalize();
        if (!candidate.startsWith(base)) {
            log.warn("Ignoring runbook path outside the dev directory: {}", script);
            return null;
        }
        return Files.isRegularFile(candidate) ? candidate : null;
    }

    private byte[] fromContentsApi(RunbookOpsProperties.WorkerConfig.GithubConfig github, String path) {
        String url = trimSlash(github.getApiUrl()) + "/repos/" + github.getRepo() + "/contents/" + path
                + "?ref=" + github.getBranch();
        for (Request.Builder builder : authVariants(url, github.getToken())) {
            try (Response response = httpClient.newCall(builder.build()).execute()) {
                if (response.code() == 401 || response.code() == 403) {
                    log.debug("Contents API refused credentials ({}), trying next scheme", response.code());
                    continue;
                }
                if (!response.isSuccessful() || response.body() == null) {
                    log.debug("Contents API returned {} for {}, trying next scheme", response.code(), path);
                    continue;
                }
                JsonNode json = objectMapper.readTree(response.body().string());
                String content = json.path("content").asText("");
                if (content.isEmpty()) continue;
                return Base64.getMimeDecoder().decode(content);
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Contents API lookup for {} failed: {}", path, e.getMessage());
            }
        }
        return null;
    }

    private byte[] fromRaw(RunbookOpsProperties.WorkerConfig.GithubConfig github, String path) {
        String url = trimSlash(github.getRawUrl()) + "/" + github.getRepo() + "/" + github.getBranch() + "/" + path;
        for (Request.Builder builder : authVariants(url, github.getToken())) {
            try (Response response = httpClient.newCall(builder.build()).execute()) {
                if (response.code() == 401 || response.code() == 403) {
                    continue;
                }
                if (!response.isSuccessful() || response.body() == null) {
                    log.debug("Raw download returned {} for {}, trying next scheme", response.code(), path);
                    continue;
                }
                return response.body().bytes();
            } catch (IOException e) {
                log.warn("Raw download for {} failed: {}", path, e.getMessage());
            }
        }
        return null;
    }

    private static List<Request.Builder> authVariants(String url, String token) {
        List<Request.Builder> variants = new ArrayList<>();
        boolean hasToken = token != null && !token.isBlank();
        if (hasToken) {
            variants.add(base(url).header("Authorization", "Bearer " + token.trim()));
        }
        variants.add(base(url));
        if (hasToken) {
            variants.add(base(url).header("Authorization", "token " + token.trim()));
        }
        return variants;
    }

    private static Request.Builder base(String url) {
        return new Request.Builder()
                .url(url)
                .header("Accept", "application/vnd.github+json")
                .header("User-Agent", USER_AGENT)
                .get();
    }

    private static Path writeTemp(String script, byte[] body) throws IOException {
        String suffix = script.toLowerCase().endsWith(".py") ? ".py" : "";
        Path file = Files.createTempFile("runbook_", suffix);
        Files.write(file, body);
        if (!file.toFile().setExecutable(true, true)) {
            log.debug("Could not mark {} executable", file);
        }
        return file;
    }

    static String repoPath(String prefix, String script) {
        String p = prefix == null ? "" : prefix.trim();
        while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
        while (p.startsWith("/")) p = p.substring(1);
        String s = script.startsWith("/") ? script.substring(1) : script;
        return p.isEmpty() ? s : p + "/" + s;
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
