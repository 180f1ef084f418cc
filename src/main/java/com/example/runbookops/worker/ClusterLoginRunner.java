package com.example.runbookops.worker;

import com.example.runbookops.config.RunbookOpsProperties;
import com.example.runbookops.message.ResourceInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Fetches Kubernetes credentials before a cluster-scoped runbook runs.
 *
 * <p>Runs the configured login script as {@code script <resource-group> <cluster> [namespace]}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClusterLoginRunner {

    private static final Set<String> NO_NAMESPACE = Set.of("", "none", "null", "undefined");

    private final RunbookOpsProperties properties;

    /**
     * Whether the job targets a cluster namespace and therefore needs a login first.
     */
    public boolean required(Map<String, String> resourceInfo) {
        if (resourceInfo == null) return false;
        String namespace = resourceInfo.get(ResourceInfo.AKS_NAMESPACE);
        return namespace != null && !NO_NAMESPACE.contains(namespace.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * @return combined output of the login script
     * @throws ClusterLoginException when the resource group or cluster name is missing, or the script fails
     */
    public String login(String execId, Map<String, String> resourceInfo) {
        String group = resourceInfo.get(ResourceInfo.RESOURCE_RG);
        String cluster = resourceInfo.get(ResourceInfo.RESOURCE_NAME);
        if (isBlank(group) || isBlank(cluster)) {
            throw new ClusterLoginException("Cluster login needs resource_rg and resource_name");
        }

        Path script = Paths.get(properties.getWorker().getClusterLoginScript());
        if (!Files.isRegularFile(script)) {
            throw new ClusterLoginException("Cluster login script not found: " + script);
        }

        List<String> command = new ArrayList<>();
        command.add(Files.isExecutable(script) ? script.toString() : "sh");
        if (!Files.isExecutable(script)) command.add(script.toString());
        command.add(group);
        command.add(cluster);
        String namespace = resourceInfo.get(ResourceInfo.AKS_NAMESPACE);
        if (!isBlank(namespace)) command.add(namespace);

        int timeoutSeconds = properties.getWorker().getClusterLoginTimeoutSeconds();
        log.info("[{}] Cluster login for {}/{}", execId, group, cluster);
        Path output = null;
        try {
            output = Files.createTempFile("cluster-login-", ".log");
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            pb.redirectOutput(output.toFile());
            Process process = pb.start();
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                throw new ClusterLoginException("Cluster login timed out after " + timeoutSeconds + "s");
            }
            String text = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                throw new ClusterLoginException("Cluster login failed (rc=" + process.exitValue() + "): " + text.trim());
            }
            return text;
        } catch (IOException e) {
            throw new ClusterLoginException("Cluster login could not start: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClusterLoginException("Cluster login interrupted", e);
        } finally {
            deleteQuietly(output);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", file, e.getMessage());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
