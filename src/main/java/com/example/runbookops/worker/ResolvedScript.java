package com.example.runbookops.worker;

import java.nio.file.Path;

/**
 * A runbook script on local disk, ready to run.
 *
 * @param path      script location
 * @param source    where the body came from: {@code local}, {@code contents-api} or {@code raw}
 * @param temporary whether the file was downloaded and must be deleted after the run
 */
public record ResolvedScript(Path path, String source, boolean temporary) {

    public boolean isPython() {
        return path.getFileName().toString().toLowerCase().endsWith(".py");
    }
}
