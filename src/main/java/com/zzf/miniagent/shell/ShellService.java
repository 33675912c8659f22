package com.zzf.miniagent.shell;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.TimeUnit;

/**
 * Locates the shell binary and tears down process trees.
 */
@Slf4j
public class ShellService {

    private static final long SIGKILL_TIMEOUT_MS = 200;

    static final String FALLBACK_SHELL = "/bin/sh";
    private static final Path DEFAULT_BASH = Paths.get("/bin/bash");

    private volatile String bash;

    public void killTree(Process process) {
        if (process == null || !process.isAlive()) {
            return;
        }
        log.info("shell.kill pid={}", process.pid());
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(SIGKILL_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    /**
     * Absolute path of bash when {@code which} finds it, otherwise {@code /bin/sh}.
     */
    public String bash() {
        String resolved = bash;
        if (resolved == null) {
            String found = which("bash");
            if (found == null && Files.isExecutable(DEFAULT_BASH)) {
                found = DEFAULT_BASH.toString();
            }
            resolved = found != null ? found : FALLBACK_SHELL;
            log.debug("shell.resolved path={}", resolved);
            bash = resolved;
        }
        return resolved;
    }

    String which(String cmd) {
        boolean isWin = System.getProperty("os.name", "").toLowerCase().contains("win");
        String[] command = isWin ? new String[]{"where", cmd} : new String[]{"which", cmd};
        try {
            Process p = new ProcessBuilder(command).redirectErrorStream(true).start();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                String line = reader.readLine();
                if (p.waitFor() == 0 && line != null && !line.isBlank()) {
                    return line.trim();
                }
            }
        } catch (IOException e) {
            log.debug("shell.which.failed cmd={} err={}", cmd, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return null;
    }
}
