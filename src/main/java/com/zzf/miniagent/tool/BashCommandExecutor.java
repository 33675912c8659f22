package com.zzf.miniagent.tool;

import com.zzf.miniagent.shell.ShellService;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code bash -c} and collects stdout and stderr separately.
 */
@Slf4j
final class BashCommandExecutor {

    private final ShellService shellService;
    private final Executor streamExecutor;
    private final Set<Process> running = ConcurrentHashMap.newKeySet();

    BashCommandExecutor(ShellService shellService, Executor streamExecutor) {
        this.shellService = shellService;
        this.streamExecutor = streamExecutor;
    }

    ExecutionResult execute(String command, long timeoutMs) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(shellService.bash(), "-c", command);
        long startedAt = System.currentTimeMillis();
        Process process = pb.start();
        running.add(process);
        try {
            process.getOutputStream().close();
            CompletableFuture<String> stdout = drain(process.getInputStream());
            CompletableFuture<String> stderr = drain(process.getErrorStream());

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                shellService.killTree(process);
                log.warn("tool.bash.timeout timeoutMs={} command={}", timeoutMs, command);
                return new ExecutionResult(-1, stdout.join(),
                        "Command terminated due to timeout (" + timeoutMs + " ms).", true,
                        System.currentTimeMillis() - startedAt);
            }
            return new ExecutionResult(process.exitValue(), stdout.join(), stderr.join(), false,
                    System.currentTimeMillis() - startedAt);
        } catch (InterruptedException e) {
            shellService.killTree(process);
            throw e;
        } finally {
            running.remove(process);
        }
    }

    /**
     * Kills every command still running. Returns how many were killed.
     */
    int killAll() {
        int killed = 0;
        for (Process process : running) {
            if (process.isAlive()) {
                shellService.killTree(process);
                killed++;
            }
            running.remove(process);
        }
        return killed;
    }

    private CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                ByteArrayOutputStream buffer = new ByteArrayOutputStream();
                in.transferTo(buffer);
                return buffer.toString(StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, streamExecutor);
    }

    static final class ExecutionResult {
        final int exitCode;
        final String stdout;
        final String stderr;
        final boolean timedOut;
        final long durationMs;

        ExecutionResult(int exitCode, String stdout, String stderr, boolean timedOut, long durationMs) {
            this.exitCode = exitCode;
            this.stdout = stdout;
            this.stderr = stderr;
            this.timedOut = timedOut;
            this.durationMs = durationMs;
        }

        boolean success() {
            return !timedOut && exitCode == 0;
        }
    }
}
