package com.dataworks.orchestrator.capability.impl;

import com.dataworks.orchestrator.capability.CapabilityContext;
import com.dataworks.orchestrator.capability.CapabilityException;
import com.dataworks.orchestrator.capability.CapabilityResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Runs an OS process inside the workspace and captures its output.
 *
 * Output goes to temp files outside the workspace so the child can never
 * block on a full pipe. If the calling thread is interrupted (the registry
 * cancelling a timed-out invocation) the whole process tree is killed.
 * Credentials in the parent environment are not passed to the child.
 */
final class ProcessRunner {

    private static final Pattern SECRET_ENV = Pattern.compile(
            ".*(TOKEN|SECRET|PASSWORD|API_KEY|APIKEY).*", Pattern.CASE_INSENSITIVE);

    private ProcessRunner() {}

    static CapabilityResult run(List<String> command, Path workingDir, CapabilityContext ctx) {
        Path stdoutFile = null;
        Path stderrFile = null;
        Process process = null;
        try {
            stdoutFile = Files.createTempFile("dataworks-out-", ".log");
            stderrFile = Files.createTempFile("dataworks-err-", ".log");

            ProcessBuilder pb = new ProcessBuilder(command)
                    .directory(workingDir.toFile())
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile());
            pb.environment().keySet().removeIf(k -> SECRET_ENV.matcher(k).matches());

            process = pb.start();
            int exitCode = process.waitFor();

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("exit_code", exitCode);
            payload.put("stdout", ctx.clip(Files.readString(stdoutFile, StandardCharsets.UTF_8)));
            payload.put("stderr", ctx.clip(Files.readString(stderrFile, StandardCharsets.UTF_8)));
            return exitCode == 0
                    ? CapabilityResult.ok(payload)
                    : new CapabilityResult(false, payload, "exit code " + exitCode);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapabilityException(CapabilityException.Kind.TIMEOUT,
                    "process interrupted: " + String.join(" ", command), e);
        } catch (IOException e) {
            throw new CapabilityException(CapabilityException.Kind.EXECUTION_ERROR,
                    "could not run process: " + e.getMessage(), e);
        } finally {
            if (process != null && process.isAlive()) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    // Our own capture files in java.io.tmpdir, never workspace data.
    private static void deleteQuietly(Path tempFile) {
        if (tempFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            tempFile.toFile().deleteOnExit();
        }
    }
}
