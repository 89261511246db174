package io.taskvault.executor;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskvault.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command per action. The payload JSON goes to stdin. Exit code 0 is
 * success; otherwise the last output line may be {@code {"error_class": ..., "message": ...}}
 * to steer escalation, and anything else counts as an unrecognized failure. Output is spooled
 * to a temp file so a chatty script never stalls on a full pipe.
 */
public final class ScriptExecutor implements ActionExecutor {
    public static final String UNCLASSIFIED = "script_failure";
    private static final Logger log = LoggerFactory.getLogger(ScriptExecutor.class);
    private static final int MAX_ERROR_CHARS = 512;

    private final String id;
    private final List<String> command;
    private final long timeoutMs;
    private final Path workingDir;

    public ScriptExecutor(String id, List<String> command, long timeoutMs, Path workingDir) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("script executor action cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script executor command cannot be empty: " + id);
        }
        this.id = id;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(100L, timeoutMs);
        this.workingDir = workingDir;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public ActionResult execute(ActionRequest request) {
        Path outputFile;
        try {
            outputFile = Files.createTempFile("taskvault-script-", ".out");
        } catch (IOException e) {
            return ActionResult.fail("config_error", "script output file failed: " + e.getMessage());
        }
        try {
            return run(request, outputFile);
        } finally {
            try {
                Files.deleteIfExists(outputFile);
            } catch (IOException e) {
                log.warn("Failed to delete script output {}: {}", outputFile, e.getMessage());
            }
        }
    }

    private ActionResult run(ActionRequest request, Path outputFile) {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        pb.redirectOutput(outputFile.toFile());
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        pb.environment().put("TASKVAULT_ATTEMPT", Integer.toString(request.attempt()));
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return ActionResult.fail("config_error", "script spawn failed: " + e.getMessage());
        }

        try {
            process.getOutputStream().write(Jsons.toCompactJson(request.payload()).getBytes(StandardCharsets.UTF_8));
            process.getOutputStream().flush();
            process.getOutputStream().close();

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return ActionResult.fail("timeout", "script timeout after " + Duration.ofMillis(timeoutMs));
            }

            String combined = Files.readString(outputFile, StandardCharsets.UTF_8);
            if (process.exitValue() == 0) {
                return ActionResult.ok(combined.strip());
            }
            return classifiedFailure(process.exitValue(), combined);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return ActionResult.fail("timeout", "script interrupted");
        } catch (IOException e) {
            process.destroyForcibly();
            return ActionResult.fail(UNCLASSIFIED, "script execution failed: " + e.getMessage());
        }
    }

    private static ActionResult classifiedFailure(int exitCode, String output) {
        String[] lines = output.strip().split("\\R");
        String last = lines.length == 0 ? "" : lines[lines.length - 1].trim();
        if (last.startsWith("{")) {
            try {
                JsonNode node = Jsons.mapper().readTree(last);
                String errorClass = node.path("error_class").asText("");
                if (!errorClass.isBlank()) {
                    return ActionResult.fail(errorClass, node.path("message").asText("script exit=" + exitCode));
                }
            } catch (IOException e) {
                return ActionResult.fail(UNCLASSIFIED, "script exit=" + exitCode + " output=" + truncate(output));
            }
        }
        return ActionResult.fail(UNCLASSIFIED, "script exit=" + exitCode + " output=" + truncate(output));
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
