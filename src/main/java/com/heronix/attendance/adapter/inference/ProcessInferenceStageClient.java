package com.heronix.attendance.adapter.inference;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.exception.StageInvocationException;
import com.heronix.attendance.model.enums.StageTransport;
import com.heronix.attendance.model.enums.StageType;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Stage client that runs a local worker per invocation.
 *
 * The worker gets the payload as JSON on stdin and must print one JSON
 * object on stdout. A non-zero exit code, a timeout or unparseable output
 * fails the stage; a timed out worker is killed. Both output pipes are drained
 * on threads of their own so a worker never stalls on a full pipe.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProcessInferenceStageClient implements InferenceStageClient {

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final AttendanceProperties properties;

    @Override
    public StageTransport getTransport() {
        return StageTransport.PROCESS;
    }

    @Override
    public String invoke(StageType stage, Object payload) {
        List<String> command = buildCommand(stage);
        int timeoutSeconds = properties.getAnalytics().getStageTimeoutSeconds();

        log.debug("Invoking {} stage with worker {}", stage.getOutputField(), command);

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new StageInvocationException(stage, "cannot start worker " + command, e);
        }

        try {
            CompletableFuture<String> stdout = readAsync(process.getInputStream(), pipeReader(stage, "stdout"));
            CompletableFuture<String> stderr = readAsync(process.getErrorStream(), pipeReader(stage, "stderr"));

            try (OutputStream stdin = process.getOutputStream()) {
                objectMapper.writeValue(stdin, payload);
            }

            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                throw new StageInvocationException(stage, "worker timed out after " + timeoutSeconds + "s");
            }

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new StageInvocationException(stage,
                        "worker exited with code " + exitCode + ": "
                                + stderr.get(timeoutSeconds, TimeUnit.SECONDS).trim());
            }

            Map<String, Object> result = objectMapper.readValue(stdout.get(timeoutSeconds, TimeUnit.SECONDS), JSON_OBJECT);
            Object value = result.get(stage.getOutputField());
            return value != null ? value.toString() : null;

        } catch (IOException | ExecutionException e) {
            throw new StageInvocationException(stage, "worker I/O failed: " + e.getMessage(), e);
        } catch (TimeoutException e) {
            throw new StageInvocationException(stage, "worker output not closed after " + timeoutSeconds + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageInvocationException(stage, "interrupted while waiting for worker", e);
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private List<String> buildCommand(StageType stage) {
        String script = properties.getAnalytics().getScripts().get(stage);
        if (script == null || script.isBlank()) {
            throw new StageInvocationException(stage, "no worker script configured");
        }
        return List.of(properties.getAnalytics().getWorkerCommand(), script);
    }

    /**
     * One daemon thread per pipe.
     */
    private static Executor pipeReader(StageType stage, String pipe) {
        return task -> {
            Thread reader = new Thread(task, "stage-" + stage.getOutputField() + "-" + pipe);
            reader.setDaemon(true);
            reader.start();
        };
    }

    private static CompletableFuture<String> readAsync(InputStream stream, Executor reader) {
        return CompletableFuture.supplyAsync(() -> {
            try (stream) {
                return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, reader);
    }
}
