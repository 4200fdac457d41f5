package me.golemcore.gateway.adapter.outbound.agent;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external process synchronously, feeding it standard input and
 * capturing standard output and standard error.
 *
 * <p>
 * Input is written and both output streams are drained on separate threads so
 * a chatty process can never block on a full pipe. No timeout is applied; the
 * call returns when the process exits.
 */
@Component
@Slf4j
public class AgentProcessRunner {

    private final ExecutorService ioExecutor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "agent-process-io");
        thread.setDaemon(true);
        return thread;
    });

    @PreDestroy
    public void shutdown() {
        ioExecutor.shutdownNow();
        try {
            if (!ioExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Agent] Process I/O executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Start {@code command}, write {@code stdin} (UTF-8) and wait for exit.
     *
     * @param workdir
     *            process working directory, or {@code null} to inherit
     * @param environment
     *            extra environment variables, may be empty
     * @throws IOException
     *             if the process cannot be started or its streams fail
     */
    public ProcessResult run(List<String> command, String stdin, Path workdir, Map<String, String> environment)
            throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workdir != null) {
            pb.directory(workdir.toFile());
        }
        pb.environment().putAll(environment);

        Process process = pb.start();
        Future<?> inputFuture = ioExecutor.submit(() -> writeInput(process.getOutputStream(), stdin));
        Future<String> stdoutFuture = ioExecutor.submit(() -> readFully(process.getInputStream()));
        Future<String> stderrFuture = ioExecutor.submit(() -> readFully(process.getErrorStream()));

        try {
            int exitCode = process.waitFor();
            inputFuture.get();
            return new ProcessResult(exitCode, stdoutFuture.get(), stderrFuture.get());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException ioException) {
                throw ioException;
            }
            throw new IOException("Failed to exchange data with process: " + cause.getMessage(), cause);
        }
    }

    private static Void writeInput(OutputStream out, String stdin) throws IOException {
        try (OutputStream stream = out) {
            if (stdin != null) {
                stream.write(stdin.getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            // process exited without reading its input
            log.debug("[Agent] Failed to write process input: {}", e.getMessage());
        }
        return null;
    }

    private static String readFully(InputStream in) throws IOException {
        try (InputStream stream = in) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
