package com.phillippitts.speechmaker.service.process;

import com.phillippitts.speechmaker.exception.ConversionCancelledException;
import com.phillippitts.speechmaker.exception.ExternalProcessException;
import com.phillippitts.speechmaker.exception.ExternalProcessExceptionBuilder;
import com.phillippitts.speechmaker.util.CancellationToken;
import com.phillippitts.speechmaker.util.ProcessTimeouts;
import com.phillippitts.speechmaker.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs one external process to completion with a bounded wait.
 *
 * <p>Every external call (voice listing, synthesis, converter validation, transcode, merge) goes
 * through here, so each one resolves to a definite outcome:
 * <ul>
 *   <li>exited: a {@link ProcessResult}, whatever the exit code (callers decide what non-zero means)</li>
 *   <li>could not start: {@link ExternalProcessException} with the command's start-failure code</li>
 *   <li>timed out: the process is destroyed, {@link ExternalProcessException} with the timeout code</li>
 *   <li>cancelled: the process is destroyed, {@link ConversionCancelledException}</li>
 * </ul>
 *
 * <p>stdout and stderr are drained concurrently by daemon threads so a chatty process cannot block
 * on a full pipe. Stateless; safe for concurrent use.
 */
@Component
public class ProcessRunner {

    private static final Logger LOG = LogManager.getLogger(ProcessRunner.class);

    static final int STDERR_MAX_BYTES = 16 * 1024;
    static final int ERROR_SNIPPET_MAX_CHARS = 500;

    private final ProcessFactory processFactory;

    public ProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    public ProcessResult run(ProcessCommand command, CancellationToken token) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(token, "token");
        token.throwIfCancelled(command.tool());

        long startTime = System.nanoTime();
        Process process;
        try {
            process = processFactory.start(command.command(), command.workingDir());
        } catch (IOException e) {
            throw ExternalProcessExceptionBuilder.create("Failed to start " + command.tool())
                    .tool(command.tool())
                    .code(command.startFailureCode())
                    .cause(e)
                    .metadata("executable", command.command().get(0))
                    .build();
        }

        StringBuffer stdout = new StringBuffer();
        StringBuffer stderr = new StringBuffer();
        Thread outGobbler = startGobbler(process.getInputStream(), stdout, command.tool() + "-out",
                command.maxStdoutBytes());
        Thread errGobbler = startGobbler(process.getErrorStream(), stderr, command.tool() + "-err",
                STDERR_MAX_BYTES);

        try (CancellationToken.Registration ignored = token.onCancel(() -> destroyProcess(process))) {
            boolean finished = process.waitFor(command.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (token.isCancelled()) {
                destroyProcess(process);
                throw new ConversionCancelledException(command.tool());
            }
            if (!finished) {
                destroyProcess(process);
                throw ExternalProcessExceptionBuilder
                        .create(command.tool() + " timed out after " + command.timeout().toMillis() + "ms")
                        .tool(command.tool())
                        .code(command.timeoutCode())
                        .durationMs(TimeUtils.elapsedMillis(startTime))
                        .metadata("stderr", snippet(stderr))
                        .build();
            }

            // Ensure gobblers have a moment to flush
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            ProcessResult result = new ProcessResult(process.exitValue(), stdout.toString(), stderr.toString(),
                    TimeUtils.elapsedMillis(startTime));
            LOG.debug("{} exited with {} in {} ms (stdout={} chars)", command.tool(), result.exitCode(),
                    result.durationMs(), result.stdout().length());
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyProcess(process);
            throw new ConversionCancelledException(command.tool());
        } finally {
            if (process.isAlive()) {
                destroyProcess(process);
            }
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        }
    }

    /**
     * Builds the exception for a process that exited with a failure code.
     */
    public static ExternalProcessException failure(String message, ProcessCommand command, ProcessResult result,
                                                   String code) {
        return ExternalProcessExceptionBuilder.create(message)
                .tool(command.tool())
                .code(code)
                .exitCode(result.exitCode())
                .durationMs(result.durationMs())
                .metadata("stderr", result.stderrSnippet(ERROR_SNIPPET_MAX_CHARS))
                .build();
    }

    private static String snippet(StringBuffer sb) {
        int len = Math.min(ERROR_SNIPPET_MAX_CHARS, sb.length());
        return sb.substring(0, len);
    }

    private static Thread startGobbler(InputStream inputStream, StringBuffer sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into the sink until the cap, then keeps draining without accumulating so the
     * process never blocks on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuffer sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuffer sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    if (sink.length() >= maxBytes) {
                        if (!capReached) {
                            LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                            capReached = true;
                        }
                        continue;
                    }
                    if (sink.length() > 0) {
                        sink.append('\n');
                    }
                    int available = maxBytes - sink.length();
                    if (line.length() > available) {
                        sink.append(line, 0, Math.max(0, available));
                        capReached = true;
                    } else {
                        sink.append(line);
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        } catch (RuntimeException e) {
            LOG.warn("Error destroying process: {}", e.toString());
        }
    }
}
