package com.phillippitts.speechmaker.service.process;

import com.phillippitts.speechmaker.exception.ErrorCodes;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * An external command plus how to run it.
 *
 * @param tool short tool name for logs and errors, e.g. {@code edge-tts}
 * @param command executable and arguments
 * @param workingDir working directory, may be null
 * @param timeout upper bound for the whole run
 * @param maxStdoutBytes cap on captured stdout
 * @param startFailureCode error code when the process cannot be started
 * @param timeoutCode error code when the timeout elapses
 */
public record ProcessCommand(
        String tool,
        List<String> command,
        Path workingDir,
        Duration timeout,
        int maxStdoutBytes,
        String startFailureCode,
        String timeoutCode
) {
    static final int DEFAULT_MAX_STDOUT_BYTES = 64 * 1024;

    public ProcessCommand {
        Objects.requireNonNull(tool, "tool");
        Objects.requireNonNull(timeout, "timeout");
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        command = List.copyOf(command);
        if (maxStdoutBytes <= 0) {
            throw new IllegalArgumentException("maxStdoutBytes must be positive");
        }
    }

    public static ProcessCommand of(String tool, List<String> command, Duration timeout) {
        return new ProcessCommand(tool, command, null, timeout, DEFAULT_MAX_STDOUT_BYTES,
                ErrorCodes.ENGINE_START_FAILED, ErrorCodes.ENGINE_TIMEOUT);
    }

    public ProcessCommand withWorkingDir(Path dir) {
        return new ProcessCommand(tool, command, dir, timeout, maxStdoutBytes, startFailureCode, timeoutCode);
    }

    public ProcessCommand withMaxStdoutBytes(int bytes) {
        return new ProcessCommand(tool, command, workingDir, timeout, bytes, startFailureCode, timeoutCode);
    }

    public ProcessCommand withErrorCodes(String onStartFailure, String onTimeout) {
        return new ProcessCommand(tool, command, workingDir, timeout, maxStdoutBytes, onStartFailure, onTimeout);
    }
}
