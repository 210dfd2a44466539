package com.phillippitts.speechmaker.service.process;

/**
 * Outcome of a process that exited on its own.
 *
 * @param exitCode process exit code
 * @param stdout captured stdout (capped)
 * @param stderr captured stderr (capped)
 * @param durationMs wall time of the run
 */
public record ProcessResult(int exitCode, String stdout, String stderr, long durationMs) {

    public boolean isSuccess() {
        return exitCode == 0;
    }

    /** First {@code maxChars} characters of stderr, for error messages. */
    public String stderrSnippet(int maxChars) {
        return stderr.length() <= maxChars ? stderr : stderr.substring(0, maxChars);
    }
}
