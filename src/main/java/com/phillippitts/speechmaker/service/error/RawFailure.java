package com.phillippitts.speechmaker.service.error;

import com.phillippitts.speechmaker.exception.ClassifiedException;
import com.phillippitts.speechmaker.exception.ErrorCodes;
import com.phillippitts.speechmaker.exception.SpeechMakerException;

import java.io.FileNotFoundException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Raw failure signature: an error code (may be null) and a message. Classification is a pure
 * function of this signature and the {@link ErrorContext}.
 *
 * @param code raw code, see {@link ErrorCodes}
 * @param message raw message, never null
 */
public record RawFailure(String code, String message) {

    public RawFailure {
        message = message == null ? "" : message;
    }

    public static RawFailure of(String code, String message) {
        return new RawFailure(code, message);
    }

    public static RawFailure ofMessage(String message) {
        return new RawFailure(null, message);
    }

    /**
     * Derives the signature from an exception, unwrapping future wrappers and walking the cause chain
     * for the first throwable that carries a recognizable code.
     */
    public static RawFailure from(Throwable error) {
        Throwable top = unwrap(error);
        String message = top.getMessage() != null ? top.getMessage() : top.getClass().getSimpleName();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable t = top; t != null && seen.add(t); t = t.getCause()) {
            String code = codeOf(t);
            if (code != null) {
                return new RawFailure(code, message);
            }
        }
        return new RawFailure(null, message);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static String codeOf(Throwable t) {
        if (t instanceof ClassifiedException classified) {
            return classified.getRecord().code();
        }
        if (t instanceof SpeechMakerException sme && sme.getErrorCode() != null) {
            return sme.getErrorCode();
        }
        if (t instanceof NoSuchFileException || t instanceof FileNotFoundException) {
            return ErrorCodes.ENOENT;
        }
        if (t instanceof AccessDeniedException) {
            return ErrorCodes.EACCES;
        }
        if (t instanceof FileSystemException fse) {
            String reason = fse.getReason() == null ? "" : fse.getReason().toLowerCase(Locale.ROOT);
            if (reason.contains("is a directory")) {
                return ErrorCodes.EISDIR;
            }
            if (reason.contains("too many open files")) {
                return ErrorCodes.EMFILE;
            }
        }
        if (t instanceof CancellationException) {
            return ErrorCodes.CANCELLED;
        }
        return null;
    }
}
