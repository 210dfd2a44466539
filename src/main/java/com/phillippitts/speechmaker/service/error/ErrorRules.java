package com.phillippitts.speechmaker.service.error;

import com.phillippitts.speechmaker.exception.ErrorCodes;

import java.util.List;
import java.util.Optional;

import static com.phillippitts.speechmaker.domain.ErrorCategory.ACCESS_DENIED;
import static com.phillippitts.speechmaker.domain.ErrorCategory.CANCELLED;
import static com.phillippitts.speechmaker.domain.ErrorCategory.CLEANUP;
import static com.phillippitts.speechmaker.domain.ErrorCategory.CONVERSION_FAILED;
import static com.phillippitts.speechmaker.domain.ErrorCategory.CONVERTER_MISSING;
import static com.phillippitts.speechmaker.domain.ErrorCategory.EMPTY_INPUT;
import static com.phillippitts.speechmaker.domain.ErrorCategory.ENGINE_UNRESPONSIVE;
import static com.phillippitts.speechmaker.domain.ErrorCategory.FILE_NOT_FOUND;
import static com.phillippitts.speechmaker.domain.ErrorCategory.FILE_TOO_LARGE;
import static com.phillippitts.speechmaker.domain.ErrorCategory.IS_DIRECTORY;
import static com.phillippitts.speechmaker.domain.ErrorCategory.MERGE_FAILED;
import static com.phillippitts.speechmaker.domain.ErrorCategory.OUTPUT_LOCATION;
import static com.phillippitts.speechmaker.domain.ErrorCategory.TOO_MANY_OPEN_FILES;
import static com.phillippitts.speechmaker.domain.ErrorCategory.UNKNOWN;
import static com.phillippitts.speechmaker.domain.ErrorCategory.UNSUPPORTED_FILE_TYPE;
import static com.phillippitts.speechmaker.domain.ErrorCategory.VOICE_UNAVAILABLE;
import static com.phillippitts.speechmaker.domain.Severity.CRITICAL;
import static com.phillippitts.speechmaker.domain.Severity.ERROR;
import static com.phillippitts.speechmaker.domain.Severity.INFO;
import static com.phillippitts.speechmaker.domain.Severity.WARNING;
import static com.phillippitts.speechmaker.domain.SuggestedAction.ADD_TEXT;
import static com.phillippitts.speechmaker.domain.SuggestedAction.BROWSE_FILE;
import static com.phillippitts.speechmaker.domain.SuggestedAction.CHECK_PERMISSIONS;
import static com.phillippitts.speechmaker.domain.SuggestedAction.CONVERT_FILE;
import static com.phillippitts.speechmaker.domain.SuggestedAction.INSTALL_CONVERTER;
import static com.phillippitts.speechmaker.domain.SuggestedAction.INSTALL_VOICES;
import static com.phillippitts.speechmaker.domain.SuggestedAction.NONE;
import static com.phillippitts.speechmaker.domain.SuggestedAction.RESTART_APP;
import static com.phillippitts.speechmaker.domain.SuggestedAction.RETRY;
import static com.phillippitts.speechmaker.domain.SuggestedAction.RETRY_SMALLER;
import static com.phillippitts.speechmaker.domain.SuggestedAction.SELECT_FOLDER;
import static com.phillippitts.speechmaker.domain.SuggestedAction.SELECT_VOICE;
import static com.phillippitts.speechmaker.domain.SuggestedAction.SPLIT_FILE;
import static com.phillippitts.speechmaker.domain.SuggestedAction.USE_WAV;

/**
 * The classification table. Lookup order: a {@code cleanup} operation always yields
 * {@code CLEANUP}; otherwise the first rule matching the raw code wins, then the first rule
 * matching the message, then {@code UNKNOWN}. Rules with an operation filter are listed before
 * their unfiltered counterparts.
 */
final class ErrorRules {

    static final ErrorRule CLEANUP_RULE = ErrorRule.builder(CLEANUP, WARNING)
            .retryable(false).action(NONE)
            .userMessage("Some temporary audio files could not be removed.")
            .troubleshooting(
                    "Temporary files are removed again on the next conversion",
                    "Check free disk space in the output folder")
            .build();

    static final ErrorRule UNKNOWN_RULE = ErrorRule.builder(UNKNOWN, ERROR)
            .retryable(false).action(NONE)
            .userMessage("An unexpected error occurred.")
            .troubleshooting(
                    "Try restarting the application",
                    "Check the application log for details",
                    "Contact support if the problem persists")
            .build();

    static final List<ErrorRule> RULES = List.of(
            ErrorRule.builder(VOICE_UNAVAILABLE, CRITICAL)
                    .retryable(true).action(INSTALL_VOICES)
                    .codes(ErrorCodes.VOICES_EMPTY)
                    .message("no (tts )?voices")
                    .userMessage("No text-to-speech voices are available on your system.")
                    .troubleshooting(
                            "Make sure the edge-tts engine is installed (pip install edge-tts)",
                            "Check your internet connection; voices are listed online",
                            "Restart the application after installing the engine",
                            "Use the retry button to reload the voice list")
                    .build(),
            ErrorRule.builder(VOICE_UNAVAILABLE, WARNING)
                    .retryable(true).action(SELECT_VOICE)
                    .codes(ErrorCodes.VOICE_NOT_FOUND)
                    .message("voice\\b.*\\bnot found")
                    .userMessage("The selected voice \"{voice}\" is no longer available.")
                    .troubleshooting(
                            "Select a different voice from the list",
                            "Refresh the voice list",
                            "Reset the voice to the default in settings")
                    .build(),
            ErrorRule.builder(ENGINE_UNRESPONSIVE, ERROR)
                    .retryable(true).action(RETRY)
                    .codes(ErrorCodes.ENGINE_START_FAILED, ErrorCodes.ENGINE_TIMEOUT, ErrorCodes.SYNTHESIS_FAILED)
                    .message("not responding|failed to execute edge-tts|tts conversion failed")
                    .userMessage("The text-to-speech engine is not responding.")
                    .troubleshooting(
                            "Try again; the engine may have been busy",
                            "Try with a shorter text sample",
                            "Check your internet connection",
                            "Restart the application if the problem persists")
                    .build(),
            ErrorRule.builder(FILE_NOT_FOUND, ERROR)
                    .retryable(true).action(BROWSE_FILE)
                    .codes(ErrorCodes.ENOENT)
                    .message("no such file")
                    .userMessage("File not found: {file}")
                    .troubleshooting(
                            "Check if the file exists at the specified location",
                            "Verify the file path is correct",
                            "Make sure the file hasn't been moved or deleted",
                            "Try browsing for the file again")
                    .build(),
            ErrorRule.builder(ACCESS_DENIED, ERROR)
                    .retryable(true).action(CHECK_PERMISSIONS)
                    .codes(ErrorCodes.EACCES, ErrorCodes.EPERM)
                    .message("permission denied|access denied")
                    .userMessage("Access denied: cannot read {file}")
                    .troubleshooting(
                            "Check if the file is open in another application",
                            "Verify you have permission to read the file",
                            "Check if the file is on a network drive with restricted access")
                    .build(),
            ErrorRule.builder(IS_DIRECTORY, ERROR)
                    .retryable(true).action(BROWSE_FILE)
                    .codes(ErrorCodes.EISDIR)
                    .message("is a directory")
                    .userMessage("Invalid selection: you selected a folder instead of a file")
                    .troubleshooting(
                            "Please select a .txt file, not a folder",
                            "Navigate into the folder and select a text file")
                    .build(),
            ErrorRule.builder(TOO_MANY_OPEN_FILES, ERROR)
                    .retryable(true).action(RESTART_APP)
                    .codes(ErrorCodes.EMFILE, ErrorCodes.ENFILE)
                    .message("too many open files")
                    .userMessage("Too many files are currently open")
                    .troubleshooting(
                            "Close some applications and try again",
                            "Restart the application if the problem persists")
                    .build(),
            ErrorRule.builder(UNSUPPORTED_FILE_TYPE, ERROR)
                    .retryable(false).action(CONVERT_FILE)
                    .codes(ErrorCodes.UNSUPPORTED_FILE_TYPE)
                    .message("unsupported file type")
                    .userMessage("Unsupported file format: {file}")
                    .troubleshooting(
                            "Only .txt files are supported",
                            "Save your document as plain text (.txt)",
                            "Copy and paste the text directly instead")
                    .build(),
            ErrorRule.builder(FILE_TOO_LARGE, ERROR)
                    .retryable(true).action(SPLIT_FILE)
                    .codes(ErrorCodes.FILE_TOO_LARGE)
                    .message("file too large")
                    .userMessage("File too large: {size}MB (maximum 10MB)")
                    .troubleshooting(
                            "Split the file into smaller parts (under 10MB each)",
                            "Remove unnecessary content from the file",
                            "Paste smaller portions of text directly")
                    .build(),
            ErrorRule.builder(EMPTY_INPUT, WARNING)
                    .retryable(false).action(ADD_TEXT)
                    .codes(ErrorCodes.EMPTY_INPUT)
                    .message("cannot be empty|file is empty|no readable text")
                    .userMessage("No text provided for conversion.")
                    .troubleshooting(
                            "Enter text in the input area or select a text file",
                            "Make sure the selected file contains readable text",
                            "Save the file as UTF-8 if it contains special characters")
                    .build(),
            ErrorRule.builder(CONVERTER_MISSING, WARNING)
                    .retryable(true).action(INSTALL_CONVERTER)
                    .codes(ErrorCodes.CONVERTER_MISSING, ErrorCodes.CONVERTER_TIMEOUT)
                    .message("ffmpeg is not installed|ffmpeg\\b.*\\bnot found")
                    .onlyFor(ErrorContext.DETECT_CONVERTER)
                    .userMessage("FFmpeg was not found. MP3 output is unavailable; WAV still works.")
                    .troubleshooting(
                            "Download FFmpeg from https://ffmpeg.org/download.html",
                            "Add the FFmpeg bin folder to your PATH",
                            "Restart the application after installation",
                            "Alternatively, use WAV format which doesn't require FFmpeg")
                    .build(),
            ErrorRule.builder(CONVERTER_MISSING, WARNING)
                    .retryable(true).action(USE_WAV)
                    .codes(ErrorCodes.CONVERTER_MISSING, ErrorCodes.CONVERTER_TIMEOUT)
                    .message("ffmpeg is not installed|ffmpeg\\b.*\\bnot found")
                    .userMessage("FFmpeg is required for MP3 conversion but is not installed.")
                    .troubleshooting(
                            "Use WAV format which doesn't require FFmpeg",
                            "Install FFmpeg and add it to your PATH",
                            "Restart the application after installation")
                    .build(),
            ErrorRule.builder(CONVERSION_FAILED, ERROR)
                    .retryable(true).action(USE_WAV)
                    .codes(ErrorCodes.TRANSCODE_FAILED)
                    .message("mp3 conversion failed")
                    .userMessage("MP3 conversion failed. The audio file may be corrupted.")
                    .troubleshooting(
                            "Try converting to WAV format instead",
                            "Check if there's enough disk space",
                            "Restart the application and try again")
                    .build(),
            ErrorRule.builder(MERGE_FAILED, ERROR)
                    .retryable(true).action(RETRY_SMALLER)
                    .codes(ErrorCodes.MERGE_FAILED)
                    .message("merging failed")
                    .userMessage("Failed to merge audio chunks. The conversion may be incomplete.")
                    .troubleshooting(
                            "Try converting smaller portions of text",
                            "Check if there's enough disk space",
                            "Use WAV format which is more reliable for large files")
                    .build(),
            ErrorRule.builder(OUTPUT_LOCATION, ERROR)
                    .retryable(true).action(SELECT_FOLDER)
                    .codes(ErrorCodes.OUTPUT_PATH)
                    .message("output path")
                    .userMessage("Cannot save to the selected output location.")
                    .troubleshooting(
                            "Check if the output folder exists and is writable",
                            "Select a different output folder",
                            "Check if there's enough disk space")
                    .build(),
            ErrorRule.builder(CANCELLED, INFO)
                    .retryable(false).action(NONE)
                    .codes(ErrorCodes.CANCELLED)
                    .message("cancelled")
                    .userMessage("Conversion was cancelled.")
                    .troubleshooting("Start a new conversion when ready")
                    .build()
    );

    private ErrorRules() {
    }

    static ErrorRule lookup(RawFailure raw, String operation) {
        if (ErrorContext.CLEANUP.equals(operation)) {
            return CLEANUP_RULE;
        }
        return byCode(raw.code(), operation)
                .or(() -> byMessage(raw.message(), operation))
                .orElse(UNKNOWN_RULE);
    }

    private static Optional<ErrorRule> byCode(String code, String operation) {
        return RULES.stream()
                .filter(r -> r.acceptsOperation(operation) && r.matchesCode(code))
                .findFirst();
    }

    private static Optional<ErrorRule> byMessage(String message, String operation) {
        return RULES.stream()
                .filter(r -> r.acceptsOperation(operation) && r.matchesMessage(message))
                .findFirst();
    }
}
