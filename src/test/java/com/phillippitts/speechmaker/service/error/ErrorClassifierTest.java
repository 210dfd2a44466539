package com.phillippitts.speechmaker.service.error;

import com.phillippitts.speechmaker.domain.ErrorCategory;
import com.phillippitts.speechmaker.domain.ErrorRecord;
import com.phillippitts.speechmaker.domain.Severity;
import com.phillippitts.speechmaker.domain.SuggestedAction;
import com.phillippitts.speechmaker.exception.ClassifiedException;
import com.phillippitts.speechmaker.exception.ConversionCancelledException;
import com.phillippitts.speechmaker.exception.ConverterUnavailableException;
import com.phillippitts.speechmaker.exception.ErrorCodes;
import com.phillippitts.speechmaker.exception.VoiceUnavailableException;
import com.phillippitts.speechmaker.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private final ErrorLog log = new ErrorLog(100);
    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final ErrorClassifier classifier =
            new ErrorClassifier(log, publisher, Clock.fixed(NOW, ZoneOffset.UTC));

    private static ErrorContext readFile(String name) {
        return ErrorContext.of(ErrorContext.READ_FILE).withFile(Path.of("/home/user", name));
    }

    @Test
    void missingTextFileSuggestsBrowsing() {
        // Act
        ErrorRecord record = classifier.classify(RawFailure.of(ErrorCodes.ENOENT, "open failed"),
                readFile("notes.txt"));

        // Assert
        assertThat(record.category()).isEqualTo(ErrorCategory.FILE_NOT_FOUND);
        assertThat(record.severity()).isEqualTo(Severity.ERROR);
        assertThat(record.canRetry()).isTrue();
        assertThat(record.suggestedAction()).isEqualTo(SuggestedAction.BROWSE_FILE);
        assertThat(record.userMessage()).isEqualTo("File not found: notes.txt");
        assertThat(record.troubleshooting()).isNotEmpty();
    }

    @Test
    void unsupportedFileTypeMessageIsNotRetryable() {
        ErrorRecord record = classifier.classify(RawFailure.ofMessage("Unsupported file type: .pdf"),
                readFile("report.pdf"));

        assertThat(record.category()).isEqualTo(ErrorCategory.UNSUPPORTED_FILE_TYPE);
        assertThat(record.canRetry()).isFalse();
        assertThat(record.suggestedAction()).isEqualTo(SuggestedAction.CONVERT_FILE);
        assertThat(record.userMessage()).isEqualTo("Unsupported file format: report.pdf");
    }

    @Test
    void codeTakesPrecedenceOverMessage() {
        ErrorRecord record = classifier.classify(
                RawFailure.of(ErrorCodes.EACCES, "Unsupported file type: .pdf"), readFile("a.txt"));

        assertThat(record.category()).isEqualTo(ErrorCategory.ACCESS_DENIED);
        assertThat(record.suggestedAction()).isEqualTo(SuggestedAction.CHECK_PERMISSIONS);
    }

    @Test
    void classifiesTableRowsByCode() {
        ErrorContext ctx = ErrorContext.of(ErrorContext.SYNTHESIZE);
        assertRow(ErrorCodes.VOICES_EMPTY, ctx, ErrorCategory.VOICE_UNAVAILABLE, Severity.CRITICAL, true,
                SuggestedAction.INSTALL_VOICES);
        assertRow(ErrorCodes.VOICE_NOT_FOUND, ctx, ErrorCategory.VOICE_UNAVAILABLE, Severity.WARNING, true,
                SuggestedAction.SELECT_VOICE);
        assertRow(ErrorCodes.ENGINE_TIMEOUT, ctx, ErrorCategory.ENGINE_UNRESPONSIVE, Severity.ERROR, true,
                SuggestedAction.RETRY);
        assertRow(ErrorCodes.EISDIR, ctx, ErrorCategory.IS_DIRECTORY, Severity.ERROR, true,
                SuggestedAction.BROWSE_FILE);
        assertRow(ErrorCodes.EMFILE, ctx, ErrorCategory.TOO_MANY_OPEN_FILES, Severity.ERROR, true,
                SuggestedAction.RESTART_APP);
        assertRow(ErrorCodes.FILE_TOO_LARGE, ctx, ErrorCategory.FILE_TOO_LARGE, Severity.ERROR, true,
                SuggestedAction.SPLIT_FILE);
        assertRow(ErrorCodes.EMPTY_INPUT, ctx, ErrorCategory.EMPTY_INPUT, Severity.WARNING, false,
                SuggestedAction.ADD_TEXT);
        assertRow(ErrorCodes.TRANSCODE_FAILED, ctx, ErrorCategory.CONVERSION_FAILED, Severity.ERROR, true,
                SuggestedAction.USE_WAV);
        assertRow(ErrorCodes.MERGE_FAILED, ctx, ErrorCategory.MERGE_FAILED, Severity.ERROR, true,
                SuggestedAction.RETRY_SMALLER);
        assertRow(ErrorCodes.OUTPUT_PATH, ctx, ErrorCategory.OUTPUT_LOCATION, Severity.ERROR, true,
                SuggestedAction.SELECT_FOLDER);
        assertRow(ErrorCodes.CANCELLED, ctx, ErrorCategory.CANCELLED, Severity.INFO, false,
                SuggestedAction.NONE);
    }

    private void assertRow(String code, ErrorContext ctx, ErrorCategory category, Severity severity,
                           boolean canRetry, SuggestedAction action) {
        ErrorRecord record = classifier.classify(RawFailure.of(code, "raw"), ctx);
        assertThat(record.category()).as(code).isEqualTo(category);
        assertThat(record.severity()).as(code).isEqualTo(severity);
        assertThat(record.canRetry()).as(code).isEqualTo(canRetry);
        assertThat(record.suggestedAction()).as(code).isEqualTo(action);
    }

    @Test
    void converterMissingSuggestsInstallDuringDetectionAndWavDuringConversion() {
        RawFailure raw = RawFailure.ofMessage("FFmpeg is not installed or not found on PATH");

        ErrorRecord detection = classifier.classify(raw, ErrorContext.of(ErrorContext.DETECT_CONVERTER));
        ErrorRecord conversion = classifier.classify(raw, ErrorContext.of(ErrorContext.TRANSCODE));

        assertThat(detection.category()).isEqualTo(ErrorCategory.CONVERTER_MISSING);
        assertThat(detection.suggestedAction()).isEqualTo(SuggestedAction.INSTALL_CONVERTER);
        assertThat(conversion.category()).isEqualTo(ErrorCategory.CONVERTER_MISSING);
        assertThat(conversion.suggestedAction()).isEqualTo(SuggestedAction.USE_WAV);
    }

    @Test
    void cleanupOperationAlwaysYieldsCleanupCategory() {
        ErrorRecord record = classifier.classify(RawFailure.of(ErrorCodes.EACCES, "permission denied"),
                ErrorContext.of(ErrorContext.CLEANUP));

        assertThat(record.category()).isEqualTo(ErrorCategory.CLEANUP);
        assertThat(record.severity()).isEqualTo(Severity.WARNING);
        assertThat(record.canRetry()).isFalse();
    }

    @Test
    void unrecognisedFailureIsUnknown() {
        ErrorRecord record = classifier.classify(new IllegalStateException("boom"),
                ErrorContext.of(ErrorContext.CONVERT));

        assertThat(record.category()).isEqualTo(ErrorCategory.UNKNOWN);
        assertThat(record.canRetry()).isFalse();
        assertThat(record.technicalMessage()).isEqualTo("boom");
        assertThat(record.operation()).isEqualTo(ErrorContext.CONVERT);
    }

    @Test
    void exceptionsMapToCodes() {
        ErrorContext ctx = ErrorContext.of(ErrorContext.READ_FILE);

        assertThat(classifier.classify(new NoSuchFileException("/x.txt"), ctx).category())
                .isEqualTo(ErrorCategory.FILE_NOT_FOUND);
        assertThat(classifier.classify(new AccessDeniedException("/x.txt"), ctx).category())
                .isEqualTo(ErrorCategory.ACCESS_DENIED);
        assertThat(classifier.classify(new FileSystemException("/x", null, "Is a directory"), ctx).category())
                .isEqualTo(ErrorCategory.IS_DIRECTORY);
        assertThat(classifier.classify(new ConversionCancelledException("merge"), ctx).category())
                .isEqualTo(ErrorCategory.CANCELLED);
        assertThat(classifier.classify(VoiceUnavailableException.noVoices(), ctx).category())
                .isEqualTo(ErrorCategory.VOICE_UNAVAILABLE);
        assertThat(classifier.classify(new ConverterUnavailableException("convert"), ctx).category())
                .isEqualTo(ErrorCategory.CONVERTER_MISSING);
    }

    @Test
    void unwrapsCompletionAndWalksCauseChain() {
        Exception nested = new RuntimeException("wrapper", new IOException("io", new NoSuchFileException("f")));

        ErrorRecord record = classifier.classify(new CompletionException(nested),
                ErrorContext.of(ErrorContext.READ_FILE));

        assertThat(record.category()).isEqualTo(ErrorCategory.FILE_NOT_FOUND);
        assertThat(record.technicalMessage()).isEqualTo("wrapper");
    }

    @Test
    void voiceNameComesFromContextOrMessage() {
        ErrorRecord fromContext = classifier.classify(RawFailure.of(ErrorCodes.VOICE_NOT_FOUND, "gone"),
                ErrorContext.of(ErrorContext.SYNTHESIZE).withVoice("en-GB-RyanNeural"));
        ErrorRecord fromMessage = classifier.classify(
                VoiceUnavailableException.notFound("en-US-AriaNeural"), ErrorContext.of(ErrorContext.CONVERT));

        assertThat(fromContext.userMessage()).contains("en-GB-RyanNeural");
        assertThat(fromMessage.userMessage()).contains("en-US-AriaNeural");
    }

    @Test
    void fileSizeIsExtractedFromMessage() {
        ErrorRecord record = classifier.classify(
                RawFailure.of(ErrorCodes.FILE_TOO_LARGE, "File too large: 12.50MB. Maximum size is 10MB."),
                readFile("big.txt"));

        assertThat(record.userMessage()).isEqualTo("File too large: 12.50MB (maximum 10MB)");
    }

    @Test
    void classificationIsDeterministicApartFromIdAndTimestamp() {
        RawFailure raw = RawFailure.of(ErrorCodes.ENGINE_START_FAILED, "Failed to start edge-tts");
        ErrorContext ctx = ErrorContext.of(ErrorContext.SYNTHESIZE).withVoice("v");

        ErrorRecord a = classifier.classify(raw, ctx);
        ErrorRecord b = classifier.classify(raw, ctx);

        assertThat(a).usingRecursiveComparison().ignoringFields("id", "timestamp").isEqualTo(b);
        assertThat(a.id()).isNotEqualTo(b.id());
    }

    @Test
    void idHasEpochMillisAndBase36Suffix() {
        ErrorRecord record = classifier.classify(RawFailure.ofMessage("x"), ErrorContext.of(ErrorContext.CONVERT));

        assertThat(record.id()).matches("err_" + NOW.toEpochMilli() + "_[0-9a-z]{9}");
        assertThat(record.timestamp()).isEqualTo(NOW);
    }

    @Test
    void recordsAreLoggedAndPublished() {
        ErrorRecord record = classifier.classify(RawFailure.ofMessage("x"), ErrorContext.of(ErrorContext.CONVERT));

        assertThat(log.recent(10)).containsExactly(record);
        assertThat(publisher.eventsOf(ErrorRecordedEvent.class))
                .extracting(ErrorRecordedEvent::record)
                .containsExactly(record);
    }

    @Test
    void alreadyClassifiedExceptionIsNotLoggedTwice() {
        ErrorRecord first = classifier.classify(RawFailure.of(ErrorCodes.MERGE_FAILED, "merging failed"),
                ErrorContext.of(ErrorContext.MERGE));
        ClassifiedException wrapped = new ClassifiedException(first, new RuntimeException());

        ErrorRecord again = classifier.classify(wrapped, ErrorContext.of(ErrorContext.CONVERT));
        ClassifiedException same = classifier.toException(wrapped, ErrorContext.of(ErrorContext.CONVERT));

        assertThat(again).isSameAs(first);
        assertThat(same).isSameAs(wrapped);
        assertThat(log.size()).isEqualTo(1);
    }
}
