package com.phillippitts.speechmaker.service.error;

import com.phillippitts.speechmaker.domain.ErrorCategory;
import com.phillippitts.speechmaker.domain.Severity;
import com.phillippitts.speechmaker.domain.SuggestedAction;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One row of the classification table.
 *
 * <p>A rule applies to a failure when its operation filter accepts the context (an empty filter
 * accepts all operations) and either the raw code is one of {@code codes} or the message matches
 * {@code messagePattern}. The user message may contain {@code {file}}, {@code {voice}} and
 * {@code {size}} placeholders.
 */
record ErrorRule(
        ErrorCategory category,
        Severity severity,
        boolean canRetry,
        SuggestedAction action,
        Set<String> codes,
        Pattern messagePattern,
        Set<String> operations,
        String userMessage,
        List<String> troubleshooting
) {

    boolean acceptsOperation(String operation) {
        return operations.isEmpty() || operations.contains(operation);
    }

    boolean matchesCode(String code) {
        return code != null && codes.contains(code);
    }

    boolean matchesMessage(String message) {
        return messagePattern != null && message != null && messagePattern.matcher(message).find();
    }

    static Builder builder(ErrorCategory category, Severity severity) {
        return new Builder(category, severity);
    }

    static final class Builder {
        private final ErrorCategory category;
        private final Severity severity;
        private boolean canRetry;
        private SuggestedAction action = SuggestedAction.NONE;
        private Set<String> codes = Set.of();
        private Pattern messagePattern;
        private Set<String> operations = Set.of();
        private String userMessage = "";
        private List<String> troubleshooting = List.of();

        private Builder(ErrorCategory category, Severity severity) {
            this.category = category;
            this.severity = severity;
        }

        Builder retryable(boolean canRetry) {
            this.canRetry = canRetry;
            return this;
        }

        Builder action(SuggestedAction action) {
            this.action = action;
            return this;
        }

        Builder codes(String... codes) {
            this.codes = Set.of(codes);
            return this;
        }

        Builder message(String regex) {
            this.messagePattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
            return this;
        }

        Builder onlyFor(String... operations) {
            this.operations = Set.of(operations);
            return this;
        }

        Builder userMessage(String userMessage) {
            this.userMessage = userMessage;
            return this;
        }

        Builder troubleshooting(String... steps) {
            this.troubleshooting = List.of(steps);
            return this;
        }

        ErrorRule build() {
            return new ErrorRule(category, severity, canRetry, action, codes, messagePattern, operations,
                    userMessage, troubleshooting);
        }
    }
}
