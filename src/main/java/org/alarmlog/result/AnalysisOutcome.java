package org.alarmlog.result;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of an anomaly or forecasting run. A run either succeeds with a value or
 * fails with a reason code and a message that can be shown to the user as is.
 * Failed runs never carry figures.
 *
 * @param <T> result payload of a successful run
 */
public abstract class AnalysisOutcome<T> {

    private AnalysisOutcome() {
    }

    public static <T> AnalysisOutcome<T> success(T value, String summary, List<String> figures) {
        return new Success<>(value, summary, figures);
    }

    public static <T> AnalysisOutcome<T> failure(FailureReason reason, String message) {
        return new Failure<>(reason, message);
    }

    public abstract boolean isSuccess();

    /**
     * Human-readable summary, the error message for failed runs.
     */
    public abstract String summary();

    /**
     * Base64 encoded PNG images.
     */
    public abstract List<String> figures();

    public abstract Optional<T> value();

    public static final class Success<T> extends AnalysisOutcome<T> {
        private final T value;
        private final String summary;
        private final List<String> figures;

        private Success(T value, String summary, List<String> figures) {
            this.value = Objects.requireNonNull(value, "value");
            this.summary = Objects.requireNonNull(summary, "summary");
            this.figures = List.copyOf(figures);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public String summary() {
            return summary;
        }

        @Override
        public List<String> figures() {
            return figures;
        }

        @Override
        public Optional<T> value() {
            return Optional.of(value);
        }

        public T get() {
            return value;
        }

        @Override
        public String toString() {
            return "Success{" + summary + ", figures=" + figures.size() + "}";
        }
    }

    public static final class Failure<T> extends AnalysisOutcome<T> {
        private final FailureReason reason;
        private final String message;

        private Failure(FailureReason reason, String message) {
            this.reason = Objects.requireNonNull(reason, "reason");
            this.message = Objects.requireNonNull(message, "message");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public String summary() {
            return message;
        }

        @Override
        public List<String> figures() {
            return Collections.emptyList();
        }

        @Override
        public Optional<T> value() {
            return Optional.empty();
        }

        public FailureReason reason() {
            return reason;
        }

        @Override
        public String toString() {
            return "Failure{" + reason + ": " + message + "}";
        }
    }
}
