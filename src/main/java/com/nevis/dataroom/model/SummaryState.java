package com.nevis.dataroom.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Summary slot of a page or a document.
 * <p>
 * A slot starts {@link Pending}, becomes {@link Done} once and stays so, or is {@link Failed}
 * for the current run. Only {@code Done} values are immutable; a failed slot is retried by a
 * later run.
 */
public sealed interface SummaryState permits SummaryState.Pending, SummaryState.Done, SummaryState.Failed {

    Pending PENDING = new Pending();

    static SummaryState pending() {
        return PENDING;
    }

    static SummaryState done(String text) {
        return new Done(text);
    }

    static SummaryState failed(PipelineStage stage, String reason) {
        return new Failed(stage, reason);
    }

    default boolean isDone() {
        return this instanceof Done;
    }

    default boolean isFailed() {
        return this instanceof Failed;
    }

    /**
     * Lowercase status name used in the index file and API responses.
     */
    default String code() {
        if (isDone()) {
            return "done";
        }
        return isFailed() ? "failed" : "pending";
    }

    default Optional<String> asText() {
        return this instanceof Done done ? Optional.of(done.text()) : Optional.empty();
    }

    /**
     * Moves the slot to {@code next}.
     *
     * @throws IllegalStateException if this slot already holds a completed summary
     */
    default SummaryState transitionTo(SummaryState next) {
        if (isDone()) {
            throw new IllegalStateException("Completed summary cannot be overwritten");
        }
        return Objects.requireNonNull(next, "next");
    }

    record Pending() implements SummaryState {
    }

    record Done(String text) implements SummaryState {
        public Done {
            Objects.requireNonNull(text, "text");
        }
    }

    record Failed(PipelineStage stage, String reason) implements SummaryState {
        public Failed {
            Objects.requireNonNull(stage, "stage");
            reason = reason == null || reason.isBlank() ? "unknown error" : reason;
        }
    }
}
