package org.example.formula.resolver;

import org.example.formula.exception.ResolutionException;
import org.example.formula.model.ResolvedGraph;
import org.example.formula.model.Selection;

import java.util.Optional;

/**
 * Result of a resolution run. Failure is reported here as data, never thrown.
 */
public class ResolutionResult {

    private final ResolutionStatus status;
    private final Selection selection;
    private final ResolvedGraph graph;
    private final Conflict conflict;
    private final String message;
    private final long steps;
    private final long backtracks;
    private final long executionTimeMs;

    private ResolutionResult(Builder builder) {
        this.status = builder.status;
        this.selection = builder.selection;
        this.graph = builder.graph;
        this.conflict = builder.conflict;
        this.message = builder.message;
        this.steps = builder.steps;
        this.backtracks = builder.backtracks;
        this.executionTimeMs = builder.executionTimeMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ResolutionStatus getStatus() {
        return status;
    }

    public boolean isSolved() {
        return status == ResolutionStatus.SOLVED;
    }

    public boolean isCancelled() {
        return status == ResolutionStatus.CANCELLED;
    }

    public Optional<Selection> getSelection() {
        return Optional.ofNullable(selection);
    }

    public Optional<ResolvedGraph> getGraph() {
        return Optional.ofNullable(graph);
    }

    public Optional<Conflict> getConflict() {
        return Optional.ofNullable(conflict);
    }

    public String getMessage() {
        return message;
    }

    public long getSteps() {
        return steps;
    }

    public long getBacktracks() {
        return backtracks;
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    /**
     * Returns the selection of a solved run.
     *
     * @throws ResolutionException if the run was exhausted or cancelled
     */
    public Selection getSelectionOrThrow() throws ResolutionException {
        if (selection == null) {
            throw new ResolutionException("Resolution " + status.name().toLowerCase() + ": " + message);
        }
        return selection;
    }

    @Override
    public String toString() {
        return switch (status) {
            case SOLVED -> String.format(
                    "ResolutionResult{status=SOLVED, selection=%s, steps=%d, backtracks=%d, time=%dms}",
                    selection, steps, backtracks, executionTimeMs);
            case EXHAUSTED, CANCELLED -> String.format(
                    "ResolutionResult{status=%s, message='%s', steps=%d, backtracks=%d, time=%dms}",
                    status, message, steps, backtracks, executionTimeMs);
        };
    }

    public static class Builder {
        private ResolutionStatus status = ResolutionStatus.EXHAUSTED;
        private Selection selection;
        private ResolvedGraph graph;
        private Conflict conflict;
        private String message;
        private long steps;
        private long backtracks;
        private long executionTimeMs;

        public Builder status(ResolutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder selection(Selection selection) {
            this.selection = selection;
            return this;
        }

        public Builder graph(ResolvedGraph graph) {
            this.graph = graph;
            return this;
        }

        public Builder conflict(Conflict conflict) {
            this.conflict = conflict;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder steps(long steps) {
            this.steps = steps;
            return this;
        }

        public Builder backtracks(long backtracks) {
            this.backtracks = backtracks;
            return this;
        }

        public Builder executionTimeMs(long executionTimeMs) {
            this.executionTimeMs = executionTimeMs;
            return this;
        }

        public ResolutionResult build() {
            return new ResolutionResult(this);
        }
    }
}
