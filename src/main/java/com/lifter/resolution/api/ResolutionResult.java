package com.lifter.resolution.api;

import com.lifter.resolution.core.model.IntegrityConflict;
import com.lifter.resolution.core.model.Lifter;
import com.lifter.resolution.core.model.OutcomeCode;
import com.lifter.resolution.core.model.ResolutionState;
import com.lifter.resolution.core.model.ResultField;
import com.lifter.resolution.core.model.VerificationOutcome;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of resolving one row.
 *
 * Carries the lifter the row belongs to, how it was decided, the states the resolver passed
 * through, every tier outcome and any integrity conflicts observed on the way.
 */
public final class ResolutionResult {

    private final String correlationId;
    private final Lifter lifter;
    private final OutcomeCode outcome;
    private final List<ResolutionState> path;
    private final List<VerificationOutcome> tierOutcomes;
    private final List<IntegrityConflict> conflicts;
    private final Map<ResultField, Object> resultEnrichment;
    private final String reasoning;

    private ResolutionResult(Builder builder) {
        this.correlationId = builder.correlationId;
        this.lifter = Objects.requireNonNull(builder.lifter, "lifter is required");
        this.outcome = Objects.requireNonNull(builder.outcome, "outcome is required");
        this.path = builder.path != null ? List.copyOf(builder.path) : List.of();
        this.tierOutcomes = builder.tierOutcomes != null ? List.copyOf(builder.tierOutcomes) : List.of();
        this.conflicts = builder.conflicts != null ? List.copyOf(builder.conflicts) : List.of();
        this.resultEnrichment = builder.resultEnrichment != null && !builder.resultEnrichment.isEmpty()
                ? new EnumMap<>(builder.resultEnrichment) : Map.of();
        this.reasoning = builder.reasoning;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    /**
     * The resolved lifter. For a new lifter returned by {@link IdentityResolver#decide} this is
     * an unsaved draft with a null lifter id.
     */
    public Lifter getLifter() {
        return lifter;
    }

    public OutcomeCode getOutcome() {
        return outcome;
    }

    /**
     * States visited, in order, starting with {@link ResolutionState#START}.
     */
    public List<ResolutionState> getPath() {
        return path;
    }

    public List<VerificationOutcome> getTierOutcomes() {
        return tierOutcomes;
    }

    public List<IntegrityConflict> getConflicts() {
        return conflicts;
    }

    /**
     * Result fields harvested for this row's lifter, to be merged null-only into the stored result.
     */
    public Map<ResultField, Object> getResultEnrichment() {
        return resultEnrichment;
    }

    public String getReasoning() {
        return reasoning;
    }

    public boolean isNewLifter() {
        return outcome.isCreation();
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    /**
     * Returns a copy pointing at the given lifter, used once a draft has been persisted.
     */
    public ResolutionResult withLifter(Lifter persisted) {
        return toBuilder().lifter(persisted).build();
    }

    /**
     * Returns a copy with one more conflict.
     */
    public ResolutionResult withConflict(IntegrityConflict conflict) {
        List<IntegrityConflict> all = new ArrayList<>(conflicts);
        all.add(conflict);
        return toBuilder().conflicts(all).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .correlationId(correlationId)
                .lifter(lifter)
                .outcome(outcome)
                .path(path)
                .tierOutcomes(tierOutcomes)
                .conflicts(conflicts)
                .resultEnrichment(resultEnrichment)
                .reasoning(reasoning);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String correlationId;
        private Lifter lifter;
        private OutcomeCode outcome;
        private List<ResolutionState> path;
        private List<VerificationOutcome> tierOutcomes;
        private List<IntegrityConflict> conflicts;
        private Map<ResultField, Object> resultEnrichment;
        private String reasoning;

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder lifter(Lifter lifter) {
            this.lifter = lifter;
            return this;
        }

        public Builder outcome(OutcomeCode outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder path(List<ResolutionState> path) {
            this.path = path;
            return this;
        }

        public Builder tierOutcomes(List<VerificationOutcome> tierOutcomes) {
            this.tierOutcomes = tierOutcomes;
            return this;
        }

        public Builder conflicts(List<IntegrityConflict> conflicts) {
            this.conflicts = conflicts;
            return this;
        }

        public Builder resultEnrichment(Map<ResultField, Object> resultEnrichment) {
            this.resultEnrichment = resultEnrichment;
            return this;
        }

        public Builder reasoning(String reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public ResolutionResult build() {
            return new ResolutionResult(this);
        }
    }

    @Override
    public String toString() {
        return "ResolutionResult{" +
                "lifterId=" + lifter.getLifterId() +
                ", name='" + lifter.getNormalizedName() + '\'' +
                ", outcome=" + outcome +
                ", path=" + path +
                ", conflicts=" + conflicts.size() +
                ", reasoning='" + reasoning + '\'' +
                '}';
    }
}
