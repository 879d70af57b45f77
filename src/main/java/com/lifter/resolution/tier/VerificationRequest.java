package com.lifter.resolution.tier;

import com.lifter.resolution.api.ResolutionContext;
import com.lifter.resolution.core.model.Lifter;

import java.util.List;
import java.util.Objects;

/**
 * Input of one verification tier.
 *
 * @param context        the row being resolved
 * @param normalizedName the row's canonical name
 * @param candidates     same-name lifters, in store order; empty when none exist
 */
public record VerificationRequest(ResolutionContext context, String normalizedName, List<Lifter> candidates) {

    public VerificationRequest {
        Objects.requireNonNull(context, "context is required");
        Objects.requireNonNull(normalizedName, "normalizedName is required");
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }
}
