package com.lifter.resolution.decision;

import com.lifter.resolution.api.ResolutionContext;
import com.lifter.resolution.api.ResolverOptions;
import com.lifter.resolution.core.model.MeetResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Bodyweight checks that keep same-name people apart.
 *
 * <p>The resolver applies the guard twice: to the own results of a candidate a tier has just
 * confirmed, where a trip vetoes that match, and to all candidates' results once no tier could
 * tell them apart, where a trip forces a new lifter.</p>
 *
 * <p>The extreme-difference guard compares the row's bodyweight with every stored result of
 * the candidates. A result at least {@code extremeDifferenceKg} away trips the guard when the
 * two age categories cross the youth/junior to senior boundary, or when the gap also reaches
 * {@code extremeAbsoluteKg}. A tripped guard means the row belongs to a different person.</p>
 */
public class DisambiguationGuards {
    private static final Logger log = LoggerFactory.getLogger(DisambiguationGuards.class);

    private final double extremeDifferenceKg;
    private final double extremeAbsoluteKg;

    public DisambiguationGuards(ResolverOptions options) {
        this(options.getExtremeDifferenceKg(), options.getExtremeAbsoluteKg());
    }

    public DisambiguationGuards(double extremeDifferenceKg, double extremeAbsoluteKg) {
        if (extremeAbsoluteKg < extremeDifferenceKg) {
            throw new IllegalArgumentException("extremeAbsoluteKg must be >= extremeDifferenceKg");
        }
        this.extremeDifferenceKg = extremeDifferenceKg;
        this.extremeAbsoluteKg = extremeAbsoluteKg;
    }

    /**
     * Finds the first candidate result whose bodyweight is incompatible with the row.
     *
     * @param ctx              the row being resolved
     * @param candidateResults stored results of one or more same-name candidates
     * @return the offending result, empty when the guard does not trip or the row has no bodyweight
     */
    public Optional<MeetResult> findExtremeDifference(ResolutionContext ctx, List<MeetResult> candidateResults) {
        Double bodyweight = ctx.bodyweightKg();
        if (bodyweight == null || candidateResults == null) {
            return Optional.empty();
        }
        for (MeetResult existing : candidateResults) {
            if (existing.getBodyweightKg() == null) {
                continue;
            }
            double gap = Math.abs(existing.getBodyweightKg() - bodyweight);
            if (gap < extremeDifferenceKg) {
                continue;
            }
            boolean bracketsDiffer = AgeBracket.crossesSeniorBoundary(ctx.ageCategory(), existing.getAgeCategory());
            if (bracketsDiffer || gap >= extremeAbsoluteKg) {
                log.info("guard.extremeDifference lifterId={} gapKg={} existingCategory='{}' rowCategory='{}'",
                        existing.getLifterId(), gap, existing.getAgeCategory(), ctx.ageCategory());
                return Optional.of(existing);
            }
        }
        return Optional.empty();
    }
}
