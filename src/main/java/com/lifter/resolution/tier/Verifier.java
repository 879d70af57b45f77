package com.lifter.resolution.tier;

import com.lifter.resolution.core.model.Tier;
import com.lifter.resolution.core.model.VerificationOutcome;

/**
 * One verification strategy. The resolver consults an ordered list of verifiers and stops at
 * the first VERIFIED outcome.
 *
 * <p>Implementations never throw for source failures; they report them as INCONCLUSIVE.
 * Missing context yields SKIPPED.</p>
 */
public interface Verifier {

    Tier tier();

    VerificationOutcome verify(VerificationRequest request);
}
