package com.lifter.resolution.api;

import com.lifter.resolution.audit.AuditAction;
import com.lifter.resolution.audit.AuditService;
import com.lifter.resolution.core.model.AthleteSummary;
import com.lifter.resolution.core.model.ConflictType;
import com.lifter.resolution.core.model.IntegrityConflict;
import com.lifter.resolution.core.model.Lifter;
import com.lifter.resolution.core.model.LifterField;
import com.lifter.resolution.core.model.MeetResult;
import com.lifter.resolution.core.model.OutcomeCode;
import com.lifter.resolution.core.model.ResolutionState;
import com.lifter.resolution.core.model.ResultField;
import com.lifter.resolution.core.model.Tier;
import com.lifter.resolution.core.model.VerificationOutcome;
import com.lifter.resolution.decision.DisambiguationGuards;
import com.lifter.resolution.logging.LogContext;
import com.lifter.resolution.merge.EnrichmentMerger;
import com.lifter.resolution.metrics.MetricsService;
import com.lifter.resolution.metrics.NoOpMetricsService;
import com.lifter.resolution.rules.CountryCodes;
import com.lifter.resolution.rules.InputValidator;
import com.lifter.resolution.rules.NameNormalizer;
import com.lifter.resolution.source.SourceUnavailableException;
import com.lifter.resolution.store.CandidateLookup;
import com.lifter.resolution.store.LifterRepository;
import com.lifter.resolution.store.StableIdAssignment;
import com.lifter.resolution.store.StableIdConflictException;
import com.lifter.resolution.tier.TierRetryPolicy;
import com.lifter.resolution.tier.VerificationRequest;
import com.lifter.resolution.tier.Verifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Main entry point for lifter identity resolution.
 * Decides, for one result row, which stored lifter the row belongs to or that a new lifter
 * must be created.
 *
 * <h2>Matching hierarchy</h2>
 * <ol>
 *   <li>stable id held by exactly one lifter whose name matches</li>
 *   <li>a same-name candidate confirmed by a verification tier</li>
 *   <li>the only same-name candidate, when nothing makes it doubtful</li>
 *   <li>otherwise a new lifter</li>
 * </ol>
 *
 * <p>Verifiers form an ordered list. The resolver runs them in tier order, retrying
 * INCONCLUSIVE outcomes, until one confirms a candidate or the list is exhausted. A source
 * that keeps failing never stops a row: the row ends in CREATE_NEW.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * IdentityResolver resolver = IdentityResolver.builder()
 *     .repository(repository)
 *     .verifier(divisionVerifier)
 *     .verifier(memberHistoryVerifier)
 *     .build();
 *
 * ResolutionResult result = resolver.resolve(ResolutionContext.fromRow(row));
 * Lifter lifter = result.getLifter();
 * </pre>
 */
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private static final Set<Tier> ALL_TIERS = EnumSet.allOf(Tier.class);
    private static final Set<Tier> DIVISION_ONLY = EnumSet.of(Tier.DIVISION_RANKINGS);
    private static final Set<Tier> HISTORY_ONLY = EnumSet.of(Tier.MEMBER_HISTORY);

    private final LifterRepository repository;
    private final CandidateLookup lookup;
    private final List<Verifier> verifiers;
    private final TierRetryPolicy retryPolicy;
    private final DisambiguationGuards guards;
    private final NameNormalizer nameNormalizer;
    private final CountryCodes countryCodes;
    private final ResolverOptions options;
    private final MetricsService metricsService;
    private final AuditService auditService;

    private IdentityResolver(Builder builder) {
        this.repository = Objects.requireNonNull(builder.repository, "repository is required");
        this.lookup = new CandidateLookup(repository);
        this.options = builder.options;
        this.verifiers = builder.verifiers.stream()
                .sorted(Comparator.comparingInt(v -> v.tier().level()))
                .toList();
        this.retryPolicy = builder.retryPolicy != null
                ? builder.retryPolicy : new TierRetryPolicy(options.getTierRetries(), options.getRetryBackoff());
        this.guards = new DisambiguationGuards(options);
        this.nameNormalizer = builder.nameNormalizer != null ? builder.nameNormalizer : new NameNormalizer();
        this.countryCodes = builder.countryCodes;
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();

        log.info("IdentityResolver initialized with tiers: {}", verifiers.stream().map(Verifier::tier).toList());
    }

    /**
     * Resolves a row to a lifter, persisting a new lifter when one is needed.
     */
    public ResolutionResult resolve(ResolutionContext ctx) {
        ResolutionResult decided = decide(ctx);
        if (decided.getLifter().isPersisted()) {
            return decided;
        }
        try (LogContext lc = LogContext.forRow(ctx.correlationId(), ctx.meetId(), ctx.name())) {
            Lifter draft = decided.getLifter();
            try {
                Lifter created = repository.createLifter(draft);
                auditCreated(created, decided.getOutcome());
                return decided.withLifter(created);
            } catch (StableIdConflictException e) {
                IntegrityConflict conflict = stableIdRaceLost(e);
                Lifter created = repository.createLifter(draft.toBuilder().stableId(null).build());
                auditCreated(created, decided.getOutcome());
                return decided.withLifter(created).withConflict(conflict);
            }
        }
    }

    /**
     * Resolves a row without persisting a new lifter. When the outcome is a creation the
     * returned lifter is an unsaved draft that the caller stores together with the row's result.
     * Stable-id assignments and null-only enrichment of existing lifters are written immediately.
     */
    public ResolutionResult decide(ResolutionContext ctx) {
        InputValidator.validateLifterName(ctx.name());
        InputValidator.validateStableId(ctx.stableId());

        long start = System.nanoTime();
        try (LogContext lc = LogContext.forRow(ctx.correlationId(), ctx.meetId(), ctx.name())) {
            Attempt attempt = new Attempt(ctx, nameNormalizer.normalize(ctx.name()));
            log.info("resolution.start athlete='{}' normalized='{}' stableId={}",
                    ctx.name(), attempt.name, ctx.stableId());

            ResolutionResult result = run(attempt);

            for (IntegrityConflict c : result.getConflicts()) {
                metricsService.incrementConflict(c.type());
                Map<String, Object> details = new HashMap<>();
                details.put("type", c.type().name());
                details.put("stableId", c.stableId());
                details.put("lifterIds", c.lifterIds().toString());
                details.put("detail", c.detail());
                auditService.record(AuditAction.INTEGRITY_CONFLICT, result.getLifter().getLifterId(), details);
            }
            metricsService.recordResolutionDuration(result.getOutcome(), Duration.ofNanos(System.nanoTime() - start));
            log.info("resolution.resolved lifterId={} outcome={} path={} conflicts={}",
                    result.getLifter().getLifterId(), result.getOutcome(), result.getPath(),
                    result.getConflicts().size());
            return result;
        }
    }

    private ResolutionResult run(Attempt a) {
        ResolutionContext ctx = a.ctx;

        if (ctx.stableId() != null) {
            a.enter(ResolutionState.STABLE_ID_LOOKUP);
            Optional<Lifter> owner = byStableId(a, ctx.stableId());
            if (owner.isPresent()) {
                return resolved(a, owner.get(), OutcomeCode.RESOLVED_BY_STABLE_ID, "stable id matches");
            }
        }

        a.enter(ResolutionState.NAME_LOOKUP);
        List<Lifter> candidates = lookup.findByName(a.name);
        if (candidates.isEmpty()) {
            return zeroCandidates(a);
        }
        if (candidates.size() == 1) {
            return oneCandidate(a, candidates.get(0));
        }
        return manyCandidates(a, candidates);
    }

    private Optional<Lifter> byStableId(Attempt a, long stableId) {
        List<Lifter> holders = lookup.findByStableId(stableId);
        if (holders.isEmpty()) {
            return Optional.empty();
        }
        List<Lifter> named = holders.stream()
                .filter(l -> nameNormalizer.sameName(l.getNormalizedName(), a.name))
                .toList();
        if (holders.size() > 1) {
            a.conflicts.add(conflict(ConflictType.DUPLICATE_STABLE_ID, stableId, ids(holders),
                    "stable id held by " + holders.size() + " lifters"));
            return named.size() == 1 ? Optional.of(named.get(0)) : Optional.empty();
        }
        if (named.isEmpty()) {
            Lifter holder = holders.get(0);
            a.conflicts.add(conflict(ConflictType.STABLE_ID_NAME_MISMATCH, stableId, ids(holders),
                    "stable id held by '" + holder.getNormalizedName() + "'"));
            return Optional.empty();
        }
        return Optional.of(named.get(0));
    }

    private ResolutionResult zeroCandidates(Attempt a) {
        a.enter(ResolutionState.ZERO);
        if (a.ctx.hasDivision()) {
            a.enter(ResolutionState.VERIFY);
            runTiers(a, List.of(), DIVISION_ONLY);
        }
        return createNew(a, OutcomeCode.CREATED_NEW, "no lifter with this name");
    }

    private ResolutionResult oneCandidate(Attempt a, Lifter candidate) {
        a.enter(ResolutionState.ONE);
        ResolutionContext ctx = a.ctx;
        boolean doubtful = false;
        Lifter current = candidate;

        if (ctx.stableId() != null) {
            if (!candidate.hasStableId()) {
                StableIdAssignment assignment = repository.assignStableIdIfAbsent(candidate.getLifterId(),
                        ctx.stableId());
                switch (assignment) {
                    case ASSIGNED -> {
                        auditService.record(AuditAction.STABLE_ID_DISCOVERED, candidate.getLifterId(),
                                Map.of("stableId", ctx.stableId(), "source", "row"));
                        current = reload(candidate);
                    }
                    case OWNED_BY_OTHER -> a.conflicts.add(conflict(ConflictType.STABLE_ID_OWNED_BY_OTHER,
                            ctx.stableId(), List.of(candidate.getLifterId()),
                            "row stable id already held by another lifter"));
                    case HOLDS_DIFFERENT -> {
                        current = reload(candidate);
                        doubtful = true;
                        a.conflicts.add(mismatch(current, ctx.stableId()));
                    }
                    default -> current = reload(candidate);
                }
            } else if (!candidate.getStableId().equals(ctx.stableId())) {
                doubtful = true;
                a.conflicts.add(mismatch(candidate, ctx.stableId()));
            }
        }

        List<MeetResult> history = repository.findResultsByLifterIds(List.of(candidate.getLifterId()));
        Optional<MeetResult> replay = findReplay(ctx, history);
        if (replay.isPresent()) {
            return resolved(a, current, OutcomeCode.RESOLVED_BY_NAME, "row already recorded for this lifter");
        }
        boolean sameDivision = hasSameDivisionResult(ctx, history);
        if (sameDivision) {
            log.info("resolution.sameDivisionResult lifterId={} meetId={}", candidate.getLifterId(), ctx.meetId());
            doubtful = true;
        }

        if (!doubtful) {
            return resolved(a, current, OutcomeCode.RESOLVED_BY_NAME, "single lifter with this name");
        }

        a.enter(ResolutionState.VERIFY);
        Optional<VerificationOutcome> confirmed = runTiers(a, List.of(current), HISTORY_ONLY);
        if (confirmed.isPresent()) {
            return resolved(a, reload(current), OutcomeCode.RESOLVED_BY_TIER2, confirmed.get().reason());
        }
        if (a.vetoed) {
            return createNew(a, OutcomeCode.CREATED_NEW_EXTREME_SPLIT,
                    "confirmed candidate has an extreme bodyweight difference");
        }
        return createNew(a, OutcomeCode.CREATED_NEW, "single candidate could not be confirmed");
    }

    private ResolutionResult manyCandidates(Attempt a, List<Lifter> candidates) {
        a.enter(ResolutionState.MANY);
        ResolutionContext ctx = a.ctx;
        Long stableId = ctx.stableId();

        if (stableId != null) {
            for (Lifter candidate : candidates) {
                if (stableId.equals(candidate.getStableId())) {
                    return resolved(a, candidate, OutcomeCode.RESOLVED_BY_STABLE_ID, "stable id matches candidate");
                }
            }
            List<Lifter> pending = candidates.stream().filter(c -> !c.hasStableId()).toList();
            if (pending.size() == 1 && !lookup.isStableIdTaken(stableId)) {
                Lifter candidate = pending.get(0);
                StableIdAssignment assignment = repository.assignStableIdIfAbsent(candidate.getLifterId(), stableId);
                if (assignment == StableIdAssignment.ASSIGNED) {
                    auditService.record(AuditAction.STABLE_ID_DISCOVERED, candidate.getLifterId(),
                            Map.of("stableId", stableId, "source", "row"));
                    return resolved(a, reload(candidate), OutcomeCode.RESOLVED_BY_PENDING_CANDIDATE,
                            "only candidate without a stable id");
                }
                log.info("resolution.pendingAssignLost lifterId={} stableId={} result={}",
                        candidate.getLifterId(), stableId, assignment);
            }
        }

        List<MeetResult> history = repository.findResultsByLifterIds(ids(candidates));
        Optional<MeetResult> replay = findReplay(ctx, history);
        if (replay.isPresent()) {
            Lifter owner = candidates.stream()
                    .filter(c -> c.getLifterId().equals(replay.get().getLifterId()))
                    .findFirst()
                    .orElseThrow();
            return resolved(a, owner, OutcomeCode.RESOLVED_BY_NAME, "row already recorded for this lifter");
        }

        a.enter(ResolutionState.VERIFY);
        boolean skipDivision = options.isSameDivisionSkipsTier1() && hasSameDivisionResult(ctx, history);
        if (skipDivision) {
            log.info("resolution.tier1Skipped reason=sameMeetAndDivision meetId={}", ctx.meetId());
        }
        Optional<VerificationOutcome> confirmed = runTiers(a, candidates, skipDivision ? HISTORY_ONLY : ALL_TIERS);
        if (confirmed.isPresent()) {
            VerificationOutcome outcome = confirmed.get();
            Lifter winner = candidates.stream()
                    .filter(c -> c.getLifterId().equals(outcome.matchedLifterId()))
                    .findFirst()
                    .map(this::reload)
                    .orElseThrow();
            OutcomeCode code = outcome.tier() == Tier.DIVISION_RANKINGS
                    ? OutcomeCode.RESOLVED_BY_TIER1 : OutcomeCode.RESOLVED_BY_TIER2;
            return resolved(a, winner, code, outcome.reason());
        }

        Optional<MeetResult> extreme = guards.findExtremeDifference(ctx, history);
        if (extreme.isPresent()) {
            Map<String, Object> details = new HashMap<>();
            details.put("existingLifterId", extreme.get().getLifterId());
            details.put("existingBodyweightKg", extreme.get().getBodyweightKg());
            details.put("rowBodyweightKg", ctx.bodyweightKg());
            details.put("existingAgeCategory", extreme.get().getAgeCategory());
            auditService.record(AuditAction.EXTREME_DIFFERENCE_SPLIT, extreme.get().getLifterId(), details);
            return createNew(a, OutcomeCode.CREATED_NEW_EXTREME_SPLIT, "extreme bodyweight difference");
        }
        return createNew(a, OutcomeCode.CREATED_NEW, "no candidate could be confirmed");
    }

    /**
     * Runs the allowed tiers in order until one confirms a candidate.
     *
     * <p>A confirmed candidate whose own results fail the extreme-difference guard is rejected:
     * the conflict is recorded, the candidate is dropped and the same tier is asked again about
     * the remaining candidates before moving on.</p>
     */
    private Optional<VerificationOutcome> runTiers(Attempt a, List<Lifter> candidates, Set<Tier> allowed) {
        List<Lifter> remaining = new ArrayList<>(candidates);
        for (Verifier verifier : verifiers) {
            if (!allowed.contains(verifier.tier())) {
                continue;
            }
            while (true) {
                VerificationOutcome outcome = runTier(a, verifier, remaining);
                if (!outcome.hasMatch()) {
                    log.debug("resolution.tierDone tier={} status={} reason='{}'",
                            verifier.tier(), outcome.status(), outcome.reason());
                    break;
                }
                Lifter winner = remaining.stream()
                        .filter(c -> c.getLifterId().equals(outcome.matchedLifterId()))
                        .findFirst()
                        .orElseThrow();
                if (rejectedByGuard(a, outcome, winner)) {
                    remaining.remove(winner);
                    if (remaining.isEmpty()) {
                        return Optional.empty();
                    }
                    continue;
                }
                if (outcome.discoveredStableId() != null && !linkDiscoveredId(a, outcome)) {
                    break;
                }
                auditService.record(AuditAction.TIER_VERIFIED, outcome.matchedLifterId(),
                        Map.of("tier", verifier.tier().name(), "reason", String.valueOf(outcome.reason())));
                return Optional.of(outcome);
            }
        }
        return Optional.empty();
    }

    private VerificationOutcome runTier(Attempt a, Verifier verifier, List<Lifter> candidates) {
        VerificationRequest request = new VerificationRequest(a.ctx, a.name, List.copyOf(candidates));
        VerificationOutcome outcome;
        try (LogContext tc = LogContext.forTier(verifier.tier().name())) {
            outcome = retryPolicy.execute(verifier, request);
        } catch (SourceUnavailableException e) {
            log.warn("resolution.tierUnavailable tier={} error={}", verifier.tier(), e.getMessage());
            outcome = VerificationOutcome.inconclusive(verifier.tier(), e.getMessage());
        }
        a.tierOutcomes.add(outcome);
        a.conflicts.addAll(outcome.conflicts());
        metricsService.recordTierOutcome(verifier.tier(), outcome.status());
        remember(a, outcome);
        return outcome;
    }

    /**
     * Applies the extreme-difference guard to the confirmed candidate's own results. A tripped
     * guard overrides the tier's confirmation.
     */
    private boolean rejectedByGuard(Attempt a, VerificationOutcome outcome, Lifter winner) {
        List<MeetResult> own = repository.findResultsByLifterIds(List.of(winner.getLifterId()));
        Optional<MeetResult> extreme = guards.findExtremeDifference(a.ctx, own);
        if (extreme.isEmpty()) {
            return false;
        }
        a.vetoed = true;
        Long stableId = outcome.discoveredStableId() != null ? outcome.discoveredStableId() : winner.getStableId();
        a.conflicts.add(conflict(ConflictType.EXTREME_DIFFERENCE_VETO, stableId, List.of(winner.getLifterId()),
                outcome.tier() + " match rejected: stored bodyweight " + extreme.get().getBodyweightKg()
                        + " kg, row " + a.ctx.bodyweightKg() + " kg"));
        Map<String, Object> details = new HashMap<>();
        details.put("tier", outcome.tier().name());
        details.put("existingBodyweightKg", extreme.get().getBodyweightKg());
        details.put("rowBodyweightKg", a.ctx.bodyweightKg());
        details.put("existingAgeCategory", extreme.get().getAgeCategory());
        auditService.record(AuditAction.EXTREME_DIFFERENCE_SPLIT, winner.getLifterId(), details);
        log.info("resolution.tierMatchRejected tier={} lifterId={} existingKg={} rowKg={}",
                outcome.tier(), winner.getLifterId(), extreme.get().getBodyweightKg(), a.ctx.bodyweightKg());
        return true;
    }

    private boolean linkDiscoveredId(Attempt a, VerificationOutcome outcome) {
        long lifterId = outcome.matchedLifterId();
        long stableId = outcome.discoveredStableId();
        StableIdAssignment assignment = repository.assignStableIdIfAbsent(lifterId, stableId);
        if (assignment.holdsRequestedId()) {
            if (assignment == StableIdAssignment.ASSIGNED) {
                auditService.record(AuditAction.STABLE_ID_DISCOVERED, lifterId,
                        Map.of("stableId", stableId, "source", outcome.tier().name()));
            }
            return true;
        }
        a.conflicts.add(conflict(ConflictType.STABLE_ID_OWNED_BY_OTHER, stableId, List.of(lifterId),
                "discovered stable id could not be assigned: " + assignment));
        return false;
    }

    private void remember(Attempt a, VerificationOutcome outcome) {
        AthleteSummary harvested = outcome.harvested();
        if (harvested != null && (a.harvested == null || a.harvested.stableId() == null)) {
            a.harvested = harvested;
        }
    }

    private ResolutionResult createNew(Attempt a, OutcomeCode code, String reasoning) {
        a.enter(ResolutionState.CREATE_NEW);
        ResolutionContext ctx = a.ctx;

        Long stableId = null;
        if (ctx.stableId() != null && !lookup.isStableIdTaken(ctx.stableId())) {
            stableId = ctx.stableId();
        } else if (options.isPreserveHarvestedStableId() && a.harvested != null && a.harvested.stableId() != null) {
            long harvestedId = a.harvested.stableId();
            if (lookup.isStableIdTaken(harvestedId)) {
                log.info("resolution.harvestedIdTaken stableId={}", harvestedId);
            } else {
                stableId = harvestedId;
            }
        }

        Lifter draft = Lifter.builder()
                .normalizedName(a.name)
                .stableId(stableId)
                .membershipNumber(ctx.membershipNumber())
                .countryCode(ctx.countryCode())
                .countryName(countryName(ctx.countryCode()))
                .birthYear(ctx.birthYear())
                .gender(ctx.gender())
                .build();
        if (a.harvested != null && Objects.equals(a.harvested.stableId(), stableId)) {
            draft = EnrichmentMerger.merge(draft, withoutStableId(a.harvested.lifterAttributes()));
        }
        log.info("resolution.createNew name='{}' stableId={} outcome={}", a.name, stableId, code);
        return a.result(draft, code, reasoning, enrichmentFor(a, stableId));
    }

    private ResolutionResult resolved(Attempt a, Lifter lifter, OutcomeCode code, String reasoning) {
        a.enter(ResolutionState.RESOLVED);
        Lifter current = enrichExisting(a, lifter);
        return a.result(current, code, reasoning, enrichmentFor(a, current.getStableId()));
    }

    /**
     * Fills missing fields of an existing lifter from the row and from a harvested athlete that
     * belongs to it.
     */
    private Lifter enrichExisting(Attempt a, Lifter lifter) {
        Map<LifterField, Object> values = new EnumMap<>(LifterField.class);
        ResolutionContext ctx = a.ctx;
        putIfPresent(values, LifterField.MEMBERSHIP_NUMBER, ctx.membershipNumber());
        putIfPresent(values, LifterField.COUNTRY_CODE, ctx.countryCode());
        putIfPresent(values, LifterField.COUNTRY_NAME, countryName(ctx.countryCode()));
        putIfPresent(values, LifterField.BIRTH_YEAR, ctx.birthYear());
        putIfPresent(values, LifterField.GENDER, ctx.gender());
        if (a.harvested != null && Objects.equals(a.harvested.stableId(), lifter.getStableId())) {
            withoutStableId(a.harvested.lifterAttributes()).forEach(values::putIfAbsent);
        }
        Map<LifterField, Object> patch = EnrichmentMerger.missingFields(lifter, values);
        if (patch.isEmpty()) {
            return lifter;
        }
        Lifter updated = repository.updateLifterFields(lifter.getLifterId(), patch);
        auditService.record(AuditAction.LIFTER_ENRICHED, lifter.getLifterId(),
                Map.of("fields", patch.keySet().toString()));
        return updated;
    }

    private Map<ResultField, Object> enrichmentFor(Attempt a, Long lifterStableId) {
        if (a.harvested == null) {
            return Map.of();
        }
        Long harvestedId = a.harvested.stableId();
        if (harvestedId != null && !harvestedId.equals(lifterStableId)) {
            return Map.of();
        }
        return a.harvested.resultAttributes();
    }

    /**
     * Records that another writer took a new lifter's stable id between the check and the insert.
     * The caller stores the lifter without the id.
     */
    IntegrityConflict stableIdRaceLost(StableIdConflictException e) {
        IntegrityConflict conflict = conflict(ConflictType.STABLE_ID_OWNED_BY_OTHER, e.getStableId(),
                e.getOwnerLifterId() != null ? List.of(e.getOwnerLifterId()) : List.of(),
                "stable id taken before the new lifter was stored");
        metricsService.incrementConflict(conflict.type());
        auditService.record(AuditAction.INTEGRITY_CONFLICT, e.getOwnerLifterId(),
                Map.of("type", conflict.type().name(), "stableId", e.getStableId(), "detail", conflict.detail()));
        return conflict;
    }

    void auditCreated(Lifter created, OutcomeCode outcome) {
        Map<String, Object> details = new HashMap<>();
        details.put("name", created.getNormalizedName());
        details.put("stableId", created.getStableId());
        details.put("outcome", outcome.name());
        auditService.record(AuditAction.LIFTER_CREATED, created.getLifterId(), details);
    }

    private Lifter reload(Lifter lifter) {
        return repository.findById(lifter.getLifterId()).orElse(lifter);
    }

    private String countryName(String countryCode) {
        return countryCodes != null ? countryCodes.nameFor(countryCode).orElse(null) : null;
    }

    /**
     * A stored result for the row's meet and division whose bodyweight and total equal the row's:
     * the same row seen again.
     */
    private static Optional<MeetResult> findReplay(ResolutionContext ctx, List<MeetResult> history) {
        if (ctx.meetId() == null) {
            return Optional.empty();
        }
        return history.stream()
                .filter(r -> r.isSameMeetAndDivision(ctx.meetId(), ctx.ageCategory(), ctx.weightClass()))
                .filter(r -> Objects.equals(r.getBodyweightKg(), ctx.bodyweightKg())
                        && Objects.equals(r.getTotal(), ctx.totalKg()))
                .findFirst();
    }

    private static boolean hasSameDivisionResult(ResolutionContext ctx, List<MeetResult> history) {
        return ctx.meetId() != null && history.stream()
                .anyMatch(r -> r.isSameMeetAndDivision(ctx.meetId(), ctx.ageCategory(), ctx.weightClass()));
    }

    private static IntegrityConflict mismatch(Lifter candidate, long rowStableId) {
        return conflict(ConflictType.STABLE_ID_MISMATCH, rowStableId, List.of(candidate.getLifterId()),
                "lifter holds stable id " + candidate.getStableId());
    }

    private static IntegrityConflict conflict(ConflictType type, Long stableId, List<Long> lifterIds, String detail) {
        log.warn("resolution.conflict type={} stableId={} lifterIds={} detail='{}'", type, stableId, lifterIds, detail);
        return new IntegrityConflict(type, stableId, lifterIds, detail);
    }

    private static List<Long> ids(List<Lifter> lifters) {
        return lifters.stream().map(Lifter::getLifterId).toList();
    }

    private static Map<LifterField, Object> withoutStableId(Map<LifterField, Object> values) {
        Map<LifterField, Object> copy = new EnumMap<>(LifterField.class);
        copy.putAll(values);
        copy.remove(LifterField.STABLE_ID);
        return copy;
    }

    private static void putIfPresent(Map<LifterField, Object> values, LifterField field, Object value) {
        if (value != null) {
            values.put(field, value);
        }
    }

    /**
     * Working state of one resolution.
     */
    private static final class Attempt {
        private final ResolutionContext ctx;
        private final String name;
        private final List<ResolutionState> path = new ArrayList<>(List.of(ResolutionState.START));
        private final List<VerificationOutcome> tierOutcomes = new ArrayList<>();
        private final List<IntegrityConflict> conflicts = new ArrayList<>();
        private AthleteSummary harvested;
        private boolean vetoed;

        private Attempt(ResolutionContext ctx, String name) {
            this.ctx = ctx;
            this.name = name;
        }

        private void enter(ResolutionState state) {
            path.add(state);
        }

        private ResolutionResult result(Lifter lifter, OutcomeCode code, String reasoning,
                                        Map<ResultField, Object> enrichment) {
            return ResolutionResult.builder()
                    .correlationId(ctx.correlationId())
                    .lifter(lifter)
                    .outcome(code)
                    .path(path)
                    .tierOutcomes(tierOutcomes)
                    .conflicts(conflicts)
                    .resultEnrichment(enrichment)
                    .reasoning(reasoning)
                    .build();
        }
    }

    public LifterRepository getRepository() {
        return repository;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    public NameNormalizer getNameNormalizer() {
        return nameNormalizer;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LifterRepository repository;
        private final List<Verifier> verifiers = new ArrayList<>();
        private TierRetryPolicy retryPolicy;
        private NameNormalizer nameNormalizer;
        private CountryCodes countryCodes;
        private ResolverOptions options = ResolverOptions.defaults();
        private MetricsService metricsService;
        private AuditService auditService;

        public Builder repository(LifterRepository repository) {
            this.repository = repository;
            return this;
        }

        /**
         * Adds a verification tier. Tiers run in {@link Tier#level()} order regardless of
         * the order they are added in.
         */
        public Builder verifier(Verifier verifier) {
            this.verifiers.add(Objects.requireNonNull(verifier, "verifier"));
            return this;
        }

        public Builder verifiers(List<? extends Verifier> verifiers) {
            verifiers.forEach(this::verifier);
            return this;
        }

        public Builder retryPolicy(TierRetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder nameNormalizer(NameNormalizer nameNormalizer) {
            this.nameNormalizer = nameNormalizer;
            return this;
        }

        /**
         * Country code table used to fill the country name of new and enriched lifters.
         */
        public Builder countryCodes(CountryCodes countryCodes) {
            this.countryCodes = countryCodes;
            return this;
        }

        public Builder options(ResolverOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public IdentityResolver build() {
            return new IdentityResolver(this);
        }
    }
}
