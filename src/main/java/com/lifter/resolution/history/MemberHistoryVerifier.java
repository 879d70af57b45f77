package com.lifter.resolution.history;

import com.lifter.resolution.api.ResolutionContext;
import com.lifter.resolution.api.ResolverOptions;
import com.lifter.resolution.audit.AuditAction;
import com.lifter.resolution.audit.AuditService;
import com.lifter.resolution.core.model.ConflictType;
import com.lifter.resolution.core.model.HistoryEntry;
import com.lifter.resolution.core.model.IntegrityConflict;
import com.lifter.resolution.core.model.Lifter;
import com.lifter.resolution.core.model.MeetReference;
import com.lifter.resolution.core.model.Tier;
import com.lifter.resolution.core.model.VerificationOutcome;
import com.lifter.resolution.source.HistoryPage;
import com.lifter.resolution.source.MemberHistorySource;
import com.lifter.resolution.source.SourceUnavailableException;
import com.lifter.resolution.store.LifterRepository;
import com.lifter.resolution.store.StableIdAssignment;
import com.lifter.resolution.tier.VerificationRequest;
import com.lifter.resolution.tier.Verifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tier 2: confirms a candidate by finding the row's meet in the candidate's member history.
 *
 * <p>A history entry matches when its meet name equals the row's meet name and its date is
 * within the configured tolerance of the meet date. The first such entry decides: bodyweight
 * and total must then agree within tolerance (each compared only when both sides are known),
 * otherwise the candidate is a PERFORMANCE_MISMATCH.</p>
 *
 * <p>Candidates are tried in order and the first VERIFIED one wins. A candidate without a
 * stable id is first looked up by name. When that candidate is confirmed the discovered id is
 * returned on the outcome and linked by the caller once it accepts the match. When it is not
 * confirmed the id is saved onto the candidate only if it was the sole candidate: several
 * same-name lifters all get the same answer from a name search, so it identifies none of them.</p>
 */
public class MemberHistoryVerifier implements Verifier {
    private static final Logger log = LoggerFactory.getLogger(MemberHistoryVerifier.class);

    private final MemberHistorySource source;
    private final LifterRepository repository;
    private final ResolverOptions options;
    private final AuditService auditService;

    public MemberHistoryVerifier(MemberHistorySource source, LifterRepository repository, ResolverOptions options,
                                 AuditService auditService) {
        this.source = source;
        this.repository = repository;
        this.options = options;
        this.auditService = auditService;
    }

    @Override
    public Tier tier() {
        return Tier.MEMBER_HISTORY;
    }

    @Override
    public VerificationOutcome verify(VerificationRequest request) {
        ResolutionContext ctx = request.context();
        MeetReference target = ctx.meet();
        if (!target.isComplete()) {
            return VerificationOutcome.skipped(tier(), "missing meet name or date");
        }
        if (request.candidates().isEmpty()) {
            return VerificationOutcome.skipped(tier(), "no candidates");
        }

        List<IntegrityConflict> conflicts = new ArrayList<>();
        boolean soleCandidate = request.candidates().size() == 1;
        Map<Long, VerificationOutcome> checked = new HashMap<>();
        NameSearch search = new NameSearch();
        boolean inconclusive = false;
        boolean mismatch = false;

        for (Lifter candidate : request.candidates()) {
            Long stableId = candidate.getStableId();
            boolean discovered = false;
            if (stableId == null) {
                Optional<Long> found;
                try {
                    found = discoverStableId(candidate, search, conflicts);
                } catch (SourceUnavailableException e) {
                    log.warn("tier2.searchFailed lifterId={} error={}", candidate.getLifterId(), e.getMessage());
                    inconclusive = true;
                    continue;
                }
                if (found.isEmpty()) {
                    continue;
                }
                stableId = found.get();
                discovered = true;
            }

            VerificationOutcome outcome = checked.get(stableId);
            if (outcome == null) {
                outcome = verify(stableId, target, ctx.bodyweightKg(), ctx.totalKg());
                checked.put(stableId, outcome);
            }
            if (discovered && soleCandidate && !outcome.isVerified()) {
                saveDiscovered(candidate, stableId, conflicts);
            }
            switch (outcome.status()) {
                case VERIFIED -> {
                    log.info("tier2.verified lifterId={} stableId={} discovered={}",
                            candidate.getLifterId(), stableId, discovered);
                    return VerificationOutcome.verified(tier(), candidate.getLifterId(), null,
                                    discovered ? stableId : null, outcome.reason())
                            .withConflicts(conflicts);
                }
                case PERFORMANCE_MISMATCH -> {
                    mismatch = true;
                    Map<String, Object> details = new HashMap<>();
                    details.put("stableId", stableId);
                    details.put("meet", target.meetName());
                    details.put("reason", outcome.reason());
                    auditService.record(AuditAction.PERFORMANCE_MISMATCH, candidate.getLifterId(), details);
                }
                case INCONCLUSIVE -> inconclusive = true;
                default -> log.debug("tier2.candidateNotFound lifterId={} stableId={}",
                        candidate.getLifterId(), stableId);
            }
        }

        VerificationOutcome result;
        if (inconclusive) {
            result = VerificationOutcome.inconclusive(tier(), "member history unavailable for a candidate");
        } else if (mismatch) {
            result = VerificationOutcome.performanceMismatch(tier(), "meet found but performance differs");
        } else {
            result = VerificationOutcome.notFound(tier(), "meet not in any candidate's history");
        }
        return result.withConflicts(conflicts);
    }

    /**
     * Checks one athlete's history for the target meet.
     *
     * @param stableId      athlete to check
     * @param target        meet the row belongs to
     * @param expectedBw    row bodyweight, may be null
     * @param expectedTotal row total, may be null
     */
    public VerificationOutcome verify(long stableId, MeetReference target, Double expectedBw, Double expectedTotal) {
        if (target == null || !target.isComplete()) {
            return VerificationOutcome.skipped(tier(), "missing meet name or date");
        }
        String wantedMeet = target.meetName().trim();
        int maxPages = options.getHistoryMaxPages();

        try {
            for (int page = 1; page <= maxPages; page++) {
                HistoryPage history = source.getHistory(stableId, page);
                for (HistoryEntry entry : history.entries()) {
                    if (!matchesMeet(entry, wantedMeet, target)) {
                        continue;
                    }
                    String mismatch = performanceMismatch(entry, expectedBw, expectedTotal);
                    if (mismatch != null) {
                        log.info("tier2.performanceMismatch stableId={} meet='{}' {}", stableId, wantedMeet, mismatch);
                        return VerificationOutcome.performanceMismatch(tier(), mismatch);
                    }
                    return VerificationOutcome.confirmed(tier(), "meet found on history page " + page);
                }
                if (!history.hasNext()) {
                    break;
                }
            }
        } catch (SourceUnavailableException e) {
            log.warn("tier2.historyFailed stableId={} error={}", stableId, e.getMessage());
            return VerificationOutcome.inconclusive(tier(), e.getMessage());
        }
        log.debug("tier2.meetNotInHistory stableId={} meet='{}'", stableId, wantedMeet);
        return VerificationOutcome.notFound(tier(), "meet not in history");
    }

    /**
     * Looks the candidate's name up on the member site. An id that another lifter already holds
     * is a conflict and yields nothing. Nothing is written.
     */
    private Optional<Long> discoverStableId(Lifter candidate, NameSearch search, List<IntegrityConflict> conflicts) {
        Optional<Long> found = search.lookup(candidate.getNormalizedName());
        if (found.isEmpty()) {
            log.debug("tier2.noStableIdForName lifterId={} name='{}'",
                    candidate.getLifterId(), candidate.getNormalizedName());
            return Optional.empty();
        }
        long stableId = found.get();
        List<Long> owners = repository.findByStableId(stableId).stream().map(Lifter::getLifterId).toList();
        if (!owners.isEmpty()) {
            conflicts.add(ownedByOther(candidate, stableId, owners));
            return Optional.empty();
        }
        return found;
    }

    /**
     * Persists a discovered id onto the sole candidate when the history check did not confirm it.
     */
    private void saveDiscovered(Lifter candidate, long stableId, List<IntegrityConflict> conflicts) {
        StableIdAssignment assignment = repository.assignStableIdIfAbsent(candidate.getLifterId(), stableId);
        switch (assignment) {
            case ASSIGNED -> {
                log.info("tier2.stableIdDiscovered lifterId={} stableId={}", candidate.getLifterId(), stableId);
                auditService.record(AuditAction.STABLE_ID_DISCOVERED, candidate.getLifterId(),
                        Map.of("stableId", stableId, "source", "member search"));
            }
            case OWNED_BY_OTHER -> conflicts.add(ownedByOther(candidate, stableId,
                    repository.findByStableId(stableId).stream().map(Lifter::getLifterId).toList()));
            default -> log.debug("tier2.discoveredIdNotSaved lifterId={} stableId={} result={}",
                    candidate.getLifterId(), stableId, assignment);
        }
    }

    private IntegrityConflict ownedByOther(Lifter candidate, long stableId, List<Long> owners) {
        List<Long> involved = new ArrayList<>(owners);
        involved.add(0, candidate.getLifterId());
        log.warn("tier2.discoveredIdOwned lifterId={} stableId={} owners={}",
                candidate.getLifterId(), stableId, owners);
        return new IntegrityConflict(ConflictType.STABLE_ID_OWNED_BY_OTHER, stableId, involved,
                "discovered stable id already held by " + owners);
    }

    private boolean matchesMeet(HistoryEntry entry, String wantedMeet, MeetReference target) {
        if (entry.meetName() == null || entry.date() == null) {
            return false;
        }
        if (!entry.meetName().trim().equals(wantedMeet)) {
            return false;
        }
        long days = Math.abs(ChronoUnit.DAYS.between(entry.date(), target.date()));
        return days <= options.getHistoryDateToleranceDays();
    }

    private String performanceMismatch(HistoryEntry entry, Double expectedBw, Double expectedTotal) {
        if (expectedBw != null && entry.bodyweightKg() != null) {
            double diff = Math.abs(entry.bodyweightKg() - expectedBw);
            if (diff > options.getBodyweightToleranceKg()) {
                return "bodyweight differs by " + diff + " kg";
            }
        }
        if (expectedTotal != null && entry.totalKg() != null) {
            double diff = Math.abs(entry.totalKg() - expectedTotal);
            if (diff > options.getTotalToleranceKg()) {
                return "total differs by " + diff + " kg";
            }
        }
        return null;
    }

    /**
     * Name searches of one request. Same-name candidates share a single lookup.
     */
    private final class NameSearch {
        private final Map<String, Optional<Long>> results = new HashMap<>();

        Optional<Long> lookup(String name) {
            Optional<Long> cached = results.get(name);
            if (cached == null) {
                cached = source.searchByName(name);
                results.put(name, cached);
            }
            return cached;
        }
    }
}
