package com.lifter.resolution.division;

import com.lifter.resolution.api.ResolutionContext;
import com.lifter.resolution.api.ResolverOptions;
import com.lifter.resolution.audit.AuditAction;
import com.lifter.resolution.audit.AuditService;
import com.lifter.resolution.core.model.AthleteSummary;
import com.lifter.resolution.core.model.ConflictType;
import com.lifter.resolution.core.model.Lifter;
import com.lifter.resolution.core.model.MeetResult;
import com.lifter.resolution.core.model.ResultField;
import com.lifter.resolution.core.model.Tier;
import com.lifter.resolution.core.model.VerificationOutcome;
import com.lifter.resolution.merge.EnrichmentMerger;
import com.lifter.resolution.metrics.MetricsService;
import com.lifter.resolution.rules.NameNormalizer;
import com.lifter.resolution.source.DivisionRankingSource;
import com.lifter.resolution.store.LifterRepository;
import com.lifter.resolution.store.StableIdAssignment;
import com.lifter.resolution.store.StoreException;
import com.lifter.resolution.tier.VerificationRequest;
import com.lifter.resolution.tier.Verifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Tier 1: cross-checks the row against the division rankings around the meet date.
 *
 * <p>The division ({@code "<age category> <weight class>"}) is mapped to its listing code, the
 * window {@code meetDate ± dateWindowDays} is swept with {@link DivisionSweep}, and the rows
 * for the athlete's name are inspected:</p>
 * <ul>
 *   <li>no candidates: HARVESTED, the row's attributes seed the new lifter</li>
 *   <li>the row's stable id equals a candidate's: VERIFIED</li>
 *   <li>exactly one candidate has no stable id and nobody else holds the row's id: VERIFIED,
 *       with the id reported as discovered</li>
 *   <li>same-name rows with different stable ids: NOT_FOUND (ambiguous)</li>
 * </ul>
 *
 * <p>Every sweep also enriches existing results of the swept athletes in the same division
 * and window. That pass only fills null fields and its failures are logged, never propagated.</p>
 */
public class DivisionVerifier implements Verifier {
    private static final Logger log = LoggerFactory.getLogger(DivisionVerifier.class);

    private final DivisionCodeTable codeTable;
    private final DivisionSweep sweep;
    private final LifterRepository repository;
    private final NameNormalizer nameNormalizer;
    private final ResolverOptions options;
    private final MetricsService metricsService;
    private final AuditService auditService;

    public DivisionVerifier(DivisionRankingSource source, DivisionCodeTable codeTable, LifterRepository repository,
                            NameNormalizer nameNormalizer, ResolverOptions options,
                            MetricsService metricsService, AuditService auditService) {
        this.codeTable = codeTable;
        this.sweep = new DivisionSweep(source, options.getBisectionMaxDepth(), options.getMinWindowDays(),
                metricsService);
        this.repository = repository;
        this.nameNormalizer = nameNormalizer;
        this.options = options;
        this.metricsService = metricsService;
        this.auditService = auditService;
    }

    @Override
    public Tier tier() {
        return Tier.DIVISION_RANKINGS;
    }

    @Override
    public VerificationOutcome verify(VerificationRequest request) {
        ResolutionContext ctx = request.context();
        return verify(request.normalizedName(), ctx.ageCategory(), ctx.weightClass(), ctx.date(),
                request.candidates());
    }

    /**
     * Runs Tier 1 for one athlete.
     *
     * @param normalizedName the athlete's canonical name
     * @param ageCategory    age category of the row
     * @param weightClass    weight class of the row
     * @param meetDate       meet date
     * @param candidates     same-name lifters, possibly empty
     */
    public VerificationOutcome verify(String normalizedName, String ageCategory, String weightClass,
                                      LocalDate meetDate, List<Lifter> candidates) {
        if (meetDate == null || isBlank(ageCategory) || isBlank(weightClass)) {
            return VerificationOutcome.skipped(tier(), "missing date, age category or weight class");
        }
        List<DivisionCode> listings = codeTable.candidateCodes(ageCategory, weightClass, meetDate);
        if (listings.isEmpty()) {
            log.info("tier1.skipped reason=unknownDivision division='{}'",
                    DivisionCodeTable.divisionName(ageCategory, weightClass));
            return VerificationOutcome.skipped(tier(), "division not in code table");
        }

        String wanted = nameNormalizer.matchKey(normalizedName);
        Predicate<AthleteSummary> isTarget = row -> keyOf(row.name()).equals(wanted);
        LocalDate from = meetDate.minusDays(options.getDateWindowDays());
        LocalDate to = meetDate.plusDays(options.getDateWindowDays());

        boolean complete = true;
        for (DivisionCode listing : listings) {
            DivisionSweep.Result swept = sweep.sweep(listing.code(), from, to, isTarget);
            complete &= swept.complete();
            log.debug("tier1.swept division='{}' code={} rows={} queries={} complete={}",
                    listing.name(), listing.code(), swept.athletes().size(), swept.queries(), swept.complete());

            enrichPeers(swept.athletes(), ageCategory, weightClass, from, to);

            List<AthleteSummary> rows = swept.athletes().stream().filter(isTarget).toList();
            if (!rows.isEmpty()) {
                return decide(normalizedName, rows, candidates);
            }
        }

        if (!complete) {
            return VerificationOutcome.inconclusive(tier(), "division sweep incomplete");
        }
        log.info("tier1.notFound athlete='{}' listings={}", normalizedName, listings.size());
        return VerificationOutcome.notFound(tier(), "athlete not in division rankings");
    }

    private VerificationOutcome decide(String normalizedName, List<AthleteSummary> rows, List<Lifter> candidates) {
        Set<Long> stableIds = rows.stream()
                .map(AthleteSummary::stableId)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (stableIds.size() > 1) {
            log.info("tier1.ambiguous athlete='{}' stableIds={}", normalizedName, stableIds);
            return VerificationOutcome.notFound(tier(), "ambiguous rows for name: " + stableIds);
        }

        AthleteSummary row = rows.stream()
                .filter(r -> r.stableId() != null)
                .findFirst()
                .orElse(rows.get(0));

        if (candidates.isEmpty()) {
            log.info("tier1.harvested athlete='{}' stableId={}", normalizedName, row.stableId());
            return VerificationOutcome.harvested(tier(), row);
        }

        Long stableId = row.stableId();
        if (stableId == null) {
            return VerificationOutcome.notFound(tier(), row, "ranking row carries no stable id");
        }

        for (Lifter candidate : candidates) {
            if (stableId.equals(candidate.getStableId())) {
                log.info("tier1.verified athlete='{}' lifterId={} stableId={}",
                        normalizedName, candidate.getLifterId(), stableId);
                return VerificationOutcome.verified(tier(), candidate.getLifterId(), row, null,
                        "stable id matches candidate");
            }
        }

        List<Lifter> pending = candidates.stream().filter(c -> !c.hasStableId()).toList();
        if (pending.size() == 1 && repository.findByStableId(stableId).isEmpty()) {
            Lifter candidate = pending.get(0);
            log.info("tier1.verifiedPending athlete='{}' lifterId={} stableId={}",
                    normalizedName, candidate.getLifterId(), stableId);
            return VerificationOutcome.verified(tier(), candidate.getLifterId(), row, stableId,
                    "only candidate without stable id");
        }

        log.info("tier1.noCandidateMatch athlete='{}' stableId={} candidates={}",
                normalizedName, stableId, candidates.size());
        return VerificationOutcome.notFound(tier(), row, "stable id " + stableId + " matches no candidate");
    }

    /**
     * Fills missing club, WSO, age, rank and gender on stored results of the swept athletes,
     * and a missing stable id on their lifters. Names shared by more than one lifter, or listed
     * with different stable ids, are left alone.
     *
     * @return number of results updated
     */
    int enrichPeers(List<AthleteSummary> athletes, String ageCategory, String weightClass,
                    LocalDate from, LocalDate to) {
        if (athletes.isEmpty()) {
            return 0;
        }
        Map<String, AthleteSummary> byName = uniqueAthletesByName(athletes);
        if (byName.isEmpty()) {
            return 0;
        }

        int enriched = 0;
        try {
            List<String> names = byName.values().stream().map(a -> nameNormalizer.normalize(a.name())).toList();
            List<MeetResult> results = repository.findResultsForNames(names, from, to, ageCategory, weightClass);

            Map<String, List<MeetResult>> resultsByName = new LinkedHashMap<>();
            for (MeetResult result : results) {
                resultsByName.computeIfAbsent(keyOf(result.getLifterName()), k -> new ArrayList<>()).add(result);
            }

            for (Map.Entry<String, List<MeetResult>> entry : resultsByName.entrySet()) {
                AthleteSummary athlete = byName.get(entry.getKey());
                List<MeetResult> owned = entry.getValue();
                if (athlete == null) {
                    continue;
                }
                Set<Long> owners = owned.stream().map(MeetResult::getLifterId).collect(Collectors.toSet());
                if (owners.size() > 1) {
                    log.debug("tier1.peerSkipped name='{}' lifters={}", athlete.name(), owners);
                    continue;
                }
                for (MeetResult result : owned) {
                    Map<ResultField, Object> patch = EnrichmentMerger.missingFields(result, athlete.resultAttributes());
                    if (!patch.isEmpty()) {
                        repository.updateResultFields(result.getResultId(), patch);
                        enriched++;
                        auditService.record(AuditAction.RESULT_ENRICHED, result.getLifterId(),
                                Map.of("resultId", result.getResultId(), "fields", patch.keySet().toString()));
                    }
                }
                if (athlete.stableId() != null) {
                    linkStableId(owners.iterator().next(), athlete.stableId());
                }
            }
        } catch (StoreException e) {
            log.warn("tier1.peerEnrichmentFailed error={}", e.getMessage());
        }

        if (enriched > 0) {
            log.info("tier1.peersEnriched results={} division='{} {}'", enriched, ageCategory, weightClass);
        }
        metricsService.recordPeerEnrichment(enriched);
        return enriched;
    }

    private void linkStableId(long lifterId, long stableId) {
        StableIdAssignment assignment = repository.assignStableIdIfAbsent(lifterId, stableId);
        if (assignment == StableIdAssignment.ASSIGNED) {
            auditService.record(AuditAction.STABLE_ID_DISCOVERED, lifterId,
                    Map.of("stableId", stableId, "source", "division rankings"));
        } else if (assignment == StableIdAssignment.OWNED_BY_OTHER) {
            metricsService.incrementConflict(ConflictType.STABLE_ID_OWNED_BY_OTHER);
            log.warn("tier1.peerStableIdConflict lifterId={} stableId={}", lifterId, stableId);
        }
    }

    private Map<String, AthleteSummary> uniqueAthletesByName(List<AthleteSummary> athletes) {
        Map<String, List<AthleteSummary>> grouped = new LinkedHashMap<>();
        for (AthleteSummary athlete : athletes) {
            grouped.computeIfAbsent(keyOf(athlete.name()), k -> new ArrayList<>()).add(athlete);
        }
        Map<String, AthleteSummary> unique = new LinkedHashMap<>();
        grouped.forEach((key, rows) -> {
            long distinctIds = rows.stream().map(AthleteSummary::stableId).filter(Objects::nonNull).distinct().count();
            if (distinctIds <= 1) {
                unique.put(key, rows.stream().filter(r -> r.stableId() != null).findFirst().orElse(rows.get(0)));
            }
        });
        return unique;
    }

    private String keyOf(String name) {
        return nameNormalizer.matchKey(nameNormalizer.normalize(name));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
