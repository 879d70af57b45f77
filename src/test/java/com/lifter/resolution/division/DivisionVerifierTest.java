package com.lifter.resolution.division;

import com.lifter.resolution.api.ResolverOptions;
import com.lifter.resolution.audit.AuditAction;
import com.lifter.resolution.audit.AuditService;
import com.lifter.resolution.core.model.AthleteSummary;
import com.lifter.resolution.core.model.Lifter;
import com.lifter.resolution.core.model.MeetResult;
import com.lifter.resolution.core.model.VerificationOutcome;
import com.lifter.resolution.core.model.VerificationStatus;
import com.lifter.resolution.metrics.NoOpMetricsService;
import com.lifter.resolution.rules.NameNormalizer;
import com.lifter.resolution.source.DivisionQueryResult;
import com.lifter.resolution.source.DivisionRankingSource;
import com.lifter.resolution.source.SourceUnavailableException;
import com.lifter.resolution.store.InMemoryLifterRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DivisionVerifierTest {

    private static final LocalDate MEET_DATE = LocalDate.of(2024, 3, 1);
    private static final String AGE = "Open Women's";
    private static final String CLASS = "63kg";

    private InMemoryLifterRepository repository;
    private AuditService auditService;
    private DivisionCodeTable codeTable;
    private List<AthleteSummary> rankings;
    private List<Integer> queriedCodes;

    @BeforeEach
    void setUp() {
        repository = new InMemoryLifterRepository();
        auditService = new AuditService();
        codeTable = new DivisionCodeTable(Map.of("Open Women's 63kg", 101), LocalDate.of(2025, 6, 1));
        rankings = new ArrayList<>();
        queriedCodes = new ArrayList<>();
    }

    private DivisionVerifier verifier(DivisionRankingSource source) {
        return new DivisionVerifier(source, codeTable, repository, new NameNormalizer(),
                ResolverOptions.defaults(), new NoOpMetricsService(), auditService);
    }

    private DivisionVerifier verifier() {
        return verifier((code, from, to) -> {
            queriedCodes.add(code);
            return DivisionQueryResult.ok(rankings);
        });
    }

    private static AthleteSummary athlete(String name, Long stableId) {
        return new AthleteSummary(name, stableId, "Barbell Club", 25, 3, "F", "Carolina", "National",
                187.0, MEET_DATE);
    }

    private Lifter stored(String name, Long stableId) {
        return repository.createLifter(Lifter.builder().normalizedName(name).stableId(stableId).build());
    }

    @Nested
    @DisplayName("Decisions")
    class Decisions {

        @Test
        @DisplayName("Should harvest the athlete when there are no candidates")
        void testHarvest() {
            rankings.add(athlete("Jane Smith", 1234L));
            rankings.add(athlete("John Doe", 999L));

            VerificationOutcome outcome = verifier().verify("Jane Smith", AGE, CLASS, MEET_DATE, List.of());

            assertEquals(VerificationStatus.HARVESTED, outcome.status());
            assertEquals(1234L, outcome.harvested().stableId());
            assertEquals("Barbell Club", outcome.harvested().club());
        }

        @Test
        @DisplayName("Should verify the candidate holding the listed stable id")
        void testVerifyByStableId() {
            Lifter a = stored("Jane Smith", 555L);
            Lifter b = stored("Jane Smith", 1234L);
            rankings.add(athlete("SMITH Jane", 1234L));

            VerificationOutcome outcome = verifier().verify("Jane Smith", AGE, CLASS, MEET_DATE, List.of(a, b));

            assertEquals(VerificationStatus.VERIFIED, outcome.status());
            assertEquals(b.getLifterId(), outcome.matchedLifterId());
            assertNull(outcome.discoveredStableId());
        }

        @Test
        @DisplayName("Should verify the only candidate without a stable id and report the id as discovered")
        void testVerifyPendingCandidate() {
            Lifter a = stored("Jane Smith", 555L);
            Lifter b = stored("Jane Smith", null);
            rankings.add(athlete("Jane Smith", 1234L));

            VerificationOutcome outcome = verifier().verify("Jane Smith", AGE, CLASS, MEET_DATE, List.of(a, b));

            assertTrue(outcome.hasMatch());
            assertEquals(b.getLifterId(), outcome.matchedLifterId());
            assertEquals(1234L, outcome.discoveredStableId());
        }

        @Test
        @DisplayName("Should not pick a pending candidate when the listed id belongs to someone else")
        void testPendingCandidateIdTaken() {
            stored("Jane Smyth", 1234L);
            Lifter a = stored("Jane Smith", 555L);
            Lifter b = stored("Jane Smith", null);
            rankings.add(athlete("Jane Smith", 1234L));

            VerificationOutcome outcome = verifier().verify("Jane Smith", AGE, CLASS, MEET_DATE, List.of(a, b));

            assertEquals(VerificationStatus.NOT_FOUND, outcome.status());
            assertEquals(1234L, outcome.harvested().stableId());
        }

        @Test
        @DisplayName("Should treat same-name rows with different stable ids as ambiguous")
        void testAmbiguousRows() {
            Lifter a = stored("Jane Smith", null);
            rankings.add(athlete("Jane Smith", 1234L));
            rankings.add(athlete("Jane Smith", 5678L));

            VerificationOutcome outcome = verifier().verify("Jane Smith", AGE, CLASS, MEET_DATE, List.of(a));

            assertEquals(VerificationStatus.NOT_FOUND, outcome.status());
            assertFalse(outcome.hasMatch());
        }

        @Test
        @DisplayName("Should report NOT_FOUND when a complete sweep has no row for the name")
        void testNotFound() {
            rankings.add(athlete("John Doe", 999L));

            VerificationOutcome outcome = verifier().verify("Jane Smith", AGE, CLASS, MEET_DATE, List.of());

            assertEquals(VerificationStatus.NOT_FOUND, outcome.status());
        }

        @Test
        @DisplayName("Should report INCONCLUSIVE when the source fails")
        void testInconclusive() {
            DivisionVerifier failing = verifier((code, from, to) -> {
                throw new SourceUnavailableException("connection refused");
            });

            VerificationOutcome outcome = failing.verify("Jane Smith", AGE, CLASS, MEET_DATE, List.of());

            assertEquals(VerificationStatus.INCONCLUSIVE, outcome.status());
        }
    }

    @Nested
    @DisplayName("Listings and context")
    class Listings {

        @Test
        @DisplayName("Should skip when the division is unknown")
        void testUnknownDivision() {
            VerificationOutcome outcome = verifier().verify("Jane Smith", AGE, "48kg", MEET_DATE, List.of());

            assertEquals(VerificationStatus.SKIPPED, outcome.status());
            assertTrue(queriedCodes.isEmpty());
        }

        @Test
        @DisplayName("Should skip when the meet date is missing")
        void testMissingDate() {
            VerificationOutcome outcome = verifier().verify("Jane Smith", AGE, CLASS, null, List.of());

            assertEquals(VerificationStatus.SKIPPED, outcome.status());
        }

        @Test
        @DisplayName("Should stop at the first listing that contains the athlete")
        void testInactiveListingFirst() {
            codeTable = new DivisionCodeTable(Map.of("Open Women's 63kg", 101,
                    "(Inactive) Open Women's 63kg", 201), LocalDate.of(2025, 6, 1));
            rankings.add(athlete("Jane Smith", 1234L));

            VerificationOutcome outcome = verifier().verify("Jane Smith", AGE, CLASS, MEET_DATE, List.of());

            assertEquals(VerificationStatus.HARVESTED, outcome.status());
            assertEquals(List.of(201), queriedCodes);
        }

        @Test
        @DisplayName("Should fall back to the second listing when the first lacks the athlete")
        void testSecondListing() {
            codeTable = new DivisionCodeTable(Map.of("Open Women's 63kg", 101,
                    "(Inactive) Open Women's 63kg", 201), LocalDate.of(2025, 6, 1));
            DivisionVerifier byCode = verifier((code, from, to) -> {
                queriedCodes.add(code);
                return code == 101
                        ? DivisionQueryResult.ok(List.of(athlete("Jane Smith", 1234L)))
                        : DivisionQueryResult.ok(List.of());
            });

            VerificationOutcome outcome = byCode.verify("Jane Smith", AGE, CLASS, MEET_DATE, List.of());

            assertEquals(VerificationStatus.HARVESTED, outcome.status());
            assertEquals(List.of(201, 101), queriedCodes);
        }
    }

    @Nested
    @DisplayName("Peer enrichment")
    class PeerEnrichment {

        private MeetResult peerResult(Lifter lifter) {
            return repository.recordResult(lifter, MeetResult.builder()
                    .meetId(100L)
                    .meetName("Spring Open")
                    .date(MEET_DATE)
                    .ageCategory(AGE)
                    .weightClass(CLASS)
                    .bodyweightKg(62.0)
                    .total(180.0)
                    .build()).result();
        }

        @Test
        @DisplayName("Should fill missing result fields and the stable id of swept peers")
        void testEnrichPeer() {
            Lifter peer = stored("John Doe", null);
            MeetResult result = peerResult(peer);
            rankings.add(athlete("Jane Smith", 1234L));
            rankings.add(athlete("DOE John", 777L));

            verifier().verify("Jane Smith", AGE, CLASS, MEET_DATE, List.of());

            MeetResult enriched = repository.findResultsByLifterIds(List.of(peer.getLifterId())).get(0);
            assertEquals(result.getResultId(), enriched.getResultId());
            assertEquals("Barbell Club", enriched.getClub());
            assertEquals("Carolina", enriched.getWso());
            assertEquals(3, enriched.getNationalRank());
            assertEquals(777L, repository.findById(peer.getLifterId()).orElseThrow().getStableId());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.RESULT_ENRICHED).size());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.STABLE_ID_DISCOVERED).size());
        }

        @Test
        @DisplayName("Should be idempotent across repeated sweeps")
        void testIdempotent() {
            Lifter peer = stored("John Doe", null);
            peerResult(peer);
            List<AthleteSummary> athletes = List.of(athlete("John Doe", 777L));
            DivisionVerifier verifier = verifier();

            int first = verifier.enrichPeers(athletes, AGE, CLASS, MEET_DATE.minusDays(5), MEET_DATE.plusDays(5));
            int second = verifier.enrichPeers(athletes, AGE, CLASS, MEET_DATE.minusDays(5), MEET_DATE.plusDays(5));

            assertEquals(1, first);
            assertEquals(0, second);
        }

        @Test
        @DisplayName("Should leave names shared by two lifters alone")
        void testSharedName() {
            Lifter a = stored("John Doe", null);
            Lifter b = stored("John Doe", null);
            peerResult(a);
            peerResult(b);

            int enriched = verifier().enrichPeers(List.of(athlete("John Doe", 777L)), AGE, CLASS,
                    MEET_DATE.minusDays(5), MEET_DATE.plusDays(5));

            assertEquals(0, enriched);
            assertNull(repository.findById(a.getLifterId()).orElseThrow().getStableId());
            assertNull(repository.findById(b.getLifterId()).orElseThrow().getStableId());
        }

        @Test
        @DisplayName("Should not link a stable id already held by another lifter")
        void testPeerIdOwned() {
            stored("Johnny Doe", 777L);
            Lifter peer = stored("John Doe", null);
            peerResult(peer);

            int enriched = verifier().enrichPeers(List.of(athlete("John Doe", 777L)), AGE, CLASS,
                    MEET_DATE.minusDays(5), MEET_DATE.plusDays(5));

            assertEquals(1, enriched);
            assertNull(repository.findById(peer.getLifterId()).orElseThrow().getStableId());
        }
    }
}
