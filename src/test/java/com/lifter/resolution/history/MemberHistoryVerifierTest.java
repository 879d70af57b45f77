package com.lifter.resolution.history;

import com.lifter.resolution.api.ResolutionContext;
import com.lifter.resolution.api.ResolverOptions;
import com.lifter.resolution.audit.AuditAction;
import com.lifter.resolution.audit.AuditService;
import com.lifter.resolution.core.model.ConflictType;
import com.lifter.resolution.core.model.HistoryEntry;
import com.lifter.resolution.core.model.Lifter;
import com.lifter.resolution.core.model.MeetReference;
import com.lifter.resolution.core.model.VerificationOutcome;
import com.lifter.resolution.core.model.VerificationStatus;
import com.lifter.resolution.source.HistoryPage;
import com.lifter.resolution.source.MemberHistorySource;
import com.lifter.resolution.source.SourceUnavailableException;
import com.lifter.resolution.store.InMemoryLifterRepository;
import com.lifter.resolution.tier.VerificationRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MemberHistoryVerifierTest {

    private static final LocalDate MEET_DATE = LocalDate.of(2024, 3, 1);
    private static final MeetReference MEET = new MeetReference(100L, "Spring Open", MEET_DATE);

    @Mock
    private MemberHistorySource source;

    private InMemoryLifterRepository repository;
    private AuditService auditService;
    private MemberHistoryVerifier verifier;

    @BeforeEach
    void setUp() {
        repository = new InMemoryLifterRepository();
        auditService = new AuditService();
        verifier = new MemberHistoryVerifier(source, repository, ResolverOptions.defaults(), auditService);
    }

    private static HistoryEntry entry(LocalDate date, Double bodyweight, Double total) {
        return new HistoryEntry("Spring Open", date, bodyweight, total);
    }

    private void history(long stableId, HistoryEntry... entries) {
        when(source.getHistory(stableId, 1)).thenReturn(HistoryPage.last(1, List.of(entries)));
    }

    @Nested
    @DisplayName("Single stable id")
    class SingleStableId {

        @Test
        @DisplayName("Should accept a history entry exactly 5 days from the meet date")
        void testFiveDaysWithinTolerance() {
            history(555L, entry(MEET_DATE.plusDays(5), 62.0, 187.0));

            VerificationOutcome outcome = verifier.verify(555L, MEET, 61.5, 187.0);

            assertEquals(VerificationStatus.VERIFIED, outcome.status());
            assertNull(outcome.matchedLifterId());
        }

        @Test
        @DisplayName("Should reject a history entry 6 days from the meet date")
        void testSixDaysOutsideTolerance() {
            history(555L, entry(MEET_DATE.minusDays(6), 62.0, 187.0));

            VerificationOutcome outcome = verifier.verify(555L, MEET, 61.5, 187.0);

            assertEquals(VerificationStatus.NOT_FOUND, outcome.status());
        }

        @Test
        @DisplayName("Should accept bodyweight exactly at the tolerance and reject beyond it")
        void testBodyweightTolerance() {
            history(555L, entry(MEET_DATE, 63.5, 187.0));
            history(556L, entry(MEET_DATE, 64.0, 187.0));

            assertTrue(verifier.verify(555L, MEET, 61.5, 187.0).isVerified());
            assertEquals(VerificationStatus.PERFORMANCE_MISMATCH, verifier.verify(556L, MEET, 61.5, 187.0).status());
        }

        @Test
        @DisplayName("Should report a total 50 kg above the expected value as PERFORMANCE_MISMATCH")
        void testTotalMismatch() {
            history(555L, entry(MEET_DATE, 62.0, 237.0));

            VerificationOutcome outcome = verifier.verify(555L, MEET, 61.5, 187.0);

            assertEquals(VerificationStatus.PERFORMANCE_MISMATCH, outcome.status());
            assertTrue(outcome.reason().contains("total"));
        }

        @Test
        @DisplayName("Should skip comparisons for unknown values")
        void testUnknownValues() {
            history(555L, entry(MEET_DATE, null, 237.0));

            assertTrue(verifier.verify(555L, MEET, 61.5, null).isVerified());
        }

        @Test
        @DisplayName("Should require the meet name to match exactly")
        void testMeetNameMismatch() {
            when(source.getHistory(555L, 1)).thenReturn(HistoryPage.last(1,
                    List.of(new HistoryEntry("Spring Open 2024", MEET_DATE, 62.0, 187.0))));

            assertEquals(VerificationStatus.NOT_FOUND, verifier.verify(555L, MEET, 61.5, 187.0).status());
        }

        @Test
        @DisplayName("Should follow history pages until the meet is found")
        void testPagination() {
            when(source.getHistory(555L, 1)).thenReturn(new HistoryPage(1,
                    List.of(new HistoryEntry("Winter Open", MEET_DATE.minusMonths(3), 62.0, 180.0)), true));
            when(source.getHistory(555L, 2)).thenReturn(HistoryPage.last(2, List.of(entry(MEET_DATE, 62.0, 187.0))));

            VerificationOutcome outcome = verifier.verify(555L, MEET, 61.5, 187.0);

            assertTrue(outcome.isVerified());
            assertTrue(outcome.reason().contains("page 2"));
        }

        @Test
        @DisplayName("Should stop at the configured page limit")
        void testPageLimit() {
            MemberHistoryVerifier limited = new MemberHistoryVerifier(source, repository,
                    ResolverOptions.builder().historyMaxPages(1).build(), auditService);
            when(source.getHistory(555L, 1)).thenReturn(new HistoryPage(1, List.of(), true));

            VerificationOutcome outcome = limited.verify(555L, MEET, 61.5, 187.0);

            assertEquals(VerificationStatus.NOT_FOUND, outcome.status());
            verify(source, never()).getHistory(555L, 2);
        }

        @Test
        @DisplayName("Should report INCONCLUSIVE when the source is unavailable")
        void testUnavailable() {
            when(source.getHistory(555L, 1)).thenThrow(new SourceUnavailableException("timeout"));

            assertEquals(VerificationStatus.INCONCLUSIVE, verifier.verify(555L, MEET, 61.5, 187.0).status());
        }

        @Test
        @DisplayName("Should skip when the meet name or date is missing")
        void testIncompleteMeet() {
            VerificationOutcome outcome = verifier.verify(555L, new MeetReference(100L, null, MEET_DATE), 61.5, 187.0);

            assertEquals(VerificationStatus.SKIPPED, outcome.status());
            verifyNoInteractions(source);
        }
    }

    @Nested
    @DisplayName("Candidates")
    class Candidates {

        private ResolutionContext context() {
            return ResolutionContext.builder()
                    .name("Jane Smith")
                    .meetId(100L)
                    .meetName("Spring Open")
                    .date(MEET_DATE)
                    .bodyweightKg(61.5)
                    .totalKg(187.0)
                    .build();
        }

        private Lifter stored(Long stableId) {
            return repository.createLifter(Lifter.builder().normalizedName("Jane Smith").stableId(stableId).build());
        }

        private VerificationRequest request(List<Lifter> candidates) {
            return new VerificationRequest(context(), "Jane Smith", candidates);
        }

        @Test
        @DisplayName("Should verify the first candidate whose history holds the meet")
        void testFirstCandidateVerified() {
            Lifter a = stored(555L);
            Lifter b = stored(null);
            history(555L, entry(MEET_DATE, 62.0, 187.0));

            VerificationOutcome outcome = verifier.verify(request(List.of(a, b)));

            assertTrue(outcome.hasMatch());
            assertEquals(a.getLifterId(), outcome.matchedLifterId());
            verify(source, never()).searchByName(anyString());
        }

        @Test
        @DisplayName("Should fall through a mismatch and discover the next candidate's stable id")
        void testFallThroughAndDiscover() {
            Lifter a = stored(555L);
            Lifter b = stored(null);
            history(555L, entry(MEET_DATE, 62.0, 237.0));
            when(source.searchByName("Jane Smith")).thenReturn(Optional.of(888L));
            history(888L, entry(MEET_DATE, 61.0, 186.0));

            VerificationOutcome outcome = verifier.verify(request(List.of(a, b)));

            assertEquals(b.getLifterId(), outcome.matchedLifterId());
            assertEquals(888L, outcome.discoveredStableId());
            assertNull(repository.findById(b.getLifterId()).orElseThrow().getStableId());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.PERFORMANCE_MISMATCH).size());
            assertTrue(auditService.getEntriesByAction(AuditAction.STABLE_ID_DISCOVERED).isEmpty());
        }

        @Test
        @DisplayName("Should save a discovered id onto a sole candidate even when its history lacks the meet")
        void testSoleCandidateKeepsDiscoveredId() {
            Lifter b = stored(null);
            when(source.searchByName("Jane Smith")).thenReturn(Optional.of(888L));
            when(source.getHistory(888L, 1)).thenReturn(HistoryPage.last(1,
                    List.of(new HistoryEntry("Winter Open", MEET_DATE.minusMonths(2), 61.0, 180.0))));

            VerificationOutcome outcome = verifier.verify(request(List.of(b)));

            assertEquals(VerificationStatus.NOT_FOUND, outcome.status());
            assertEquals(888L, repository.findById(b.getLifterId()).orElseThrow().getStableId());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.STABLE_ID_DISCOVERED).size());
        }

        @Test
        @DisplayName("Should not save a name-search id onto any of several same-name candidates")
        void testSharedNameSearchNotSaved() {
            Lifter a = stored(null);
            Lifter b = stored(null);
            when(source.searchByName("Jane Smith")).thenReturn(Optional.of(999L));
            history(999L, entry(MEET_DATE, 62.0, 237.0));

            VerificationOutcome outcome = verifier.verify(request(List.of(a, b)));

            assertEquals(VerificationStatus.PERFORMANCE_MISMATCH, outcome.status());
            assertNull(repository.findById(a.getLifterId()).orElseThrow().getStableId());
            assertNull(repository.findById(b.getLifterId()).orElseThrow().getStableId());
            verify(source, times(1)).searchByName("Jane Smith");
            verify(source, times(1)).getHistory(999L, 1);
        }

        @Test
        @DisplayName("Should report PERFORMANCE_MISMATCH when no candidate can be confirmed")
        void testAllCandidatesFail() {
            Lifter a = stored(555L);
            Lifter b = stored(null);
            history(555L, entry(MEET_DATE, 62.0, 237.0));
            when(source.searchByName("Jane Smith")).thenReturn(Optional.empty());

            VerificationOutcome outcome = verifier.verify(request(List.of(a, b)));

            assertEquals(VerificationStatus.PERFORMANCE_MISMATCH, outcome.status());
            assertFalse(outcome.hasMatch());
        }

        @Test
        @DisplayName("Should raise a conflict when the discovered id belongs to another lifter")
        void testDiscoveredIdOwned() {
            Lifter owner = repository.createLifter(Lifter.builder().normalizedName("Jane Smyth").stableId(888L).build());
            Lifter b = stored(null);
            when(source.searchByName("Jane Smith")).thenReturn(Optional.of(888L));

            VerificationOutcome outcome = verifier.verify(request(List.of(b)));

            assertEquals(VerificationStatus.NOT_FOUND, outcome.status());
            assertEquals(1, outcome.conflicts().size());
            assertEquals(ConflictType.STABLE_ID_OWNED_BY_OTHER, outcome.conflicts().get(0).type());
            assertEquals(List.of(b.getLifterId(), owner.getLifterId()), outcome.conflicts().get(0).lifterIds());
            assertNull(repository.findById(b.getLifterId()).orElseThrow().getStableId());
            verify(source, never()).getHistory(anyLong(), anyInt());
        }

        @Test
        @DisplayName("Should report INCONCLUSIVE when the name search fails")
        void testSearchFails() {
            Lifter b = stored(null);
            when(source.searchByName("Jane Smith")).thenThrow(new SourceUnavailableException("timeout"));

            assertEquals(VerificationStatus.INCONCLUSIVE, verifier.verify(request(List.of(b))).status());
        }

        @Test
        @DisplayName("Should skip without candidates")
        void testNoCandidates() {
            assertEquals(VerificationStatus.SKIPPED, verifier.verify(request(List.of())).status());
            verifyNoInteractions(source);
        }
    }
}
