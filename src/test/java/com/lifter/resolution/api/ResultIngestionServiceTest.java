package com.lifter.resolution.api;

import com.lifter.resolution.audit.AuditAction;
import com.lifter.resolution.audit.AuditService;
import com.lifter.resolution.core.model.AthleteSummary;
import com.lifter.resolution.core.model.ConflictType;
import com.lifter.resolution.core.model.Lifter;
import com.lifter.resolution.core.model.MeetResult;
import com.lifter.resolution.core.model.OutcomeCode;
import com.lifter.resolution.core.model.ResultRow;
import com.lifter.resolution.division.DivisionCodeTable;
import com.lifter.resolution.division.DivisionVerifier;
import com.lifter.resolution.metrics.NoOpMetricsService;
import com.lifter.resolution.rules.NameNormalizer;
import com.lifter.resolution.source.DivisionQueryResult;
import com.lifter.resolution.store.InMemoryLifterRepository;
import com.lifter.resolution.store.LifterRepository;
import com.lifter.resolution.store.RecordedResult;
import com.lifter.resolution.store.StableIdConflictException;
import com.lifter.resolution.store.StoreException;
import com.lifter.resolution.tier.TierRetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResultIngestionServiceTest {

    private static final LocalDate MEET_DATE = LocalDate.of(2024, 3, 1);

    private InMemoryLifterRepository repository;
    private AuditService auditService;
    private List<AthleteSummary> rankings;
    private ResultIngestionService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryLifterRepository();
        auditService = new AuditService();
        rankings = new ArrayList<>();
        service = new ResultIngestionService(resolver(repository));
    }

    private IdentityResolver resolver(LifterRepository repo) {
        ResolverOptions options = ResolverOptions.defaults();
        DivisionCodeTable codeTable = new DivisionCodeTable(Map.of("Open Women's 63kg", 101),
                options.getDivisionCutover());
        return IdentityResolver.builder()
                .repository(repo)
                .retryPolicy(TierRetryPolicy.noRetries())
                .auditService(auditService)
                .verifier(new DivisionVerifier((code, from, to) -> DivisionQueryResult.ok(rankings), codeTable, repo,
                        new NameNormalizer(), options, new NoOpMetricsService(), auditService))
                .build();
    }

    private static ResultRow.Builder row() {
        return ResultRow.builder()
                .lineNumber(2)
                .lifterName("Jane Smith")
                .meetId(100L)
                .meetName("Spring Open")
                .date(MEET_DATE)
                .ageCategory("Open Women's")
                .weightClass("63kg")
                .bodyweightKg(61.5)
                .total(187.0);
    }

    @Test
    @DisplayName("Should store a new lifter together with its result")
    void testNewLifterAndResult() {
        IngestionResult result = service.ingest(row().build());

        assertEquals(OutcomeCode.CREATED_NEW, result.resolution().getOutcome());
        assertTrue(result.resultCreated());
        assertNotNull(result.result().getResultId());
        assertEquals(result.resolution().getLifter().getLifterId(), result.result().getLifterId());
        assertEquals(1, repository.lifterCount());
        assertEquals(1, repository.resultCount());
        assertEquals(1, auditService.getEntriesByAction(AuditAction.LIFTER_CREATED).size());
        assertEquals(1, auditService.getEntriesByAction(AuditAction.RESULT_RECORDED).size());
    }

    @Test
    @DisplayName("Should fill empty result fields from the harvested ranking row")
    void testHarvestedFieldsOnResult() {
        rankings.add(new AthleteSummary("Jane Smith", 1234L, "Ranked Club", 25, 3, "F", "Carolina",
                "National", 187.0, MEET_DATE));

        MeetResult stored = service.ingest(row().build()).result();

        assertEquals("Ranked Club", stored.getClub());
        assertEquals("Carolina", stored.getWso());
        assertEquals(25, stored.getCompetitionAge());
        assertEquals(1234L, repository.findById(stored.getLifterId()).orElseThrow().getStableId());
    }

    @Test
    @DisplayName("Should keep the row's own club over the harvested one")
    void testRowValuesWin() {
        rankings.add(new AthleteSummary("Jane Smith", 1234L, "Ranked Club", 25, 3, "F", "Carolina",
                "National", 187.0, MEET_DATE));

        MeetResult stored = service.ingest(row().club("Row Club").build()).result();

        assertEquals("Row Club", stored.getClub());
        assertEquals("Carolina", stored.getWso());
    }

    @Test
    @DisplayName("Should resolve a replayed row to the same lifter without adding a result")
    void testReplay() {
        IngestionResult first = service.ingest(row().build());
        IngestionResult second = service.ingest(row().build());

        assertEquals(first.resolution().getLifter().getLifterId(), second.resolution().getLifter().getLifterId());
        assertFalse(second.resultCreated());
        assertEquals(first.result().getResultId(), second.result().getResultId());
        assertEquals(1, repository.lifterCount());
        assertEquals(1, repository.resultCount());
    }

    @Test
    @DisplayName("Should store the new lifter without its stable id when the id was taken concurrently")
    void testRaceOnNewLifter() {
        LifterRepository mockRepository = mock(LifterRepository.class);
        Lifter persisted = Lifter.builder().lifterId(6L).normalizedName("Jane Smith").build();
        MeetResult storedResult = MeetResult.builder().resultId(1L).lifterId(6L).meetId(100L).build();
        when(mockRepository.recordResult(any(), any()))
                .thenThrow(new StableIdConflictException(1234L, 5L))
                .thenReturn(new RecordedResult(persisted, storedResult, true, true));
        ResultIngestionService raced = new ResultIngestionService(IdentityResolver.builder()
                .repository(mockRepository)
                .auditService(auditService)
                .build());

        IngestionResult result = raced.ingest(row().stableId(1234L).ageCategory(null).build());

        assertEquals(6L, result.resolution().getLifter().getLifterId());
        assertEquals(ConflictType.STABLE_ID_OWNED_BY_OTHER, result.resolution().getConflicts().get(0).type());
        verify(mockRepository, times(2)).recordResult(any(), any());
    }

    @Test
    @DisplayName("Should propagate a store failure for an existing lifter")
    void testStoreFailure() {
        LifterRepository mockRepository = mock(LifterRepository.class);
        Lifter existing = Lifter.builder().lifterId(3L).normalizedName("Jane Smith").build();
        when(mockRepository.findByName("Jane Smith")).thenReturn(List.of(existing));
        when(mockRepository.recordResult(any(), any())).thenThrow(new StoreException("disk full"));
        ResultIngestionService failing = new ResultIngestionService(IdentityResolver.builder()
                .repository(mockRepository)
                .auditService(auditService)
                .build());

        assertThrows(StoreException.class, () -> failing.ingest(row().build()));
        assertTrue(auditService.getEntriesByAction(AuditAction.RESULT_RECORDED).isEmpty());
    }

    @Test
    @DisplayName("Should reject a row with an invalid name")
    void testInvalidRow() {
        assertThrows(IllegalArgumentException.class, () -> service.ingest(row().lifterName(" ").build()));
        assertEquals(0, repository.lifterCount());
    }
}
