package com.lifter.resolution.bulk;

import com.lifter.resolution.core.model.OutcomeCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ImportReportTest {

    @Test
    @DisplayName("Should count outcomes and creations")
    void testCounts() {
        Map<OutcomeCode, Long> counts = new HashMap<>();
        counts.put(OutcomeCode.CREATED_NEW, 3L);
        counts.put(OutcomeCode.CREATED_NEW_EXTREME_SPLIT, 1L);
        counts.put(OutcomeCode.RESOLVED_BY_NAME, 2L);

        ImportReport report = new ImportReport(6, counts, List.of(),
                List.of(new ImportReport.ImportError(4, "Jane Smith", OutcomeCode.STORE_FAILED, "down")));

        assertEquals(4, report.lifterCreatedCount());
        assertEquals(2, report.count(OutcomeCode.RESOLVED_BY_NAME));
        assertEquals(0, report.count(OutcomeCode.RESOLVED_BY_TIER1));
        assertTrue(report.hasErrors());
        assertEquals(1, report.errorCount());
    }

    @Test
    @DisplayName("Should not be affected by later changes to its inputs")
    void testDefensiveCopy() {
        Map<OutcomeCode, Long> counts = new HashMap<>();
        counts.put(OutcomeCode.CREATED_NEW, 1L);
        ImportReport report = new ImportReport(1, counts, null, null);

        counts.put(OutcomeCode.CREATED_NEW, 9L);

        assertEquals(1, report.count(OutcomeCode.CREATED_NEW));
        assertTrue(report.rows().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> report.errors().add(null));
    }

    @Test
    @DisplayName("Should report nothing when empty")
    void testEmpty() {
        ImportReport report = ImportReport.empty();

        assertEquals(0, report.totalRows());
        assertEquals(0, report.successCount());
        assertFalse(report.hasErrors());
    }
}
