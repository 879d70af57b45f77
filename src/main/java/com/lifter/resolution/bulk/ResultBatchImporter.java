package com.lifter.resolution.bulk;

import com.lifter.resolution.api.IngestionResult;
import com.lifter.resolution.api.ResolutionResult;
import com.lifter.resolution.api.ResultIngestionService;
import com.lifter.resolution.audit.AuditAction;
import com.lifter.resolution.audit.AuditService;
import com.lifter.resolution.core.model.OutcomeCode;
import com.lifter.resolution.core.model.ResultRow;
import com.lifter.resolution.logging.LogContext;
import com.lifter.resolution.metrics.MetricsService;
import com.lifter.resolution.reprocess.ReprocessingItem;
import com.lifter.resolution.reprocess.ReprocessingQueue;
import com.lifter.resolution.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ingests the rows of one or more meets.
 *
 * <p>Rows are processed one at a time in ascending meet date, keeping input order for equal
 * dates and putting undated rows last. A row that fails never stops the batch: an invalid row is
 * reported as an error, a row whose store write failed is reported as STORE_FAILED and queued
 * for reprocessing.</p>
 */
public class ResultBatchImporter {
    private static final Logger log = LoggerFactory.getLogger(ResultBatchImporter.class);
    private static final int PROGRESS_INTERVAL = 100;

    private static final Comparator<ResultRow> BY_DATE = Comparator.comparing(ResultRow::getDate,
            Comparator.nullsLast(Comparator.naturalOrder()));

    private final ResultIngestionService ingestionService;
    private final ReprocessingQueue reprocessingQueue;
    private final MeetResultCsvReader csvReader;
    private final MetricsService metricsService;
    private final AuditService auditService;

    public ResultBatchImporter(ResultIngestionService ingestionService, ReprocessingQueue reprocessingQueue) {
        this.ingestionService = ingestionService;
        this.reprocessingQueue = reprocessingQueue;
        this.csvReader = new MeetResultCsvReader();
        this.metricsService = ingestionService.getResolver().getMetricsService();
        this.auditService = ingestionService.getResolver().getAuditService();
    }

    /**
     * Reads a meet file and imports its rows.
     *
     * @throws MeetFileException if the file cannot be read
     */
    public ImportReport importMeetFile(InputStream input, long meetId, String meetName, ProgressCallback callback) {
        return importRows(csvReader.read(input, meetId, meetName), callback);
    }

    public ImportReport importMeetFile(Reader reader, long meetId, String meetName, ProgressCallback callback) {
        return importRows(csvReader.read(reader, meetId, meetName), callback);
    }

    /**
     * Imports rows, sorted by meet date first.
     */
    public ImportReport importRows(List<ResultRow> rows, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<ResultRow> ordered = new ArrayList<>(rows);
        ordered.sort(BY_DATE);

        String batchId = LogContext.generateCorrelationId();
        try (LogContext lc = LogContext.forBatch(batchId)) {
            log.info("import.started batchId={} rows={}", batchId, ordered.size());
            metricsService.recordBatchSize(ordered.size());

            Tally tally = new Tally();
            for (ResultRow row : ordered) {
                try {
                    tally.success(row, ingestionService.ingest(row));
                } catch (StoreException e) {
                    tally.storeFailure(row, e);
                    ReprocessingItem item = reprocessingQueue.submit(row, e.getMessage());
                    Map<String, Object> details = new HashMap<>();
                    details.put("itemId", item.getId());
                    details.put("lifter", row.getLifterName());
                    details.put("meetId", row.getMeetId());
                    details.put("reason", e.getMessage());
                    auditService.record(AuditAction.ROW_QUEUED, null, details);
                } catch (IllegalArgumentException e) {
                    tally.invalid(row, e);
                }

                if (tally.processed % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(tally.processed, ordered.size(), "Processed " + tally.processed + " rows");
                }
            }

            ImportReport report = tally.report();
            cb.onProgress(report.totalRows(), ordered.size(), "Import completed");
            log.info("import.completed batchId={} report={}", batchId, report);
            return report;
        }
    }

    /**
     * Retries every pending row of the reprocessing queue, oldest first. Rows that succeed are
     * marked resolved, invalid rows are marked failed, and rows that hit a store error again stay
     * pending.
     */
    public ImportReport retryQueued(ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<ReprocessingItem> pending = reprocessingQueue.getPending();
        log.info("reprocess.started pending={}", pending.size());

        Tally tally = new Tally();
        for (ReprocessingItem item : pending) {
            ResultRow row = item.getRow();
            try {
                IngestionResult result = ingestionService.ingest(row);
                tally.success(row, result);
                reprocessingQueue.markResolved(item.getId(),
                        result.resolution().getLifter().getLifterId());
            } catch (StoreException e) {
                tally.storeFailure(row, e);
                reprocessingQueue.recordFailedAttempt(item.getId(), e.getMessage());
            } catch (IllegalArgumentException e) {
                tally.invalid(row, e);
                reprocessingQueue.markFailed(item.getId(), e.getMessage());
            }
            cb.onProgress(tally.processed, pending.size(), "Retried " + tally.processed + " rows");
        }

        ImportReport report = tally.report();
        log.info("reprocess.completed report={} stillPending={}", report, reprocessingQueue.countPending());
        return report;
    }

    /**
     * Running counts of one import.
     */
    private static final class Tally {
        private final Map<OutcomeCode, Long> counts = new EnumMap<>(OutcomeCode.class);
        private final List<ImportReport.RowReport> rows = new ArrayList<>();
        private final List<ImportReport.ImportError> errors = new ArrayList<>();
        private long processed;

        void success(ResultRow row, IngestionResult result) {
            processed++;
            ResolutionResult resolution = result.resolution();
            increment(resolution.getOutcome());
            if (resolution.hasConflicts()) {
                increment(OutcomeCode.INTEGRITY_CONFLICT);
            }
            rows.add(new ImportReport.RowReport(row.getLineNumber(), row.getLifterName(),
                    resolution.getLifter().getLifterId(), result.result().getResultId(),
                    resolution.getOutcome(), resolution.getConflicts().size()));
        }

        void storeFailure(ResultRow row, StoreException e) {
            processed++;
            increment(OutcomeCode.STORE_FAILED);
            errors.add(new ImportReport.ImportError(row.getLineNumber(), row.getLifterName(),
                    OutcomeCode.STORE_FAILED, e.getMessage()));
            log.warn("import.storeFailed line={} lifter='{}' error={}",
                    row.getLineNumber(), row.getLifterName(), e.getMessage());
        }

        void invalid(ResultRow row, IllegalArgumentException e) {
            processed++;
            errors.add(new ImportReport.ImportError(row.getLineNumber(), row.getLifterName(), null, e.getMessage()));
            log.warn("import.invalidRow line={} lifter='{}' error={}",
                    row.getLineNumber(), row.getLifterName(), e.getMessage());
        }

        private void increment(OutcomeCode code) {
            counts.merge(code, 1L, Long::sum);
        }

        ImportReport report() {
            return new ImportReport(processed, counts, rows, errors);
        }
    }
}
