package com.lifter.resolution.api;

import com.lifter.resolution.audit.AuditAction;
import com.lifter.resolution.audit.AuditService;
import com.lifter.resolution.core.model.IntegrityConflict;
import com.lifter.resolution.core.model.Lifter;
import com.lifter.resolution.core.model.MeetResult;
import com.lifter.resolution.core.model.ResultRow;
import com.lifter.resolution.logging.LogContext;
import com.lifter.resolution.merge.EnrichmentMerger;
import com.lifter.resolution.store.LifterRepository;
import com.lifter.resolution.store.RecordedResult;
import com.lifter.resolution.store.StableIdConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Resolves a result row and stores it.
 *
 * <p>A lifter created for the row is written in the same repository call as the row's result,
 * so a failure never leaves a lifter without its result. Attributes harvested while resolving
 * are merged into the result before it is stored, filling only empty fields.</p>
 */
public class ResultIngestionService {
    private static final Logger log = LoggerFactory.getLogger(ResultIngestionService.class);

    private final IdentityResolver resolver;
    private final LifterRepository repository;
    private final AuditService auditService;

    public ResultIngestionService(IdentityResolver resolver) {
        this.resolver = resolver;
        this.repository = resolver.getRepository();
        this.auditService = resolver.getAuditService();
    }

    /**
     * Ingests one row.
     *
     * @throws IllegalArgumentException if the row's name or stable id is invalid
     * @throws com.lifter.resolution.store.StoreException if the row could not be stored
     */
    public IngestionResult ingest(ResultRow row) {
        ResolutionContext ctx = ResolutionContext.fromRow(row);
        ResolutionResult resolution = resolver.decide(ctx);

        try (LogContext lc = LogContext.forRow(ctx.correlationId(), ctx.meetId(), ctx.name())) {
            Lifter lifter = resolution.getLifter();
            MeetResult draft = EnrichmentMerger.merge(
                    MeetResult.fromRow(row, lifter.getLifterId(), lifter.getNormalizedName()),
                    resolution.getResultEnrichment());

            RecordedResult recorded;
            try {
                recorded = repository.recordResult(lifter, draft);
            } catch (StableIdConflictException e) {
                if (lifter.isPersisted()) {
                    throw e;
                }
                IntegrityConflict conflict = resolver.stableIdRaceLost(e);
                resolution = resolution.withConflict(conflict);
                recorded = repository.recordResult(lifter.toBuilder().stableId(null).build(), draft);
            }

            if (recorded.lifterCreated()) {
                resolver.auditCreated(recorded.lifter(), resolution.getOutcome());
            }
            Map<String, Object> details = new HashMap<>();
            details.put("resultId", recorded.result().getResultId());
            details.put("meetId", row.getMeetId());
            details.put("outcome", resolution.getOutcome().name());
            details.put("created", recorded.resultCreated());
            auditService.record(AuditAction.RESULT_RECORDED, recorded.lifter().getLifterId(), details);

            log.info("ingest.recorded lifterId={} resultId={} outcome={} newResult={}",
                    recorded.lifter().getLifterId(), recorded.result().getResultId(),
                    resolution.getOutcome(), recorded.resultCreated());
            return new IngestionResult(resolution.withLifter(recorded.lifter()), recorded.result(),
                    recorded.resultCreated());
        }
    }

    public IdentityResolver getResolver() {
        return resolver;
    }
}
