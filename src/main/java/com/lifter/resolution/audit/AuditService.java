package com.lifter.resolution.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only audit trail of resolution decisions, conflicts and mismatches.
 * The correlation id is taken from the current {@code LogContext} when present.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    public AuditEntry record(AuditEntry entry) {
        entries.add(entry);
        log.debug("audit.recorded action={} lifterId={} details={}",
                entry.action(), entry.lifterId(), entry.details());
        return entry;
    }

    /**
     * Records an entry for the row currently in the MDC. Null detail values are dropped.
     */
    public AuditEntry record(AuditAction action, Long lifterId, Map<String, Object> details) {
        Map<String, Object> cleaned = new HashMap<>();
        if (details != null) {
            details.forEach((k, v) -> {
                if (v != null) {
                    cleaned.put(k, v);
                }
            });
        }
        return record(AuditEntry.builder()
                .action(action)
                .lifterId(lifterId)
                .correlationId(MDC.get("correlationId"))
                .details(cleaned)
                .build());
    }

    public AuditEntry record(AuditAction action, Long lifterId) {
        return record(action, lifterId, null);
    }

    public List<AuditEntry> getAllEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<AuditEntry> getEntriesForLifter(long lifterId) {
        return entries.stream()
                .filter(e -> e.lifterId() != null && e.lifterId() == lifterId)
                .toList();
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .toList();
    }

    public List<AuditEntry> getEntriesForCorrelation(String correlationId) {
        return entries.stream()
                .filter(e -> Objects.equals(correlationId, e.correlationId()))
                .toList();
    }

    public int size() {
        return entries.size();
    }
}
