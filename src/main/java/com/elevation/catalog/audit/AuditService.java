package com.elevation.catalog.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Service for recording and querying audit entries.
 * Provides append-only storage for rejections, deprecations, item builds and node writes.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries;

    public AuditService() {
        this.entries = new CopyOnWriteArrayList<>();
    }

    /**
     * Records an audit entry.
     */
    public AuditEntry record(AuditEntry entry) {
        entries.add(entry);
        log.debug("Audit entry recorded: {} for {} by {}",
                entry.action(), entry.subjectId(), entry.component());
        return entry;
    }

    public AuditEntry record(AuditAction action, String subjectId, String component, Map<String, Object> details) {
        AuditEntry entry = AuditEntry.builder()
                .action(action)
                .subjectId(subjectId)
                .component(component)
                .details(details)
                .build();
        return record(entry);
    }

    public AuditEntry record(AuditAction action, String subjectId, String component) {
        return record(action, subjectId, component, null);
    }

    /**
     * Gets all audit entries (immutable view).
     */
    public List<AuditEntry> getAllEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }
}
