package io.taskvault.ingest;

import io.taskvault.model.TaskRecord;
import io.taskvault.observability.AuditActions;
import io.taskvault.observability.AuditEvent;
import io.taskvault.observability.AuditLog;
import io.taskvault.storage.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Admits incoming work exactly once per dedup key. Each call writes exactly one audit entry.
 */
public final class Ingestor {
    private static final Logger log = LoggerFactory.getLogger(Ingestor.class);
    private static final String ACTOR = "ingestor";

    private final StateStore store;
    private final AuditLog audit;
    private final Clock clock;

    public Ingestor(StateStore store, AuditLog audit, Clock clock) {
        this.store = store;
        this.audit = audit;
        this.clock = clock;
    }

    public AdmitOutcome admit(IncomingItem item) {
        String dedupKey = TaskNames.dedupKey(item.source(), item.content());

        Optional<TaskRecord> finished = store.findFinishedByDedupKey(dedupKey);
        if (finished.isPresent()) {
            return skip(finished.get(), dedupKey, AdmitOutcome.REASON_ALREADY_PROCESSED);
        }
        Optional<TaskRecord> active = store.findActiveByDedupKey(dedupKey);
        if (active.isPresent()) {
            return skip(active.get(), dedupKey, AdmitOutcome.REASON_IN_FLIGHT);
        }

        Instant now = clock.instant();
        String name = TaskNames.fresh(item.source(), dedupKey, now);
        TaskRecord task = TaskRecord.admitted(name, dedupKey, item.source(), item.metadata(), now);
        store.createTask(task, item.content());

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("dedup_key", dedupKey);
        params.put("source", item.source().wireName());
        params.put("bytes", item.content().length());
        audit.log(AuditEvent.success(AuditActions.FILE_WRITE, ACTOR, name, params));
        log.info("Admitted task {} from {}", name, item.source().wireName());
        return AdmitOutcome.accepted(name, dedupKey);
    }

    private AdmitOutcome skip(TaskRecord existing, String dedupKey, String reason) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("existing_task", existing.name());
        params.put("existing_status", existing.status().wireName());
        params.put("reason", reason);
        audit.log(AuditEvent.skip(AuditActions.DEDUP_SKIP, ACTOR, dedupKey, params));
        log.info("Skipped duplicate of {} ({})", existing.name(), reason);
        return AdmitOutcome.skipped(existing.name(), dedupKey, reason);
    }
}
