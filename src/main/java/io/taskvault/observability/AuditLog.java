package io.taskvault.observability;

import io.taskvault.security.SensitiveDataMasker;
import io.taskvault.storage.StateStoreException;
import io.taskvault.util.Hashing;
import io.taskvault.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Append-only JSON-lines audit trail, one segment per UTC day. Every row carries the hash of
 * the previous row in the same segment; timestamps within a segment never go backwards.
 */
public final class AuditLog {
    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    private final Path auditDir;
    private final Clock clock;
    private LocalDate currentDay;
    private Instant lastTimestamp;
    private String previousHash;

    public AuditLog(Path auditDir, Clock clock) {
        this.auditDir = auditDir;
        this.clock = clock;
        try {
            Files.createDirectories(auditDir);
        } catch (IOException e) {
            throw new StateStoreException("Failed to initialize audit directory: " + auditDir, e);
        }
    }

    public synchronized AuditEntry log(AuditEvent event) {
        Instant now = clock.instant();
        LocalDate day = LocalDate.ofInstant(now, ZoneOffset.UTC);
        if (!day.equals(currentDay)) {
            openSegment(day);
        }
        if (lastTimestamp != null && now.isBefore(lastTimestamp)) {
            now = lastTimestamp;
        }
        AuditEntry unsigned = new AuditEntry(
                now,
                event.actionType(),
                event.actor(),
                event.target(),
                SensitiveDataMasker.masked(event.parameters()),
                event.approvalStatus(),
                event.result(),
                event.error() == null ? null : SensitiveDataMasker.maskAccountNumbers(event.error()),
                previousHash,
                null
        );
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(unsigned));
        AuditEntry entry = unsigned.withHash(rowHash);
        Path segment = segmentFile(day);
        try {
            Files.writeString(segment, Jsons.toCompactJson(entry) + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StateStoreException("Failed to write audit log: " + segment, e);
        }
        previousHash = rowHash;
        lastTimestamp = now;
        log.debug("audit {} {} -> {}", entry.actionType(), entry.target(), entry.result());
        return entry;
    }

    public synchronized String currentHash() {
        return previousHash == null ? "" : previousHash;
    }

    public Path segmentFile(LocalDate day) {
        return auditDir.resolve(day + ".jsonl");
    }

    public List<AuditEntry> readSegment(LocalDate day) {
        return readSegment(segmentFile(day));
    }

    /**
     * Newest entries first, walking segments from the most recent day backwards.
     */
    public List<AuditEntry> recent(int limit) {
        List<AuditEntry> out = new ArrayList<>();
        if (limit <= 0) {
            return out;
        }
        for (Path segment : segmentsNewestFirst()) {
            List<AuditEntry> rows = readSegment(segment);
            for (int i = rows.size() - 1; i >= 0 && out.size() < limit; i--) {
                out.add(rows.get(i));
            }
            if (out.size() >= limit) {
                break;
            }
        }
        return out;
    }

    /**
     * Recomputes the hash chain of one segment. False when a row was altered, dropped or reordered.
     */
    public boolean verify(LocalDate day) {
        String expectedPrev = "";
        Instant previous = null;
        for (AuditEntry entry : readSegment(day)) {
            if (!Objects.equals(expectedPrev, entry.prevHash())) {
                return false;
            }
            if (!Hashing.sha256Hex(Jsons.toCompactJson(entry.withoutHash())).equals(entry.hash())) {
                return false;
            }
            if (previous != null && entry.timestamp().isBefore(previous)) {
                return false;
            }
            previous = entry.timestamp();
            expectedPrev = entry.hash();
        }
        return true;
    }

    private void openSegment(LocalDate day) {
        List<AuditEntry> rows = readSegment(segmentFile(day));
        AuditEntry last = rows.isEmpty() ? null : rows.get(rows.size() - 1);
        currentDay = day;
        previousHash = last == null ? "" : last.hash();
        lastTimestamp = last == null ? null : last.timestamp();
    }

    private List<AuditEntry> readSegment(Path segment) {
        if (!Files.exists(segment)) {
            return List.of();
        }
        List<AuditEntry> rows = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(segment, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    rows.add(Jsons.mapper().readValue(line, AuditEntry.class));
                }
            }
        } catch (IOException e) {
            throw new StateStoreException("Failed to read audit segment: " + segment, e);
        }
        return rows;
    }

    private List<Path> segmentsNewestFirst() {
        List<Path> segments = new ArrayList<>();
        if (!Files.isDirectory(auditDir)) {
            return segments;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(auditDir, "*.jsonl")) {
            stream.forEach(segments::add);
        } catch (IOException e) {
            throw new StateStoreException("Failed to list audit segments: " + auditDir, e);
        }
        segments.sort(Comparator.comparing((Path p) -> p.getFileName().toString()));
        Collections.reverse(segments);
        return segments;
    }
}
