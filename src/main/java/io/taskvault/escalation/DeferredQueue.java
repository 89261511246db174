package io.taskvault.escalation;

import com.fasterxml.jackson.core.type.TypeReference;
import io.taskvault.model.DeferredEntry;
import io.taskvault.model.DeferredStatus;
import io.taskvault.storage.StateStoreException;
import io.taskvault.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code deferred_queue.json}: the whole list is read, changed and written back with an atomic
 * replace. Entries are never removed; resolution only changes their status.
 */
public final class DeferredQueue {
    private static final TypeReference<List<DeferredEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final Path queueFile;

    public DeferredQueue(Path queueFile) {
        this.queueFile = queueFile;
    }

    public synchronized List<DeferredEntry> list() {
        if (!Files.exists(queueFile)) {
            return List.of();
        }
        try {
            List<DeferredEntry> entries = Jsons.mapper().readValue(queueFile.toFile(), ENTRY_LIST);
            return entries == null ? List.of() : List.copyOf(entries);
        } catch (IOException e) {
            throw new StateStoreException("Failed to read deferred queue: " + queueFile, e);
        }
    }

    public List<DeferredEntry> list(DeferredStatus status) {
        return list().stream().filter(entry -> entry.status() == status).toList();
    }

    public Optional<DeferredEntry> find(String id) {
        return list().stream().filter(entry -> entry.id().equals(id)).findFirst();
    }

    public List<DeferredEntry> forTask(String taskName) {
        return list().stream()
                .filter(entry -> entry.payload() != null && taskName.equals(entry.payload().task()))
                .toList();
    }

    public synchronized void append(DeferredEntry entry) {
        List<DeferredEntry> entries = new ArrayList<>(list());
        if (entries.stream().anyMatch(existing -> existing.id().equals(entry.id()))) {
            throw new IllegalStateException("Deferred entry already queued: " + entry.id());
        }
        entries.add(entry);
        write(entries);
    }

    public synchronized void update(DeferredEntry entry) {
        List<DeferredEntry> entries = new ArrayList<>(list());
        boolean replaced = false;
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).id().equals(entry.id())) {
                entries.set(i, entry);
                replaced = true;
                break;
            }
        }
        if (!replaced) {
            throw new IllegalStateException("Deferred entry not found: " + entry.id());
        }
        write(entries);
    }

    private void write(List<DeferredEntry> entries) {
        try {
            Jsons.writeAtomically(queueFile, entries);
        } catch (IOException e) {
            throw new StateStoreException("Failed to write deferred queue: " + queueFile, e);
        }
    }
}
