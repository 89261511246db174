package io.taskvault.ingest;

import com.fasterxml.jackson.core.type.TypeReference;
import io.taskvault.config.TaskVaultConfig;
import io.taskvault.model.SourceTag;
import io.taskvault.observability.AuditActions;
import io.taskvault.observability.AuditEvent;
import io.taskvault.observability.AuditLog;
import io.taskvault.storage.StateStoreException;
import io.taskvault.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks up files dropped into {@code inbox/}. An optional {@code <file>.meta.json} next to a
 * file supplies {@code source}, {@code subject} and {@code sender}. Consumed files move to
 * {@code inbox/.consumed/} whether admitted or skipped as duplicates.
 */
public final class InboxScanner {
    private static final Logger log = LoggerFactory.getLogger(InboxScanner.class);
    private static final String META_SUFFIX = ".meta.json";

    private final TaskVaultConfig config;
    private final Ingestor ingestor;
    private final AuditLog audit;

    public InboxScanner(TaskVaultConfig config, Ingestor ingestor, AuditLog audit) {
        this.config = config;
        this.ingestor = ingestor;
        this.audit = audit;
    }

    public List<AdmitOutcome> scan() {
        List<AdmitOutcome> outcomes = new ArrayList<>();
        for (Path file : pendingFiles()) {
            Path metaFile = file.resolveSibling(file.getFileName() + META_SUFFIX);
            Map<String, String> metadata = readMetadata(metaFile);
            String content = read(file);
            SourceTag source = SourceTag.fromString(metadata.remove("source"));
            metadata.putIfAbsent("inbox_file", file.getFileName().toString());
            AdmitOutcome outcome = ingestor.admit(new IncomingItem(content, source, metadata));
            consume(file);
            if (Files.exists(metaFile)) {
                consume(metaFile);
            }
            audit.log(AuditEvent.success(AuditActions.INBOX_CONSUMED, "inbox_scanner", file.getFileName().toString(),
                    Map.of("accepted", outcome.accepted(), "task", outcome.taskName())));
            outcomes.add(outcome);
        }
        return outcomes;
    }

    private List<Path> pendingFiles() {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(config.inboxDir())) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(config.inboxDir())) {
            for (Path path : stream) {
                String fileName = path.getFileName().toString();
                if (Files.isRegularFile(path) && !fileName.startsWith(".") && !fileName.endsWith(META_SUFFIX)
                        && !fileName.endsWith(".tmp")) {
                    files.add(path);
                }
            }
        } catch (IOException e) {
            throw new StateStoreException("Failed to scan inbox: " + config.inboxDir(), e);
        }
        files.sort(Path::compareTo);
        return files;
    }

    private Map<String, String> readMetadata(Path metaFile) {
        if (!Files.exists(metaFile)) {
            return new HashMap<>();
        }
        try {
            Map<String, String> raw = Jsons.mapper().readValue(metaFile.toFile(), new TypeReference<Map<String, String>>() {
            });
            return raw == null ? new HashMap<>() : new HashMap<>(raw);
        } catch (IOException e) {
            log.warn("Ignoring unreadable inbox metadata {}: {}", metaFile, e.getMessage());
            return new HashMap<>();
        }
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StateStoreException("Failed to read inbox file: " + file, e);
        }
    }

    private void consume(Path file) {
        try {
            Files.createDirectories(config.consumedInboxDir());
            Files.move(file, config.consumedInboxDir().resolve(file.getFileName()), StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StateStoreException("Failed to move consumed inbox file: " + file, e);
        }
    }
}
