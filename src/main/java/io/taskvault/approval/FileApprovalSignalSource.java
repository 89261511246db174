package io.taskvault.approval;

import io.taskvault.config.TaskVaultConfig;
import io.taskvault.model.ApprovalRequest;
import io.taskvault.model.ApprovalStatus;
import io.taskvault.storage.StateStoreException;
import io.taskvault.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads decisions from the approval pools. A request counts as decided when either of its
 * files ({@code <id>.md} or {@code <id>.md.meta.json}) sits in {@code approved/} or
 * {@code rejected/}, or when a human edits {@code status} in the pending sidecar.
 * Rejection wins when the files disagree.
 */
public final class FileApprovalSignalSource implements ApprovalSignalSource {
    static final String MARKDOWN_SUFFIX = ".md";
    static final String SIDECAR_SUFFIX = ".md.meta.json";

    private final TaskVaultConfig config;

    public FileApprovalSignalSource(TaskVaultConfig config) {
        this.config = config;
    }

    @Override
    public List<ApprovalRequest> observe() {
        Map<String, ApprovalRequest> requests = new LinkedHashMap<>();
        for (ApprovalStatus pool : ApprovalStatus.values()) {
            for (Path sidecar : files(config.approvalPool(pool), "*" + SIDECAR_SUFFIX)) {
                ApprovalRequest request = read(sidecar);
                requests.putIfAbsent(request.id(), request);
            }
        }
        List<ApprovalRequest> observed = new ArrayList<>();
        for (ApprovalRequest request : requests.values()) {
            observed.add(request.observedAs(statusOf(request)));
        }
        observed.sort(Comparator.comparing(ApprovalRequest::createdAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
                .thenComparing(ApprovalRequest::id));
        return observed;
    }

    @Override
    public Optional<ApprovalRequest> find(String id) {
        for (ApprovalStatus pool : ApprovalStatus.values()) {
            Path sidecar = config.approvalPool(pool).resolve(id + SIDECAR_SUFFIX);
            if (Files.exists(sidecar)) {
                ApprovalRequest request = read(sidecar);
                return Optional.of(request.observedAs(statusOf(request)));
            }
        }
        return Optional.empty();
    }

    @Override
    public void publish(ApprovalRequest request, String markdown) {
        Path pending = config.approvalPool(ApprovalStatus.PENDING);
        try {
            Files.createDirectories(pending);
            Jsons.writeStringAtomically(pending.resolve(request.id() + MARKDOWN_SUFFIX), markdown);
            Jsons.writeAtomically(pending.resolve(request.id() + SIDECAR_SUFFIX), request);
        } catch (IOException e) {
            throw new StateStoreException("Failed to write approval request: " + request.id(), e);
        }
    }

    private ApprovalStatus statusOf(ApprovalRequest request) {
        if (inPool(ApprovalStatus.REJECTED, request.id())) {
            return ApprovalStatus.REJECTED;
        }
        if (inPool(ApprovalStatus.APPROVED, request.id())) {
            return ApprovalStatus.APPROVED;
        }
        Path pendingSidecar = config.approvalPool(ApprovalStatus.PENDING).resolve(request.id() + SIDECAR_SUFFIX);
        if (Files.exists(pendingSidecar)) {
            return read(pendingSidecar).status();
        }
        return ApprovalStatus.PENDING;
    }

    private boolean inPool(ApprovalStatus pool, String id) {
        Path dir = config.approvalPool(pool);
        return Files.exists(dir.resolve(id + MARKDOWN_SUFFIX)) || Files.exists(dir.resolve(id + SIDECAR_SUFFIX));
    }

    private static ApprovalRequest read(Path sidecar) {
        try {
            return Jsons.mapper().readValue(Files.readString(sidecar, StandardCharsets.UTF_8), ApprovalRequest.class);
        } catch (IOException e) {
            throw new StateStoreException("Failed to read approval sidecar: " + sidecar, e);
        }
    }

    private static List<Path> files(Path dir, String glob) {
        List<Path> out = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return out;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, glob)) {
            stream.forEach(out::add);
        } catch (IOException e) {
            throw new StateStoreException("Failed to list approvals: " + dir, e);
        }
        out.sort(Path::compareTo);
        return out;
    }
}
