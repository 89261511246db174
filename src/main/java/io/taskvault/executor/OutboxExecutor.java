package io.taskvault.executor;

import io.taskvault.model.ActionPayload;
import io.taskvault.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Default handoff: writes {@code outbox/<action>/<planId>.json} for an outside worker to pick
 * up. A plan is handed off at most once; a second attempt finds the file and succeeds
 * without rewriting it.
 */
public final class OutboxExecutor implements ActionExecutor {
    public static final String ID = "outbox";

    private final Path outboxDir;

    public OutboxExecutor(Path outboxDir) {
        this.outboxDir = outboxDir;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ActionResult execute(ActionRequest request) {
        ActionPayload payload = request.payload();
        Path target = outboxDir.resolve(payload.action()).resolve(payload.planId() + ".json");
        if (Files.exists(target)) {
            return ActionResult.ok("already handed off: " + target.getFileName());
        }
        try {
            Jsons.writeAtomically(target, payload);
        } catch (IOException e) {
            throw new ActionFailureException("disk_full", "outbox write failed: " + e.getMessage(), e);
        }
        return ActionResult.ok("handed off: " + outboxDir.relativize(target));
    }
}
