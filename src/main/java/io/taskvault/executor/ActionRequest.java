package io.taskvault.executor;

import io.taskvault.model.ActionPayload;

import java.time.Duration;

public record ActionRequest(
        ActionPayload payload,
        int attempt,
        Duration timeout
) {
}
