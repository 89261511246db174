package io.taskvault.ingest;

import io.taskvault.model.SourceTag;

import java.util.Map;

public record IncomingItem(String content, SourceTag source, Map<String, String> metadata) {
    public IncomingItem {
        if (content == null) {
            throw new IllegalArgumentException("content is required");
        }
        source = source == null ? SourceTag.INBOX : source;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static IncomingItem of(String content, SourceTag source) {
        return new IncomingItem(content, source, Map.of());
    }
}
