package io.taskvault.ingest;

import io.taskvault.model.SourceTag;
import io.taskvault.util.Hashing;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public final class TaskNames {
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);

    private TaskNames() {
    }

    public static String dedupKey(SourceTag source, String content) {
        return source.wireName() + ":" + Hashing.sha256Hex(normalize(content));
    }

    public static String fresh(SourceTag source, String dedupKey, Instant now) {
        String hash = dedupKey.substring(dedupKey.indexOf(':') + 1);
        return source.wireName().toUpperCase(Locale.ROOT).replace('-', '_')
                + "_" + STAMP.format(now)
                + "_" + hash.substring(0, Math.min(8, hash.length()));
    }

    /**
     * Follow-up name for a requeued task; the retry number keeps it distinct from its predecessor.
     */
    public static String requeued(String originalName, int retryCount) {
        String base = originalName.replaceFirst("_R\\d+$", "");
        return base + "_R" + retryCount;
    }

    static String normalize(String content) {
        return content.replace("\r\n", "\n").strip();
    }
}
