package io.taskvault.rules;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.taskvault.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class RuleTable {
    public static final String BUNDLED_RESOURCE = "/tables/routing-rules.json";

    private final int version;
    private final List<RoutingRule> rules;

    public RuleTable(int version, List<RoutingRule> rules) {
        Set<String> ids = new HashSet<>();
        for (RoutingRule rule : rules) {
            if (!ids.add(rule.id())) {
                throw new IllegalArgumentException("Duplicate routing rule id: " + rule.id());
            }
        }
        this.version = version;
        this.rules = List.copyOf(rules);
    }

    public static RuleTable bundled() {
        try (InputStream in = RuleTable.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Bundled routing rules missing: " + BUNDLED_RESOURCE);
            }
            return fromFile(Jsons.mapper().readValue(in, TableFile.class));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read bundled routing rules", e);
        }
    }

    public static RuleTable load(Path override) {
        if (override == null || !Files.exists(override)) {
            return bundled();
        }
        try {
            return fromFile(Jsons.mapper().readValue(override.toFile(), TableFile.class));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read routing rules: " + override, e);
        }
    }

    private static RuleTable fromFile(TableFile file) {
        return new RuleTable(file.version() == null ? 1 : file.version(), file.rules() == null ? List.of() : file.rules());
    }

    public int version() {
        return version;
    }

    /** Evaluation order: first match wins. */
    public List<RoutingRule> rules() {
        return rules;
    }

    record TableFile(
            @JsonProperty("version") Integer version,
            @JsonProperty("rules") List<RoutingRule> rules
    ) {
    }
}
