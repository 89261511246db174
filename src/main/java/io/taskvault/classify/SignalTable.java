package io.taskvault.classify;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.taskvault.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword tables behind {@link DomainClassifier}. Loaded from {@code signal-table.json};
 * a copy in the vault root overrides the bundled default.
 */
public final class SignalTable {
    public static final String BUNDLED_RESOURCE = "/tables/signal-table.json";

    private final int version;
    private final Map<String, List<KeywordMatcher>> business;
    private final Map<String, List<KeywordMatcher>> personal;
    private final Pattern monetaryPattern;
    private final List<KeywordMatcher> urgentKeywords;
    private final List<KeywordMatcher> actionVerbs;
    private final List<CategoryRow> categories;

    private SignalTable(TableFile file) {
        if (file.monetaryPattern() == null || file.monetaryPattern().isBlank()) {
            throw new IllegalArgumentException("signal table is missing monetary_pattern");
        }
        this.version = file.version() == null ? 1 : file.version();
        this.business = matchersByCategory(file.business());
        this.personal = matchersByCategory(file.personal());
        this.monetaryPattern = Pattern.compile(file.monetaryPattern(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        this.urgentKeywords = matchers(file.urgentKeywords());
        this.actionVerbs = matchers(file.actionVerbs());
        List<CategoryRow> rows = new ArrayList<>();
        if (file.categories() != null) {
            for (CategoryFile category : file.categories()) {
                rows.add(new CategoryRow(category.name(), matchers(category.keywords())));
            }
        }
        this.categories = List.copyOf(rows);
    }

    public static SignalTable bundled() {
        try (InputStream in = SignalTable.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Bundled signal table missing: " + BUNDLED_RESOURCE);
            }
            return new SignalTable(Jsons.mapper().readValue(in, TableFile.class));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read bundled signal table", e);
        }
    }

    public static SignalTable load(Path override) {
        if (override == null || !Files.exists(override)) {
            return bundled();
        }
        try {
            return new SignalTable(Jsons.mapper().readValue(override.toFile(), TableFile.class));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read signal table: " + override, e);
        }
    }

    public int version() {
        return version;
    }

    Map<String, List<KeywordMatcher>> business() {
        return business;
    }

    Map<String, List<KeywordMatcher>> personal() {
        return personal;
    }

    Pattern monetaryPattern() {
        return monetaryPattern;
    }

    List<KeywordMatcher> urgentKeywords() {
        return urgentKeywords;
    }

    List<KeywordMatcher> actionVerbs() {
        return actionVerbs;
    }

    List<CategoryRow> categories() {
        return categories;
    }

    private static Map<String, List<KeywordMatcher>> matchersByCategory(Map<String, List<String>> raw) {
        Map<String, List<KeywordMatcher>> out = new LinkedHashMap<>();
        if (raw != null) {
            raw.forEach((category, keywords) -> out.put(category, matchers(keywords)));
        }
        return out;
    }

    private static List<KeywordMatcher> matchers(List<String> keywords) {
        if (keywords == null) {
            return List.of();
        }
        return keywords.stream()
                .filter(keyword -> keyword != null && !keyword.isBlank())
                .map(KeywordMatcher::new)
                .toList();
    }

    record CategoryRow(String name, List<KeywordMatcher> keywords) {
    }

    record CategoryFile(
            @JsonProperty("name") String name,
            @JsonProperty("keywords") List<String> keywords
    ) {
    }

    record TableFile(
            @JsonProperty("version") Integer version,
            @JsonProperty("business") LinkedHashMap<String, List<String>> business,
            @JsonProperty("personal") LinkedHashMap<String, List<String>> personal,
            @JsonProperty("monetary_pattern") String monetaryPattern,
            @JsonProperty("urgent_keywords") List<String> urgentKeywords,
            @JsonProperty("action_verbs") List<String> actionVerbs,
            @JsonProperty("categories") List<CategoryFile> categories
    ) {
    }
}
