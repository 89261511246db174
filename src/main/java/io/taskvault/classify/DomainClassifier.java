package io.taskvault.classify;

import io.taskvault.model.Domain;
import io.taskvault.model.SourceTag;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Pure keyword classifier. The same content, source and metadata always yield an equal
 * {@link Classification}.
 */
public final class DomainClassifier {
    public static final String DEFAULT_CATEGORY = "general";
    private static final Set<String> SENSITIVE_CATEGORIES = Set.of("payment", "external-communication");

    private final SignalTable table;

    public DomainClassifier(SignalTable table) {
        this.table = table;
    }

    public Classification classify(String content, SourceTag source, Map<String, String> metadata) {
        String text = scanText(content, metadata);
        String lowered = text.toLowerCase(Locale.ROOT);

        Map<String, List<String>> businessSignals = signals(table.business(), lowered);
        Map<String, List<String>> personalSignals = signals(table.personal(), lowered);
        Domain domain = decide(!businessSignals.isEmpty(), !personalSignals.isEmpty());

        boolean monetary = table.monetaryPattern().matcher(text).find();
        boolean urgent = anyMatch(table.urgentKeywords(), lowered);
        boolean actionVerb = anyMatch(table.actionVerbs(), lowered);
        String category = category(lowered);

        boolean sensitive = SENSITIVE_CATEGORIES.contains(category)
                || (source != null && source.isExternal())
                || actionVerb
                || monetary;
        return new Classification(domain, sensitive, monetary, urgent, actionVerb, category,
                businessSignals, personalSignals, table.version());
    }

    static Domain decide(boolean business, boolean personal) {
        if (business && personal) {
            return Domain.BOTH;
        }
        if (business) {
            return Domain.BUSINESS;
        }
        return Domain.PERSONAL;
    }

    private String category(String lowered) {
        for (SignalTable.CategoryRow row : table.categories()) {
            if (anyMatch(row.keywords(), lowered)) {
                return row.name();
            }
        }
        return DEFAULT_CATEGORY;
    }

    private static Map<String, List<String>> signals(Map<String, List<KeywordMatcher>> categories, String lowered) {
        Map<String, List<String>> hits = new LinkedHashMap<>();
        categories.forEach((category, matchers) -> {
            List<String> matched = new ArrayList<>();
            for (KeywordMatcher matcher : matchers) {
                if (matcher.matches(lowered)) {
                    matched.add(matcher.keyword());
                }
            }
            if (!matched.isEmpty()) {
                hits.put(category, List.copyOf(matched));
            }
        });
        return hits;
    }

    private static boolean anyMatch(List<KeywordMatcher> matchers, String lowered) {
        for (KeywordMatcher matcher : matchers) {
            if (matcher.matches(lowered)) {
                return true;
            }
        }
        return false;
    }

    private static String scanText(String content, Map<String, String> metadata) {
        String body = content == null ? "" : content;
        if (metadata == null) {
            return body;
        }
        String subject = metadata.get("subject");
        return subject == null || subject.isBlank() ? body : subject + "\n" + body;
    }
}
