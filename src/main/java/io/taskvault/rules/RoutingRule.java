package io.taskvault.rules;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.taskvault.classify.Classification;
import io.taskvault.classify.KeywordMatcher;
import io.taskvault.model.Domain;
import io.taskvault.model.Priority;
import io.taskvault.model.SourceTag;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One row of the routing table. Every condition present in {@code when} must hold; absent
 * conditions are ignored.
 */
public record RoutingRule(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("when") Trigger when,
        @JsonProperty("then") Effect then
) {
    public RoutingRule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("routing rule id is required");
        }
        when = when == null ? new Trigger(null, null, null, null, null, null, null) : when;
        then = then == null ? new Effect(null, null, null, null, null) : then;
    }

    public String label() {
        return name == null || name.isBlank() ? id : id + " " + name;
    }

    boolean matches(Classification classification, SourceTag source, Map<String, String> metadata, String loweredContent) {
        if (when.sources() != null && !when.sources().contains(source)) {
            return false;
        }
        if (when.domains() != null && !when.domains().contains(classification.domain())) {
            return false;
        }
        if (when.monetary() != null && when.monetary() != classification.monetary()) {
            return false;
        }
        if (when.urgent() != null && when.urgent() != classification.urgent()) {
            return false;
        }
        if (when.businessCategories() != null
                && when.businessCategories().stream().noneMatch(classification::hasBusinessCategory)) {
            return false;
        }
        if (when.personalAny() != null && when.personalAny() != classification.hasPersonalSignal()) {
            return false;
        }
        if (when.keywordsAny() != null) {
            String subject = metadata == null ? null : metadata.get("subject");
            String text = subject == null ? loweredContent : subject.toLowerCase(Locale.ROOT) + "\n" + loweredContent;
            return when.keywordsAny().stream().map(KeywordMatcher::new).anyMatch(matcher -> matcher.matches(text));
        }
        return true;
    }

    public record Trigger(
            @JsonProperty("sources") List<SourceTag> sources,
            @JsonProperty("domains") List<Domain> domains,
            @JsonProperty("monetary") Boolean monetary,
            @JsonProperty("urgent") Boolean urgent,
            @JsonProperty("business_categories") List<String> businessCategories,
            @JsonProperty("personal_any") Boolean personalAny,
            @JsonProperty("keywords_any") List<String> keywordsAny
    ) {
    }

    public record Effect(
            @JsonProperty("domain") Domain domain,
            @JsonProperty("priority") Priority priority,
            @JsonProperty("require_approval") Boolean requireApproval,
            @JsonProperty("ledger_checks") List<LedgerCheck> ledgerChecks,
            @JsonProperty("split") Boolean split
    ) {
    }
}
