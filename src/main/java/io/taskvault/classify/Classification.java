package io.taskvault.classify;

import io.taskvault.model.Domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of classifying one task. {@code businessSignals} and {@code personalSignals} map each
 * matched signal category to the keywords that hit, in table order.
 */
public record Classification(
        Domain domain,
        boolean sensitive,
        boolean monetary,
        boolean urgent,
        boolean actionVerb,
        String category,
        Map<String, List<String>> businessSignals,
        Map<String, List<String>> personalSignals,
        int tableVersion
) {
    public Classification {
        businessSignals = Collections.unmodifiableMap(new LinkedHashMap<>(businessSignals));
        personalSignals = Collections.unmodifiableMap(new LinkedHashMap<>(personalSignals));
    }

    public boolean hasBusinessCategory(String signalCategory) {
        return businessSignals.containsKey(signalCategory);
    }

    public boolean hasPersonalSignal() {
        return !personalSignals.isEmpty();
    }

    public int businessHits() {
        return businessSignals.values().stream().mapToInt(List::size).sum();
    }

    public int personalHits() {
        return personalSignals.values().stream().mapToInt(List::size).sum();
    }
}
