package io.taskvault.plan;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Simple text statistics recorded in plan notes.
 */
public record TaskAnalysis(int words, int lines, List<String> keyPhrases) {
    private static final int KEY_PHRASE_LIMIT = 5;
    private static final Set<String> STOP_WORDS = Set.of(
            "this", "that", "with", "from", "have", "will", "your", "about", "please", "there", "their",
            "would", "could", "should", "what", "when", "which", "were", "been", "into", "them", "then", "than"
    );

    public static TaskAnalysis of(String content) {
        String text = content == null ? "" : content.strip();
        if (text.isEmpty()) {
            return new TaskAnalysis(0, 0, List.of());
        }
        String[] tokens = text.split("\\s+");
        int lines = text.split("\\R").length;
        Map<String, Integer> counts = new TreeMap<>();
        for (String token : tokens) {
            String word = token.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]", "");
            if (word.length() >= 4 && !STOP_WORDS.contains(word)) {
                counts.merge(word, 1, Integer::sum);
            }
        }
        List<String> keyPhrases = counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.<String, Integer>comparingByKey()))
                .limit(KEY_PHRASE_LIMIT)
                .map(Map.Entry::getKey)
                .toList();
        return new TaskAnalysis(tokens.length, lines, keyPhrases);
    }
}
