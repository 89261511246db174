package io.taskvault.classify;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case-insensitive whole-token keyword match that also accepts a plural ending: "invoice" matches
 * "two invoices" and "pay" matches "please pay now", but "pay" never matches "payroll".
 */
public final class KeywordMatcher {
    private final String keyword;
    private final Pattern pattern;

    public KeywordMatcher(String keyword) {
        this.keyword = keyword.trim().toLowerCase(Locale.ROOT);
        this.pattern = Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(this.keyword) + "(?:e?s)?(?![\\p{L}\\p{N}])");
    }

    public String keyword() {
        return keyword;
    }

    /**
     * @param lowered text already lower-cased with {@link Locale#ROOT}
     */
    public boolean matches(String lowered) {
        return pattern.matcher(lowered).find();
    }
}
