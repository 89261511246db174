package io.taskvault.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskvault.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrubs audit parameters before they are persisted. Credentials are replaced outright;
 * long digit runs (account and card numbers) keep only their last four digits.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "api_key", "apikey", "credential",
            "iban", "account_number", "card_number", "pin"
    );
    private static final Pattern ACCOUNT_NUMBER = Pattern.compile("(?<!\\d)\\d{4}[ -]?\\d{4}[ -]?\\d{4}(?:[ -]?\\d{1,7})?(?!\\d)");

    private SensitiveDataMasker() {
    }

    public static Map<String, Object> masked(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode tree = Jsons.mapper().valueToTree(input);
        JsonNode masked = masked(tree);
        @SuppressWarnings("unchecked")
        Map<String, Object> out = Jsons.mapper().convertValue(masked, Map.class);
        return out;
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (isSensitiveKey(entry.getKey())) {
                    out.put(entry.getKey(), MASK);
                } else {
                    out.set(entry.getKey(), masked(entry.getValue()));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual()) {
            String text = input.asText("");
            if (likelySecretValue(text)) {
                return Jsons.mapper().valueToTree(MASK);
            }
            return Jsons.mapper().valueToTree(maskAccountNumbers(text));
        }
        return input;
    }

    public static String maskAccountNumbers(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        Matcher matcher = ACCOUNT_NUMBER.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String digits = matcher.group().replaceAll("[ -]", "");
            matcher.appendReplacement(out, Matcher.quoteReplacement(MASK + digits.substring(digits.length() - 4)));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.equals(hint) || key.endsWith("_" + hint) || key.startsWith(hint + "_")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Long opaque tokens with mixed case and digits. Lower-case hex digests (dedup keys,
     * hash chain values) do not match.
     */
    private static boolean likelySecretValue(String value) {
        String v = value.trim();
        if (v.length() < 24 || !v.matches("^[A-Za-z0-9+/=\\-]{24,}$")) {
            return false;
        }
        boolean upper = false;
        boolean lower = false;
        boolean digit = false;
        for (char c : v.toCharArray()) {
            upper |= Character.isUpperCase(c);
            lower |= Character.isLowerCase(c);
            digit |= Character.isDigit(c);
        }
        return upper && lower && digit;
    }
}
