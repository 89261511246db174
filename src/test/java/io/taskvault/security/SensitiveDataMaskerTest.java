package io.taskvault.security;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class SensitiveDataMaskerTest {

    @Test
    void masksCredentialKeysAtAnyDepth() {
        Map<String, Object> masked = SensitiveDataMasker.masked(Map.of(
                "password", "hunter2",
                "nested", Map.of("smtp_secret", "s", "host", "mail.example.test"),
                "list", List.of(Map.of("token", "t"))
        ));

        Assertions.assertEquals("***", masked.get("password"));
        Assertions.assertEquals(Map.of("smtp_secret", "***", "host", "mail.example.test"), masked.get("nested"));
        Assertions.assertEquals(List.of(Map.of("token", "***")), masked.get("list"));
    }

    @Test
    void keysThatOnlyContainAHintAreKept() {
        Map<String, Object> masked = SensitiveDataMasker.masked(Map.of("shipping", "standard", "spinner", "on"));

        Assertions.assertEquals("standard", masked.get("shipping"));
        Assertions.assertEquals("on", masked.get("spinner"));
    }

    @Test
    void accountNumbersKeepLastFourDigits() {
        Assertions.assertEquals("pay ***7890 today", SensitiveDataMasker.maskAccountNumbers("pay 1234-5678-1234-567890 today"));
        Assertions.assertEquals("invoice 42 for $500", SensitiveDataMasker.maskAccountNumbers("invoice 42 for $500"));
        Assertions.assertNull(SensitiveDataMasker.maskAccountNumbers(null));
    }

    @Test
    void opaqueTokensAreMaskedButIdentifiersAreNot() {
        Map<String, Object> masked = SensitiveDataMasker.masked(Map.of(
                "value", "AbCdEfGh1234IjKlMnOp5678",
                "task", "BUSINESS_MESSAGING_20261019T100000_ab12cd34",
                "dedup_key", "inbox:9f86d081884c7d659a2feaa0c55ad015a3bf4f1b2b0b822cd15d6c15b0f00a08"
        ));

        Assertions.assertEquals("***", masked.get("value"));
        Assertions.assertEquals("BUSINESS_MESSAGING_20261019T100000_ab12cd34", masked.get("task"));
        Assertions.assertTrue(((String) masked.get("dedup_key")).startsWith("inbox:9f86"));
    }
}
