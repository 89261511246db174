package io.taskvault.plan;

import io.taskvault.rules.LedgerCheck;

import java.util.Map;

/**
 * Read-only lookups against outside records (invoice ledger, bank balance, contact history).
 * Implementations must not change anything on the other side.
 */
public interface LedgerClient {
    LedgerFinding check(LedgerCheck check, LedgerQuery query);

    record LedgerQuery(String taskName, String content, Map<String, String> metadata) {
    }
}
