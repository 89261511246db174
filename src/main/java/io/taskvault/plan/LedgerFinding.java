package io.taskvault.plan;

import io.taskvault.rules.LedgerCheck;

/**
 * @param available false when the ledger could not be consulted and a human must verify
 */
public record LedgerFinding(LedgerCheck check, boolean available, String summary) {
}
