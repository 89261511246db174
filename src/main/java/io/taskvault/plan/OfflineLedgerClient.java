package io.taskvault.plan;

import io.taskvault.rules.LedgerCheck;

/**
 * Used when no ledger integration is configured. Every check is reported as unavailable so the
 * plan tells the reviewer to verify by hand.
 */
public final class OfflineLedgerClient implements LedgerClient {
    @Override
    public LedgerFinding check(LedgerCheck check, LedgerQuery query) {
        String subject = switch (check) {
            case INVOICE -> "invoice ledger";
            case BANK_BALANCE -> "bank balance";
            case CONTACT_HISTORY -> "contact history";
        };
        return new LedgerFinding(check, false, "No ledger configured; verify " + subject + " manually");
    }
}
