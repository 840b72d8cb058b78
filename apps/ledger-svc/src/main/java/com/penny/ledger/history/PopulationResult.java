package com.penny.ledger.history;

import com.penny.ledger.store.TransactionConflict;

/**
 * Outcome of a reconstruction pass. A skipped pass made no changes and should be retried on the
 * next start or rebuild.
 */
public record PopulationResult(Outcome outcome, int snapshotsWritten, TransactionConflict conflict) {

    public enum Outcome {
        COMPLETED,
        SKIPPED_CONFLICT,
        FAILED_CONTINUED
    }

    public static PopulationResult completed(int snapshotsWritten) {
        return new PopulationResult(Outcome.COMPLETED, snapshotsWritten, null);
    }

    public static PopulationResult skipped(TransactionConflict conflict) {
        return new PopulationResult(Outcome.SKIPPED_CONFLICT, 0, conflict);
    }

    public static PopulationResult failedAndContinued() {
        return new PopulationResult(Outcome.FAILED_CONTINUED, 0, null);
    }
}
