package com.simfolio.backend.service.ledger;

import com.simfolio.backend.model.LedgerTransaction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

final class LedgerOrdering {

    /** Commit order: createdAt, then id; rows without either keep their log position. */
    static final Comparator<LedgerTransaction> COMMIT_ORDER = Comparator
            .comparing(LedgerTransaction::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(LedgerTransaction::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private LedgerOrdering() {
    }

    static List<LedgerTransaction> sorted(List<LedgerTransaction> transactions) {
        List<LedgerTransaction> copy = new ArrayList<>(transactions == null ? List.of() : transactions);
        copy.sort(COMMIT_ORDER);
        return copy;
    }
}
