package io.pairledger.storage;

import io.pairledger.model.Ledger;

import java.nio.file.Path;
import java.util.Optional;

public interface LedgerStore {
    /**
     * Returns an empty ledger when nothing has been stored yet, and
     * {@link Optional#empty()} when stored content exists but cannot be
     * understood. Callers must not overwrite content they could not read.
     */
    Optional<Ledger> read();

    boolean write(Ledger ledger);

    boolean exists();

    Path location();
}
