package org.carma.influence.ledger;

import java.io.UncheckedIOException;
import java.io.IOException;

/**
 * A computed row could not be persisted. Fatal for the sweep: rows already written
 * stay intact, and no later row is accepted by the same writer.
 */
public class LedgerWriteException extends UncheckedIOException {

    public LedgerWriteException(String message, IOException cause) {
        super(message, cause);
    }
}
