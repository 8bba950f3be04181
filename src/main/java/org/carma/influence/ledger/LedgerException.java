package org.carma.influence.ledger;

import java.io.IOException;

/**
 * The ledger file exists but cannot be used: unreadable, or its header lacks the
 * grid point key columns.
 */
public class LedgerException extends IOException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
