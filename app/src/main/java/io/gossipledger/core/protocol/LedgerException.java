package io.gossipledger.core.protocol;

/** Unchecked failure that carries the ledger rule it broke. */
public class LedgerException extends IllegalArgumentException {
    private final ValidationError error;

    public LedgerException(ValidationError error, String message) {
        super(message);
        this.error = error;
    }

    public ValidationError error() {
        return error;
    }
}
