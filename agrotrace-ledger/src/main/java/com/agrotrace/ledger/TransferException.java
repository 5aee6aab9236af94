package com.agrotrace.ledger;

/**
 * Thrown when a ledger refuses a transfer. Nothing has moved when this is thrown.
 */
public class TransferException extends Exception {

    private final TransferError error;

    public TransferException(TransferError error, String message) {
        super(message);
        this.error = error;
    }

    public TransferError getError() {
        return error;
    }
}
