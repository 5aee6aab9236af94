package com.agrotrace.ledger;

import com.agrotrace.core.result.ErrorCategory;
import com.agrotrace.core.result.ErrorCode;

/**
 * Reasons a value transfer is refused. Propagated unchanged to the caller of the operation
 * that attempted the transfer.
 */
public enum TransferError implements ErrorCode {
    INSUFFICIENT_BALANCE(1),
    SAME_ACCOUNT(2),
    NON_POSITIVE_AMOUNT(3),
    UNKNOWN_ACCOUNT(4);

    private final int code;

    TransferError(int code) {
        this.code = code;
    }

    @Override
    public int code() {
        return code;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.TRANSFER;
    }
}
