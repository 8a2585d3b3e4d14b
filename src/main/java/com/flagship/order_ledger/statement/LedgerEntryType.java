package com.flagship.order_ledger.statement;

/**
 * Kinds of entries on a customer or supplier statement.
 * Declaration order is the tiebreak for entries on the same date.
 */
public enum LedgerEntryType {
    OPENING_BALANCE,
    ORDER,
    PURCHASE_INVOICE,
    PAYMENT,
    RETURN,
    REFUND
}
