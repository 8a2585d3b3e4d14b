package com.flagship.order_ledger.common;

/**
 * Which side of the business a counterparty sits on.
 *
 * The sign of a balance means different things per role: for a customer a
 * positive balance is accounts receivable, for a supplier it is accounts payable.
 */
public enum EntityRole {
    CUSTOMER,
    SUPPLIER
}
