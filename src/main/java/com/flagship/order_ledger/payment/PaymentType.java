package com.flagship.order_ledger.payment;

/**
 * Direction of a payment.
 */
public enum PaymentType {
    /** Money received from a customer against AR. */
    CUSTOMER_PAYMENT,

    /** Money paid to a supplier against AP. */
    SUPPLIER_PAYMENT,

    /** Money returned to a customer. */
    REFUND
}
