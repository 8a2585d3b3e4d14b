package com.flagship.order_ledger.fee;

public enum FeeMode {
    /** value * percentage / 100 */
    PERCENTAGE,
    /** flat amount, whatever the value */
    FIXED,
    /** first rule whose [min, max] contains the value */
    RANGE_BASED
}
