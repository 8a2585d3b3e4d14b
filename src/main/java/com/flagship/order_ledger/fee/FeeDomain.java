package com.flagship.order_ledger.fee;

/**
 * What a fee rule set prices. Decides the fallback when no range matches.
 */
public enum FeeDomain {
    /** Cash-on-delivery handling fee, keyed by the COD amount. */
    COD,
    /** Quantity pricing, keyed by unit count. The first unit is never charged by the default. */
    QUANTITY
}
