package com.flagship.order_ledger.invoice;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_ledger.common.Amounts;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Net position of a customer or supplier.
 *
 * A negative pending is an overpayment held as credit; it is exposed as
 * availableAdvance so callers never have to negate it themselves.
 */
@Value
public class BalanceSnapshot {

    @JsonProperty("pending")
    BigDecimal pending;

    @JsonProperty("available_advance")
    BigDecimal availableAdvance;

    public static BalanceSnapshot fromNetBalance(BigDecimal netBalance) {
        BigDecimal pending = Amounts.normalize(netBalance);
        return new BalanceSnapshot(pending, Amounts.maxZero(pending.negate()));
    }
}
