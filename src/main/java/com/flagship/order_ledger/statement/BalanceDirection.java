package com.flagship.order_ledger.statement;

import com.flagship.order_ledger.common.EntityRole;

import java.math.BigDecimal;

/**
 * Which way a statement balance points.
 *
 * OWES: a customer owes us, or we owe a supplier.
 * ADVANCE: a customer has paid ahead, or a supplier owes us.
 */
public enum BalanceDirection {
    OWES,
    ADVANCE;

    public static BalanceDirection of(BigDecimal balance) {
        return balance.signum() >= 0 ? OWES : ADVANCE;
    }

    public String label(EntityRole role) {
        if (role == EntityRole.CUSTOMER) {
            return this == OWES ? "Owes" : "Advance";
        }
        return this == OWES ? "We Owe" : "They Owe";
    }
}
