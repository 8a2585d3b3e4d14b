package com.flagship.order_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * An account in a tenant's chart of accounts.
 * balance is a cache kept current by {@link LedgerService#postTransaction};
 * the transaction lines remain the source of truth.
 */
@Value
@Builder
public class Account {
    UUID id;
    UUID tenantId;
    String code;
    String name;
    AccountType accountType;
    AccountSubType subType;
    BigDecimal balance;

    public enum AccountType {
        ASSET,
        LIABILITY,
        EQUITY,
        INCOME,
        EXPENSE;

        /**
         * ASSET and EXPENSE grow with debits; LIABILITY, EQUITY and INCOME grow with credits.
         */
        public boolean isDebitIncrease() {
            return this == ASSET || this == EXPENSE;
        }

        public BigDecimal balanceChange(BigDecimal debit, BigDecimal credit) {
            return isDebitIncrease() ? debit.subtract(credit) : credit.subtract(debit);
        }
    }

    /**
     * Marks the asset accounts money can be paid from or into.
     */
    public enum AccountSubType {
        CASH,
        BANK
    }
}
