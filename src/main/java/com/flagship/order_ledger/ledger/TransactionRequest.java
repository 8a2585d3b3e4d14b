package com.flagship.order_ledger.ledger;

import com.flagship.order_ledger.common.Amounts;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Request object for posting a transaction.
 * Each line carries either a debit or a credit amount.
 *
 * Invariant: Sum of debits must equal sum of credits (within the ledger tolerance).
 */
@Value
public class TransactionRequest {
    LocalDate date;
    String description;
    List<Line> lines;

    public boolean isBalanced(BigDecimal tolerance) {
        return Amounts.equalsWithin(getDebitTotal(), getCreditTotal(), tolerance);
    }

    public BigDecimal getDebitTotal() {
        return lines.stream()
            .map(Line::getDebitAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getCreditTotal() {
        return lines.stream()
            .map(Line::getCreditAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * A single debit or credit against one account.
     */
    @Value
    public static class Line {
        UUID accountId;
        BigDecimal debitAmount;
        BigDecimal creditAmount;

        private Line(UUID accountId, BigDecimal debitAmount, BigDecimal creditAmount) {
            this.accountId = Objects.requireNonNull(accountId, "Account ID is required");
            this.debitAmount = Amounts.normalize(debitAmount);
            this.creditAmount = Amounts.normalize(creditAmount);
            if (this.debitAmount.signum() < 0 || this.creditAmount.signum() < 0) {
                throw new IllegalArgumentException("Line amounts cannot be negative");
            }
            if (this.debitAmount.signum() > 0 == this.creditAmount.signum() > 0) {
                throw new IllegalArgumentException("A line must carry either a debit or a credit amount");
            }
        }

        public static Line debit(UUID accountId, BigDecimal amount) {
            return new Line(accountId, amount, BigDecimal.ZERO);
        }

        public static Line credit(UUID accountId, BigDecimal amount) {
            return new Line(accountId, BigDecimal.ZERO, amount);
        }
    }
}
