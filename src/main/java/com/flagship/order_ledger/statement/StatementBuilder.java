package com.flagship.order_ledger.statement;

import com.flagship.order_ledger.common.Amounts;
import com.flagship.order_ledger.common.DocumentNumbers;
import com.flagship.order_ledger.common.EntityRole;
import com.flagship.order_ledger.invoice.BalanceSnapshot;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Merges opening balance, invoices, payments, returns and refunds into one
 * statement with a running balance.
 *
 * Customer (balance = what the customer owes us, i.e. AR):
 *   ORDER, positive OPENING_BALANCE        -> debit, balance up
 *   PAYMENT, RETURN, REFUND                -> credit, balance down
 * Supplier (balance = what we owe the supplier, i.e. AP):
 *   PURCHASE_INVOICE, positive OPENING_BALANCE -> credit, balance up
 *   PAYMENT, RETURN                            -> debit, balance down
 *   REFUND (money the supplier sends back)     -> credit, balance up
 * A negative opening balance goes in the opposite column.
 *
 * Entries are ordered by date, then entry type, then reference, walked
 * oldest first, and returned most recent first.
 */
@Component
public class StatementBuilder {

    static final Comparator<StatementSourceEntry> CHRONOLOGICAL = Comparator
        .comparing(StatementSourceEntry::getDate)
        .thenComparing(StatementSourceEntry::getType)
        .thenComparing(StatementSourceEntry::getReference, Comparator.nullsFirst(DocumentNumbers.SEQUENCE_ORDER));

    public Statement buildStatement(List<StatementSourceEntry> entries, EntityRole role) {
        if (role == null) {
            throw new IllegalArgumentException("Entity role is required");
        }
        List<StatementSourceEntry> sorted = new ArrayList<>(entries);
        sorted.sort(CHRONOLOGICAL);

        List<StatementLine> lines = new ArrayList<>(sorted.size());
        BigDecimal balance = Amounts.normalize(BigDecimal.ZERO);
        BigDecimal totalDebit = Amounts.normalize(BigDecimal.ZERO);
        BigDecimal totalCredit = Amounts.normalize(BigDecimal.ZERO);

        for (StatementSourceEntry entry : sorted) {
            BigDecimal amount = Amounts.normalize(entry.getAmount());
            if (entry.getType() != LedgerEntryType.OPENING_BALANCE && amount.signum() < 0) {
                throw new IllegalArgumentException(
                    "Amount of " + entry.getType() + " " + entry.getReference() + " cannot be negative");
            }
            boolean debit = isDebit(entry.getType(), amount, role);
            BigDecimal magnitude = amount.abs();
            BigDecimal debitAmount = debit ? magnitude : Amounts.normalize(BigDecimal.ZERO);
            BigDecimal creditAmount = debit ? Amounts.normalize(BigDecimal.ZERO) : magnitude;

            balance = role == EntityRole.CUSTOMER
                ? balance.add(debitAmount).subtract(creditAmount)
                : balance.add(creditAmount).subtract(debitAmount);
            totalDebit = totalDebit.add(debitAmount);
            totalCredit = totalCredit.add(creditAmount);

            BalanceDirection direction = BalanceDirection.of(balance);
            lines.add(StatementLine.builder()
                .date(entry.getDate())
                .type(entry.getType())
                .reference(entry.getReference())
                .description(entry.getDescription())
                .debit(debitAmount)
                .credit(creditAmount)
                .balance(balance)
                .direction(direction)
                .balanceLabel(direction.label(role))
                .build());
        }

        Collections.reverse(lines);
        BalanceDirection closingDirection = BalanceDirection.of(balance);
        return Statement.builder()
            .entityRole(role)
            .lines(lines)
            .totalDebit(totalDebit)
            .totalCredit(totalCredit)
            .closingBalance(balance)
            .closingDirection(closingDirection)
            .closingLabel(closingDirection.label(role))
            .balance(BalanceSnapshot.fromNetBalance(balance))
            .build();
    }

    private static boolean isDebit(LedgerEntryType type, BigDecimal amount, EntityRole role) {
        switch (type) {
            case OPENING_BALANCE:
                // a positive opening balance sits where the role's invoices sit
                return (role == EntityRole.CUSTOMER) == (amount.signum() >= 0);
            case ORDER:
                requireRole(type, role, EntityRole.CUSTOMER);
                return true;
            case PURCHASE_INVOICE:
                requireRole(type, role, EntityRole.SUPPLIER);
                return false;
            case PAYMENT:
            case RETURN:
                return role == EntityRole.SUPPLIER;
            case REFUND:
                return false;
            default:
                throw new IllegalArgumentException("Unsupported entry type: " + type);
        }
    }

    private static void requireRole(LedgerEntryType type, EntityRole actual, EntityRole expected) {
        if (actual != expected) {
            throw new IllegalArgumentException(type + " entries belong on a " + expected.name().toLowerCase() + " statement");
        }
    }
}
