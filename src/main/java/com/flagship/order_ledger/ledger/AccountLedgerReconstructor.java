package com.flagship.order_ledger.ledger;

import com.flagship.order_ledger.common.Amounts;
import com.flagship.order_ledger.common.DocumentNumbers;
import com.flagship.order_ledger.ledger.Account.AccountType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Rebuilds the running balance of a single account from its transaction lines.
 *
 * Lines are ordered by (date, transactionNumber) and walked oldest first:
 * balance += debit - credit for ASSET and EXPENSE accounts,
 * balance += credit - debit for the others.
 * Lines sharing both keys keep their input order.
 */
@Component
public class AccountLedgerReconstructor {

    static final Comparator<AccountPosting> CHRONOLOGICAL = Comparator
        .comparing(AccountPosting::getDate)
        .thenComparing(AccountPosting::getTransactionNumber, Comparator.nullsFirst(DocumentNumbers.SEQUENCE_ORDER));

    /**
     * @return entries oldest first, each carrying the balance after that line
     */
    public List<AccountLedgerEntry> computeAccountLedger(List<AccountPosting> postings, AccountType accountType) {
        if (accountType == null) {
            throw new IllegalArgumentException("Account type is required");
        }
        List<AccountPosting> sorted = new ArrayList<>(postings);
        sorted.sort(CHRONOLOGICAL);

        List<AccountLedgerEntry> entries = new ArrayList<>(sorted.size());
        BigDecimal balance = Amounts.normalize(BigDecimal.ZERO);
        for (AccountPosting posting : sorted) {
            BigDecimal debit = Amounts.normalize(posting.getDebitAmount());
            BigDecimal credit = Amounts.normalize(posting.getCreditAmount());
            balance = balance.add(accountType.balanceChange(debit, credit));
            entries.add(AccountLedgerEntry.builder()
                .transactionId(posting.getTransactionId())
                .transactionNumber(posting.getTransactionNumber())
                .date(posting.getDate())
                .description(posting.getDescription())
                .debit(debit)
                .credit(credit)
                .balance(balance)
                .build());
        }
        return entries;
    }

    /**
     * Display order. The balances are the ones fixed by the forward pass.
     */
    public List<AccountLedgerEntry> mostRecentFirst(List<AccountLedgerEntry> entries) {
        List<AccountLedgerEntry> reversed = new ArrayList<>(entries);
        Collections.reverse(reversed);
        return reversed;
    }

    public BigDecimal closingBalance(List<AccountLedgerEntry> chronological) {
        if (chronological.isEmpty()) {
            return Amounts.normalize(BigDecimal.ZERO);
        }
        return chronological.get(chronological.size() - 1).getBalance();
    }

    public ReconciliationResult reconcile(Account account, List<AccountPosting> postings, BigDecimal tolerance) {
        BigDecimal computed = closingBalance(computeAccountLedger(postings, account.getAccountType()));
        BigDecimal stored = Amounts.normalize(account.getBalance());
        BigDecimal difference = stored.subtract(computed);
        return new ReconciliationResult(
            account.getId(),
            stored,
            computed,
            difference,
            difference.abs().compareTo(tolerance) <= 0
        );
    }
}
