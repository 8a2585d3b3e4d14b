package com.flagship.order_ledger.ledger;

import com.flagship.order_ledger.config.LedgerProperties;
import com.flagship.order_ledger.ledger.dto.AccountLedgerResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Ledger view of a stored account: reconstructed entries plus a check of the
 * cached balance against them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountLedgerService {

    private final AccountService accountService;
    private final LedgerService ledgerService;
    private final AccountLedgerReconstructor reconstructor;
    private final LedgerProperties properties;

    @Transactional(readOnly = true)
    public AccountLedgerResponse getAccountLedger(UUID tenantId, UUID accountId) {
        Account account = accountService.findById(tenantId, accountId)
            .orElseThrow(() -> new IllegalArgumentException("Account not found: " + accountId));

        List<AccountPosting> postings = ledgerService.getAccountPostings(tenantId, accountId);
        List<AccountLedgerEntry> chronological = reconstructor.computeAccountLedger(postings, account.getAccountType());
        ReconciliationResult reconciliation = reconstructor.reconcile(account, postings, properties.getBalanceTolerance());

        if (!reconciliation.isReconciled()) {
            log.warn("Account {} ({}) out of balance: stored={}, computed={}",
                account.getCode(), accountId, reconciliation.getStoredBalance(), reconciliation.getComputedBalance());
        }

        return AccountLedgerResponse.builder()
            .accountId(account.getId())
            .code(account.getCode())
            .name(account.getName())
            .accountType(account.getAccountType())
            .closingBalance(reconstructor.closingBalance(chronological))
            .entries(reconstructor.mostRecentFirst(chronological))
            .reconciliation(reconciliation)
            .build();
    }
}
