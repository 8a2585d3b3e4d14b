package com.flagship.order_ledger.ledger;

import com.flagship.order_ledger.ledger.dto.AccountLedgerResponse;
import com.flagship.order_ledger.ledger.dto.ReconstructLedgerRequest;
import com.flagship.order_ledger.ledger.dto.ReconstructLedgerResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller for account ledgers and the chart of accounts.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    static final String TENANT_HEADER = "X-Tenant-ID";

    private final AccountLedgerReconstructor reconstructor;
    private final AccountLedgerService accountLedgerService;
    private final AccountService accountService;

    /**
     * Rebuilds a running balance from lines supplied by the caller. Nothing is read or written.
     */
    @PostMapping("/accounts/reconstruct")
    public ResponseEntity<ReconstructLedgerResponse> reconstruct(@Valid @RequestBody ReconstructLedgerRequest request) {
        List<AccountLedgerEntry> chronological =
            reconstructor.computeAccountLedger(request.getPostings(), request.getAccountType());
        boolean mostRecentFirst = request.getMostRecentFirst() == null || request.getMostRecentFirst();
        return ResponseEntity.ok(new ReconstructLedgerResponse(
            reconstructor.closingBalance(chronological),
            mostRecentFirst ? reconstructor.mostRecentFirst(chronological) : chronological
        ));
    }

    @GetMapping("/accounts/{id}/entries")
    public ResponseEntity<AccountLedgerResponse> getAccountEntries(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID accountId) {
        return ResponseEntity.ok(accountLedgerService.getAccountLedger(tenantId, accountId));
    }

    @PostMapping("/chart-of-accounts")
    public ResponseEntity<Map<String, Object>> initializeChartOfAccounts(@RequestHeader(TENANT_HEADER) UUID tenantId) {
        int created = accountService.initializeChartOfAccounts(tenantId);
        return ResponseEntity.ok(Map.of("tenant_id", tenantId, "accounts_created", created));
    }
}
