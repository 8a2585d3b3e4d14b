package com.flagship.order_ledger.ledger;

import com.flagship.order_ledger.ledger.Account.AccountSubType;
import com.flagship.order_ledger.ledger.Account.AccountType;
import com.flagship.order_ledger.ledger.dto.AccountLedgerResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Try to break the ledger: unbalanced transactions, unknown accounts,
 * and cached balances drifting from the lines.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class LedgerServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_ledger")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private AccountLedgerService accountLedgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID tenantId;
    private UUID bankId;
    private UUID receivableId;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @BeforeEach
    void setUp() {
        // Every test gets its own tenant so document numbers and balances start fresh
        tenantId = UUID.randomUUID();
        bankId = accountService.getOrCreate(tenantId, ChartOfAccounts.BANK);
        receivableId = accountService.getOrCreate(tenantId, ChartOfAccounts.ACCOUNTS_RECEIVABLE);
    }

    private TransactionRequest transfer(LocalDate date, String amount) {
        return new TransactionRequest(date, "Customer settles invoice", List.of(
            TransactionRequest.Line.debit(bankId, new BigDecimal(amount)),
            TransactionRequest.Line.credit(receivableId, new BigDecimal(amount))
        ));
    }

    @Test
    @DisplayName("Balanced transaction is posted and numbered per year")
    void testPostBalancedTransaction() {
        printTestHeader("Balanced Transaction");

        PostedTransaction first = ledgerService.postTransaction(tenantId, transfer(LocalDate.of(2024, 5, 1), "100.00"));
        PostedTransaction second = ledgerService.postTransaction(tenantId, transfer(LocalDate.of(2024, 5, 2), "50.00"));
        PostedTransaction nextYear = ledgerService.postTransaction(tenantId, transfer(LocalDate.of(2025, 1, 2), "5.00"));
        printOutput("Transactions", List.of(first, second, nextYear));

        assertEquals("TXN-2024-0001", first.getTransactionNumber());
        assertEquals("TXN-2024-0002", second.getTransactionNumber());
        assertEquals("TXN-2025-0001", nextYear.getTransactionNumber());

        Integer lines = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM transaction_lines WHERE transaction_id = ?", Integer.class, first.getId());
        assertEquals(2, lines, "Should have 1 debit and 1 credit line");
    }

    @Test
    @DisplayName("Posting moves cached balances by the account type's sign rule")
    void testCachedBalances() {
        UUID advanceId = accountService.getOrCreate(tenantId, ChartOfAccounts.CUSTOMER_ADVANCE);
        ledgerService.postTransaction(tenantId, new TransactionRequest(LocalDate.of(2024, 5, 1), "Advance received",
            List.of(
                TransactionRequest.Line.debit(bankId, new BigDecimal("300.00")),
                TransactionRequest.Line.credit(advanceId, new BigDecimal("300.00"))
            )));

        assertEquals(new BigDecimal("300.00"), accountService.findById(tenantId, bankId).orElseThrow().getBalance());
        assertEquals(new BigDecimal("300.00"), accountService.findById(tenantId, advanceId).orElseThrow().getBalance(),
            "A liability grows with credits");
        assertEquals(0, new BigDecimal("300.00").compareTo(ledgerService.getAccountBalance(tenantId, advanceId)));
    }

    @Test
    @DisplayName("Unbalanced transaction is rejected and nothing is written")
    void testUnbalancedRejected() {
        TransactionRequest unbalanced = new TransactionRequest(LocalDate.of(2024, 5, 1), "Broken", List.of(
            TransactionRequest.Line.debit(bankId, new BigDecimal("100.00")),
            TransactionRequest.Line.credit(receivableId, new BigDecimal("99.00"))
        ));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> ledgerService.postTransaction(tenantId, unbalanced));

        assertTrue(e.getMessage().contains("not balanced"));
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM transactions WHERE tenant_id = ?", Integer.class, tenantId);
        assertEquals(0, count);
    }

    @Test
    @DisplayName("Accounts of another tenant cannot be posted to")
    void testForeignAccountRejected() {
        UUID otherTenantBank = accountService.getOrCreate(UUID.randomUUID(), ChartOfAccounts.BANK);
        TransactionRequest request = new TransactionRequest(LocalDate.of(2024, 5, 1), "Cross tenant", List.of(
            TransactionRequest.Line.debit(otherTenantBank, new BigDecimal("10.00")),
            TransactionRequest.Line.credit(receivableId, new BigDecimal("10.00"))
        ));

        assertThrows(IllegalArgumentException.class, () -> ledgerService.postTransaction(tenantId, request));
    }

    @Test
    @DisplayName("Database rejects an unbalanced transaction written around the service")
    void testDatabaseTriggerRejectsImbalance() {
        UUID transactionId = UUID.randomUUID();

        assertThrows(DataAccessException.class, () -> jdbcTemplate.execute((Connection connection) -> {
            connection.setAutoCommit(false);
            try (PreparedStatement insertTransaction = connection.prepareStatement(
                    "INSERT INTO transactions (id, tenant_id, transaction_number, transaction_date) VALUES (?, ?, ?, ?)");
                 PreparedStatement insertLine = connection.prepareStatement(
                    "INSERT INTO transaction_lines (transaction_id, account_id, line_number, debit_amount) VALUES (?, ?, 1, 50)")) {
                insertTransaction.setObject(1, transactionId);
                insertTransaction.setObject(2, tenantId);
                insertTransaction.setString(3, "TXN-2024-9999");
                insertTransaction.setObject(4, LocalDate.of(2024, 5, 1));
                insertTransaction.executeUpdate();
                insertLine.setObject(1, transactionId);
                insertLine.setObject(2, bankId);
                insertLine.executeUpdate();
                // the deferred balance trigger fires here
                connection.commit();
            } finally {
                connection.rollback();
                connection.setAutoCommit(true);
            }
            return null;
        }));

        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM transactions WHERE id = ?", Integer.class, transactionId);
        assertEquals(0, count);
    }

    @Test
    @DisplayName("Account ledger rebuilds the running balance and reconciles the cache")
    void testAccountLedger() {
        ledgerService.postTransaction(tenantId, transfer(LocalDate.of(2024, 6, 1), "120.00"));
        ledgerService.postTransaction(tenantId, transfer(LocalDate.of(2024, 6, 3), "30.00"));

        AccountLedgerResponse ledger = accountLedgerService.getAccountLedger(tenantId, bankId);
        printOutput("Ledger", ledger);

        assertEquals(new BigDecimal("150.00"), ledger.getClosingBalance());
        assertEquals(new BigDecimal("150.00"), ledger.getEntries().get(0).getBalance(), "Most recent entry first");
        assertEquals(new BigDecimal("120.00"), ledger.getEntries().get(1).getBalance());
        assertTrue(ledger.getReconciliation().isReconciled());

        // Drift the cache on purpose
        jdbcTemplate.update("UPDATE accounts SET balance = balance + 1 WHERE id = ?", bankId);
        assertFalse(accountLedgerService.getAccountLedger(tenantId, bankId).getReconciliation().isReconciled());
    }

    @Test
    @DisplayName("Chart of accounts is created once per tenant")
    void testInitializeChartOfAccounts() {
        int created = accountService.initializeChartOfAccounts(tenantId);
        int again = accountService.initializeChartOfAccounts(tenantId);

        assertEquals(ChartOfAccounts.values().length - 2, created, "BANK and AR already exist");
        assertEquals(0, again);
        Account advance = accountService.findByCode(tenantId, "2050").orElseThrow();
        assertEquals(AccountType.LIABILITY, advance.getAccountType());
        assertEquals(AccountSubType.BANK, accountService.findById(tenantId, bankId).orElseThrow().getSubType());
    }

    @Test
    @DisplayName("Only cash and bank accounts can receive payments")
    void testRequirePaymentAccount() {
        accountService.requirePaymentAccount(tenantId, bankId);

        assertThrows(IllegalArgumentException.class, () -> accountService.requirePaymentAccount(tenantId, receivableId));
        assertThrows(IllegalArgumentException.class, () -> accountService.requirePaymentAccount(tenantId, UUID.randomUUID()));
    }
}
