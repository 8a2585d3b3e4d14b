package com.flagship.order_ledger.ledger;

import com.flagship.order_ledger.common.DocumentNumbers;
import com.flagship.order_ledger.config.LedgerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Service for posting transactions to the ledger.
 *
 * This service enforces the core invariants:
 * 1. Debits must equal credits within the configured tolerance
 * 2. Transaction lines are immutable once written
 * 3. Lines and cached account balances change atomically
 *
 * The deferred database trigger repeats the balance check at commit time.
 */
@Service
@Slf4j
public class LedgerService {

    private final JdbcTemplate jdbcTemplate;
    private final LedgerProperties properties;

    public LedgerService(JdbcTemplate jdbcTemplate, LedgerProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
    }

    /**
     * Posts a transaction to the ledger.
     *
     * @param tenantId owner of every account on the lines
     * @param request  the lines to post
     * @return id and number of the created transaction
     * @throws IllegalArgumentException if the transaction is not balanced,
     *                                  has no lines or names an unknown account
     */
    @Transactional
    public PostedTransaction postTransaction(UUID tenantId, TransactionRequest request) {
        if (request.getLines() == null || request.getLines().isEmpty()) {
            throw new IllegalArgumentException("Transaction must have at least one line");
        }
        if (!request.isBalanced(properties.getBalanceTolerance())) {
            throw new IllegalArgumentException(
                String.format("Transaction is not balanced: debits=%s, credits=%s",
                    request.getDebitTotal(), request.getCreditTotal()));
        }

        Map<UUID, Account.AccountType> accountTypes = loadAccountTypes(tenantId, request);

        UUID transactionId = UUID.randomUUID();
        String transactionNumber = DocumentNumbers.next(jdbcTemplate, "transactions", "transaction_number",
            tenantId, DocumentNumbers.TRANSACTION_PREFIX, request.getDate());
        jdbcTemplate.update(
            "INSERT INTO transactions (id, tenant_id, transaction_number, transaction_date, description, created_at) " +
            "VALUES (?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            transactionId,
            tenantId,
            transactionNumber,
            request.getDate(),
            request.getDescription()
        );

        int lineNumber = 1;
        for (TransactionRequest.Line line : request.getLines()) {
            jdbcTemplate.update(
                "INSERT INTO transaction_lines (transaction_id, account_id, line_number, debit_amount, credit_amount) " +
                "VALUES (?, ?, ?, ?, ?)",
                transactionId,
                line.getAccountId(),
                lineNumber++,
                line.getDebitAmount(),
                line.getCreditAmount()
            );
            BigDecimal change = accountTypes.get(line.getAccountId())
                .balanceChange(line.getDebitAmount(), line.getCreditAmount());
            jdbcTemplate.update(
                "UPDATE accounts SET balance = balance + ? WHERE id = ?",
                change,
                line.getAccountId()
            );
        }

        log.info("Posted transaction {} with {} lines, total {}",
            transactionNumber, request.getLines().size(), request.getDebitTotal());
        return new PostedTransaction(transactionId, transactionNumber);
    }

    private Map<UUID, Account.AccountType> loadAccountTypes(UUID tenantId, TransactionRequest request) {
        Map<UUID, Account.AccountType> accountTypes = new LinkedHashMap<>();
        for (TransactionRequest.Line line : request.getLines()) {
            if (accountTypes.containsKey(line.getAccountId())) {
                continue;
            }
            List<String> types = jdbcTemplate.queryForList(
                "SELECT account_type FROM accounts WHERE tenant_id = ? AND id = ?",
                String.class,
                tenantId, line.getAccountId()
            );
            if (types.isEmpty()) {
                throw new IllegalArgumentException("Account not found: " + line.getAccountId());
            }
            accountTypes.put(line.getAccountId(), Account.AccountType.valueOf(types.get(0)));
        }
        return accountTypes;
    }

    /**
     * All lines posted to an account, in the order they were written.
     */
    @Transactional(readOnly = true)
    public List<AccountPosting> getAccountPostings(UUID tenantId, UUID accountId) {
        return jdbcTemplate.query(
            "SELECT t.id, t.transaction_number, t.transaction_date, t.description, " +
            "       l.debit_amount, l.credit_amount " +
            "FROM transaction_lines l JOIN transactions t ON t.id = l.transaction_id " +
            "WHERE t.tenant_id = ? AND l.account_id = ? " +
            "ORDER BY t.created_at, l.line_number",
            (rs, rowNum) -> AccountPosting.builder()
                .transactionId(UUID.fromString(rs.getString("id")))
                .transactionNumber(rs.getString("transaction_number"))
                .date(rs.getDate("transaction_date").toLocalDate())
                .description(rs.getString("description"))
                .debitAmount(rs.getBigDecimal("debit_amount"))
                .creditAmount(rs.getBigDecimal("credit_amount"))
                .build(),
            tenantId, accountId
        );
    }

    /**
     * Gets the balance for an account by summing its lines rather than
     * reading the cached column.
     */
    @Transactional(readOnly = true)
    public BigDecimal getAccountBalance(UUID tenantId, UUID accountId) {
        List<String> types = jdbcTemplate.queryForList(
            "SELECT account_type FROM accounts WHERE tenant_id = ? AND id = ?",
            String.class,
            tenantId, accountId
        );
        if (types.isEmpty()) {
            throw new IllegalArgumentException("Account not found: " + accountId);
        }
        boolean debitIncrease = Account.AccountType.valueOf(types.get(0)).isDebitIncrease();

        BigDecimal balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(" + (debitIncrease ? "debit_amount - credit_amount" : "credit_amount - debit_amount") + "), 0) " +
            "FROM transaction_lines WHERE account_id = ?",
            BigDecimal.class,
            accountId
        );
        return balance != null ? balance : BigDecimal.ZERO;
    }
}
