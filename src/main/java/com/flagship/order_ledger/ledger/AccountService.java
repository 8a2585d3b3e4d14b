package com.flagship.order_ledger.ledger;

import com.flagship.order_ledger.ledger.Account.AccountSubType;
import com.flagship.order_ledger.ledger.Account.AccountType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for managing a tenant's accounts.
 */
@Service
@Slf4j
public class AccountService {

    private final JdbcTemplate jdbcTemplate;

    public AccountService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public UUID createAccount(UUID tenantId, String code, String name,
                              AccountType accountType, AccountSubType subType) {
        UUID accountId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO accounts (id, tenant_id, code, name, account_type, account_sub_type, balance, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, 0, CURRENT_TIMESTAMP)",
            accountId,
            tenantId,
            code,
            name,
            accountType.name(),
            subType != null ? subType.name() : null
        );
        return accountId;
    }

    public Optional<Account> findById(UUID tenantId, UUID accountId) {
        List<Account> accounts = jdbcTemplate.query(
            "SELECT id, tenant_id, code, name, account_type, account_sub_type, balance " +
            "FROM accounts WHERE tenant_id = ? AND id = ?",
            accountRowMapper(),
            tenantId, accountId
        );
        return accounts.stream().findFirst();
    }

    public Optional<Account> findByCode(UUID tenantId, String code) {
        List<Account> accounts = jdbcTemplate.query(
            "SELECT id, tenant_id, code, name, account_type, account_sub_type, balance " +
            "FROM accounts WHERE tenant_id = ? AND code = ?",
            accountRowMapper(),
            tenantId, code
        );
        return accounts.stream().findFirst();
    }

    /**
     * Returns the id of the tenant's account for a standard chart entry,
     * creating it on first use.
     */
    @Transactional
    public UUID getOrCreate(UUID tenantId, ChartOfAccounts chartAccount) {
        jdbcTemplate.update(
            "INSERT INTO accounts (id, tenant_id, code, name, account_type, account_sub_type, balance, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, 0, CURRENT_TIMESTAMP) ON CONFLICT (tenant_id, code) DO NOTHING",
            UUID.randomUUID(),
            tenantId,
            chartAccount.getCode(),
            chartAccount.getAccountName(),
            chartAccount.getAccountType().name(),
            chartAccount.getSubType() != null ? chartAccount.getSubType().name() : null
        );
        return findByCode(tenantId, chartAccount.getCode())
            .map(Account::getId)
            .orElseThrow(() -> new IllegalStateException(
                "Account " + chartAccount.getCode() + " missing after creation for tenant " + tenantId));
    }

    /**
     * Creates every missing account of the default chart for the tenant.
     *
     * @return number of accounts that were created
     */
    @Transactional
    public int initializeChartOfAccounts(UUID tenantId) {
        int created = 0;
        for (ChartOfAccounts chartAccount : ChartOfAccounts.values()) {
            if (findByCode(tenantId, chartAccount.getCode()).isEmpty()) {
                getOrCreate(tenantId, chartAccount);
                created++;
            }
        }
        log.info("Chart of accounts initialized for tenant {}: {} accounts created", tenantId, created);
        return created;
    }

    /**
     * Checks that money can be paid from or into the account: it must be a
     * cash or bank asset account of the tenant.
     */
    public void requirePaymentAccount(UUID tenantId, UUID accountId) {
        Account account = findById(tenantId, accountId)
            .orElseThrow(() -> new IllegalArgumentException("Account not found: " + accountId));
        if (account.getAccountType() != AccountType.ASSET || account.getSubType() == null) {
            throw new IllegalArgumentException(
                "Account " + account.getCode() + " is not a cash or bank account");
        }
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> {
            String subType = rs.getString("account_sub_type");
            return Account.builder()
                .id(UUID.fromString(rs.getString("id")))
                .tenantId(UUID.fromString(rs.getString("tenant_id")))
                .code(rs.getString("code"))
                .name(rs.getString("name"))
                .accountType(AccountType.valueOf(rs.getString("account_type")))
                .subType(subType != null ? AccountSubType.valueOf(subType) : null)
                .balance(rs.getBigDecimal("balance"))
                .build();
        };
    }
}
