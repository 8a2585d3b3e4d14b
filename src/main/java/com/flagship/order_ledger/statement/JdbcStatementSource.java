package com.flagship.order_ledger.statement;

import com.flagship.order_ledger.common.EntityRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Date;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Loads the stored entries of a customer or supplier statement: opening
 * balance, invoices and cash payments.
 *
 * Only the cash part of a payment is listed. Drawing on an advance moves
 * value inside the party's own balance and does not change it.
 */
@Repository
@Slf4j
public class JdbcStatementSource {

    private final JdbcTemplate jdbcTemplate;

    public JdbcStatementSource(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional(readOnly = true)
    public List<StatementSourceEntry> loadEntries(UUID tenantId, EntityRole role, UUID entityId) {
        String partyColumn = role == EntityRole.CUSTOMER ? "customer_id" : "supplier_id";
        String paymentType = role == EntityRole.CUSTOMER ? "CUSTOMER_PAYMENT" : "SUPPLIER_PAYMENT";

        // the opening balance is dated on the party's first invoice or payment
        List<Map<String, Object>> parties = jdbcTemplate.queryForList(
            "SELECT opening_balance, LEAST(" +
            "       (SELECT MIN(i.invoice_date) FROM invoices i WHERE i.party_id = p.id AND i.is_deleted = FALSE), " +
            "       (SELECT MIN(pay.payment_date) FROM payments pay WHERE pay." + partyColumn + " = p.id)) AS first_date " +
            "FROM parties p WHERE p.tenant_id = ? AND p.id = ? AND p.party_role = ?",
            tenantId, entityId, role.name()
        );
        if (parties.isEmpty()) {
            throw new IllegalArgumentException(role + " not found: " + entityId);
        }

        List<StatementSourceEntry> entries = new ArrayList<>();
        BigDecimal opening = (BigDecimal) parties.get(0).get("opening_balance");
        if (opening != null && opening.signum() != 0) {
            Date firstDate = (Date) parties.get(0).get("first_date");
            entries.add(StatementSourceEntry.builder()
                .date(firstDate != null ? firstDate.toLocalDate() : LocalDate.EPOCH)
                .type(LedgerEntryType.OPENING_BALANCE)
                .amount(opening)
                .description("Opening balance")
                .build());
        }

        LedgerEntryType invoiceType = role == EntityRole.CUSTOMER ? LedgerEntryType.ORDER : LedgerEntryType.PURCHASE_INVOICE;
        entries.addAll(jdbcTemplate.query(
            "SELECT invoice_number, invoice_date, total_amount FROM invoices " +
            "WHERE tenant_id = ? AND party_id = ? AND is_deleted = FALSE",
            (rs, rowNum) -> StatementSourceEntry.builder()
                .date(rs.getDate("invoice_date").toLocalDate())
                .type(invoiceType)
                .amount(rs.getBigDecimal("total_amount"))
                .reference(rs.getString("invoice_number"))
                .description(invoiceType == LedgerEntryType.ORDER ? "Order" : "Purchase invoice")
                .build(),
            tenantId, entityId
        ));

        entries.addAll(jdbcTemplate.query(
            "SELECT payment_number, payment_date, amount FROM payments " +
            "WHERE tenant_id = ? AND " + partyColumn + " = ? AND payment_type = ? AND amount > 0",
            (rs, rowNum) -> StatementSourceEntry.builder()
                .date(rs.getDate("payment_date").toLocalDate())
                .type(LedgerEntryType.PAYMENT)
                .amount(rs.getBigDecimal("amount"))
                .reference(rs.getString("payment_number"))
                .description("Payment")
                .build(),
            tenantId, entityId, paymentType
        ));

        log.debug("Loaded {} statement entries for {} {}", entries.size(), role, entityId);
        return entries;
    }
}
