package com.flagship.order_ledger.invoice;

import com.flagship.order_ledger.common.EntityRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of {@link InvoiceDirectory}.
 *
 * Payments settle an invoice with their cash amount plus any advance they
 * consumed; the party balance only moves with cash, since applying an advance
 * is a transfer inside the party's own balance.
 */
@Repository
@Slf4j
public class JdbcInvoiceDirectory implements InvoiceDirectory {

    private final JdbcTemplate jdbcTemplate;

    public JdbcInvoiceDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Invoice> fetchInvoicesForEntity(UUID tenantId, EntityRole role, UUID entityId) {
        List<Invoice> invoices = jdbcTemplate.query(
            "SELECT i.id, i.invoice_number, i.invoice_date, i.total_amount, i.legacy_payment_amount " +
            "FROM invoices i JOIN parties p ON p.id = i.party_id " +
            "WHERE i.tenant_id = ? AND i.party_id = ? AND p.party_role = ? AND i.is_deleted = FALSE " +
            "ORDER BY i.invoice_date, i.invoice_number",
            (rs, rowNum) -> Invoice.builder()
                .id(UUID.fromString(rs.getString("id")))
                .invoiceNumber(rs.getString("invoice_number"))
                .invoiceDate(rs.getDate("invoice_date").toLocalDate())
                .entityRole(role)
                .entityId(entityId)
                .totalAmount(rs.getBigDecimal("total_amount"))
                .legacyPaymentAmount(rs.getBigDecimal("legacy_payment_amount"))
                .build(),
            tenantId, entityId, role.name()
        );

        if (invoices.isEmpty()) {
            return invoices;
        }

        Map<UUID, List<BigDecimal>> linked = new HashMap<>();
        List<BigDecimal> unlinked = new ArrayList<>();
        jdbcTemplate.query(
            "SELECT COALESCE(order_id, purchase_invoice_id) AS invoice_id, amount + advance_amount_used AS settled " +
            "FROM payments WHERE tenant_id = ? AND " + partyColumn(role) + " = ? AND payment_type = ?",
            rs -> {
                String invoiceId = rs.getString("invoice_id");
                BigDecimal settled = rs.getBigDecimal("settled");
                if (invoiceId == null) {
                    unlinked.add(settled);
                } else {
                    linked.computeIfAbsent(UUID.fromString(invoiceId), id -> new ArrayList<>()).add(settled);
                }
            },
            tenantId, entityId, paymentType(role)
        );

        List<Invoice> result = new ArrayList<>(invoices.size());
        for (Invoice invoice : invoices) {
            result.add(invoice.toBuilder()
                .linkedPayments(linked.getOrDefault(invoice.getId(), List.of()))
                .entityPayments(unlinked)
                .build());
        }
        log.debug("Loaded {} invoices for {} {}", result.size(), role, entityId);
        return result;
    }

    @Override
    @Transactional(readOnly = true)
    public BalanceSnapshot fetchBalanceSnapshot(UUID tenantId, EntityRole role, UUID entityId) {
        List<BigDecimal> net = jdbcTemplate.queryForList(
            "SELECT p.opening_balance " +
            "  + COALESCE((SELECT SUM(i.total_amount) FROM invoices i " +
            "              WHERE i.party_id = p.id AND i.is_deleted = FALSE), 0) " +
            "  - COALESCE((SELECT SUM(pay.amount) FROM payments pay " +
            "              WHERE pay." + partyColumn(role) + " = p.id AND pay.payment_type = ?), 0) " +
            "FROM parties p WHERE p.tenant_id = ? AND p.id = ? AND p.party_role = ?",
            BigDecimal.class,
            paymentType(role), tenantId, entityId, role.name()
        );
        if (net.isEmpty()) {
            throw new IllegalArgumentException(role + " not found: " + entityId);
        }
        return BalanceSnapshot.fromNetBalance(net.get(0));
    }

    @Override
    public Optional<Invoice> lockInvoice(UUID tenantId, UUID invoiceId) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT i.party_id, p.party_role FROM invoices i JOIN parties p ON p.id = i.party_id " +
            "WHERE i.tenant_id = ? AND i.id = ? AND i.is_deleted = FALSE FOR UPDATE OF i",
            tenantId, invoiceId
        );
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        UUID partyId = (UUID) rows.get(0).get("party_id");
        EntityRole role = EntityRole.valueOf((String) rows.get(0).get("party_role"));
        return fetchInvoicesForEntity(tenantId, role, partyId).stream()
            .filter(invoice -> invoice.getId().equals(invoiceId))
            .findFirst();
    }

    private static String partyColumn(EntityRole role) {
        return role == EntityRole.CUSTOMER ? "customer_id" : "supplier_id";
    }

    private static String paymentType(EntityRole role) {
        return role == EntityRole.CUSTOMER ? "CUSTOMER_PAYMENT" : "SUPPLIER_PAYMENT";
    }
}
