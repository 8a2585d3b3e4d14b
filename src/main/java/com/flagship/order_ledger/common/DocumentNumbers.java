package com.flagship.order_ledger.common;

import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigInteger;
import java.time.LocalDate;
import java.util.Comparator;

/**
 * Per-tenant, per-year document numbers such as PAY-2024-0007 or TXN-2024-0131.
 */
public final class DocumentNumbers {

    public static final String PAYMENT_PREFIX = "PAY";
    public static final String TRANSACTION_PREFIX = "TXN";

    /**
     * Orders numbers by everything up to the last '-' and then by the numeric
     * sequence after it, so TXN-2024-9999 comes before TXN-2024-10000.
     * A numeric sequence sorts before a non-numeric one under the same prefix.
     */
    public static final Comparator<String> SEQUENCE_ORDER = DocumentNumbers::compareSequence;

    private DocumentNumbers() {
        // Utility class - no instantiation
    }

    public static String format(String prefix, int year, long sequence) {
        return String.format("%s-%d-%04d", prefix, year, sequence);
    }

    /**
     * Next free number in {@code table.column} for the tenant and the year of {@code date}.
     * Callers run inside the posting transaction; the unique constraint on the
     * column rejects a concurrent writer that picked the same number.
     */
    public static String next(JdbcTemplate jdbcTemplate, String table, String column,
                              Object tenantId, String prefix, LocalDate date) {
        String yearPrefix = prefix + "-" + date.getYear() + "-";
        Long last = jdbcTemplate.queryForObject(
            "SELECT COALESCE(MAX(CAST(SUBSTRING(" + column + " FROM " + (yearPrefix.length() + 1) + ") AS BIGINT)), 0) " +
            "FROM " + table + " WHERE tenant_id = ? AND " + column + " LIKE ?",
            Long.class,
            tenantId, yearPrefix + "%"
        );
        return format(prefix, date.getYear(), (last == null ? 0 : last) + 1);
    }

    private static int compareSequence(String left, String right) {
        int leftDash = left.lastIndexOf('-');
        int rightDash = right.lastIndexOf('-');
        int byPrefix = left.substring(0, leftDash + 1).compareTo(right.substring(0, rightDash + 1));
        if (byPrefix != 0) {
            return byPrefix;
        }
        String leftSequence = left.substring(leftDash + 1);
        String rightSequence = right.substring(rightDash + 1);
        boolean leftNumeric = isDigits(leftSequence);
        boolean rightNumeric = isDigits(rightSequence);
        if (leftNumeric != rightNumeric) {
            return leftNumeric ? -1 : 1;
        }
        int bySequence = leftNumeric
            ? new BigInteger(leftSequence).compareTo(new BigInteger(rightSequence))
            : leftSequence.compareTo(rightSequence);
        return bySequence != 0 ? bySequence : left.compareTo(right);
    }

    private static boolean isDigits(String value) {
        return !value.isEmpty() && value.chars().allMatch(c -> c >= '0' && c <= '9');
    }
}
