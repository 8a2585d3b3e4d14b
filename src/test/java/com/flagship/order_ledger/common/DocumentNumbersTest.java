package com.flagship.order_ledger.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DocumentNumbersTest {

    @Test
    @DisplayName("Sequences keep four digits and grow past them")
    void testFormat() {
        assertEquals("PAY-2024-0007", DocumentNumbers.format(DocumentNumbers.PAYMENT_PREFIX, 2024, 7));
        assertEquals("TXN-2024-10000", DocumentNumbers.format(DocumentNumbers.TRANSACTION_PREFIX, 2024, 10000));
    }

    @Test
    @DisplayName("Numbers sort by prefix and then by numeric sequence")
    void testSequenceOrder() {
        List<String> numbers = new ArrayList<>(List.of(
            "TXN-2024-10000", "TXN-2025-0001", "TXN-2024-9999", "PAY-2024-0002", "TXN-2024-0001"));

        numbers.sort(DocumentNumbers.SEQUENCE_ORDER);

        assertEquals(List.of("PAY-2024-0002", "TXN-2024-0001", "TXN-2024-9999", "TXN-2024-10000", "TXN-2025-0001"),
            numbers);
    }

    @Test
    @DisplayName("References without a numeric sequence sort after numbered ones")
    void testNonNumericReference() {
        List<String> references = new ArrayList<>(List.of("ORD-A", "ORD-12", "ORD-3", "MANUAL"));

        references.sort(DocumentNumbers.SEQUENCE_ORDER);

        assertEquals(List.of("MANUAL", "ORD-3", "ORD-12", "ORD-A"), references);
    }
}
