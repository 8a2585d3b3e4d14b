package com.flagship.order_ledger.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * Identity of a transaction written by {@link LedgerService#postTransaction}.
 */
@Value
public class PostedTransaction {
    UUID id;
    String transactionNumber;
}
