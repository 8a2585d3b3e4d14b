package com.flagship.order_ledger.config;

import lombok.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Settings under the {@code ledger.*} prefix.
 */
@Value
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    /** Maximum debit/credit difference still treated as balanced. */
    BigDecimal balanceTolerance;

    /** How long idempotency keys stay cached in Redis. */
    Duration idempotencyTtl;

    Shipping shipping;

    public LedgerProperties(@DefaultValue("0.01") BigDecimal balanceTolerance,
                            @DefaultValue("7d") Duration idempotencyTtl,
                            @DefaultValue Shipping shipping) {
        this.balanceTolerance = balanceTolerance;
        this.idempotencyTtl = idempotencyTtl;
        this.shipping = shipping;
    }

    @Value
    public static class Shipping {
        BigDecimal defaultCityCharge;
        BigDecimal defaultQuantityCharge;

        public Shipping(@DefaultValue("200") BigDecimal defaultCityCharge,
                        @DefaultValue("150") BigDecimal defaultQuantityCharge) {
            this.defaultCityCharge = defaultCityCharge;
            this.defaultQuantityCharge = defaultQuantityCharge;
        }
    }
}
