package com.flagship.order_ledger.fee;

import com.flagship.order_ledger.common.Amounts;
import com.flagship.order_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Prices a value against a fee configuration.
 *
 * PERCENTAGE:  value * percentage / 100
 * FIXED:       flatAmount
 * RANGE_BASED: fee of the first rule (ascending min) with min <= value <= max;
 *              without a match, defaultFee for COD and
 *              max(0, value - 1) * defaultFee for QUANTITY.
 *
 * Results are rounded half-up to two decimals.
 */
@Component
@RequiredArgsConstructor
public class FeeRuleEvaluator {

    private final LedgerMetrics metrics;

    public BigDecimal evaluateFeeRule(FeeRuleConfig config, BigDecimal value) {
        if (config.getMode() == null) {
            throw FeeRuleValidationException.of("mode", "Fee calculation mode is required");
        }
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException("Value to price must be zero or positive, got " + value);
        }
        metrics.recordFeeEvaluation(config.getMode().name());

        switch (config.getMode()) {
            case PERCENTAGE:
                if (config.getPercentage() == null) {
                    throw FeeRuleValidationException.of("percentage", "Fee percentage not configured");
                }
                return Amounts.normalize(value.multiply(config.getPercentage()).divide(Amounts.ONE_HUNDRED));
            case FIXED:
                if (config.getFlatAmount() == null) {
                    throw FeeRuleValidationException.of("flat_amount", "Fixed fee not configured");
                }
                return Amounts.normalize(config.getFlatAmount());
            case RANGE_BASED:
                Optional<FeeRule> match = config.getRules().findFirstMatch(value);
                if (match.isPresent()) {
                    return Amounts.normalize(match.get().getFee());
                }
                return defaultFee(config, value);
            default:
                throw new IllegalArgumentException("Unsupported fee mode: " + config.getMode());
        }
    }

    public CodFeeResult calculateCodFee(FeeRuleConfig config, BigDecimal codAmount) {
        return new CodFeeResult(Amounts.normalize(codAmount), evaluateFeeRule(config, codAmount), config.getMode());
    }

    private static BigDecimal defaultFee(FeeRuleConfig config, BigDecimal value) {
        BigDecimal defaultFee = Amounts.orZero(config.getDefaultFee());
        if (config.getDomain() == FeeDomain.QUANTITY) {
            BigDecimal additionalUnits = value.subtract(BigDecimal.ONE).max(BigDecimal.ZERO);
            return Amounts.normalize(additionalUnits.multiply(defaultFee));
        }
        return Amounts.normalize(defaultFee);
    }
}
