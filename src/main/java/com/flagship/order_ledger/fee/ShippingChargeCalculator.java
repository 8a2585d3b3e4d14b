package com.flagship.order_ledger.fee;

import com.flagship.order_ledger.common.Amounts;
import com.flagship.order_ledger.config.LedgerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Shipping charge of an order: a base charge for the destination city plus a
 * quantity charge per product line.
 *
 * City lookup: exact name, then a case and whitespace insensitive match, then
 * the "default" entry, then the tenant default.
 *
 * Quantity charge per product: nothing for a single unit; otherwise
 * rule.fee * (quantity - 1) for the first matching rule, or
 * defaultQuantityCharge * (quantity - 1) when no rule matches.
 * A product that does not use default shipping brings its own rules and
 * default charge, each replacing the tenant's when present; its default
 * charge alone acts as a flat rate for every extra unit.
 */
@Component
@Slf4j
public class ShippingChargeCalculator {

    static final String DEFAULT_CITY_KEY = "default";

    private final FeeRuleEvaluator evaluator;
    private final LedgerProperties.Shipping systemDefaults;

    public ShippingChargeCalculator(FeeRuleEvaluator evaluator, LedgerProperties properties) {
        this.evaluator = evaluator;
        this.systemDefaults = properties.getShipping();
    }

    public ShippingQuote calculate(ShippingConfig config, String city, List<ProductShipping> products) {
        BigDecimal cityCharge = Amounts.normalize(cityCharge(config, city));

        List<ShippingQuote.ProductCharge> charges = new ArrayList<>();
        BigDecimal quantityCharge = Amounts.normalize(BigDecimal.ZERO);
        if (products != null) {
            for (ProductShipping product : products) {
                BigDecimal charge = productCharge(config, product);
                charges.add(new ShippingQuote.ProductCharge(product.getProductId(), product.getQuantity(), charge));
                quantityCharge = quantityCharge.add(charge);
            }
        }

        log.debug("Shipping for city '{}': base={}, quantity={}", city, cityCharge, quantityCharge);
        return new ShippingQuote(cityCharge, quantityCharge, cityCharge.add(quantityCharge), charges);
    }

    BigDecimal cityCharge(ShippingConfig config, String city) {
        Map<String, BigDecimal> cityCharges = config.getCityCharges() != null ? config.getCityCharges() : Map.of();
        BigDecimal tenantDefault = config.getDefaultCityCharge() != null
            ? config.getDefaultCityCharge()
            : systemDefaults.getDefaultCityCharge();

        if (city == null || city.isBlank()) {
            return tenantDefault;
        }
        BigDecimal exact = cityCharges.get(city.trim());
        if (exact != null) {
            return exact;
        }
        String normalized = normalizeCity(city);
        Optional<BigDecimal> matched = cityCharges.entrySet().stream()
            .filter(entry -> !DEFAULT_CITY_KEY.equals(entry.getKey()))
            .filter(entry -> normalizeCity(entry.getKey()).equals(normalized))
            .map(Map.Entry::getValue)
            .findFirst();
        if (matched.isPresent()) {
            return matched.get();
        }
        log.debug("No shipping charge for city '{}', using default", city);
        BigDecimal cityDefault = cityCharges.get(DEFAULT_CITY_KEY);
        return cityDefault != null ? cityDefault : tenantDefault;
    }

    BigDecimal productCharge(ShippingConfig config, ProductShipping product) {
        int quantity = product.getQuantity();
        if (quantity < 1) {
            throw new IllegalArgumentException(
                "Quantity of product " + product.getProductId() + " must be at least 1, got " + quantity);
        }

        boolean custom = !product.isUseDefaultShipping();
        boolean ownRules = custom && product.getRules() != null && !product.getRules().isEmpty();
        boolean ownDefault = custom && product.getDefaultQuantityCharge() != null;
        BigDecimal defaultCharge = ownDefault ? product.getDefaultQuantityCharge() : tenantDefaultQuantityCharge(config);
        FeeRuleSet rules;
        if (ownRules) {
            rules = product.getRules();
        } else if (ownDefault) {
            rules = flatRate(defaultCharge);
        } else {
            rules = tenantRules(config);
        }

        if (quantity == 1) {
            return Amounts.normalize(BigDecimal.ZERO);
        }
        BigDecimal units = BigDecimal.valueOf(quantity);
        Optional<FeeRule> rule = rules.findFirstMatch(units);
        if (rule.isPresent()) {
            return Amounts.normalize(rule.get().getFee().multiply(units.subtract(BigDecimal.ONE)));
        }
        FeeRuleConfig fallback = FeeRuleConfig.builder()
            .mode(FeeMode.RANGE_BASED)
            .domain(FeeDomain.QUANTITY)
            .defaultFee(defaultCharge)
            .build();
        return evaluator.evaluateFeeRule(fallback, units);
    }

    private FeeRuleSet tenantRules(ShippingConfig config) {
        if (config.getQuantityRules() != null && !config.getQuantityRules().isEmpty()) {
            return config.getQuantityRules();
        }
        return flatRate(tenantDefaultQuantityCharge(config));
    }

    private static FeeRuleSet flatRate(BigDecimal charge) {
        return FeeRuleSet.of(List.of(new FeeRule(BigDecimal.ONE, null, charge)));
    }

    private BigDecimal tenantDefaultQuantityCharge(ShippingConfig config) {
        return config.getDefaultQuantityCharge() != null
            ? config.getDefaultQuantityCharge()
            : systemDefaults.getDefaultQuantityCharge();
    }

    static String normalizeCity(String city) {
        return city.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
