package com.flagship.order_ledger.fee;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A validated fee table, always sorted ascending by min.
 *
 * Every mutation returns a new, re-sorted set. Overlapping ranges are allowed:
 * lookup takes the first rule by ascending min, and {@link #overlaps()} lists
 * the pairs so callers can warn about them.
 */
@EqualsAndHashCode
public final class FeeRuleSet {

    private static final Comparator<FeeRule> BY_MIN = Comparator.comparing(FeeRule::getMin);
    private static final FeeRuleSet EMPTY = new FeeRuleSet(List.of());

    private final List<FeeRule> rules;

    private FeeRuleSet(List<FeeRule> sortedRules) {
        this.rules = Collections.unmodifiableList(sortedRules);
    }

    public static FeeRuleSet empty() {
        return EMPTY;
    }

    /**
     * @throws FeeRuleValidationException naming every invalid rule by its position in {@code rules}
     */
    public static FeeRuleSet of(List<FeeRule> rules) {
        if (rules == null || rules.isEmpty()) {
            return EMPTY;
        }
        Map<String, String> violations = new LinkedHashMap<>();
        for (int i = 0; i < rules.size(); i++) {
            FeeRule rule = rules.get(i);
            if (rule == null) {
                violations.put("rules[" + i + "]", "Rule is required");
            } else {
                violations.putAll(rule.validate("rules[" + i + "]"));
            }
        }
        if (!violations.isEmpty()) {
            throw new FeeRuleValidationException(violations);
        }
        List<FeeRule> sorted = new ArrayList<>(rules);
        sorted.sort(BY_MIN);
        return new FeeRuleSet(sorted);
    }

    public FeeRuleSet insert(FeeRule rule) {
        List<FeeRule> updated = new ArrayList<>(rules);
        updated.add(rule);
        return of(updated);
    }

    /**
     * @param index position in the sorted rule list
     */
    public FeeRuleSet update(int index, FeeRule rule) {
        checkIndex(index);
        List<FeeRule> updated = new ArrayList<>(rules);
        updated.set(index, rule);
        return of(updated);
    }

    public FeeRuleSet remove(int index) {
        checkIndex(index);
        List<FeeRule> updated = new ArrayList<>(rules);
        updated.remove(index);
        return of(updated);
    }

    public List<FeeRule> getRules() {
        return rules;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public Optional<FeeRule> findFirstMatch(BigDecimal value) {
        return rules.stream().filter(rule -> rule.matches(value)).findFirst();
    }

    /**
     * Pairs of rules whose ranges share at least one value, in rule order.
     */
    public List<Overlap> overlaps() {
        List<Overlap> overlaps = new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            FeeRule earlier = rules.get(i);
            for (int j = i + 1; j < rules.size(); j++) {
                FeeRule later = rules.get(j);
                if (earlier.getMax() == null || later.getMin().compareTo(earlier.getMax()) <= 0) {
                    overlaps.add(new Overlap(earlier, later));
                }
            }
        }
        return overlaps;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= rules.size()) {
            throw new IllegalArgumentException("No fee rule at position " + index);
        }
    }

    /**
     * Two overlapping rules; values in both ranges get the earlier rule's fee.
     */
    @Value
    public static class Overlap {
        @JsonProperty("first")
        FeeRule first;

        @JsonProperty("second")
        FeeRule second;

        public String describe() {
            return String.format("Rule %s-%s overlaps rule %s-%s; the first one wins",
                first.getMin(), first.getMax() == null ? "unbounded" : first.getMax(),
                second.getMin(), second.getMax() == null ? "unbounded" : second.getMax());
        }
    }
}
