package com.flagship.order_ledger.fee;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Normalizes a {@link FeeRuleSource} into a validated, sorted {@link FeeRuleSet}.
 */
@Component
@RequiredArgsConstructor
public class FeeRuleParser {

    private final ObjectMapper objectMapper;

    /**
     * @param source may be null, meaning no rules
     * @throws FeeRuleValidationException if the JSON is malformed or a rule is invalid
     */
    public FeeRuleSet parse(FeeRuleSource source) {
        if (source == null) {
            return FeeRuleSet.empty();
        }
        return FeeRuleSet.of(source.toRules(objectMapper));
    }
}
