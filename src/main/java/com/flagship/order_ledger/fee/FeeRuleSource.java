package com.flagship.order_ledger.fee;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fee rules as a client sent them: either a JSON string holding the rule
 * array (how older records store them) or the array itself.
 *
 * {@link FeeRuleParser} turns either form into a {@link FeeRuleSet} once, at the API boundary.
 */
@JsonDeserialize(using = FeeRuleSourceDeserializer.class)
public abstract class FeeRuleSource {

    private static final TypeReference<List<FeeRule>> RULE_LIST = new TypeReference<>() {
    };

    FeeRuleSource() {
    }

    public static FeeRuleSource raw(String json) {
        return new Raw(json);
    }

    public static FeeRuleSource parsed(List<FeeRule> rules) {
        return new Parsed(rules);
    }

    abstract List<FeeRule> toRules(ObjectMapper mapper);

    /**
     * Rules stored as a JSON string. Blank means no rules.
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    @ToString
    public static final class Raw extends FeeRuleSource {
        private final String json;

        Raw(String json) {
            this.json = json;
        }

        @Override
        List<FeeRule> toRules(ObjectMapper mapper) {
            if (json == null || json.isBlank()) {
                return List.of();
            }
            try {
                List<FeeRule> rules = mapper.readValue(json, RULE_LIST);
                return rules != null ? rules : List.of();
            } catch (JsonProcessingException e) {
                throw FeeRuleValidationException.of("rules", "Malformed fee rules: " + e.getOriginalMessage());
            }
        }
    }

    /**
     * Rules that arrived already structured.
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    @ToString
    public static final class Parsed extends FeeRuleSource {
        private final List<FeeRule> rules;

        Parsed(List<FeeRule> rules) {
            this.rules = rules != null ? Collections.unmodifiableList(new ArrayList<>(rules)) : List.of();
        }

        @Override
        List<FeeRule> toRules(ObjectMapper mapper) {
            return rules;
        }
    }
}
