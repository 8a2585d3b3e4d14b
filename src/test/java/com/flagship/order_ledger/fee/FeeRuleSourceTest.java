package com.flagship.order_ledger.fee;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.order_ledger.config.JacksonConfig;
import com.flagship.order_ledger.fee.dto.RuleValidationRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Fee rules arrive either as a JSON string (older records) or as an array;
 * both must parse to the same rule set.
 */
class FeeRuleSourceTest {

    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();
    private final FeeRuleParser parser = new FeeRuleParser(objectMapper);

    @Test
    @DisplayName("String and array forms parse to the same rules")
    void testBothFormsParse() throws Exception {
        RuleValidationRequest asArray = objectMapper.readValue(
            "{\"rules\": [{\"min\": 6, \"max\": null, \"fee\": 20}, {\"min\": 1, \"max\": 5, \"fee\": 10}]}",
            RuleValidationRequest.class);
        RuleValidationRequest asString = objectMapper.readValue(
            "{\"rules\": \"[{\\\"min\\\": 6, \\\"max\\\": null, \\\"fee\\\": 20}, {\\\"min\\\": 1, \\\"max\\\": 5, \\\"fee\\\": 10}]\"}",
            RuleValidationRequest.class);

        assertInstanceOf(FeeRuleSource.Parsed.class, asArray.getRules());
        assertInstanceOf(FeeRuleSource.Raw.class, asString.getRules());

        FeeRuleSet fromArray = parser.parse(asArray.getRules());
        FeeRuleSet fromString = parser.parse(asString.getRules());
        assertEquals(fromArray, fromString);
        assertEquals(new BigDecimal("1"), fromArray.getRules().get(0).getMin());
    }

    @Test
    @DisplayName("charge is accepted as another name for fee")
    void testChargeAlias() throws Exception {
        RuleValidationRequest request = objectMapper.readValue(
            "{\"rules\": [{\"min\": 2, \"charge\": 100}]}", RuleValidationRequest.class);

        FeeRule rule = parser.parse(request.getRules()).getRules().get(0);

        assertEquals(new BigDecimal("100"), rule.getFee());
    }

    @Test
    @DisplayName("Null, blank and missing rules mean no rules")
    void testEmptyForms() throws Exception {
        RuleValidationRequest nullRules = objectMapper.readValue("{\"rules\": null}", RuleValidationRequest.class);
        RuleValidationRequest blankRules = objectMapper.readValue("{\"rules\": \"  \"}", RuleValidationRequest.class);

        assertTrue(parser.parse(nullRules.getRules()).isEmpty());
        assertTrue(parser.parse(blankRules.getRules()).isEmpty());
        assertTrue(parser.parse(null).isEmpty());
    }

    @Test
    @DisplayName("Malformed JSON in the string form is a validation error")
    void testMalformedString() {
        FeeRuleValidationException e = assertThrows(FeeRuleValidationException.class,
            () -> parser.parse(FeeRuleSource.raw("[{\"min\": 1,")));

        assertTrue(e.getViolations().get("rules").startsWith("Malformed fee rules"));
    }

    @Test
    @DisplayName("Parsed rules are validated like any other")
    void testParsedRulesValidated() {
        FeeRuleSource source = FeeRuleSource.parsed(List.of(
            new FeeRule(BigDecimal.ONE, null, new BigDecimal("-3"))));

        FeeRuleValidationException e = assertThrows(FeeRuleValidationException.class, () -> parser.parse(source));

        assertTrue(e.getViolations().containsKey("rules[0].fee"));
    }
}
