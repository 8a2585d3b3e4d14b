package com.flagship.order_ledger.fee;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.order_ledger.config.JacksonConfig;
import com.flagship.order_ledger.config.LedgerProperties;
import com.flagship.order_ledger.exception.GlobalExceptionHandler;
import com.flagship.order_ledger.observability.LedgerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.Duration;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Fee endpoints end to end through JSON, with the real evaluator and parser.
 */
class FeeControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = JacksonConfig.createObjectMapper();
        FeeRuleEvaluator evaluator = new FeeRuleEvaluator(new LedgerMetrics(new SimpleMeterRegistry()));
        LedgerProperties properties = new LedgerProperties(new BigDecimal("0.01"), Duration.ofDays(7),
            new LedgerProperties.Shipping(new BigDecimal("200"), new BigDecimal("150")));
        FeeController controller = new FeeController(
            new FeeRuleParser(objectMapper), evaluator, new ShippingChargeCalculator(evaluator, properties));

        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
            .build();
    }

    @Test
    @DisplayName("Range-based evaluation with rules sent as a JSON string")
    void testEvaluateWithStringRules() throws Exception {
        String body = "{\"mode\": \"RANGE_BASED\", \"value\": 6,"
            + " \"rules\": \"[{\\\"min\\\":1,\\\"max\\\":5,\\\"fee\\\":10},{\\\"min\\\":6,\\\"max\\\":null,\\\"fee\\\":20}]\"}";

        mockMvc.perform(post("/api/fees/evaluate").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.fee").value(20.00))
            .andExpect(jsonPath("$.domain").value("COD"))
            .andExpect(jsonPath("$.warnings", hasSize(0)));
    }

    @Test
    @DisplayName("Overlapping rules are accepted with a warning")
    void testValidateRulesWithOverlap() throws Exception {
        String body = "{\"rules\": [{\"min\": 5, \"max\": null, \"charge\": 20}, {\"min\": 1, \"max\": 10, \"fee\": 10}]}";

        mockMvc.perform(post("/api/fees/rules/validate").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(true))
            .andExpect(jsonPath("$.rules[0].min").value(1))
            .andExpect(jsonPath("$.warnings", hasSize(1)));
    }

    @Test
    @DisplayName("Invalid rules answer 400 naming the rule and field")
    void testValidateRulesRejected() throws Exception {
        String body = "{\"rules\": [{\"min\": 0, \"fee\": 10}]}";

        mockMvc.perform(post("/api/fees/rules/validate").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid Fee Rules"))
            .andExpect(jsonPath("$.details['rules[0].min']").value("Minimum must be at least 1"));
    }

    @Test
    @DisplayName("COD fee in percentage mode")
    void testCodPercentage() throws Exception {
        String body = "{\"mode\": \"PERCENTAGE\", \"percentage\": 2, \"value\": 1500}";

        mockMvc.perform(post("/api/fees/cod").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cod_fee").value(30.00))
            .andExpect(jsonPath("$.calculation_type").value("PERCENTAGE"));
    }

    @Test
    @DisplayName("Negative values fail request validation")
    void testNegativeValue() throws Exception {
        String body = "{\"mode\": \"FIXED\", \"flat_amount\": 10, \"value\": -1}";

        mockMvc.perform(post("/api/fees/evaluate").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.value").value("Value cannot be negative"));
    }

    @Test
    @DisplayName("Shipping quote combines city and per-product charges")
    void testShipping() throws Exception {
        String body = "{\"city\": \" karachi \","
            + " \"city_charges\": {\"Karachi\": 150, \"default\": 250},"
            + " \"quantity_rules\": [{\"min\": 2, \"max\": null, \"charge\": 100}],"
            + " \"products\": ["
            + "   {\"product_id\": \"P-1\", \"quantity\": 3},"
            + "   {\"product_id\": \"P-2\", \"quantity\": 2, \"use_default_shipping\": false,"
            + "    \"shipping_default_quantity_charge\": 40}"
            + " ]}";

        mockMvc.perform(post("/api/fees/shipping").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.city_charge").value(150.00))
            .andExpect(jsonPath("$.quantity_charge").value(240.00))
            .andExpect(jsonPath("$.total").value(390.00))
            .andExpect(jsonPath("$.products[1].charge").value(40.00));
    }
}
