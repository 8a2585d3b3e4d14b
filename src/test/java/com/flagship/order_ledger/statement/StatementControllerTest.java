package com.flagship.order_ledger.statement;

import com.flagship.order_ledger.common.EntityRole;
import com.flagship.order_ledger.config.JacksonConfig;
import com.flagship.order_ledger.exception.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class StatementControllerTest {

    private static final UUID TENANT_ID = UUID.randomUUID();

    @Mock
    private JdbcStatementSource statementSource;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new StatementController(new StatementBuilder(), statementSource))
            .setControllerAdvice(new GlobalExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(JacksonConfig.createObjectMapper()))
            .build();
    }

    @Test
    @DisplayName("Statement built from posted entries lists the latest line first")
    void testStatementFromEntries() throws Exception {
        String body = "{\"entity_role\": \"CUSTOMER\", \"entries\": ["
            + "{\"date\": \"2024-03-10\", \"type\": \"PAYMENT\", \"amount\": 200.00, \"reference\": \"PAY-2024-0001\"},"
            + "{\"date\": \"2024-03-01\", \"type\": \"ORDER\", \"amount\": 500.00, \"reference\": \"ORD-1\"}"
            + "]}";

        mockMvc.perform(post("/api/statements")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.lines.length()").value(2))
            .andExpect(jsonPath("$.lines[0].reference").value("PAY-2024-0001"))
            .andExpect(jsonPath("$.closing_balance").value(300.00))
            .andExpect(jsonPath("$.closing_label").value("Owes"));
    }

    @Test
    @DisplayName("An entry without an amount is rejected")
    void testEntryWithoutAmountRejected() throws Exception {
        String body = "{\"entity_role\": \"SUPPLIER\", \"entries\": ["
            + "{\"date\": \"2024-03-01\", \"type\": \"PURCHASE_INVOICE\"}]}";

        mockMvc.perform(post("/api/statements")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Unknown counterparty is reported as a bad request")
    void testUnknownCounterparty() throws Exception {
        UUID supplierId = UUID.randomUUID();
        when(statementSource.loadEntries(TENANT_ID, EntityRole.SUPPLIER, supplierId))
            .thenThrow(new IllegalArgumentException("SUPPLIER not found: " + supplierId));

        mockMvc.perform(get("/api/statements/SUPPLIER/" + supplierId)
                .header("X-Tenant-ID", TENANT_ID.toString()))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("SUPPLIER not found: " + supplierId));
    }
}
