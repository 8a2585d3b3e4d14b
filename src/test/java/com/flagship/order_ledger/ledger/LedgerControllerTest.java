package com.flagship.order_ledger.ledger;

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
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class LedgerControllerTest {

    @Mock
    private AccountLedgerService accountLedgerService;

    @Mock
    private AccountService accountService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        LedgerController controller =
            new LedgerController(new AccountLedgerReconstructor(), accountLedgerService, accountService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(JacksonConfig.createObjectMapper()))
            .build();
    }

    private static final String POSTINGS = "\"postings\": ["
        + "{\"transaction_number\": \"TXN-2024-0002\", \"date\": \"2024-03-05\", \"credit_amount\": 150.00},"
        + "{\"transaction_number\": \"TXN-2024-0001\", \"date\": \"2024-03-01\", \"debit_amount\": 500.00}"
        + "]";

    @Test
    @DisplayName("Running balance of an asset account is returned most recent first by default")
    void testReconstructMostRecentFirst() throws Exception {
        mockMvc.perform(post("/api/ledger/accounts/reconstruct")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"account_type\": \"ASSET\", " + POSTINGS + "}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.closing_balance").value(350.00))
            .andExpect(jsonPath("$.entries[0].transaction_number").value("TXN-2024-0002"))
            .andExpect(jsonPath("$.entries[0].balance").value(350.00))
            .andExpect(jsonPath("$.entries[1].balance").value(500.00));
    }

    @Test
    @DisplayName("Liability lines can be returned in posting order")
    void testReconstructChronological() throws Exception {
        mockMvc.perform(post("/api/ledger/accounts/reconstruct")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"account_type\": \"LIABILITY\", \"most_recent_first\": false, " + POSTINGS + "}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.closing_balance").value(-350.00))
            .andExpect(jsonPath("$.entries[0].transaction_number").value("TXN-2024-0001"))
            .andExpect(jsonPath("$.entries[0].balance").value(-500.00));
    }

    @Test
    @DisplayName("Missing account type is rejected")
    void testMissingAccountType() throws Exception {
        mockMvc.perform(post("/api/ledger/accounts/reconstruct")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{" + POSTINGS + "}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.accountType").value("Account type is required"));
    }

    @Test
    @DisplayName("Chart of accounts initialisation reports how many accounts were created")
    void testInitializeChartOfAccounts() throws Exception {
        UUID tenantId = UUID.randomUUID();
        when(accountService.initializeChartOfAccounts(tenantId)).thenReturn(19);

        mockMvc.perform(post("/api/ledger/chart-of-accounts")
                .header("X-Tenant-ID", tenantId.toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.accounts_created").value(19));
    }
}
