package com.loanamori.loan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end tests of the loan API on an in-memory database.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Loan API Integration Tests")
class LoanApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String createUser(String username) throws Exception {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        String body = String.format("{\"username\":\"%s-%s\",\"email\":\"%s-%s@example.com\"}",
            username, suffix, username, suffix);
        MvcResult result = mockMvc.perform(post("/api/v1/users").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isCreated())
            .andReturn();
        return readJson(result).get("id").asText();
    }

    private String createLoan(String ownerId, String amount, String rate, int term) throws Exception {
        String body = String.format(
            "{\"user_id\":\"%s\",\"amount\":%s,\"annual_interest_rate\":%s,\"loan_term_in_months\":%d}",
            ownerId, amount, rate, term);
        MvcResult result = mockMvc.perform(post("/api/v1/loans").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isCreated())
            .andReturn();
        return readJson(result).get("id").asText();
    }

    private JsonNode getJson(String path, Object... vars) throws Exception {
        return readJson(mockMvc.perform(get(path, vars)).andExpect(status().isOk()).andReturn());
    }

    private JsonNode readJson(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    @DisplayName("Should reject duplicate usernames and emails")
    void testDuplicateUsers() throws Exception {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        String alice = "{\"username\":\"alice-" + suffix + "\",\"email\":\"alice-" + suffix + "@example.com\"}";
        String sameName = "{\"username\":\"alice-" + suffix + "\",\"email\":\"other-" + suffix + "@example.com\"}";
        String sameEmail = "{\"username\":\"other-" + suffix + "\",\"email\":\"alice-" + suffix + "@example.com\"}";

        mockMvc.perform(post("/api/v1/users").contentType(MediaType.APPLICATION_JSON).content(alice))
            .andExpect(status().isCreated());
        mockMvc.perform(post("/api/v1/users").contentType(MediaType.APPLICATION_JSON).content(sameName))
            .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/v1/users").contentType(MediaType.APPLICATION_JSON).content(sameEmail))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Should create a loan and read it back through every view")
    void testCreateAndReadLoan() throws Exception {
        String ownerId = createUser("owner");
        String loanId = createLoan(ownerId, "10000.00", "6.0", 12);

        JsonNode loan = getJson("/api/v1/loans/{loanId}", loanId);
        assertThat(loan.get("user_id").asText()).isEqualTo(ownerId);
        assertThat(new BigDecimal(loan.get("amount").asText())).isEqualByComparingTo("10000.00");
        assertThat(loan.get("amount").isTextual()).isTrue();
        assertThat(loan.get("annual_interest_rate").isTextual()).isTrue();
        assertThat(new BigDecimal(loan.get("annual_interest_rate").asText())).isEqualByComparingTo("6.0");

        JsonNode owned = getJson("/api/v1/users/{userId}/loans", ownerId);
        assertThat(owned).hasSize(1);
        assertThat(owned.get(0).get("id").asText()).isEqualTo(loanId);

        JsonNode all = getJson("/api/v1/loans");
        assertThat(all.findValuesAsText("id")).contains(loanId);
    }

    @Test
    @DisplayName("Should return 404 for unknown users and loans")
    void testNotFound() throws Exception {
        UUID unknown = UUID.randomUUID();

        mockMvc.perform(get("/api/v1/users/{userId}/loans", unknown)).andExpect(status().isNotFound());
        mockMvc.perform(get("/api/v1/loans/{loanId}", unknown)).andExpect(status().isNotFound());
        mockMvc.perform(get("/api/v1/loans/{loanId}/schedule", unknown)).andExpect(status().isNotFound());
        mockMvc.perform(post("/api/v1/loans").contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_id\":\"" + unknown + "\",\"amount\":100,\"annual_interest_rate\":1,\"loan_term_in_months\":1}"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should share a loan once and never with its owner")
    void testSharing() throws Exception {
        String ownerId = createUser("share-owner");
        String viewerId = createUser("share-viewer");
        String loanId = createLoan(ownerId, "10000.00", "6.0", 12);
        String path = "/api/v1/loans/{loanId}/share";

        mockMvc.perform(post(path, loanId).contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_id\":\"" + viewerId + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.shared_user_ids[0]").value(viewerId));

        mockMvc.perform(post(path, loanId).contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_id\":\"" + viewerId + "\"}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post(path, loanId).contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_id\":\"" + ownerId + "\"}"))
            .andExpect(status().isBadRequest());

        JsonNode loan = getJson("/api/v1/loans/{loanId}", loanId);
        assertThat(loan.get("shared_user_ids")).hasSize(1);
    }

    @Test
    @DisplayName("Should return a term-length schedule ending at zero")
    void testSchedule() throws Exception {
        String ownerId = createUser("schedule");
        String loanId = createLoan(ownerId, "1200.00", "0", 12);

        JsonNode schedule = getJson("/api/v1/loans/{loanId}/schedule", loanId);

        assertThat(schedule).hasSize(12);
        assertThat(schedule.get(0).fieldNames()).toIterable()
            .containsExactlyInAnyOrder("month", "remaining_balance", "monthly_payment");
        assertThat(schedule.get(0).get("remaining_balance").asText()).isEqualTo("1100.00");
        assertThat(schedule.get(11).get("remaining_balance").asText()).isEqualTo("0.00");
        schedule.forEach(row -> assertThat(row.get("monthly_payment").asText()).isEqualTo("100.00"));
    }

    @Test
    @DisplayName("Should validate the summary month")
    void testSummaryMonthValidation() throws Exception {
        String ownerId = createUser("summary-validation");
        String loanId = createLoan(ownerId, "5000.00", "5.0", 24);
        String path = "/api/v1/loans/{loanId}/summary";

        mockMvc.perform(get(path, loanId)).andExpect(status().isBadRequest());
        mockMvc.perform(get(path, loanId).param("month", "-1")).andExpect(status().isBadRequest());
        mockMvc.perform(get(path, loanId).param("month", "25")).andExpect(status().isBadRequest());
        mockMvc.perform(get(path, loanId).param("month", "abc")).andExpect(status().isBadRequest());

        mockMvc.perform(get(path, loanId).param("month", "0"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.current_principal_balance").value("5000.00"))
            .andExpect(jsonPath("$.total_principal_paid").value("0.00"))
            .andExpect(jsonPath("$.total_interest_paid").value("0.00"));
    }

    @ParameterizedTest(name = "{0} at {1}% for {2} months")
    @CsvSource({
        "10000.00,  6.0,  12",
        "12345.67,  4.25, 24",
        "8000.00,   3.2,  60",
        "250000.00, 5.5,  360"
    })
    void testPaymentsBalanceTheBooks(String amount, String rate, int term) throws Exception {
        String ownerId = createUser("books");
        String loanId = createLoan(ownerId, amount, rate, term);

        JsonNode schedule = getJson("/api/v1/loans/{loanId}/schedule", loanId);
        JsonNode summary = getJson("/api/v1/loans/{loanId}/summary?month={month}", loanId, term);

        BigDecimal totalPaid = BigDecimal.ZERO;
        for (JsonNode row : schedule) {
            totalPaid = totalPaid.add(new BigDecimal(row.get("monthly_payment").asText()));
        }
        BigDecimal totalInterest = new BigDecimal(summary.get("total_interest_paid").asText());

        assertThat(totalPaid).isEqualByComparingTo(new BigDecimal(amount).add(totalInterest));
        assertThat(new BigDecimal(summary.get("total_principal_paid").asText())).isEqualByComparingTo(amount);
        assertThat(summary.get("current_principal_balance").asText()).isEqualTo("0.00");
    }

    @Test
    @DisplayName("Should reject loans beyond the configured term limit")
    void testTermLimit() throws Exception {
        String ownerId = createUser("limits");

        mockMvc.perform(post("/api/v1/loans").contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_id\":\"" + ownerId + "\",\"amount\":1000,\"annual_interest_rate\":5,\"loan_term_in_months\":601}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Loan term cannot exceed 600 months"));
    }
}
