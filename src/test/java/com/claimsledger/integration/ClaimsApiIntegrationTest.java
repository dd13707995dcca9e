package com.claimsledger.integration;

import com.claimsledger.domain.Claim.ClaimStatus;
import com.claimsledger.domain.ClaimTransaction.TransactionType;
import com.claimsledger.domain.PolicyCoverage;
import com.claimsledger.dto.ImportedTotalsRequest;
import com.claimsledger.dto.RegisterClaimRequest;
import com.claimsledger.dto.StatusChangeRequest;
import com.claimsledger.dto.TransactionRequest;
import com.claimsledger.repository.ClaimTransactionRepository;
import com.claimsledger.repository.PolicyCoverageRepository;
import com.claimsledger.security.JwtTokenProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end claim workflow against the full application context and H2.
 *
 * register → reserve → pay → idempotent repeat → close → guard → reopen,
 * plus an informational claim and the policy roll-up.
 *
 * This verifies:
 * - Liability decided at registration (ACTIVE and INFORMATIONAL)
 * - Gross and share totals recomputed from the stored ledger
 * - Idempotency on referenceId
 * - Lifecycle guard and transition table through real transactions
 * - Role rules on JWT bearer tokens
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class ClaimsApiIntegrationTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private JwtTokenProvider tokenProvider;
    @Autowired private PolicyCoverageRepository policyRepository;
    @Autowired private ClaimTransactionRepository transactionRepository;

    // State shared across test methods (executed in order)
    private static Long policyId;
    private static Long activeClaimId;
    private static Long informationalClaimId;

    private String underwriterToken;
    private String viewerToken;

    @BeforeEach
    void setUp() {
        underwriterToken = tokenProvider.generateToken("underwriter@test", List.of("UNDERWRITER"));
        viewerToken = tokenProvider.generateToken("viewer@test", List.of("VIEWER"));
        if (policyId == null) {
            PolicyCoverage policy = policyRepository.findByPolicyNumber("POL-IT-2024")
                .orElseGet(() -> policyRepository.save(new PolicyCoverage(
                    "POL-IT-2024", "Acme Shipping", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31),
                    "USD", new BigDecimal("0.5"), "occurrence", null, new BigDecimal("20000"))));
            policyId = policy.getId();
        }
    }

    // ── 1. Registration ───────────────────────────────────────────────────────

    @Test
    @Order(1)
    @DisplayName("POST /claims - loss inside the period → ACTIVE")
    void registerActiveClaim() throws Exception {
        MvcResult result = mockMvc.perform(asUnderwriter(post("/claims"))
                .content(json(new RegisterClaimRequest(policyId, "CLM-2024-001", "2024-06-15", "2024-06-20"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.claim.liabilityType").value("ACTIVE"))
                .andExpect(jsonPath("$.claim.liabilityReason").value("Loss occurred within policy period"))
                .andExpect(jsonPath("$.claim.status").value("OPEN"))
                .andExpect(jsonPath("$.claim.createdBy").value("underwriter@test"))
                .andExpect(jsonPath("$.transactions", hasSize(0)))
                .andReturn();

        activeClaimId = objectMapper.readTree(result.getResponse().getContentAsString())
                .get("claim").get("claimId").asLong();
    }

    @Test
    @Order(2)
    @DisplayName("POST /claims - same claim number on the same policy → 409")
    void registerDuplicate() throws Exception {
        mockMvc.perform(asUnderwriter(post("/claims"))
                .content(json(new RegisterClaimRequest(policyId, "CLM-2024-001", "2024-06-16", null))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("DUPLICATE_KEY"));
    }

    @Test
    @Order(3)
    @DisplayName("POST /claims - unknown policy → 404")
    void registerUnknownPolicy() throws Exception {
        mockMvc.perform(asUnderwriter(post("/claims"))
                .content(json(new RegisterClaimRequest(987654L, "CLM-X", "2024-06-15", null))))
                .andExpect(status().isNotFound());
    }

    // ── 2. Ledger ─────────────────────────────────────────────────────────────

    @Test
    @Order(10)
    @DisplayName("POST reserve 10000 at 50% → incurred share 5000")
    void addReserve() throws Exception {
        mockMvc.perform(asUnderwriter(post("/claims/" + activeClaimId + "/transactions"))
                .content(json(new TransactionRequest(TransactionType.RESERVE_SET, new BigDecimal("10000"), "IT-RES-1"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transactions", hasSize(1)))
                .andExpect(jsonPath("$.transactions[0].sharePercent").value(50.0))
                .andExpect(jsonPath("$.transactions[0].currency").value("USD"))
                .andExpect(jsonPath("$.totals.incurredShare").value(5000.0))
                .andExpect(jsonPath("$.totals.outstandingGross").value(10000.0));
    }

    @Test
    @Order(11)
    @DisplayName("POST payment 4000 → paid share 2000, outstanding 6000 gross / 3000 share")
    void addPayment() throws Exception {
        mockMvc.perform(asUnderwriter(post("/claims/" + activeClaimId + "/transactions"))
                .content(json(new TransactionRequest(TransactionType.PAYMENT, new BigDecimal("4000"), "IT-PAY-1"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transactions", hasSize(2)))
                .andExpect(jsonPath("$.totals.paidShare").value(2000.0))
                .andExpect(jsonPath("$.totals.outstandingGross").value(6000.0))
                .andExpect(jsonPath("$.totals.outstandingShare").value(3000.0));
    }

    @Test
    @Order(12)
    @DisplayName("POST same referenceId again → 200, nothing appended")
    void idempotentRepeat() throws Exception {
        mockMvc.perform(asUnderwriter(post("/claims/" + activeClaimId + "/transactions"))
                .content(json(new TransactionRequest(TransactionType.PAYMENT, new BigDecimal("4000"), "IT-PAY-1"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transactions", hasSize(2)))
                .andExpect(jsonPath("$.totals.outstandingGross").value(6000.0));

        assertThat(transactionRepository.countByClaimId(activeClaimId)).isEqualTo(2);
    }

    @Test
    @Order(13)
    @DisplayName("POST share percent 9500 → 400, ledger unchanged")
    void rejectsDoubleScaledShare() throws Exception {
        TransactionRequest request = new TransactionRequest(TransactionType.PAYMENT, new BigDecimal("100"), "IT-PAY-9500");
        request.setSharePercent(new BigDecimal("9500"));

        mockMvc.perform(asUnderwriter(post("/claims/" + activeClaimId + "/transactions"))
                .content(json(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("between 0 and 100")));

        assertThat(transactionRepository.countByClaimId(activeClaimId)).isEqualTo(2);
    }

    @Test
    @Order(14)
    @DisplayName("POST negative payment → 400")
    void rejectsNegativePayment() throws Exception {
        mockMvc.perform(asUnderwriter(post("/claims/" + activeClaimId + "/transactions"))
                .content(json(new TransactionRequest(TransactionType.PAYMENT, new BigDecimal("-50"), "IT-PAY-NEG"))))
                .andExpect(status().isBadRequest());
    }

    // ── 3. Lifecycle ──────────────────────────────────────────────────────────

    @Test
    @Order(20)
    @DisplayName("POST status OPEN → REOPENED → 409 INVALID_TRANSITION")
    void openToReopened() throws Exception {
        mockMvc.perform(asUnderwriter(post("/claims/" + activeClaimId + "/status"))
                .content(json(new StatusChangeRequest(ClaimStatus.REOPENED, true))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INVALID_TRANSITION"));
    }

    @Test
    @Order(21)
    @DisplayName("POST status CLOSED unconfirmed → 400")
    void closeUnconfirmed() throws Exception {
        mockMvc.perform(asUnderwriter(post("/claims/" + activeClaimId + "/status"))
                .content(json(new StatusChangeRequest(ClaimStatus.CLOSED, false))))
                .andExpect(status().isBadRequest());
    }

    @Test
    @Order(22)
    @DisplayName("POST status CLOSED confirmed → 200 with closedDate")
    void close() throws Exception {
        mockMvc.perform(asUnderwriter(post("/claims/" + activeClaimId + "/status"))
                .content(json(new StatusChangeRequest(ClaimStatus.CLOSED, true))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.claim.status").value("CLOSED"))
                .andExpect(jsonPath("$.claim.closedDate").isNotEmpty());
    }

    @Test
    @Order(23)
    @DisplayName("POST payment on a closed claim → 409, totals unchanged")
    void paymentAfterClose() throws Exception {
        mockMvc.perform(asUnderwriter(post("/claims/" + activeClaimId + "/transactions"))
                .content(json(new TransactionRequest(TransactionType.PAYMENT, new BigDecimal("3000"), "IT-PAY-2"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INVALID_OPERATION"))
                .andExpect(jsonPath("$.message").value(containsString("claim is not open")));

        mockMvc.perform(get("/claims/" + activeClaimId).header("Authorization", "Bearer " + viewerToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transactions", hasSize(2)))
                .andExpect(jsonPath("$.totals.outstandingGross").value(6000.0))
                .andExpect(jsonPath("$.totals.outstandingShare").value(3000.0));
    }

    @Test
    @Order(24)
    @DisplayName("POST status REOPENED then payment 500 → outstanding 5500")
    void reopenAndPay() throws Exception {
        mockMvc.perform(asUnderwriter(post("/claims/" + activeClaimId + "/status"))
                .content(json(new StatusChangeRequest(ClaimStatus.REOPENED, true))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.claim.status").value("REOPENED"))
                .andExpect(jsonPath("$.claim.closedDate").doesNotExist());

        mockMvc.perform(asUnderwriter(post("/claims/" + activeClaimId + "/transactions"))
                .content(json(new TransactionRequest(TransactionType.PAYMENT, new BigDecimal("500"), "IT-PAY-3"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totals.outstandingGross").value(5500.0))
                .andExpect(jsonPath("$.totals.outstandingShare").value(2750.0));
    }

    // ── 4. Informational claim ────────────────────────────────────────────────

    @Test
    @Order(30)
    @DisplayName("POST /claims - loss after expiry → INFORMATIONAL")
    void registerInformationalClaim() throws Exception {
        MvcResult result = mockMvc.perform(asUnderwriter(post("/claims"))
                .content(json(new RegisterClaimRequest(policyId, "CLM-2025-001", "2025-01-10", "2025-01-12"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.claim.liabilityType").value("INFORMATIONAL"))
                .andExpect(jsonPath("$.claim.liabilityReason")
                        .value("Loss date outside period (2024-01-01 to 2024-12-31)"))
                .andReturn();

        informationalClaimId = objectMapper.readTree(result.getResponse().getContentAsString())
                .get("claim").get("claimId").asLong();
    }

    @Test
    @Order(31)
    @DisplayName("POST reserve on an informational claim → 409")
    void informationalRejectsReserve() throws Exception {
        mockMvc.perform(asUnderwriter(post("/claims/" + informationalClaimId + "/transactions"))
                .content(json(new TransactionRequest(TransactionType.RESERVE_SET, new BigDecimal("10000"), "IT-RES-INFO"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value(containsString("informational-only")));
    }

    @Test
    @Order(32)
    @DisplayName("POST imported totals on the informational claim → 200")
    void importedTotals() throws Exception {
        mockMvc.perform(asUnderwriter(post("/claims/" + informationalClaimId + "/imported-totals"))
                .content(json(new ImportedTotalsRequest(new BigDecimal("8000"), new BigDecimal("2500")))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.claim.importedTotalIncurred").value(8000.0))
                .andExpect(jsonPath("$.transactions", hasSize(0)));
    }

    // ── 5. Read models ────────────────────────────────────────────────────────

    @Test
    @Order(40)
    @DisplayName("GET /policies/{id}/claims-summary → burning cost and loss ratio")
    void policySummary() throws Exception {
        mockMvc.perform(get("/policies/" + policyId + "/claims-summary")
                .header("Authorization", "Bearer " + viewerToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.insuredName").value("Acme Shipping"))
                .andExpect(jsonPath("$.activeClaims").value(1))
                .andExpect(jsonPath("$.informationalClaims").value(1))
                .andExpect(jsonPath("$.activeTotals.incurredGross").value(10000.0))
                .andExpect(jsonPath("$.importedIncurred").value(8000.0))
                .andExpect(jsonPath("$.burningCost").value(18000.0))
                .andExpect(jsonPath("$.lossRatio").value(0.25));
    }

    @Test
    @Order(41)
    @DisplayName("GET /claims filtered by liability and search term")
    void listClaims() throws Exception {
        mockMvc.perform(get("/claims")
                .param("policyId", policyId.toString())
                .param("liabilityType", "ACTIVE")
                .header("Authorization", "Bearer " + viewerToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(1))
                .andExpect(jsonPath("$.content[0].claim.claimNumber").value("CLM-2024-001"))
                .andExpect(jsonPath("$.pageTotals.outstandingGross").value(5500.0));

        mockMvc.perform(get("/claims")
                .param("search", "clm-2025")
                .header("Authorization", "Bearer " + viewerToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content", hasSize(1)))
                .andExpect(jsonPath("$.content[0].claim.liabilityType").value("INFORMATIONAL"));

        // wildcards in the search text are literal
        mockMvc.perform(get("/claims")
                .param("search", "clm_2024")
                .header("Authorization", "Bearer " + viewerToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(0));

        mockMvc.perform(get("/claims")
                .param("search", "clm%001")
                .header("Authorization", "Bearer " + viewerToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(0));
    }

    @Test
    @Order(42)
    @DisplayName("GET /claims/{id}/transactions → newest first")
    void ledgerNewestFirst() throws Exception {
        mockMvc.perform(get("/claims/" + activeClaimId + "/transactions")
                .header("Authorization", "Bearer " + viewerToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(3)))
                .andExpect(jsonPath("$[0].referenceId").value("IT-PAY-3"))
                .andExpect(jsonPath("$[2].referenceId").value("IT-RES-1"));
    }

    // ── 6. Access rules ───────────────────────────────────────────────────────

    @Test
    @Order(50)
    @DisplayName("POST /claims as VIEWER → 403")
    void viewerCannotRegister() throws Exception {
        mockMvc.perform(post("/claims")
                .header("Authorization", "Bearer " + viewerToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(new RegisterClaimRequest(policyId, "CLM-VIEWER", "2024-06-15", null))))
                .andExpect(status().isForbidden());
    }

    @Test
    @Order(51)
    @DisplayName("GET /claims without a token → 401; GET /health is public")
    void anonymous() throws Exception {
        mockMvc.perform(get("/claims/" + activeClaimId))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    @Order(52)
    @DisplayName("GET /claims with a tampered token → 401")
    void tamperedToken() throws Exception {
        mockMvc.perform(get("/claims").header("Authorization", "Bearer " + flipSignatureChar(underwriterToken)))
                .andExpect(status().isUnauthorized());
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private MockHttpServletRequestBuilder asUnderwriter(MockHttpServletRequestBuilder builder) {
        return builder
                .header("Authorization", "Bearer " + underwriterToken)
                .contentType(MediaType.APPLICATION_JSON);
    }

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    private static String flipSignatureChar(String token) {
        int i = token.lastIndexOf('.') + 5;
        char replacement = token.charAt(i) == 'A' ? 'B' : 'A';
        return token.substring(0, i) + replacement + token.substring(i + 1);
    }
}
