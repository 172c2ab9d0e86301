package com.RxLedger.rx_backend.controller;

import com.RxLedger.rx_backend.enums.PrescriptionStatus;
import com.RxLedger.rx_backend.model.IntegrityAlert;
import com.RxLedger.rx_backend.model.Prescription;
import com.RxLedger.rx_backend.repository.IntegrityAlertRepository;
import com.RxLedger.rx_backend.repository.PrescriptionRepository;
import com.RxLedger.rx_backend.service.ExpirySweepService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.httpBasic;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class PrescriptionFlowIntegrationTest {

    private static final String DOCTOR = "0x1111111111111111111111111111111111111111";
    private static final String PHARMACY = "0x2222222222222222222222222222222222222222";
    private static final String OTHER_DOCTOR = "0x4444444444444444444444444444444444444444";

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private ObjectMapper objectMapper;
    @Autowired
    private PrescriptionRepository prescriptionRepository;
    @Autowired
    private IntegrityAlertRepository integrityAlertRepository;
    @Autowired
    private ExpirySweepService expirySweepService;
    @Autowired
    private TransactionTemplate transactionTemplate;

    private static final String ISSUE_BODY = """
            {
              "doctorAddress": "%s",
              "patientName": "%s",
              "patientAge": "42",
              "diagnosis": "Otitis media",
              "maxUsage": %d,
              "items": [
                {"name": "Ibuprofen", "dosage": "200mg", "quantity": "10", "instructions": "with food"},
                {"name": "Amoxicillin", "dosage": "500mg", "quantity": "21"}
              ]
            }
            """;

    private static final String DISPENSE_BODY = "{\"pharmacyAddress\": \"" + PHARMACY + "\"}";

    @BeforeEach
    void clearStore() {
        integrityAlertRepository.deleteAll();
        prescriptionRepository.deleteAll();
    }

    private String issue(String patientName, int maxUsage) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/prescriptions")
                        .with(httpBasic("doctor", "doctor-pass"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(ISSUE_BODY, DOCTOR, patientName, maxUsage)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.status").value("ACTIVE"))
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.path("data").path("blockchainId").asText();
    }

    @Test
    void issueThenDispenseOnceThenSecondDispenseIsRejected() throws Exception {
        String code = issue("Jane Doe", 1);

        mockMvc.perform(post("/api/prescriptions/{id}/validate-dispense", code)
                        .with(httpBasic("pharmacy", "pharmacy-pass"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DISPENSE_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.valid").value(true))
                .andExpect(jsonPath("$.data.hashIntegrity.medMatch").value(true));

        mockMvc.perform(post("/api/prescriptions/{id}/dispense", code)
                        .with(httpBasic("pharmacy", "pharmacy-pass"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DISPENSE_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("USED"))
                .andExpect(jsonPath("$.data.usageCount").value(1))
                .andExpect(jsonPath("$.data.remainingUsage").value(0));

        mockMvc.perform(post("/api/prescriptions/{id}/dispense", code)
                        .with(httpBasic("pharmacy", "pharmacy-pass"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DISPENSE_BODY))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("STATUS_MISMATCH"))
                .andExpect(jsonPath("$.retryable").value(false))
                .andExpect(jsonPath("$.details.actual").value("USED"));

        mockMvc.perform(get("/api/ledger/prescriptions/{id}", code)
                        .with(httpBasic("admin", "admin-pass")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("USED"))
                .andExpect(jsonPath("$.data.usageCount").value(1));
    }

    @Test
    void offChainEditIsCaughtAsHashMismatchAndRaisesAlert() throws Exception {
        String code = issue("John Roe", 1);

        transactionTemplate.executeWithoutResult(tx -> {
            Prescription prescription = prescriptionRepository.findByBlockchainId(code).orElseThrow();
            prescription.getItems().get(1).setQuantity(42L);
            prescriptionRepository.save(prescription);
        });

        mockMvc.perform(post("/api/prescriptions/{id}/dispense", code)
                        .with(httpBasic("pharmacy", "pharmacy-pass"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DISPENSE_BODY))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("HASH_MISMATCH"))
                .andExpect(jsonPath("$.details.patientMatch").value(true))
                .andExpect(jsonPath("$.details.medMatch").value(false));

        List<IntegrityAlert> alerts = integrityAlertRepository.findByBlockchainId(code);
        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).getActorAddress()).isEqualTo(PHARMACY);
        assertThat(prescriptionRepository.findByBlockchainId(code).orElseThrow().getStatus().name()).isEqualTo("ACTIVE");

        mockMvc.perform(get("/api/integrity-alerts").with(httpBasic("admin", "admin-pass")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].blockchainId").value(code));
    }

    @Test
    void boundLedgerAddressIsUsedWhenRequestOmitsIt() throws Exception {
        MvcResult issued = mockMvc.perform(post("/api/prescriptions")
                        .with(httpBasic("doctor", "doctor-pass"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "patientName": "Ann Lee",
                                  "patientAge": "30",
                                  "items": [{"name": "Cetirizine", "dosage": "10mg", "quantity": "14"}]
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.doctorAddress").value(DOCTOR))
                .andReturn();
        String code = objectMapper.readTree(issued.getResponse().getContentAsString())
                .path("data").path("blockchainId").asText();

        mockMvc.perform(post("/api/prescriptions/{id}/dispense", code)
                        .with(httpBasic("pharmacy", "pharmacy-pass")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("USED"))
                .andExpect(jsonPath("$.data.pharmacyAddress").value(PHARMACY));
    }

    @Test
    void callersCannotActAsAnotherLedgerAccount() throws Exception {
        mockMvc.perform(post("/api/prescriptions")
                        .with(httpBasic("doctor", "doctor-pass"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(ISSUE_BODY, OTHER_DOCTOR, "Jane Doe", 1)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("ADDRESS_MISMATCH"));
        assertThat(prescriptionRepository.count()).isZero();

        String code = issue("Jane Doe", 1);

        mockMvc.perform(post("/api/prescriptions/{id}/dispense", code)
                        .with(httpBasic("other-pharmacy", "other-pass"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DISPENSE_BODY))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("ADDRESS_MISMATCH"));

        Prescription stored = prescriptionRepository.findByBlockchainId(code).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(PrescriptionStatus.ACTIVE);
        assertThat(stored.getUsageCount()).isZero();
        mockMvc.perform(get("/api/ledger/prescriptions/{id}", code)
                        .with(httpBasic("admin", "admin-pass")))
                .andExpect(jsonPath("$.data.usageCount").value(0));
    }

    @Test
    void staleDispenseReceiptNeverOverwritesLaterState() throws Exception {
        String code = issue("Jane Doe", 2);
        for (int i = 0; i < 2; i++) {
            mockMvc.perform(post("/api/prescriptions/{id}/dispense", code)
                            .with(httpBasic("pharmacy", "pharmacy-pass"))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(DISPENSE_BODY))
                    .andExpect(status().isOk());
        }

        // the first receipt (one usage left) arriving after the second one was stored
        Integer applied = transactionTemplate.execute(tx -> prescriptionRepository.recordDispense(code,
                PrescriptionStatus.DISPENSED, PrescriptionStatus.sourcesOf(PrescriptionStatus.DISPENSED),
                1L, LocalDateTime.now(), PHARMACY, "0xstale"));

        assertThat(applied).isZero();
        Prescription stored = prescriptionRepository.findByBlockchainId(code).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(PrescriptionStatus.USED);
        assertThat(stored.getUsageCount()).isEqualTo(2);
        assertThat(stored.getConfirmedTxHash()).isNotEqualTo("0xstale");
    }

    @Test
    void unknownPrescriptionIsNotFound() throws Exception {
        mockMvc.perform(get("/api/prescriptions/{id}", "ZZZZZZ")
                        .with(httpBasic("pharmacy", "pharmacy-pass")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("RESOURCE_NOT_FOUND"));
    }

    @Test
    void rolesAreEnforced() throws Exception {
        mockMvc.perform(post("/api/prescriptions")
                        .with(httpBasic("pharmacy", "pharmacy-pass"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(ISSUE_BODY, DOCTOR, "Jane Doe", 1)))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/api/ledger/reconcile").with(httpBasic("pharmacy", "pharmacy-pass")))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/prescriptions/{id}", "ZZZZZZ"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void invalidIssueRequestIsRejected() throws Exception {
        mockMvc.perform(post("/api/prescriptions")
                        .with(httpBasic("doctor", "doctor-pass"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"doctorAddress\": \"not-an-address\", \"patientName\": \"\", \"items\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.errors.doctorAddress").exists());
    }

    @Test
    void reconciliationReportsIssuedRecordsAsMatching() throws Exception {
        issue("Jane Doe", 2);

        mockMvc.perform(post("/api/ledger/reconcile").with(httpBasic("admin", "admin-pass")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.total").value(1))
                .andExpect(jsonPath("$.data.matchCount").value(1));
    }

    @Test
    void sweepLeavesUnexpiredRecordsAlone() throws Exception {
        String code = issue("Jane Doe", 1);

        assertThat(expirySweepService.markExpiredPrescriptions()).isZero();
        assertThat(prescriptionRepository.findByBlockchainId(code).orElseThrow().getStatus().name()).isEqualTo("ACTIVE");
    }
}
