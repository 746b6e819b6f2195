package com.lihtcmate.backend.modules.rentroll;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lihtcmate.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

/**
 * A household verified on a hand-entered future lease, carried through two rent-roll uploads.
 */
@SpringBootTest
@AutoConfigureMockMvc
class FutureLeaseInheritanceIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String UNIT_205_ROW = """
            "205": [
              {"leaseStartDate": "2025-06-01", "leaseEndDate": "2026-05-31", "leaseRent": 1200.00,
               "residents": [{"name": "Gia Moreno", "annualizedIncome": 41000.00}]}
            ]
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private UUID propertyId;
    private UUID futureLeaseId;
    private UUID futureResidentId;

    @BeforeEach
    void setUp() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/properties")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Mesa Verde Apartments", "county": "Maricopa", "state": "AZ"}
                                """))
                .andExpect(status().isCreated())
                .andReturn();
        propertyId = UUID.fromString(readJson(created).path("id").asText());

        MvcResult units = mockMvc.perform(post("/api/properties/%s/units".formatted(propertyId))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"units": [{"unitNumber": "205", "bedroomCount": 2}]}
                                """))
                .andExpect(status().isOk())
                .andReturn();
        UUID unitId = UUID.fromString(readJson(units).path("units").get(0).path("id").asText());

        MvcResult lease = mockMvc.perform(post("/api/units/%s/future-leases".formatted(unitId))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Gia Moreno", "residents": [{"name": "Gia Moreno"}]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.snapshotId").doesNotExist())
                .andReturn();
        JsonNode leaseJson = readJson(lease);
        futureLeaseId = UUID.fromString(leaseJson.path("id").asText());
        futureResidentId = UUID.fromString(leaseJson.path("residents").get(0).path("id").asText());

        MvcResult verification = mockMvc.perform(post("/api/leases/%s/verifications".formatted(futureLeaseId))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"reason": "INITIAL_LEASE"}
                                """))
                .andExpect(status().isOk())
                .andReturn();
        UUID verificationId = UUID.fromString(readJson(verification).path("id").asText());

        mockMvc.perform(post("/api/verifications/%s/residents/%s/finalize".formatted(verificationId, futureResidentId))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"verifiedIncome": 42000.00}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.verificationFinalized").value(true));
    }

    @Test
    @DisplayName("a dated upload row for the unit is offered the verified future lease")
    void finalize_offersVerifiedFutureLease() throws Exception {
        finalizeUpload("2025-01-31", UNIT_205_ROW)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.futureLeasesPreserved").value(1))
                .andExpect(jsonPath("$.futureLeaseMatches.length()").value(1))
                .andExpect(jsonPath("$.futureLeaseMatches[0].unitNumber").value("205"))
                .andExpect(jsonPath("$.futureLeaseMatches[0].newLeaseStartDate").value("2025-06-01"))
                .andExpect(jsonPath("$.futureLeaseMatches[0].existingFutureLease.residents[0].name").value("Gia Moreno"))
                .andExpect(jsonPath("$.futureLeaseMatches[0].existingFutureLease.residents[0].verifiedIncome").value(42000.00));

        Integer leasesOfUnit = jdbcTemplate.queryForObject("""
                SELECT COUNT(*) FROM lease l JOIN unit u ON u.id = l.unit_id
                WHERE u.property_id = ? AND u.unit_number = '205'
                """, Integer.class, propertyId);
        // the hand-entered original, its copy and the uploaded lease
        assertThat(leasesOfUnit).isEqualTo(3);
    }

    @Test
    @DisplayName("the hand-entered original is copied forward only once")
    void finalize_copiesManualLeaseOnce() throws Exception {
        finalizeUpload("2025-01-31", UNIT_205_ROW).andExpect(status().isOk());

        finalizeUpload("2025-06-30", UNIT_205_ROW)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.futureLeasesPreserved").value(2))
                .andExpect(jsonPath("$.futureLeaseMatches.length()").value(1));

        Integer copiesOfVerifiedResident = jdbcTemplate.queryForObject("""
                SELECT COUNT(*) FROM resident r
                JOIN lease l ON l.id = r.lease_id
                JOIN unit u ON u.id = l.unit_id
                WHERE u.property_id = ? AND r.name = 'Gia Moreno' AND r.income_finalized
                """, Integer.class, propertyId);
        // original plus one copy per upload
        assertThat(copiesOfVerifiedResident).isEqualTo(3);
    }

    @Test
    @DisplayName("accepting the inheritance finalizes the uploaded lease with the verified income")
    void resolveInheritance_carriesVerifiedIncome() throws Exception {
        MvcResult finalized = finalizeUpload("2025-01-31", UNIT_205_ROW)
                .andExpect(status().isOk())
                .andReturn();
        String newLeaseId = readJson(finalized).path("futureLeaseMatches").get(0).path("newLeaseId").asText();

        mockMvc.perform(post("/api/properties/%s/compliance/inheritance".formatted(propertyId))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"decisions": {"205": {"inherit": true, "newLeaseId": "%s"}}}
                                """.formatted(newLeaseId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.units[0].inherited").value(true))
                .andExpect(jsonPath("$.units[0].newLeaseId").value(newLeaseId))
                .andExpect(jsonPath("$.units[0].residentsInherited").value(1));

        Boolean finalizedResident = jdbcTemplate.queryForObject(
                "SELECT income_finalized FROM resident WHERE lease_id = ?", Boolean.class, UUID.fromString(newLeaseId));
        assertThat(finalizedResident).isTrue();
    }

    private ResultActions finalizeUpload(String rentRollDate, String unitGroups) throws Exception {
        return mockMvc.perform(post("/api/properties/%s/compliance/finalize".formatted(propertyId))
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"rentRollDate": "%s", "unitGroups": {%s}}
                        """.formatted(rentRollDate, unitGroups)));
    }

    private JsonNode readJson(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
