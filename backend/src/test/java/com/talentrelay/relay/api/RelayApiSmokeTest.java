package com.talentrelay.relay.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.emptyString;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class RelayApiSmokeTest {
    private static final String TOKEN = "test-shared-token";

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private RelayRequestFilter requestFilter;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).addFilters(requestFilter).build();
    }

    @Test
    void healthNeedsNoToken() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ok").value(true))
            .andExpect(header().string(RelayRequestFilter.REQUEST_ID_HEADER, not(emptyString())));
    }

    @Test
    void apiRoutesRejectMissingOrWrongToken() throws Exception {
        mockMvc.perform(post("/api/ashby/index/status").header(RelayRequestFilter.REQUEST_ID_HEADER, "req-401"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.ok").value(false))
            .andExpect(jsonPath("$.error").value("Unauthorized"))
            .andExpect(jsonPath("$.requestId").value("req-401"));

        mockMvc.perform(post("/api/ashby/index/status").header(RelayRequestFilter.BACKEND_TOKEN_HEADER, "nope"))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void indexStatusReportsUnbuiltIndex() throws Exception {
        mockMvc.perform(post("/api/ashby/index/status")
                .header(RelayRequestFilter.BACKEND_TOKEN_HEADER, TOKEN)
                .header(RelayRequestFilter.REQUEST_ID_HEADER, "req-status"))
            .andExpect(status().isOk())
            .andExpect(header().string(RelayRequestFilter.REQUEST_ID_HEADER, "req-status"))
            .andExpect(jsonPath("$.ok").value(true))
            .andExpect(jsonPath("$.requestId").value("req-status"))
            .andExpect(jsonPath("$.data.candidateCount").value(0))
            .andExpect(jsonPath("$.data.refreshInFlight").value(false));
    }

    @Test
    void lookupWithoutLinkedInReferenceIsValidationError() throws Exception {
        mockMvc.perform(post("/api/ashby/candidates/lookup-by-linkedin")
                .header(RelayRequestFilter.BACKEND_TOKEN_HEADER, TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.ok").value(false))
            .andExpect(jsonPath("$.error").value(containsString("linkedInUrl or linkedInHandle")))
            .andExpect(jsonPath("$.requestId").isNotEmpty());
    }

    @Test
    void malformedBodyIsRejected() throws Exception {
        mockMvc.perform(post("/api/ashby/candidates/upload-to-job")
                .header(RelayRequestFilter.BACKEND_TOKEN_HEADER, TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("[not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Request body must be a JSON object."));
    }

    @Test
    void uploadWithoutCandidateIsValidationError() throws Exception {
        mockMvc.perform(post("/api/ashby/candidates/upload-to-job")
                .header(RelayRequestFilter.BACKEND_TOKEN_HEADER, TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"jobId\":\"job-1\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.ok").value(false))
            .andExpect(jsonPath("$.error").value("gemCandidateId is required."));
    }
}
