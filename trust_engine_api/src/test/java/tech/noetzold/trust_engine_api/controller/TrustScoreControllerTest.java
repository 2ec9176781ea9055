package tech.noetzold.trust_engine_api.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import tech.noetzold.trust_engine_api.exception.ConfigurationException;
import tech.noetzold.trust_engine_api.exception.StaleSnapshotException;
import tech.noetzold.trust_engine_api.service.TrustScoreService;

import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class TrustScoreControllerTest {

    @Mock private TrustScoreService trustScoreService;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new TrustScoreController(trustScoreService))
                .setControllerAdvice(new ErrorHandler())
                .build();
    }

    @Test
    void supersededMappingVersionIsAConflict() throws Exception {
        when(trustScoreService.getTrustScore("acme", 3L)).thenThrow(new StaleSnapshotException(3, 4));

        mvc.perform(get("/organizations/acme/trust-score").param("mapping_version", "3"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("STALE_SNAPSHOT"))
                .andExpect(jsonPath("$.current_mapping_version").value(4));
    }

    @Test
    void zeroWeightsAreAConfigurationError() throws Exception {
        when(trustScoreService.updateFrameworkWeights(eq("acme"), anyMap()))
                .thenThrow(new ConfigurationException("At least one framework weight must be positive"));

        mvc.perform(put("/organizations/acme/framework-weights")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"weights\": {\"SOC2\": 0}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("CONFIGURATION_ERROR"));
    }
}
