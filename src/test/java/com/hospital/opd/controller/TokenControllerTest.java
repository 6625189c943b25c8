package com.hospital.opd.controller;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.hospital.opd.dto.AllocationOutcome;
import com.hospital.opd.dto.AllocationRequest;
import com.hospital.opd.dto.CancelRequest;
import com.hospital.opd.dto.RecommendedAction;
import com.hospital.opd.dto.TokenView;
import com.hospital.opd.entity.AllocationMethod;
import com.hospital.opd.entity.TokenMetadata;
import com.hospital.opd.entity.TokenSource;
import com.hospital.opd.entity.TokenStatus;
import com.hospital.opd.exception.AllocationException;
import com.hospital.opd.exception.ErrorCode;
import com.hospital.opd.service.ReallocationService;
import com.hospital.opd.service.TokenAllocationService;
import com.hospital.opd.service.TokenLifecycleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class TokenControllerTest {

    @Mock
    private TokenAllocationService allocationService;

    @Mock
    private TokenLifecycleService lifecycleService;

    @Mock
    private ReallocationService reallocationService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new TokenController(allocationService, lifecycleService, reallocationService))
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(Jackson2ObjectMapperBuilder.json()
                        .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                        .featuresToEnable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                        .build()))
                .build();
    }

    @Test
    void allocatedTokenIsCreated() throws Exception {
        when(allocationService.allocateToken(any())).thenReturn(
                new AllocationOutcome.Allocated(token("TKN-1", TokenStatus.ALLOCATED), AllocationMethod.DIRECT, List.of()));

        mockMvc.perform(post("/api/tokens")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"patientId":"P1","slotId":"S1","source":"online",
                                 "patientInfo":{"age":30,"isFollowup":false}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.outcome").value("ALLOCATED"))
                .andExpect(jsonPath("$.token.tokenId").value("TKN-1"))
                .andExpect(jsonPath("$.allocationMethod").value("DIRECT"));

        ArgumentCaptor<AllocationRequest> captor = ArgumentCaptor.forClass(AllocationRequest.class);
        verify(allocationService).allocateToken(captor.capture());
        assertThat(captor.getValue().getPatientId()).isEqualTo("P1");
        assertThat(captor.getValue().getPatientInfo().getAge()).isEqualTo(30);
    }

    @Test
    void rejectionCarriesErrorCodeStatus() throws Exception {
        when(allocationService.allocateToken(any())).thenReturn(new AllocationOutcome.Rejected(
                ErrorCode.SLOT_NOT_FOUND, "Time slot not found", Map.of("slotId", "S9"), List.of()));

        mockMvc.perform(post("/api/tokens")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"patientId\":\"P1\",\"slotId\":\"S9\",\"source\":\"online\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.outcome").value("REJECTED"))
                .andExpect(jsonPath("$.errorCode").value("SLOT_NOT_FOUND"))
                .andExpect(jsonPath("$.details.slotId").value("S9"));
    }

    @Test
    void alternativesAreOk() throws Exception {
        when(allocationService.emergencyInsertion(any())).thenReturn(new AllocationOutcome.Alternatives(
                null, List.of(), RecommendedAction.NO_ALTERNATIVES, List.of("No alternative slots are available")));

        mockMvc.perform(post("/api/tokens/emergency")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"patientId\":\"P1\",\"doctorId\":\"DOC-1\",\"urgencyLevel\":\"HIGH\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("ALTERNATIVES"))
                .andExpect(jsonPath("$.recommendedAction").value("NO_ALTERNATIVES"));
    }

    @Test
    void lifecycleErrorsMapToHttpStatus() throws Exception {
        when(lifecycleService.cancel(eq("TKN-1"), any(CancelRequest.class)))
                .thenThrow(new AllocationException(ErrorCode.TOKEN_ALREADY_PROCESSED, "Token TKN-1 is COMPLETED"));

        mockMvc.perform(post("/api/tokens/TKN-1/cancel")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"PATIENT_REQUEST\",\"cancelledBy\":\"P1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("TOKEN_ALREADY_PROCESSED"))
                .andExpect(jsonPath("$.category").value("BUSINESS_LOGIC"));
    }

    @Test
    void confirmWithoutBody() throws Exception {
        when(lifecycleService.confirm("TKN-1", null)).thenReturn(token("TKN-1", TokenStatus.CONFIRMED));

        mockMvc.perform(post("/api/tokens/TKN-1/confirm"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CONFIRMED"));
    }

    @Test
    void malformedBodyIsValidationError() throws Exception {
        mockMvc.perform(post("/api/tokens")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));

        verifyNoInteractions(allocationService);
    }

    @Test
    void patientTokensRequirePatientId() throws Exception {
        mockMvc.perform(get("/api/tokens"))
                .andExpect(status().isBadRequest());

        when(lifecycleService.tokensForPatient("P1")).thenReturn(List.of(token("TKN-1", TokenStatus.ALLOCATED)));
        mockMvc.perform(get("/api/tokens").param("patientId", "P1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].tokenId").value("TKN-1"));
    }

    private static TokenView token(String tokenId, TokenStatus status) {
        Instant now = Instant.parse("2030-01-15T08:00:00Z");
        return new TokenView(tokenId, "P1", "DOC-1", "S1", 1, TokenSource.ONLINE, 400, status,
                new TokenMetadata(), now, now, 0L);
    }
}
