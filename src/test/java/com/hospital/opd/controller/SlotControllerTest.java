package com.hospital.opd.controller;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.hospital.opd.component.ConcurrencyController;
import com.hospital.opd.component.OperationRegistry;
import com.hospital.opd.dto.SlotSummary;
import com.hospital.opd.entity.Slot;
import com.hospital.opd.exception.AllocationException;
import com.hospital.opd.service.SlotService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SlotControllerTest {

    @Mock
    private SlotService slotService;

    @Mock
    private ConcurrencyController concurrency;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SlotController(slotService, concurrency))
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(Jackson2ObjectMapperBuilder.json()
                        .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                        .featuresToEnable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                        .build()))
                .build();
    }

    @Test
    void openSlotReturnsCreated() throws Exception {
        when(slotService.openSlot(any())).thenReturn(summary(Slot.Status.ACTIVE));

        mockMvc.perform(post("/api/slots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"slotId":"S1","doctorId":"DOC-1","specialty":"cardiology",
                                 "date":"2030-01-15","startTime":"09:00","endTime":"10:00","maxCapacity":5}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.slotId").value("S1"))
                .andExpect(jsonPath("$.date").value("2030-01-15"));
    }

    @Test
    void statusChangeTakesEnumParameter() throws Exception {
        when(slotService.changeSlotStatus("S1", Slot.Status.SUSPENDED)).thenReturn(summary(Slot.Status.SUSPENDED));

        mockMvc.perform(put("/api/slots/S1/status").param("status", "SUSPENDED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUSPENDED"));
        mockMvc.perform(put("/api/slots/S1/status").param("status", "PAUSED"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
    }

    @Test
    void unknownSlotIsNotFound() throws Exception {
        when(slotService.getSlot("S9")).thenThrow(AllocationException.slotNotFound("S9"));

        mockMvc.perform(get("/api/slots/S9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("SLOT_NOT_FOUND"));
    }

    @Test
    void inFlightOperationsAreListed() throws Exception {
        when(concurrency.inFlightOperations()).thenReturn(List.of(
                new OperationRegistry.InFlightOperation("allocate:S1:P1", Instant.parse("2030-01-15T08:00:00Z"), 120)));

        mockMvc.perform(get("/api/slots/operations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].operationKey").value("allocate:S1:P1"))
                .andExpect(jsonPath("$[0].ageMillis").value(120));
    }

    private static SlotSummary summary(Slot.Status status) {
        return new SlotSummary("S1", "DOC-1", "cardiology", LocalDate.of(2030, 1, 15), LocalTime.of(9, 0),
                LocalTime.of(10, 0), 5, 0, 1, 0, status, 0L);
    }
}
