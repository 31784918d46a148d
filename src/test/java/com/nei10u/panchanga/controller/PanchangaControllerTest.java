package com.nei10u.panchanga.controller;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.matchesPattern;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ExtendWith(OutputCaptureExtension.class)
class PanchangaControllerTest {

    @Autowired
    private MockMvc mockMvc;

    private static final String DELHI = """
            {"year":2024,"month":1,"day":15,"hour":10,"minute":30,
             "latitude":28.6139,"longitude":77.2090%s}
            """;

    @Test
    void computesPanchanga() throws Exception {
        mockMvc.perform(post("/api/panchanga/compute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DELHI.formatted(",\"timezone\":\"Asia/Kolkata\"")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tithi.number").value(5))
                .andExpect(jsonPath("$.nakshatra.number").value(25))
                .andExpect(jsonPath("$.karana.karana.name").value("Bava"))
                .andExpect(jsonPath("$.vara.name").value("Monday"))
                .andExpect(jsonPath("$.siderealMode").value("LAHIRI"));
    }

    @Test
    void serializesNamesTimesAndEnums() throws Exception {
        mockMvc.perform(post("/api/panchanga/compute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DELHI.formatted("")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tithi.tithi.name").value("Panchami"))
                .andExpect(jsonPath("$.paksha").value("Shukla Paksha"))
                .andExpect(jsonPath("$.vara.lord").value("Moon"))
                .andExpect(jsonPath("$.sunriseTime").value(matchesPattern("\\d{2}:\\d{2}:\\d{2}")))
                .andExpect(jsonPath("$.moonrise").value(matchesPattern("\\d{1,2}:\\d{2}:\\d{2} AM")))
                .andExpect(jsonPath("$.sunriseFallback").value(false));
    }

    @Test
    void logsRequestIdAroundCompute(CapturedOutput output) throws Exception {
        mockMvc.perform(post("/api/panchanga/compute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DELHI.formatted(",\"requestId\":\"rid-42\"")))
                .andExpect(status().isOk());
        assertTrue(output.getOut().contains("[rid-42] compute start"));
        assertTrue(output.getOut().contains("[rid-42] compute done"));
    }

    @Test
    void unknownTimezoneIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/panchanga/compute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DELHI.formatted(",\"timezone\":\"Mars/Base\"")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_TIMEZONE"));
    }

    @Test
    void missingLatitudeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/panchanga/compute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"year\":2024,\"month\":1,\"day\":15,\"longitude\":77.2}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }
}
