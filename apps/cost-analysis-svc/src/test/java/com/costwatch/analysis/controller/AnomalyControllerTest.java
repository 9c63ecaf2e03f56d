package com.costwatch.analysis.controller;

import static com.costwatch.analysis.controller.RequestBodies.records;
import static org.hamcrest.Matchers.hasItems;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AnomalyControllerTest {

    private static final double[] SPIKE = {100, 105, 95, 102, 1000, 98, 101};

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @Test
    void detectFindsTheSpike() throws Exception {
        String body = objectMapper.writeValueAsString(Map.of("records", records("compute", SPIKE)));

        mockMvc.perform(post("/anomalies/detect")
                        .header("X-Request-Trace", "trace-123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Trace", "trace-123"))
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.traceId").value("trace-123"))
                .andExpect(jsonPath("$.anomalies[0].date").value("2024-01-05"))
                .andExpect(jsonPath("$.anomalies[0].severity").value("critical"))
                .andExpect(jsonPath("$.anomalies[0].algorithms", hasItems("zscore", "iqr")));
    }

    @Test
    void nullRecordsInPerServiceRequestAreIgnored() throws Exception {
        List<Map<String, Object>> all = new ArrayList<>();
        all.add(null);
        all.addAll(records("compute", SPIKE));
        Map<String, Object> request = new HashMap<>();
        request.put("records", all);
        request.put("perService", true);

        mockMvc.perform(post("/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.anomalies[0].label").value("compute"));
    }

    @Test
    void shortSeriesYieldsNoAnomalies() throws Exception {
        String body = objectMapper.writeValueAsString(Map.of("records", records("compute", 100, 105, 95)));

        mockMvc.perform(post("/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0))
                .andExpect(header().exists("X-Request-Trace"));
    }

    @Test
    void reportSummarisesPerServiceFindings() throws Exception {
        List<Map<String, Object>> all = new ArrayList<>(records("compute", SPIKE));
        all.addAll(records("storage", 50, 50, 50, 50, 50, 50, 50));
        String body = objectMapper.writeValueAsString(Map.of("records", all));

        mockMvc.perform(post("/anomalies/report")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAnomalies").value(1))
                .andExpect(jsonPath("$.severityBreakdown.high").value(1))
                .andExpect(jsonPath("$.topServices[0].service").value("compute"))
                .andExpect(jsonPath("$.recommendations[0].type").value("immediate_action"));
    }

    @Test
    void invalidThresholdIsAValidationError() throws Exception {
        String body = objectMapper.writeValueAsString(Map.of(
                "records", records("compute", SPIKE),
                "options", Map.of("threshold", -1)));

        mockMvc.perform(post("/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void unparseableDateIsRejected() throws Exception {
        String body = objectMapper.writeValueAsString(Map.of(
                "records", List.of(Map.of("date", "yesterday", "service", "compute", "amount", 10))));

        mockMvc.perform(post("/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void unknownAlgorithmIsRejected() throws Exception {
        String body = objectMapper.writeValueAsString(Map.of(
                "records", records("compute", SPIKE),
                "options", Map.of("algorithms", List.of("fourier"))));

        mockMvc.perform(post("/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest());
    }
}
