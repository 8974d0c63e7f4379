package com.stockneuro.backend.controller;

import com.stockneuro.backend.util.TestSeriesFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ForecastingApiTest {

    @Autowired
    private MockMvc mockMvc;

    @BeforeAll
    static void writePriceHistory() throws IOException {
        Path dataDir = Paths.get(System.getProperty("java.io.tmpdir"), "stockneuro-test-prices");
        Files.createDirectories(dataDir);
        double[] closes = TestSeriesFactory.sineCloses(300, 50.0, 4.0);
        List<LocalDate> dates = TestSeriesFactory.tradingDates(closes.length);
        List<String> lines = new ArrayList<>();
        lines.add("date,close");
        for (int i = 0; i < closes.length; i++) {
            lines.add(dates.get(i) + "," + closes[i]);
        }
        Files.write(dataDir.resolve("APITEST.csv"), lines, StandardCharsets.UTF_8);
    }

    @Test
    void trainThenForecastWithIntervals() throws Exception {
        mockMvc.perform(post("/api/models/ZERO_SHOT/train")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ticker\":\"APITEST\",\"period\":\"max\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.architecture").value("ZERO_SHOT"))
                .andExpect(jsonPath("$.modelVersionId").value(notNullValue()));

        mockMvc.perform(get("/api/models/ZERO_SHOT/promoted"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ticker").value("APITEST"));

        mockMvc.perform(get("/api/forecast")
                        .param("ticker", "APITEST")
                        .param("architecture", "ZERO_SHOT")
                        .param("horizon", "2")
                        .param("coverage", "0.9"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.points", hasSize(2)))
                .andExpect(jsonPath("$.points[0].lower").value(notNullValue()));
    }

    @Test
    void walkForwardBacktestReportsEverySplit() throws Exception {
        mockMvc.perform(post("/api/benchmarks/walk-forward")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ticker\":\"APITEST\",\"architecture\":\"ZERO_SHOT\",\"strategy\":\"EXPANDING\","
                                + "\"trainSize\":100,\"testSize\":20,\"stepSize\":40}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalSplits").value(4))
                .andExpect(jsonPath("$.failedSplits").value(0))
                .andExpect(jsonPath("$.splits", hasSize(4)))
                .andExpect(jsonPath("$.splits[3].split.trainStart").value(0))
                .andExpect(jsonPath("$.splits[3].split.trainEnd").value(220))
                .andExpect(jsonPath("$.aggregate.sampleCount").value(80));
    }

    @Test
    void invalidTrainingRequestReturnsValidationDetails() throws Exception {
        mockMvc.perform(post("/api/training-jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"architecture\":\"LSTM\",\"ticker\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"))
                .andExpect(jsonPath("$.details[0].field").value("ticker"));
    }

    @Test
    void forecastWithoutPromotedModelIsNotFound() throws Exception {
        mockMvc.perform(get("/api/forecast")
                        .param("ticker", "APITEST")
                        .param("architecture", "STATE_SPACE")
                        .header("X-Correlation-Id", "corr-1"))
                .andExpect(status().isNotFound())
                .andExpect(header().string("X-Correlation-Id", "corr-1"))
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"))
                .andExpect(jsonPath("$.correlationId").value("corr-1"))
                .andExpect(jsonPath("$.path").value("/api/forecast"));
    }

    @Test
    void outOfRangeHorizonIsRejected() throws Exception {
        mockMvc.perform(get("/api/forecast")
                        .param("ticker", "APITEST")
                        .param("horizon", "0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownArchitectureIsRejected() throws Exception {
        mockMvc.perform(get("/api/models/TRANSFORMER_XL/versions"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0].field").value("architecture"));
    }

    @Test
    void unknownTrainingJobIsNotFound() throws Exception {
        mockMvc.perform(get("/api/training-jobs/does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }
}
