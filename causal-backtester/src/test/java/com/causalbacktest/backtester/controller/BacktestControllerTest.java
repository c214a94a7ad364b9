package com.causalbacktest.backtester.controller;

import com.causalbacktest.backtester.controller.dto.BacktestRequest;
import com.causalbacktest.backtester.controller.dto.BacktestResponse;
import com.causalbacktest.backtester.controller.dto.OptimizationRequest;
import com.causalbacktest.backtester.controller.dto.OptimizationResponse;
import com.causalbacktest.backtester.controller.dto.WalkForwardRequest;
import com.causalbacktest.backtester.controller.dto.WalkForwardResponse;
import com.causalbacktest.backtester.domain.ConfigurationException;
import com.causalbacktest.backtester.domain.DataValidationException;
import com.causalbacktest.backtester.service.BacktestService;
import com.causalbacktest.backtester.service.OptimizationService;
import com.causalbacktest.backtester.service.WalkForwardService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web layer tests for BacktestController REST endpoints.
 */
@WebMvcTest(BacktestController.class)
class BacktestControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private BacktestService backtestService;

    @MockBean
    private OptimizationService optimizationService;

    @MockBean
    private WalkForwardService walkForwardService;

    @Test
    void testRunBacktest_Success() throws Exception {
        // Arrange
        BacktestResponse mockResponse = BacktestResponse.builder()
                .policy("MovingAverageCrossover")
                .symbol("AAPL")
                .parameters(Map.of("fast", 10, "slow", 30))
                .initialCapital(new BigDecimal("100000"))
                .bars(250)
                .ordersSubmitted(6)
                .fills(6)
                .trades(List.of())
                .equityCurve(List.of())
                .annotations(List.of())
                .build();

        when(backtestService.runBacktest(any())).thenReturn(mockResponse);

        // Act & Assert
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(createValidRequest())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.policy").value("MovingAverageCrossover"))
                .andExpect(jsonPath("$.symbol").value("AAPL"))
                .andExpect(jsonPath("$.bars").value(250))
                .andExpect(jsonPath("$.fills").value(6))
                .andExpect(jsonPath("$.parameters.fast").value(10));
    }

    @Test
    void testRunBacktest_MissingPolicy() throws Exception {
        // Arrange
        BacktestRequest request = createValidRequest();
        request.setPolicy(null);

        // Act & Assert
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.category").value("VALIDATION"))
                .andExpect(jsonPath("$.field").value("policy"));

        verifyNoInteractions(backtestService);
    }

    @Test
    void testRunBacktest_NegativeSlippageOverride() throws Exception {
        // Arrange
        String body = """
                {"policy":"BuyAndHold","symbol":"AAPL","startDate":"2023-01-01","endDate":"2023-12-31",
                 "execution":{"slippageBps":-1}}
                """;

        // Act & Assert
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("execution.slippageBps"));
    }

    @Test
    void testRunBacktest_MalformedBody() throws Exception {
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"policy\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }

    @Test
    void testRunBacktest_DataErrorMappedToBadRequest() throws Exception {
        // Arrange
        when(backtestService.runBacktest(any()))
                .thenThrow(new DataValidationException("symbol", "No data file for AAPL"));

        // Act & Assert
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(createValidRequest())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.category").value("DATA"))
                .andExpect(jsonPath("$.field").value("symbol"))
                .andExpect(jsonPath("$.message").value("No data file for AAPL"));
    }

    @Test
    void testOptimize_Success() throws Exception {
        // Arrange
        OptimizationRequest request = OptimizationRequest.builder()
                .policy("MA_CROSSOVER")
                .symbol("AAPL")
                .startDate(LocalDate.of(2023, 1, 1))
                .endDate(LocalDate.of(2023, 12, 31))
                .parameterGrid(Map.of("fast", List.of(5, 10), "slow", List.of(20, 30)))
                .build();
        OptimizationResponse mockResponse = OptimizationResponse.builder()
                .policy("MovingAverageCrossover")
                .rankBy("SHARPE_RATIO")
                .tieBreaker("TRADE_COUNT")
                .totalCombinations(4)
                .completed(4)
                .best(Map.of("rank", 1, "fast", 10, "slow", 30))
                .rows(List.of())
                .build();

        when(optimizationService.optimize(any())).thenReturn(mockResponse);

        // Act & Assert
        mockMvc.perform(post("/backtests/optimizations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCombinations").value(4))
                .andExpect(jsonPath("$.completed").value(4))
                .andExpect(jsonPath("$.cancelled").value(false))
                .andExpect(jsonPath("$.best.fast").value(10));
    }

    @Test
    void testOptimize_EmptyGridRejected() throws Exception {
        // Arrange
        OptimizationRequest request = OptimizationRequest.builder()
                .policy("MA_CROSSOVER")
                .symbol("AAPL")
                .startDate(LocalDate.of(2023, 1, 1))
                .endDate(LocalDate.of(2023, 12, 31))
                .parameterGrid(Map.of())
                .build();

        // Act & Assert
        mockMvc.perform(post("/backtests/optimizations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("parameterGrid"));

        verifyNoInteractions(optimizationService);
    }

    @Test
    void testWalkForward_ConfigurationErrorMapped() throws Exception {
        // Arrange
        WalkForwardRequest request = WalkForwardRequest.builder()
                .policy("MA_CROSSOVER")
                .symbol("AAPL")
                .startDate(LocalDate.of(2023, 1, 1))
                .endDate(LocalDate.of(2023, 12, 31))
                .parameterGrid(Map.of("fast", List.of(5, 10)))
                .trainBars(500)
                .testBars(100)
                .build();

        when(walkForwardService.analyze(any()))
                .thenThrow(new ConfigurationException("trainBars", "Walk-forward needs at least 600 bars"));

        // Act & Assert
        mockMvc.perform(post("/backtests/walk-forward")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.category").value("CONFIGURATION"))
                .andExpect(jsonPath("$.field").value("trainBars"));
    }

    @Test
    void testWalkForward_Success() throws Exception {
        // Arrange
        WalkForwardRequest request = WalkForwardRequest.builder()
                .policy("MA_CROSSOVER")
                .symbol("AAPL")
                .startDate(LocalDate.of(2023, 1, 1))
                .endDate(LocalDate.of(2023, 12, 31))
                .parameterGrid(Map.of("fast", List.of(5, 10)))
                .trainBars(120)
                .testBars(40)
                .build();

        when(walkForwardService.analyze(any())).thenReturn(WalkForwardResponse.builder()
                .policy("MovingAverageCrossover")
                .symbol("AAPL")
                .windows(List.of(Map.of("window", 0), Map.of("window", 1)))
                .stitchedEquity(List.of())
                .build());

        // Act & Assert
        mockMvc.perform(post("/backtests/walk-forward")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.windows.length()").value(2))
                .andExpect(jsonPath("$.symbol").value("AAPL"));
    }

    private BacktestRequest createValidRequest() {
        return BacktestRequest.builder()
                .policy("MA_CROSSOVER")
                .symbol("AAPL")
                .startDate(LocalDate.of(2023, 1, 1))
                .endDate(LocalDate.of(2023, 12, 31))
                .parameters(Map.of("fast", 10, "slow", 30))
                .build();
    }
}
