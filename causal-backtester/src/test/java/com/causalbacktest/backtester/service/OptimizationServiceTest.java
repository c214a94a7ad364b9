package com.causalbacktest.backtester.service;

import com.causalbacktest.backtester.TestBars;
import com.causalbacktest.backtester.config.BacktestProperties;
import com.causalbacktest.backtester.controller.dto.OptimizationRequest;
import com.causalbacktest.backtester.controller.dto.OptimizationResponse;
import com.causalbacktest.backtester.controller.dto.WalkForwardRequest;
import com.causalbacktest.backtester.controller.dto.WalkForwardResponse;
import com.causalbacktest.backtester.domain.ConfigurationException;
import com.causalbacktest.backtester.optimizer.GridSearchOptimizer;
import com.causalbacktest.backtester.optimizer.SweepCancellation;
import com.causalbacktest.backtester.walkforward.WalkForwardAnalyzer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the sweep and walk-forward services over a real optimizer.
 */
@ExtendWith(MockitoExtension.class)
class OptimizationServiceTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final LocalDate END = LocalDate.of(2024, 12, 31);

    @Mock
    private MarketDataService marketDataService;

    @Mock
    private BacktestMetricsService metricsService;

    private ExecutorService executorService;
    private BacktestProperties properties;
    private OptimizationService optimizationService;
    private WalkForwardService walkForwardService;

    @BeforeEach
    void setUp() {
        executorService = Executors.newFixedThreadPool(2);
        properties = new BacktestProperties();
        GridSearchOptimizer optimizer = new GridSearchOptimizer(executorService);
        optimizationService = new OptimizationService(optimizer, marketDataService, properties, metricsService);
        walkForwardService = new WalkForwardService(new WalkForwardAnalyzer(optimizer),
                marketDataService, properties, metricsService);
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    @Test
    void testOptimize_RanksAllCombinations() {
        // Arrange
        OptimizationRequest request = createSweepRequest();
        when(marketDataService.loadBars("WAVE", START, END)).thenReturn(TestBars.wave(150));

        // Act
        OptimizationResponse response = optimizationService.optimize(request);

        // Assert
        assertEquals("MovingAverageCrossover", response.getPolicy());
        assertEquals("SHARPE_RATIO", response.getRankBy());
        assertEquals("TRADE_COUNT", response.getTieBreaker());
        assertEquals(4, response.getTotalCombinations());
        assertEquals(4, response.getCompleted());
        assertEquals(0, response.getFailed());
        assertFalse(response.isCancelled());
        assertEquals(4, response.getRows().size());
        assertNotNull(response.getBest());
        verify(metricsService).recordSweepCompleted(eq(4), anyLong());
    }

    @Test
    void testOptimize_TopLimitsRows() {
        // Arrange
        OptimizationRequest request = createSweepRequest();
        request.setTop(2);
        when(marketDataService.loadBars("WAVE", START, END)).thenReturn(TestBars.wave(150));

        // Act
        OptimizationResponse response = optimizationService.optimize(request);

        // Assert
        assertEquals(2, response.getRows().size());
        assertEquals(4, response.getCompleted());
    }

    @Test
    void testOptimize_EmptyGridFailsBeforeLoadingData() {
        // Arrange
        OptimizationRequest request = createSweepRequest();
        request.setParameterGrid(Map.of("fast", List.of()));

        // Act & Assert
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> optimizationService.optimize(request));
        assertEquals("fast", ex.getField());
        verifyNoInteractions(marketDataService);
        verify(metricsService).recordFailure();
        verify(metricsService, never()).recordSweepCompleted(anyInt(), anyLong());
    }

    @Test
    void testOptimize_UnknownRankingMetric() {
        // Arrange
        OptimizationRequest request = createSweepRequest();
        request.setRankBy("luck");

        // Act & Assert
        assertThrows(ConfigurationException.class, () -> optimizationService.optimize(request));
        verifyNoInteractions(marketDataService);
    }

    @Test
    void testCancellation_RequestBudgetWins() {
        properties.getOptimizer().setTimeBudget(Duration.ofHours(1));

        SweepCancellation expired = optimizationService.cancellation(0L);

        assertTrue(expired.isCancelled(), "A zero-second budget is already spent");
    }

    @Test
    void testCancellation_ConfiguredBudgetAndUnlimited() {
        assertFalse(optimizationService.cancellation(null).isCancelled());

        properties.getOptimizer().setTimeBudget(Duration.ofHours(1));
        assertFalse(optimizationService.cancellation(null).isCancelled());
    }

    @Test
    void testWalkForward_CoversTestWindows() {
        // Arrange
        WalkForwardRequest request = WalkForwardRequest.builder()
                .policy("MA_CROSSOVER")
                .symbol("WAVE")
                .startDate(START)
                .endDate(END)
                .parameterGrid(grid())
                .trainBars(80)
                .testBars(40)
                .build();
        when(marketDataService.loadBars("WAVE", START, END)).thenReturn(TestBars.wave(200));

        // Act
        WalkForwardResponse response = walkForwardService.analyze(request);

        // Assert
        assertEquals("WAVE", response.getSymbol());
        assertFalse(response.isCancelled());
        assertEquals(3, response.getWindows().size());
        assertEquals(120, response.getStitchedEquity().size());
        verify(metricsService).recordWalkForwardCompleted(anyLong());
    }

    @Test
    void testWalkForward_TooFewBarsIsFatal() {
        // Arrange
        WalkForwardRequest request = WalkForwardRequest.builder()
                .policy("MA_CROSSOVER")
                .symbol("WAVE")
                .startDate(START)
                .endDate(END)
                .parameterGrid(grid())
                .trainBars(150)
                .testBars(100)
                .build();
        when(marketDataService.loadBars("WAVE", START, END)).thenReturn(TestBars.wave(200));

        // Act & Assert
        assertThrows(ConfigurationException.class, () -> walkForwardService.analyze(request));
        verify(metricsService).recordFailure();
    }

    private OptimizationRequest createSweepRequest() {
        return OptimizationRequest.builder()
                .policy("ma_crossover")
                .symbol("WAVE")
                .startDate(START)
                .endDate(END)
                .parameterGrid(grid())
                .build();
    }

    private static Map<String, List<Object>> grid() {
        Map<String, List<Object>> grid = new LinkedHashMap<>();
        grid.put("fast", List.of(3, 5));
        grid.put("slow", List.of(10, 20));
        return grid;
    }
}
