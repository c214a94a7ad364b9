package com.causalbacktest.backtester.walkforward;

import com.causalbacktest.backtester.TestBars;
import com.causalbacktest.backtester.domain.BarFeed;
import com.causalbacktest.backtester.domain.ConfigurationException;
import com.causalbacktest.backtester.execution.ExecutionSettings;
import com.causalbacktest.backtester.optimizer.GridSearchOptimizer;
import com.causalbacktest.backtester.optimizer.ParameterGrid;
import com.causalbacktest.backtester.optimizer.SweepCancellation;
import com.causalbacktest.backtester.optimizer.SweepSpec;
import com.causalbacktest.backtester.strategy.MovingAverageCrossoverPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

/**
 * Tests for rolling train/test validation.
 */
class WalkForwardAnalyzerTest {

    private static final BigDecimal CAPITAL = new BigDecimal("10000");

    private ExecutorService executorService;
    private GridSearchOptimizer optimizer;
    private WalkForwardAnalyzer analyzer;
    private BarFeed feed;

    @BeforeEach
    void setUp() {
        executorService = Executors.newFixedThreadPool(2);
        optimizer = spy(new GridSearchOptimizer(executorService));
        analyzer = new WalkForwardAnalyzer(optimizer);
        feed = TestBars.wave(200);
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    @Test
    void testAnalyze_TestWindowsCoverEveryBarAfterFirstTrain() {
        // Act
        WalkForwardResult result = analyzer.analyze(spec(80, 30));

        // Assert - test windows [80,110) [110,140) [140,170) [170,200)
        assertEquals(4, result.getWindows().size());
        assertFalse(result.isCancelled());
        List<StitchedEquityPoint> stitched = result.getStitchedEquity();
        assertEquals(120, stitched.size());
        for (int i = 0; i < stitched.size(); i++) {
            assertEquals(80 + i, stitched.get(i).getBarIndex());
            assertEquals(feed.bar(80 + i).getTimestamp(), stitched.get(i).getTimestamp());
        }
        assertEquals(4, result.getAggregate().getNumWindows());
        assertNotNull(result.getAggregate().getOverall());
        assertEquals(4, result.toTable().size());
    }

    @Test
    void testAnalyze_TrainAndTestRangesNeverOverlap() {
        WalkForwardResult result = analyzer.analyze(spec(80, 30));

        for (WindowResult window : result.getWindows()) {
            assertTrue(window.getTrainEndTime().isBefore(window.getTestStartTime()));
            assertEquals(feed.bar(window.getWindow().getTrainEnd() - 1).getTimestamp(), window.getTrainEndTime());
            assertEquals(feed.bar(window.getWindow().getTestStart()).getTimestamp(), window.getTestStartTime());
            assertEquals(4, window.getCombinationsEvaluated());
        }
    }

    @Test
    void testAnalyze_OptimizerOnlySeesTrainBars() {
        WalkForwardResult result = analyzer.analyze(spec(80, 30));

        ArgumentCaptor<SweepSpec> captor = ArgumentCaptor.forClass(SweepSpec.class);
        verify(optimizer, atLeastOnce()).optimize(captor.capture(), any(SweepCancellation.class));
        List<SweepSpec> sweeps = captor.getAllValues();

        assertEquals(result.getWindows().size(), sweeps.size());
        for (int w = 0; w < sweeps.size(); w++) {
            BarFeed trainFeed = sweeps.get(w).getFeed();
            WindowResult window = result.getWindows().get(w);
            assertEquals(80, trainFeed.length());
            assertTrue(trainFeed.lastTimestamp().isBefore(window.getTestStartTime()),
                    "Train data for window " + w + " reaches into its test range");
        }
    }

    @Test
    void testStitchedEquity_SegmentsChainFromPreviousEnd() {
        WalkForwardResult result = analyzer.analyze(spec(80, 30));
        List<StitchedEquityPoint> stitched = result.getStitchedEquity();

        StitchedEquityPoint first = stitched.get(0);
        assertEquals(first.getSegmentEquity().doubleValue(), first.getEquity().doubleValue(), 1e-6);

        for (int i = 1; i < stitched.size(); i++) {
            StitchedEquityPoint previous = stitched.get(i - 1);
            StitchedEquityPoint current = stitched.get(i);
            if (previous.getWindow() != current.getWindow()) {
                // factor carried over is previous end / capital
                BigDecimal factor = previous.getEquity().divide(CAPITAL, MathContext.DECIMAL64);
                double expected = current.getSegmentEquity().multiply(factor).doubleValue();
                assertEquals(expected, current.getEquity().doubleValue(), 1e-4);
            }
        }
    }

    @Test
    void testAnalyze_NoCompletedCombinationFailsLoudly() {
        WalkForwardSpec spec = spec(80, 30).toBuilder()
                .grid(ParameterGrid.builder().add("fast", 30).add("slow", 10).build())
                .build();

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> analyzer.analyze(spec));

        assertEquals("grid", ex.getField());
        assertTrue(ex.getMessage().contains("train window 0"));
    }

    @Test
    void testAnalyze_InsufficientDataRejected() {
        WalkForwardSpec spec = spec(150, 60);

        assertThrows(ConfigurationException.class, () -> analyzer.analyze(spec));
    }

    @Test
    void testAnalyze_CancelledBeforeFirstWindow() {
        SweepCancellation cancellation = SweepCancellation.create();
        cancellation.cancel();

        WalkForwardResult result = analyzer.analyze(spec(80, 30), cancellation);

        assertTrue(result.isCancelled());
        assertTrue(result.getWindows().isEmpty());
        assertTrue(result.getStitchedEquity().isEmpty());
        assertEquals(0, result.getAggregate().getNumWindows());
        assertNull(result.getAggregate().getOverall());
    }

    private WalkForwardSpec spec(int train, int test) {
        return WalkForwardSpec.builder()
                .policy(new MovingAverageCrossoverPolicy())
                .grid(ParameterGrid.builder()
                        .add("fast", 3, 5)
                        .add("slow", 10, 15)
                        .build())
                .feed(feed)
                .initialCapital(CAPITAL)
                .execution(ExecutionSettings.defaults())
                .config(WalkForwardConfig.builder()
                        .trainBars(train)
                        .testBars(test)
                        .build())
                .build();
    }
}
