package com.causalbacktest.backtester.strategy;

import com.causalbacktest.backtester.TestBars;
import com.causalbacktest.backtester.domain.BarFeed;
import com.causalbacktest.backtester.domain.ConfigurationException;
import com.causalbacktest.backtester.domain.ErrorCategory;
import com.causalbacktest.backtester.domain.OrderSide;
import com.causalbacktest.backtester.domain.OrderType;
import com.causalbacktest.backtester.domain.ParameterSet;
import com.causalbacktest.backtester.engine.BacktestEngine;
import com.causalbacktest.backtester.engine.BacktestResult;
import com.causalbacktest.backtester.engine.DecisionPolicy;
import com.causalbacktest.backtester.execution.ExecutionSettings;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour of the built-in decision policies.
 */
class PolicyTest {

    private static final BigDecimal CAPITAL = new BigDecimal("10000");

    @Test
    void testPolicyType_ResolvesNames() {
        assertEquals(PolicyType.MA_CROSSOVER, PolicyType.fromName("ma_crossover"));
        assertEquals(PolicyType.MA_CROSSOVER, PolicyType.fromName("MA-CROSSOVER"));
        assertEquals(PolicyType.BUY_AND_HOLD, PolicyType.fromName("BuyAndHold"));
        assertEquals(PolicyType.TREND_BREAKOUT_ATR, PolicyType.fromName("trend-breakout-atr"));

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> PolicyType.fromName("martingale"));
        assertEquals("policy", ex.getField());
    }

    @Test
    void testBuyAndHold_BuysOnceAtSecondOpen() {
        BacktestResult result = run(new BuyAndHoldPolicy(), TestBars.flatFeed(100, 101, 102, 103), ParameterSet.empty());

        assertEquals(1, result.getOrdersSubmitted());
        assertEquals(95, result.getOrders().get(0).getQuantity());
        assertEquals(1, result.getFills().get(0).getBarIndex());
        assertEquals(0, result.getFills().get(0).getFillPrice().compareTo(new BigDecimal("101")));
        // 10000 - 95 * 101 + 95 * 103
        assertEquals(0, result.getFinalEquity().compareTo(new BigDecimal("10190")));
    }

    @Test
    void testBuyAndHold_RefusedEntryRetriedNextBar() {
        // Arrange - 95% of 10000 buys no unit at 20000
        BarFeed feed = TestBars.flatFeed(20000, 100, 101, 102);

        // Act
        BacktestResult result = run(new BuyAndHoldPolicy(), feed, ParameterSet.empty());

        // Assert
        assertEquals(1, result.getOrdersSubmitted());
        assertEquals(1, result.getOrders().get(0).getSubmittedAtBarIndex());
        assertEquals(95, result.getOrders().get(0).getQuantity());
        assertEquals(2, result.getFills().get(0).getBarIndex());
        assertEquals(ErrorCategory.POLICY, result.getAnnotations().get(0).getCategory());
        assertEquals(0, result.getAnnotations().get(0).getBarIndex());
    }

    @Test
    void testRsiMeanReversion_EntersOversoldExitsOverbought() {
        ParameterSet params = ParameterSet.empty()
                .with(RsiMeanReversionPolicy.RSI_PERIOD, 2)
                .with(RsiMeanReversionPolicy.POSITION_PCT, 50);

        BacktestResult result = run(new RsiMeanReversionPolicy(),
                TestBars.flatFeed(10, 11, 12, 11, 10, 11, 12, 13), params);

        // RSI: -, -, 100, 50, 0, 50, 100 ...
        assertEquals(2, result.getOrdersSubmitted());
        assertEquals(4, result.getOrders().get(0).getSubmittedAtBarIndex());
        assertEquals(OrderSide.BUY, result.getOrders().get(0).getSide());
        assertEquals(500, result.getOrders().get(0).getQuantity());
        assertEquals(6, result.getOrders().get(1).getSubmittedAtBarIndex());
        assertEquals(OrderSide.SELL, result.getOrders().get(1).getSide());

        assertEquals(1, result.getTrades().size());
        assertEquals(0, result.getTrades().get(0).getPnl().compareTo(new BigDecimal("1000")));
    }

    @Test
    void testRsiMeanReversion_InvalidLevelsRejected() {
        ParameterSet params = ParameterSet.empty()
                .with(RsiMeanReversionPolicy.OVERSOLD, 80)
                .with(RsiMeanReversionPolicy.OVERBOUGHT, 70);

        assertThrows(ConfigurationException.class,
                () -> run(new RsiMeanReversionPolicy(), TestBars.wave(40), params));
    }

    @Test
    void testTrendBreakout_EntersAndProtectsWithTrailingStop() {
        ParameterSet params = ParameterSet.empty()
                .with(TrendBreakoutAtrPolicy.TREND_LENGTH, 10)
                .with(TrendBreakoutAtrPolicy.BREAKOUT_LENGTH, 5)
                .with(TrendBreakoutAtrPolicy.ATR_LENGTH, 5)
                .with(TrendBreakoutAtrPolicy.MIN_ATR_PCT, 0);

        BacktestResult result = run(new TrendBreakoutAtrPolicy(), TestBars.wave(200), params);

        assertTrue(result.getOrders().stream()
                .anyMatch(o -> o.getSide() == OrderSide.BUY && o.getType() == OrderType.MARKET), "Expected an entry");
        assertTrue(result.getOrders().stream()
                .anyMatch(o -> o.getSide() == OrderSide.SELL && o.getType() == OrderType.STOP), "Expected a trailing stop");
        assertTrue(result.getOrders().stream()
                .noneMatch(o -> o.getSide() == OrderSide.BUY && o.getType() == OrderType.STOP));
        assertTrue(result.getEquityHistory().stream().allMatch(s -> s.getMarketValue().signum() >= 0),
                "Long-only policy must never hold a short position");
    }

    @Test
    void testTrendBreakout_InvalidRiskRejected() {
        ParameterSet params = ParameterSet.empty().with(TrendBreakoutAtrPolicy.RISK_PCT, 0);

        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> run(new TrendBreakoutAtrPolicy(), TestBars.wave(40), params));
        assertEquals(TrendBreakoutAtrPolicy.RISK_PCT, ex.getField());
    }

    @Test
    void testDefaults_AppliedForMissingParameters() {
        BacktestResult result = run(new MovingAverageCrossoverPolicy(), TestBars.wave(80),
                ParameterSet.empty().with(MovingAverageCrossoverPolicy.FAST, 5));

        assertEquals(5, result.getParameters().get(MovingAverageCrossoverPolicy.FAST));
        assertEquals(50, result.getParameters().get(MovingAverageCrossoverPolicy.SLOW));
    }

    private static BacktestResult run(DecisionPolicy<?> policy, BarFeed feed, ParameterSet params) {
        return new BacktestEngine(BacktestEngine.BacktestConfig.builder()
                .policy(policy)
                .parameters(params)
                .barFeed(feed)
                .initialCapital(CAPITAL)
                .execution(ExecutionSettings.frictionless())
                .build()).runBacktest();
    }
}
