package com.causalbacktest.backtester.strategy;

import com.causalbacktest.backtester.domain.ParameterSet;
import com.causalbacktest.backtester.engine.DecisionPolicy;
import com.causalbacktest.backtester.engine.OrderSizing;
import com.causalbacktest.backtester.engine.PolicyContext;
import com.causalbacktest.backtester.indicator.AverageTrueRange;
import com.causalbacktest.backtester.indicator.ExponentialMovingAverage;
import com.causalbacktest.backtester.indicator.IndicatorSet;
import com.causalbacktest.backtester.indicator.RollingHigh;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Optional;

/**
 * Trend-following breakout with ATR risk sizing.
 *
 * <p>Enters long when the close breaks above the previous bar's rolling high while above
 * the EMA trend and ATR is at least {@code minAtrPct} of price. Position size risks
 * {@code riskPct} of equity over {@code atrStopMult} ATRs. While long, a protective sell
 * stop trails {@code atrTrailMult} ATRs under the close and only ever moves up; a close
 * under the stop or under the EMA exits at the next open.
 */
@Slf4j
public class TrendBreakoutAtrPolicy implements DecisionPolicy<TrendBreakoutAtrPolicy.State> {

    public static final String TREND_LENGTH = "trendLength";
    public static final String BREAKOUT_LENGTH = "breakoutLength";
    public static final String ATR_LENGTH = "atrLength";
    public static final String ATR_STOP_MULT = "atrStopMult";
    public static final String ATR_TRAIL_MULT = "atrTrailMult";
    public static final String MIN_ATR_PCT = "minAtrPct";
    public static final String RISK_PCT = "riskPct";

    private static final String TREND = "trend";
    private static final String ATR = "atr";
    private static final String HIGHEST = "highest";
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private static final ParameterSet DEFAULTS = ParameterSet.empty()
            .with(TREND_LENGTH, 200)
            .with(BREAKOUT_LENGTH, 20)
            .with(ATR_LENGTH, 14)
            .with(ATR_STOP_MULT, new BigDecimal("2.0"))
            .with(ATR_TRAIL_MULT, new BigDecimal("3.0"))
            .with(MIN_ATR_PCT, new BigDecimal("1.0"))
            .with(RISK_PCT, new BigDecimal("1.0"));

    @Override
    public String getName() {
        return "TrendBreakoutAtr";
    }

    @Override
    public ParameterSet defaultParameters() {
        return DEFAULTS;
    }

    @Override
    public IndicatorSet createIndicators(ParameterSet parameters) {
        return IndicatorSet.empty()
                .add(TREND, new ExponentialMovingAverage(PolicyParameters.period(parameters, TREND_LENGTH)))
                .add(ATR, new AverageTrueRange(PolicyParameters.period(parameters, ATR_LENGTH)))
                .add(HIGHEST, new RollingHigh(PolicyParameters.period(parameters, BREAKOUT_LENGTH)));
    }

    @Override
    public State onStart(ParameterSet parameters) {
        return new State(
                PolicyParameters.positive(parameters, ATR_STOP_MULT),
                PolicyParameters.positive(parameters, ATR_TRAIL_MULT),
                PolicyParameters.nonNegative(parameters, MIN_ATR_PCT),
                PolicyParameters.percent(parameters, RISK_PCT));
    }

    @Override
    public void onBar(State state, PolicyContext context) {
        Optional<BigDecimal> trendValue = context.indicator(TREND);
        Optional<BigDecimal> atrValue = context.indicator(ATR);
        Optional<BigDecimal> highestValue = context.indicator(HIGHEST);
        if (trendValue.isEmpty() || atrValue.isEmpty() || highestValue.isEmpty()) {
            return;
        }
        BigDecimal ema = trendValue.get();
        BigDecimal atr = atrValue.get();
        BigDecimal close = context.getClose();

        if (context.getPositionQuantity() > 0) {
            manageLong(state, context, ema, atr);
        } else if (context.isFlat()) {
            state.trailStop = null;
            state.activeStop = null;

            BigDecimal atrPct = atr.multiply(HUNDRED).divide(close, MathContext.DECIMAL64);
            boolean breakout = state.previousHigh != null && close.compareTo(state.previousHigh) > 0;
            boolean bullTrend = close.compareTo(ema) > 0;
            boolean volatilityOk = atrPct.compareTo(state.minAtrPct) >= 0;

            if (breakout && bullTrend && volatilityOk && context.getPendingOrderCount() == 0) {
                BigDecimal stopDistance = atr.multiply(state.atrStopMult);
                context.submitBuy(OrderSizing.risk(state.riskPct, stopDistance))
                        .ifPresent(order -> {
                            state.trailStop = close.subtract(atr.multiply(state.atrTrailMult));
                            log.debug("Breakout: BUY {} submitted at bar {} (close {}, prior high {}, atr {})",
                                    order.getQuantity(), context.getBarIndex(), close, state.previousHigh, atr);
                        });
            }
        }

        state.previousHigh = highestValue.get();
    }

    private void manageLong(State state, PolicyContext context, BigDecimal ema, BigDecimal atr) {
        BigDecimal close = context.getClose();
        BigDecimal candidate = close.subtract(atr.multiply(state.atrTrailMult));
        if (state.trailStop == null || candidate.compareTo(state.trailStop) > 0) {
            state.trailStop = candidate;
        }

        if (close.compareTo(state.trailStop) <= 0 || close.compareTo(ema) < 0) {
            context.cancelPendingOrders();
            context.closePosition()
                    .ifPresent(order -> log.debug("Breakout: exit SELL {} submitted at bar {} (close {}, stop {}, ema {})",
                            order.getQuantity(), context.getBarIndex(), close, state.trailStop, ema));
            state.activeStop = null;
            return;
        }

        // re-arm when the stop moved up or the previous stop order expired
        boolean stale = state.activeStop == null || state.trailStop.compareTo(state.activeStop) > 0
                || context.getPendingOrderCount() == 0;
        if (stale) {
            context.cancelPendingOrders();
            context.submitSellStop(OrderSizing.shares(context.getPositionQuantity()), state.trailStop)
                    .ifPresent(order -> state.activeStop = state.trailStop);
        }
    }

    public static final class State {
        private final BigDecimal atrStopMult;
        private final BigDecimal atrTrailMult;
        private final BigDecimal minAtrPct;
        private final BigDecimal riskPct;
        private BigDecimal previousHigh;
        private BigDecimal trailStop;
        private BigDecimal activeStop;

        State(BigDecimal atrStopMult, BigDecimal atrTrailMult, BigDecimal minAtrPct, BigDecimal riskPct) {
            this.atrStopMult = atrStopMult;
            this.atrTrailMult = atrTrailMult;
            this.minAtrPct = minAtrPct;
            this.riskPct = riskPct;
        }
    }
}
