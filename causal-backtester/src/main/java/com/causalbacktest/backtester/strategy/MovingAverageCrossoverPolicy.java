package com.causalbacktest.backtester.strategy;

import com.causalbacktest.backtester.domain.ConfigurationException;
import com.causalbacktest.backtester.domain.ParameterSet;
import com.causalbacktest.backtester.engine.DecisionPolicy;
import com.causalbacktest.backtester.engine.OrderSizing;
import com.causalbacktest.backtester.engine.PolicyContext;
import com.causalbacktest.backtester.indicator.IndicatorSet;
import com.causalbacktest.backtester.indicator.SimpleMovingAverage;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Moving Average Crossover Strategy.
 * Enters long when the fast SMA crosses above the slow SMA while flat, and exits when
 * it crosses back below while long.
 */
@Slf4j
public class MovingAverageCrossoverPolicy implements DecisionPolicy<MovingAverageCrossoverPolicy.State> {

    public static final String FAST = "fast";
    public static final String SLOW = "slow";
    public static final String POSITION_PCT = "positionPct";

    private static final ParameterSet DEFAULTS = ParameterSet.empty()
            .with(FAST, 20)
            .with(SLOW, 50)
            .with(POSITION_PCT, new BigDecimal("95"));

    @Override
    public String getName() {
        return "MovingAverageCrossover";
    }

    @Override
    public ParameterSet defaultParameters() {
        return DEFAULTS;
    }

    @Override
    public IndicatorSet createIndicators(ParameterSet parameters) {
        int fast = PolicyParameters.period(parameters, FAST);
        int slow = PolicyParameters.period(parameters, SLOW);
        if (fast >= slow) {
            throw new ConfigurationException(FAST, "Fast period must be less than slow period, got "
                    + fast + " and " + slow);
        }
        return IndicatorSet.empty()
                .add(FAST, new SimpleMovingAverage(fast))
                .add(SLOW, new SimpleMovingAverage(slow));
    }

    @Override
    public State onStart(ParameterSet parameters) {
        return new State(PolicyParameters.percent(parameters, POSITION_PCT));
    }

    @Override
    public void onBar(State state, PolicyContext context) {
        Optional<BigDecimal> fastValue = context.indicator(FAST);
        Optional<BigDecimal> slowValue = context.indicator(SLOW);
        if (fastValue.isEmpty() || slowValue.isEmpty()) {
            return;
        }
        BigDecimal fast = fastValue.get();
        BigDecimal slow = slowValue.get();

        if (state.previousFast != null) {
            boolean bullish = state.previousFast.compareTo(state.previousSlow) <= 0 && fast.compareTo(slow) > 0;
            boolean bearish = state.previousFast.compareTo(state.previousSlow) >= 0 && fast.compareTo(slow) < 0;

            if (bullish && context.isFlat()) {
                context.submitBuy(OrderSizing.percentOfEquity(state.positionPct))
                        .ifPresent(order -> log.debug("MA Crossover: BUY {} submitted at bar {} (fast {}, slow {})",
                                order.getQuantity(), context.getBarIndex(), fast, slow));
            } else if (bearish && context.getPositionQuantity() > 0) {
                context.closePosition()
                        .ifPresent(order -> log.debug("MA Crossover: SELL {} submitted at bar {} (fast {}, slow {})",
                                order.getQuantity(), context.getBarIndex(), fast, slow));
            }
        }

        state.previousFast = fast;
        state.previousSlow = slow;
    }

    public static final class State {
        private final BigDecimal positionPct;
        private BigDecimal previousFast;
        private BigDecimal previousSlow;

        State(BigDecimal positionPct) {
            this.positionPct = positionPct;
        }
    }
}
