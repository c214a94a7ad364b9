package com.causalbacktest.backtester.strategy;

import com.causalbacktest.backtester.domain.ConfigurationException;
import com.causalbacktest.backtester.domain.ParameterSet;
import com.causalbacktest.backtester.engine.DecisionPolicy;
import com.causalbacktest.backtester.engine.OrderSizing;
import com.causalbacktest.backtester.engine.PolicyContext;
import com.causalbacktest.backtester.indicator.IndicatorSet;
import com.causalbacktest.backtester.indicator.RelativeStrengthIndex;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * RSI mean reversion. Enters long when RSI drops through the oversold level while flat
 * and exits when RSI rises through the overbought level.
 */
@Slf4j
public class RsiMeanReversionPolicy implements DecisionPolicy<RsiMeanReversionPolicy.State> {

    public static final String RSI_PERIOD = "rsiPeriod";
    public static final String OVERSOLD = "oversold";
    public static final String OVERBOUGHT = "overbought";
    public static final String POSITION_PCT = "positionPct";

    private static final String RSI = "rsi";

    private static final ParameterSet DEFAULTS = ParameterSet.empty()
            .with(RSI_PERIOD, 14)
            .with(OVERSOLD, new BigDecimal("30"))
            .with(OVERBOUGHT, new BigDecimal("70"))
            .with(POSITION_PCT, new BigDecimal("95"));

    @Override
    public String getName() {
        return "RsiMeanReversion";
    }

    @Override
    public ParameterSet defaultParameters() {
        return DEFAULTS;
    }

    @Override
    public IndicatorSet createIndicators(ParameterSet parameters) {
        return IndicatorSet.empty()
                .add(RSI, new RelativeStrengthIndex(PolicyParameters.period(parameters, RSI_PERIOD)));
    }

    @Override
    public State onStart(ParameterSet parameters) {
        BigDecimal oversold = PolicyParameters.nonNegative(parameters, OVERSOLD);
        BigDecimal overbought = PolicyParameters.nonNegative(parameters, OVERBOUGHT);
        if (oversold.compareTo(overbought) >= 0) {
            throw new ConfigurationException(OVERSOLD, "Oversold level must be below overbought level, got "
                    + oversold + " and " + overbought);
        }
        return new State(oversold, overbought, PolicyParameters.percent(parameters, POSITION_PCT));
    }

    @Override
    public void onBar(State state, PolicyContext context) {
        Optional<BigDecimal> rsiValue = context.indicator(RSI);
        if (rsiValue.isEmpty()) {
            return;
        }
        BigDecimal rsi = rsiValue.get();

        if (state.previousRsi != null) {
            boolean entersOversold = state.previousRsi.compareTo(state.oversold) >= 0
                    && rsi.compareTo(state.oversold) < 0;
            boolean entersOverbought = state.previousRsi.compareTo(state.overbought) <= 0
                    && rsi.compareTo(state.overbought) > 0;

            if (entersOversold && context.isFlat()) {
                context.submitBuy(OrderSizing.percentOfEquity(state.positionPct))
                        .ifPresent(order -> log.debug("RSI: BUY {} submitted at bar {} (rsi {})",
                                order.getQuantity(), context.getBarIndex(), rsi));
            } else if (entersOverbought && context.getPositionQuantity() > 0) {
                context.closePosition()
                        .ifPresent(order -> log.debug("RSI: SELL {} submitted at bar {} (rsi {})",
                                order.getQuantity(), context.getBarIndex(), rsi));
            }
        }

        state.previousRsi = rsi;
    }

    public static final class State {
        private final BigDecimal oversold;
        private final BigDecimal overbought;
        private final BigDecimal positionPct;
        private BigDecimal previousRsi;

        State(BigDecimal oversold, BigDecimal overbought, BigDecimal positionPct) {
            this.oversold = oversold;
            this.overbought = overbought;
            this.positionPct = positionPct;
        }
    }
}
