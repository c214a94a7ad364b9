package com.causalbacktest.backtester.strategy;

import com.causalbacktest.backtester.domain.ParameterSet;
import com.causalbacktest.backtester.engine.DecisionPolicy;
import com.causalbacktest.backtester.engine.OrderSizing;
import com.causalbacktest.backtester.engine.PolicyContext;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;

/**
 * Buy and Hold Strategy.
 * Buys with a fixed share of equity on the first bar and holds the position to the end.
 */
@Slf4j
public class BuyAndHoldPolicy implements DecisionPolicy<BuyAndHoldPolicy.State> {

    public static final String POSITION_PCT = "positionPct";

    private static final ParameterSet DEFAULTS = ParameterSet.empty()
            .with(POSITION_PCT, new BigDecimal("95"));

    @Override
    public String getName() {
        return "BuyAndHold";
    }

    @Override
    public ParameterSet defaultParameters() {
        return DEFAULTS;
    }

    @Override
    public State onStart(ParameterSet parameters) {
        return new State(PolicyParameters.percent(parameters, POSITION_PCT));
    }

    @Override
    public void onBar(State state, PolicyContext context) {
        if (state.entered) {
            return;
        }
        // a refused submission is retried on the next bar
        context.submitBuy(OrderSizing.percentOfEquity(state.positionPct))
                .ifPresent(order -> {
                    state.entered = true;
                    log.debug("Buy and Hold: BUY {} units submitted on {}",
                            order.getQuantity(), context.getTimestamp());
                });
    }

    @Override
    public void onFinish(State state) {
        log.debug("Buy and Hold strategy completed. Entered: {}", state.entered);
    }

    public static final class State {
        private final BigDecimal positionPct;
        private boolean entered;

        State(BigDecimal positionPct) {
            this.positionPct = positionPct;
        }
    }
}
