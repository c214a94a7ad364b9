package com.causalbacktest.backtester.engine;

import com.causalbacktest.backtester.domain.ParameterSet;
import com.causalbacktest.backtester.indicator.IndicatorSet;

/**
 * A trading decision process driven one closed bar at a time.
 *
 * <p>Implementations are stateless and may be shared between concurrent runs. Everything
 * a run needs to remember lives in the state value {@code S} returned by
 * {@link #onStart(ParameterSet)}, which the engine owns and hands back on every bar.
 *
 * @param <S> per-run state
 */
public interface DecisionPolicy<S> {

    String getName();

    /**
     * Parameter values used when a run does not supply its own.
     */
    default ParameterSet defaultParameters() {
        return ParameterSet.empty();
    }

    /**
     * Fresh indicators for one run. The engine updates them with each bar before
     * {@link #onBar(Object, PolicyContext)} is called.
     *
     * @throws com.causalbacktest.backtester.domain.ConfigurationException for invalid parameters
     */
    default IndicatorSet createIndicators(ParameterSet parameters) {
        return IndicatorSet.empty();
    }

    S onStart(ParameterSet parameters);

    void onBar(S state, PolicyContext context);

    default void onFinish(S state) {
    }
}
