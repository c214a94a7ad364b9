package com.causalbacktest.backtester.indicator;

import com.causalbacktest.backtester.domain.Bar;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Incremental statistic over the bars supplied so far.
 *
 * <p>The value returned after the k-th {@link #update(Bar)} depends only on those k bars.
 * An empty result means "not available yet" and must be read as no signal.
 */
public interface Indicator {

    Optional<BigDecimal> update(Bar bar);

    /**
     * The value produced by the most recent update.
     */
    Optional<BigDecimal> value();

    /**
     * Number of bars supplied so far.
     */
    int count();
}
