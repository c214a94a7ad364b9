package com.causalbacktest.backtester.strategy;

import com.causalbacktest.backtester.domain.ConfigurationException;
import com.causalbacktest.backtester.engine.DecisionPolicy;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Closed registry of the built-in decision policies. Policies are stateless, so one
 * instance per type is shared by every run.
 */
public enum PolicyType {
    BUY_AND_HOLD(new BuyAndHoldPolicy()),
    MA_CROSSOVER(new MovingAverageCrossoverPolicy()),
    RSI_MEAN_REVERSION(new RsiMeanReversionPolicy()),
    TREND_BREAKOUT_ATR(new TrendBreakoutAtrPolicy());

    private final DecisionPolicy<?> policy;

    PolicyType(DecisionPolicy<?> policy) {
        this.policy = policy;
    }

    public DecisionPolicy<?> policy() {
        return policy;
    }

    /**
     * Resolve a policy name, accepting the enum name in any case as well as the
     * policy's display name.
     *
     * @throws ConfigurationException for an unknown name
     */
    public static PolicyType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("policy", "Policy name is required");
        }
        String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (PolicyType type : values()) {
            if (type.name().equals(normalized) || type.policy.getName().equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        String known = Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", "));
        throw new ConfigurationException("policy", "Unknown policy '" + name + "', expected one of " + known);
    }
}
