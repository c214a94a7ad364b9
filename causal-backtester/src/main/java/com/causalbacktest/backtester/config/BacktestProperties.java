package com.causalbacktest.backtester.config;

import com.causalbacktest.backtester.execution.ExecutionSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Defaults for runs started through the service layer, bound from {@code backtest.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "backtest")
public class BacktestProperties {

    @NotNull
    @Positive
    private BigDecimal initialCash = new BigDecimal("100000");

    @Valid
    private Execution execution = new Execution();

    @Valid
    private Metrics metrics = new Metrics();

    @Valid
    private Optimizer optimizer = new Optimizer();

    @Valid
    private DataSettings data = new DataSettings();

    @Data
    public static class Execution {

        @NotNull
        @PositiveOrZero
        private BigDecimal commissionPerFill = new BigDecimal("1.00");

        @NotNull
        @PositiveOrZero
        private BigDecimal commissionPct = BigDecimal.ZERO;

        @NotNull
        @PositiveOrZero
        private BigDecimal slippageBps = BigDecimal.ONE;

        @NotNull
        @PositiveOrZero
        private BigDecimal slippageFixed = BigDecimal.ZERO;

        @Min(1)
        private int orderExpiryBars = 10;

        private boolean fillAtNextOpen = true;

        private boolean allowShort;

        private boolean marginEnabled;

        public ExecutionSettings toSettings() {
            return ExecutionSettings.builder()
                    .commissionPerFill(commissionPerFill)
                    .commissionPct(commissionPct)
                    .slippageBps(slippageBps)
                    .slippageFixed(slippageFixed)
                    .orderExpiryBars(orderExpiryBars)
                    .fillAtNextOpen(fillAtNextOpen)
                    .allowShort(allowShort)
                    .marginEnabled(marginEnabled)
                    .build();
        }
    }

    @Data
    public static class Metrics {

        @Min(1)
        private int periodsPerYear = 252;
    }

    @Data
    public static class Optimizer {

        @NotBlank
        private String rankBy = "sharpe_ratio";

        @NotBlank
        private String tieBreaker = "trade_count";

        /** Wall-clock budget per sweep; unset means unlimited. */
        private Duration timeBudget;
    }

    @Data
    public static class DataSettings {

        /** Directory holding {@code SYMBOL.csv} files. */
        @NotBlank
        private String directory = "data";

        /** Generate deterministic synthetic bars when a symbol has no file. */
        private boolean syntheticFallback = true;
    }
}
