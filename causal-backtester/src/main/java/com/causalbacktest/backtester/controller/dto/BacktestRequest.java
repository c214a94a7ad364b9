package com.causalbacktest.backtester.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Request DTO for a single backtest run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestRequest {

    @NotBlank(message = "Policy is required")
    private String policy;

    @NotBlank(message = "Symbol is required")
    @Pattern(regexp = "[A-Za-z0-9._-]+", message = "Symbol may only contain letters, digits, '.', '_' and '-'")
    private String symbol;

    @NotNull(message = "Start date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate startDate;

    @NotNull(message = "End date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate endDate;

    /** Policy parameters; missing names take the policy's defaults. */
    private Map<String, Object> parameters;

    /** Falls back to {@code backtest.initial-cash}. */
    @Positive(message = "Initial capital must be positive")
    private BigDecimal initialCapital;

    @Valid
    private ExecutionOverrides execution;
}
