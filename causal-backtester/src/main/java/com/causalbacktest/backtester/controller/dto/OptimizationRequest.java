package com.causalbacktest.backtester.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for a grid-search parameter sweep.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OptimizationRequest {

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

    @NotEmpty(message = "Parameter grid must contain at least one parameter")
    private Map<String, List<Object>> parameterGrid;

    /** Fixed parameters applied under every grid combination. */
    private Map<String, Object> baseParameters;

    @Positive(message = "Initial capital must be positive")
    private BigDecimal initialCapital;

    private String rankBy;

    private String tieBreaker;

    @Positive(message = "Time budget must be positive")
    private Long timeBudgetSeconds;

    /** Number of ranked rows to return; all rows when unset. */
    @Min(value = 1, message = "Top must be at least 1")
    private Integer top;

    @Valid
    private ExecutionOverrides execution;
}
