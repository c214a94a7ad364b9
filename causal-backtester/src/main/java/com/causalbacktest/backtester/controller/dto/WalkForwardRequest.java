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
 * Request DTO for a walk-forward analysis.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WalkForwardRequest {

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

    private Map<String, Object> baseParameters;

    @NotNull(message = "Train bars are required")
    @Min(value = 1, message = "Train window must be at least 1 bar")
    private Integer trainBars;

    @NotNull(message = "Test bars are required")
    @Min(value = 1, message = "Test window must be at least 1 bar")
    private Integer testBars;

    @Min(value = 1, message = "Step must be at least 1 bar")
    private Integer stepBars;

    @Min(value = 1, message = "Window count must be at least 1")
    private Integer windowCount;

    @Positive(message = "Initial capital must be positive")
    private BigDecimal initialCapital;

    private String rankBy;

    private String tieBreaker;

    @Positive(message = "Time budget must be positive")
    private Long timeBudgetSeconds;

    @Valid
    private ExecutionOverrides execution;
}
