package com.causalbacktest.backtester.validation;

import com.causalbacktest.backtester.controller.dto.BacktestRequest;
import com.causalbacktest.backtester.controller.dto.ExecutionOverrides;
import com.causalbacktest.backtester.controller.dto.OptimizationRequest;
import com.causalbacktest.backtester.controller.dto.WalkForwardRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for input validation and constraint violations.
 */
class ValidationTest {

    private static Validator validator;

    @BeforeAll
    static void setUp() {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @Test
    void testValidRequest_NoViolations() {
        // Arrange
        BacktestRequest request = createValidRequest();

        // Act
        Set<ConstraintViolation<BacktestRequest>> violations = validator.validate(request);

        // Assert
        assertTrue(violations.isEmpty(), "Valid request should have no violations");
    }

    @Test
    void testBlankPolicy_Violation() {
        // Arrange
        BacktestRequest request = createValidRequest();
        request.setPolicy("   ");

        // Act
        Set<ConstraintViolation<BacktestRequest>> violations = validator.validate(request);

        // Assert
        assertEquals(1, violations.size());
        ConstraintViolation<BacktestRequest> violation = violations.iterator().next();
        assertEquals("policy", violation.getPropertyPath().toString());
        assertTrue(violation.getMessage().contains("required"));
    }

    @Test
    void testPathLikeSymbol_Violation() {
        // Arrange
        BacktestRequest request = createValidRequest();
        request.setSymbol("../private/secret");

        // Act
        Set<ConstraintViolation<BacktestRequest>> violations = validator.validate(request);

        // Assert
        assertEquals(1, violations.size());
        assertEquals("symbol", violations.iterator().next().getPropertyPath().toString());
    }

    @Test
    void testDottedSymbol_NoViolation() {
        BacktestRequest request = createValidRequest();
        request.setSymbol("BRK.B");

        assertTrue(validator.validate(request).isEmpty());
    }

    @Test
    void testWalkForwardRequest_PathLikeSymbol_Violation() {
        WalkForwardRequest request = WalkForwardRequest.builder()
                .policy("MovingAverageCrossover")
                .symbol("data/AAPL")
                .trainBars(100)
                .testBars(50)
                .parameterGrid(Map.of("fastPeriod", List.of(5)))
                .build();

        Set<ConstraintViolation<WalkForwardRequest>> violations = validator.validate(request);

        assertTrue(violations.stream().anyMatch(v -> v.getPropertyPath().toString().equals("symbol")));
    }

    @Test
    void testMissingDates_Violations() {
        // Arrange
        BacktestRequest request = createValidRequest();
        request.setStartDate(null);
        request.setEndDate(null);

        // Act
        Set<ConstraintViolation<BacktestRequest>> violations = validator.validate(request);

        // Assert
        assertEquals(2, violations.size());
    }

    @Test
    void testZeroInitialCapital_Violation() {
        // Arrange
        BacktestRequest request = createValidRequest();
        request.setInitialCapital(BigDecimal.ZERO);

        // Act
        Set<ConstraintViolation<BacktestRequest>> violations = validator.validate(request);

        // Assert
        assertEquals(1, violations.size());
        assertEquals("initialCapital", violations.iterator().next().getPropertyPath().toString());
    }

    @Test
    void testNestedExecutionOverrides_Validated() {
        // Arrange
        BacktestRequest request = createValidRequest();
        request.setExecution(ExecutionOverrides.builder()
                .commissionPct(new BigDecimal("-0.1"))
                .orderExpiryBars(0)
                .build());

        // Act
        Set<ConstraintViolation<BacktestRequest>> violations = validator.validate(request);

        // Assert
        assertEquals(2, violations.size());
        assertTrue(violations.stream()
                .anyMatch(v -> v.getPropertyPath().toString().equals("execution.orderExpiryBars")));
    }

    @Test
    void testOptimizationRequest_TopAndBudget() {
        // Arrange
        OptimizationRequest request = OptimizationRequest.builder()
                .policy("MA_CROSSOVER")
                .symbol("AAPL")
                .startDate(LocalDate.of(2023, 1, 1))
                .endDate(LocalDate.of(2023, 12, 31))
                .parameterGrid(Map.of("fast", List.of(5, 10)))
                .top(0)
                .timeBudgetSeconds(-5L)
                .build();

        // Act
        Set<ConstraintViolation<OptimizationRequest>> violations = validator.validate(request);

        // Assert
        assertEquals(2, violations.size());
    }

    @Test
    void testWalkForwardRequest_WindowSizesRequired() {
        // Arrange
        WalkForwardRequest request = WalkForwardRequest.builder()
                .policy("MA_CROSSOVER")
                .symbol("AAPL")
                .startDate(LocalDate.of(2023, 1, 1))
                .endDate(LocalDate.of(2023, 12, 31))
                .parameterGrid(Map.of("fast", List.of(5, 10)))
                .testBars(0)
                .build();

        // Act
        Set<ConstraintViolation<WalkForwardRequest>> violations = validator.validate(request);

        // Assert
        assertEquals(2, violations.size());
        assertTrue(violations.stream().anyMatch(v -> v.getPropertyPath().toString().equals("trainBars")));
        assertTrue(violations.stream().anyMatch(v -> v.getPropertyPath().toString().equals("testBars")));
    }

    private BacktestRequest createValidRequest() {
        return BacktestRequest.builder()
                .policy("MA_CROSSOVER")
                .symbol("AAPL")
                .startDate(LocalDate.of(2023, 1, 1))
                .endDate(LocalDate.of(2023, 12, 31))
                .parameters(Map.of("fast", 10, "slow", 30))
                .build();
    }
}
