package com.causalbacktest.backtester.controller;

import com.causalbacktest.backtester.controller.dto.BacktestRequest;
import com.causalbacktest.backtester.controller.dto.BacktestResponse;
import com.causalbacktest.backtester.controller.dto.OptimizationRequest;
import com.causalbacktest.backtester.controller.dto.OptimizationResponse;
import com.causalbacktest.backtester.controller.dto.WalkForwardRequest;
import com.causalbacktest.backtester.controller.dto.WalkForwardResponse;
import com.causalbacktest.backtester.service.BacktestService;
import com.causalbacktest.backtester.service.OptimizationService;
import com.causalbacktest.backtester.service.WalkForwardService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for backtests, parameter sweeps and walk-forward analyses.
 * All three run synchronously and return the finished result.
 */
@RestController
@RequestMapping("/backtests")
@RequiredArgsConstructor
@Slf4j
public class BacktestController {

    private final BacktestService backtestService;
    private final OptimizationService optimizationService;
    private final WalkForwardService walkForwardService;

    /**
     * Run a single backtest.
     *
     * @param request the backtest request
     * @return trades, equity curve, annotations and summary of the run
     */
    @PostMapping
    public ResponseEntity<BacktestResponse> runBacktest(@Valid @RequestBody BacktestRequest request) {

        log.info("POST /backtests - Policy: {}, Symbol: {}", request.getPolicy(), request.getSymbol());

        return ResponseEntity.ok(backtestService.runBacktest(request));
    }

    /**
     * Run a grid-search parameter sweep.
     *
     * @param request the sweep request
     * @return the ranked result table
     */
    @PostMapping("/optimizations")
    public ResponseEntity<OptimizationResponse> optimize(@Valid @RequestBody OptimizationRequest request) {

        log.info("POST /backtests/optimizations - Policy: {}, Symbol: {}, Parameters: {}",
                request.getPolicy(), request.getSymbol(), request.getParameterGrid().keySet());

        return ResponseEntity.ok(optimizationService.optimize(request));
    }

    /**
     * Run a walk-forward analysis.
     *
     * @param request the walk-forward request
     * @return per-window results, stitched equity and aggregate statistics
     */
    @PostMapping("/walk-forward")
    public ResponseEntity<WalkForwardResponse> walkForward(@Valid @RequestBody WalkForwardRequest request) {

        log.info("POST /backtests/walk-forward - Policy: {}, Symbol: {}, Train: {}, Test: {}",
                request.getPolicy(), request.getSymbol(), request.getTrainBars(), request.getTestBars());

        return ResponseEntity.ok(walkForwardService.analyze(request));
    }
}
