package com.causalbacktest.backtester.service;

import com.causalbacktest.backtester.controller.dto.BacktestRequest;
import com.causalbacktest.backtester.controller.dto.BacktestResponse;

/**
 * Service interface for single backtest runs.
 */
public interface BacktestService {

    /**
     * Load the requested data and run one backtest to completion.
     *
     * @param request the backtest request
     * @return the full run output
     */
    BacktestResponse runBacktest(BacktestRequest request);
}
