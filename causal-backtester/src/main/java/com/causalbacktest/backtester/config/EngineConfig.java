package com.causalbacktest.backtester.config;

import com.causalbacktest.backtester.data.CsvBarLoader;
import com.causalbacktest.backtester.data.SyntheticBarGenerator;
import com.causalbacktest.backtester.optimizer.GridSearchOptimizer;
import com.causalbacktest.backtester.walkforward.WalkForwardAnalyzer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;

/**
 * Wires the plain-Java engine components into the application context.
 */
@Configuration
@EnableConfigurationProperties(BacktestProperties.class)
public class EngineConfig {

    @Bean
    public GridSearchOptimizer gridSearchOptimizer(@Qualifier("sweepExecutorService") ExecutorService executorService) {
        return new GridSearchOptimizer(executorService);
    }

    @Bean
    public WalkForwardAnalyzer walkForwardAnalyzer(GridSearchOptimizer gridSearchOptimizer) {
        return new WalkForwardAnalyzer(gridSearchOptimizer);
    }

    @Bean
    public CsvBarLoader csvBarLoader() {
        return new CsvBarLoader();
    }

    @Bean
    public SyntheticBarGenerator syntheticBarGenerator() {
        return new SyntheticBarGenerator();
    }
}
