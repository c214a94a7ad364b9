package com.causalbacktest.backtester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CausalBacktesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(CausalBacktesterApplication.class, args);
    }
}
