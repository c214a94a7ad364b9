package com.causalbacktest.backtester.domain;

public enum OrderType {
    MARKET, LIMIT, STOP
}
