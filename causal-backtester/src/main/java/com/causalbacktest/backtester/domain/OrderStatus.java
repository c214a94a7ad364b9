package com.causalbacktest.backtester.domain;

public enum OrderStatus {
    PENDING, FILLED, CANCELLED
}
