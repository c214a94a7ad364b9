package com.causalbacktest.backtester.execution;

import com.causalbacktest.backtester.TestBars;
import com.causalbacktest.backtester.domain.CancelReason;
import com.causalbacktest.backtester.domain.ErrorCategory;
import com.causalbacktest.backtester.domain.Fill;
import com.causalbacktest.backtester.domain.LedgerAnnotation;
import com.causalbacktest.backtester.domain.Order;
import com.causalbacktest.backtester.domain.OrderSide;
import com.causalbacktest.backtester.domain.OrderStatus;
import com.causalbacktest.backtester.domain.OrderType;
import com.causalbacktest.backtester.domain.Portfolio;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the pending-order book.
 */
class BrokerTest {

    @Test
    void testMarketOrder_FillsOnNextBar() {
        Broker broker = broker("10000", ExecutionSettings.frictionless());
        Order order = broker.submit(OrderSide.BUY, OrderType.MARKET, 10, null, null, 0, TestBars.START);

        List<Fill> fills = broker.processPendingOrders(TestBars.flatBar(1, 101), 1);

        assertEquals(1, fills.size());
        assertEquals(OrderStatus.FILLED, order.getStatus());
        assertEquals(1, order.getFilledAtBarIndex());
        assertEquals(0, broker.getPendingCount());
        assertEquals(10, broker.getPortfolio().getPosition().getQuantity());
    }

    @Test
    void testOrdersMatchedInSubmissionOrder() {
        Broker broker = broker("1500", ExecutionSettings.frictionless());
        Order first = broker.submit(OrderSide.BUY, OrderType.MARKET, 10, null, null, 0, TestBars.START);
        Order second = broker.submit(OrderSide.BUY, OrderType.MARKET, 10, null, null, 0, TestBars.START);

        broker.processPendingOrders(TestBars.flatBar(1, 100), 1);

        // the first order uses the cash the second would need
        assertEquals(OrderStatus.FILLED, first.getStatus());
        assertEquals(OrderStatus.CANCELLED, second.getStatus());
        assertEquals(CancelReason.INSUFFICIENT_CASH, second.getCancelReason());
    }

    @Test
    void testRejectedFill_AnnotatedAndFillIdNotConsumed() {
        Broker broker = broker("1000", ExecutionSettings.frictionless());
        broker.submit(OrderSide.BUY, OrderType.MARKET, 100, null, null, 0, TestBars.START);
        broker.submit(OrderSide.BUY, OrderType.MARKET, 5, null, null, 0, TestBars.START);

        List<Fill> fills = broker.processPendingOrders(TestBars.flatBar(1, 100), 1);

        assertEquals(1, fills.size());
        assertEquals(1L, fills.get(0).getId());
        assertEquals(2L, fills.get(0).getOrderId());
        LedgerAnnotation annotation = broker.getAnnotations().get(0);
        assertEquals(ErrorCategory.EXECUTION, annotation.getCategory());
        assertEquals(CancelReason.INSUFFICIENT_CASH, annotation.getCancelReason());
        assertEquals(1L, annotation.getOrderId());
    }

    @Test
    void testUnfilledOrder_ExpiresAfterConfiguredBars() {
        Broker broker = broker("10000", ExecutionSettings.frictionless().toBuilder().orderExpiryBars(2).build());
        Order order = broker.submit(OrderSide.BUY, OrderType.LIMIT, 1, new BigDecimal("50"), null, 0, TestBars.START);

        broker.processPendingOrders(TestBars.flatBar(1, 100), 1);
        assertTrue(order.isPending(), "One bar old order should still be pending");

        broker.processPendingOrders(TestBars.flatBar(2, 100), 2);

        assertEquals(OrderStatus.CANCELLED, order.getStatus());
        assertEquals(CancelReason.EXPIRED, order.getCancelReason());
        assertEquals(CancelReason.EXPIRED, broker.getAnnotations().get(0).getCancelReason());
        assertEquals(0, broker.getPendingCount());
    }

    @Test
    void testSameBarOrder_NeverMatched() {
        Broker broker = broker("10000", ExecutionSettings.frictionless());
        broker.submit(OrderSide.BUY, OrderType.MARKET, 1, null, null, 3, TestBars.START);

        assertThrows(IllegalStateException.class, () -> broker.processPendingOrders(TestBars.flatBar(3, 100), 3));
    }

    @Test
    void testCancelAll_AnnotatesEachOrder() {
        Broker broker = broker("10000", ExecutionSettings.frictionless());
        broker.submit(OrderSide.BUY, OrderType.LIMIT, 1, new BigDecimal("50"), null, 0, TestBars.START);
        broker.submit(OrderSide.BUY, OrderType.LIMIT, 1, new BigDecimal("60"), null, 0, TestBars.START);

        int cancelled = broker.cancelAll(CancelReason.END_OF_DATA, ErrorCategory.EXECUTION, 0, TestBars.START);

        assertEquals(2, cancelled);
        assertEquals(0, broker.getPendingCount());
        assertEquals(2, broker.getAnnotations().size());
        assertTrue(broker.getOrders().stream().allMatch(o -> o.getCancelReason() == CancelReason.END_OF_DATA));
    }

    private static Broker broker(String cash, ExecutionSettings settings) {
        Portfolio portfolio = Portfolio.builder()
                .initialCash(new BigDecimal(cash))
                .allowShort(settings.isAllowShort())
                .marginEnabled(settings.isMarginEnabled())
                .build();
        return new Broker(new ExecutionModel(settings), portfolio);
    }
}
