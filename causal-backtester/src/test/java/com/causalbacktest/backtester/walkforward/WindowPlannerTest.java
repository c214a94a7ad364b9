package com.causalbacktest.backtester.walkforward;

import com.causalbacktest.backtester.domain.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WindowPlannerTest {

    @Test
    void testDefaultStep_TestWindowsCoverRemainderOnce() {
        List<WindowSpec> windows = WindowPlanner.plan(100, config(50, 20, null, null));

        assertEquals(3, windows.size());
        assertEquals(new WindowSpec(0, 0, 50, 50, 70), windows.get(0));
        assertEquals(new WindowSpec(1, 20, 70, 70, 90), windows.get(1));
        // shorter last test window
        assertEquals(new WindowSpec(2, 40, 90, 90, 100), windows.get(2));
        assertEquals(10, windows.get(2).getTestBars());
        assertEquals(50, windows.get(2).getTrainBars());

        int expectedStart = 50;
        for (WindowSpec window : windows) {
            assertEquals(expectedStart, window.getTestStart());
            assertEquals(window.getTrainEnd(), window.getTestStart());
            expectedStart = window.getTestEnd();
        }
        assertEquals(100, expectedStart);
    }

    @Test
    void testExactFit_NoTailWindow() {
        List<WindowSpec> windows = WindowPlanner.plan(90, config(50, 20, null, null));

        assertEquals(2, windows.size());
        assertEquals(90, windows.get(1).getTestEnd());
    }

    @Test
    void testCustomStep_OverlappingWindowsWithoutTail() {
        List<WindowSpec> windows = WindowPlanner.plan(100, config(50, 20, 10, null));

        assertEquals(4, windows.size());
        assertEquals(30, windows.get(3).getTrainStart());
        assertEquals(100, windows.get(3).getTestEnd());
    }

    @Test
    void testWindowCount_TakesFirstWindows() {
        List<WindowSpec> windows = WindowPlanner.plan(100, config(50, 20, null, 2));

        assertEquals(2, windows.size());
        assertEquals(0, windows.get(0).getIndex());
    }

    @Test
    void testWindowCount_TooManyRejected() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> WindowPlanner.plan(100, config(50, 20, null, 5)));

        assertEquals("windowCount", ex.getField());
    }

    @Test
    void testTooFewBars_Rejected() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> WindowPlanner.plan(60, config(50, 20, null, null)));

        assertEquals("trainBars", ex.getField());
    }

    @Test
    void testInvalidSizes_Rejected() {
        assertEquals("testBars", assertThrows(ConfigurationException.class,
                () -> WindowPlanner.plan(100, config(50, 0, null, null))).getField());
        assertEquals("stepBars", assertThrows(ConfigurationException.class,
                () -> WindowPlanner.plan(100, config(50, 20, 0, null))).getField());
    }

    private static WalkForwardConfig config(int train, int test, Integer step, Integer count) {
        return WalkForwardConfig.builder()
                .trainBars(train)
                .testBars(test)
                .stepBars(step)
                .windowCount(count)
                .build();
    }
}
