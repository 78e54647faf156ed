package com.plcopen.generator.codegen.translate;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ParameterOrderTrackerTest {

    @Test
    void testFreeOrderIsClaimedAsRequested() {
        ParameterOrderTracker tracker = new ParameterOrderTracker();

        assertThat(tracker.claim("main", 0)).isEqualTo(0);
        assertThat(tracker.claim("main", 1)).isEqualTo(1);
        assertThat(tracker.claim("main", 5)).isEqualTo(5);
    }

    @Test
    void testCollisionMovesToNextFreeOrder() {
        ParameterOrderTracker tracker = new ParameterOrderTracker();
        tracker.claim("fb", 0);
        tracker.claim("fb", 1);

        assertThat(tracker.claim("fb", 0)).isEqualTo(2);
        assertThat(tracker.claim("fb", 1)).isEqualTo(3);
    }

    @Test
    void testPouNamesAreIndependent() {
        ParameterOrderTracker tracker = new ParameterOrderTracker();
        tracker.claim("a", 0);

        assertThat(tracker.claim("b", 0)).isEqualTo(0);
        assertThat(tracker.claim("b", 1)).isEqualTo(1);
    }

    @Test
    void testPouNamesDifferingOnlyInCaseShareOrders() {
        ParameterOrderTracker tracker = new ParameterOrderTracker();

        assertThat(tracker.claim("Motor", 0)).isEqualTo(0);
        assertThat(tracker.claim("MOTOR", 0)).isEqualTo(1);
        assertThat(tracker.claim("motor", 0)).isEqualTo(2);
    }

    @Test
    void testOverflowIsReported() {
        ParameterOrderTracker tracker = new ParameterOrderTracker();
        tracker.claim("p", Long.MAX_VALUE);

        assertThatThrownBy(() -> tracker.claim("p", Long.MAX_VALUE)).isInstanceOf(ArithmeticException.class);
    }
}
