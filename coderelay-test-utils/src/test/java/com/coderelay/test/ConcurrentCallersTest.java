package com.coderelay.test;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrentCallersTest {

    @Test
    void shouldReturnResultsIndexedByCaller() {
        List<Integer> results = ConcurrentCallers.race(4, index -> index * 10, Duration.ofSeconds(5));

        assertEquals(List.of(0, 10, 20, 30), results);
    }

    @Test
    void shouldReportFailingCaller() {
        assertThrows(AssertionError.class, () -> ConcurrentCallers.race(2, index -> {
            if (index == 1) {
                throw new IllegalStateException("boom");
            }
            return index;
        }, Duration.ofSeconds(5)));
    }
}
