package com.example.storemap.service;

import com.example.storemap.model.LocationRollup;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.example.storemap.service.MapServices.product;
import static org.junit.jupiter.api.Assertions.*;

class LocationRollupCalculatorTest {

    private final LocationRollupCalculator calculator = new LocationRollupCalculator();

    @Test
    void testCompute_DistinctLocationsSortedByAisleThenShelf() {
        LocationRollup rollup = calculator.compute(List.of(
                product(1L, 1L, "Pasta", "B", "4"),
                product(1L, 2L, "Rice", "A", "7"),
                product(1L, 3L, "Flour", "A", "2"),
                product(1L, 4L, "Oats", "A", "2"),
                product(1L, 5L, "Bread", "A", null)));

        assertEquals(List.of("A", "A", "A", "B"), rollup.getAisles());
        assertEquals(Arrays.asList("2", "7", null, "4"), rollup.getShelves());
        assertEquals("A", rollup.getPrimaryAisle());
        assertEquals("2", rollup.getPrimaryShelf());
        assertEquals(4, rollup.getLocationCount());
    }

    @Test
    void testCompute_NoLocatedProducts() {
        assertNull(calculator.compute(List.of()));
        assertNull(calculator.compute(List.of(product(1L, 1L, "Gift Card", null, "1"))));
    }
}
