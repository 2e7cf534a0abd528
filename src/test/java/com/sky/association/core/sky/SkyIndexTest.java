package com.sky.association.core.sky;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SkyIndexTest {

    private record Point(String name, double ra, double dec) {}

    private SkyIndex<String, Point> index;

    @BeforeEach
    void setUp() {
        index = new SkyIndex<>(Point::name, p -> new SkyPosition(p.ra(), p.dec()));
    }

    private List<String> names(List<Point> points) {
        return points.stream().map(Point::name).toList();
    }

    @Test
    void returnsNearestFirst() {
        index.put(new Point("far", 10.0, 10.08));
        index.put(new Point("near", 10.0, 10.01));
        index.put(new Point("outside", 10.0, 10.5));

        assertEquals(List.of("near", "far"), names(index.within(10.0, 10.0, 0.1)));
    }

    @Test
    void findsItemsAcrossBandEdges() {
        index.put(new Point("below", 20.0, -0.01));
        index.put(new Point("above", 20.0, 0.01));

        assertEquals(2, index.within(20.0, 0.0, 0.02).size());
    }

    @Test
    void findsItemsAcrossZeroRa() {
        index.put(new Point("west", 359.99, 0.0));

        assertEquals(List.of("west"), names(index.within(0.01, 0.0, 0.05)));
    }

    @Test
    void putMovesExistingItem() {
        index.put(new Point("a", 10.0, 10.0));
        index.put(new Point("a", 50.0, -40.0));

        assertEquals(1, index.size());
        assertTrue(index.within(10.0, 10.0, 1.0).isEmpty());
        assertEquals(List.of("a"), names(index.within(50.0, -40.0, 0.1)));
    }

    @Test
    void removeAndClear() {
        index.put(new Point("a", 10.0, 10.0));
        index.put(new Point("b", 10.0, 10.0));

        assertTrue(index.remove("a"));
        assertFalse(index.remove("a"));
        assertEquals(1, index.size());

        index.clear();
        assertTrue(index.within(10.0, 10.0, 1.0).isEmpty());
    }

    @Test
    void conesClampAtThePole() {
        index.put(new Point("pole", 0.0, 89.99));

        assertEquals(1, index.within(180.0, 89.95, 0.1).size());
    }

    @Test
    void rejectsNonPositiveBandHeight() {
        assertThrows(IllegalArgumentException.class,
                () -> new SkyIndex<String, Point>(0.0, Point::name, p -> new SkyPosition(p.ra(), p.dec())));
    }
}
