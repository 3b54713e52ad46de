package org.sn.blockdeque.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.sn.blockdeque.testutils.TestUtil.assertExceptionFromCallable;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;


public class DequeSettingsTest {
    @Test
    void testDefault() {
        assertEquals(128, DequeSettings.DEFAULT.getBlockCapacity());
        assertEquals(16, DequeSettings.DEFAULT.getInitialRingCapacity());
        assertSame(DequeSettings.DEFAULT, DequeSettings.of(128, 16));
        assertEquals("DequeSettings[blockCapacity=128, initialRingCapacity=16]", DequeSettings.DEFAULT.toString());
    }

    @Test
    void testEquals() {
        assertEquals(DequeSettings.of(3, 8), DequeSettings.of(3, 8));
        assertEquals(DequeSettings.of(3, 8).hashCode(), DequeSettings.of(3, 8).hashCode());
        assertNotEquals(DequeSettings.of(3, 8), DequeSettings.of(3, 4));
        assertNotEquals(DequeSettings.of(3, 8), DequeSettings.of(4, 8));
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, -1 })
    void testInvalidBlockCapacity(int blockCapacity) {
        assertExceptionFromCallable(() -> DequeSettings.of(blockCapacity, 16),
                                    IllegalArgumentException.class,
                                    "blockCapacity must be greater than or equal to 1: " + blockCapacity);
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, -4, 3, 12, Integer.MIN_VALUE })
    void testInvalidInitialRingCapacity(int initialRingCapacity) {
        assertExceptionFromCallable(() -> DequeSettings.of(4, initialRingCapacity),
                                    IllegalArgumentException.class,
                                    "initialRingCapacity must be a positive power of two: " + initialRingCapacity);
    }

    @Test
    void testBlocksFor() {
        DequeSettings settings = DequeSettings.of(4, 2);
        assertEquals(1, settings.blocksFor(0));
        assertEquals(1, settings.blocksFor(1));
        assertEquals(1, settings.blocksFor(4));
        assertEquals(2, settings.blocksFor(5));
        assertEquals(3, settings.blocksFor(12));
    }

    @Test
    void testRingCapacityFor() {
        DequeSettings settings = DequeSettings.of(4, 2);
        assertEquals(2, settings.ringCapacityFor(0));
        assertEquals(2, settings.ringCapacityFor(8));
        assertEquals(4, settings.ringCapacityFor(9));
        assertEquals(4, settings.ringCapacityFor(16));
        assertEquals(8, settings.ringCapacityFor(17));
    }

    @Test
    void testRingCapacityForTooManyBlocks() {
        DequeSettings settings = DequeSettings.of(1, 1);
        assertEquals(1 << 30, settings.ringCapacityFor(1 << 30));
        assertExceptionFromCallable(() -> settings.ringCapacityFor((1 << 30) + 1),
                                    IllegalArgumentException.class,
                                    "Required ring capacity too large: elementCount=1073741825, blocks=1073741825");
        assertExceptionFromCallable(() -> settings.ringCapacityFor(Integer.MAX_VALUE),
                                    IllegalArgumentException.class);
        assertEquals(1 << 29, DequeSettings.of(4, 1).ringCapacityFor(Integer.MAX_VALUE - 3));
    }

    @Test
    void testDoubledRingCapacity() {
        assertEquals(2, DequeSettings.doubledRingCapacity(1));
        assertEquals(32, DequeSettings.doubledRingCapacity(16));
        assertEquals(1 << 30, DequeSettings.doubledRingCapacity(1 << 29));
        assertExceptionFromCallable(() -> DequeSettings.doubledRingCapacity(1 << 30),
                                    OutOfMemoryError.class,
                                    "Required ring capacity too large: 1073741824 slots are full");
    }
}
