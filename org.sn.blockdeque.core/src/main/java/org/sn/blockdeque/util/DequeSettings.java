package org.sn.blockdeque.util;

import java.util.Objects;


/**
 * Sizing of a {@link BlockDeque}: how many elements each block holds,
 * and how many block slots the ring starts with.
 *
 * <p>The ring capacity is a power of two. It doubles when the ring runs out of slots,
 * and goes back to {@code initialRingCapacity} when the deque is cleared.
 */
public final class DequeSettings {
    /**
     * 512 bytes worth of ints.
     */
    public static final int DEFAULT_BLOCK_CAPACITY = 512 / Integer.BYTES;
    public static final int DEFAULT_INITIAL_RING_CAPACITY = 1 << 4;

    /**
     * The largest power of two that is a valid array length.
     */
    static final int MAX_RING_CAPACITY = 1 << 30;

    public static final DequeSettings DEFAULT = new DequeSettings(DEFAULT_BLOCK_CAPACITY, DEFAULT_INITIAL_RING_CAPACITY);

    private final int blockCapacity;
    private final int initialRingCapacity;

    private DequeSettings(int blockCapacity, int initialRingCapacity) {
        this.blockCapacity = checkBlockCapacity(blockCapacity);
        this.initialRingCapacity = checkInitialRingCapacity(initialRingCapacity);
    }

    /**
     * Create settings.
     *
     * @param blockCapacity the number of elements in each block
     * @param initialRingCapacity the number of block slots in a new or cleared deque
     * @throws IllegalArgumentException if blockCapacity is less than 1,
     *         or if initialRingCapacity is not a positive power of two
     */
    public static DequeSettings of(int blockCapacity, int initialRingCapacity) {
        if (blockCapacity == DEFAULT_BLOCK_CAPACITY && initialRingCapacity == DEFAULT_INITIAL_RING_CAPACITY) {
            return DEFAULT;
        }
        return new DequeSettings(blockCapacity, initialRingCapacity);
    }

    private static int checkBlockCapacity(int blockCapacity) {
        if (blockCapacity < 1) {
            throw new IllegalArgumentException("blockCapacity must be greater than or equal to 1: " + blockCapacity);
        }
        return blockCapacity;
    }

    private static int checkInitialRingCapacity(int initialRingCapacity) {
        if (initialRingCapacity < 1 || Integer.bitCount(initialRingCapacity) != 1) {
            throw new IllegalArgumentException("initialRingCapacity must be a positive power of two: " + initialRingCapacity);
        }
        return initialRingCapacity;
    }

    public int getBlockCapacity() {
        return blockCapacity;
    }

    public int getInitialRingCapacity() {
        return initialRingCapacity;
    }

    /**
     * The number of blocks needed to hold elementCount elements, when every block but the last is full.
     * An empty deque still has one block.
     */
    int blocksFor(int elementCount) {
        if (elementCount == 0) {
            return 1;
        }
        return (elementCount - 1) / blockCapacity + 1;
    }

    /**
     * The ring capacity to hold elementCount elements without expanding:
     * the smallest power of two holding the blocks, but no less than the initial capacity.
     *
     * @throws IllegalArgumentException if the blocks do not fit in a ring of MAX_RING_CAPACITY slots
     */
    int ringCapacityFor(int elementCount) {
        int blocks = blocksFor(elementCount);
        if (blocks > MAX_RING_CAPACITY) {
            throw new IllegalArgumentException("Required ring capacity too large: elementCount=" + elementCount
                                                       + ", blocks=" + blocks);
        }
        int capacity = initialRingCapacity;
        while (capacity < blocks) {
            capacity <<= 1;
        }
        return capacity;
    }

    /**
     * The ring capacity after doubling a full ring.
     *
     * @throws OutOfMemoryError if the ring already has MAX_RING_CAPACITY slots
     */
    static int doubledRingCapacity(int capacity) {
        if (capacity >= MAX_RING_CAPACITY) {
            throw new OutOfMemoryError("Required ring capacity too large: " + capacity + " slots are full");
        }
        return capacity << 1;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof DequeSettings)) {
            return false;
        }
        DequeSettings that = (DequeSettings) obj;
        return blockCapacity == that.blockCapacity && initialRingCapacity == that.initialRingCapacity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(blockCapacity, initialRingCapacity);
    }

    @Override
    public String toString() {
        return "DequeSettings[blockCapacity=" + blockCapacity + ", initialRingCapacity=" + initialRingCapacity + "]";
    }
}
