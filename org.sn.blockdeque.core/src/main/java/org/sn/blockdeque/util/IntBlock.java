package org.sn.blockdeque.util;

import java.util.Arrays;
import org.sn.blockdeque.annotations.NotThreadSafe;


/**
 * A fixed capacity array of ints, of which a contiguous window {@code [head, tail]} is occupied.
 *
 * <p>The window never wraps around the end of the array.
 * An empty block has head == tail == 0, and its first write decides which way it grows:
 * pushFront puts the element in the last position of the array, so the block can only grow towards the front,
 * and pushBack puts the element in the first position, so the block can only grow towards the back.
 *
 * <p>The push and pop functions do not check for room. The caller must check the predicates first,
 * and the preconditions are asserted.
 */
@NotThreadSafe
final class IntBlock {
    private final int[] data;
    private int head;
    private int tail;
    private int size;

    IntBlock(int capacity) {
        this.data = new int[capacity];
    }

    /**
     * Create a block whose first size elements are filler.
     */
    IntBlock(int capacity, int size, int filler) {
        assert size >= 1 && size <= capacity : "size=" + size + ", capacity=" + capacity;
        this.data = new int[capacity];
        Arrays.fill(data, 0, size, filler);
        this.head = 0;
        this.tail = size - 1;
        this.size = size;
    }

    /**
     * Deep copy.
     */
    IntBlock(IntBlock other) {
        this.data = other.data.clone();
        this.head = other.head;
        this.tail = other.tail;
        this.size = other.size;
    }

    void pushBack(int value) {
        assert canPushBack() : "no room at back: " + this;
        if (size == 0) {
            head = 0;
            tail = 0;
        } else {
            tail++;
        }
        data[tail] = value;
        size++;
    }

    void pushFront(int value) {
        assert canPushFront() : "no room at front: " + this;
        if (size == 0) {
            head = data.length - 1;
            tail = head;
        } else {
            head--;
        }
        data[head] = value;
        size++;
    }

    int popBack() {
        assert size > 0 : "pop from empty block";
        int value = data[tail];
        data[tail] = 0;
        size--;
        if (size == 0) {
            reset();
        } else {
            tail--;
        }
        return value;
    }

    int popFront() {
        assert size > 0 : "pop from empty block";
        int value = data[head];
        data[head] = 0;
        size--;
        if (size == 0) {
            reset();
        } else {
            head++;
        }
        return value;
    }

    private void reset() {
        head = 0;
        tail = 0;
    }

    /**
     * Return the element at offset index from the start of the window.
     */
    int get(int index) {
        assert index >= 0 && index < size : "index=" + index + ", size=" + size;
        return data[head + index];
    }

    /**
     * Replace the element at offset index from the start of the window.
     *
     * @return the old value
     */
    int set(int index, int value) {
        assert index >= 0 && index < size : "index=" + index + ", size=" + size;
        int old = data[head + index];
        data[head + index] = value;
        return old;
    }

    int size() {
        return size;
    }

    int capacity() {
        return data.length;
    }

    int head() {
        return head;
    }

    int tail() {
        return tail;
    }

    boolean isEmpty() {
        return size == 0;
    }

    boolean isFull() {
        return size == data.length;
    }

    /**
     * True if the window does not start at the first position of the array.
     * When false there is no room at the front, even if the block is not full.
     */
    boolean isHeadShifted() {
        return head != 0;
    }

    /**
     * True if the window reaches the last position of the array, so there is no room at the back.
     */
    boolean isRightClose() {
        return head + size >= data.length;
    }

    boolean canPushFront() {
        return size == 0 || head > 0;
    }

    boolean canPushBack() {
        return size == 0 || tail < data.length - 1;
    }

    /**
     * Debug string like "3[7,8,9]" meaning the window starts at array position 3.
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(head).append('[');
        for (int i = 0; i < size; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(data[head + i]);
        }
        return builder.append(']').toString();
    }
}
