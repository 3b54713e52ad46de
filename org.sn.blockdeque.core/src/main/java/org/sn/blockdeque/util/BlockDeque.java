package org.sn.blockdeque.util;

import java.util.Collection;
import java.util.ConcurrentModificationException;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.IntStream;
import java.util.stream.StreamSupport;
import org.sn.blockdeque.annotations.NotThreadSafe;


/**
 * A double ended queue of ints with random access.
 *
 * <p>Elements are stored in blocks of a fixed capacity, and the blocks are held in a ring of slots
 * (see {@link BlockRing}). Pushing or popping at either end is amortized O(1),
 * and {@code get(index)} and {@code set(index, value)} are O(1).
 * Unlike a growable array, growing the deque never copies the elements, only the references to the blocks.
 * Unlike a linked list, there is one allocation per block, not per element.
 *
 * <p>The class takes care that only the blocks at the two ends of the ring are partially filled:
 * a new block is added at the back only when the last block has no room at its back,
 * and a new block is added at the front only when the first block has no room at its front.
 *
 * <p>Popping the last element keeps the last block, so that pushing and popping one element on an empty deque
 * does not allocate each time. {@link #clear()} on the other hand throws away all blocks and shrinks the ring
 * back to its initial capacity.
 *
 * <p>Iterators are fail-fast.
 */
@NotThreadSafe
public class BlockDeque implements Iterable<Integer> {
    private BlockRing ring;
    private int size;
    private int modCount;

    /**
     * Create an empty deque with default settings.
     */
    public BlockDeque() {
        this(DequeSettings.DEFAULT);
    }

    /**
     * Create an empty deque.
     */
    public BlockDeque(DequeSettings settings) {
        this.ring = new BlockRing(settings);
    }

    /**
     * Create a deque of length zeros.
     *
     * @throws IllegalArgumentException if length is negative
     */
    public BlockDeque(int length) {
        this(DequeSettings.DEFAULT, length, 0);
    }

    private BlockDeque(DequeSettings settings, int length, int filler) {
        this.ring = new BlockRing(settings, checkLength(length), filler);
        this.size = length;
    }

    private BlockDeque(BlockRing ring) {
        this.ring = ring;
    }

    /**
     * Create a deque with the same elements and settings as another.
     * The blocks are copied, so changing one deque does not change the other.
     */
    public BlockDeque(BlockDeque other) {
        this.ring = new BlockRing(other.ring);
        this.size = other.size;
    }

    /**
     * Create a deque holding the elements of a collection, in iteration order.
     *
     * @throws NullPointerException if the collection contains null
     */
    public BlockDeque(Collection<Integer> elements) {
        this(new BlockRing(DequeSettings.DEFAULT, elements.size()));
        for (int element : elements) {
            pushBack(element);
        }
    }

    /**
     * Create a deque holding the given elements, in order.
     */
    public static BlockDeque of(int... elements) {
        return of(DequeSettings.DEFAULT, elements);
    }

    /**
     * Create a deque holding the given elements, in order.
     * The ring is sized up front, so it does not expand while the elements are added.
     */
    public static BlockDeque of(DequeSettings settings, int... elements) {
        BlockDeque deque = new BlockDeque(new BlockRing(settings, elements.length));
        for (int element : elements) {
            deque.pushBack(element);
        }
        return deque;
    }

    /**
     * Create a deque of length copies of filler.
     *
     * @throws IllegalArgumentException if length is negative
     */
    public static BlockDeque filled(int length, int filler) {
        return new BlockDeque(DequeSettings.DEFAULT, length, filler);
    }

    /**
     * Create a deque of length copies of filler.
     *
     * @throws IllegalArgumentException if length is negative
     */
    public static BlockDeque filled(DequeSettings settings, int length, int filler) {
        return new BlockDeque(settings, length, filler);
    }

    private static int checkLength(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be greater than or equal to 0: " + length);
        }
        return length;
    }

    public void pushBack(int value) {
        if (ring.isTailBlockFull() || ring.isTailBlockRightClose()) {
            if (ring.isFull()) {
                ring.expand();
            }
            ring.addTailBlock();
        }
        ring.tailBlock().pushBack(value);
        size++;
        modCount++;
    }

    public void pushFront(int value) {
        if (!ring.isEmpty() && (ring.isHeadBlockFull() || ring.isHeadBlockNotShifted())) {
            if (ring.isFull()) {
                ring.expand();
            }
            ring.addHeadBlock();
        }
        ring.headBlock().pushFront(value);
        size++;
        modCount++;
    }

    /**
     * Remove and return the last element.
     *
     * @throws NoSuchElementException if the deque is empty
     */
    public int popBack() {
        checkNotEmpty();
        IntBlock tailBlock = ring.tailBlock();
        int value = tailBlock.popBack();
        if (tailBlock.isEmpty() && size > 1) {
            ring.deleteTailBlock();
        }
        size--;
        modCount++;
        return value;
    }

    /**
     * Remove and return the first element.
     *
     * @throws NoSuchElementException if the deque is empty
     */
    public int popFront() {
        checkNotEmpty();
        IntBlock headBlock = ring.headBlock();
        int value = headBlock.popFront();
        if (headBlock.isEmpty() && size > 1) {
            ring.deleteHeadBlock();
        }
        size--;
        modCount++;
        return value;
    }

    /**
     * @throws NoSuchElementException if the deque is empty
     */
    public int getFirst() {
        checkNotEmpty();
        return ring.headBlock().get(0);
    }

    /**
     * @throws NoSuchElementException if the deque is empty
     */
    public int getLast() {
        checkNotEmpty();
        IntBlock tailBlock = ring.tailBlock();
        return tailBlock.get(tailBlock.size() - 1);
    }

    private void checkNotEmpty() {
        if (size == 0) {
            throw new NoSuchElementException("deque is empty");
        }
    }

    /**
     * Return the element at a position, where 0 is the first element.
     *
     * @throws IndexOutOfBoundsException if index is negative or not less than size
     */
    public int get(int index) {
        checkIndex(index);
        return ring.get(index);
    }

    /**
     * Replace the element at a position.
     *
     * @return the old value
     * @throws IndexOutOfBoundsException if index is negative or not less than size
     */
    public int set(int index, int value) {
        checkIndex(index);
        int old = ring.set(index, value);
        modCount++;
        return old;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index: " + index + ", Size: " + size);
        }
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Remove all elements, free all blocks, and shrink the ring to its initial capacity.
     */
    public void clear() {
        ring.clear();
        size = 0;
        modCount++;
    }

    /**
     * Replace the contents of this deque with a copy of another.
     */
    public void copyFrom(BlockDeque other) {
        if (this == other) {
            return;
        }
        ring = new BlockRing(other.ring);
        size = other.size;
        modCount++;
    }

    /**
     * Take over the blocks of source without copying them.
     * Afterwards source is empty, as if newly created with the same settings.
     */
    public void moveFrom(BlockDeque source) {
        if (this == source) {
            return;
        }
        ring = source.ring;
        size = source.size;
        source.ring = new BlockRing(ring.settings());
        source.size = 0;
        modCount++;
        source.modCount++;
    }

    /**
     * Exchange the contents of two deques without copying elements.
     */
    public void swap(BlockDeque other) {
        int tempSize = size;
        size = other.size;
        other.size = tempSize;
        ring.swap(other.ring);
        modCount++;
        other.modCount++;
    }

    public DequeSettings getSettings() {
        return ring.settings();
    }

    /**
     * Return an iterator from first to last element.
     * The iterator throws ConcurrentModificationException if the deque is changed other than through the iterator.
     */
    @Override
    public PrimitiveIterator.OfInt iterator() {
        return new DequeIterator();
    }

    @Override
    public Spliterator.OfInt spliterator() {
        return Spliterators.spliterator(iterator(), size, Spliterator.ORDERED | Spliterator.NONNULL);
    }

    public IntStream stream() {
        return StreamSupport.intStream(spliterator(), false);
    }

    public int[] toArray() {
        int[] array = new int[size];
        for (int i = 0; i < size; i++) {
            array[i] = ring.get(i);
        }
        return array;
    }

    BlockRing ring() {
        return ring;
    }

    private class DequeIterator implements PrimitiveIterator.OfInt {
        private int nextIndex;
        private int expectedModCount = modCount;

        @Override
        public boolean hasNext() {
            return nextIndex < size;
        }

        @Override
        public int nextInt() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
            if (nextIndex >= size) {
                throw new NoSuchElementException();
            }
            return ring.get(nextIndex++);
        }
    }

    /**
     * Two deques are equal if they have the same elements in the same order.
     * The settings are not compared.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof BlockDeque)) {
            return false;
        }
        BlockDeque that = (BlockDeque) obj;
        if (size != that.size) {
            return false;
        }
        for (int i = 0; i < size; i++) {
            if (ring.get(i) != that.ring.get(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Same as List.hashCode of the boxed elements.
     */
    @Override
    public int hashCode() {
        int hashCode = 1;
        for (int i = 0; i < size; i++) {
            hashCode = 31 * hashCode + Integer.hashCode(ring.get(i));
        }
        return hashCode;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("[");
        for (int i = 0; i < size; i++) {
            if (i > 0) {
                builder.append(", ");
            }
            builder.append(ring.get(i));
        }
        return builder.append(']').toString();
    }
}
