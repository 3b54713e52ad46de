package org.sn.blockdeque.util;

import java.lang.System.Logger.Level;
import org.sn.blockdeque.annotations.NotThreadSafe;
import org.sn.blockdeque.annotations.Nullable;


/**
 * A ring of slots, each of which is empty or owns one {@link IntBlock}.
 * The populated slots are head, head+1, ..., tail, wrapping around the end of the slot array.
 *
 * <p>Blocks are added and removed only at the two ends of the ring.
 * When the ring is full the slot array doubles, and the blocks are moved (by reference) to the start of the new array.
 *
 * <p>Translating a flat index to a block relies on every block after the head block and before the tail block being full.
 * {@link BlockDeque} only adds a block next to an end block that has no more room on that side, which keeps this true.
 */
@NotThreadSafe
final class BlockRing {
    private static final System.Logger LOGGER = System.getLogger(BlockRing.class.getName());

    private DequeSettings settings;
    private IntBlock[] slots;
    private int head;
    private int tail;
    private int size;

    /**
     * Create a ring with one empty block.
     */
    BlockRing(DequeSettings settings) {
        this(settings, 0);
    }

    /**
     * Create a ring with one empty block and enough slots so that elementCount elements
     * can be pushed without expanding the ring.
     */
    BlockRing(DequeSettings settings, int elementCount) {
        this.settings = settings;
        this.slots = new IntBlock[settings.ringCapacityFor(elementCount)];
        this.slots[0] = new IntBlock(settings.getBlockCapacity());
        this.size = 1;
    }

    /**
     * Create a ring holding elementCount copies of filler.
     * Every block is full except the last, which holds what is left over.
     */
    BlockRing(DequeSettings settings, int elementCount, int filler) {
        this.settings = settings;
        int blockCapacity = settings.getBlockCapacity();
        int blocks = settings.blocksFor(elementCount);
        this.slots = new IntBlock[settings.ringCapacityFor(elementCount)];
        if (elementCount == 0) {
            slots[0] = new IntBlock(blockCapacity);
        } else {
            for (int i = 0; i < blocks - 1; i++) {
                slots[i] = new IntBlock(blockCapacity, blockCapacity, filler);
            }
            int remainder = elementCount - (blocks - 1) * blockCapacity;
            slots[blocks - 1] = new IntBlock(blockCapacity, remainder, filler);
        }
        this.tail = blocks - 1;
        this.size = blocks;
    }

    /**
     * Deep copy. The blocks keep the same ring positions as in the other ring.
     */
    BlockRing(BlockRing other) {
        this.settings = other.settings;
        this.slots = new IntBlock[other.slots.length];
        for (int i = 0; i < other.size; i++) {
            int ringIndex = other.ringIndex(i);
            slots[ringIndex] = new IntBlock(other.slots[ringIndex]);
        }
        this.head = other.head;
        this.tail = other.tail;
        this.size = other.size;
    }

    private int ringIndex(int ordinal) {
        return (head + ordinal) & (slots.length - 1);
    }

    private int next(int ringIndex) {
        return (ringIndex + 1) & (slots.length - 1);
    }

    private int previous(int ringIndex) {
        return (ringIndex - 1) & (slots.length - 1);
    }

    /**
     * Allocate an empty block in the slot after tail.
     * The caller must expand the ring first if it is full.
     */
    void addTailBlock() {
        assert !isFull() : "ring is full: size=" + size;
        if (size > 0) {
            tail = next(tail);
        }
        slots[tail] = new IntBlock(settings.getBlockCapacity());
        size++;
    }

    /**
     * Allocate an empty block in the slot before head.
     * The caller must expand the ring first if it is full.
     */
    void addHeadBlock() {
        assert !isFull() : "ring is full: size=" + size;
        if (size > 0) {
            head = previous(head);
        }
        slots[head] = new IntBlock(settings.getBlockCapacity());
        size++;
    }

    void deleteTailBlock() {
        assert size > 0 : "no blocks";
        slots[tail] = null;
        if (size == 1) {
            resetIndices();
        } else {
            tail = previous(tail);
            size--;
        }
    }

    void deleteHeadBlock() {
        assert size > 0 : "no blocks";
        slots[head] = null;
        if (size == 1) {
            resetIndices();
        } else {
            head = next(head);
            size--;
        }
    }

    private void resetIndices() {
        head = 0;
        tail = 0;
        size = 0;
    }

    /**
     * Double the number of slots. The blocks are moved to slots 0 .. size-1 keeping their order.
     */
    void expand() {
        int oldCapacity = slots.length;
        IntBlock[] newSlots = new IntBlock[DequeSettings.doubledRingCapacity(oldCapacity)];
        for (int i = 0; i < size; i++) {
            newSlots[i] = slots[ringIndex(i)];
        }
        slots = newSlots;
        head = 0;
        tail = Math.max(size - 1, 0);
        LOGGER.log(Level.TRACE, "Expanded block ring from {0} to {1} slots", oldCapacity, newSlots.length);
    }

    /**
     * Drop all blocks and go back to the initial capacity with one empty block.
     */
    void clear() {
        int oldCapacity = slots.length;
        slots = new IntBlock[settings.getInitialRingCapacity()];
        slots[0] = new IntBlock(settings.getBlockCapacity());
        head = 0;
        tail = 0;
        size = 1;
        LOGGER.log(Level.TRACE, "Cleared block ring from {0} to {1} slots", oldCapacity, slots.length);
    }

    /**
     * Exchange the blocks of two rings. No elements are copied.
     */
    void swap(BlockRing other) {
        DequeSettings tempSettings = settings;
        settings = other.settings;
        other.settings = tempSettings;

        IntBlock[] tempSlots = slots;
        slots = other.slots;
        other.slots = tempSlots;

        int temp = head;
        head = other.head;
        other.head = temp;

        temp = tail;
        tail = other.tail;
        other.tail = temp;

        temp = size;
        size = other.size;
        other.size = temp;
    }

    int get(int index) {
        IntBlock headBlock = slots[head];
        int headSize = headBlock.size();
        if (index < headSize) {
            return headBlock.get(index);
        }
        index -= headSize;
        int blockCapacity = settings.getBlockCapacity();
        return blockAfterHead(index / blockCapacity).get(index % blockCapacity);
    }

    /**
     * Replace the element at a flat index.
     *
     * @return the old value
     */
    int set(int index, int value) {
        IntBlock headBlock = slots[head];
        int headSize = headBlock.size();
        if (index < headSize) {
            return headBlock.set(index, value);
        }
        index -= headSize;
        int blockCapacity = settings.getBlockCapacity();
        return blockAfterHead(index / blockCapacity).set(index % blockCapacity, value);
    }

    private IntBlock blockAfterHead(int distance) {
        int ringIndex = (head + distance + 1) & (slots.length - 1);
        IntBlock block = slots[ringIndex];
        assert block != null : "no block at ring index " + ringIndex;
        assert ringIndex == tail || block.isFull() : "partially filled block in the middle of the ring: " + block;
        return block;
    }

    /**
     * Return the head block. If all blocks have been deleted, allocate a new one.
     */
    IntBlock headBlock() {
        ensureOneBlock();
        return slots[head];
    }

    /**
     * Return the tail block. If all blocks have been deleted, allocate a new one.
     */
    IntBlock tailBlock() {
        ensureOneBlock();
        return slots[tail];
    }

    private void ensureOneBlock() {
        if (size == 0) {
            slots[0] = new IntBlock(settings.getBlockCapacity());
            size = 1;
        }
    }

    boolean isFull() {
        return size == slots.length;
    }

    /**
     * True if there are no elements: either one empty block, or no blocks at all.
     */
    boolean isEmpty() {
        return size == 0 || (size == 1 && slots[head].isEmpty());
    }

    boolean isTailBlockFull() {
        return tailBlock().isFull();
    }

    boolean isHeadBlockFull() {
        return headBlock().isFull();
    }

    /**
     * True if the tail block has no room at the back.
     */
    boolean isTailBlockRightClose() {
        return tailBlock().isRightClose();
    }

    /**
     * True if the head block has no room at the front.
     */
    boolean isHeadBlockNotShifted() {
        return !headBlock().isHeadShifted();
    }

    int blockCount() {
        return size;
    }

    int capacity() {
        return slots.length;
    }

    int blockCapacity() {
        return settings.getBlockCapacity();
    }

    DequeSettings settings() {
        return settings;
    }

    /**
     * Return the block that is ordinal blocks after head.
     */
    IntBlock blockAt(int ordinal) {
        assert ordinal >= 0 && ordinal < size : "ordinal=" + ordinal + ", size=" + size;
        return slots[ringIndex(ordinal)];
    }

    /**
     * Return what is in a slot, which is null for a slot outside head .. tail.
     */
    @Nullable IntBlock slotAt(int ringIndex) {
        return slots[ringIndex];
    }

    int headIndex() {
        return head;
    }

    int tailIndex() {
        return tail;
    }

    /**
     * Debug string like "0[1,2,3] * 0[4,5,6] * 0[7]", one item per block from head to tail.
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < size; i++) {
            if (i > 0) {
                builder.append(" * ");
            }
            builder.append(slots[ringIndex(i)]);
        }
        return builder.toString();
    }
}
