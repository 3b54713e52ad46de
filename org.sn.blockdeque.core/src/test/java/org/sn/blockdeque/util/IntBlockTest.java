package org.sn.blockdeque.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.sn.blockdeque.testutils.TestUtil.assertException;

import org.junit.jupiter.api.Test;


public class IntBlockTest {
    @Test
    void testEmpty() {
        IntBlock block = new IntBlock(4);
        assertTrue(block.isEmpty());
        assertFalse(block.isFull());
        assertEquals(0, block.size());
        assertEquals(4, block.capacity());
        assertEquals(0, block.head());
        assertEquals(0, block.tail());
        assertFalse(block.isHeadShifted());
        assertFalse(block.isRightClose());
        assertTrue(block.canPushFront());
        assertTrue(block.canPushBack());
        assertEquals("0[]", block.toString());
    }

    @Test
    void testPushBackFromEmpty() {
        IntBlock block = new IntBlock(4);
        block.pushBack(1);
        assertEquals("0[1]", block.toString());
        assertEquals(0, block.head());
        assertEquals(0, block.tail());
        assertFalse(block.canPushFront());
        block.pushBack(2);
        block.pushBack(3);
        assertEquals("0[1,2,3]", block.toString());
        assertFalse(block.isRightClose());
        assertTrue(block.canPushBack());

        block.pushBack(4);
        assertEquals("0[1,2,3,4]", block.toString());
        assertTrue(block.isFull());
        assertTrue(block.isRightClose());
        assertFalse(block.canPushBack());
        assertEquals(3, block.tail());
    }

    @Test
    void testPushFrontFromEmpty() {
        IntBlock block = new IntBlock(4);
        block.pushFront(5);
        assertEquals("3[5]", block.toString());
        assertEquals(3, block.head());
        assertEquals(3, block.tail());
        assertTrue(block.isHeadShifted());
        assertTrue(block.isRightClose());
        assertFalse(block.canPushBack());

        block.pushFront(6);
        block.pushFront(7);
        block.pushFront(8);
        assertEquals("0[8,7,6,5]", block.toString());
        assertTrue(block.isFull());
        assertFalse(block.isHeadShifted());
        assertFalse(block.canPushFront());
    }

    @Test
    void testPopFrontOpensRoomAtFront() {
        IntBlock block = new IntBlock(4);
        for (int i = 1; i <= 4; i++) {
            block.pushBack(i);
        }
        assertEquals(1, block.popFront());
        assertEquals("1[2,3,4]", block.toString());
        assertTrue(block.isHeadShifted());
        assertTrue(block.isRightClose());
        assertFalse(block.isFull());
        assertTrue(block.canPushFront());

        block.pushFront(9);
        assertEquals("0[9,2,3,4]", block.toString());
    }

    @Test
    void testPopToEmptyForgetsDirection() {
        IntBlock block = new IntBlock(4);
        block.pushFront(5);
        block.pushFront(6);
        assertEquals("2[6,5]", block.toString());
        assertEquals(5, block.popBack());
        assertEquals("2[6]", block.toString());
        assertEquals(6, block.popBack());
        assertTrue(block.isEmpty());
        assertEquals(0, block.head());
        assertEquals(0, block.tail());

        block.pushBack(7);
        assertEquals("0[7]", block.toString());
        assertEquals(7, block.popFront());
        assertTrue(block.isEmpty());

        block.pushFront(8);
        assertEquals("3[8]", block.toString());
    }

    @Test
    void testGetAndSet() {
        IntBlock block = new IntBlock(4);
        block.pushFront(20);
        block.pushFront(10);
        assertEquals(10, block.get(0));
        assertEquals(20, block.get(1));
        assertEquals(20, block.set(1, 21));
        assertEquals(21, block.get(1));
        assertEquals("2[10,21]", block.toString());
    }

    @Test
    void testFilled() {
        IntBlock block = new IntBlock(4, 3, 8);
        assertEquals("0[8,8,8]", block.toString());
        assertEquals(3, block.size());
        assertEquals(2, block.tail());
        assertFalse(block.isRightClose());
        block.pushBack(9);
        assertEquals("0[8,8,8,9]", block.toString());
        assertTrue(block.isFull());
    }

    @Test
    void testCopy() {
        IntBlock block = new IntBlock(4);
        block.pushFront(1);
        block.pushFront(2);
        IntBlock copy = new IntBlock(block);
        assertEquals("2[2,1]", copy.toString());

        copy.set(0, 99);
        copy.pushFront(3);
        assertEquals("1[3,99,1]", copy.toString());
        assertEquals("2[2,1]", block.toString());

        block.popBack();
        assertEquals("1[3,99,1]", copy.toString());
    }

    @Test
    void testPreconditionsAreAsserted() {
        assumeTrue(IntBlock.class.desiredAssertionStatus(), "assertions are disabled");

        IntBlock full = new IntBlock(2, 2, 0);
        assertException(() -> full.pushBack(1), AssertionError.class);
        assertException(() -> full.pushFront(1), AssertionError.class);

        IntBlock leftAligned = new IntBlock(2);
        leftAligned.pushBack(1);
        assertException(() -> leftAligned.pushFront(0), AssertionError.class);

        IntBlock rightAligned = new IntBlock(2);
        rightAligned.pushFront(1);
        assertException(() -> rightAligned.pushBack(2), AssertionError.class);

        IntBlock empty = new IntBlock(2);
        assertException(empty::popBack, AssertionError.class);
        assertException(empty::popFront, AssertionError.class);
        assertException(() -> empty.get(0), AssertionError.class);
    }
}
