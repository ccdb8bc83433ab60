/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Tessella.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.tessella.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class IntArrayListTest {

    @Test
    void testGrowth() {
        var list = new IntArrayList(0);
        for (int i = 0; i < 1000; i++) {
            list.addInt(i);
        }
        assertEquals(1000, list.size());
        for (int i = 0; i < 1000; i++) {
            assertEquals(i, list.getInt(i));
        }
    }

    @Test
    void testStackOperations() {
        var list = new IntArrayList();
        list.push(4);
        list.push(8);
        list.push(12);
        assertEquals(12, list.peek());
        assertEquals(12, list.pop());
        assertEquals(8, list.pop());
        assertEquals(1, list.size());
        assertEquals(4, list.pop());
        assertTrue(list.isEmpty());
        assertThrows(IllegalStateException.class, list::pop);
    }

    @Test
    void testRemoveSwapAndSearch() {
        var list = new IntArrayList();
        for (int i = 0; i < 5; i++) {
            list.addInt(i * 10);
        }
        assertEquals(10, list.removeSwap(1));
        assertEquals(40, list.getInt(1));
        assertFalse(list.contains(10));
        assertEquals(2, list.indexOf(20));
        assertEquals(4, list.size());
        assertThrows(IndexOutOfBoundsException.class, () -> list.getInt(4));
    }

    @Test
    void testEquality() {
        var a = new IntArrayList();
        var b = new IntArrayList(50);
        a.addInt(1);
        a.addInt(2);
        b.addInt(1);
        b.addInt(2);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        b.setInt(1, 3);
        assertNotEquals(a, b);
        assertArrayEquals(new int[] { 1, 3 }, b.toArray());
    }
}
