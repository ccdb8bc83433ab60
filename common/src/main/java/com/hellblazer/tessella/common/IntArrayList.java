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

import java.util.Arrays;
import java.util.RandomAccess;

/**
 * Unboxed growable list of ints. Used as the free-list and traversal stack of arena backed structures, so the tail
 * operations ({@link #push(int)}, {@link #pop()}) are the hot path.
 * <p>
 * Thread Safety: not thread safe.
 *
 * @author hal.hildebrand
 */
public final class IntArrayList implements RandomAccess {

    private static final int DEFAULT_CAPACITY = 10;

    private int[] array;
    private int   size;

    public IntArrayList() {
        this(DEFAULT_CAPACITY);
    }

    public IntArrayList(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("Initial capacity must be non-negative: " + initialCapacity);
        }
        array = new int[initialCapacity];
    }

    public void addInt(int element) {
        if (size == array.length) {
            grow();
        }
        array[size++] = element;
    }

    public void clear() {
        size = 0;
    }

    public boolean contains(int element) {
        return indexOf(element) != -1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof final IntArrayList other)) {
            return false;
        }
        return Arrays.equals(array, 0, size, other.array, 0, other.size);
    }

    public int getInt(int index) {
        ensureIndexInRange(index);
        return array[index];
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (int i = 0; i < size; i++) {
            result = (31 * result) + array[i];
        }
        return result;
    }

    public int indexOf(int element) {
        for (int i = 0; i < size; i++) {
            if (array[i] == element) {
                return i;
            }
        }
        return -1;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int peek() {
        if (size == 0) {
            throw new IllegalStateException("List is empty");
        }
        return array[size - 1];
    }

    /**
     * Remove and answer the last element
     */
    public int pop() {
        if (size == 0) {
            throw new IllegalStateException("List is empty");
        }
        return array[--size];
    }

    public void push(int element) {
        addInt(element);
    }

    /**
     * Remove the element at the index, swapping the last element into its slot. Order is not preserved.
     */
    public int removeSwap(int index) {
        ensureIndexInRange(index);
        int value = array[index];
        array[index] = array[--size];
        return value;
    }

    public int setInt(int index, int element) {
        ensureIndexInRange(index);
        int previousValue = array[index];
        array[index] = element;
        return previousValue;
    }

    public int size() {
        return size;
    }

    public int[] toArray() {
        return Arrays.copyOf(array, size);
    }

    @Override
    public String toString() {
        return Arrays.toString(toArray());
    }

    private void ensureIndexInRange(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index:" + index + ", Size:" + size);
        }
    }

    private void grow() {
        // Resize to 1.5x the size
        int length = ((size * 3) / 2) + 1;
        if (length < 0) {
            throw new OutOfMemoryError();
        }
        array = Arrays.copyOf(array, length);
    }
}
