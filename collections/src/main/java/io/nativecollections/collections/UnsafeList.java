/*
 * Copyright 2026 The Native Collections Project
 *
 * The Native Collections Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.nativecollections.collections;

import io.netty.util.AbstractReferenceCounted;
import io.netty.util.IllegalReferenceCountException;
import io.netty.util.internal.SystemPropertyUtil;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.util.Arrays;
import java.util.NoSuchElementException;

import static io.netty.util.internal.ObjectUtil.checkNotNull;
import static io.netty.util.internal.ObjectUtil.checkPositiveOrZero;

/**
 * 可增长的、引用计数的数组列表，是容器的底层存储。
 * <p>
 * 和{@code ByteBuf}一样，它的初始引用计数为1，引用计数变为0时底层数组会被归还给{@link ArrayAllocator}，
 * 之后的任何访问都会抛出{@link IllegalReferenceCountException}(可以通过
 * {@code -Dio.nativecollections.list.checkAccessible=false}关闭该检查)。
 * <p>
 * 容量按2倍增长，上限为{@link #MAX_CAPACITY}。超过上限的请求在修改任何状态之前就会失败。
 * 增长会重新分配数组，因此任何在列表外部缓存的数组引用都会失效。
 * <p>
 * 包内的{@link #_get(int)}和{@link #_set(int, Object)}不做任何检查，供堆的内部循环使用。
 *
 * A growable, reference-counted array list backing a native container. Once its reference count drops to
 * {@code 0} the array goes back to its {@link ArrayAllocator} and further access fails. Capacity doubles on growth
 * up to {@link #MAX_CAPACITY}. This class is not thread-safe.
 *
 * @param <E> the element type
 */
public final class UnsafeList<E> extends AbstractReferenceCounted {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(UnsafeList.class);

    /**
     * 一些虚拟机会在数组中保留一些头信息，与{@link java.util.ArrayList}保持一致。
     */
    public static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private static final boolean CHECK_ACCESSIBLE =
            SystemPropertyUtil.getBoolean("io.nativecollections.list.checkAccessible", true);

    static {
        if (logger.isDebugEnabled()) {
            logger.debug("-Dio.nativecollections.list.checkAccessible: {}", CHECK_ACCESSIBLE);
        }
    }

    private static final Object[] EMPTY_ELEMENTS = new Object[0];

    private final ArrayAllocator allocator;
    private Object[] elements;
    private int length;

    public UnsafeList(int initialCapacity) {
        this(initialCapacity, ArrayAllocator.DEFAULT);
    }

    public UnsafeList(int initialCapacity, ArrayAllocator allocator) {
        checkPositiveOrZero(initialCapacity, "initialCapacity");
        checkCapacity(initialCapacity);
        this.allocator = checkNotNull(allocator, "allocator");
        elements = allocator.allocate(initialCapacity);
    }

    public ArrayAllocator allocator() {
        return allocator;
    }

    /**
     * 返回元素的数量。
     *
     * Returns the number of elements.
     */
    public int length() {
        ensureAccessible();
        return length;
    }

    /**
     * 返回底层数组的长度。
     *
     * Returns the number of elements the list can hold without reallocating.
     */
    public int capacity() {
        ensureAccessible();
        return elements.length;
    }

    public E get(int index) {
        ensureAccessible();
        checkIndex(index);
        return _get(index);
    }

    public void set(int index, E element) {
        ensureAccessible();
        checkIndex(index);
        _set(index, element);
    }

    /**
     * 在末尾添加一个元素，必要时扩容。
     *
     * Appends {@code element}, growing the backing array first if it is full.
     *
     * @throws CapacityOverflowException if the list is already at {@link #MAX_CAPACITY}
     */
    public void add(E element) {
        ensureAccessible();
        if (length == elements.length) {
            grow(length + 1L);
        }
        elements[length++] = element;
    }

    /**
     * 删除并返回最后一个元素。
     *
     * Removes and returns the last element.
     */
    public E removeLast() {
        ensureAccessible();
        if (length == 0) {
            throw new NoSuchElementException("list is empty");
        }
        E last = _get(--length);
        elements[length] = null;
        return last;
    }

    /**
     * 用最后一个元素覆盖{@code index}处的元素，然后删除最后一个元素。
     *
     * Replaces the element at {@code index} with the last element and shrinks the list by one.
     *
     * @return the element which was at {@code index}
     */
    public E removeAtSwapBack(int index) {
        ensureAccessible();
        checkIndex(index);
        E removed = _get(index);
        int last = --length;
        elements[index] = elements[last];
        elements[last] = null;
        return removed;
    }

    /**
     * Makes sure the list can hold {@code minCapacity} elements without reallocating.
     *
     * @throws CapacityOverflowException if {@code minCapacity} exceeds {@link #MAX_CAPACITY}
     */
    public void ensureCapacity(int minCapacity) {
        ensureAccessible();
        checkPositiveOrZero(minCapacity, "minCapacity");
        if (minCapacity > elements.length) {
            grow(minCapacity);
        }
    }

    /**
     * 将底层数组调整为能容纳{@code capacity}个元素，可用于缩容。
     * 分配器可能分配比请求更大的数组。
     *
     * Reallocates the backing array to hold {@code capacity} elements. The allocator may hand out a larger array.
     *
     * @throws IllegalArgumentException if {@code capacity} is smaller than {@link #length()}
     */
    public void setCapacity(int capacity) {
        ensureAccessible();
        checkPositiveOrZero(capacity, "capacity");
        checkCapacity(capacity);
        if (capacity < length) {
            throw new IllegalArgumentException("capacity: " + capacity + " (expected: >= length(" + length + "))");
        }
        if (capacity != elements.length) {
            elements = allocator.reallocate(elements, length, capacity);
        }
    }

    /**
     * Removes all elements, keeping the capacity.
     */
    public void clear() {
        ensureAccessible();
        Arrays.fill(elements, 0, length, null);
        length = 0;
    }

    @SuppressWarnings("unchecked")
    E _get(int index) {
        return (E) elements[index];
    }

    void _set(int index, E element) {
        elements[index] = element;
    }

    private void grow(long minCapacity) {
        checkCapacity(minCapacity);
        int oldCapacity = elements.length;
        long newCapacity = Math.min(Math.max((long) oldCapacity << 1, minCapacity), MAX_CAPACITY);
        elements = allocator.reallocate(elements, length, (int) newCapacity);
    }

    static void checkCapacity(long capacity) {
        if (capacity > MAX_CAPACITY) {
            throw new CapacityOverflowException(capacity);
        }
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("index: " + index + " (expected: range(0, " + length + "))");
        }
    }

    private void ensureAccessible() {
        if (CHECK_ACCESSIBLE && refCnt() == 0) {
            throw new IllegalReferenceCountException(0);
        }
    }

    @Override
    public UnsafeList<E> retain() {
        super.retain();
        return this;
    }

    @Override
    public UnsafeList<E> retain(int increment) {
        super.retain(increment);
        return this;
    }

    @Override
    public UnsafeList<E> touch() {
        return this;
    }

    @Override
    public UnsafeList<E> touch(Object hint) {
        return this;
    }

    @Override
    protected void deallocate() {
        Object[] elements = this.elements;
        this.elements = EMPTY_ELEMENTS;
        length = 0;
        allocator.free(elements);
    }

    @Override
    public String toString() {
        if (refCnt() == 0) {
            return "UnsafeList(freed)";
        }
        return "UnsafeList(length: " + length + ", capacity: " + elements.length + ')';
    }
}
