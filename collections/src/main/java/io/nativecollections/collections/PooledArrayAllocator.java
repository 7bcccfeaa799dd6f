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

import io.netty.util.internal.MathUtil;
import io.netty.util.internal.SystemPropertyUtil;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.util.ArrayDeque;
import java.util.Arrays;

import static io.netty.util.internal.ObjectUtil.checkNotNull;
import static io.netty.util.internal.ObjectUtil.checkPositive;
import static io.netty.util.internal.ObjectUtil.checkPositiveOrZero;

/**
 * 池化的数组分配器。
 * <p>
 * 数组长度按2的幂分级，每一级缓存有限个被回收的数组。超过{@code maxPooledCapacity}的数组不进行池化。
 * 回收的数组会先清除所有引用，然后才放入缓存。
 *
 * Recycles arrays in power-of-two size classes. Each size class caches at most {@code maxCachedArrays} arrays;
 * arrays longer than {@code maxPooledCapacity} are never pooled.
 */
public final class PooledArrayAllocator implements ArrayAllocator {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(PooledArrayAllocator.class);

    private static final int DEFAULT_MAX_POOLED_CAPACITY;
    private static final int DEFAULT_MAX_CACHED_ARRAYS;

    static {
        DEFAULT_MAX_POOLED_CAPACITY = Math.max(1,
                SystemPropertyUtil.getInt("io.nativecollections.allocator.maxPooledCapacity", 1 << 16));
        DEFAULT_MAX_CACHED_ARRAYS = Math.max(0,
                SystemPropertyUtil.getInt("io.nativecollections.allocator.maxCachedArrays", 16));

        if (logger.isDebugEnabled()) {
            logger.debug("-Dio.nativecollections.allocator.maxPooledCapacity: {}", DEFAULT_MAX_POOLED_CAPACITY);
            logger.debug("-Dio.nativecollections.allocator.maxCachedArrays: {}", DEFAULT_MAX_CACHED_ARRAYS);
        }
    }

    public static final PooledArrayAllocator DEFAULT =
            new PooledArrayAllocator(DEFAULT_MAX_POOLED_CAPACITY, DEFAULT_MAX_CACHED_ARRAYS);

    private final int maxPooledCapacity;
    private final int maxCachedArrays;
    /**
     * 下标为数组长度以2为底的对数。
     */
    private final ArrayDeque<Object[]>[] caches;

    @SuppressWarnings("unchecked")
    public PooledArrayAllocator(int maxPooledCapacity, int maxCachedArrays) {
        checkPositive(maxPooledCapacity, "maxPooledCapacity");
        this.maxCachedArrays = checkPositiveOrZero(maxCachedArrays, "maxCachedArrays");
        this.maxPooledCapacity = MathUtil.findNextPositivePowerOfTwo(Math.min(maxPooledCapacity, 1 << 30));
        caches = new ArrayDeque[sizeIndex(this.maxPooledCapacity) + 1];
        for (int i = 0; i < caches.length; i++) {
            caches[i] = new ArrayDeque<Object[]>();
        }
    }

    public int maxPooledCapacity() {
        return maxPooledCapacity;
    }

    /**
     * 返回当前缓存的数组数量。
     *
     * Returns the number of arrays currently waiting in the caches.
     */
    public int cachedArrays() {
        int count = 0;
        for (ArrayDeque<Object[]> cache : caches) {
            synchronized (cache) {
                count += cache.size();
            }
        }
        return count;
    }

    @Override
    public Object[] allocate(int capacity) {
        checkPositiveOrZero(capacity, "capacity");
        if (capacity == 0 || capacity > maxPooledCapacity) {
            return new Object[capacity];
        }
        int normalized = MathUtil.findNextPositivePowerOfTwo(capacity);
        ArrayDeque<Object[]> cache = caches[sizeIndex(normalized)];
        Object[] array;
        synchronized (cache) {
            array = cache.pollFirst();
        }
        return array != null ? array : new Object[normalized];
    }

    @Override
    public Object[] reallocate(Object[] array, int length, int newCapacity) {
        checkNotNull(array, "array");
        Object[] newArray = allocate(newCapacity);
        System.arraycopy(array, 0, newArray, 0, Math.min(length, newCapacity));
        free(array);
        return newArray;
    }

    @Override
    public void free(Object[] array) {
        Arrays.fill(array, null);
        int capacity = array.length;
        // 只缓存本分配器分配的规格
        if (capacity == 0 || capacity > maxPooledCapacity || Integer.bitCount(capacity) != 1) {
            return;
        }
        ArrayDeque<Object[]> cache = caches[sizeIndex(capacity)];
        synchronized (cache) {
            if (cache.size() < maxCachedArrays) {
                cache.offerFirst(array);
            }
        }
    }

    private static int sizeIndex(int powerOfTwo) {
        return Integer.numberOfTrailingZeros(powerOfTwo);
    }

    @Override
    public String toString() {
        return "PooledArrayAllocator(maxPooledCapacity: " + maxPooledCapacity +
                ", maxCachedArrays: " + maxCachedArrays + ')';
    }
}
