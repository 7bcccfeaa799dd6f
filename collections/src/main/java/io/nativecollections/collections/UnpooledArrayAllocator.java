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

import java.util.Arrays;

import static io.netty.util.internal.ObjectUtil.checkNotNull;
import static io.netty.util.internal.ObjectUtil.checkPositiveOrZero;

/**
 * Allocates a fresh array for every request and leaves reuse to the garbage collector.
 */
public final class UnpooledArrayAllocator implements ArrayAllocator {

    public static final UnpooledArrayAllocator DEFAULT = new UnpooledArrayAllocator();

    private UnpooledArrayAllocator() {
    }

    @Override
    public Object[] allocate(int capacity) {
        return new Object[checkPositiveOrZero(capacity, "capacity")];
    }

    @Override
    public Object[] reallocate(Object[] array, int length, int newCapacity) {
        checkNotNull(array, "array");
        checkPositiveOrZero(newCapacity, "newCapacity");
        Object[] newArray = new Object[newCapacity];
        System.arraycopy(array, 0, newArray, 0, Math.min(length, newCapacity));
        free(array);
        return newArray;
    }

    @Override
    public void free(Object[] array) {
        // 清除引用，即使调用方仍持有数组也不会阻止元素被回收
        Arrays.fill(array, null);
    }

    @Override
    public String toString() {
        return "UnpooledArrayAllocator";
    }
}
