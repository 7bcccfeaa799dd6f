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

/**
 * 实现类负责分配和回收容器的底层数组。实现类应该为线程安全的，因为容器可能在任务线程中被释放。
 *
 * Implementations are responsible to allocate and take back the arrays backing an {@link UnsafeList}.
 * Implementations of this interface are expected to be thread-safe.
 */
public interface ArrayAllocator {

    /**
     * 默认的分配器，通过{@code -Dio.nativecollections.allocator.type}选择({@code unpooled}或{@code pooled})。
     */
    ArrayAllocator DEFAULT = ArrayAllocatorUtil.DEFAULT_ALLOCATOR;

    /**
     * 分配一个长度至少为{@code capacity}的数组。
     *
     * Allocates an array which can hold at least {@code capacity} elements.
     */
    Object[] allocate(int capacity);

    /**
     * 分配一个长度至少为{@code newCapacity}的数组，拷贝{@code array}的前{@code length}个元素，然后回收{@code array}。
     *
     * Allocates an array which can hold at least {@code newCapacity} elements, copies the first {@code length}
     * elements of {@code array} into it and takes {@code array} back.
     */
    Object[] reallocate(Object[] array, int length, int newCapacity);

    /**
     * 回收数组。调用之后，调用方不能再访问该数组。
     *
     * Takes back an array. The caller must not touch {@code array} afterwards.
     */
    void free(Object[] array);
}
