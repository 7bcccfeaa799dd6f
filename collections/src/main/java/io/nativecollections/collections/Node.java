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

import io.netty.util.internal.ObjectUtil;

/**
 * 优先级队列中的一个节点快照：值、优先级和所在的槽位。
 * <p>
 * 节点是不可变的。队列每次把节点写入槽位{@code i}时，写入的都是{@code index == i}的新快照，
 * 因此调用方持有的旧快照在槽位内容变化之后会被{@link IndexedPriorityQueue#contains(Node)}识别为过期。
 *
 * An immutable snapshot of a queue entry. Equality covers value, priority and index.
 *
 * @param <T> the value type
 */
public final class Node<T> {

    private final T value;
    private final int priority;
    private final int index;

    /**
     * 创建一个不在任何队列中的节点，可以直接传给{@link IndexedPriorityQueue#enqueue(Node, int)}。
     *
     * Returns a node which is not in any queue yet.
     */
    public static <T> Node<T> of(T value) {
        return new Node<T>(ObjectUtil.checkNotNull(value, "value"), 0, 0);
    }

    Node(T value, int priority, int index) {
        this.value = value;
        this.priority = priority;
        this.index = index;
    }

    public T value() {
        return value;
    }

    public int priority() {
        return priority;
    }

    /**
     * 快照生成时节点所在的槽位(从1开始)，0表示不在队列中。
     *
     * The 1-based slot the node occupied when this snapshot was taken, or {@code 0} if it was never queued.
     */
    public int index() {
        return index;
    }

    Node<T> withIndex(int index) {
        return index == this.index ? this : new Node<T>(value, priority, index);
    }

    Node<T> withPriority(int priority) {
        return priority == this.priority ? this : new Node<T>(value, priority, index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Node)) {
            return false;
        }
        Node<?> that = (Node<?>) o;
        return index == that.index && priority == that.priority && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * value.hashCode() + priority) + index;
    }

    @Override
    public String toString() {
        return "Node [" + value + ", " + priority + ", " + index + ']';
    }
}
