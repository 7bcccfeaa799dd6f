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
 * 基于下标追踪的最小堆优先级队列。
 * 优先级是一个{@code int}，数值越小优先级越高。相同优先级的节点之间不保证任何顺序。
 * <p>
 * 每个节点都记录了自己当前所在的槽位，因此可以在O(log n)时间内删除或更新任意节点，而不需要遍历寻找。
 * 和{@link java.util.concurrent.ScheduledThreadPoolExecutor}中自定义的优先级队列思路是一样的。
 *
 * A min-heap priority queue which tracks the slot of every node, so arbitrary nodes can be removed or
 * re-prioritised in O(log n). Lower priority values are dequeued first; equal priorities come out in no
 * particular order. Implementations are not thread-safe.
 *
 * @param <T> the value type
 */
public interface IndexedPriorityQueue<T> {

    /**
     * 返回队列中的节点数量。
     *
     * Returns the number of nodes in the queue.
     */
    int length();

    /**
     * 返回不需要扩容就能容纳的节点数量。入队时容量会自动增长。
     *
     * Returns the number of nodes the queue can hold before it has to grow. Capacity grows automatically.
     */
    int capacity();

    boolean isEmpty();

    /**
     * 以{@code priority}将{@code value}入队。
     *
     * Adds {@code value} with the given {@code priority}.
     *
     * @throws NullPointerException if {@code value} is {@code null}
     * @throws CapacityOverflowException if the queue cannot grow any further; the queue is left unchanged
     */
    void enqueue(T value, int priority);

    /**
     * 和{@link #enqueue(Object, int)}相同，只使用{@code node}的值，它原有的优先级和下标会被忽略。
     *
     * Same as {@link #enqueue(Object, int)} using the value of {@code node}; its priority and index are ignored.
     */
    void enqueue(Node<T> node, int priority);

    /**
     * 删除并返回优先级最高(数值最小)的节点。
     *
     * Removes and returns the node with the lowest priority value.
     *
     * @throws EmptyQueueException if the queue is empty
     */
    Node<T> dequeue();

    /**
     * 返回但不删除优先级最高的节点。
     *
     * Returns the node with the lowest priority value without removing it.
     *
     * @throws EmptyQueueException if the queue is empty
     */
    Node<T> peek();

    /**
     * 检查{@code node}是否仍然是它所记录的槽位中的节点。
     * 这不是一个遍历查找，持有旧快照的调用方在槽位的内容变化之后会得到false。
     *
     * Returns {@code true} if the slot recorded in {@code node} still holds exactly {@code node}. This is a
     * stale-handle check, not a membership scan.
     */
    boolean contains(Node<T> node);

    /**
     * 删除{@code node}。如果{@code node}已经过期(见{@link #contains(Node)})，返回false且不做任何修改。
     *
     * Removes {@code node} from its slot. Returns {@code false} and leaves the queue untouched if the handle is stale.
     */
    boolean remove(Node<T> node);

    /**
     * 通知队列该节点的优先级发生改变，队列会调整以保证堆的性质。
     *
     * Changes the priority of {@code node} and moves it to restore the heap order.
     *
     * @return the node's new snapshot
     * @throws IllegalArgumentException if the handle is stale
     */
    Node<T> updatePriority(Node<T> node, int priority);

    /**
     * 删除所有值等于{@code value}的节点。
     *
     * Removes every node whose value equals {@code value}.
     *
     * @return the number of removed nodes
     */
    int removeByValue(T value);

    /**
     * 删除所有优先级等于{@code priority}的节点。
     *
     * Removes every node with the given {@code priority}.
     *
     * @return the number of removed nodes
     */
    int removeByPriority(int priority);

    /**
     * 将所有值等于{@code value}的节点的优先级设为{@code priority}。
     *
     * Sets the priority of every node whose value equals {@code value}.
     */
    void updatePriorityByValue(T value, int priority);

    /**
     * 删除所有节点，保留容量。
     *
     * Removes all nodes, keeping the capacity.
     */
    void clear();
}
