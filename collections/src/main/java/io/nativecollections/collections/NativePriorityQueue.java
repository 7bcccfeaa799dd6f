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

import io.nativecollections.util.AtomicSafetyHandle;
import io.nativecollections.util.NativeContainer;
import io.nativecollections.util.concurrent.JobScheduler;
import io.netty.util.ResourceLeakDetector;
import io.netty.util.ResourceLeakDetectorFactory;
import io.netty.util.ResourceLeakTracker;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.internal.StringUtil;

import static io.netty.util.internal.ObjectUtil.checkNotNull;
import static io.netty.util.internal.ObjectUtil.checkPositiveOrZero;

/**
 * 基于数组的二叉最小堆优先级队列，每个节点都记录自己所在的槽位。
 *
 * <h3>存储结构</h3>
 * 节点存储在一个{@link UnsafeList}中，槽位0是哨兵，永远不会被当作有效数据读取，这样父子节点的下标计算更简单：
 * 父节点为{@code i >> 1}，子节点为{@code 2i}和{@code 2i + 1}。
 * 每次把节点写入槽位{@code i}时，写入的节点的{@link Node#index()}都等于{@code i}。
 *
 * <h3>删除</h3>
 * 删除任意槽位的节点时，将最后一个节点移动到该槽位，缩短列表，然后将移动过来的节点向上或向下调整(swap-and-truncate)。
 *
 * <h3>线程模型</h3>
 * 队列不是线程安全的，要求单写者。如果需要在其它线程中批量操作队列，使用
 * {@link JobScheduler#schedule(EventExecutor, io.nativecollections.util.concurrent.Job, NativeContainer...)}
 * 将队列整体交给一个任务，在任务的future完成之前，其它线程的访问会被{@link AtomicSafetyHandle}拒绝。
 *
 * <h3>释放</h3>
 * 队列独占其底层存储，必须通过{@link #dispose()}显式释放，释放之后的任何操作都会抛出
 * {@link io.netty.util.IllegalReferenceCountException}。非{@link Allocator#TEMP}的队列会被netty的
 * {@link ResourceLeakDetector}追踪，未释放就被回收的队列会被报告。
 *
 * An array-backed binary min-heap which tracks the slot of every node. Slot {@code 0} is a sentinel; the parent
 * of slot {@code i} is {@code i >> 1} and its children are {@code 2i} and {@code 2i + 1}. The queue owns its backing
 * storage until {@link #dispose()} is called. It is not thread-safe.
 *
 * @param <T> the value type, compared with {@link Object#equals(Object)}
 */
public final class NativePriorityQueue<T> implements IndexedPriorityQueue<T>, NativeContainer {

    @SuppressWarnings("rawtypes")
    private static final ResourceLeakDetector<NativePriorityQueue> leakDetector =
            ResourceLeakDetectorFactory.instance().newResourceLeakDetector(NativePriorityQueue.class);

    private final UnsafeList<Node<T>> nodes;
    private final AtomicSafetyHandle safety;
    private final Allocator allocator;
    @SuppressWarnings("rawtypes")
    private final ResourceLeakTracker<NativePriorityQueue> leak;

    public NativePriorityQueue(int initialCapacity, Allocator allocator) {
        this(initialCapacity, allocator, ArrayAllocator.DEFAULT);
    }

    /**
     * @param initialCapacity the number of nodes the queue can hold before it has to grow
     * @param allocator the allocation strategy, {@link Allocator#TEMP}, {@link Allocator#TEMP_JOB} or
     *                  {@link Allocator#PERSISTENT}
     * @param arrayAllocator hands out the backing arrays
     * @throws IllegalArgumentException if {@code initialCapacity} is negative or {@code allocator} is not valid
     * @throws CapacityOverflowException if {@code initialCapacity} is too large for an array
     */
    public NativePriorityQueue(int initialCapacity, Allocator allocator, ArrayAllocator arrayAllocator) {
        checkNotNull(allocator, "allocator");
        if (!allocator.isValid()) {
            throw new IllegalArgumentException(
                    "allocator: " + allocator + " (expected: TEMP, TEMP_JOB or PERSISTENT)");
        }
        checkPositiveOrZero(initialCapacity, "initialCapacity");
        // 额外的一个槽位是哨兵
        UnsafeList.checkCapacity(initialCapacity + 1L);
        this.allocator = allocator;
        nodes = new UnsafeList<Node<T>>(initialCapacity + 1, arrayAllocator);
        nodes.add(null);
        safety = new AtomicSafetyHandle(AtomicSafetyHandle.collectionsChecksEnabled(), allocator.allowsJobs());
        leak = allocator.isLeakTracked() ? leakDetector.track(this) : null;
    }

    public Allocator allocator() {
        return allocator;
    }

    @Override
    public AtomicSafetyHandle safetyHandle() {
        return safety;
    }

    @Override
    public boolean isCreated() {
        return !safety.isReleased();
    }

    @Override
    public int length() {
        safety.checkReadAndThrow();
        return lengthUnsafe();
    }

    @Override
    public int capacity() {
        safety.checkReadAndThrow();
        return nodes.capacity() - 1;
    }

    @Override
    public boolean isEmpty() {
        return length() == 0;
    }

    /**
     * 调整容量，可用于缩容，但不能小于当前节点数量。
     *
     * Resizes the backing storage to hold {@code capacity} nodes.
     *
     * @throws IllegalArgumentException if {@code capacity} is smaller than {@link #length()}
     * @throws CapacityOverflowException if {@code capacity} is too large for an array
     */
    public void setCapacity(int capacity) {
        safety.checkWriteAndThrow();
        checkPositiveOrZero(capacity, "capacity");
        UnsafeList.checkCapacity(capacity + 1L);
        int length = lengthUnsafe();
        if (capacity < length) {
            throw new IllegalArgumentException("capacity: " + capacity + " (expected: >= length(" + length + "))");
        }
        nodes.setCapacity(capacity + 1);
    }

    @Override
    public void enqueue(T value, int priority) {
        checkNotNull(value, "value");
        safety.checkWriteAndThrow();

        Node<T> node = new Node<T>(value, priority, lengthUnsafe() + 1);
        // 扩容失败时队列保持不变
        nodes.add(node);
        cascadeUp(node);
    }

    @Override
    public void enqueue(Node<T> node, int priority) {
        checkNotNull(node, "node");
        enqueue(node.value(), priority);
    }

    @Override
    public Node<T> dequeue() {
        safety.checkWriteAndThrow();

        int length = lengthUnsafe();
        if (length == 0) {
            throw new EmptyQueueException();
        }
        Node<T> returnMe = nodes._get(1);
        if (length == 1) {
            nodes.removeLast();
            return returnMe;
        }

        // 原来的最后一个节点现在在根节点的位置，向下调整
        Node<T> formerLast = removeAtSwapBackUnsafe(1);
        cascadeDown(formerLast);
        return returnMe;
    }

    @Override
    public Node<T> peek() {
        safety.checkReadAndThrow();
        if (lengthUnsafe() == 0) {
            throw new EmptyQueueException();
        }
        return nodes._get(1);
    }

    @Override
    public boolean contains(Node<T> node) {
        checkNotNull(node, "node");
        safety.checkReadAndThrow();
        return containsUnsafe(node);
    }

    @Override
    public boolean remove(Node<T> node) {
        checkNotNull(node, "node");
        safety.checkWriteAndThrow();
        if (!containsUnsafe(node)) {
            return false;
        }
        removeAtUnsafe(node.index());
        return true;
    }

    @Override
    public Node<T> updatePriority(Node<T> node, int priority) {
        checkNotNull(node, "node");
        safety.checkWriteAndThrow();
        if (!containsUnsafe(node)) {
            throw new IllegalArgumentException("node is not in this queue: " + node);
        }
        return onNodeUpdatedUnsafe(node.withPriority(priority));
    }

    @Override
    public int removeByValue(final T value) {
        checkNotNull(value, "value");
        safety.checkWriteAndThrow();
        return removeMatchingUnsafe(new NodeMatcher<T>() {
            @Override
            public boolean matches(Node<T> node) {
                return value.equals(node.value());
            }
        });
    }

    @Override
    public int removeByPriority(final int priority) {
        safety.checkWriteAndThrow();
        return removeMatchingUnsafe(new NodeMatcher<T>() {
            @Override
            public boolean matches(Node<T> node) {
                return node.priority() == priority;
            }
        });
    }

    /**
     * 更新所有匹配节点的优先级。
     * <p>
     * 节点向下调整之后，它原来的槽位被一个还没有检查过的子节点占据，因此该槽位需要重新检查。
     * 已经更新过的节点优先级等于{@code priority}，再次遇到时会被跳过。
     */
    @Override
    public void updatePriorityByValue(T value, int priority) {
        checkNotNull(value, "value");
        safety.checkWriteAndThrow();

        int i = 1;
        while (i <= lengthUnsafe()) {
            Node<T> node = nodes._get(i);
            if (node.priority() == priority || !value.equals(node.value())) {
                i++;
                continue;
            }
            Node<T> updated = onNodeUpdatedUnsafe(node.withPriority(priority));
            if (updated.index() <= i) {
                i++;
            }
        }
    }

    @Override
    public void clear() {
        safety.checkWriteAndThrow();
        nodes.clear();
        nodes.add(null);
    }

    @Override
    public void dispose() {
        safety.checkDeallocateAndThrow();
        safety.release();
        deallocate();
    }

    @Override
    public Future<Void> dispose(EventExecutor executor, Future<?> inputDeps) {
        checkNotNull(executor, "executor");
        // 正在独占队列的任务必须包含在inputDeps中
        safety.checkScheduleAndThrow(inputDeps);
        safety.release();
        return JobScheduler.scheduleDispose(executor, inputDeps, new Runnable() {
            @Override
            public void run() {
                deallocate();
            }
        });
    }

    @Override
    public void close() {
        dispose();
    }

    private void deallocate() {
        if (leak != null) {
            boolean closed = leak.close(this);
            assert closed;
        }
        nodes.release();
    }

    /**
     * Reads a slot without any checks. Slot {@code 0} is the sentinel.
     */
    Node<T> readUnsafe(int index) {
        return nodes._get(index);
    }

    private int lengthUnsafe() {
        return nodes.length() - 1;
    }

    private boolean containsUnsafe(Node<T> node) {
        int index = node.index();
        if (index < 1 || index > lengthUnsafe()) {
            return false;
        }
        return node.equals(nodes._get(index));
    }

    /**
     * 向上调整(heapify-up)。父节点优先级不低于(数值小于等于)该节点时停止，相同优先级时父节点不动。
     *
     * @return the node as written to its final slot
     */
    private Node<T> cascadeUp(Node<T> node) {
        int index = node.index();
        while (index > 1) {
            int parentIndex = index >> 1;
            Node<T> parent = nodes._get(parentIndex);
            if (hasHigherOrEqualPriority(parent, node)) {
                break;
            }
            // 父节点下移，为该节点腾出位置
            nodes._set(index, parent.withIndex(index));
            index = parentIndex;
        }
        Node<T> placed = node.withIndex(index);
        nodes._set(index, placed);
        return placed;
    }

    /**
     * 向下调整(heapify-down)。只有子节点的优先级严格更高时才交换；两个子节点优先级相同时选择右子节点。
     *
     * @return the node as written to its final slot
     */
    private Node<T> cascadeDown(Node<T> node) {
        final int length = lengthUnsafe();
        // 下标大于half的节点是叶子节点
        final int half = length >>> 1;
        int index = node.index();
        while (index <= half) {
            int childLeftIndex = index << 1;
            int childRightIndex = childLeftIndex + 1;
            Node<T> childLeft = nodes._get(childLeftIndex);
            Node<T> child;
            int childIndex;
            if (hasHigherPriority(childLeft, node)) {
                if (childRightIndex > length) {
                    child = childLeft;
                    childIndex = childLeftIndex;
                } else {
                    Node<T> childRight = nodes._get(childRightIndex);
                    if (hasHigherPriority(childLeft, childRight)) {
                        child = childLeft;
                        childIndex = childLeftIndex;
                    } else {
                        child = childRight;
                        childIndex = childRightIndex;
                    }
                }
            } else if (childRightIndex > length) {
                break;
            } else {
                Node<T> childRight = nodes._get(childRightIndex);
                if (!hasHigherPriority(childRight, node)) {
                    break;
                }
                child = childRight;
                childIndex = childRightIndex;
            }
            nodes._set(index, child.withIndex(index));
            index = childIndex;
        }
        Node<T> placed = node.withIndex(index);
        nodes._set(index, placed);
        return placed;
    }

    /**
     * 节点优先级改变(或被移动到新的槽位)之后，向上或向下调整。根节点总是向下调整。
     */
    private Node<T> onNodeUpdatedUnsafe(Node<T> node) {
        int parentIndex = node.index() >> 1;
        if (parentIndex > 0 && hasHigherPriority(node, nodes._get(parentIndex))) {
            return cascadeUp(node);
        }
        return cascadeDown(node);
    }

    /**
     * 删除所有匹配的节点。
     * <p>
     * 向前遍历，在槽位{@code i}发现匹配时，先直接删除末尾所有匹配的节点，这样移动到槽位{@code i}的节点一定不匹配；
     * 移动过来的节点调整之后，槽位{@code i}中可能是一个还没检查过的节点，所以不前进，重新检查槽位{@code i}。
     * 向下调整只会把下标大于{@code i}的节点上移到不小于{@code i}的槽位，向上调整只会移动已经检查过的祖先节点，
     * 因此每个节点都会被检查到。
     */
    private int removeMatchingUnsafe(NodeMatcher<T> matcher) {
        int removed = 0;
        int i = 1;
        while (i <= lengthUnsafe()) {
            if (!matcher.matches(nodes._get(i))) {
                i++;
                continue;
            }
            int last = lengthUnsafe();
            while (last > i && matcher.matches(nodes._get(last))) {
                nodes.removeLast();
                removed++;
                last--;
            }
            removeAtUnsafe(i);
            removed++;
        }
        return removed;
    }

    private void removeAtUnsafe(int index) {
        if (index == lengthUnsafe()) {
            nodes.removeLast();
            return;
        }
        Node<T> formerLast = removeAtSwapBackUnsafe(index);
        // 原来的最后一个节点来自另一棵子树，可能需要向上调整
        onNodeUpdatedUnsafe(formerLast);
    }

    /**
     * 将最后一个节点移动到{@code index}，并缩短列表。调用方必须紧接着调整返回的节点。
     *
     * @return the former last node, now at {@code index}
     */
    private Node<T> removeAtSwapBackUnsafe(int index) {
        Node<T> formerLast = nodes._get(lengthUnsafe()).withIndex(index);
        nodes._set(index, formerLast);
        nodes.removeLast();
        return formerLast;
    }

    /**
     * Returns true if {@code higher} has a strictly lower priority value than {@code lower}. Ties return false.
     */
    private static boolean hasHigherPriority(Node<?> higher, Node<?> lower) {
        return higher.priority() < lower.priority();
    }

    /**
     * Returns true if {@code higher} has a lower or equal priority value than {@code lower}. Ties return true.
     */
    private static boolean hasHigherOrEqualPriority(Node<?> higher, Node<?> lower) {
        return higher.priority() <= lower.priority();
    }

    @Override
    public String toString() {
        if (safety.isReleased()) {
            return StringUtil.simpleClassName(this) + "(disposed)";
        }
        return StringUtil.simpleClassName(this) + "(length: " + lengthUnsafe() + ", capacity: " +
                (nodes.capacity() - 1) + ", allocator: " + allocator + ')';
    }

    private interface NodeMatcher<T> {
        boolean matches(Node<T> node);
    }
}
