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
package io.nativecollections.util;

import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;

/**
 * 一个显式释放的容器。
 * 容器独占自己的底层存储，直到{@link #dispose()}被调用。释放之后的任何访问都会立即失败，而不是产生未定义的行为。
 *
 * A container that owns its backing storage exclusively until it is disposed. Any access after disposal fails
 * fast with an {@link io.netty.util.IllegalReferenceCountException}.
 * <p>
 * A container may be handed to exactly one job at a time through
 * {@link io.nativecollections.util.concurrent.JobScheduler}. Its {@link AtomicSafetyHandle} rejects access from
 * other threads until the job's future completes.
 * </p>
 */
public interface NativeContainer extends AutoCloseable {

    /**
     * 返回保护该容器的安全句柄。
     *
     * Returns the handle which guards access to this container.
     */
    AtomicSafetyHandle safetyHandle();

    /**
     * 当且仅当容器还未被释放时返回true。
     *
     * Returns {@code true} if and only if this container has not been disposed yet.
     */
    boolean isCreated();

    /**
     * 立即释放底层存储。如果容器已被释放，或者正被某个任务独占，则抛出异常。
     *
     * Releases the backing storage right away.
     *
     * @throws io.netty.util.IllegalReferenceCountException if the container was already disposed
     * @throws ConcurrentAccessException if a scheduled job still owns the container
     */
    void dispose();

    /**
     * 在{@code inputDeps}完成之后，由{@code executor}释放底层存储。
     * 调用方在该方法返回之后就不能再访问容器了，但是已经调度的任务仍然可以访问，直到它们完成。
     * 如果容器正被某个任务独占，{@code inputDeps}必须是该任务的future。
     *
     * Schedules the release of the backing storage on {@code executor} once {@code inputDeps} completes. The
     * container becomes unusable for the caller as soon as this method returns; jobs that are already scheduled
     * keep their access until they complete, so {@code inputDeps} must be the future of the job which currently
     * owns the container.
     *
     * @param inputDeps the jobs which must complete first, or {@code null} to release as soon as possible
     * @return a future which is notified once the storage has been released
     * @throws io.netty.util.IllegalReferenceCountException if the container was already disposed
     * @throws ConcurrentAccessException if the job which currently owns the container is not {@code inputDeps}
     */
    Future<Void> dispose(EventExecutor executor, Future<?> inputDeps);

    /**
     * Same as {@link #dispose()}, so containers can be used in try-with-resources blocks.
     */
    @Override
    void close();
}
