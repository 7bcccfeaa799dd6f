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
package io.nativecollections.util.concurrent;

import io.nativecollections.util.AtomicSafetyHandle;
import io.nativecollections.util.NativeContainer;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.PromiseCombiner;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.util.concurrent.RejectedExecutionException;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * 将容器整体交给一个异步任务执行，并通过{@link Future}发布完成信号。
 * <p>
 * 容器本身不是线程安全的，这里使用的是和netty的EventLoop相同的思路：不加锁，而是把容器的访问权交给唯一的一个线程。
 * 任务执行期间，其它线程对容器的访问会被{@link AtomicSafetyHandle}拒绝，直到任务的future完成。
 * 调用方一般这样使用：
 * <pre>{@code
 * Future<Void> future = JobScheduler.schedule(executor, job, queue);
 * future.syncUninterruptibly();
 * queue.dequeue();
 * }</pre>
 * 返回的future是不可取消的，任务要么完整执行，要么失败。
 *
 * Hands containers to exactly one job running on an {@link EventExecutor} and publishes the job's completion
 * through a {@link Future}. Until that future completes, other threads are refused access to the containers.
 * Jobs cannot be cancelled.
 */
public final class JobScheduler {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(JobScheduler.class);

    private JobScheduler() {
    }

    /**
     * Schedules {@code job} on {@code executor}, handing it the given containers.
     *
     * @see #schedule(EventExecutor, Future, Job, NativeContainer...)
     */
    public static Future<Void> schedule(EventExecutor executor, Job job, NativeContainer... containers) {
        return schedule(executor, null, job, containers);
    }

    /**
     * 在{@code dependsOn}成功完成之后执行{@code job}。
     * 如果{@code dependsOn}失败，任务不会执行，返回的future以相同的原因失败。
     * 已经被另一个未完成的任务独占的容器，只能交给直接依赖于该任务的新任务。
     *
     * Schedules {@code job} on {@code executor} once {@code dependsOn} has succeeded. If the dependency fails, the job
     * does not run and the returned future fails with the same cause.
     *
     * @param dependsOn the future to wait for, or {@code null}
     * @return a future which is notified once the job has finished and released the containers
     * @throws IllegalArgumentException if a container cannot be handed to a job
     * @throws io.nativecollections.util.ConcurrentAccessException if a container is owned by a job other than
     *         {@code dependsOn}
     */
    public static Future<Void> schedule(final EventExecutor executor, Future<?> dependsOn, Job job,
                                        NativeContainer... containers) {
        checkNotNull(executor, "executor");
        checkNotNull(job, "job");
        checkNotNull(containers, "containers");

        final AtomicSafetyHandle[] handles = new AtomicSafetyHandle[containers.length];
        for (int i = 0; i < containers.length; i++) {
            handles[i] = checkNotNull(containers[i], "containers[" + i + ']').safetyHandle();
            if (!handles[i].isSchedulable()) {
                throw new IllegalArgumentException(
                        "containers[" + i + "]: " + containers[i] + " (expected: a container which allows jobs)");
            }
            handles[i].checkScheduleAndThrow(dependsOn);
        }

        final Promise<Void> promise = executor.newPromise();
        promise.setUncancellable();
        for (AtomicSafetyHandle handle : handles) {
            handle.scheduleJob(promise, dependsOn);
        }

        final JobTask task = new JobTask(promise, job, handles);
        if (dependsOn == null) {
            execute(executor, task, promise);
        } else {
            dependsOn.addListener(new FutureListener<Object>() {
                @Override
                public void operationComplete(Future<Object> future) {
                    if (future.isSuccess()) {
                        execute(executor, task, promise);
                    } else {
                        promise.tryFailure(future.cause());
                    }
                }
            });
        }
        return promise;
    }

    /**
     * 合并多个future，所有future完成后返回的future才完成，任意一个失败则失败。
     *
     * Returns a future which completes once all {@code dependencies} have completed; it fails if any of them fails.
     */
    public static Future<Void> combineDependencies(final EventExecutor executor, final Future<?>... dependencies) {
        checkNotNull(executor, "executor");
        checkNotNull(dependencies, "dependencies");
        final Promise<Void> aggregate = executor.newPromise();
        // PromiseCombiner只能在EventLoop线程中使用
        if (executor.inEventLoop()) {
            combine0(executor, aggregate, dependencies);
        } else {
            execute(executor, new Runnable() {
                @Override
                public void run() {
                    combine0(executor, aggregate, dependencies);
                }
            }, aggregate);
        }
        return aggregate;
    }

    private static void combine0(EventExecutor executor, Promise<Void> aggregate, Future<?>[] dependencies) {
        PromiseCombiner combiner = new PromiseCombiner(executor);
        combiner.addAll(dependencies);
        combiner.finish(aggregate);
    }

    /**
     * 在{@code inputDeps}完成之后(无论成功与否)执行{@code release}。
     * 释放总是会执行：如果{@code executor}拒绝了释放任务，则在当前线程释放。
     *
     * Runs {@code release} on {@code executor} once {@code inputDeps} has completed, successfully or not. If the
     * executor rejects the task, the release runs on the calling thread instead so the storage is never leaked.
     *
     * @param inputDeps the future to wait for, or {@code null}
     * @return a future which is notified once {@code release} has run
     */
    public static Future<Void> scheduleDispose(final EventExecutor executor, Future<?> inputDeps,
                                               final Runnable release) {
        checkNotNull(executor, "executor");
        checkNotNull(release, "release");

        final Promise<Void> promise = executor.newPromise();
        promise.setUncancellable();
        final Runnable task = new Runnable() {
            @Override
            public void run() {
                try {
                    release.run();
                    promise.trySuccess(null);
                } catch (Throwable t) {
                    logger.warn("Failed to release the storage of a disposed container.", t);
                    promise.tryFailure(t);
                }
            }
        };
        if (inputDeps == null) {
            submitDispose(executor, task);
        } else {
            inputDeps.addListener(new FutureListener<Object>() {
                @Override
                public void operationComplete(Future<Object> future) {
                    submitDispose(executor, task);
                }
            });
        }
        return promise;
    }

    private static void submitDispose(EventExecutor executor, Runnable task) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            logger.warn("Dispose task rejected by {}, releasing on the calling thread.", executor, e);
            task.run();
        }
    }

    private static void execute(EventExecutor executor, Runnable task, Promise<Void> promise) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            promise.tryFailure(e);
        }
    }
}
