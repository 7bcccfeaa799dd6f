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

import io.netty.util.IllegalReferenceCountException;
import io.netty.util.concurrent.Future;
import io.netty.util.internal.SystemPropertyUtil;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

/**
 * 容器的安全句柄，是一个可选的独占访问断言层。
 *
 * <h3>它做了什么</h3>
 * <ul>
 *     <li>容器释放之后的访问总是会失败(抛出{@link IllegalReferenceCountException})，这个检查不能关闭。</li>
 *     <li>容器交给任务之后，直到任务的{@link Future}完成，除任务线程以外的线程都不能读写容器，
 *     否则抛出{@link ConcurrentAccessException}。这个检查可以通过
 *     {@code -Dio.nativecollections.collectionsChecks=false}关闭。</li>
 * </ul>
 * 它并不是一个锁，它只是尽早地暴露错误的使用方式。容器本身仍然要求单写者。
 *
 * Guards a {@link NativeContainer} against use after release and against access from threads other than the
 * job which currently owns it. The release check is always on; the ownership check can be turned off with
 * {@code -Dio.nativecollections.collectionsChecks=false}.
 */
public final class AtomicSafetyHandle {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(AtomicSafetyHandle.class);

    private static final boolean COLLECTIONS_CHECKS =
            SystemPropertyUtil.getBoolean("io.nativecollections.collectionsChecks", true);

    static {
        if (logger.isDebugEnabled()) {
            logger.debug("-Dio.nativecollections.collectionsChecks: {}", COLLECTIONS_CHECKS);
        }
    }

    private static final AtomicIntegerFieldUpdater<AtomicSafetyHandle> RELEASED_UPDATER =
            AtomicIntegerFieldUpdater.newUpdater(AtomicSafetyHandle.class, "released");

    @SuppressWarnings("rawtypes")
    private static final AtomicReferenceFieldUpdater<AtomicSafetyHandle, Future> OWNER_UPDATER =
            AtomicReferenceFieldUpdater.newUpdater(AtomicSafetyHandle.class, Future.class, "owner");

    private final boolean checksEnabled;
    private final boolean schedulable;

    /**
     * 0: 存活, 1: 已释放
     */
    @SuppressWarnings("unused")
    private volatile int released;

    /**
     * 最近一次被调度的任务的future，未完成表示容器仍被任务独占。
     */
    private volatile Future<?> owner;

    /**
     * 正在执行任务的线程，只有在任务执行期间不为null。
     */
    private volatile Thread jobThread;

    public AtomicSafetyHandle() {
        this(COLLECTIONS_CHECKS);
    }

    public AtomicSafetyHandle(boolean checksEnabled) {
        this(checksEnabled, true);
    }

    /**
     * @param checksEnabled whether job ownership is checked
     * @param schedulable whether the container may be handed to a job at all
     */
    public AtomicSafetyHandle(boolean checksEnabled, boolean schedulable) {
        this.checksEnabled = checksEnabled;
        this.schedulable = schedulable;
    }

    /**
     * Returns {@code true} if containers created with the default constructor check job ownership.
     */
    public static boolean collectionsChecksEnabled() {
        return COLLECTIONS_CHECKS;
    }

    public boolean checksEnabled() {
        return checksEnabled;
    }

    /**
     * 临时容器不能交给任务。
     *
     * Returns {@code false} if the container must never be handed to a job.
     */
    public boolean isSchedulable() {
        return schedulable;
    }

    public boolean isReleased() {
        return released != 0;
    }

    /**
     * 当且仅当有任务独占容器(任务的future还未完成)时返回true。
     *
     * Returns {@code true} if a scheduled job has not completed yet.
     */
    public boolean isOwnedByJob() {
        Future<?> owner = this.owner;
        return owner != null && !owner.isDone();
    }

    /**
     * Fails unless the caller may read the container.
     */
    public void checkReadAndThrow() {
        checkAccess("read");
    }

    /**
     * Fails unless the caller may write the container.
     */
    public void checkWriteAndThrow() {
        checkAccess("write");
    }

    /**
     * 检查容器是否还存活(未释放)，不检查任务的所有权。调度任务时使用。
     *
     * Fails if the container was released, regardless of job ownership.
     */
    public void checkExistsAndThrow() {
        if (isReleased() && !inJobThread()) {
            throw new IllegalReferenceCountException(0);
        }
    }

    /**
     * 检查调用方是否可以立即释放容器。已释放或者正被任务独占时失败。
     *
     * Fails unless the container may be released synchronously by the caller.
     */
    public void checkDeallocateAndThrow() {
        if (isReleased()) {
            throw new IllegalReferenceCountException(0, -1);
        }
        if (checksEnabled && isOwnedByJob()) {
            throw new ConcurrentAccessException(
                    "cannot dispose a container while a scheduled job owns it; " +
                    "wait for the job or use dispose(executor, inputDeps)");
        }
    }

    /**
     * 标记容器为已释放。重复释放将抛出{@link IllegalReferenceCountException}。
     *
     * Marks the container released. Releasing twice fails with {@link IllegalReferenceCountException}.
     */
    public void release() {
        if (!RELEASED_UPDATER.compareAndSet(this, 0, 1)) {
            throw new IllegalReferenceCountException(0, -1);
        }
    }

    /**
     * 将容器的所有权交给{@code job}。
     * 如果已经有一个未完成的任务独占容器，那么新的任务必须依赖于它({@code dependsOn}就是它的future)，否则失败。
     *
     * Transfers ownership of the container to {@code job}. If another job still owns the container, the new job
     * must depend on it directly.
     *
     * @throws ConcurrentAccessException if the current owner is still running and is not {@code dependsOn}
     */
    public void scheduleJob(Future<?> job, Future<?> dependsOn) {
        for (;;) {
            Future<?> current = owner;
            checkSchedule(current, dependsOn);
            if (OWNER_UPDATER.compareAndSet(this, current, job)) {
                return;
            }
        }
    }

    /**
     * 与{@link #scheduleJob(Future, Future)}进行相同的检查，但不转移所有权。
     *
     * Runs the checks of {@link #scheduleJob(Future, Future)} without transferring ownership.
     */
    public void checkScheduleAndThrow(Future<?> dependsOn) {
        checkSchedule(owner, dependsOn);
    }

    private void checkSchedule(Future<?> current, Future<?> dependsOn) {
        checkExistsAndThrow();
        if (current != null && !current.isDone() && current != dependsOn) {
            throw new ConcurrentAccessException(
                    "the container is owned by another scheduled job; pass that job's future as a dependency");
        }
    }

    /**
     * Called by the job's thread right before the job starts.
     */
    public void enterJob() {
        jobThread = Thread.currentThread();
    }

    /**
     * Called by the job's thread once the job has finished, before its future is notified.
     */
    public void exitJob() {
        if (jobThread == Thread.currentThread()) {
            jobThread = null;
        }
    }

    private boolean inJobThread() {
        Thread jobThread = this.jobThread;
        return jobThread != null && jobThread == Thread.currentThread();
    }

    private void checkAccess(String access) {
        if (inJobThread()) {
            return;
        }
        if (isReleased()) {
            throw new IllegalReferenceCountException(0);
        }
        if (checksEnabled && isOwnedByJob()) {
            throw new ConcurrentAccessException(
                    "cannot " + access + " a container while a scheduled job owns it; wait for the job's future first");
        }
    }
}
