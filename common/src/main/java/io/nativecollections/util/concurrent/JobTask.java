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
import io.netty.util.concurrent.Promise;

/**
 * 持有一个{@link Promise}和一个{@link Job}，而不是继承{@code DefaultPromise}。
 * 结果只由自己赋值，外部只能看见{@link JobScheduler}返回的{@link io.netty.util.concurrent.Future}。
 * <p>
 * 执行顺序：进入所有容器的独占状态 -> 执行任务 -> 退出独占状态 -> 通知promise。
 * 必须先退出独占状态再通知promise，否则等待future的线程被唤醒之后仍然可能访问失败。
 *
 * Runs a {@link Job} on behalf of its containers and completes the job's promise once ownership of the
 * containers has been handed back.
 */
final class JobTask implements Runnable {

    private final Promise<Void> promise;
    private final Job job;
    private final AtomicSafetyHandle[] handles;

    JobTask(Promise<Void> promise, Job job, AtomicSafetyHandle[] handles) {
        this.promise = promise;
        this.job = job;
        this.handles = handles;
    }

    @Override
    public void run() {
        for (AtomicSafetyHandle handle : handles) {
            handle.enterJob();
        }
        Throwable cause = null;
        try {
            job.execute();
        } catch (Throwable t) {
            cause = t;
        } finally {
            for (AtomicSafetyHandle handle : handles) {
                handle.exitJob();
            }
        }
        if (cause == null) {
            promise.trySuccess(null);
        } else {
            promise.tryFailure(cause);
        }
    }

    @Override
    public String toString() {
        return "JobTask(job: " + job + ", promise: " + promise + ')';
    }
}
