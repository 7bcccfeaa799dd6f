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

/**
 * 一个批量操作容器的任务单元，由{@link JobScheduler}交给某个{@link io.netty.util.concurrent.EventExecutor}执行。
 * 执行期间它独占被调度的容器。
 *
 * A unit of deferred work over one or more {@link io.nativecollections.util.NativeContainer}s. While it runs, the
 * job owns the containers it was scheduled with.
 */
public interface Job {

    /**
     * 执行任务逻辑。抛出的异常将使任务的future失败。
     *
     * Runs the job. Any exception fails the job's future.
     */
    void execute() throws Exception;
}
