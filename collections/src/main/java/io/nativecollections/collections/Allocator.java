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
 * 容器创建时选择的分配策略。它描述容器的生命周期，而不是内存的来源。
 * <ul>
 *     <li>{@link #TEMP}: 生命周期很短，通常在同一个方法内创建和释放，不进行泄漏追踪，不能交给任务。</li>
 *     <li>{@link #TEMP_JOB}: 生命周期跨越若干个任务。</li>
 *     <li>{@link #PERSISTENT}: 长期存活的容器。</li>
 * </ul>
 * {@link #INVALID}和{@link #NONE}不能用于创建容器。
 *
 * The allocation strategy chosen when a container is created. {@link #TEMP_JOB} and {@link #PERSISTENT}
 * containers are registered with netty's {@link io.netty.util.ResourceLeakDetector}, so a container that is
 * garbage collected without being disposed gets reported. {@link #TEMP} containers cannot be handed to a job.
 */
public enum Allocator {
    INVALID,
    NONE,
    TEMP,
    TEMP_JOB,
    PERSISTENT;

    /**
     * Returns {@code true} if containers may be created with this allocator.
     */
    public boolean isValid() {
        return compareTo(TEMP) >= 0;
    }

    /**
     * Returns {@code true} if containers created with this allocator are tracked for leaks.
     */
    public boolean isLeakTracked() {
        return this == TEMP_JOB || this == PERSISTENT;
    }

    /**
     * Returns {@code true} if containers created with this allocator may be handed to a job.
     */
    public boolean allowsJobs() {
        return this == TEMP_JOB || this == PERSISTENT;
    }
}
