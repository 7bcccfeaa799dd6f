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
import io.netty.util.concurrent.ImmediateEventExecutor;
import io.netty.util.concurrent.Promise;
import org.junit.Test;
import org.junit.function.ThrowingRunnable;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class AtomicSafetyHandleTest {

    @Test
    public void releaseTwiceFails() {
        final AtomicSafetyHandle handle = new AtomicSafetyHandle(true);
        assertFalse(handle.isReleased());
        handle.release();
        assertTrue(handle.isReleased());

        assertThrows(IllegalReferenceCountException.class, new ThrowingRunnable() {
            @Override
            public void run() {
                handle.release();
            }
        });
    }

    @Test
    public void accessAfterReleaseFails() {
        final AtomicSafetyHandle handle = new AtomicSafetyHandle(false);
        handle.release();

        assertThrows(IllegalReferenceCountException.class, new ThrowingRunnable() {
            @Override
            public void run() {
                handle.checkReadAndThrow();
            }
        });
        assertThrows(IllegalReferenceCountException.class, new ThrowingRunnable() {
            @Override
            public void run() {
                handle.checkWriteAndThrow();
            }
        });
        assertThrows(IllegalReferenceCountException.class, new ThrowingRunnable() {
            @Override
            public void run() {
                handle.checkDeallocateAndThrow();
            }
        });
    }

    @Test
    public void pendingJobBlocksOtherThreads() {
        final AtomicSafetyHandle handle = new AtomicSafetyHandle(true);
        Promise<Void> job = ImmediateEventExecutor.INSTANCE.newPromise();
        handle.scheduleJob(job, null);
        assertTrue(handle.isOwnedByJob());

        assertThrows(ConcurrentAccessException.class, new ThrowingRunnable() {
            @Override
            public void run() {
                handle.checkReadAndThrow();
            }
        });
        assertThrows(ConcurrentAccessException.class, new ThrowingRunnable() {
            @Override
            public void run() {
                handle.checkDeallocateAndThrow();
            }
        });

        job.setSuccess(null);
        assertFalse(handle.isOwnedByJob());
        handle.checkReadAndThrow();
        handle.checkWriteAndThrow();
        handle.checkDeallocateAndThrow();
    }

    @Test
    public void disabledChecksIgnoreOwnership() {
        AtomicSafetyHandle handle = new AtomicSafetyHandle(false);
        handle.scheduleJob(ImmediateEventExecutor.INSTANCE.<Void>newPromise(), null);

        handle.checkReadAndThrow();
        handle.checkWriteAndThrow();
    }

    @Test
    public void secondJobMustDependOnTheFirst() {
        final AtomicSafetyHandle handle = new AtomicSafetyHandle(true);
        final Promise<Void> first = ImmediateEventExecutor.INSTANCE.newPromise();
        final Promise<Void> second = ImmediateEventExecutor.INSTANCE.newPromise();
        handle.scheduleJob(first, null);

        assertThrows(ConcurrentAccessException.class, new ThrowingRunnable() {
            @Override
            public void run() {
                handle.scheduleJob(second, null);
            }
        });

        handle.scheduleJob(second, first);
        first.setSuccess(null);
        assertTrue(handle.isOwnedByJob());
        second.setSuccess(null);
        assertFalse(handle.isOwnedByJob());
    }

    @Test
    public void jobThreadKeepsAccessAfterRelease() {
        final AtomicSafetyHandle handle = new AtomicSafetyHandle(true);
        Promise<Void> job = ImmediateEventExecutor.INSTANCE.newPromise();
        handle.scheduleJob(job, null);
        handle.enterJob();
        handle.release();

        handle.checkReadAndThrow();
        handle.checkWriteAndThrow();

        handle.exitJob();
        job.setSuccess(null);
        assertThrows(IllegalReferenceCountException.class, new ThrowingRunnable() {
            @Override
            public void run() {
                handle.checkWriteAndThrow();
            }
        });
    }

    @Test
    public void handlesAreSchedulableUnlessTemporary() {
        assertTrue(new AtomicSafetyHandle(true).isSchedulable());
        assertFalse(new AtomicSafetyHandle(true, false).isSchedulable());
    }
}
