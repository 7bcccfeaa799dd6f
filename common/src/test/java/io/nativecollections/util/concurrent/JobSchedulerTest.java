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
import io.nativecollections.util.ConcurrentAccessException;
import io.nativecollections.util.NativeContainer;
import io.netty.util.IllegalReferenceCountException;
import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.function.ThrowingRunnable;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class JobSchedulerTest {

    private EventExecutor executor;

    @Before
    public void setUp() {
        executor = new DefaultEventExecutor();
    }

    @After
    public void tearDown() {
        executor.shutdownGracefully(0, 5, TimeUnit.SECONDS).syncUninterruptibly();
    }

    @Test(timeout = 5000)
    public void jobRunsAndHandsOwnershipBack() {
        final CounterContainer counter = new CounterContainer();

        Future<Void> future = JobScheduler.schedule(executor, new Job() {
            @Override
            public void execute() {
                counter.increment();
                counter.increment();
            }
        }, counter);

        future.syncUninterruptibly();
        assertTrue(future.isSuccess());
        assertEquals(2, counter.get());
        assertFalse(counter.safetyHandle().isOwnedByJob());
    }

    @Test(timeout = 5000)
    public void callerIsRefusedWhileJobRuns() throws InterruptedException {
        final CounterContainer counter = new CounterContainer();
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        Future<Void> future = JobScheduler.schedule(executor, new Job() {
            @Override
            public void execute() throws InterruptedException {
                started.countDown();
                release.await();
                counter.increment();
            }
        }, counter);

        started.await();
        assertThrows(ConcurrentAccessException.class, new ThrowingRunnable() {
            @Override
            public void run() {
                counter.get();
            }
        });
        assertThrows(ConcurrentAccessException.class, new ThrowingRunnable() {
            @Override
            public void run() {
                counter.dispose();
            }
        });

        release.countDown();
        future.syncUninterruptibly();
        assertEquals(1, counter.get());
    }

    @Test(timeout = 5000)
    public void failingJobFailsFuture() {
        CounterContainer counter = new CounterContainer();
        final IllegalStateException cause = new IllegalStateException("boom");

        Future<Void> future = JobScheduler.schedule(executor, new Job() {
            @Override
            public void execute() {
                throw cause;
            }
        }, counter);

        future.awaitUninterruptibly();
        assertFalse(future.isSuccess());
        assertSame(cause, future.cause());
        assertEquals(0, counter.get());
    }

    @Test(timeout = 5000)
    public void jobsCannotBeCancelled() throws InterruptedException {
        CounterContainer counter = new CounterContainer();
        final CountDownLatch release = new CountDownLatch(1);

        Future<Void> future = JobScheduler.schedule(executor, new Job() {
            @Override
            public void execute() throws InterruptedException {
                release.await();
            }
        }, counter);

        assertFalse(future.isCancellable());
        assertFalse(future.cancel(true));
        release.countDown();
        future.syncUninterruptibly();
    }

    @Test(timeout = 5000)
    public void secondJobNeedsDependency() throws InterruptedException {
        final CounterContainer counter = new CounterContainer();
        final CountDownLatch release = new CountDownLatch(1);

        Future<Void> first = JobScheduler.schedule(executor, new Job() {
            @Override
            public void execute() throws InterruptedException {
                release.await();
                counter.increment();
            }
        }, counter);

        final Job second = new Job() {
            @Override
            public void execute() {
                counter.add(10);
            }
        };
        assertThrows(ConcurrentAccessException.class, new ThrowingRunnable() {
            @Override
            public void run() {
                JobScheduler.schedule(executor, second, counter);
            }
        });

        Future<Void> chained = JobScheduler.schedule(executor, first, second, counter);
        release.countDown();
        chained.syncUninterruptibly();
        assertTrue(first.isSuccess());
        assertEquals(11, counter.get());
    }

    @Test(timeout = 5000)
    public void failedDependencySkipsJob() {
        final CounterContainer counter = new CounterContainer();
        final IllegalArgumentException cause = new IllegalArgumentException("first job failed");

        Future<Void> first = JobScheduler.schedule(executor, new Job() {
            @Override
            public void execute() {
                throw cause;
            }
        }, counter);
        Future<Void> second = JobScheduler.schedule(executor, first, new Job() {
            @Override
            public void execute() {
                counter.increment();
            }
        }, counter);

        second.awaitUninterruptibly();
        assertSame(cause, second.cause());
        assertEquals(0, counter.get());
    }

    @Test(timeout = 5000)
    public void combinedDependenciesCompleteTogether() {
        final CounterContainer a = new CounterContainer();
        final CounterContainer b = new CounterContainer();

        Future<Void> first = JobScheduler.schedule(executor, new Job() {
            @Override
            public void execute() {
                a.increment();
            }
        }, a);
        Future<Void> second = JobScheduler.schedule(executor, new Job() {
            @Override
            public void execute() {
                b.increment();
            }
        }, b);

        JobScheduler.combineDependencies(executor, first, second).syncUninterruptibly();
        assertEquals(1, a.get());
        assertEquals(1, b.get());
    }

    @Test(timeout = 5000)
    public void disposeWaitsForInputDependencies() throws InterruptedException {
        final CounterContainer counter = new CounterContainer();
        final CountDownLatch release = new CountDownLatch(1);

        Future<Void> job = JobScheduler.schedule(executor, new Job() {
            @Override
            public void execute() throws InterruptedException {
                release.await();
                counter.increment();
            }
        }, counter);
        Future<Void> disposed = counter.dispose(executor, job);

        assertFalse(counter.isCreated());
        assertFalse(counter.storageReleased);
        assertThrows(IllegalReferenceCountException.class, new ThrowingRunnable() {
            @Override
            public void run() {
                counter.get();
            }
        });

        release.countDown();
        disposed.syncUninterruptibly();
        assertTrue(job.isSuccess());
        assertTrue(counter.storageReleased);
    }

    @Test(timeout = 5000)
    public void disposeRefusedUnlessItDependsOnOwner() throws InterruptedException {
        final CounterContainer counter = new CounterContainer();
        final CountDownLatch release = new CountDownLatch(1);

        Future<Void> job = JobScheduler.schedule(executor, new Job() {
            @Override
            public void execute() throws InterruptedException {
                release.await();
                counter.increment();
            }
        }, counter);

        assertThrows(ConcurrentAccessException.class, new ThrowingRunnable() {
            @Override
            public void run() {
                counter.dispose(executor, null);
            }
        });
        assertTrue(counter.isCreated());

        release.countDown();
        job.syncUninterruptibly();
        assertEquals(1, counter.get());
    }

    @Test
    public void disposedContainerCannotBeScheduled() {
        final CounterContainer counter = new CounterContainer();
        counter.dispose();

        assertThrows(IllegalReferenceCountException.class, new ThrowingRunnable() {
            @Override
            public void run() {
                JobScheduler.schedule(executor, new Job() {
                    @Override
                    public void execute() {
                        counter.increment();
                    }
                }, counter);
            }
        });
    }

    /**
     * Minimal container guarding a single counter.
     */
    private static final class CounterContainer implements NativeContainer {
        private final AtomicSafetyHandle safety = new AtomicSafetyHandle(true);
        private int value;
        volatile boolean storageReleased;

        int get() {
            safety.checkReadAndThrow();
            return value;
        }

        void increment() {
            add(1);
        }

        void add(int delta) {
            safety.checkWriteAndThrow();
            value += delta;
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
        public void dispose() {
            safety.checkDeallocateAndThrow();
            safety.release();
            storageReleased = true;
        }

        @Override
        public Future<Void> dispose(EventExecutor executor, Future<?> inputDeps) {
            safety.checkScheduleAndThrow(inputDeps);
            safety.release();
            return JobScheduler.scheduleDispose(executor, inputDeps, new Runnable() {
                @Override
                public void run() {
                    storageReleased = true;
                }
            });
        }

        @Override
        public void close() {
            dispose();
        }
    }
}
