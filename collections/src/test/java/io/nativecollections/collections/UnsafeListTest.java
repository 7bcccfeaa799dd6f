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

import io.netty.util.IllegalReferenceCountException;
import org.junit.Test;
import org.junit.function.ThrowingRunnable;

import java.util.NoSuchElementException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class UnsafeListTest {

    @Test
    public void addGrowsGeometrically() {
        UnsafeList<String> list = new UnsafeList<String>(2, UnpooledArrayAllocator.DEFAULT);
        try {
            list.add("a");
            list.add("b");
            assertEquals(2, list.capacity());
            list.add("c");
            assertEquals(4, list.capacity());
            assertEquals(3, list.length());
            assertEquals("c", list.get(2));
        } finally {
            list.release();
        }
    }

    @Test
    public void growsFromZeroCapacity() {
        UnsafeList<String> list = new UnsafeList<String>(0);
        try {
            list.add("a");
            assertEquals(1, list.length());
            assertTrue(list.capacity() >= 1);
        } finally {
            list.release();
        }
    }

    @Test
    public void removeAtSwapBackMovesLastElement() {
        UnsafeList<String> list = new UnsafeList<String>(4);
        try {
            list.add("a");
            list.add("b");
            list.add("c");

            assertEquals("a", list.removeAtSwapBack(0));
            assertEquals(2, list.length());
            assertEquals("c", list.get(0));
            assertEquals("b", list.get(1));

            assertEquals("b", list.removeLast());
            assertEquals("c", list.removeLast());
            assertEquals(0, list.length());
        } finally {
            list.release();
        }
    }

    @Test
    public void boundsAreChecked() {
        final UnsafeList<String> list = new UnsafeList<String>(4);
        try {
            list.add("a");
            assertThrows(IndexOutOfBoundsException.class, new ThrowingRunnable() {
                @Override
                public void run() {
                    list.get(1);
                }
            });
            assertThrows(IndexOutOfBoundsException.class, new ThrowingRunnable() {
                @Override
                public void run() {
                    list.set(-1, "x");
                }
            });
            list.removeLast();
            assertThrows(NoSuchElementException.class, new ThrowingRunnable() {
                @Override
                public void run() {
                    list.removeLast();
                }
            });
        } finally {
            list.release();
        }
    }

    @Test
    public void capacityLimits() {
        final UnsafeList<String> list = new UnsafeList<String>(4);
        try {
            list.add("a");
            list.add("b");
            assertThrows(IllegalArgumentException.class, new ThrowingRunnable() {
                @Override
                public void run() {
                    list.setCapacity(1);
                }
            });
            assertThrows(CapacityOverflowException.class, new ThrowingRunnable() {
                @Override
                public void run() {
                    list.ensureCapacity(Integer.MAX_VALUE);
                }
            });
            assertEquals(4, list.capacity());
            assertEquals(2, list.length());

            list.ensureCapacity(9);
            assertTrue(list.capacity() >= 9);
            list.setCapacity(2);
            assertEquals(2, list.capacity());
            assertEquals("b", list.get(1));
        } finally {
            list.release();
        }
    }

    @Test
    public void clearDropsReferences() {
        UnsafeList<String> list = new UnsafeList<String>(4);
        try {
            list.add("a");
            list.add("b");
            list.clear();
            assertEquals(0, list.length());
            list.add("c");
            assertEquals("c", list.get(0));
            assertEquals(4, list.capacity());
        } finally {
            list.release();
        }
    }

    @Test
    public void releasedListIsInaccessible() {
        PooledArrayAllocator arrays = new PooledArrayAllocator(64, 2);
        final UnsafeList<String> list = new UnsafeList<String>(8, arrays);
        list.add("a");

        assertTrue(list.release());
        assertEquals(1, arrays.cachedArrays());
        assertThrows(IllegalReferenceCountException.class, new ThrowingRunnable() {
            @Override
            public void run() {
                list.length();
            }
        });
        assertThrows(IllegalReferenceCountException.class, new ThrowingRunnable() {
            @Override
            public void run() {
                list.add("b");
            }
        });
        assertThrows(IllegalReferenceCountException.class, new ThrowingRunnable() {
            @Override
            public void run() {
                list.release();
            }
        });

        Object[] recycled = arrays.allocate(8);
        assertNull(recycled[0]);
    }
}
