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

import io.netty.util.internal.SystemPropertyUtil;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.util.Locale;

/**
 * Selects {@link ArrayAllocator#DEFAULT}.
 */
final class ArrayAllocatorUtil {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(ArrayAllocatorUtil.class);

    static final ArrayAllocator DEFAULT_ALLOCATOR;

    static {
        String allocType = SystemPropertyUtil.get("io.nativecollections.allocator.type", "unpooled")
                .toLowerCase(Locale.US).trim();
        ArrayAllocator alloc;
        if ("unpooled".equals(allocType)) {
            alloc = UnpooledArrayAllocator.DEFAULT;
            logger.debug("-Dio.nativecollections.allocator.type: {}", allocType);
        } else if ("pooled".equals(allocType)) {
            alloc = PooledArrayAllocator.DEFAULT;
            logger.debug("-Dio.nativecollections.allocator.type: {}", allocType);
        } else {
            alloc = UnpooledArrayAllocator.DEFAULT;
            logger.debug("-Dio.nativecollections.allocator.type: unpooled (unknown: {})", allocType);
        }
        DEFAULT_ALLOCATOR = alloc;
    }

    private ArrayAllocatorUtil() {
    }
}
