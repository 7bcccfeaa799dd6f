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
 * 请求的容量超过了数组可寻址的上限({@link UnsafeList#MAX_CAPACITY})时抛出。
 * 抛出该异常时，容器的状态不会发生任何改变。
 *
 * Raised when a requested capacity exceeds {@link UnsafeList#MAX_CAPACITY}. The container is left unchanged.
 */
public class CapacityOverflowException extends IllegalArgumentException {

    private static final long serialVersionUID = 4102837394010239184L;

    public CapacityOverflowException() { }

    public CapacityOverflowException(String s) {
        super(s);
    }

    public CapacityOverflowException(long requestedCapacity) {
        super("capacity: " + requestedCapacity + " (expected: <= " + UnsafeList.MAX_CAPACITY + ')');
    }
}
