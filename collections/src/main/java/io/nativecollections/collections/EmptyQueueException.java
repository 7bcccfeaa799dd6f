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

import java.util.NoSuchElementException;

/**
 * Raised by {@link IndexedPriorityQueue#dequeue()} and {@link IndexedPriorityQueue#peek()} on an empty queue.
 */
public class EmptyQueueException extends NoSuchElementException {

    private static final long serialVersionUID = -2650420781286423307L;

    public EmptyQueueException() {
        super("queue is empty");
    }

    public EmptyQueueException(String s) {
        super(s);
    }
}
