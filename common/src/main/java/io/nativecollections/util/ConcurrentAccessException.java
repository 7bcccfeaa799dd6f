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

/**
 * 当一个容器已经交给某个任务独占，而其它线程仍试图读写或释放它时，抛出该异常。
 * 调用方应该先等待任务的{@link io.netty.util.concurrent.Future}完成，再访问容器。
 *
 * An {@link IllegalStateException} which is raised when a {@link NativeContainer} is read, written or disposed
 * by a thread other than the job that currently owns it. Wait for the job's future before touching the
 * container again.
 */
public class ConcurrentAccessException extends IllegalStateException {

    private static final long serialVersionUID = -6373928173476283561L;

    public ConcurrentAccessException() { }

    public ConcurrentAccessException(String s) {
        super(s);
    }

    public ConcurrentAccessException(Throwable cause) {
        super(cause);
    }

    public ConcurrentAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
