/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package io.kubeauth.common.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers around {@link CompletableFuture}.
 */
public final class FutureUtil {

    private FutureUtil() {
    }

    /**
     * Return the root cause of a {@link CompletionException} or {@link ExecutionException} chain.
     */
    public static Throwable unwrapCompletionException(Throwable ex) {
        Throwable cause = ex;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Links the cancellation of {@code outer} to {@code inner}: cancelling the first cancels the second.
     */
    public static <T> void propagateCancellation(CompletableFuture<?> outer, CompletableFuture<T> inner) {
        outer.whenComplete((__, ex) -> {
            if (outer.isCancelled()) {
                inner.cancel(true);
            }
        });
    }
}
