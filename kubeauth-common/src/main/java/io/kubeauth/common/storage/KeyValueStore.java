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
package io.kubeauth.common.storage;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Persistent storage the engine keeps its configuration and roles in. Keys are {@code /} separated paths.
 *
 * <p>Implementations are provided by the embedding host. Failures complete the returned futures with a
 * {@link KeyValueStoreException}.
 */
public interface KeyValueStore extends AutoCloseable {

    /**
     * Read the value stored at a key.
     *
     * @return the value, or an empty optional when the key does not exist
     */
    CompletableFuture<Optional<byte[]>> get(String key);

    /**
     * Store a value, replacing any previous one.
     */
    CompletableFuture<Void> put(String key, byte[] value);

    /**
     * Remove a key.
     *
     * @return true if the key existed
     */
    CompletableFuture<Boolean> delete(String key);

    /**
     * List the names directly below {@code prefix}, sorted. A name that has children itself is returned with a
     * trailing {@code /}.
     */
    CompletableFuture<List<String>> list(String prefix);

    @Override
    default void close() throws Exception {
    }
}
