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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link KeyValueStore} kept in process memory.
 */
@Slf4j
public class MemoryKeyValueStore implements KeyValueStore {

    private final NavigableMap<String, byte[]> map = new ConcurrentSkipListMap<>();
    private final AtomicBoolean isClosed = new AtomicBoolean(false);

    @Override
    public CompletableFuture<Optional<byte[]>> get(String key) {
        if (isClosed.get()) {
            return CompletableFuture.failedFuture(new KeyValueStoreException.AlreadyClosedException());
        }
        byte[] value = map.get(key);
        return CompletableFuture.completedFuture(
                Optional.ofNullable(value).map(v -> Arrays.copyOf(v, v.length)));
    }

    @Override
    public CompletableFuture<Void> put(String key, byte[] value) {
        if (isClosed.get()) {
            return CompletableFuture.failedFuture(new KeyValueStoreException.AlreadyClosedException());
        }
        map.put(key, Arrays.copyOf(value, value.length));
        if (log.isDebugEnabled()) {
            log.debug("Stored {} ({} bytes)", key, value.length);
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Boolean> delete(String key) {
        if (isClosed.get()) {
            return CompletableFuture.failedFuture(new KeyValueStoreException.AlreadyClosedException());
        }
        return CompletableFuture.completedFuture(map.remove(key) != null);
    }

    @Override
    public CompletableFuture<List<String>> list(String prefix) {
        if (isClosed.get()) {
            return CompletableFuture.failedFuture(new KeyValueStoreException.AlreadyClosedException());
        }
        String base = prefix.endsWith("/") ? prefix : prefix + "/";
        TreeSet<String> children = new TreeSet<>();
        for (Map.Entry<String, byte[]> entry : map.tailMap(base, false).entrySet()) {
            String key = entry.getKey();
            if (!key.startsWith(base)) {
                break;
            }
            String rest = key.substring(base.length());
            int idx = rest.indexOf('/');
            children.add(idx < 0 ? rest : rest.substring(0, idx + 1));
        }
        return CompletableFuture.completedFuture(new ArrayList<>(children));
    }

    @Override
    public void close() {
        isClosed.set(true);
    }
}
