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
package io.kubeauth.common.resources;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.kubeauth.common.storage.KeyValueStore;
import io.kubeauth.common.storage.KeyValueStoreException;
import io.kubeauth.common.util.ObjectMapperFactory;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for records kept as JSON documents in a {@link KeyValueStore}.
 *
 * @param <T>
 *            type of the stored record.
 */
@Slf4j
public class BaseResources<T> {

    @Getter
    private final KeyValueStore store;
    private final Class<T> clazz;
    private final ObjectMapper mapper = ObjectMapperFactory.getMapper();
    private final int operationTimeoutSec;

    public BaseResources(KeyValueStore store, Class<T> clazz, int operationTimeoutSec) {
        this.store = store;
        this.clazz = clazz;
        this.operationTimeoutSec = operationTimeoutSec;
    }

    protected List<String> getChildren(String path) throws KeyValueStoreException {
        try {
            return getChildrenAsync(path).get(operationTimeoutSec, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw (e.getCause() instanceof KeyValueStoreException) ? (KeyValueStoreException) e.getCause()
                    : new KeyValueStoreException(e.getCause());
        } catch (Exception e) {
            throw new KeyValueStoreException("Failed to get children of " + path, e);
        }
    }

    protected CompletableFuture<List<String>> getChildrenAsync(String path) {
        return store.list(path);
    }

    protected Optional<T> get(String path) throws KeyValueStoreException {
        try {
            return getAsync(path).get(operationTimeoutSec, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw (e.getCause() instanceof KeyValueStoreException) ? (KeyValueStoreException) e.getCause()
                    : new KeyValueStoreException(e.getCause());
        } catch (Exception e) {
            throw new KeyValueStoreException("Failed to get data from " + path, e);
        }
    }

    protected CompletableFuture<Optional<T>> getAsync(String path) {
        return store.get(path).thenApply(optValue -> optValue.map(value -> {
            try {
                return mapper.readValue(value, clazz);
            } catch (IOException e) {
                throw new CompletionException(
                        new KeyValueStoreException.InvalidDataException("Invalid " + clazz.getSimpleName()
                                + " stored at " + path, e));
            }
        }));
    }

    protected void set(String path, T data) throws KeyValueStoreException {
        try {
            setAsync(path, data).get(operationTimeoutSec, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw (e.getCause() instanceof KeyValueStoreException) ? (KeyValueStoreException) e.getCause()
                    : new KeyValueStoreException(e.getCause());
        } catch (Exception e) {
            throw new KeyValueStoreException("Failed to set data for " + path, e);
        }
    }

    protected CompletableFuture<Void> setAsync(String path, T data) {
        byte[] value;
        try {
            value = mapper.writeValueAsBytes(data);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new KeyValueStoreException("Failed to serialize " + path, e));
        }
        return store.put(path, value);
    }

    protected boolean delete(String path) throws KeyValueStoreException {
        try {
            return deleteAsync(path).get(operationTimeoutSec, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw (e.getCause() instanceof KeyValueStoreException) ? (KeyValueStoreException) e.getCause()
                    : new KeyValueStoreException(e.getCause());
        } catch (Exception e) {
            throw new KeyValueStoreException("Failed to delete " + path, e);
        }
    }

    protected CompletableFuture<Boolean> deleteAsync(String path) {
        log.info("Deleting path: {}", path);
        return store.delete(path);
    }
}
