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

import io.kubeauth.common.data.ClusterConfig;
import io.kubeauth.common.storage.KeyValueStore;
import io.kubeauth.common.storage.KeyValueStoreException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Access to the stored {@link ClusterConfig}.
 */
public class ClusterConfigResources extends BaseResources<ClusterConfig> {

    static final String CONFIG_PATH = "config";

    public ClusterConfigResources(KeyValueStore store, int operationTimeoutSec) {
        super(store, ClusterConfig.class, operationTimeoutSec);
    }

    public Optional<ClusterConfig> getConfig() throws KeyValueStoreException {
        return get(CONFIG_PATH);
    }

    public CompletableFuture<Optional<ClusterConfig>> getConfigAsync() {
        return getAsync(CONFIG_PATH);
    }

    public void setConfig(ClusterConfig config) throws KeyValueStoreException {
        set(CONFIG_PATH, config);
    }
}
