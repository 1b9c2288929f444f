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

import io.kubeauth.common.data.RoleEntry;
import io.kubeauth.common.storage.KeyValueStore;
import io.kubeauth.common.storage.KeyValueStoreException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Access to the stored {@link RoleEntry} records, kept under {@code role/<name>}.
 */
public class RoleResources extends BaseResources<RoleEntry> {

    static final String ROLE_PREFIX = "role";

    public RoleResources(KeyValueStore store, int operationTimeoutSec) {
        super(store, RoleEntry.class, operationTimeoutSec);
    }

    public Optional<RoleEntry> getRole(String name) throws KeyValueStoreException {
        return get(rolePath(name));
    }

    public CompletableFuture<Optional<RoleEntry>> getRoleAsync(String name) {
        return getAsync(rolePath(name));
    }

    public void setRole(String name, RoleEntry role) throws KeyValueStoreException {
        set(rolePath(name), role);
    }

    public boolean deleteRole(String name) throws KeyValueStoreException {
        return delete(rolePath(name));
    }

    public List<String> listRoles() throws KeyValueStoreException {
        return getChildren(ROLE_PREFIX).stream()
                .filter(name -> !name.endsWith("/"))
                .collect(Collectors.toList());
    }

    static String rolePath(String name) {
        return ROLE_PREFIX + "/" + name.toLowerCase();
    }
}
