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
package io.kubeauth.kubernetes;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Reads the annotations of a service account that are meant for the login engine.
 */
public interface ServiceAccountReader {

    /**
     * Annotation prefix selecting the annotations returned by {@link #readAnnotations(String, String)}.
     */
    String ALLOWED_ANNOTATION_PREFIX = "vault.hashicorp.com/auth-metadata/";

    /**
     * Read the annotations of a service account carrying {@link #ALLOWED_ANNOTATION_PREFIX}.
     *
     * @return a future completed with the normalized annotations: prefix stripped and {@code -} replaced by
     *         {@code _}. It completes exceptionally with an {@link java.io.IOException} on failure, and is
     *         cancellable.
     */
    CompletableFuture<Map<String, String>> readAnnotations(String name, String namespace);
}
