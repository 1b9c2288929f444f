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
package io.kubeauth.login.validation;

import io.kubeauth.common.data.RoleEntry;
import java.util.concurrent.CompletableFuture;

/**
 * Establishes that a raw service account token is genuine and currently valid.
 */
public interface TokenValidator {

    /**
     * Validate a token for a login against {@code role}.
     *
     * @return a future completed with the verified token, or exceptionally with a
     *         {@link io.kubeauth.login.KubeAuthenticationException} telling why the token was refused or could not
     *         be checked. Cancelling it aborts any request made to the cluster.
     */
    CompletableFuture<VerifiedToken> validate(String token, RoleEntry role);
}
