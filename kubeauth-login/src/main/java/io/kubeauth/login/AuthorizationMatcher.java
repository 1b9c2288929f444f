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
package io.kubeauth.login;

import io.kubeauth.common.data.RoleEntry;
import io.kubeauth.login.KubeAuthenticationException.ErrorCode;

/**
 * Checks a service account identity against the bindings of a role. The name is checked before the namespace.
 */
public final class AuthorizationMatcher {

    private AuthorizationMatcher() {
    }

    public static void authorize(ServiceAccountIdentity identity, RoleEntry role) throws KubeAuthenticationException {
        if (!GlobMatcher.matchesAny(role.getBoundServiceAccountNames(), identity.getName())) {
            throw new KubeAuthenticationException(ErrorCode.SERVICE_ACCOUNT_NOT_AUTHORIZED,
                    "service account name not authorized");
        }
        if (!GlobMatcher.matchesAny(role.getBoundServiceAccountNamespaces(), identity.getNamespace())) {
            throw new KubeAuthenticationException(ErrorCode.NAMESPACE_NOT_AUTHORIZED,
                    "namespace not authorized");
        }
    }
}
