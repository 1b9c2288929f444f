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

import io.kubeauth.common.data.AliasNameSource;
import io.kubeauth.login.KubeAuthenticationException.ErrorCode;
import org.apache.commons.lang3.StringUtils;

/**
 * Computes the alias of an identity.
 */
public final class AliasResolver {

    private AliasResolver() {
    }

    public static String resolve(ServiceAccountIdentity identity, AliasNameSource source)
            throws KubeAuthenticationException {
        String namespace = identity.getNamespace();
        String name = identity.getName();
        switch (source == null ? AliasNameSource.DEFAULT : source) {
            case SERVICEACCOUNT_NAME:
                if (StringUtils.isEmpty(namespace) || StringUtils.isEmpty(name)) {
                    throw incomplete();
                }
                return namespace + "/" + name;
            case DEFAULT:
            case SERVICEACCOUNT_UID:
            default:
                if (StringUtils.isEmpty(namespace) && StringUtils.isEmpty(name)) {
                    throw incomplete();
                }
                if (StringUtils.isEmpty(identity.getUid())) {
                    throw new KubeAuthenticationException(ErrorCode.INCOMPLETE_IDENTITY,
                            "could not parse UID from claims");
                }
                return identity.getUid();
        }
    }

    private static KubeAuthenticationException incomplete() {
        return new KubeAuthenticationException(ErrorCode.INCOMPLETE_IDENTITY,
                "service account namespace and name must be set");
    }
}
