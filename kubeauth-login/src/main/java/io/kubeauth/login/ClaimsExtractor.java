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

import com.auth0.jwt.interfaces.Claim;
import com.auth0.jwt.interfaces.DecodedJWT;
import io.kubeauth.login.KubeAuthenticationException.ErrorCode;
import java.util.Collections;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads the service account identity out of a decoded token.
 *
 * <p>Two token shapes exist. Legacy secret-based tokens carry flat claims:
 * <pre>
 * "kubernetes.io/serviceaccount/namespace": "default",
 * "kubernetes.io/serviceaccount/secret.name": "vault-auth-token-t5pcn",
 * "kubernetes.io/serviceaccount/service-account.name": "vault-auth",
 * "kubernetes.io/serviceaccount/service-account.uid": "d77f89bc-..."
 * </pre>
 * Projected tokens carry a nested object:
 * <pre>
 * "kubernetes.io": {
 *   "namespace": "default",
 *   "pod": {"name": "vault", "uid": "086c2f61-..."},
 *   "serviceaccount": {"name": "default", "uid": "77c81ad7-..."}
 * }
 * </pre>
 */
public final class ClaimsExtractor {

    static final String PROJECTED_CLAIM = "kubernetes.io";
    static final String LEGACY_NAMESPACE_CLAIM = "kubernetes.io/serviceaccount/namespace";
    static final String LEGACY_SECRET_NAME_CLAIM = "kubernetes.io/serviceaccount/secret.name";
    static final String LEGACY_NAME_CLAIM = "kubernetes.io/serviceaccount/service-account.name";
    static final String LEGACY_UID_CLAIM = "kubernetes.io/serviceaccount/service-account.uid";

    private ClaimsExtractor() {
    }

    /**
     * Extract the identity of a token.
     *
     * @throws KubeAuthenticationException with {@link ErrorCode#MALFORMED_CLAIMS} when the token carries neither
     *         shape, or carries identity claims of the wrong type
     */
    public static ServiceAccountIdentity extract(DecodedJWT jwt) throws KubeAuthenticationException {
        ServiceAccountIdentity.ServiceAccountIdentityBuilder builder = ServiceAccountIdentity.builder()
                .subject(jwt.getSubject())
                .issuer(jwt.getIssuer())
                .audiences(jwt.getAudience() != null ? jwt.getAudience() : Collections.emptyList())
                .expiresAt(jwt.getExpiresAtAsInstant())
                .issuedAt(jwt.getIssuedAtAsInstant())
                .notBefore(jwt.getNotBeforeAsInstant());

        Map<String, Object> projected = asMap(jwt.getClaim(PROJECTED_CLAIM), PROJECTED_CLAIM);
        if (projected != null) {
            Map<String, Object> serviceAccount = nested(projected, "serviceaccount");
            Map<String, Object> pod = nested(projected, "pod");
            if (!projected.containsKey("namespace") && serviceAccount.isEmpty()) {
                throw malformed();
            }
            return builder.projected(true)
                    .namespace(string(projected, "namespace"))
                    .name(string(serviceAccount, "name"))
                    .uid(string(serviceAccount, "uid"))
                    .podName(string(pod, "name"))
                    .podUid(string(pod, "uid"))
                    .build();
        }

        if (jwt.getClaim(LEGACY_NAMESPACE_CLAIM).isMissing() && jwt.getClaim(LEGACY_NAME_CLAIM).isMissing()) {
            throw malformed();
        }
        return builder.projected(false)
                .namespace(string(jwt.getClaim(LEGACY_NAMESPACE_CLAIM), LEGACY_NAMESPACE_CLAIM))
                .name(string(jwt.getClaim(LEGACY_NAME_CLAIM), LEGACY_NAME_CLAIM))
                .uid(string(jwt.getClaim(LEGACY_UID_CLAIM), LEGACY_UID_CLAIM))
                .secretName(string(jwt.getClaim(LEGACY_SECRET_NAME_CLAIM), LEGACY_SECRET_NAME_CLAIM))
                .build();
    }

    private static KubeAuthenticationException malformed() {
        return new KubeAuthenticationException(ErrorCode.MALFORMED_CLAIMS,
                "token does not contain service account namespace and name claims");
    }

    private static Map<String, Object> asMap(Claim claim, String name) throws KubeAuthenticationException {
        if (claim.isMissing() || claim.isNull()) {
            return null;
        }
        Map<String, Object> map = claim.asMap();
        if (map == null) {
            throw new KubeAuthenticationException(ErrorCode.MALFORMED_CLAIMS,
                    "claim \"" + name + "\" is not an object");
        }
        return map;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> nested(Map<String, Object> parent, String key)
            throws KubeAuthenticationException {
        Object value = parent.get(key);
        if (value == null) {
            return Collections.emptyMap();
        }
        if (!(value instanceof Map)) {
            throw new KubeAuthenticationException(ErrorCode.MALFORMED_CLAIMS,
                    "claim \"" + PROJECTED_CLAIM + "." + key + "\" is not an object");
        }
        return (Map<String, Object>) value;
    }

    private static String string(Map<String, Object> parent, String key) throws KubeAuthenticationException {
        Object value = parent.get(key);
        if (value == null) {
            return "";
        }
        if (!(value instanceof String)) {
            throw new KubeAuthenticationException(ErrorCode.MALFORMED_CLAIMS,
                    "claim \"" + key + "\" is not a string");
        }
        return (String) value;
    }

    private static String string(Claim claim, String name) throws KubeAuthenticationException {
        if (claim.isMissing() || claim.isNull()) {
            return "";
        }
        String value = claim.asString();
        if (value == null) {
            throw new KubeAuthenticationException(ErrorCode.MALFORMED_CLAIMS,
                    "claim \"" + name + "\" is not a string");
        }
        return StringUtils.defaultString(value);
    }
}
