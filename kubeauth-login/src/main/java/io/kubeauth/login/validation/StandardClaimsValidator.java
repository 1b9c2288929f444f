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

import com.auth0.jwt.JWT;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.interfaces.DecodedJWT;
import io.kubeauth.common.data.ClusterConfig;
import io.kubeauth.common.data.RoleEntry;
import io.kubeauth.login.KubeAuthenticationException;
import io.kubeauth.login.KubeAuthenticationException.ErrorCode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.apache.commons.lang3.StringUtils;

/**
 * Checks the registered claims of a token: expiry, not-before, issuer and audience. Times are compared at second
 * precision with no leeway.
 */
public class StandardClaimsValidator {

    private final Clock clock;
    private final ClusterConfig config;

    public StandardClaimsValidator(Clock clock, ClusterConfig config) {
        this.clock = clock;
        this.config = config;
    }

    /**
     * Decode a token without verifying it.
     */
    public static DecodedJWT decode(String token) throws KubeAuthenticationException {
        try {
            return JWT.decode(token);
        } catch (JWTDecodeException e) {
            throw new KubeAuthenticationException(ErrorCode.MALFORMED_CLAIMS,
                    "Unable to decode JWT: " + e.getMessage(), e);
        }
    }

    public void validate(DecodedJWT jwt, RoleEntry role) throws KubeAuthenticationException {
        long now = clock.instant().getEpochSecond();
        Instant expiresAt = jwt.getExpiresAtAsInstant();
        if (expiresAt != null && now > expiresAt.getEpochSecond()) {
            throw new KubeAuthenticationException(ErrorCode.TOKEN_EXPIRED, "Token is expired");
        }
        Instant notBefore = jwt.getNotBeforeAsInstant();
        if (notBefore != null && now < notBefore.getEpochSecond()) {
            throw new KubeAuthenticationException(ErrorCode.TOKEN_NOT_YET_VALID, "Token is not valid yet");
        }
        if (!config.isDisableIssValidation() && !config.getIssuerOrDefault().equals(jwt.getIssuer())) {
            throw new KubeAuthenticationException(ErrorCode.INVALID_ISSUER, "invalid token issuer");
        }
        if (role != null && StringUtils.isNotEmpty(role.getAudience())) {
            List<String> audiences = jwt.getAudience();
            if (audiences == null || !audiences.contains(role.getAudience())) {
                throw new KubeAuthenticationException(ErrorCode.INVALID_AUDIENCE, "invalid audience (aud) claim");
            }
        }
    }
}
