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

import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import io.kubeauth.common.data.RoleEntry;
import io.kubeauth.login.KubeAuthenticationException;
import io.kubeauth.login.KubeAuthenticationException.ErrorCode;
import java.security.PublicKey;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPublicKey;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

/**
 * Verifies tokens against the configured public keys without calling the cluster.
 *
 * <p>Keys are tried in configuration order and the first one verifying the signature wins. Keys whose family does
 * not match the token algorithm are skipped. Registered claims are only checked once the signature holds, so an
 * expired forged token is reported as a signature failure.
 */
@Slf4j
public class LocalSignatureValidator implements TokenValidator {

    static final String ALG_RS256 = "RS256";
    static final String ALG_RS384 = "RS384";
    static final String ALG_RS512 = "RS512";
    static final String ALG_ES256 = "ES256";
    static final String ALG_ES384 = "ES384";
    static final String ALG_ES512 = "ES512";

    private final List<PublicKey> keys;
    private final StandardClaimsValidator claimsValidator;

    public LocalSignatureValidator(List<PublicKey> keys, StandardClaimsValidator claimsValidator) {
        this.keys = List.copyOf(keys);
        this.claimsValidator = claimsValidator;
    }

    @Override
    public CompletableFuture<VerifiedToken> validate(String token, RoleEntry role) {
        try {
            DecodedJWT jwt = verify(StandardClaimsValidator.decode(token));
            claimsValidator.validate(jwt, role);
            return CompletableFuture.completedFuture(new VerifiedToken(jwt, null));
        } catch (KubeAuthenticationException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    DecodedJWT verify(DecodedJWT jwt) throws KubeAuthenticationException {
        for (PublicKey key : keys) {
            Algorithm alg = algorithmFor(jwt.getAlgorithm(), key);
            if (alg == null) {
                continue;
            }
            try {
                alg.verify(jwt);
                return jwt;
            } catch (SignatureVerificationException e) {
                log.debug("Token signature does not match {} key: {}", key.getAlgorithm(), e.getMessage());
            }
        }
        throw new KubeAuthenticationException(ErrorCode.INVALID_SIGNATURE, "failed to validate JWT signature");
    }

    /**
     * Algorithm verifying {@code jwtAlg} with {@code key}, or null when the key cannot verify that algorithm.
     */
    static Algorithm algorithmFor(String jwtAlg, PublicKey key) {
        if (jwtAlg == null) {
            return null;
        }
        if (key instanceof RSAPublicKey) {
            RSAPublicKey rsaKey = (RSAPublicKey) key;
            switch (jwtAlg) {
                case ALG_RS256:
                    return Algorithm.RSA256(rsaKey, null);
                case ALG_RS384:
                    return Algorithm.RSA384(rsaKey, null);
                case ALG_RS512:
                    return Algorithm.RSA512(rsaKey, null);
                default:
                    return null;
            }
        }
        if (key instanceof ECPublicKey) {
            ECPublicKey ecKey = (ECPublicKey) key;
            switch (jwtAlg) {
                case ALG_ES256:
                    return Algorithm.ECDSA256(ecKey, null);
                case ALG_ES384:
                    return Algorithm.ECDSA384(ecKey, null);
                case ALG_ES512:
                    return Algorithm.ECDSA512(ecKey, null);
                default:
                    return null;
            }
        }
        return null;
    }
}
