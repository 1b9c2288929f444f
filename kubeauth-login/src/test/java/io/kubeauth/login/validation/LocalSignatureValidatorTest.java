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

import static io.kubeauth.login.TokenFixtures.CLOCK;
import static io.kubeauth.login.TokenFixtures.ECDSA_KEY;
import static io.kubeauth.login.TokenFixtures.JWT_ECDSA_SIGNED;
import static io.kubeauth.login.TokenFixtures.JWT_LEGACY_BAD_SIGNING_KEY;
import static io.kubeauth.login.TokenFixtures.JWT_PROJECTED;
import static io.kubeauth.login.TokenFixtures.JWT_PROJECTED_EXPIRED;
import static io.kubeauth.login.TokenFixtures.MINIKUBE_PUBLIC_KEY;
import static io.kubeauth.login.TokenFixtures.NOW;
import static io.kubeauth.login.TokenFixtures.ecKeyPair;
import static io.kubeauth.login.TokenFixtures.failureOf;
import static io.kubeauth.login.TokenFixtures.legacyToken;
import static io.kubeauth.login.TokenFixtures.projectedToken;
import static io.kubeauth.login.TokenFixtures.rsaKeyPair;
import static io.kubeauth.login.TokenFixtures.toPem;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotEquals;
import com.auth0.jwt.algorithms.Algorithm;
import io.kubeauth.common.data.ClusterConfig;
import io.kubeauth.common.data.RoleEntry;
import io.kubeauth.common.util.PemUtils;
import io.kubeauth.login.KubeAuthenticationException;
import io.kubeauth.login.KubeAuthenticationException.ErrorCode;
import java.security.KeyPair;
import java.security.PublicKey;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.testng.annotations.Test;

public class LocalSignatureValidatorTest {

    private static final RoleEntry ROLE = RoleEntry.builder().build();

    private static ClusterConfig config(String... pems) {
        return ClusterConfig.builder().kubernetesHost("https://kubernetes.default.svc").pemKeys(List.of(pems)).build();
    }

    private static LocalSignatureValidator validator(ClusterConfig config) throws Exception {
        List<PublicKey> keys = new ArrayList<>();
        for (String pem : config.getPemKeys()) {
            keys.addAll(PemUtils.parsePublicKeys(pem));
        }
        return new LocalSignatureValidator(keys, new StandardClaimsValidator(CLOCK, config));
    }

    private static Algorithm rs256(KeyPair keyPair) {
        return Algorithm.RSA256((RSAPublicKey) keyPair.getPublic(), (RSAPrivateKey) keyPair.getPrivate());
    }

    @Test
    public void testRecordedEcdsaToken() throws Exception {
        VerifiedToken verified = validator(config(MINIKUBE_PUBLIC_KEY, ECDSA_KEY))
                .validate(JWT_ECDSA_SIGNED, ROLE).get(10, TimeUnit.SECONDS);

        assertEquals(verified.getJwt().getAlgorithm(), "ES384");
        assertFalse(verified.getReview().isPresent());
    }

    @Test
    public void testRecordedProjectedToken() throws Exception {
        VerifiedToken verified = validator(config(ECDSA_KEY, MINIKUBE_PUBLIC_KEY))
                .validate(JWT_PROJECTED, ROLE).get(10, TimeUnit.SECONDS);

        assertEquals(verified.getJwt().getSubject(), "system:serviceaccount:default:default");
    }

    @Test
    public void testExpiredToken() throws Exception {
        KubeAuthenticationException e = failureOf(validator(config(MINIKUBE_PUBLIC_KEY))
                .validate(JWT_PROJECTED_EXPIRED, ROLE));

        assertEquals(e.getErrorCode(), ErrorCode.TOKEN_EXPIRED);
        assertEquals(e.getMessage(), "Token is expired");
        assertEquals(e.getHttpStatus(), 403);
    }

    @Test
    public void testUnknownSigningKey() throws Exception {
        KubeAuthenticationException e = failureOf(validator(config(MINIKUBE_PUBLIC_KEY, ECDSA_KEY))
                .validate(JWT_LEGACY_BAD_SIGNING_KEY, ROLE));

        assertEquals(e.getErrorCode(), ErrorCode.INVALID_SIGNATURE);
        assertEquals(e.getMessage(), "failed to validate JWT signature");
    }

    @Test
    public void testNoKeyOfTheTokenFamily() throws Exception {
        KubeAuthenticationException e = failureOf(validator(config(MINIKUBE_PUBLIC_KEY))
                .validate(JWT_ECDSA_SIGNED, ROLE));

        assertEquals(e.getErrorCode(), ErrorCode.INVALID_SIGNATURE);
    }

    @Test
    public void testSignatureIsCheckedBeforeExpiry() throws Exception {
        String forged = legacyToken("default", "vault-auth", "uid")
                .withExpiresAt(NOW.minusSeconds(3600))
                .sign(rs256(rsaKeyPair()));

        KubeAuthenticationException e = failureOf(validator(config(MINIKUBE_PUBLIC_KEY)).validate(forged, ROLE));

        assertEquals(e.getErrorCode(), ErrorCode.INVALID_SIGNATURE);
        assertNotEquals(e.getMessage(), "Token is expired");
    }

    @Test
    public void testFirstMatchingKeyWins() throws Exception {
        KeyPair other = rsaKeyPair();
        KeyPair signer = rsaKeyPair();
        String token = projectedToken("default", "vault-auth", "uid").sign(rs256(signer));

        VerifiedToken verified = validator(config(toPem(other.getPublic()), toPem(signer.getPublic())))
                .validate(token, ROLE).get(10, TimeUnit.SECONDS);

        assertEquals(verified.getJwt().getToken(), token);
    }

    @Test
    public void testRsaFamily() throws Exception {
        KeyPair signer = rsaKeyPair();
        RSAPublicKey publicKey = (RSAPublicKey) signer.getPublic();
        RSAPrivateKey privateKey = (RSAPrivateKey) signer.getPrivate();
        LocalSignatureValidator validator = validator(config(toPem(signer.getPublic())));

        for (Algorithm alg : List.of(Algorithm.RSA256(publicKey, privateKey), Algorithm.RSA384(publicKey, privateKey),
                Algorithm.RSA512(publicKey, privateKey))) {
            validator.validate(legacyToken("default", "vault-auth", "uid").sign(alg), ROLE)
                    .get(10, TimeUnit.SECONDS);
        }
    }

    @Test
    public void testEcdsaFamily() throws Exception {
        KeyPair p256 = ecKeyPair("secp256r1");
        KeyPair p521 = ecKeyPair("secp521r1");
        LocalSignatureValidator validator = validator(config(toPem(p256.getPublic()), toPem(p521.getPublic())));

        String es256 = legacyToken("default", "vault-auth", "uid").sign(
                Algorithm.ECDSA256((ECPublicKey) p256.getPublic(), (ECPrivateKey) p256.getPrivate()));
        String es512 = legacyToken("default", "vault-auth", "uid").sign(
                Algorithm.ECDSA512((ECPublicKey) p521.getPublic(), (ECPrivateKey) p521.getPrivate()));

        validator.validate(es256, ROLE).get(10, TimeUnit.SECONDS);
        validator.validate(es512, ROLE).get(10, TimeUnit.SECONDS);
    }

    @Test
    public void testUnsignedTokenIsRejected() throws Exception {
        String unsigned = legacyToken("default", "vault-auth", "uid").sign(Algorithm.none());

        KubeAuthenticationException e = failureOf(validator(config(MINIKUBE_PUBLIC_KEY, ECDSA_KEY))
                .validate(unsigned, ROLE));

        assertEquals(e.getErrorCode(), ErrorCode.INVALID_SIGNATURE);
    }

    @Test
    public void testGarbageToken() throws Exception {
        KubeAuthenticationException e = failureOf(validator(config(MINIKUBE_PUBLIC_KEY))
                .validate("not-a-jwt", ROLE));

        assertEquals(e.getErrorCode(), ErrorCode.MALFORMED_CLAIMS);
    }
}
