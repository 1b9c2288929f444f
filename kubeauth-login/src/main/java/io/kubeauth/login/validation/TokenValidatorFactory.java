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

import io.kubeauth.common.data.ClusterConfig;
import io.kubeauth.common.util.PemUtils;
import io.kubeauth.kubernetes.TokenReviewer;
import java.io.IOException;
import java.security.PublicKey;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Picks how tokens are validated for a cluster configuration.
 */
public final class TokenValidatorFactory {

    private TokenValidatorFactory() {
    }

    /**
     * Tokens are verified locally when public keys are configured, and reviewed by the cluster otherwise. With
     * {@code always_review_token} set, locally verified tokens are reviewed too.
     *
     * @throws IOException when a configured key can not be parsed
     */
    public static TokenValidator create(ClusterConfig config, TokenReviewer reviewer, Clock clock)
            throws IOException {
        StandardClaimsValidator claims = new StandardClaimsValidator(clock, config);
        List<PublicKey> keys = new ArrayList<>();
        for (String pem : config.getPemKeys()) {
            keys.addAll(PemUtils.parsePublicKeys(pem));
        }
        if (keys.isEmpty()) {
            return new TokenReviewValidator(reviewer, claims);
        }
        LocalSignatureValidator local = new LocalSignatureValidator(keys, claims);
        if (config.isAlwaysReviewToken()) {
            return new ChainedTokenValidator(local, new TokenReviewValidator(reviewer, claims));
        }
        return local;
    }
}
