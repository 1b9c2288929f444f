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

import com.auth0.jwt.interfaces.DecodedJWT;
import io.kubeauth.common.data.RoleEntry;
import io.kubeauth.common.util.FutureUtil;
import io.kubeauth.kubernetes.TokenReviewResult;
import io.kubeauth.kubernetes.TokenReviewer;
import io.kubeauth.login.KubeAuthenticationException;
import io.kubeauth.login.KubeAuthenticationException.ErrorCode;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Lets the cluster decide whether a token is valid through the token review API. The registered claims are still
 * checked locally before the cluster is asked.
 */
@Slf4j
public class TokenReviewValidator implements TokenValidator {

    private final TokenReviewer reviewer;
    private final StandardClaimsValidator claimsValidator;

    public TokenReviewValidator(TokenReviewer reviewer, StandardClaimsValidator claimsValidator) {
        this.reviewer = reviewer;
        this.claimsValidator = claimsValidator;
    }

    @Override
    public CompletableFuture<VerifiedToken> validate(String token, RoleEntry role) {
        DecodedJWT jwt;
        try {
            jwt = StandardClaimsValidator.decode(token);
            claimsValidator.validate(jwt, role);
        } catch (KubeAuthenticationException e) {
            return CompletableFuture.failedFuture(e);
        }
        return review(jwt, role);
    }

    CompletableFuture<VerifiedToken> review(DecodedJWT jwt, RoleEntry role) {
        List<String> audiences = role != null && StringUtils.isNotEmpty(role.getAudience())
                ? Collections.singletonList(role.getAudience())
                : Collections.emptyList();
        CompletableFuture<TokenReviewResult> review = reviewer.review(jwt.getToken(), audiences);
        CompletableFuture<VerifiedToken> result = review.handle((r, ex) -> {
            if (ex != null) {
                throw new CompletionException(translate(FutureUtil.unwrapCompletionException(ex)));
            }
            if (!r.isAuthenticated()) {
                throw new CompletionException(
                        new KubeAuthenticationException(ErrorCode.TOKEN_REVIEW_DENIED, r.getError()));
            }
            return new VerifiedToken(jwt, r);
        });
        FutureUtil.propagateCancellation(result, review);
        return result;
    }

    static KubeAuthenticationException translate(Throwable cause) {
        if (cause instanceof KubeAuthenticationException) {
            return (KubeAuthenticationException) cause;
        }
        if (cause instanceof CancellationException) {
            return new KubeAuthenticationException(ErrorCode.CANCELED, "token review canceled", cause);
        }
        if (cause instanceof IOException) {
            log.warn("Token review failed: {}", cause.getMessage());
            return new KubeAuthenticationException(ErrorCode.REVIEW_UNAVAILABLE,
                    "token review failed: " + cause.getMessage(), cause);
        }
        log.error("Unexpected token review failure", cause);
        return new KubeAuthenticationException(ErrorCode.REVIEW_UNAVAILABLE,
                "token review failed: " + cause, cause);
    }
}
