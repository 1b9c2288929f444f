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
import io.kubeauth.common.util.FutureUtil;
import java.util.concurrent.CompletableFuture;

/**
 * Verifies a token locally, then asks the cluster whether it is still valid. Used when public keys are configured
 * and every token must still be reviewed, so that revoked tokens are refused.
 */
public class ChainedTokenValidator implements TokenValidator {

    private final LocalSignatureValidator local;
    private final TokenReviewValidator review;

    public ChainedTokenValidator(LocalSignatureValidator local, TokenReviewValidator review) {
        this.local = local;
        this.review = review;
    }

    @Override
    public CompletableFuture<VerifiedToken> validate(String token, RoleEntry role) {
        CompletableFuture<VerifiedToken> result = new CompletableFuture<>();
        local.validate(token, role).whenComplete((verified, ex) -> {
            if (ex != null) {
                result.completeExceptionally(FutureUtil.unwrapCompletionException(ex));
                return;
            }
            CompletableFuture<VerifiedToken> reviewed = review.review(verified.getJwt(), role);
            FutureUtil.propagateCancellation(result, reviewed);
            reviewed.whenComplete((r, reviewEx) -> {
                if (reviewEx != null) {
                    result.completeExceptionally(FutureUtil.unwrapCompletionException(reviewEx));
                } else {
                    result.complete(r);
                }
            });
        });
        return result;
    }
}
