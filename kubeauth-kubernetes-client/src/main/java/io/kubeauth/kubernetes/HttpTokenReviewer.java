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
package io.kubeauth.kubernetes;

import io.kubeauth.common.util.FutureUtil;
import io.kubeauth.kubernetes.models.V1TokenReview;
import io.kubeauth.kubernetes.models.V1TokenReviewSpec;
import io.kubeauth.kubernetes.models.V1TokenReviewStatus;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.HttpPost;

/**
 * {@link TokenReviewer} posting a {@code TokenReview} to the cluster API.
 */
@Slf4j
public class HttpTokenReviewer implements TokenReviewer {

    static final String TOKEN_REVIEW_PATH = "/apis/authentication.k8s.io/v1/tokenreviews";
    static final String SERVICE_ACCOUNT_USERNAME_PREFIX = "system:serviceaccount:";

    private final KubernetesApiClient client;

    public HttpTokenReviewer(KubernetesApiClient client) {
        this.client = client;
    }

    @Override
    public CompletableFuture<TokenReviewResult> review(String jwt, List<String> audiences) {
        V1TokenReview request = new V1TokenReview();
        request.setSpec(new V1TokenReviewSpec(jwt, audiences == null || audiences.isEmpty() ? null : audiences));

        // Without a reviewer token the reviewed token authenticates its own review.
        String bearer = client.getReviewerJwt().orElse(jwt);
        HttpPost post;
        try {
            post = client.newPost(TOKEN_REVIEW_PATH, request, bearer);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }
        CompletableFuture<V1TokenReview> response = client.executeAsync(post, V1TokenReview.class);
        CompletableFuture<TokenReviewResult> result = response
                .thenApply(HttpTokenReviewer::toResult)
                .exceptionally(ex -> {
                    throw new CompletionException(translate(FutureUtil.unwrapCompletionException(ex)));
                });
        FutureUtil.propagateCancellation(result, response);
        return result;
    }

    private static Throwable translate(Throwable cause) {
        if (cause instanceof KubernetesApiException
                && ((KubernetesApiException) cause).getCode() == HttpStatus.SC_UNAUTHORIZED) {
            return new KubernetesApiException(HttpStatus.SC_UNAUTHORIZED,
                    "lookup failed: service account unauthorized; this could mean it has been deleted"
                            + " or recreated with a new token",
                    ((KubernetesApiException) cause).getResponseBody());
        }
        return cause;
    }

    static TokenReviewResult toResult(V1TokenReview review) {
        V1TokenReviewStatus status = review.getStatus();
        if (status == null) {
            return TokenReviewResult.denied("lookup failed: empty token review status");
        }
        if (StringUtils.isNotEmpty(status.getError())) {
            return TokenReviewResult.denied("lookup failed: " + status.getError());
        }
        if (!status.isAuthenticated()) {
            return TokenReviewResult.denied("lookup failed: service account jwt not valid");
        }
        String username = status.getUser() != null ? status.getUser().getUsername() : null;
        // system:serviceaccount:<namespace>:<name>
        String[] parts = StringUtils.defaultString(username).split(":", -1);
        if (parts.length != 4 || !username.startsWith(SERVICE_ACCOUNT_USERNAME_PREFIX)) {
            log.warn("Token review returned unexpected username format: {}", username);
            return TokenReviewResult.denied("lookup failed: unexpected username format");
        }
        return TokenReviewResult.builder()
                .authenticated(true)
                .namespace(parts[2])
                .name(parts[3])
                .uid(status.getUser().getUid())
                .audiences(status.getAudiences() != null ? status.getAudiences() : Collections.emptyList())
                .build();
    }
}
