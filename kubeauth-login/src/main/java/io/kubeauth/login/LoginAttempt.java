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

import io.kubeauth.common.data.ClusterConfig;
import io.kubeauth.common.data.RoleEntry;
import io.kubeauth.common.util.FutureUtil;
import io.kubeauth.kubernetes.TokenReviewResult;
import io.kubeauth.login.KubeAuthenticationException.ErrorCode;
import io.kubeauth.login.validation.VerifiedToken;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * One login, driven through its states until it fails or a response is built.
 *
 * <p>At most one network call is in flight at a time. Completing the result future by any means (cancellation by
 * the caller, timeout or a regular outcome) cancels that call.
 */
@Slf4j
class LoginAttempt {

    enum State {
        PARSE_INPUT,
        VALIDATE_TOKEN,
        EXTRACT_CLAIMS,
        MATCH_ROLE,
        RESOLVE_ALIAS,
        FETCH_ANNOTATIONS,
        BUILD_RESPONSE
    }

    @FunctionalInterface
    interface Step<T, R> {
        R apply(T input) throws KubeAuthenticationException;
    }

    private final LoginRequest request;
    private final boolean lookahead;
    private final Function<String, CompletableFuture<Optional<RoleEntry>>> roleLookup;
    private final Supplier<CompletableFuture<ClusterState>> clusterState;
    private final ScheduledExecutorService scheduler;
    private final long timeoutMillis;

    private final CompletableFuture<LoginResponse> result = new CompletableFuture<>();
    private volatile CompletableFuture<?> inFlight;
    @Getter
    private volatile State state;

    private RoleEntry role;
    private ClusterState cluster;
    // guarded by this
    private ClusterState held;
    private boolean finished;
    private ServiceAccountIdentity identity;
    private String aliasName;

    LoginAttempt(LoginRequest request, boolean lookahead,
                 Function<String, CompletableFuture<Optional<RoleEntry>>> roleLookup,
                 Supplier<CompletableFuture<ClusterState>> clusterState,
                 ScheduledExecutorService scheduler, long timeoutMillis) {
        this.request = request;
        this.lookahead = lookahead;
        this.roleLookup = roleLookup;
        this.clusterState = clusterState;
        this.scheduler = scheduler;
        this.timeoutMillis = timeoutMillis;
    }

    CompletableFuture<LoginResponse> run() {
        result.whenComplete((response, ex) -> {
            CompletableFuture<?> call = inFlight;
            if (call != null) {
                call.cancel(true);
            }
            releaseCluster();
            recordOutcome(ex);
        });
        if (timeoutMillis > 0) {
            ScheduledFuture<?> timeout = scheduler.schedule(() -> {
                if (result.completeExceptionally(new KubeAuthenticationException(ErrorCode.CANCELED,
                        "login timed out after " + timeoutMillis + " ms in state " + state))) {
                    log.warn("Login for role [{}] timed out in state {}", request.getRole(), state);
                }
            }, timeoutMillis, TimeUnit.MILLISECONDS);
            result.whenComplete((response, ex) -> timeout.cancel(false));
        }

        try {
            transition(State.PARSE_INPUT);
            if (StringUtils.isEmpty(request.getRole())) {
                throw new KubeAuthenticationException(ErrorCode.MISSING_ROLE, "missing role");
            }
            if (StringUtils.isEmpty(request.getJwt())) {
                throw new KubeAuthenticationException(ErrorCode.MISSING_JWT, "missing jwt");
            }
        } catch (KubeAuthenticationException e) {
            result.completeExceptionally(e);
            return result;
        }

        track(roleLookup.apply(request.getRole()))
                .thenApply(unchecked(this::requireRole))
                .thenCompose(__ -> track(acquireCluster()))
                .thenCompose(this::validateToken)
                .thenApply(unchecked(this::extractAndAuthorize))
                .thenCompose(this::fetchAnnotations)
                .whenComplete((response, ex) -> {
                    if (ex != null) {
                        result.completeExceptionally(translate(FutureUtil.unwrapCompletionException(ex)));
                    } else {
                        result.complete(response);
                    }
                });
        return result;
    }

    private RoleEntry requireRole(Optional<RoleEntry> entry) throws KubeAuthenticationException {
        role = entry.orElseThrow(() -> new KubeAuthenticationException(ErrorCode.INVALID_ROLE_NAME,
                "invalid role name \"" + request.getRole() + "\""));
        return role;
    }

    /**
     * The returned future may be canceled without losing the retained state, which is released when the login
     * completes.
     */
    private CompletableFuture<ClusterState> acquireCluster() {
        CompletableFuture<ClusterState> loaded = clusterState.get();
        loaded.thenAccept(this::holdCluster);
        return loaded.thenApply(state -> state);
    }

    private synchronized void holdCluster(ClusterState state) {
        if (finished) {
            state.release();
        } else {
            held = state;
        }
    }

    private synchronized void releaseCluster() {
        finished = true;
        if (held != null) {
            held.release();
            held = null;
        }
    }

    private CompletableFuture<VerifiedToken> validateToken(ClusterState current) {
        cluster = current;
        transition(State.VALIDATE_TOKEN);
        return track(current.getValidator().validate(request.getJwt(), role));
    }

    private ServiceAccountIdentity extractAndAuthorize(VerifiedToken verified) throws KubeAuthenticationException {
        transition(State.EXTRACT_CLAIMS);
        identity = ClaimsExtractor.extract(verified.getJwt());
        Optional<TokenReviewResult> review = verified.getReview();
        if (review.isPresent()) {
            checkReviewMatches(identity, review.get());
        }

        transition(State.MATCH_ROLE);
        AuthorizationMatcher.authorize(identity, role);

        transition(State.RESOLVE_ALIAS);
        aliasName = AliasResolver.resolve(identity, role.getAliasNameSourceOrDefault());
        return identity;
    }

    /**
     * The cluster must have reviewed the same service account the token claims to be.
     */
    static void checkReviewMatches(ServiceAccountIdentity identity, TokenReviewResult review)
            throws KubeAuthenticationException {
        if (!StringUtils.equals(identity.getName(), review.getName())) {
            throw new KubeAuthenticationException(ErrorCode.IDENTITY_MISMATCH, "JWT names did not match");
        }
        if (!StringUtils.equals(identity.getUid(), review.getUid())) {
            throw new KubeAuthenticationException(ErrorCode.IDENTITY_MISMATCH, "JWT UIDs did not match");
        }
        if (!StringUtils.equals(identity.getNamespace(), review.getNamespace())) {
            throw new KubeAuthenticationException(ErrorCode.IDENTITY_MISMATCH, "JWT namespaces did not match");
        }
    }

    private CompletableFuture<LoginResponse> fetchAnnotations(ServiceAccountIdentity id) {
        if (lookahead) {
            return CompletableFuture.completedFuture(
                    LoginResponse.lookahead(Alias.builder().name(aliasName).build()));
        }
        ClusterConfig config = cluster.getConfig();
        if (!config.isEnableCustomMetadataFromAnnotations()) {
            return CompletableFuture.completedFuture(buildResponse(Collections.emptyMap(), null));
        }
        transition(State.FETCH_ANNOTATIONS);
        return track(cluster.getServiceAccountReader().readAnnotations(id.getName(), id.getNamespace()))
                .handle((annotations, ex) -> {
                    if (ex == null) {
                        return buildResponse(annotations, null);
                    }
                    Throwable cause = FutureUtil.unwrapCompletionException(ex);
                    if (cause instanceof CancellationException || result.isDone()) {
                        throw new CompletionException(cause);
                    }
                    KubeAuthenticationException warning = new KubeAuthenticationException(
                            ErrorCode.ANNOTATION_FETCH_FAILED,
                            "failed to fetch service account annotations: " + cause.getMessage(), cause);
                    log.warn("Failed to read annotations of service account {}/{} [{}]: {}",
                            id.getNamespace(), id.getName(), warning.getErrorCode(), cause.getMessage());
                    return buildResponse(Collections.emptyMap(), warning.getMessage());
                });
    }

    private LoginResponse buildResponse(Map<String, String> annotations, String warning) {
        transition(State.BUILD_RESPONSE);
        Map<String, String> metadata = new HashMap<>(identity.toMetadata());
        Map<String, String> aliasMetadata = new HashMap<>(identity.toMetadata());
        AnnotationMerger.merge(annotations, metadata, aliasMetadata);

        Auth auth = Auth.builder()
                .policies(role.getTokenPolicies())
                .metadata(metadata)
                .displayName(identity.getNamespace() + "-" + identity.getName())
                .alias(Alias.builder().name(aliasName).metadata(aliasMetadata).build())
                .ttl(Duration.ofSeconds(role.getTokenTtlSeconds()))
                .maxTtl(Duration.ofSeconds(role.getTokenMaxTtlSeconds()))
                .period(Duration.ofSeconds(role.getTokenPeriodSeconds()))
                .numUses(role.getTokenNumUses())
                .internalData(Collections.singletonMap(Auth.INTERNAL_DATA_ROLE, request.getRole()))
                .build();
        LoginResponse.LoginResponseBuilder response = LoginResponse.builder().auth(auth);
        if (warning != null) {
            response.warning(warning);
        }
        return response.build();
    }

    private <T> CompletableFuture<T> track(CompletableFuture<T> call) {
        inFlight = call;
        if (result.isDone()) {
            call.cancel(true);
        }
        return call;
    }

    private void transition(State next) {
        if (log.isDebugEnabled()) {
            log.debug("Login for role [{}] from [{}]: {} -> {}", request.getRole(), request.getRemoteAddress(),
                    state, next);
        }
        state = next;
    }

    static KubeAuthenticationException translate(Throwable cause) {
        if (cause instanceof KubeAuthenticationException) {
            return (KubeAuthenticationException) cause;
        }
        if (cause instanceof CancellationException) {
            return new KubeAuthenticationException(ErrorCode.CANCELED, "login canceled", cause);
        }
        return new KubeAuthenticationException(ErrorCode.BACKEND_NOT_CONFIGURED,
                "could not load backend configuration: " + cause.getMessage(), cause);
    }

    private void recordOutcome(Throwable ex) {
        String action = lookahead ? "Alias lookahead" : "Auth";
        if (ex == null) {
            if (!lookahead) {
                LoginMetrics.loginSucceeded(request.getRole());
            }
            log.info("[Audit Event] {} succeeded for request from remote ip [{}] for role [{}]",
                    action, request.getRemoteAddress(), request.getRole());
            return;
        }
        KubeAuthenticationException failure = translate(FutureUtil.unwrapCompletionException(ex));
        if (!lookahead) {
            LoginMetrics.loginFailed(failure.getErrorCode());
        }
        log.warn("[Audit Event] {} failed for request from remote ip [{}] with reason: {}",
                action, request.getRemoteAddress(), failure.getMessage());
    }

    private static <T, R> Function<T, R> unchecked(Step<T, R> step) {
        return input -> {
            try {
                return step.apply(input);
            } catch (KubeAuthenticationException e) {
                throw new CompletionException(e);
            }
        };
    }
}
