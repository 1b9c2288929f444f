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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.kubeauth.common.configuration.KubeAuthConfiguration;
import io.kubeauth.common.data.ClusterConfig;
import io.kubeauth.common.data.RoleEntry;
import io.kubeauth.common.resources.ClusterConfigResources;
import io.kubeauth.common.resources.RoleResources;
import io.kubeauth.common.storage.KeyValueStore;
import io.kubeauth.common.storage.KeyValueStoreException;
import io.kubeauth.kubernetes.ServiceAccountReaderFactory;
import io.kubeauth.kubernetes.TokenReviewerFactory;
import io.kubeauth.login.KubeAuthenticationException.ErrorCode;
import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Kubernetes service account login backend.
 *
 * <p>Holds the stored cluster configuration and roles, and logs service accounts in against them. Logins are
 * independent of each other and may run concurrently. The cluster client and validators are built once per
 * configuration and replaced when {@link #writeConfig(ClusterConfig)} stores a different one.
 */
@Slf4j
public class KubeAuthBackend implements Closeable {

    private final KubeAuthConfiguration conf;
    private final ClusterConfigResources configResources;
    private final RoleResources roleResources;
    private final Clock clock;
    private final ExecutorService httpExecutor;
    private final ScheduledExecutorService scheduler;

    private volatile TokenReviewerFactory tokenReviewerFactory = TokenReviewerFactory.DEFAULT;
    private volatile ServiceAccountReaderFactory serviceAccountReaderFactory = ServiceAccountReaderFactory.DEFAULT;

    private ClusterState clusterState;
    private boolean closed;

    public KubeAuthBackend(KubeAuthConfiguration conf, KeyValueStore store) {
        this(conf, store, Clock.systemUTC());
    }

    public KubeAuthBackend(KubeAuthConfiguration conf, KeyValueStore store, Clock clock) {
        this.conf = conf;
        this.configResources = new ClusterConfigResources(store, conf.getStoreOperationTimeoutSeconds());
        this.roleResources = new RoleResources(store, conf.getStoreOperationTimeoutSeconds());
        this.clock = clock;
        this.httpExecutor = Executors.newFixedThreadPool(conf.getKubernetesHttpExecutorThreads(),
                new ThreadFactoryBuilder().setNameFormat("kubeauth-http-%d").setDaemon(true).build());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("kubeauth-login-timer-%d").setDaemon(true).build());
    }

    /**
     * Log a service account in.
     *
     * @return a future completed with the granted authentication, or exceptionally with a
     *         {@link KubeAuthenticationException}. Cancelling it aborts the login and any call made to the cluster.
     */
    public CompletableFuture<LoginResponse> login(LoginRequest request) {
        return newAttempt(request, false).run();
    }

    /**
     * Resolve the alias a login would bind to, running every check a login runs except reading annotations.
     */
    public CompletableFuture<LoginResponse> aliasLookahead(LoginRequest request) {
        return newAttempt(request, true).run();
    }

    private LoginAttempt newAttempt(LoginRequest request, boolean lookahead) {
        return new LoginAttempt(request, lookahead, roleResources::getRoleAsync, this::loadClusterState,
                scheduler, conf.getLoginTimeoutMillis());
    }

    public void writeConfig(ClusterConfig config) throws KeyValueStoreException {
        config.validate();
        configResources.setConfig(config);
        log.info("Stored cluster configuration for {}", config.getKubernetesHost());
        invalidateClusterState();
    }

    public Optional<ClusterConfig> readConfig() throws KeyValueStoreException {
        return configResources.getConfig();
    }

    public void writeRole(String name, RoleEntry role) throws KeyValueStoreException {
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("role name can not be empty");
        }
        role.validate();
        roleResources.setRole(name, role);
        log.info("Stored role {}", name);
    }

    public Optional<RoleEntry> readRole(String name) throws KeyValueStoreException {
        return roleResources.getRole(name);
    }

    public boolean deleteRole(String name) throws KeyValueStoreException {
        return roleResources.deleteRole(name);
    }

    public List<String> listRoles() throws KeyValueStoreException {
        return roleResources.listRoles();
    }

    /**
     * The state for the stored configuration, retained for the caller. The caller must release it.
     */
    private CompletableFuture<ClusterState> loadClusterState() {
        return configResources.getConfigAsync().thenApply(config -> {
            try {
                return clusterStateFor(config.orElseThrow(() -> new KubeAuthenticationException(
                        ErrorCode.BACKEND_NOT_CONFIGURED, "could not load backend configuration")));
            } catch (KubeAuthenticationException e) {
                throw new CompletionException(e);
            }
        });
    }

    private synchronized ClusterState clusterStateFor(ClusterConfig config) throws KubeAuthenticationException {
        if (closed) {
            throw new KubeAuthenticationException(ErrorCode.CANCELED, "backend is closed");
        }
        if (clusterState != null && clusterState.getConfig().equals(config)) {
            clusterState.retain();
            return clusterState;
        }
        ClusterState next;
        try {
            next = ClusterState.create(config, conf, httpExecutor, clock, tokenReviewerFactory,
                    serviceAccountReaderFactory);
        } catch (IOException e) {
            log.error("Failed to set up client for {}", config.getKubernetesHost(), e);
            throw new KubeAuthenticationException(ErrorCode.BACKEND_NOT_CONFIGURED,
                    "could not load backend configuration: " + e.getMessage(), e);
        }
        retire(clusterState);
        next.retain();
        clusterState = next;
        return next;
    }

    private synchronized void invalidateClusterState() {
        retire(clusterState);
        clusterState = null;
    }

    private static void retire(ClusterState state) {
        if (state != null) {
            state.retire();
        }
    }

    @VisibleForTesting
    synchronized ClusterState currentClusterState() {
        return clusterState;
    }

    @VisibleForTesting
    void setTokenReviewerFactory(TokenReviewerFactory tokenReviewerFactory) {
        this.tokenReviewerFactory = tokenReviewerFactory;
        invalidateClusterState();
    }

    @VisibleForTesting
    void setServiceAccountReaderFactory(ServiceAccountReaderFactory serviceAccountReaderFactory) {
        this.serviceAccountReaderFactory = serviceAccountReaderFactory;
        invalidateClusterState();
    }

    @Override
    public void close() throws IOException {
        synchronized (this) {
            closed = true;
            invalidateClusterState();
        }
        scheduler.shutdownNow();
        httpExecutor.shutdownNow();
    }
}
