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

import io.kubeauth.common.configuration.KubeAuthConfiguration;
import io.kubeauth.common.data.ClusterConfig;
import io.kubeauth.kubernetes.KubernetesApiClient;
import io.kubeauth.kubernetes.ServiceAccountReader;
import io.kubeauth.kubernetes.ServiceAccountReaderFactory;
import io.kubeauth.kubernetes.TokenReviewerFactory;
import io.kubeauth.login.validation.TokenValidator;
import io.kubeauth.login.validation.TokenValidatorFactory;
import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.Executor;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Everything built from one generation of the cluster configuration. Shared by the logins running against that
 * generation. Once a newer configuration retires it, the client is closed when the last of those logins releases
 * it.
 */
@Slf4j
@Getter
class ClusterState implements Closeable {

    private final ClusterConfig config;
    private final KubernetesApiClient client;
    private final TokenValidator validator;
    private final ServiceAccountReader serviceAccountReader;

    @Getter(AccessLevel.NONE)
    private int users;
    @Getter(AccessLevel.NONE)
    private boolean retired;

    private ClusterState(ClusterConfig config, KubernetesApiClient client, TokenValidator validator,
                         ServiceAccountReader serviceAccountReader) {
        this.config = config;
        this.client = client;
        this.validator = validator;
        this.serviceAccountReader = serviceAccountReader;
    }

    static ClusterState create(ClusterConfig config, KubeAuthConfiguration conf, Executor executor, Clock clock,
                               TokenReviewerFactory reviewerFactory,
                               ServiceAccountReaderFactory readerFactory) throws IOException {
        KubernetesApiClient client = new KubernetesApiClient(config, conf, executor);
        try {
            TokenValidator validator = TokenValidatorFactory.create(config, reviewerFactory.create(client), clock);
            return new ClusterState(config, client, validator, readerFactory.create(client));
        } catch (IOException | RuntimeException e) {
            client.close();
            throw e;
        }
    }

    synchronized void retain() {
        users++;
    }

    void release() {
        boolean close;
        synchronized (this) {
            users--;
            close = retired && users == 0;
        }
        if (close) {
            closeQuietly();
        }
    }

    /**
     * Stop handing this state out. The client stays open for the logins still holding it.
     */
    void retire() {
        boolean close;
        synchronized (this) {
            if (retired) {
                return;
            }
            retired = true;
            close = users == 0;
        }
        if (close) {
            closeQuietly();
        }
    }

    synchronized boolean isRetired() {
        return retired;
    }

    synchronized int getUsers() {
        return users;
    }

    private void closeQuietly() {
        try {
            close();
        } catch (IOException e) {
            log.warn("Failed to close client for {}", config.getKubernetesHost(), e);
        }
    }

    @Override
    public void close() throws IOException {
        client.close();
    }
}
