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
import io.prometheus.client.Counter;

/**
 * Login outcome counters.
 */
public final class LoginMetrics {

    @VisibleForTesting
    static final Counter loginSuccessMetrics = Counter.build()
            .name("kubeauth_login_success")
            .help("Successful service account logins")
            .labelNames("role")
            .register();

    @VisibleForTesting
    static final Counter loginFailureMetrics = Counter.build()
            .name("kubeauth_login_failure")
            .help("Failed service account logins")
            .labelNames("reason")
            .register();

    private LoginMetrics() {
    }

    public static void loginSucceeded(String role) {
        loginSuccessMetrics.labels(role).inc();
    }

    public static void loginFailed(KubeAuthenticationException.ErrorCode reason) {
        loginFailureMetrics.labels(reason.name()).inc();
    }
}
