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
package io.kubeauth.common.configuration;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Process-level settings of the login engine.
 *
 * <p>Per-cluster settings (API host, keys, reviewer token) are not part of this object, they are stored
 * records written through the administrative operations.
 */
@Getter
@Setter
@ToString
public class KubeAuthConfiguration {

    private static final String CATEGORY_KUBERNETES_CLIENT = "Kubernetes Client";
    private static final String CATEGORY_LOGIN = "Login";
    private static final String CATEGORY_STORAGE = "Storage";
    private static final String CATEGORY_IN_CLUSTER = "In-cluster credentials";

    @FieldContext(
            category = CATEGORY_KUBERNETES_CLIENT,
            minValue = 1,
            doc = "Connect timeout in milliseconds for requests to the Kubernetes API server"
    )
    private int kubernetesHttpConnectTimeoutMillis = 10_000;

    @FieldContext(
            category = CATEGORY_KUBERNETES_CLIENT,
            minValue = 1,
            doc = "Read timeout in milliseconds for requests to the Kubernetes API server"
    )
    private int kubernetesHttpReadTimeoutMillis = 10_000;

    @FieldContext(
            category = CATEGORY_KUBERNETES_CLIENT,
            minValue = 1,
            doc = "Maximum number of pooled connections to the Kubernetes API server"
    )
    private int kubernetesHttpMaxConnections = 20;

    @FieldContext(
            category = CATEGORY_KUBERNETES_CLIENT,
            minValue = 1,
            maxValue = 1024,
            doc = "Number of threads executing blocking Kubernetes API calls"
    )
    private int kubernetesHttpExecutorThreads = 8;

    @FieldContext(
            category = CATEGORY_LOGIN,
            minValue = 0,
            doc = "Upper bound in milliseconds for a single login. A login exceeding it is canceled."
                    + " 0 disables the bound."
    )
    private long loginTimeoutMillis = 0;

    @FieldContext(
            category = CATEGORY_STORAGE,
            minValue = 1,
            doc = "Timeout in seconds for synchronous reads and writes of stored configuration and roles"
    )
    private int storeOperationTimeoutSeconds = 30;

    @FieldContext(
            category = CATEGORY_IN_CLUSTER,
            doc = "Path of the service-account token mounted into the pod, used as token reviewer JWT"
                    + " when none is configured"
    )
    private String localServiceAccountTokenPath = "/var/run/secrets/kubernetes.io/serviceaccount/token";

    @FieldContext(
            category = CATEGORY_IN_CLUSTER,
            doc = "Path of the cluster CA certificate mounted into the pod, used when no CA certificate"
                    + " is configured"
    )
    private String localCaCertPath = "/var/run/secrets/kubernetes.io/serviceaccount/ca.crt";
}
