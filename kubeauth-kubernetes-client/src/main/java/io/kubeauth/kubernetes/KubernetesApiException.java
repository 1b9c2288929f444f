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

import io.kubeauth.kubernetes.models.V1Status;
import java.io.IOException;
import java.util.Optional;
import lombok.Getter;

/**
 * Failure answered by the Kubernetes API server.
 */
public class KubernetesApiException extends IOException {

    @Getter
    private final int code;
    @Getter
    private final String responseBody;
    private final V1Status status;

    public KubernetesApiException(int code, String message, String responseBody) {
        this(code, message, responseBody, null);
    }

    public KubernetesApiException(int code, String message, String responseBody, V1Status status) {
        super(message);
        this.code = code;
        this.responseBody = responseBody;
        this.status = status;
    }

    public KubernetesApiException(String message, Throwable cause) {
        super(message, cause);
        this.code = 0;
        this.responseBody = null;
        this.status = null;
    }

    public Optional<V1Status> getStatus() {
        return Optional.ofNullable(status);
    }

    static KubernetesApiException fromStatus(V1Status status, String body) {
        int code = status.getCode() != null ? status.getCode() : 0;
        String message = status.getMessage() != null ? status.getMessage() : status.getReason();
        return new KubernetesApiException(code, message, body, status);
    }
}
