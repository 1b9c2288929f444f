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

import com.google.common.net.UrlEscapers;
import io.kubeauth.common.util.FutureUtil;
import io.kubeauth.kubernetes.models.V1ServiceAccount;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.lang3.StringUtils;
import org.apache.http.client.methods.HttpGet;

/**
 * {@link ServiceAccountReader} fetching the {@code ServiceAccount} object from the cluster API.
 */
public class HttpServiceAccountReader implements ServiceAccountReader {

    private final KubernetesApiClient client;

    public HttpServiceAccountReader(KubernetesApiClient client) {
        this.client = client;
    }

    @Override
    public CompletableFuture<Map<String, String>> readAnnotations(String name, String namespace) {
        String path = String.format("/api/v1/namespaces/%s/serviceaccounts/%s",
                UrlEscapers.urlPathSegmentEscaper().escape(namespace),
                UrlEscapers.urlPathSegmentEscaper().escape(name));
        HttpGet get = client.newGet(path, client.getReviewerJwt().orElse(""));
        CompletableFuture<V1ServiceAccount> response = client.executeAsync(get, V1ServiceAccount.class);
        CompletableFuture<Map<String, String>> result =
                response.thenApply(HttpServiceAccountReader::filterAnnotations);
        FutureUtil.propagateCancellation(result, response);
        return result;
    }

    static Map<String, String> filterAnnotations(V1ServiceAccount serviceAccount) {
        if (serviceAccount.getMetadata() == null || serviceAccount.getMetadata().getAnnotations() == null) {
            return Collections.emptyMap();
        }
        Map<String, String> filtered = new HashMap<>();
        serviceAccount.getMetadata().getAnnotations().forEach((key, value) -> {
            if (key.startsWith(ALLOWED_ANNOTATION_PREFIX)) {
                // vault.hashicorp.com/auth-metadata/service-role becomes service_role
                filtered.put(StringUtils.removeStart(key, ALLOWED_ANNOTATION_PREFIX).replace('-', '_'), value);
            }
        });
        return filtered;
    }
}
