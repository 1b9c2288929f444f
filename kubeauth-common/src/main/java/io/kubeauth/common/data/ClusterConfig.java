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
package io.kubeauth.common.data;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.kubeauth.common.util.PemUtils;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collections;
import java.util.List;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.apache.commons.lang3.StringUtils;

/**
 * Connection and verification settings of the Kubernetes cluster logins are checked against.
 *
 * <p>Instances are immutable. Reconfiguration stores a new instance which replaces the previous one.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ClusterConfig {

    public static final String DEFAULT_ISSUER = "kubernetes/serviceaccount";

    /** Base URL of the Kubernetes API server. */
    @JsonProperty("kubernetes_host")
    String kubernetesHost;

    /** PEM encoded CA certificate(s) used to verify the API server's TLS certificate. */
    @JsonProperty("kubernetes_ca_cert")
    String kubernetesCaCert;

    /** Bearer token used for the token review and service-account reads. */
    @ToString.Exclude
    @JsonProperty("token_reviewer_jwt")
    String tokenReviewerJwt;

    /** PEM encoded public keys or certificates verifying service-account tokens locally. */
    @Builder.Default
    @JsonProperty("pem_keys")
    List<String> pemKeys = Collections.emptyList();

    @Builder.Default
    @JsonProperty("issuer")
    String issuer = DEFAULT_ISSUER;

    @JsonProperty("disable_iss_validation")
    boolean disableIssValidation;

    /** Do not fall back to the token and CA mounted into the pod. */
    @JsonProperty("disable_local_ca_jwt")
    boolean disableLocalCaJwt;

    @JsonProperty("enable_custom_metadata_from_annotations")
    boolean enableCustomMetadataFromAnnotations;

    /** Confirm locally verified tokens with a token review as well. */
    @JsonProperty("always_review_token")
    boolean alwaysReviewToken;

    @JsonIgnore
    public String getIssuerOrDefault() {
        return StringUtils.isBlank(issuer) ? DEFAULT_ISSUER : issuer;
    }

    /**
     * Checks the record is usable.
     *
     * @throws IllegalArgumentException describing the first problem found
     */
    public void validate() throws IllegalArgumentException {
        if (StringUtils.isBlank(kubernetesHost)) {
            throw new IllegalArgumentException("no host provided");
        }
        try {
            URI uri = new URI(kubernetesHost);
            if ((!"https".equals(uri.getScheme()) && !"http".equals(uri.getScheme())) || uri.getHost() == null) {
                throw new IllegalArgumentException("invalid kubernetes_host \"" + kubernetesHost + "\"");
            }
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("invalid kubernetes_host \"" + kubernetesHost + "\"", e);
        }
        if (StringUtils.isNotBlank(kubernetesCaCert)) {
            try {
                PemUtils.parseCertificates(kubernetesCaCert);
            } catch (IOException e) {
                throw new IllegalArgumentException("invalid kubernetes_ca_cert: " + e.getMessage(), e);
            }
        }
        if (pemKeys != null) {
            for (String pem : pemKeys) {
                try {
                    PemUtils.parsePublicKeys(pem);
                } catch (IOException e) {
                    throw new IllegalArgumentException("invalid pem_keys: " + e.getMessage(), e);
                }
            }
        }
    }
}
