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

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Identity of the service account a token was issued to, whatever the token shape.
 */
@Value
@Builder(toBuilder = true)
public class ServiceAccountIdentity {

    public static final String METADATA_SERVICE_ACCOUNT_NAME = "service_account_name";
    public static final String METADATA_SERVICE_ACCOUNT_UID = "service_account_uid";
    public static final String METADATA_SERVICE_ACCOUNT_NAMESPACE = "service_account_namespace";
    public static final String METADATA_SERVICE_ACCOUNT_SECRET_NAME = "service_account_secret_name";

    @Builder.Default
    String namespace = "";
    @Builder.Default
    String name = "";
    @Builder.Default
    String uid = "";
    /** Name of the secret holding a legacy token, empty for projected tokens. */
    @Builder.Default
    String secretName = "";
    /** Pod the projected token is bound to, empty for legacy tokens. */
    @Builder.Default
    String podName = "";
    @Builder.Default
    String podUid = "";
    String subject;
    String issuer;
    @Builder.Default
    List<String> audiences = Collections.emptyList();
    boolean projected;
    Instant expiresAt;
    Instant issuedAt;
    Instant notBefore;

    /**
     * Identity metadata attached to a successful login. These keys are never overridden by annotations.
     */
    public Map<String, String> toMetadata() {
        Map<String, String> metadata = new HashMap<>();
        metadata.put(METADATA_SERVICE_ACCOUNT_UID, StringUtils.defaultString(uid));
        metadata.put(METADATA_SERVICE_ACCOUNT_NAME, StringUtils.defaultString(name));
        metadata.put(METADATA_SERVICE_ACCOUNT_NAMESPACE, StringUtils.defaultString(namespace));
        metadata.put(METADATA_SERVICE_ACCOUNT_SECRET_NAME, StringUtils.defaultString(secretName));
        return metadata;
    }
}
