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

import com.google.common.collect.ImmutableSet;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Copies service account annotations into login metadata.
 */
@Slf4j
public final class AnnotationMerger {

    static final Set<String> RESERVED_KEYS = ImmutableSet.of(
            ServiceAccountIdentity.METADATA_SERVICE_ACCOUNT_NAME,
            ServiceAccountIdentity.METADATA_SERVICE_ACCOUNT_UID,
            ServiceAccountIdentity.METADATA_SERVICE_ACCOUNT_NAMESPACE,
            ServiceAccountIdentity.METADATA_SERVICE_ACCOUNT_SECRET_NAME);

    private AnnotationMerger() {
    }

    /**
     * Put every annotation into both metadata maps, except the reserved identity keys whose values are kept.
     */
    public static void merge(Map<String, String> annotations, Map<String, String> authMetadata,
                             Map<String, String> aliasMetadata) {
        if (annotations == null) {
            return;
        }
        annotations.forEach((key, value) -> {
            if (RESERVED_KEYS.contains(key)) {
                log.warn("Ignoring annotation overriding reserved metadata key {}", key);
                return;
            }
            authMetadata.put(key, value);
            aliasMetadata.put(key, value);
        });
    }
}
