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

import static org.assertj.core.api.Assertions.assertThat;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.testng.annotations.Test;

public class AnnotationMergerTest {

    private static final ServiceAccountIdentity IDENTITY = ServiceAccountIdentity.builder()
            .namespace("default")
            .name("vault-auth")
            .uid("d77f89bc-9055-11e7-a068-0800276d99bf")
            .secretName("vault-auth-token-t5pcn")
            .build();

    @Test
    public void testMergeIntoBothMaps() {
        Map<String, String> metadata = new HashMap<>(IDENTITY.toMetadata());
        Map<String, String> aliasMetadata = new HashMap<>(IDENTITY.toMetadata());

        AnnotationMerger.merge(Map.of("service_role", "authz"), metadata, aliasMetadata);

        assertThat(metadata).containsEntry("service_role", "authz").hasSize(5);
        assertThat(aliasMetadata).isEqualTo(metadata);
    }

    @Test
    public void testReservedKeysAreKept() {
        Map<String, String> metadata = new HashMap<>(IDENTITY.toMetadata());
        Map<String, String> aliasMetadata = new HashMap<>(IDENTITY.toMetadata());

        AnnotationMerger.merge(Map.of(
                "service_account_name", "overwritten",
                "service_account_uid", "overwritten",
                "service_account_namespace", "overwritten",
                "service_account_secret_name", "overwritten",
                "team", "payments"), metadata, aliasMetadata);

        for (Map<String, String> map : List.of(metadata, aliasMetadata)) {
            assertThat(map)
                    .containsEntry("service_account_name", "vault-auth")
                    .containsEntry("service_account_uid", "d77f89bc-9055-11e7-a068-0800276d99bf")
                    .containsEntry("service_account_namespace", "default")
                    .containsEntry("service_account_secret_name", "vault-auth-token-t5pcn")
                    .containsEntry("team", "payments");
        }
    }

    @Test
    public void testIdempotent() {
        Map<String, String> metadata = new HashMap<>(IDENTITY.toMetadata());
        Map<String, String> aliasMetadata = new HashMap<>();
        Map<String, String> annotations = Map.of("service_role", "authz");

        AnnotationMerger.merge(annotations, metadata, aliasMetadata);
        Map<String, String> once = new HashMap<>(metadata);
        AnnotationMerger.merge(annotations, metadata, aliasMetadata);

        assertThat(metadata).isEqualTo(once);
        assertThat(aliasMetadata).containsOnlyKeys("service_role");
    }

    @Test
    public void testNullAnnotations() {
        Map<String, String> metadata = new HashMap<>(IDENTITY.toMetadata());

        AnnotationMerger.merge(null, metadata, new HashMap<>());

        assertThat(metadata).isEqualTo(IDENTITY.toMetadata());
    }
}
