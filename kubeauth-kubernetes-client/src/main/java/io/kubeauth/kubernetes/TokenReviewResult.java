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

import java.util.Collections;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a token review. When {@code authenticated} is false the identity fields are unset and
 * {@code error} explains the refusal.
 */
@Value
@Builder
public class TokenReviewResult {
    boolean authenticated;
    String namespace;
    String name;
    String uid;
    @Builder.Default
    List<String> audiences = Collections.emptyList();
    String error;

    public static TokenReviewResult denied(String error) {
        return TokenReviewResult.builder().authenticated(false).error(error).build();
    }
}
