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

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Authentication granted by a successful login, handed to the host to issue its own credential.
 */
@Value
@Builder
public class Auth {

    public static final String INTERNAL_DATA_ROLE = "role";

    @Builder.Default
    List<String> policies = Collections.emptyList();
    @Builder.Default
    Map<String, String> metadata = Collections.emptyMap();
    /** {@code <namespace>-<name>} of the service account. */
    String displayName;
    Alias alias;
    Duration ttl;
    Duration maxTtl;
    Duration period;
    int numUses;
    @Builder.Default
    Map<String, String> internalData = Collections.emptyMap();
}
