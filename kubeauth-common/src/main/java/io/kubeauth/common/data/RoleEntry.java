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
import java.util.Collections;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.apache.commons.lang3.StringUtils;

/**
 * A named role: the service accounts allowed to log in with it and what a successful login is granted.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RoleEntry {

    @Builder.Default
    @JsonProperty("bound_service_account_names")
    List<String> boundServiceAccountNames = Collections.emptyList();

    @Builder.Default
    @JsonProperty("bound_service_account_namespaces")
    List<String> boundServiceAccountNamespaces = Collections.emptyList();

    /** When set, the token audience must contain this value. */
    @JsonProperty("audience")
    String audience;

    @Builder.Default
    @JsonProperty("alias_name_source")
    AliasNameSource aliasNameSource = AliasNameSource.DEFAULT;

    @Builder.Default
    @JsonProperty("token_policies")
    List<String> tokenPolicies = Collections.emptyList();

    @JsonProperty("token_ttl")
    long tokenTtlSeconds;

    @JsonProperty("token_max_ttl")
    long tokenMaxTtlSeconds;

    @JsonProperty("token_period")
    long tokenPeriodSeconds;

    @JsonProperty("token_num_uses")
    int tokenNumUses;

    @JsonIgnore
    public AliasNameSource getAliasNameSourceOrDefault() {
        return aliasNameSource == null ? AliasNameSource.DEFAULT : aliasNameSource;
    }

    /**
     * Checks the record is usable.
     *
     * @throws IllegalArgumentException describing the first problem found
     */
    public void validate() throws IllegalArgumentException {
        if (boundServiceAccountNames == null || boundServiceAccountNames.isEmpty()) {
            throw new IllegalArgumentException("\"bound_service_account_names\" can not be empty");
        }
        if (boundServiceAccountNamespaces == null || boundServiceAccountNamespaces.isEmpty()) {
            throw new IllegalArgumentException("\"bound_service_account_namespaces\" can not be empty");
        }
        checkNoMixedWildcard(boundServiceAccountNames, "bound_service_account_names");
        checkNoMixedWildcard(boundServiceAccountNamespaces, "bound_service_account_namespaces");
        if (tokenTtlSeconds < 0 || tokenMaxTtlSeconds < 0 || tokenPeriodSeconds < 0 || tokenNumUses < 0) {
            throw new IllegalArgumentException("token ttl, max ttl, period and num uses can not be negative");
        }
        if (tokenMaxTtlSeconds > 0 && tokenTtlSeconds > tokenMaxTtlSeconds) {
            throw new IllegalArgumentException("\"token_ttl\" cannot be greater than \"token_max_ttl\"");
        }
    }

    private static void checkNoMixedWildcard(List<String> values, String field) {
        for (String value : values) {
            if (StringUtils.isBlank(value)) {
                throw new IllegalArgumentException("\"" + field + "\" can not contain empty values");
            }
        }
        if (values.size() > 1 && values.contains("*")) {
            throw new IllegalArgumentException("can not mix \"*\" with values");
        }
    }
}
