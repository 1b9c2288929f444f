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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * Source of the identity alias emitted by a login.
 */
public enum AliasNameSource {
    /** Service account UID. */
    DEFAULT("default"),
    /** Service account UID. */
    SERVICEACCOUNT_UID("serviceaccount_uid"),
    /** {@code <namespace>/<name>}. */
    SERVICEACCOUNT_NAME("serviceaccount_name");

    private final String value;

    AliasNameSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AliasNameSource fromString(String value) {
        if (StringUtils.isEmpty(value)) {
            return DEFAULT;
        }
        for (AliasNameSource source : values()) {
            if (source.value.equals(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("invalid alias_name_source \"" + value + "\"");
    }

    @Override
    public String toString() {
        return value;
    }
}
