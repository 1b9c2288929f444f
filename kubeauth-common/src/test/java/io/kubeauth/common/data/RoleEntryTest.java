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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.expectThrows;
import com.fasterxml.jackson.databind.JsonMappingException;
import io.kubeauth.common.util.ObjectMapperFactory;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.testng.annotations.Test;

public class RoleEntryTest {

    private static RoleEntry.RoleEntryBuilder role(List<String> names, List<String> namespaces) {
        return RoleEntry.builder()
                .boundServiceAccountNames(names)
                .boundServiceAccountNamespaces(namespaces);
    }

    @Test
    public void testValidRole() {
        role(Arrays.asList("vault-auth", "app-*"), Collections.singletonList("*")).build().validate();
        role(Collections.singletonList("*"), Collections.singletonList("default"))
                .tokenTtlSeconds(60).tokenMaxTtlSeconds(120).build().validate();
    }

    @Test
    public void testEmptyBindings() {
        assertEquals(expectThrows(IllegalArgumentException.class,
                        () -> role(Collections.emptyList(), Collections.singletonList("*")).build().validate())
                .getMessage(), "\"bound_service_account_names\" can not be empty");
        assertEquals(expectThrows(IllegalArgumentException.class,
                        () -> role(Collections.singletonList("*"), Collections.emptyList()).build().validate())
                .getMessage(), "\"bound_service_account_namespaces\" can not be empty");
    }

    @Test
    public void testWildcardCannotBeMixed() {
        assertEquals(expectThrows(IllegalArgumentException.class,
                        () -> role(Arrays.asList("*", "vault-auth"), Collections.singletonList("default"))
                                .build().validate())
                .getMessage(), "can not mix \"*\" with values");
        expectThrows(IllegalArgumentException.class,
                () -> role(Collections.singletonList("name"), Arrays.asList("default", "*")).build().validate());
    }

    @Test
    public void testTtlBounds() {
        expectThrows(IllegalArgumentException.class,
                () -> role(Collections.singletonList("*"), Collections.singletonList("*"))
                        .tokenTtlSeconds(600).tokenMaxTtlSeconds(60).build().validate());
    }

    @Test
    public void testAliasNameSourceJson() throws Exception {
        RoleEntry role = ObjectMapperFactory.getMapper().readValue(
                "{\"bound_service_account_names\":[\"a\"],\"bound_service_account_namespaces\":[\"b\"],"
                        + "\"alias_name_source\":\"serviceaccount_name\",\"token_policies\":[\"p1\"]}",
                RoleEntry.class);
        assertEquals(role.getAliasNameSource(), AliasNameSource.SERVICEACCOUNT_NAME);
        assertEquals(role.getTokenPolicies(), Collections.singletonList("p1"));

        RoleEntry defaults = ObjectMapperFactory.getMapper().readValue(
                "{\"bound_service_account_names\":[\"a\"],\"bound_service_account_namespaces\":[\"b\"]}",
                RoleEntry.class);
        assertEquals(defaults.getAliasNameSourceOrDefault(), AliasNameSource.DEFAULT);

        String json = ObjectMapperFactory.getMapper().writeValueAsString(role);
        assertEquals(ObjectMapperFactory.getMapper().readTree(json).get("alias_name_source").asText(),
                "serviceaccount_name");

        expectThrows(JsonMappingException.class, () -> ObjectMapperFactory.getMapper().readValue(
                "{\"alias_name_source\":\"bogus\"}", RoleEntry.class));
    }

    @Test
    public void testAliasNameSourceFromString() {
        assertEquals(AliasNameSource.fromString(""), AliasNameSource.DEFAULT);
        assertEquals(AliasNameSource.fromString("serviceaccount_uid"), AliasNameSource.SERVICEACCOUNT_UID);
        assertEquals(expectThrows(IllegalArgumentException.class, () -> AliasNameSource.fromString("uid"))
                .getMessage(), "invalid alias_name_source \"uid\"");
    }
}
