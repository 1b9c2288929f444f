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
package io.kubeauth.common.storage;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import org.testng.annotations.Test;

public class MemoryKeyValueStoreTest {

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testListReturnsDirectChildren() throws Exception {
        MemoryKeyValueStore store = new MemoryKeyValueStore();
        store.put("role/a", bytes("1")).get();
        store.put("role/b", bytes("2")).get();
        store.put("role/nested/c", bytes("3")).get();
        store.put("roles", bytes("4")).get();
        store.put("config", bytes("5")).get();

        assertEquals(store.list("role").get(), Arrays.asList("a", "b", "nested/"));
        assertEquals(store.list("role/nested/").get(), Collections.singletonList("c"));
        assertTrue(store.list("missing").get().isEmpty());
    }

    @Test
    public void testValuesAreCopied() throws Exception {
        MemoryKeyValueStore store = new MemoryKeyValueStore();
        byte[] value = bytes("abc");
        store.put("k", value).get();
        value[0] = 'x';

        byte[] read = store.get("k").get().get();
        assertEquals(new String(read, StandardCharsets.UTF_8), "abc");
        read[0] = 'y';
        assertEquals(new String(store.get("k").get().get(), StandardCharsets.UTF_8), "abc");

        assertTrue(store.delete("k").get());
        assertFalse(store.get("k").get().isPresent());
    }
}
