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

import java.io.IOException;

/**
 * Generic key-value store failure.
 */
public class KeyValueStoreException extends IOException {

    public KeyValueStoreException(String message) {
        super(message);
    }

    public KeyValueStoreException(Throwable cause) {
        super(cause);
    }

    public KeyValueStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * A stored value cannot be decoded.
     */
    public static class InvalidDataException extends KeyValueStoreException {
        public InvalidDataException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Operation on a closed store.
     */
    public static class AlreadyClosedException extends KeyValueStoreException {
        public AlreadyClosedException() {
            super("The key-value store is closed");
        }
    }
}
