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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asks the cluster whether a service-account token is valid.
 */
public interface TokenReviewer {

    /**
     * Review a token.
     *
     * @param jwt the raw token
     * @param audiences audiences the token must be issued for, may be empty
     * @return a future completed with the verdict of the cluster. It completes exceptionally with an
     *         {@link java.io.IOException} when the cluster could not be asked, and is cancellable.
     */
    CompletableFuture<TokenReviewResult> review(String jwt, List<String> audiences);
}
