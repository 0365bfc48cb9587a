/*
 * Copyright (c) 2020 Cognite AS
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.cognite.sdk.servicesV1;

import com.google.common.collect.ImmutableSet;

public final class ConnectorConstants {
    public static final String SDK_IDENTIFIER = "cdf-sdk-java-hierarchy-0.9.0";
    public static final String DEFAULT_APP_IDENTIFIER = "cdf-sdk-java";
    public static final String DEFAULT_SESSION_IDENTIFIER = "cdf-sdk-java";

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int MIN_MAX_RETRIES = 1;
    public static final int MAX_MAX_RETRIES = 20;

    public static final int DEFAULT_MAX_BATCH_SIZE = 1000;

    // Response codes where the request is retried by the executor.
    public static final ImmutableSet<Integer> RETRYABLE_RESPONSE_CODES = ImmutableSet.of(429, 500, 502, 503, 504);
    // Retryable response codes where the failed request may still have been applied.
    public static final ImmutableSet<Integer> AMBIGUOUS_RESPONSE_CODES = ImmutableSet.of(500, 502, 504);

    public static final long MAX_BACKOFF_MS = 500L;

    private ConnectorConstants() {
    }
}
