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

package com.cognite.sdk.servicesV1.executor;

import com.cognite.sdk.servicesV1.ConnectorConstants;
import com.cognite.sdk.servicesV1.ResponseItems;
import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.RandomStringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Executes http requests towards the Cognite api.
 *
 * Requests that fail with a transient error (throttling, unavailable service, I/O error) are retried with
 * a bounded exponential backoff until the max number of attempts is reached. All other responses, including
 * client errors, are returned to the caller as-is. A response that follows an attempt with an unknown effect
 * (server error, gateway error, I/O error) is flagged via {@link ResponseItems#isRetriedAfterAmbiguousError()}.
 */
@AutoValue
public abstract class RequestExecutor {
    protected static final Logger LOG = LoggerFactory.getLogger(RequestExecutor.class);

    private static Builder builder() {
        return new AutoValue_RequestExecutor.Builder()
                .setMaxRetries(ConnectorConstants.DEFAULT_MAX_RETRIES)
                .setExecutor(ForkJoinPool.commonPool());
    }

    public static RequestExecutor of(OkHttpClient client) {
        Preconditions.checkNotNull(client, "The http client cannot be null.");
        return RequestExecutor.builder()
                .setHttpClient(client)
                .build();
    }

    abstract Builder toBuilder();
    abstract OkHttpClient getHttpClient();
    abstract Executor getExecutor();
    public abstract int getMaxRetries();

    public RequestExecutor withMaxRetries(int retries) {
        return toBuilder().setMaxRetries(retries).build();
    }

    public RequestExecutor withExecutor(Executor executor) {
        Preconditions.checkNotNull(executor, "The executor cannot be null.");
        return toBuilder().setExecutor(executor).build();
    }

    public RequestExecutor withHttpClient(OkHttpClient client) {
        Preconditions.checkNotNull(client, "The http client cannot be null.");
        return toBuilder().setHttpClient(client).build();
    }

    /**
     * Executes a request asynchronously.
     *
     * The future completes exceptionally (with the last {@link IOException} as the cause) if the request could not
     * be completed within the max number of attempts. A response with a transient error code after the last attempt
     * is returned as-is.
     *
     * @param request the request to execute
     * @return a future with the response
     */
    public CompletableFuture<ResponseItems> executeRequestAsync(Request request) {
        Preconditions.checkNotNull(request, "Request cannot be null.");
        return CompletableFuture.supplyAsync(() -> executeRequest(request), getExecutor());
    }

    private ResponseItems executeRequest(Request request) {
        final String loggingPrefix = "executeRequest() - " + RandomStringUtils.randomAlphanumeric(5) + " - ";
        final Instant startInstant = Instant.now();
        ThreadLocalRandom random = ThreadLocalRandom.current();
        ResponseItems lastResponse = null;
        IOException lastException = null;
        boolean ambiguousAttempt = false;

        for (int i = 0; i < getMaxRetries(); i++) {
            if (i > 0) {
                sleep(Math.min(ConnectorConstants.MAX_BACKOFF_MS, (10L * (long) Math.exp(i)) + random.nextLong(5)));
            }
            try (Response response = getHttpClient().newCall(request).execute()) {
                ResponseBody body = response.body();
                lastResponse = ResponseItems.of(response.code(), null == body ? "" : body.string(), ambiguousAttempt);
                lastException = null;
                if (ConnectorConstants.AMBIGUOUS_RESPONSE_CODES.contains(response.code())) {
                    ambiguousAttempt = true;
                }
                if (!ConnectorConstants.RETRYABLE_RESPONSE_CODES.contains(response.code())) {
                    LOG.debug(loggingPrefix + "Request to {} completed with response code {}. Duration: {}",
                            request.url(),
                            response.code(),
                            Duration.between(startInstant, Instant.now()));
                    return lastResponse;
                }
                LOG.warn(loggingPrefix + "Transient response code {} from {} on attempt {} of {}.",
                        response.code(),
                        request.url(),
                        i + 1,
                        getMaxRetries());
            } catch (IOException e) {
                lastException = e;
                ambiguousAttempt = true;
                LOG.warn(loggingPrefix + "I/O error calling {} on attempt {} of {}: {}",
                        request.url(),
                        i + 1,
                        getMaxRetries(),
                        e.toString());
            }
        }

        if (null != lastException) {
            LOG.error(loggingPrefix + "Request to {} failed after {} attempts. Duration: {}",
                    request.url(),
                    getMaxRetries(),
                    Duration.between(startInstant, Instant.now()));
            throw new CompletionException(lastException);
        }
        return lastResponse;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        }
    }

    @AutoValue.Builder
    abstract static class Builder {
        abstract Builder setHttpClient(OkHttpClient value);
        abstract Builder setExecutor(Executor value);
        abstract Builder setMaxRetries(int value);

        abstract RequestExecutor autoBuild();

        RequestExecutor build() {
            RequestExecutor executor = autoBuild();
            Preconditions.checkState(executor.getMaxRetries() <= ConnectorConstants.MAX_MAX_RETRIES
                            && executor.getMaxRetries() >= ConnectorConstants.MIN_MAX_RETRIES,
                    "Max retries out of range. Must be between "
                            + ConnectorConstants.MIN_MAX_RETRIES + " and " + ConnectorConstants.MAX_MAX_RETRIES);
            return executor;
        }
    }
}
