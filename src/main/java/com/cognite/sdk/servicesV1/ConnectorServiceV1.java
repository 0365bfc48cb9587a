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

import com.cognite.sdk.servicesV1.executor.RequestExecutor;
import com.cognite.sdk.servicesV1.request.PostJsonRequestProvider;
import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import okhttp3.OkHttpClient;
import org.apache.commons.lang3.RandomStringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;

/**
 * The connector service handles connections to the Cognite REST api.
 *
 * Each service method returns a reader or writer bound to a specific api endpoint. The reader/writer
 * executes requests via a {@link RequestExecutor} which handles transient errors.
 */
@AutoValue
public abstract class ConnectorServiceV1 {
    static final OkHttpClient DEFAULT_CLIENT = new OkHttpClient.Builder()
            .connectTimeout(90, TimeUnit.SECONDS)
            .readTimeout(90, TimeUnit.SECONDS)
            .writeTimeout(90, TimeUnit.SECONDS)
            .build();

    protected final Logger LOG = LoggerFactory.getLogger(this.getClass());
    // Logger identifier per instance
    private final String randomIdString = RandomStringUtils.randomAlphanumeric(5);
    private final String loggingPrefix = "ConnectorService [" + randomIdString + "] -";

    public static Builder builder() {
        return new AutoValue_ConnectorServiceV1.Builder()
                .setMaxRetries(ConnectorConstants.DEFAULT_MAX_RETRIES)
                .setAppIdentifier(ConnectorConstants.DEFAULT_APP_IDENTIFIER)
                .setSessionIdentifier(ConnectorConstants.DEFAULT_SESSION_IDENTIFIER)
                .setHttpClient(DEFAULT_CLIENT)
                .setExecutor(ForkJoinPool.commonPool());
    }

    public static ConnectorServiceV1 create() {
        return ConnectorServiceV1.builder().build();
    }

    public static ConnectorServiceV1 create(int maxRetries,
                                            String appIdentifier,
                                            String sessionIdentifier) {
        return ConnectorServiceV1.builder()
                .setMaxRetries(maxRetries)
                .setAppIdentifier(appIdentifier)
                .setSessionIdentifier(sessionIdentifier)
                .build();
    }

    public abstract int getMaxRetries();
    public abstract String getAppIdentifier();
    public abstract String getSessionIdentifier();
    abstract OkHttpClient getHttpClient();
    abstract Executor getExecutor();

    abstract Builder toBuilder();

    /**
     * Sets the http client to use for api requests.
     *
     * @param client The {@link OkHttpClient} to use.
     * @return a {@link ConnectorServiceV1} object with the configuration applied.
     */
    public ConnectorServiceV1 withHttpClient(OkHttpClient client) {
        Preconditions.checkNotNull(client, "The http client cannot be null.");
        return toBuilder().setHttpClient(client).build();
    }

    /**
     * Sets the {@link Executor} to use for async api requests.
     *
     * @param executor The {@link Executor} to use.
     * @return a {@link ConnectorServiceV1} object with the configuration applied.
     */
    public ConnectorServiceV1 withExecutor(Executor executor) {
        Preconditions.checkNotNull(executor, "The executor cannot be null.");
        return toBuilder().setExecutor(executor).build();
    }

    /**
     * Read assets by id from Cognite.
     *
     * @return a reader for the {@code assets/byids} endpoint.
     */
    public ItemReader readAssetsById() {
        LOG.debug(loggingPrefix + "Initiating read assets by id service.");
        return ItemReader.builder()
                .setRequestProvider(buildRequestProvider("assets/byids"))
                .setRequestExecutor(buildRequestExecutor())
                .build();
    }

    /**
     * Write Assets to Cognite.
     *
     * @return a writer for the {@code assets} endpoint.
     */
    public ItemWriter writeAssets() {
        LOG.debug(loggingPrefix + "Initiating write assets service.");
        return ItemWriter.builder()
                .setRequestProvider(buildRequestProvider("assets"))
                .setRequestExecutor(buildRequestExecutor())
                .build();
    }

    /**
     * Update Assets in Cognite.
     *
     * @return a writer for the {@code assets/update} endpoint.
     */
    public ItemWriter updateAssets() {
        LOG.debug(loggingPrefix + "Initiating update assets service.");
        return ItemWriter.builder()
                .setRequestProvider(buildRequestProvider("assets/update"))
                .setRequestExecutor(buildRequestExecutor())
                .build();
    }

    private PostJsonRequestProvider buildRequestProvider(String endpoint) {
        return PostJsonRequestProvider.builder()
                .setEndpoint(endpoint)
                .setSdkIdentifier(ConnectorConstants.SDK_IDENTIFIER)
                .setAppIdentifier(getAppIdentifier())
                .setSessionIdentifier(getSessionIdentifier())
                .build();
    }

    private RequestExecutor buildRequestExecutor() {
        return RequestExecutor.of(getHttpClient())
                .withExecutor(getExecutor())
                .withMaxRetries(getMaxRetries());
    }

    @AutoValue.Builder
    public abstract static class Builder {
        public abstract Builder setMaxRetries(int value);
        public abstract Builder setAppIdentifier(String value);
        public abstract Builder setSessionIdentifier(String value);
        abstract Builder setHttpClient(OkHttpClient value);
        abstract Builder setExecutor(Executor value);

        abstract ConnectorServiceV1 autoBuild();

        public ConnectorServiceV1 build() {
            ConnectorServiceV1 service = autoBuild();
            Preconditions.checkState(service.getMaxRetries() <= ConnectorConstants.MAX_MAX_RETRIES
                            && service.getMaxRetries() >= ConnectorConstants.MIN_MAX_RETRIES,
                    "Max retries out of range. Must be between "
                            + ConnectorConstants.MIN_MAX_RETRIES + " and " + ConnectorConstants.MAX_MAX_RETRIES);
            Preconditions.checkState(service.getAppIdentifier().length() < 40
                    , "App identifier out of range. Length must be < 40.");
            Preconditions.checkState(service.getSessionIdentifier().length() < 40
                    , "Session identifier out of range. Length must be < 40.");
            return service;
        }
    }

    /**
     * Base class for read and write requests.
     */
    abstract static class ConnectorBase {
        final Logger LOG = LoggerFactory.getLogger(this.getClass());

        abstract PostJsonRequestProvider getRequestProvider();
        abstract RequestExecutor getRequestExecutor();

        CompletableFuture<ResponseItems> executeAsync(RequestParameters items) throws Exception {
            Preconditions.checkNotNull(items, "Input cannot be null.");
            return getRequestExecutor().executeRequestAsync(getRequestProvider()
                    .withRequestParameters(items)
                    .buildRequest());
        }
    }

    /**
     * Executes item-based read requests, for example retrieving items by id.
     */
    @AutoValue
    public abstract static class ItemReader extends ConnectorBase {

        static Builder builder() {
            return new AutoValue_ConnectorServiceV1_ItemReader.Builder();
        }

        /**
         * Executes an item-based read request. Blocks until the response is ready.
         *
         * @param items the request parameters.
         * @return the response.
         * @throws Exception if the request cannot be built or executed.
         */
        public ResponseItems getItems(RequestParameters items) throws Exception {
            return getItemsAsync(items).join();
        }

        public CompletableFuture<ResponseItems> getItemsAsync(RequestParameters items) throws Exception {
            return executeAsync(items);
        }

        @AutoValue.Builder
        abstract static class Builder {
            abstract Builder setRequestProvider(PostJsonRequestProvider value);
            abstract Builder setRequestExecutor(RequestExecutor value);

            abstract ItemReader build();
        }
    }

    /**
     * Executes item-based write requests, for example create and update.
     */
    @AutoValue
    public abstract static class ItemWriter extends ConnectorBase {

        static Builder builder() {
            return new AutoValue_ConnectorServiceV1_ItemWriter.Builder();
        }

        /**
         * Executes an item-based write request.
         *
         * This method will block until the response is ready. The async version of this method is
         * {@code writeItemsAsync}.
         *
         * @param items the request parameters.
         * @return the response.
         * @throws Exception if the request cannot be built or executed.
         */
        public ResponseItems writeItems(RequestParameters items) throws Exception {
            return writeItemsAsync(items).join();
        }

        public CompletableFuture<ResponseItems> writeItemsAsync(RequestParameters items) throws Exception {
            return executeAsync(items);
        }

        @AutoValue.Builder
        abstract static class Builder {
            abstract Builder setRequestProvider(PostJsonRequestProvider value);
            abstract Builder setRequestExecutor(RequestExecutor value);

            abstract ItemWriter build();
        }
    }
}
