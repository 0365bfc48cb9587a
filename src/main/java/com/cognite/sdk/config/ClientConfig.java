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

package com.cognite.sdk.config;

import com.cognite.sdk.servicesV1.ConnectorConstants;
import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

import java.io.Serializable;

/**
 * Configuration settings for the {@link com.cognite.sdk.CogniteClient}.
 *
 * The configuration is immutable. Use the {@code withX} methods to derive a modified copy and pass it to
 * {@link com.cognite.sdk.CogniteClient#withClientConfig(ClientConfig)}.
 */
@AutoValue
public abstract class ClientConfig implements Serializable {
    private static final int DEFAULT_CPU_MULTIPLIER = 8;
    private static final int DEFAULT_MAX_WORKERS = 64;
    private static final int MAX_HIERARCHY_BATCH_SIZE = 1000;

    private static Builder builder() {
        return new AutoValue_ClientConfig.Builder()
                .setAppIdentifier(ConnectorConstants.DEFAULT_APP_IDENTIFIER)
                .setSessionIdentifier(ConnectorConstants.DEFAULT_SESSION_IDENTIFIER)
                .setMaxRetries(ConnectorConstants.DEFAULT_MAX_RETRIES)
                .setNoWorkers(Math.min(Runtime.getRuntime().availableProcessors() * DEFAULT_CPU_MULTIPLIER,
                        DEFAULT_MAX_WORKERS))
                .setMaxHierarchyBatchSize(MAX_HIERARCHY_BATCH_SIZE)
                .setUpsertMode(UpsertMode.UPDATE);
    }

    public static ClientConfig create() {
        return ClientConfig.builder().build();
    }

    abstract Builder toBuilder();

    public abstract String getAppIdentifier();
    public abstract String getSessionIdentifier();
    public abstract int getMaxRetries();
    public abstract int getNoWorkers();
    public abstract int getMaxHierarchyBatchSize();
    public abstract UpsertMode getUpsertMode();

    /**
     * Set the app identifier. The identifier is encoded in the api calls to the Cognite instance and can be
     * used for tracing and statistics.
     *
     * @param identifier the application identifier
     * @return the {@link ClientConfig} with the setting applied
     */
    public ClientConfig withAppIdentifier(String identifier) {
        Preconditions.checkArgument(null != identifier && !identifier.isEmpty(),
                "Identifier cannot be null or empty.");
        return toBuilder().setAppIdentifier(identifier).build();
    }

    /**
     * Set the session identifier. The identifier is encoded in the api calls to the Cognite instance and can be
     * used for tracing and statistics.
     *
     * @param identifier the session identifier
     * @return the {@link ClientConfig} with the setting applied
     */
    public ClientConfig withSessionIdentifier(String identifier) {
        Preconditions.checkArgument(null != identifier && !identifier.isEmpty(),
                "Identifier cannot be null or empty.");
        return toBuilder().setSessionIdentifier(identifier).build();
    }

    /**
     * Sets the maximum number of attempts per api request. The transport retries requests that fail with a
     * transient error (throttling, unavailable service, I/O). Must be between 1 and 20. Default is 3.
     *
     * @param retries the max number of attempts
     * @return the {@link ClientConfig} with the setting applied
     */
    public ClientConfig withMaxRetries(int retries) {
        return toBuilder().setMaxRetries(retries).build();
    }

    /**
     * Sets the number of worker threads used for parallel api requests.
     *
     * @param noWorkers the number of workers
     * @return the {@link ClientConfig} with the setting applied
     */
    public ClientConfig withNoWorkers(int noWorkers) {
        return toBuilder().setNoWorkers(noWorkers).build();
    }

    /**
     * Sets the max number of assets per write request when writing an asset hierarchy. Must be between
     * 1 and 1000 (the api limit). Default is 1000.
     *
     * @param batchSize the max number of assets per request
     * @return the {@link ClientConfig} with the setting applied
     */
    public ClientConfig withMaxHierarchyBatchSize(int batchSize) {
        return toBuilder().setMaxHierarchyBatchSize(batchSize).build();
    }

    /**
     * Sets the upsert mode.
     *
     * When an asset already exists in CDF, it can be updated in one of two ways: update or replace.
     * {@code UpsertMode.UPDATE} will update the provided fields and leave all other fields unchanged.
     * {@code UpsertMode.REPLACE} will replace the entire target object with the provided fields
     * ({@code id} and {@code externalId} remain unchanged).
     *
     * @param mode the upsert mode
     * @return the {@link ClientConfig} with the setting applied
     */
    public ClientConfig withUpsertMode(UpsertMode mode) {
        Preconditions.checkNotNull(mode, "Upsert mode cannot be null.");
        return toBuilder().setUpsertMode(mode).build();
    }

    @AutoValue.Builder
    abstract static class Builder {
        abstract Builder setAppIdentifier(String value);
        abstract Builder setSessionIdentifier(String value);
        abstract Builder setMaxRetries(int value);
        abstract Builder setNoWorkers(int value);
        abstract Builder setMaxHierarchyBatchSize(int value);
        abstract Builder setUpsertMode(UpsertMode value);

        abstract ClientConfig autoBuild();

        ClientConfig build() {
            ClientConfig config = autoBuild();
            Preconditions.checkState(config.getMaxRetries() <= ConnectorConstants.MAX_MAX_RETRIES
                            && config.getMaxRetries() >= ConnectorConstants.MIN_MAX_RETRIES,
                    "Max retries out of range. Must be between "
                            + ConnectorConstants.MIN_MAX_RETRIES + " and " + ConnectorConstants.MAX_MAX_RETRIES);
            Preconditions.checkState(config.getNoWorkers() > 0,
                    "The number of workers must be at least 1.");
            Preconditions.checkState(config.getMaxHierarchyBatchSize() > 0
                            && config.getMaxHierarchyBatchSize() <= MAX_HIERARCHY_BATCH_SIZE,
                    "Hierarchy batch size out of range. Must be between 1 and " + MAX_HIERARCHY_BATCH_SIZE);
            Preconditions.checkState(config.getAppIdentifier().length() < 40,
                    "App identifier out of range. Length must be < 40.");
            Preconditions.checkState(config.getSessionIdentifier().length() < 40,
                    "Session identifier out of range. Length must be < 40.");
            return config;
        }
    }
}
