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

package com.cognite.sdk;

import com.cognite.sdk.config.ClientConfig;
import com.cognite.sdk.config.ProjectConfig;
import com.cognite.sdk.servicesV1.ConnectorServiceV1;
import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ForkJoinPool;

/**
 * This class represents the main entry point for interacting with this SDK (and Cognite Data Fusion).
 *
 * All services are exposed via this object. The client is immutable: the {@code withX} methods return a new
 * client with the setting applied. Clients with the same {@link ClientConfig#getNoWorkers()} share a worker pool.
 */
@AutoValue
public abstract class CogniteClient {
    private final static String DEFAULT_BASE_URL = "https://api.cognitedata.com";
    private final static String API_ENV_VAR = "COGNITE_API_KEY";
    private final static String PROJECT_ENV_VAR = "COGNITE_PROJECT";
    private final static String BASE_URL_ENV_VAR = "COGNITE_BASE_URL";

    // One pool per worker count. The pool threads are daemon threads, so the pools live as long as the JVM.
    private static final ConcurrentMap<Integer, ForkJoinPool> executorServices = new ConcurrentHashMap<>();

    protected final Logger LOG = LoggerFactory.getLogger(this.getClass());

    private static Builder builder() {
        return new AutoValue_CogniteClient.Builder()
                .setClientConfig(ClientConfig.create())
                .setBaseUrl(DEFAULT_BASE_URL);
    }

    /**
     * Returns a {@link CogniteClient} using an API key from the system's environment
     * variables (COGNITE_API_KEY) and using default settings. The project (COGNITE_PROJECT) and
     * base URL (COGNITE_BASE_URL) are also picked up from the environment when set.
     *
     * @return the client object.
     * @throws Exception if the api key cannot be read from the system environment.
     */
    public static CogniteClient create() throws Exception {
        String apiKey = System.getenv(API_ENV_VAR);
        if (null == apiKey) {
            String errorMessage = "The environment variable " + API_ENV_VAR + " is not set. Either provide "
                    + "an api key directly to the client or set it via " + API_ENV_VAR;
            throw new Exception(errorMessage);
        }

        CogniteClient client = CogniteClient.ofKey(apiKey);
        if (null != System.getenv(PROJECT_ENV_VAR)) {
            client = client.withProject(System.getenv(PROJECT_ENV_VAR));
        }
        if (null != System.getenv(BASE_URL_ENV_VAR)) {
            client = client.withBaseUrl(System.getenv(BASE_URL_ENV_VAR));
        }
        return client;
    }

    public static CogniteClient ofKey(String apiKey) {
        Preconditions.checkArgument(null != apiKey && !apiKey.isEmpty(),
                "The api key cannot be empty.");
        return CogniteClient.builder()
                .setApiKey(apiKey)
                .build();
    }

    protected abstract Builder toBuilder();
    protected abstract String getApiKey();
    @Nullable
    public abstract String getProject();
    public abstract String getBaseUrl();
    public abstract ClientConfig getClientConfig();

    /**
     * Returns a {@link CogniteClient} using the specified api key.
     *
     * @param key The api key to use for interacting with Cognite Data Fusion.
     * @return the client object with the api key set.
     */
    public CogniteClient withApiKey(String key) {
        Preconditions.checkArgument(null != key && !key.isEmpty(),
                "The api key cannot be empty.");
        return toBuilder().setApiKey(key).build();
    }

    /**
     * Returns a {@link CogniteClient} using the specified Cognite Data Fusion project / tenant.
     *
     * @param project The project / tenant to use for interacting with Cognite Data Fusion.
     * @return the client object with the project / tenant key set.
     */
    public CogniteClient withProject(String project) {
        Preconditions.checkArgument(null != project && !project.isEmpty(),
                "The project cannot be empty.");
        return toBuilder().setProject(project).build();
    }

    /**
     * Returns a {@link CogniteClient} using the specified base URL for issuing API requests.
     *
     * The base URL must follow the format {@code https://<my-host>.cognitedata.com}. The default
     * base URL is {@code https://api.cognitedata.com}
     *
     * @param baseUrl The CDF api base URL
     * @return the client object with the base URL set.
     */
    public CogniteClient withBaseUrl(String baseUrl) {
        Preconditions.checkArgument(null != baseUrl && !baseUrl.isEmpty(),
                "The base URL cannot be empty.");
        return toBuilder().setBaseUrl(baseUrl).build();
    }

    /**
     * Returns a {@link CogniteClient} using the specified configuration settings.
     *
     * @param config The {@link ClientConfig} hosting the client configuration setting.
     * @return the client object with the config applied.
     */
    public CogniteClient withClientConfig(ClientConfig config) {
        Preconditions.checkNotNull(config, "The client config cannot be null.");
        LOG.info("Setting up client with {} worker threads and max {} assets per hierarchy batch.",
                config.getNoWorkers(),
                config.getMaxHierarchyBatchSize());
        return toBuilder().setClientConfig(config).build();
    }

    /**
     * Returns {@link Assets} representing the Cognite assets api endpoint.
     *
     * @return The assets api object.
     */
    public Assets assets() {
        return Assets.of(this);
    }

    /**
     * Returns the worker pool for parallel api requests. The pool is shared by all clients with the same number
     * of workers.
     */
    protected ForkJoinPool getExecutorService() {
        return executorServices.computeIfAbsent(getClientConfig().getNoWorkers(), ForkJoinPool::new);
    }

    /**
     * Returns the services layer mirroring the Cognite Data Fusion API.
     */
    @Memoized
    protected ConnectorServiceV1 getConnectorService() {
        return ConnectorServiceV1.create(getClientConfig().getMaxRetries(),
                        getClientConfig().getAppIdentifier(),
                        getClientConfig().getSessionIdentifier())
                .withExecutor(getExecutorService());
    }

    /**
     * Returns a auth info for api requests
     *
     * @return project config with auth info populated
     * @throws Exception if the project is not configured
     */
    protected ProjectConfig buildProjectConfig() throws Exception {
        if (null == getProject()) {
            String message = "The CDF project is not configured. Set it via withProject() or "
                    + PROJECT_ENV_VAR + ".";
            LOG.error(message);
            throw new Exception(message);
        }

        return ProjectConfig.create()
                .withHost(getBaseUrl())
                .withApiKey(getApiKey())
                .withProject(getProject());
    }

    @AutoValue.Builder
    abstract static class Builder {
        abstract Builder setApiKey(String value);
        abstract Builder setProject(String value);
        abstract Builder setBaseUrl(String value);
        abstract Builder setClientConfig(ClientConfig value);

        abstract CogniteClient build();
    }
}
