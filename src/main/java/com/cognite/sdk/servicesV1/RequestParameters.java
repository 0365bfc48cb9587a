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

import com.cognite.sdk.config.ProjectConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.io.Serializable;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * This class represents the request parameters of a Cognite api request.
 *
 * The parameters mirror the api's Json request body, with {@code Map<String, Object>} as the Json container
 * and {@code List} as the Json array. Item-based requests carry their items in the root {@code items} node.
 */
@AutoValue
public abstract class RequestParameters implements Serializable {
    private static final String ITEMS_KEY = "items";
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static Builder builder() {
        return new AutoValue_RequestParameters.Builder()
                .setRequestParameters(ImmutableMap.of())
                .setProjectConfig(ProjectConfig.create());
    }

    public static RequestParameters create() {
        return RequestParameters.builder().build();
    }

    /**
     * Returns the object representation of the composite request body.
     *
     * @return the request body parameters
     */
    public abstract ImmutableMap<String, Object> getRequestParameters();

    /**
     * Returns the project configuration for a request: host, project and credentials.
     *
     * @return the project config
     */
    public abstract ProjectConfig getProjectConfig();

    abstract Builder toBuilder();

    /**
     * Adds a root-level parameter. An existing parameter with the same key is replaced.
     *
     * @param key the parameter name
     * @param value the parameter value
     * @return the {@link RequestParameters} with the parameter set
     */
    public RequestParameters withRootParameter(String key, Object value) {
        checkArgument(null != key && !key.isEmpty(), "Key cannot be null or empty.");
        checkNotNull(value, "Value cannot be null.");
        Map<String, Object> temp = new HashMap<>(getRequestParameters());
        temp.put(key, value);
        return toBuilder().setRequestParameters(ImmutableMap.copyOf(temp)).build();
    }

    /**
     * Sets the request items. Existing items are replaced.
     *
     * @param items the items to include in the request
     * @return the {@link RequestParameters} with the items set
     */
    public RequestParameters withItems(List<? extends Map<String, Object>> items) {
        checkNotNull(items, "Items cannot be null.");
        return withRootParameter(ITEMS_KEY, ImmutableList.copyOf(items));
    }

    public RequestParameters withProjectConfig(ProjectConfig config) {
        checkNotNull(config, "Project config cannot be null.");
        return toBuilder().setProjectConfig(config).build();
    }

    /**
     * Returns the request body as a Json string.
     *
     * @return the Json request body
     * @throws JsonProcessingException if the parameters cannot be serialized
     */
    public String getRequestParametersAsJson() throws JsonProcessingException {
        return objectMapper.writeValueAsString(getRequestParameters());
    }

    @AutoValue.Builder
    abstract static class Builder {
        abstract Builder setRequestParameters(ImmutableMap<String, Object> value);
        abstract Builder setProjectConfig(ProjectConfig value);

        abstract RequestParameters build();
    }
}
