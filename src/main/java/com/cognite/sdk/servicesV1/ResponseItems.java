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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

import java.io.IOException;

/**
 * The response of a Cognite api request: the http status code and the response body.
 *
 * Helper methods extract the main results items and the error details the api reports.
 */
@AutoValue
public abstract class ResponseItems {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static ResponseItems of(int responseCode, String responseBody, boolean retriedAfterAmbiguousError) {
        return new AutoValue_ResponseItems(responseCode,
                null == responseBody ? "" : responseBody,
                retriedAfterAmbiguousError);
    }

    public abstract int getResponseCode();
    abstract String getResponseBody();

    /**
     * Returns {@code true} if an earlier attempt of the same request failed in a way that leaves its effect unknown
     * (server error, gateway error, timeout). The request may already have been applied by that attempt.
     *
     * @return whether the response follows an ambiguous attempt
     */
    public abstract boolean isRetriedAfterAmbiguousError();

    public boolean isSuccessful() {
        return getResponseCode() >= 200 && getResponseCode() < 300;
    }

    public boolean isClientError() {
        return getResponseCode() >= 400 && getResponseCode() < 500
                && !ConnectorConstants.RETRYABLE_RESPONSE_CODES.contains(getResponseCode());
    }

    /**
     * Returns the main results items, each as a Json string.
     *
     * @return the items of the {@code items} node.
     * @throws IOException if the body is not valid Json
     */
    public ImmutableList<String> getResultsItems() throws IOException {
        return extractNodes(objectMapper.readTree(getResponseBody()).path("items"));
    }

    /**
     * Returns the items listed under {@code error.duplicated}, each as a Json string.
     *
     * @return the duplicated items reported by the api.
     * @throws IOException if the body is not valid Json
     */
    public ImmutableList<String> getDuplicateItems() throws IOException {
        return extractErrorItems("duplicated");
    }

    /**
     * Returns the api error message, or the raw response body if the body does not carry an error message.
     *
     * @return the error message
     */
    public String getErrorMessage() {
        try {
            JsonNode message = objectMapper.readTree(getResponseBody()).path("error").path("message");
            if (message.isTextual()) {
                return message.textValue();
            }
        } catch (IOException e) {
            // not a Json error body
        }
        return getResponseBody();
    }

    private ImmutableList<String> extractErrorItems(String errorSubPath) throws IOException {
        if (getResponseBody().isEmpty()) {
            return ImmutableList.of();
        }
        return extractNodes(objectMapper.readTree(getResponseBody()).path("error").path(errorSubPath));
    }

    private ImmutableList<String> extractNodes(JsonNode arrayNode) throws IOException {
        ImmutableList.Builder<String> builder = ImmutableList.builder();
        if (arrayNode.isArray()) {
            for (JsonNode node : arrayNode) {
                builder.add(objectMapper.writeValueAsString(node));
            }
        }
        return builder.build();
    }
}
