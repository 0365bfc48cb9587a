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

package com.cognite.sdk.servicesV1.request;

import com.cognite.sdk.servicesV1.ConnectorConstants;
import com.cognite.sdk.servicesV1.RequestParameters;
import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.io.IOException;
import java.io.Serializable;
import java.net.URI;
import java.net.URISyntaxException;

/**
 * Builds a POST request with the request parameters as the Json body.
 */
@AutoValue
public abstract class PostJsonRequestProvider implements Serializable {
    protected static final String apiVersion = "v1";
    private static final MediaType JSON = MediaType.get("application/json");

    public static Builder builder() {
        return new AutoValue_PostJsonRequestProvider.Builder()
                .setRequestParameters(RequestParameters.create())
                .setSdkIdentifier(ConnectorConstants.SDK_IDENTIFIER)
                .setAppIdentifier(ConnectorConstants.DEFAULT_APP_IDENTIFIER)
                .setSessionIdentifier(ConnectorConstants.DEFAULT_SESSION_IDENTIFIER);
    }

    public abstract String getSdkIdentifier();
    public abstract String getAppIdentifier();
    public abstract String getSessionIdentifier();
    public abstract String getEndpoint();
    public abstract RequestParameters getRequestParameters();

    abstract Builder toBuilder();

    public PostJsonRequestProvider withRequestParameters(RequestParameters parameters) {
        Preconditions.checkNotNull(parameters, "Request parameters cannot be null.");
        return toBuilder().setRequestParameters(parameters).build();
    }

    public Request buildRequest() throws IOException, URISyntaxException {
        Preconditions.checkState(this.getAppIdentifier().length() < 40
                , "App identifier out of range. Length must be < 40.");
        Preconditions.checkState(this.getSdkIdentifier().length() < 40
                , "SDK identifier out of range. Length must be < 40.");
        Preconditions.checkState(this.getSessionIdentifier().length() < 40
                , "Session identifier out of range. Length must be < 40.");
        getRequestParameters().getProjectConfig().validate();

        String outputJson = getRequestParameters().getRequestParametersAsJson();
        return new Request.Builder()
                .header("Accept", "application/json")
                .header("api-key", getRequestParameters().getProjectConfig().getApiKey())
                .header("x-cdp-sdk", getSdkIdentifier())
                .header("x-cdp-app", getAppIdentifier())
                .header("x-cdp-clienttag", getSessionIdentifier())
                .url(buildUrl())
                .post(RequestBody.create(outputJson, JSON))
                .build();
    }

    private HttpUrl buildUrl() throws URISyntaxException {
        URI uri = new URI(getRequestParameters().getProjectConfig().getHost());
        HttpUrl.Builder urlBuilder = new HttpUrl.Builder()
                .scheme(uri.getScheme())
                .host(uri.getHost());
        if (uri.getPort() != -1) {
            urlBuilder.port(uri.getPort());
        }

        return urlBuilder
                .addPathSegment("api")
                .addPathSegment(apiVersion)
                .addPathSegment("projects")
                .addPathSegment(getRequestParameters().getProjectConfig().getProject())
                .addPathSegments(getEndpoint())
                .build();
    }

    @AutoValue.Builder
    public abstract static class Builder {
        public abstract Builder setSdkIdentifier(String value);
        public abstract Builder setAppIdentifier(String value);
        public abstract Builder setSessionIdentifier(String value);
        public abstract Builder setEndpoint(String value);
        public abstract Builder setRequestParameters(RequestParameters value);

        public abstract PostJsonRequestProvider build();
    }
}
