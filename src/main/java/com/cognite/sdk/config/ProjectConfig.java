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

import com.google.auto.value.AutoValue;

import javax.annotation.Nullable;
import java.io.Serializable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * The target of an api request: host, project and the credentials to use.
 */
@AutoValue
public abstract class ProjectConfig implements Serializable {
    private final static String DEFAULT_HOST = "https://api.cognitedata.com";

    private static Builder builder() {
        return new AutoValue_ProjectConfig.Builder()
                .setHost(DEFAULT_HOST)
                .setConfigured(false);
    }

    public static ProjectConfig create() {
        return ProjectConfig.builder().build();
    }

    @Nullable public abstract String getProject();
    @Nullable public abstract String getApiKey();
    public abstract String getHost();
    public abstract boolean isConfigured();

    public abstract ProjectConfig.Builder toBuilder();

    public ProjectConfig withHost(String value) {
        return toBuilder().setHost(value).setConfigured(true).build();
    }

    public ProjectConfig withProject(String value) {
        return toBuilder().setProject(value).setConfigured(true).build();
    }

    public ProjectConfig withApiKey(String value) {
        return toBuilder().setApiKey(value).setConfigured(true).build();
    }

    public void validate() {
        checkState(isConfigured(), "ProjectConfig parameters have not been configured.");
        checkArgument(!getHost().isEmpty(), "Could not obtain Cognite host name");
        checkArgument(getProject() != null && !getProject().isEmpty(),
                "Could not obtain Cognite project name");
        checkArgument(getApiKey() != null && !getApiKey().isBlank(),
                "Could not obtain Cognite api key");
    }

    @Override
    public String toString() {
        return "ProjectConfig{host=" + getHost() + ", project=" + getProject() + ", apiKey=*****}";
    }

    @AutoValue.Builder
    public abstract static class Builder {
        public abstract Builder setProject(String value);
        public abstract Builder setApiKey(String value);
        public abstract Builder setHost(String value);
        public abstract Builder setConfigured(boolean value);

        public abstract ProjectConfig build();
    }
}
