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

package com.cognite.sdk.dto;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nullable;
import java.io.Serializable;
import java.util.Map;

/**
 * An asset node in Cognite Data Fusion.
 *
 * An asset is identified by its {@code externalId} (assigned by the client) and, once it exists in CDF, by its
 * {@code id} (assigned by CDF). The parent can be referenced either via {@code parentExternalId} or via
 * {@code parentId}. If both are set, {@code parentExternalId} takes precedence when ordering a hierarchy.
 */
@AutoValue
public abstract class Asset implements Serializable {

    public static Builder newBuilder() {
        return new AutoValue_Asset.Builder()
                .setMetadata(ImmutableMap.of());
    }

    /**
     * The CDF internal id. Set when the asset already exists in CDF.
     */
    @Nullable
    public abstract Long getId();
    @Nullable
    public abstract String getExternalId();
    @Nullable
    public abstract String getName();
    @Nullable
    public abstract String getParentExternalId();
    @Nullable
    public abstract Long getParentId();
    @Nullable
    public abstract String getDescription();
    @Nullable
    public abstract String getSource();
    @Nullable
    public abstract Long getDataSetId();
    public abstract ImmutableMap<String, String> getMetadata();

    public abstract Builder toBuilder();

    public boolean hasId() {
        return null != getId();
    }

    public boolean hasExternalId() {
        return null != getExternalId() && !getExternalId().isEmpty();
    }

    public boolean hasName() {
        return null != getName() && !getName().isEmpty();
    }

    public boolean hasParentExternalId() {
        return null != getParentExternalId() && !getParentExternalId().isEmpty();
    }

    public boolean hasParentId() {
        return null != getParentId();
    }

    public boolean hasDescription() {
        return null != getDescription();
    }

    public boolean hasSource() {
        return null != getSource();
    }

    public boolean hasDataSetId() {
        return null != getDataSetId();
    }

    @AutoValue.Builder
    public abstract static class Builder {
        public abstract Builder setId(Long value);
        public abstract Builder setExternalId(String value);
        public abstract Builder setName(String value);
        public abstract Builder setParentExternalId(String value);
        public abstract Builder setParentId(Long value);
        public abstract Builder setDescription(String value);
        public abstract Builder setSource(String value);
        public abstract Builder setDataSetId(Long value);
        public abstract Builder setMetadata(Map<String, String> value);

        public abstract Asset build();
    }
}
