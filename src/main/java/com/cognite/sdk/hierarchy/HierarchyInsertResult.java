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

package com.cognite.sdk.hierarchy;

import com.cognite.sdk.dto.Asset;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * The outcome of writing an asset hierarchy. Every asset is listed in exactly one of the three categories:
 *
 * - {@code created}: written to CDF. Holds the assets as returned by the api, including their {@code id}.
 * - {@code unknown}: the write was ambiguous (server error, timeout), or an ancestor's write was ambiguous.
 * - {@code failed}: rejected by the api, never sent, or a descendant of a rejected asset.
 */
@AutoValue
public abstract class HierarchyInsertResult {

    static Builder builder() {
        return new AutoValue_HierarchyInsertResult.Builder();
    }

    public abstract ImmutableList<Asset> getCreated();
    public abstract ImmutableList<Asset> getUnknown();
    public abstract ImmutableList<Asset> getFailed();

    /**
     * The error message per {@code externalId}, for the assets where the api reported one.
     */
    public abstract ImmutableMap<String, String> getErrorMessages();

    public boolean isSuccessful() {
        return getUnknown().isEmpty() && getFailed().isEmpty();
    }

    @AutoValue.Builder
    abstract static class Builder {
        abstract ImmutableList.Builder<Asset> createdBuilder();
        abstract ImmutableList.Builder<Asset> unknownBuilder();
        abstract ImmutableList.Builder<Asset> failedBuilder();
        abstract Builder setErrorMessages(Map<String, String> value);

        Builder addCreated(Asset asset) {
            createdBuilder().add(asset);
            return this;
        }

        Builder addUnknown(Asset asset) {
            unknownBuilder().add(asset);
            return this;
        }

        Builder addFailed(Asset asset) {
            failedBuilder().add(asset);
            return this;
        }

        abstract HierarchyInsertResult build();
    }
}
