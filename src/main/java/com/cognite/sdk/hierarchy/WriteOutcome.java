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
import com.google.common.base.Preconditions;

import javax.annotation.Nullable;

/**
 * The outcome of writing a single asset, as reported by a {@link HierarchyWriter}.
 */
@AutoValue
public abstract class WriteOutcome {

    public enum Kind {
        /** The asset was written. The result carries the asset as returned by CDF. */
        SUCCESS,
        /** The api rejected the asset. It was not written. */
        CLIENT_ERROR,
        /** The api rejected the asset because it already exists. It was not written. */
        DUPLICATED,
        /** Server error, timeout or I/O error. The asset may or may not have been written. */
        SERVER_ERROR
    }

    public static WriteOutcome success(String externalId, Asset result) {
        Preconditions.checkNotNull(result, "Result cannot be null.");
        return new AutoValue_WriteOutcome(externalId, Kind.SUCCESS, result, null);
    }

    public static WriteOutcome clientError(String externalId, String message) {
        return new AutoValue_WriteOutcome(externalId, Kind.CLIENT_ERROR, null, message);
    }

    public static WriteOutcome duplicated(String externalId) {
        return new AutoValue_WriteOutcome(externalId, Kind.DUPLICATED, null, "The asset already exists.");
    }

    public static WriteOutcome serverError(String externalId, String message) {
        return new AutoValue_WriteOutcome(externalId, Kind.SERVER_ERROR, null, message);
    }

    public abstract String getExternalId();
    public abstract Kind getKind();
    @Nullable
    public abstract Asset getResult();
    @Nullable
    public abstract String getMessage();

    public boolean isSuccess() {
        return getKind() == Kind.SUCCESS;
    }
}
