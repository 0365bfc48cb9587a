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

import java.util.List;

/**
 * Thrown when one or more assets of a hierarchy could not be written.
 *
 * Some assets may already have been written. Inspect {@link #getResult()} before retrying: {@code created}
 * assets exist in CDF, {@code failed} assets do not, and the state of {@code unknown} assets must be checked
 * in CDF.
 */
public class AssetHierarchyInsertException extends AssetHierarchyException {
    private final HierarchyInsertResult result;

    public AssetHierarchyInsertException(HierarchyInsertResult result) {
        super(String.format("Failed to write the asset hierarchy: %d created, %d unknown, %d failed.",
                result.getCreated().size(),
                result.getUnknown().size(),
                result.getFailed().size()));
        this.result = result;
    }

    public HierarchyInsertResult getResult() {
        return result;
    }

    public List<Asset> getCreated() {
        return result.getCreated();
    }

    public List<Asset> getUnknown() {
        return result.getUnknown();
    }

    public List<Asset> getFailed() {
        return result.getFailed();
    }
}
