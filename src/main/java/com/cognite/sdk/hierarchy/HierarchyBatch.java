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

import java.util.List;

/**
 * A group of assets that can be written in a single request.
 *
 * All parents of the assets in a batch are either in a batch with a lower depth or outside the input.
 * Batches with the same depth do not depend on each other.
 */
@AutoValue
public abstract class HierarchyBatch {

    static HierarchyBatch of(int depth, List<Asset> assets) {
        return new AutoValue_HierarchyBatch(depth, ImmutableList.copyOf(assets));
    }

    /**
     * The distance from the roots: 0 for roots, 1 for their children and so on.
     */
    public abstract int getDepth();
    public abstract ImmutableList<Asset> getAssets();

    public int size() {
        return getAssets().size();
    }
}
