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

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Writes batches of assets to CDF and reports a {@link WriteOutcome} per asset.
 *
 * Implementations own the transport concerns: request building, retries of transient errors and response
 * parsing. They must report an outcome for every asset they receive, keyed by {@code externalId}. An asset
 * without a reported outcome is treated as {@link WriteOutcome.Kind#SERVER_ERROR}.
 */
public interface HierarchyWriter {

    /**
     * Creates a batch of new assets.
     *
     * @param assets the assets to create. All parents exist in CDF.
     * @return one outcome per asset.
     * @throws Exception if the batch could not be submitted. All assets in the batch are then treated as
     *                   {@link WriteOutcome.Kind#SERVER_ERROR}.
     */
    List<WriteOutcome> create(List<Asset> assets) throws Exception;

    /**
     * Updates a batch of existing assets.
     *
     * @param assets the assets to update, identified by {@code id} or {@code externalId}.
     * @return one outcome per asset.
     * @throws Exception if the batch could not be submitted.
     */
    List<WriteOutcome> update(List<Asset> assets) throws Exception;

    /**
     * Looks up which of the given {@code externalId}s exist in CDF.
     *
     * @param externalIds the {@code externalId}s to look up.
     * @return the {@code externalId}s that exist.
     * @throws Exception if the lookup fails.
     */
    Set<String> retrieveExisting(Collection<String> externalIds) throws Exception;
}
