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

package com.cognite.sdk;

import com.cognite.sdk.dto.Asset;
import com.cognite.sdk.hierarchy.AssetHierarchy;
import com.cognite.sdk.hierarchy.AssetHierarchyInsertException;
import com.cognite.sdk.hierarchy.HierarchyBatch;
import com.cognite.sdk.hierarchy.HierarchyInsertResult;
import com.cognite.sdk.hierarchy.HierarchyInserter;
import com.cognite.sdk.hierarchy.HierarchyWriter;
import com.cognite.sdk.hierarchy.InvalidAssetHierarchyException;
import com.cognite.sdk.hierarchy.ValidationReport;
import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * This class represents the Cognite assets api endpoint.
 *
 * It provides methods for validating and writing asset hierarchies.
 */
@AutoValue
public abstract class Assets {
    protected static final Logger LOG = LoggerFactory.getLogger(Assets.class);

    private static Builder builder() {
        return new AutoValue_Assets.Builder();
    }

    /**
     * Constructs a new {@link Assets} object using the provided client configuration.
     *
     * This method is intended for internal use--SDK clients should always use {@link CogniteClient}
     * as the entry point to this class.
     *
     * @param client The {@link CogniteClient} to use for configuration settings.
     * @return the assets api object.
     */
    public static Assets of(CogniteClient client) {
        Preconditions.checkNotNull(client, "Client cannot be null.");
        return Assets.builder()
                .setClient(client)
                .build();
    }

    abstract CogniteClient getClient();

    /**
     * Validates a collection of assets as a hierarchy.
     *
     * Parent references outside the input are looked up in CDF. Assets referencing a parent that exists in CDF
     * are not reported as orphans. The lookup is done whenever the input has orphans, so the report covers all
     * categories.
     *
     * @param assets the assets to validate.
     * @return the validation report.
     * @throws Exception if the lookup of external parents fails.
     */
    public ValidationReport validateHierarchy(List<Asset> assets) throws Exception {
        return resolveExternalParents(AssetHierarchy.of(assets), false).validate();
    }

    /**
     * Writes a collection of assets as a hierarchy. See {@link #createHierarchy(AssetHierarchy, boolean)}.
     *
     * @param assets the assets to write.
     * @return the created assets.
     * @throws Exception if the hierarchy is invalid or if one or more assets could not be written.
     */
    public List<Asset> createHierarchy(List<Asset> assets) throws Exception {
        return createHierarchy(AssetHierarchy.of(assets), false);
    }

    /**
     * Writes a collection of assets as a hierarchy. See {@link #createHierarchy(AssetHierarchy, boolean)}.
     *
     * @param assets the assets to write.
     * @param upsert set to {@code true} to update assets that already exist.
     * @return the created and updated assets.
     * @throws Exception if the hierarchy is invalid or if one or more assets could not be written.
     */
    public List<Asset> createHierarchy(List<Asset> assets, boolean upsert) throws Exception {
        return createHierarchy(AssetHierarchy.of(assets), upsert);
    }

    /**
     * Writes an asset hierarchy to CDF.
     *
     * The hierarchy is validated before anything is written. Parents referenced by {@code parentExternalId} that
     * are not part of the input must exist in CDF (unless the hierarchy ignores orphans). The assets are then
     * written in topological order, parents before children, in batches of max
     * {@link com.cognite.sdk.config.ClientConfig#getMaxHierarchyBatchSize()} assets.
     *
     * Assets with an {@code id} are updated. When {@code upsert} is enabled, assets that already exist are
     * updated as well, according to the configured {@link com.cognite.sdk.config.UpsertMode}.
     *
     * @param hierarchy the hierarchy to write.
     * @param upsert set to {@code true} to update assets that already exist.
     * @return the created and updated assets, as returned by CDF.
     * @throws InvalidAssetHierarchyException if the hierarchy is invalid. Nothing has been written.
     * @throws AssetHierarchyInsertException if one or more assets could not be written.
     * @throws Exception if the lookup of external parents fails.
     */
    public List<Asset> createHierarchy(AssetHierarchy hierarchy, boolean upsert) throws Exception {
        return createHierarchy(hierarchy, buildHierarchyInserter(upsert));
    }

    /**
     * Writes an asset hierarchy to CDF using the given inserter. Use this method when you need to cancel the
     * insert via {@link HierarchyInserter#cancel()}.
     *
     * @param hierarchy the hierarchy to write.
     * @param inserter the inserter, as returned by {@link #buildHierarchyInserter(boolean)}.
     * @return the created and updated assets, as returned by CDF.
     * @throws InvalidAssetHierarchyException if the hierarchy is invalid. Nothing has been written.
     * @throws AssetHierarchyInsertException if one or more assets could not be written.
     * @throws Exception if the lookup of external parents fails.
     */
    public List<Asset> createHierarchy(AssetHierarchy hierarchy, HierarchyInserter inserter) throws Exception {
        String loggingPrefix = "createHierarchy() - ";
        Instant startInstant = Instant.now();
        Preconditions.checkNotNull(hierarchy, "Hierarchy cannot be null.");
        Preconditions.checkNotNull(inserter, "Inserter cannot be null.");
        if (hierarchy.getAssets().isEmpty()) {
            LOG.warn(loggingPrefix + "No items specified in the request. Will skip the write request.");
            return Collections.emptyList();
        }
        LOG.info(loggingPrefix + "Received {} assets to write.", hierarchy.getAssets().size());

        AssetHierarchy resolved = resolveExternalParents(hierarchy, true);
        resolved.validateAndRaise();

        List<HierarchyBatch> batches = resolved.toBatches(getClient().getClientConfig().getMaxHierarchyBatchSize());
        HierarchyInsertResult result = inserter.insert(resolved.getGraph(), batches);
        if (!result.isSuccessful()) {
            LOG.error(loggingPrefix + "Failed to write the asset hierarchy. {} created, {} unknown, {} failed.",
                    result.getCreated().size(),
                    result.getUnknown().size(),
                    result.getFailed().size());
            throw new AssetHierarchyInsertException(result);
        }

        LOG.info(loggingPrefix + "Completed writing {} assets within a duration of {}.",
                result.getCreated().size(),
                Duration.between(startInstant, Instant.now()).toString());
        return result.getCreated();
    }

    /**
     * Builds an inserter for this client. The inserter writes via the client's connection and worker pool.
     *
     * @param upsert set to {@code true} to update assets that already exist.
     * @return the inserter.
     * @throws Exception if the client's project is not configured.
     */
    public HierarchyInserter buildHierarchyInserter(boolean upsert) throws Exception {
        return HierarchyInserter.of(buildHierarchyWriter(), getClient().getExecutorService())
                .withUpsert(upsert);
    }

    HierarchyWriter buildHierarchyWriter() throws Exception {
        return ConnectorHierarchyWriter.of(getClient().getConnectorService(), getClient().buildProjectConfig())
                .withUpsertMode(getClient().getClientConfig().getUpsertMode());
    }

    /*
    Confirms the parents outside the input via CDF. With skipOnStructuralErrors, the lookup is only done when
    orphans are the sole problem, so that a hierarchy that cannot be written fails without any api call.
     */
    private AssetHierarchy resolveExternalParents(AssetHierarchy hierarchy,
                                                  boolean skipOnStructuralErrors) throws Exception {
        ValidationReport report = hierarchy.validate();
        if (report.getOrphans().isEmpty() || (skipOnStructuralErrors && report.hasStructuralErrors())) {
            return hierarchy;
        }
        Set<String> existing = buildHierarchyWriter().retrieveExisting(hierarchy.getExternalParentReferences());
        LOG.debug("Confirmed {} of {} external parents in CDF.",
                existing.size(),
                hierarchy.getExternalParentReferences().size());
        return hierarchy.withExistingParents(existing);
    }

    @AutoValue.Builder
    abstract static class Builder {
        abstract Builder setClient(CogniteClient value);

        abstract Assets build();
    }
}
