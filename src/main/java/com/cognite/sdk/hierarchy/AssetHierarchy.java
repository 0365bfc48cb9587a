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
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A collection of assets that should form one or more hierarchies.
 *
 * The hierarchy checks the structural constraints CDF puts on asset writes before anything is sent to the api:
 * every asset needs an {@code externalId} and a {@code name}, {@code externalId}s must be unique,
 * parent references must resolve and the parent references cannot form cycles. See {@link ValidationReport}
 * for the categories.
 *
 * A {@code parentExternalId} that is not part of the input is assumed to reference an asset in CDF. Until that
 * is confirmed via {@link #withExistingParents(Collection)}, the referencing asset is reported as an orphan.
 * Use {@link #ignoreOrphans(boolean)} to skip the orphan check altogether.
 *
 * The hierarchy is immutable; {@link #validate()} returns the same report every time it is called.
 */
@AutoValue
public abstract class AssetHierarchy {
    private static final Logger LOG = LoggerFactory.getLogger(AssetHierarchy.class);

    private static Builder builder() {
        return new AutoValue_AssetHierarchy.Builder()
                .setIgnoreOrphans(false)
                .setExistingParentExternalIds(ImmutableSet.of());
    }

    /**
     * Creates a hierarchy from a collection of assets. The input order is kept and used as the tie-breaker
     * when ordering the assets for writing.
     *
     * @param assets the assets.
     * @return the asset hierarchy.
     */
    public static AssetHierarchy of(Collection<Asset> assets) {
        Preconditions.checkNotNull(assets, "Assets cannot be null.");
        return AssetHierarchy.builder()
                .setAssets(ImmutableList.copyOf(assets))
                .build();
    }

    public abstract ImmutableList<Asset> getAssets();
    public abstract boolean isIgnoreOrphans();
    public abstract ImmutableSet<String> getExistingParentExternalIds();

    abstract Builder toBuilder();

    /**
     * Skips the orphan check. Parent references outside the input are then assumed to exist in CDF.
     *
     * @param ignore set to {@code true} to skip the orphan check.
     * @return the asset hierarchy with the setting applied.
     */
    public AssetHierarchy ignoreOrphans(boolean ignore) {
        return toBuilder().setIgnoreOrphans(ignore).build();
    }

    /**
     * Registers {@code externalId}s that are confirmed to exist in CDF. Assets referencing one of these
     * as parent are not orphans.
     *
     * @param externalIds the {@code externalId}s of existing assets.
     * @return the asset hierarchy with the existing parents registered.
     */
    public AssetHierarchy withExistingParents(Collection<String> externalIds) {
        Preconditions.checkNotNull(externalIds, "ExternalIds cannot be null.");
        return toBuilder()
                .setExistingParentExternalIds(ImmutableSet.<String>builder()
                        .addAll(getExistingParentExternalIds())
                        .addAll(externalIds)
                        .build())
                .build();
    }

    @Memoized
    public HierarchyGraph getGraph() {
        return HierarchyGraph.of(getAssets());
    }

    /**
     * Validates the hierarchy.
     *
     * @return the validation report.
     */
    public ValidationReport validate() {
        HierarchyGraph graph = getGraph();
        ImmutableSet<String> cycles = graph.findCycleMembers();
        ImmutableSet<String> duplicates = graph.getDuplicateExternalIds();
        Set<String> ambiguous = findAmbiguousExternalIds(graph, duplicates);

        List<Asset> invalid = new ArrayList<>();
        List<Asset> orphans = new ArrayList<>();
        List<Asset> unsureParents = new ArrayList<>();
        for (Asset asset : getAssets()) {
            if (!asset.hasExternalId() || !asset.hasName()) {
                invalid.add(asset);
            }
            if (asset.hasExternalId() && cycles.contains(asset.getExternalId())) {
                // Parent resolution is meaningless inside a cycle
                continue;
            }
            if (asset.hasParentExternalId()
                    && !graph.contains(asset.getParentExternalId())
                    && !isIgnoreOrphans()
                    && !getExistingParentExternalIds().contains(asset.getParentExternalId())) {
                orphans.add(asset);
            }
            boolean parentIsAmbiguous = asset.hasParentExternalId()
                    && ambiguous.contains(asset.getParentExternalId());
            boolean selfIsAmbiguous = asset.hasExternalId() && ambiguous.contains(asset.getExternalId());
            if (parentIsAmbiguous || selfIsAmbiguous) {
                unsureParents.add(asset);
            }
        }

        ValidationReport report = ValidationReport.builder()
                .setInvalid(invalid)
                .setOrphans(orphans)
                .setUnsureParents(unsureParents)
                .setDuplicates(duplicates)
                .setCycles(cycles)
                .build();
        LOG.debug("Validated {} assets: {}", getAssets().size(), report.summary());
        return report;
    }

    /**
     * Validates the hierarchy and throws an exception if it is not valid.
     *
     * @throws InvalidAssetHierarchyException if the hierarchy is not valid.
     */
    public void validateAndRaise() throws InvalidAssetHierarchyException {
        ValidationReport report = validate();
        if (!report.isValid()) {
            LOG.error(report.describe());
            throw new InvalidAssetHierarchyException(report);
        }
    }

    /**
     * Returns the {@code parentExternalId}s that are referenced by the input but not part of it. These
     * are expected to exist in CDF.
     *
     * @return the parent references outside the input, in input order.
     */
    public ImmutableSet<String> getExternalParentReferences() {
        Set<String> references = new LinkedHashSet<>();
        for (Asset asset : getAssets()) {
            if (asset.hasParentExternalId() && !getGraph().contains(asset.getParentExternalId())) {
                references.add(asset.getParentExternalId());
            }
        }
        return ImmutableSet.copyOf(references);
    }

    /**
     * Groups the assets by their {@code parentExternalId}. Assets without a {@code parentExternalId} are
     * left out.
     *
     * @return the assets per parent, in input order.
     */
    public ImmutableListMultimap<String, Asset> groupByParentExternalId() {
        ImmutableListMultimap.Builder<String, Asset> builder = ImmutableListMultimap.builder();
        for (Asset asset : getAssets()) {
            if (asset.hasParentExternalId()) {
                builder.put(asset.getParentExternalId(), asset);
            }
        }
        return builder.build();
    }

    /**
     * Counts the number of descendants of an asset in the input.
     *
     * @param externalId the {@code externalId} of the subtree root.
     * @return the number of descendants, not including the asset itself.
     */
    public int countSubtree(String externalId) {
        return getGraph().countDescendants(externalId);
    }

    /**
     * Orders the hierarchy into batches for writing. The hierarchy must not contain cycles.
     *
     * @param maxBatchSize the max number of assets per batch.
     * @return the batches, parents before children.
     */
    public List<HierarchyBatch> toBatches(int maxBatchSize) {
        return HierarchyBatcher.of(maxBatchSize).batch(getGraph());
    }

    /*
    A duplicated externalId is ambiguous when its occurrences do not agree on the parent reference.
     */
    private static Set<String> findAmbiguousExternalIds(HierarchyGraph graph, Set<String> duplicates) {
        Set<String> ambiguous = new HashSet<>();
        for (String externalId : duplicates) {
            Set<String> parentReferences = new HashSet<>();
            graph.getOccurrences(externalId).forEach(asset -> parentReferences.add(parentReference(asset)));
            if (parentReferences.size() > 1) {
                ambiguous.add(externalId);
            }
        }
        return ambiguous;
    }

    private static String parentReference(Asset asset) {
        if (asset.hasParentExternalId()) {
            return "externalId:" + asset.getParentExternalId();
        } else if (asset.hasParentId()) {
            return "id:" + asset.getParentId();
        }
        return "root";
    }

    @AutoValue.Builder
    abstract static class Builder {
        abstract Builder setAssets(ImmutableList<Asset> value);
        abstract Builder setIgnoreOrphans(boolean value);
        abstract Builder setExistingParentExternalIds(ImmutableSet<String> value);

        abstract AssetHierarchy build();
    }
}
