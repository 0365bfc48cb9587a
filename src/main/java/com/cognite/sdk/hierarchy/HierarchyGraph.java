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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The parent/child structure of a collection of assets, keyed by {@code externalId}.
 *
 * The graph is built in a single pass over the input:
 * - Assets without an {@code externalId} cannot be referenced and are left out of the graph.
 * - If an {@code externalId} occurs more than once, all occurrences are recorded but the last occurrence
 *   wins: its parent reference defines the edge and it is the asset that will be written.
 * - An asset is a root if it has no parent reference, references its parent via (internal) {@code id}, or
 *   references a {@code parentExternalId} that is not in the input (assumed to exist in CDF).
 */
public final class HierarchyGraph {
    private final ImmutableList<Asset> inputAssets;
    private final ImmutableMap<String, Asset> assetsByExternalId;
    private final ImmutableMap<String, Integer> positionByExternalId;
    private final ImmutableListMultimap<String, Asset> occurrences;
    private final ImmutableListMultimap<String, String> children;
    private final ImmutableList<String> roots;
    private final Graph<String, DefaultEdge> graph;

    private HierarchyGraph(List<Asset> assets) {
        inputAssets = ImmutableList.copyOf(assets);

        Map<String, Asset> assetMap = new LinkedHashMap<>();
        Map<String, Integer> positionMap = new LinkedHashMap<>();
        ImmutableListMultimap.Builder<String, Asset> occurrencesBuilder = ImmutableListMultimap.builder();
        for (int i = 0; i < inputAssets.size(); i++) {
            Asset asset = inputAssets.get(i);
            if (!asset.hasExternalId()) {
                continue;
            }
            occurrencesBuilder.put(asset.getExternalId(), asset);
            assetMap.put(asset.getExternalId(), asset);
            positionMap.put(asset.getExternalId(), i);
        }
        occurrences = occurrencesBuilder.build();
        assetsByExternalId = ImmutableMap.copyOf(assetMap);
        positionByExternalId = ImmutableMap.copyOf(positionMap);

        // Edges point from parent to child. Only the winning occurrence of an externalId contributes an edge.
        graph = new DefaultDirectedGraph<>(DefaultEdge.class);
        assetsByExternalId.keySet().forEach(graph::addVertex);
        ImmutableListMultimap.Builder<String, String> childrenBuilder = ImmutableListMultimap.builder();
        ImmutableList.Builder<String> rootsBuilder = ImmutableList.builder();
        for (int i = 0; i < inputAssets.size(); i++) {
            Asset asset = inputAssets.get(i);
            if (!asset.hasExternalId() || positionByExternalId.get(asset.getExternalId()) != i) {
                continue;
            }
            String parent = getParentExternalId(asset);
            if (null != parent) {
                graph.addEdge(parent, asset.getExternalId());
                childrenBuilder.put(parent, asset.getExternalId());
            } else {
                rootsBuilder.add(asset.getExternalId());
            }
        }
        children = childrenBuilder.build();
        roots = rootsBuilder.build();
    }

    /**
     * Builds the graph of a collection of assets.
     *
     * @param assets the assets, in input order.
     * @return the graph.
     */
    public static HierarchyGraph of(List<Asset> assets) {
        Preconditions.checkNotNull(assets, "Assets cannot be null.");
        return new HierarchyGraph(assets);
    }

    /**
     * Returns the input assets, in input order, including duplicates and assets without {@code externalId}.
     */
    public ImmutableList<Asset> getInputAssets() {
        return inputAssets;
    }

    /**
     * Returns the winning (last) occurrence per {@code externalId}, in order of first occurrence.
     */
    public ImmutableMap<String, Asset> getAssetsByExternalId() {
        return assetsByExternalId;
    }

    public boolean contains(String externalId) {
        return assetsByExternalId.containsKey(externalId);
    }

    public Asset getAsset(String externalId) {
        return assetsByExternalId.get(externalId);
    }

    /**
     * The input position of the winning occurrence of an {@code externalId}.
     */
    public int getPosition(String externalId) {
        Preconditions.checkArgument(contains(externalId), "Unknown externalId: %s", externalId);
        return positionByExternalId.get(externalId);
    }

    /**
     * Returns all occurrences of an {@code externalId}, in input order.
     */
    public ImmutableList<Asset> getOccurrences(String externalId) {
        return occurrences.get(externalId);
    }

    public ImmutableSet<String> getDuplicateExternalIds() {
        ImmutableSet.Builder<String> builder = ImmutableSet.builder();
        for (String externalId : occurrences.keySet()) {
            if (occurrences.get(externalId).size() > 1) {
                builder.add(externalId);
            }
        }
        return builder.build();
    }

    /**
     * Returns the children of an asset, in input order.
     */
    public ImmutableList<String> getChildren(String externalId) {
        return children.get(externalId);
    }

    /**
     * Returns the parent-to-children mapping of the assets in the input.
     */
    public ImmutableListMultimap<String, String> getChildren() {
        return children;
    }

    /**
     * Returns the roots, in input order.
     */
    public ImmutableList<String> getRoots() {
        return roots;
    }

    /**
     * Returns the {@code externalId} of the asset's parent if that parent is part of this graph.
     *
     * @param asset the asset.
     * @return the parent's {@code externalId}, or {@code null} if the parent is not in the input.
     */
    @Nullable
    public String getParentExternalId(Asset asset) {
        if (asset.hasParentExternalId() && assetsByExternalId.containsKey(asset.getParentExternalId())) {
            return asset.getParentExternalId();
        }
        return null;
    }

    /**
     * Returns the {@code externalId} of every asset that is part of a parent-reference cycle. An asset
     * referencing itself as its parent is a cycle of length one.
     *
     * Assets that merely descend from a cycle are not members of it.
     *
     * @return the cycle members.
     */
    public ImmutableSet<String> findCycleMembers() {
        return ImmutableSet.copyOf(new CycleDetector<>(graph).findCycles());
    }

    /**
     * Counts the descendants of an asset.
     *
     * @param externalId the asset to count the subtree of.
     * @return the number of descendants, not including the asset itself.
     */
    public int countDescendants(String externalId) {
        Preconditions.checkArgument(contains(externalId), "Unknown externalId: %s", externalId);
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>(getChildren(externalId));
        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (next.equals(externalId) || !visited.add(next)) {
                continue;
            }
            queue.addAll(getChildren(next));
        }
        return visited.size();
    }

    public int size() {
        return assetsByExternalId.size();
    }
}
