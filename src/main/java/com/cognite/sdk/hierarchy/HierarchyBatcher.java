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
import com.google.common.collect.Lists;
import org.apache.commons.lang3.RandomStringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Sorts a collection of assets into batches for writing to CDF.
 *
 * Assets need to be written in a certain order to comply with the hierarchy constraints of CDF. In short, if an asset
 * references a parent, then that parent must exist in CDF before the asset is written. Hence, a collection of
 * assets must be written in topological order.
 *
 * The sort is a layered (breadth-first) traversal from the roots:
 * layer 0 holds the roots, layer k + 1 holds the children of the assets in layer k. Each layer is ordered by
 * input position and split into batches of at most {@code maxBatchSize} assets.
 */
public final class HierarchyBatcher {
    private static final Logger LOG = LoggerFactory.getLogger(HierarchyBatcher.class);

    private final int maxBatchSize;

    private HierarchyBatcher(int maxBatchSize) {
        this.maxBatchSize = maxBatchSize;
    }

    public static HierarchyBatcher of(int maxBatchSize) {
        Preconditions.checkArgument(maxBatchSize > 0, "Max batch size must be at least 1.");
        return new HierarchyBatcher(maxBatchSize);
    }

    /**
     * Sorts the assets of a graph into batches. Only the winning occurrence of each {@code externalId} is included.
     *
     * @param graph the hierarchy graph. Must not contain cycles.
     * @return the batches, in write order.
     * @throws IllegalStateException if the graph contains a cycle.
     */
    public List<HierarchyBatch> batch(HierarchyGraph graph) {
        final String batchLogPrefix = "Batch: " + RandomStringUtils.randomAlphanumeric(6) + " - ";
        final Instant startInstant = Instant.now();
        Preconditions.checkNotNull(graph, "Graph cannot be null.");
        Comparator<String> inputOrder = Comparator.comparingInt(graph::getPosition);

        List<HierarchyBatch> batches = new ArrayList<>();
        List<String> layer = new ArrayList<>(graph.getRoots());
        int depth = 0;
        int noSorted = 0;
        while (!layer.isEmpty()) {
            layer.sort(inputOrder);
            List<Asset> layerAssets = new ArrayList<>(layer.size());
            List<String> nextLayer = new ArrayList<>();
            for (String externalId : layer) {
                layerAssets.add(graph.getAsset(externalId));
                nextLayer.addAll(graph.getChildren(externalId));
            }
            for (List<Asset> chunk : Lists.partition(layerAssets, maxBatchSize)) {
                batches.add(HierarchyBatch.of(depth, chunk));
            }
            LOG.debug(batchLogPrefix + "Sorted layer {} with {} assets.", depth, layerAssets.size());
            noSorted += layerAssets.size();
            layer = nextLayer;
            depth++;
        }

        // Assets on, or below, a cycle are never reached from a root.
        if (noSorted != graph.size()) {
            String message = batchLogPrefix + "Circular reference detected when sorting assets. "
                    + (graph.size() - noSorted) + " assets cannot be ordered.";
            LOG.error(message);
            throw new IllegalStateException(message);
        }

        LOG.info(batchLogPrefix + "Sorted {} assets into {} batches over {} layers. Duration: {}",
                noSorted,
                batches.size(),
                depth,
                Duration.between(startInstant, Instant.now()));
        return batches;
    }
}
