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
import org.apache.commons.lang3.RandomStringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Writes batches of assets to CDF in topological order and tracks the outcome per asset.
 *
 * The batches are written strictly in sequence: a batch is started when the outcome of every asset in the previous
 * batch is known. Within a batch, the create and update requests are dispatched in parallel on the executor.
 *
 * Before an asset is submitted, its parent's outcome is checked. If the parent was not written, the asset is
 * skipped: it is reported as {@code failed} if the parent was rejected, and as {@code unknown} if the parent's
 * write was ambiguous. Skipping propagates down the subtree, while independent subtrees continue.
 *
 * This class does not retry. Transient errors are retried by the {@link HierarchyWriter}.
 */
public final class HierarchyInserter {
    private static final Logger LOG = LoggerFactory.getLogger(HierarchyInserter.class);

    /*
    Terminal state per asset. Each state maps to one of the result categories.
     */
    enum Disposition {
        CREATED(Category.CREATED),
        AMBIGUOUS(Category.UNKNOWN),
        REJECTED(Category.FAILED),
        SKIPPED_FAILED(Category.FAILED),
        SKIPPED_UNKNOWN(Category.UNKNOWN),
        NOT_SUBMITTED(Category.FAILED);

        private final Category category;

        Disposition(Category category) {
            this.category = category;
        }

        Category getCategory() {
            return category;
        }
    }

    enum Category {
        CREATED,
        UNKNOWN,
        FAILED
    }

    @FunctionalInterface
    private interface WriteCall {
        List<WriteOutcome> write(List<Asset> assets) throws Exception;
    }

    private final HierarchyWriter writer;
    private final Executor executor;
    private final boolean upsert;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private HierarchyInserter(HierarchyWriter writer, Executor executor, boolean upsert) {
        this.writer = writer;
        this.executor = executor;
        this.upsert = upsert;
    }

    /**
     * Creates an inserter.
     *
     * @param writer the writer submitting the batches to CDF.
     * @param executor the executor to dispatch the requests of a batch on.
     * @return the inserter.
     */
    public static HierarchyInserter of(HierarchyWriter writer, Executor executor) {
        Preconditions.checkNotNull(writer, "Writer cannot be null.");
        Preconditions.checkNotNull(executor, "Executor cannot be null.");
        return new HierarchyInserter(writer, executor, false);
    }

    /**
     * Enables upsert. Assets that the api reports as already existing are re-submitted as updates.
     *
     * @param enable set to {@code true} to enable upsert.
     * @return an inserter with the setting applied.
     */
    public HierarchyInserter withUpsert(boolean enable) {
        return new HierarchyInserter(writer, executor, enable);
    }

    /**
     * Stops the insert. The running batch is allowed to complete, but no new batch is started. Assets that were
     * never sent are reported as {@code failed}.
     */
    public void cancel() {
        LOG.info("Cancel requested. No new batches will be dispatched.");
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Writes the batches to CDF.
     *
     * @param graph the graph the batches were built from. Used to look up parents.
     * @param batches the batches, ordered by depth. Written in the given order.
     * @return the outcome, covering every asset in the batches exactly once.
     */
    public HierarchyInsertResult insert(HierarchyGraph graph, List<HierarchyBatch> batches) {
        final String loggingPrefix = "insert() - " + RandomStringUtils.randomAlphanumeric(6) + " - ";
        final Instant startInstant = Instant.now();
        Preconditions.checkNotNull(graph, "Graph cannot be null.");
        Preconditions.checkNotNull(batches, "Batches cannot be null.");

        ConcurrentMap<String, Disposition> dispositions = new ConcurrentHashMap<>();
        ConcurrentMap<String, Asset> written = new ConcurrentHashMap<>();
        ConcurrentMap<String, String> errorMessages = new ConcurrentHashMap<>();

        for (int i = 0; i < batches.size(); i++) {
            if (cancelled.get()) {
                LOG.warn(loggingPrefix + "Insert cancelled before batch {} of {}.", i + 1, batches.size());
                break;
            }
            HierarchyBatch batch = batches.get(i);
            List<Asset> eligible = new ArrayList<>(batch.size());
            for (Asset asset : batch.getAssets()) {
                Disposition skip = checkParent(graph, asset, dispositions);
                if (null == skip) {
                    eligible.add(asset);
                } else {
                    record(dispositions, asset.getExternalId(), skip);
                }
            }
            if (eligible.isEmpty()) {
                LOG.debug(loggingPrefix + "All assets of batch {} at depth {} are skipped.", i + 1, batch.getDepth());
                continue;
            }
            LOG.debug(loggingPrefix + "Writing batch {} of {} with {} assets at depth {}.",
                    i + 1,
                    batches.size(),
                    eligible.size(),
                    batch.getDepth());
            submitBatch(eligible, dispositions, written, errorMessages, loggingPrefix);
        }

        HierarchyInsertResult.Builder resultBuilder = HierarchyInsertResult.builder();
        for (HierarchyBatch batch : batches) {
            for (Asset asset : batch.getAssets()) {
                Disposition disposition = dispositions.getOrDefault(asset.getExternalId(), Disposition.NOT_SUBMITTED);
                switch (disposition.getCategory()) {
                    case CREATED:
                        resultBuilder.addCreated(written.get(asset.getExternalId()));
                        break;
                    case UNKNOWN:
                        resultBuilder.addUnknown(asset);
                        break;
                    default:
                        resultBuilder.addFailed(asset);
                }
            }
        }
        HierarchyInsertResult result = resultBuilder
                .setErrorMessages(errorMessages)
                .build();

        LOG.info(loggingPrefix + "Completed writing {} batches. {} created, {} unknown, {} failed. Duration: {}",
                batches.size(),
                result.getCreated().size(),
                result.getUnknown().size(),
                result.getFailed().size(),
                Duration.between(startInstant, Instant.now()));
        return result;
    }

    /*
    Returns the skip disposition if the parent has not been written, null if the asset can be submitted.
    A parent outside the input is assumed to exist.
     */
    private static Disposition checkParent(HierarchyGraph graph,
                                           Asset asset,
                                           Map<String, Disposition> dispositions) {
        String parent = graph.getParentExternalId(asset);
        if (null == parent) {
            return null;
        }
        Disposition parentDisposition = dispositions.getOrDefault(parent, Disposition.NOT_SUBMITTED);
        switch (parentDisposition.getCategory()) {
            case CREATED:
                return null;
            case UNKNOWN:
                return Disposition.SKIPPED_UNKNOWN;
            default:
                return Disposition.SKIPPED_FAILED;
        }
    }

    private void submitBatch(List<Asset> batch,
                             ConcurrentMap<String, Disposition> dispositions,
                             ConcurrentMap<String, Asset> written,
                             ConcurrentMap<String, String> errorMessages,
                             String loggingPrefix) {
        List<Asset> toCreate = new ArrayList<>();
        List<Asset> toUpdate = new ArrayList<>();
        for (Asset asset : batch) {
            if (asset.hasId()) {
                toUpdate.add(asset);
            } else {
                toCreate.add(asset);
            }
        }

        CompletableFuture<Map<String, WriteOutcome>> createFuture =
                CompletableFuture.supplyAsync(() -> write(writer::create, toCreate, loggingPrefix), executor);
        CompletableFuture<Map<String, WriteOutcome>> updateFuture =
                CompletableFuture.supplyAsync(() -> write(writer::update, toUpdate, loggingPrefix), executor);
        Map<String, WriteOutcome> outcomes = new HashMap<>();
        outcomes.putAll(createFuture.join());
        outcomes.putAll(updateFuture.join());

        if (upsert) {
            List<Asset> existing = new ArrayList<>();
            for (Asset asset : toCreate) {
                WriteOutcome outcome = outcomes.get(asset.getExternalId());
                if (null != outcome && outcome.getKind() == WriteOutcome.Kind.DUPLICATED) {
                    existing.add(asset);
                }
            }
            if (!existing.isEmpty()) {
                LOG.info(loggingPrefix + "{} assets already exist. Will update them instead.", existing.size());
                outcomes.putAll(write(writer::update, existing, loggingPrefix));
            }
        }

        for (Asset asset : batch) {
            WriteOutcome outcome = outcomes.get(asset.getExternalId());
            if (null == outcome) {
                LOG.warn(loggingPrefix + "No outcome reported for externalId [{}]. Its state is unknown.",
                        asset.getExternalId());
                record(dispositions, asset.getExternalId(), Disposition.AMBIGUOUS);
                continue;
            }
            if (null != outcome.getMessage()) {
                errorMessages.putIfAbsent(asset.getExternalId(), outcome.getMessage());
            }
            switch (outcome.getKind()) {
                case SUCCESS:
                    written.putIfAbsent(asset.getExternalId(), outcome.getResult());
                    record(dispositions, asset.getExternalId(), Disposition.CREATED);
                    break;
                case SERVER_ERROR:
                    record(dispositions, asset.getExternalId(), Disposition.AMBIGUOUS);
                    break;
                default:
                    record(dispositions, asset.getExternalId(), Disposition.REJECTED);
            }
        }
    }

    /*
    A writer exception leaves the state of the whole batch unknown.
     */
    private static Map<String, WriteOutcome> write(WriteCall call, List<Asset> assets, String loggingPrefix) {
        if (assets.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, WriteOutcome> outcomes = new HashMap<>();
        try {
            for (WriteOutcome outcome : call.write(assets)) {
                outcomes.put(outcome.getExternalId(), outcome);
            }
        } catch (Exception e) {
            LOG.warn(loggingPrefix + "Failed to write batch of {} assets: {}", assets.size(), e.toString());
            for (Asset asset : assets) {
                outcomes.put(asset.getExternalId(), WriteOutcome.serverError(asset.getExternalId(), e.toString()));
            }
        }
        return outcomes;
    }

    private static void record(ConcurrentMap<String, Disposition> dispositions,
                               String externalId,
                               Disposition disposition) {
        Disposition previous = dispositions.putIfAbsent(externalId, disposition);
        if (null != previous) {
            LOG.warn("Outcome for externalId [{}] already recorded as {}. Ignoring {}.",
                    externalId, previous, disposition);
        }
    }
}
