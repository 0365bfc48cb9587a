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

import com.cognite.sdk.config.ProjectConfig;
import com.cognite.sdk.config.UpsertMode;
import com.cognite.sdk.dto.Asset;
import com.cognite.sdk.hierarchy.HierarchyWriter;
import com.cognite.sdk.hierarchy.WriteOutcome;
import com.cognite.sdk.servicesV1.ConnectorServiceV1;
import com.cognite.sdk.servicesV1.RequestParameters;
import com.cognite.sdk.servicesV1.ResponseItems;
import com.cognite.sdk.servicesV1.parser.AssetParser;
import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import org.apache.commons.lang3.RandomStringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Writes asset batches to CDF via the {@code assets}, {@code assets/update} and {@code assets/byids} endpoints.
 *
 * The api responses are classified per asset:
 * - 2xx: the assets in the response items are written. Assets missing from the response are unknown.
 * - 409 with a list of duplicated items: the listed assets already exist. The api rejects the whole request,
 *   so the remaining assets are re-submitted once.
 * - Other 4xx: all assets are rejected with the api error message.
 * - 5xx (after the executor's retries), timeouts and I/O errors: the state of all assets is unknown.
 */
@AutoValue
public abstract class ConnectorHierarchyWriter implements HierarchyWriter {
    private static final Logger LOG = LoggerFactory.getLogger(ConnectorHierarchyWriter.class);
    private static final int MAX_RETRIEVE_BATCH_SIZE = 1000;

    private static Builder builder() {
        return new AutoValue_ConnectorHierarchyWriter.Builder()
                .setUpsertMode(UpsertMode.UPDATE);
    }

    /**
     * Creates a writer.
     *
     * @param connectorService the services layer to issue requests with.
     * @param projectConfig the project and credentials to write to.
     * @return the writer.
     */
    public static ConnectorHierarchyWriter of(ConnectorServiceV1 connectorService, ProjectConfig projectConfig) {
        Preconditions.checkNotNull(connectorService, "Connector service cannot be null.");
        Preconditions.checkNotNull(projectConfig, "Project config cannot be null.");
        return ConnectorHierarchyWriter.builder()
                .setConnectorService(connectorService)
                .setProjectConfig(projectConfig)
                .build();
    }

    abstract Builder toBuilder();
    abstract ConnectorServiceV1 getConnectorService();
    abstract ProjectConfig getProjectConfig();
    public abstract UpsertMode getUpsertMode();

    /**
     * Sets how updates are applied. {@link UpsertMode#UPDATE} sets the provided fields and keeps the others.
     * {@link UpsertMode#REPLACE} sets the provided fields and clears the others.
     *
     * @param mode the update mode.
     * @return the writer with the setting applied.
     */
    public ConnectorHierarchyWriter withUpsertMode(UpsertMode mode) {
        Preconditions.checkNotNull(mode, "Upsert mode cannot be null.");
        return toBuilder().setUpsertMode(mode).build();
    }

    @Override
    public List<WriteOutcome> create(List<Asset> assets) throws Exception {
        return write(getConnectorService().writeAssets(), assets, AssetParser::toRequestInsertItem, "create() - ");
    }

    @Override
    public List<WriteOutcome> update(List<Asset> assets) throws Exception {
        Function<Asset, Map<String, Object>> updateItemFunction = getUpsertMode() == UpsertMode.REPLACE
                ? AssetParser::toRequestReplaceItem
                : AssetParser::toRequestUpdateItem;
        return write(getConnectorService().updateAssets(), assets, updateItemFunction, "update() - ");
    }

    /**
     * Looks up which of the given {@code externalId}s exist in CDF. Unknown ids are ignored.
     *
     * @param externalIds the {@code externalId}s to look up.
     * @return the {@code externalId}s that exist.
     * @throws Exception if the lookup request fails.
     */
    @Override
    public Set<String> retrieveExisting(Collection<String> externalIds) throws Exception {
        final String loggingPrefix = "retrieveExisting() - " + RandomStringUtils.randomAlphanumeric(5) + " - ";
        final Instant startInstant = Instant.now();
        Set<String> existing = new LinkedHashSet<>();
        if (externalIds.isEmpty()) {
            return existing;
        }
        ConnectorServiceV1.ItemReader reader = getConnectorService().readAssetsById();
        for (List<String> batch : Lists.partition(new ArrayList<>(externalIds), MAX_RETRIEVE_BATCH_SIZE)) {
            List<Map<String, Object>> items = batch.stream()
                    .map(externalId -> ImmutableMap.<String, Object>of("externalId", externalId))
                    .collect(Collectors.toList());
            RequestParameters request = RequestParameters.create()
                    .withItems(items)
                    .withRootParameter("ignoreUnknownIds", true)
                    .withProjectConfig(getProjectConfig());

            ResponseItems response = reader.getItems(request);
            if (!response.isSuccessful()) {
                String message = loggingPrefix + "Failed to look up assets. Response code: "
                        + response.getResponseCode() + ". " + response.getErrorMessage();
                LOG.error(message);
                throw new Exception(message);
            }
            for (String item : response.getResultsItems()) {
                existing.add(AssetParser.parseExternalId(item));
            }
        }
        LOG.info(loggingPrefix + "Found {} of {} assets in CDF. Duration: {}",
                existing.size(),
                externalIds.size(),
                Duration.between(startInstant, Instant.now()));
        return existing;
    }

    private List<WriteOutcome> write(ConnectorServiceV1.ItemWriter itemWriter,
                                     List<Asset> assets,
                                     Function<Asset, Map<String, Object>> toRequestItem,
                                     String loggingPrefix) throws Exception {
        final String batchLogPrefix = loggingPrefix + RandomStringUtils.randomAlphanumeric(5) + " - ";
        final Instant startInstant = Instant.now();
        Preconditions.checkNotNull(assets, "Assets cannot be null.");
        if (assets.isEmpty()) {
            return new ArrayList<>();
        }

        List<WriteOutcome> outcomes = new ArrayList<>(assets.size());
        List<Asset> remaining = assets;
        // First attempt, plus a single re-submit of the items that were not reported as duplicates.
        for (int attempt = 0; attempt < 2 && !remaining.isEmpty(); attempt++) {
            ResponseItems response;
            try {
                response = itemWriter.writeItems(RequestParameters.create()
                        .withItems(remaining.stream().map(toRequestItem).collect(Collectors.toList()))
                        .withProjectConfig(getProjectConfig()));
            } catch (CompletionException e) {
                LOG.warn(batchLogPrefix + "Request failed for {} assets: {}", remaining.size(), e.toString());
                outcomes.addAll(allOf(remaining, asset ->
                        WriteOutcome.serverError(asset.getExternalId(), String.valueOf(e.getCause()))));
                return outcomes;
            }

            if (response.isSuccessful()) {
                outcomes.addAll(parseSuccess(response, remaining, batchLogPrefix));
                remaining = new ArrayList<>();
            } else if (response.getResponseCode() == 409 && !response.getDuplicateItems().isEmpty()) {
                Set<String> duplicates = new HashSet<>();
                for (String item : response.getDuplicateItems()) {
                    duplicates.add(AssetParser.parseExternalId(item));
                }
                LOG.info(batchLogPrefix + "{} of {} assets already exist.", duplicates.size(), remaining.size());
                // After an ambiguous attempt, the duplicates may be the assets that attempt created.
                boolean possiblyOwnWrite = response.isRetriedAfterAmbiguousError();
                if (possiblyOwnWrite) {
                    LOG.warn(batchLogPrefix + "Duplicates reported after a failed attempt with unknown effect. "
                            + "Their state is unknown.");
                }
                List<Asset> notDuplicated = new ArrayList<>();
                for (Asset asset : remaining) {
                    if (duplicates.contains(asset.getExternalId()) && possiblyOwnWrite) {
                        outcomes.add(WriteOutcome.serverError(asset.getExternalId(), "Reported as duplicate after "
                                + "a failed attempt. It may have been created by that attempt."));
                    } else if (duplicates.contains(asset.getExternalId())) {
                        outcomes.add(WriteOutcome.duplicated(asset.getExternalId()));
                    } else {
                        notDuplicated.add(asset);
                    }
                }
                remaining = notDuplicated;
                if (attempt > 0 && !remaining.isEmpty()) {
                    String message = response.getErrorMessage();
                    outcomes.addAll(allOf(remaining, asset -> WriteOutcome.clientError(asset.getExternalId(), message)));
                    remaining = new ArrayList<>();
                }
            } else if (response.isClientError()) {
                String message = response.getErrorMessage();
                LOG.warn(batchLogPrefix + "The api rejected {} assets. Response code: {}. {}",
                        remaining.size(),
                        response.getResponseCode(),
                        message);
                outcomes.addAll(allOf(remaining, asset -> WriteOutcome.clientError(asset.getExternalId(), message)));
                remaining = new ArrayList<>();
            } else {
                String message = "Response code " + response.getResponseCode() + ": " + response.getErrorMessage();
                LOG.warn(batchLogPrefix + "Server error for {} assets. {}", remaining.size(), message);
                outcomes.addAll(allOf(remaining, asset -> WriteOutcome.serverError(asset.getExternalId(), message)));
                remaining = new ArrayList<>();
            }
        }

        LOG.debug(batchLogPrefix + "Wrote batch of {} assets. Duration: {}",
                assets.size(),
                Duration.between(startInstant, Instant.now()));
        return outcomes;
    }

    private List<WriteOutcome> parseSuccess(ResponseItems response,
                                            List<Asset> submitted,
                                            String batchLogPrefix) throws Exception {
        Map<String, Asset> resultsMap = new HashMap<>();
        for (String item : response.getResultsItems()) {
            Asset result = AssetParser.parseAsset(item);
            if (result.hasExternalId()) {
                resultsMap.put(result.getExternalId(), result);
            }
        }
        List<WriteOutcome> outcomes = new ArrayList<>(submitted.size());
        for (Asset asset : submitted) {
            Asset result = resultsMap.get(asset.getExternalId());
            if (null == result) {
                LOG.warn(batchLogPrefix + "Asset [{}] is missing from the response.", asset.getExternalId());
                outcomes.add(WriteOutcome.serverError(asset.getExternalId(), "Missing from the api response."));
            } else {
                outcomes.add(WriteOutcome.success(asset.getExternalId(), result));
            }
        }
        return outcomes;
    }

    private static List<WriteOutcome> allOf(List<Asset> assets, Function<Asset, WriteOutcome> outcomeFunction) {
        return assets.stream()
                .map(outcomeFunction)
                .collect(Collectors.toList());
    }

    @AutoValue.Builder
    abstract static class Builder {
        abstract Builder setConnectorService(ConnectorServiceV1 value);
        abstract Builder setProjectConfig(ProjectConfig value);
        abstract Builder setUpsertMode(UpsertMode value);

        abstract ConnectorHierarchyWriter build();
    }
}
