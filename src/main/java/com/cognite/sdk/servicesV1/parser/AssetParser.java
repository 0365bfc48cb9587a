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

package com.cognite.sdk.servicesV1.parser;

import com.cognite.sdk.dto.Asset;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * This class contains a set of methods to help parsing asset objects between Cognite api representations
 * (json) and typed objects.
 */
public class AssetParser {
    static final String logPrefix = "AssetParser - ";
    static final int MAX_LOG_ELEMENT_LENGTH = 500;
    static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parses an asset json string to {@link Asset}.
     *
     * @param json the asset json object
     * @return the parsed asset
     * @throws Exception if the json is not a valid asset
     */
    public static Asset parseAsset(String json) throws Exception {
        JsonNode root = objectMapper.readTree(json);
        Asset.Builder assetBuilder = Asset.newBuilder();

        // An asset must contain an id and name.
        if (root.path("id").isIntegralNumber()) {
            assetBuilder.setId(root.get("id").longValue());
        } else {
            throw new Exception(logPrefix + "Unable to parse attribute: id. Item exerpt: "
                    + json.substring(0, Math.min(json.length(), MAX_LOG_ELEMENT_LENGTH)));
        }

        if (root.path("name").isTextual()) {
            assetBuilder.setName(root.get("name").textValue());
        } else {
            throw new Exception(logPrefix + "Unable to parse attribute: name. Item exerpt: "
                    + json.substring(0, Math.min(json.length(), MAX_LOG_ELEMENT_LENGTH)));
        }

        // The rest of the attributes are optional.
        if (root.path("externalId").isTextual()) {
            assetBuilder.setExternalId(root.get("externalId").textValue());
        }
        if (root.path("parentId").isIntegralNumber()) {
            assetBuilder.setParentId(root.get("parentId").longValue());
        }
        if (root.path("parentExternalId").isTextual()) {
            assetBuilder.setParentExternalId(root.get("parentExternalId").textValue());
        }
        if (root.path("description").isTextual()) {
            assetBuilder.setDescription(root.get("description").textValue());
        }
        if (root.path("source").isTextual()) {
            assetBuilder.setSource(root.get("source").textValue());
        }
        if (root.path("dataSetId").isIntegralNumber()) {
            assetBuilder.setDataSetId(root.get("dataSetId").longValue());
        }
        if (root.path("metadata").isObject()) {
            Map<String, String> metadata = new HashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fieldIterator = root.path("metadata").fields();
            while (fieldIterator.hasNext()) {
                Map.Entry<String, JsonNode> entry = fieldIterator.next();
                if (entry.getValue().isTextual()) {
                    metadata.put(entry.getKey(), entry.getValue().textValue());
                }
            }
            assetBuilder.setMetadata(metadata);
        }

        return assetBuilder.build();
    }

    /**
     * Parses the {@code externalId} of an item json string. Returns an empty string if the item has no
     * {@code externalId}.
     *
     * @param json the item json object
     * @return the external id
     * @throws Exception if the json cannot be parsed
     */
    public static String parseExternalId(String json) throws Exception {
        return objectMapper.readTree(json).path("externalId").asText("");
    }

    /**
     * Builds a request insert item object from {@link Asset}.
     *
     * An insert item object creates a new asset data object in the Cognite system. A parent reference by
     * {@code parentExternalId} takes precedence over {@code parentId}.
     *
     * @param element the asset to insert
     * @return the insert item
     */
    public static Map<String, Object> toRequestInsertItem(Asset element) {
        // Note that "id" cannot be a part of an insert request.
        ImmutableMap.Builder<String, Object> mapBuilder = ImmutableMap.<String, Object>builder()
                .put("externalId", element.getExternalId())
                .put("name", element.getName());

        if (element.hasParentExternalId()) {
            mapBuilder.put("parentExternalId", element.getParentExternalId());
        } else if (element.hasParentId()) {
            mapBuilder.put("parentId", element.getParentId());
        }
        if (element.hasDescription()) {
            mapBuilder.put("description", element.getDescription());
        }
        if (element.hasSource()) {
            mapBuilder.put("source", element.getSource());
        }
        if (element.hasDataSetId()) {
            mapBuilder.put("dataSetId", element.getDataSetId());
        }
        if (!element.getMetadata().isEmpty()) {
            mapBuilder.put("metadata", element.getMetadata());
        }

        return mapBuilder.build();
    }

    /**
     * Builds a request update item object from {@link Asset}.
     *
     * An update item object updates an existing asset object with new values for all provided fields.
     * Fields that are not in the update object retain their original value.
     *
     * @param element the asset to update
     * @return the update item
     */
    public static Map<String, Object> toRequestUpdateItem(Asset element) {
        ImmutableMap.Builder<String, Object> updateNodeBuilder = ImmutableMap.builder();
        if (element.hasId() && element.hasExternalId()) {
            updateNodeBuilder.put("externalId", ImmutableMap.of("set", element.getExternalId()));
        }
        updateNodeBuilder.put("name", ImmutableMap.of("set", element.getName()));

        if (element.hasParentExternalId()) {
            updateNodeBuilder.put("parentExternalId", ImmutableMap.of("set", element.getParentExternalId()));
        } else if (element.hasParentId()) {
            updateNodeBuilder.put("parentId", ImmutableMap.of("set", element.getParentId()));
        }
        if (element.hasDescription()) {
            updateNodeBuilder.put("description", ImmutableMap.of("set", element.getDescription()));
        }
        if (element.hasSource()) {
            updateNodeBuilder.put("source", ImmutableMap.of("set", element.getSource()));
        }
        if (element.hasDataSetId()) {
            updateNodeBuilder.put("dataSetId", ImmutableMap.of("set", element.getDataSetId()));
        }
        if (!element.getMetadata().isEmpty()) {
            updateNodeBuilder.put("metadata", ImmutableMap.of("add", element.getMetadata()));
        }

        return buildUpdateItem(element, updateNodeBuilder.build());
    }

    /**
     * Builds a request replace item object from {@link Asset}.
     *
     * A replace item object replaces an existing asset object with new values for all provided fields.
     * Fields that are not in the update object are set to null.
     *
     * @param element the asset to replace
     * @return the replace item
     */
    public static Map<String, Object> toRequestReplaceItem(Asset element) {
        ImmutableMap.Builder<String, Object> updateNodeBuilder = ImmutableMap.builder();
        if (element.hasId() && element.hasExternalId()) {
            updateNodeBuilder.put("externalId", ImmutableMap.of("set", element.getExternalId()));
        }
        updateNodeBuilder.put("name", ImmutableMap.of("set", element.getName()));

        // The parent link cannot be nulled, only moved.
        if (element.hasParentExternalId()) {
            updateNodeBuilder.put("parentExternalId", ImmutableMap.of("set", element.getParentExternalId()));
        } else if (element.hasParentId()) {
            updateNodeBuilder.put("parentId", ImmutableMap.of("set", element.getParentId()));
        }
        if (element.hasDescription()) {
            updateNodeBuilder.put("description", ImmutableMap.of("set", element.getDescription()));
        } else {
            updateNodeBuilder.put("description", ImmutableMap.of("setNull", true));
        }
        if (element.hasSource()) {
            updateNodeBuilder.put("source", ImmutableMap.of("set", element.getSource()));
        } else {
            updateNodeBuilder.put("source", ImmutableMap.of("setNull", true));
        }
        if (element.hasDataSetId()) {
            updateNodeBuilder.put("dataSetId", ImmutableMap.of("set", element.getDataSetId()));
        } else {
            updateNodeBuilder.put("dataSetId", ImmutableMap.of("setNull", true));
        }
        updateNodeBuilder.put("metadata", ImmutableMap.of("set", element.getMetadata()));

        return buildUpdateItem(element, updateNodeBuilder.build());
    }

    private static Map<String, Object> buildUpdateItem(Asset element, Map<String, Object> updateNode) {
        ImmutableMap.Builder<String, Object> mapBuilder = ImmutableMap.builder();
        if (element.hasId()) {
            mapBuilder.put("id", element.getId());
        } else if (element.hasExternalId()) {
            mapBuilder.put("externalId", element.getExternalId());
        } else {
            throw new IllegalArgumentException(logPrefix + "Asset must have an externalId or id to be updated.");
        }
        mapBuilder.put("update", updateNode);

        return mapBuilder.build();
    }
}
