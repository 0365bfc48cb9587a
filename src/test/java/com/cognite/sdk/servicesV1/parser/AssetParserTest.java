package com.cognite.sdk.servicesV1.parser;

import com.cognite.sdk.dto.Asset;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AssetParserTest {

    @Test
    void parseAsset() throws Exception {
        String json = "{\"id\":12,\"externalId\":\"pump-1\",\"name\":\"Pump 1\",\"parentId\":3,"
                + "\"parentExternalId\":\"plant\",\"description\":\"Main pump\",\"dataSetId\":99,"
                + "\"metadata\":{\"type\":\"pump\",\"count\":4},\"rootId\":1}";
        Asset asset = AssetParser.parseAsset(json);

        assertEquals(12L, asset.getId());
        assertEquals("pump-1", asset.getExternalId());
        assertEquals("plant", asset.getParentExternalId());
        assertEquals(3L, asset.getParentId());
        assertEquals(99L, asset.getDataSetId());
        assertEquals(Map.of("type", "pump"), asset.getMetadata());
        assertFalse(asset.hasSource());
    }

    @Test
    void parseAssetRequiresIdAndName() {
        assertThrows(Exception.class, () -> AssetParser.parseAsset("{\"externalId\":\"a\",\"name\":\"A\"}"));
        assertThrows(Exception.class, () -> AssetParser.parseAsset("{\"id\":1,\"externalId\":\"a\"}"));
    }

    @Test
    void insertItemPrefersParentExternalId() {
        Asset asset = Asset.newBuilder()
                .setExternalId("child")
                .setName("Child")
                .setParentExternalId("parent")
                .setParentId(5L)
                .setId(8L)
                .build();
        Map<String, Object> item = AssetParser.toRequestInsertItem(asset);

        assertEquals("parent", item.get("parentExternalId"));
        assertFalse(item.containsKey("parentId"));
        assertFalse(item.containsKey("id"));
        assertFalse(item.containsKey("metadata"));
    }

    @Test
    void updateItemIdentifiesById() {
        Asset asset = Asset.newBuilder()
                .setId(8L)
                .setExternalId("child")
                .setName("Child")
                .build();
        Map<String, Object> item = AssetParser.toRequestUpdateItem(asset);

        assertEquals(8L, item.get("id"));
        assertFalse(item.containsKey("externalId"));
        Map<?, ?> update = (Map<?, ?>) item.get("update");
        assertEquals(Map.of("set", "child"), update.get("externalId"));
        assertFalse(update.containsKey("description"));
    }

    @Test
    void replaceItemClearsAbsentFields() {
        Asset asset = Asset.newBuilder()
                .setExternalId("child")
                .setName("Child")
                .setSource("test")
                .build();
        Map<String, Object> item = AssetParser.toRequestReplaceItem(asset);

        assertEquals("child", item.get("externalId"));
        Map<?, ?> update = (Map<?, ?>) item.get("update");
        assertEquals(Map.of("setNull", true), update.get("description"));
        assertEquals(Map.of("set", "test"), update.get("source"));
        assertEquals(Map.of("set", Map.of()), update.get("metadata"));
    }

    @Test
    void updateItemRequiresIdentifier() {
        Asset asset = Asset.newBuilder().setName("anonymous").build();
        assertThrows(IllegalArgumentException.class, () -> AssetParser.toRequestUpdateItem(asset));
    }
}
