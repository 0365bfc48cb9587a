package com.cognite.sdk;

import com.cognite.sdk.dto.Asset;
import org.apache.commons.lang3.RandomStringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

public class TestUtils {
    public static final String sourceKey = "source";
    public static final String sourceValue = "unitTest";

    public static Asset asset(String externalId) {
        return Asset.newBuilder()
                .setExternalId(externalId)
                .setName("name_" + externalId)
                .setSource(sourceValue)
                .build();
    }

    public static Asset asset(String externalId, String parentExternalId) {
        return asset(externalId).toBuilder()
                .setParentExternalId(parentExternalId)
                .build();
    }

    /**
     * Generates a random, valid asset hierarchy with a single root. Every asset is listed after its parent.
     */
    public static List<Asset> generateAssetHierarchy(int noObjects) {
        List<Asset> objects = new ArrayList<>(noObjects);
        String rootExternalId = "root_" + RandomStringUtils.randomAlphanumeric(10);
        objects.add(Asset.newBuilder()
                .setExternalId(rootExternalId)
                .setName("test_asset_root")
                .setDescription(RandomStringUtils.randomAlphanumeric(50))
                .setSource(sourceValue)
                .build());
        for (int i = 1; i < noObjects; i++) {
            Asset parent = objects.get(ThreadLocalRandom.current().nextInt(objects.size()));
            objects.add(Asset.newBuilder()
                    .setExternalId(RandomStringUtils.randomAlphanumeric(10) + "_" + i)
                    .setName("test_asset_" + RandomStringUtils.randomAlphanumeric(5))
                    .setParentExternalId(parent.getExternalId())
                    .setDescription(RandomStringUtils.randomAlphanumeric(50))
                    .setSource(sourceValue)
                    .build());
        }
        return objects;
    }
}
