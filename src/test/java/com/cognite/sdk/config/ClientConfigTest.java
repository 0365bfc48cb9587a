package com.cognite.sdk.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ClientConfigTest {

    @Test
    public void defaults() {
        ClientConfig config = ClientConfig.create();
        assertEquals(3, config.getMaxRetries());
        assertEquals(1000, config.getMaxHierarchyBatchSize());
        assertEquals(UpsertMode.UPDATE, config.getUpsertMode());
        assertTrue(config.getNoWorkers() > 0 && config.getNoWorkers() <= 64);
    }

    @Test
    public void withSettingsReturnsCopy() {
        ClientConfig config = ClientConfig.create();
        ClientConfig modified = config
                .withMaxRetries(5)
                .withNoWorkers(2)
                .withMaxHierarchyBatchSize(10)
                .withUpsertMode(UpsertMode.REPLACE)
                .withAppIdentifier("my-app");

        assertEquals(3, config.getMaxRetries());
        assertEquals(5, modified.getMaxRetries());
        assertEquals(2, modified.getNoWorkers());
        assertEquals(10, modified.getMaxHierarchyBatchSize());
        assertEquals(UpsertMode.REPLACE, modified.getUpsertMode());
        assertEquals("my-app", modified.getAppIdentifier());
    }

    @Test
    public void outOfRangeSettingsAreRejected() {
        ClientConfig config = ClientConfig.create();
        assertThrows(IllegalStateException.class, () -> config.withMaxRetries(0));
        assertThrows(IllegalStateException.class, () -> config.withMaxRetries(21));
        assertThrows(IllegalStateException.class, () -> config.withNoWorkers(0));
        assertThrows(IllegalStateException.class, () -> config.withMaxHierarchyBatchSize(1001));
        assertThrows(IllegalStateException.class,
                () -> config.withSessionIdentifier("a-very-long-session-identifier-exceeding-the-limit"));
        assertThrows(IllegalArgumentException.class, () -> config.withAppIdentifier(""));
    }
}
