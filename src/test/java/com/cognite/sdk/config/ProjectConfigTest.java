package com.cognite.sdk.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ProjectConfigTest {

    @Test
    public void defaultIsNotConfigured() {
        ProjectConfig config = ProjectConfig.create();
        assertFalse(config.isConfigured());
        assertEquals("https://api.cognitedata.com", config.getHost());
        assertThrows(IllegalStateException.class, config::validate);
    }

    @Test
    public void completeConfig() {
        ProjectConfig config = ProjectConfig.create()
                .withHost("https://westeurope-1.cognitedata.com")
                .withProject("test-project")
                .withApiKey("something");
        assertTrue(config.isConfigured());
        assertEquals("test-project", config.getProject());
        config.validate();
    }

    @Test
    public void missingProjectIsRejected() {
        ProjectConfig config = ProjectConfig.create().withApiKey("something");
        assertThrows(IllegalArgumentException.class, config::validate);
    }

    @Test
    public void apiKeyIsMasked() {
        ProjectConfig config = ProjectConfig.create()
                .withProject("test-project")
                .withApiKey("something");
        assertFalse(config.toString().contains("something"));
        assertTrue(config.toString().contains("test-project"));
    }
}
