package com.yieldsolver;

import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Main configuration loading
 */
class MainTest {

    @Test
    void loadConfig_shouldReadBundledApplicationYml() {
        JsonObject config = Main.loadConfig(Main.CONFIG_RESOURCE);

        assertEquals(8081, config.getJsonObject("http").getInteger("port"));
        assertEquals("EARLY_EXIT", config.getJsonObject("solver").getString("iteration-mode"));
        assertEquals(1.0e-7, config.getJsonObject("solver").getDouble("default-tolerance"));
        assertEquals(1000, config.getJsonObject("batch").getInteger("max-series"));
    }

    @Test
    void loadConfig_shouldFailForMissingResource() {
        assertThrows(IllegalStateException.class, () -> Main.loadConfig("missing.yml"));
    }
}
