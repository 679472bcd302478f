package com.fxtrace.config;

import org.junit.Test;

import static org.junit.Assert.*;

public class TracerConfigTest {

    @Test
    public void testDefaultsFromClasspath() {
        TracerConfig config = TracerConfig.defaults();
        assertTrue(config.isFriendlyNames());
        assertEquals(MethodCatalog.DEFAULT_RESOURCE, config.getMethodCatalog());
        assertEquals(config, TracerConfig.defaults());
    }

    @Test
    public void testChangingDefaultsDoesNotLeak() {
        TracerConfig mine = TracerConfig.defaults();
        mine.setFriendlyNames(false);
        mine.setMethodCatalog("test-methods.json");

        TracerConfig next = TracerConfig.defaults();
        assertNotSame(mine, next);
        assertTrue(next.isFriendlyNames());
        assertEquals(MethodCatalog.DEFAULT_RESOURCE, next.getMethodCatalog());
    }

    @Test
    public void testLoadResource() {
        TracerConfig config = TracerConfig.load("no-naming.json");
        assertFalse(config.isFriendlyNames());
        assertEquals("test-methods.json", config.getMethodCatalog());
    }

    @Test
    public void testMissingResourceGivesBuiltInDefaults() {
        TracerConfig config = TracerConfig.load("does-not-exist.json");
        assertEquals(new TracerConfig(), config);
    }
}
