package com.energyforecast.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigReaderUtilTest {
    private static final String RESOURCE = "forecast-test.properties";

    @Test
    void testTypedValues() {
        ConfigReaderUtil cr = new ConfigReaderUtil(RESOURCE);

        assertEquals(12, cr.getInt("window.length", 24));
        assertEquals(0.7, cr.getDouble("split.train.end", 0.8), 0.0);
        assertEquals(7L, cr.getLong("seed", 42L));
        assertFalse(cr.getBoolean("search.enabled", true));
        assertEquals("basic", cr.getValue("architecture"));
    }

    @Test
    void testListsAreTrimmed() {
        ConfigReaderUtil cr = new ConfigReaderUtil(RESOURCE);

        assertEquals(List.of("AEP", "PJME"), cr.getList("datasets"));
        assertEquals(List.of(8, 16), cr.getIntList("grid.recurrent.units", List.of()));
        assertEquals(List.of(0.0), cr.getDoubleList("grid.dropout.rates", List.of()));
    }

    @Test
    void testMissingKeysFallBackToDefaults() {
        ConfigReaderUtil cr = new ConfigReaderUtil(RESOURCE);

        assertNull(cr.getValue("no.such.key"));
        assertEquals("fallback", cr.getValue("no.such.key", "fallback"));
        assertEquals(3, cr.getInt("no.such.key", 3));
        assertEquals(List.of(1, 2), cr.getIntList("no.such.key", List.of(1, 2)));
        assertTrue(cr.getList("no.such.key").isEmpty());
    }

    @Test
    void testMissingResourceFails() {
        assertThrows(IllegalStateException.class, () -> new ConfigReaderUtil("does-not-exist.properties"));
    }
}
