package com.finpal.assistant.config;

import java.nio.file.Path;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FinpalPropertiesTest {

    private static final FinpalProperties.Security SECURITY =
            new FinpalProperties.Security("12345678901234567890123456789012", null);

    @Test
    void storageDefaultsFileNamesAndSeedFlag() {
        FinpalProperties.Storage storage = new FinpalProperties.Storage("data", null, " ", null);

        assertEquals(Path.of("data", "users.json"), storage.usersPath());
        assertEquals(Path.of("data", "finance.json"), storage.financePath());
        assertTrue(storage.seedDemoDataFlag());
    }

    @Test
    void seedFlagRespectsFalse() {
        assertFalse(new FinpalProperties.Storage("data", null, null, false).seedDemoDataFlag());
    }

    @Test
    void missingQueryFallsBackToSystemZone() {
        FinpalProperties props = new FinpalProperties(new FinpalProperties.Storage("data", null, null, null), SECURITY, null);

        assertEquals(ZoneId.systemDefault(), props.query().zoneOrDefault());
        assertEquals(3600L, props.security().tokenTtlOrDefault());
    }

    @Test
    void configuredZoneIsUsed() {
        assertEquals(ZoneId.of("Asia/Kolkata"), new FinpalProperties.Query("Asia/Kolkata").zoneOrDefault());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FinpalProperties.Query("Mars/Olympus"));
        assertThrows(IllegalArgumentException.class, () -> new FinpalProperties.Security(" ", null));
        assertThrows(IllegalArgumentException.class, () -> new FinpalProperties.Security("x".repeat(32), 0L));
        assertThrows(IllegalArgumentException.class, () -> new FinpalProperties.Storage("", null, null, null));
        assertThrows(IllegalArgumentException.class, () -> new FinpalProperties(null, SECURITY, null));
    }
}
