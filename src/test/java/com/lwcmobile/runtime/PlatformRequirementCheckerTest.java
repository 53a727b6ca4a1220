package com.lwcmobile.runtime;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.lwcmobile.versioning.Version;
import com.lwcmobile.versioning.VersionParseException;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlatformRequirementCheckerTest {

    @Test
    void shouldAcceptVersionAtOrAboveMinimum() {
        PlatformRequirementChecker checker = new PlatformRequirementChecker(config());

        PlatformRequirementChecker.RequirementCheck atMinimum = checker.check("ios", "13.0");
        PlatformRequirementChecker.RequirementCheck above = checker.check("IOS", "14-2-1");

        assertTrue(atMinimum.satisfied());
        assertEquals("ios", atMinimum.platform());
        assertEquals(new Version(13, 0, 0), atMinimum.minimum());
        assertTrue(above.satisfied());
        assertEquals("14.2.1 meets minimum 13.0.0", above.reason());
    }

    @Test
    void shouldRejectVersionBelowMinimum() {
        PlatformRequirementChecker.RequirementCheck check = new PlatformRequirementChecker(config())
                .check("android", "9.0.1");

        assertFalse(check.satisfied());
        assertEquals("android", check.platform());
        assertEquals("9.0.1 is older than minimum 10.0.0", check.reason());
    }

    @Test
    void shouldAcceptAnyVersionWhenNoMinimumConfigured() {
        AppConfig config = config();
        config.getPlatforms().remove("android");

        PlatformRequirementChecker.RequirementCheck check = new PlatformRequirementChecker(config).check("android", "1");

        assertTrue(check.satisfied());
        assertNull(check.minimum());
        assertEquals(PlatformRequirementChecker.NO_MINIMUM_CONFIGURED, check.reason());
    }

    @Test
    void shouldFailForUnknownPlatform() {
        assertThrows(IllegalArgumentException.class,
                () -> new PlatformRequirementChecker(config()).check("windows", "10.0"));
    }

    @Test
    void shouldFailForUnparsableVersion() {
        assertThrows(VersionParseException.class,
                () -> new PlatformRequirementChecker(config()).check("ios", "13.beta"));
    }

    @Test
    void shouldReportUnparsableMinimumAsConfigError() {
        AppConfig config = config();
        config.getPlatforms().put("ios", platform("13.x"));
        PlatformRequirementChecker checker = new PlatformRequirementChecker(config);

        IllegalStateException validation = assertThrows(IllegalStateException.class, checker::validate);
        IllegalStateException check = assertThrows(IllegalStateException.class, () -> checker.check("ios", "14.0"));

        assertEquals("Invalid minimumOsVersion for platform ios: 13.x", validation.getMessage());
        assertInstanceOf(VersionParseException.class, validation.getCause());
        assertEquals(validation.getMessage(), check.getMessage());
    }

    @Test
    void shouldValidateWellFormedMinimums() {
        assertDoesNotThrow(() -> new PlatformRequirementChecker(config()).validate());
    }

    @Test
    void shouldIgnoreUnknownAndIncompletePlatformEntries() {
        AppConfig config = config();
        config.getPlatforms().put("windows", platform("10.0"));
        config.getPlatforms().put("Android", platform(null));
        config.getPlatforms().remove("android");

        PlatformRequirementChecker checker = new PlatformRequirementChecker(config);

        assertEquals(List.of("ios", "android"), List.copyOf(checker.supportedPlatforms()));
        assertEquals(List.of("ios"), List.copyOf(checker.requirements().keySet()));
    }

    private static AppConfig config() {
        Map<String, AppConfig.PlatformConfig> platforms = new LinkedHashMap<>();
        platforms.put("ios", platform("13.0"));
        platforms.put("android", platform("10.0"));

        AppConfig config = new AppConfig();
        config.setPlatforms(platforms);
        return config;
    }

    private static AppConfig.PlatformConfig platform(String minimumOsVersion) {
        AppConfig.PlatformConfig platformConfig = new AppConfig.PlatformConfig();
        platformConfig.setMinimumOsVersion(minimumOsVersion);
        return platformConfig;
    }
}
