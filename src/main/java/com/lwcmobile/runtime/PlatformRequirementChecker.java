package com.lwcmobile.runtime;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.lwcmobile.cli.CommandLineUtils;
import com.lwcmobile.common.MapUtils;
import com.lwcmobile.common.SetUtils;
import com.lwcmobile.versioning.Version;
import com.lwcmobile.versioning.VersionParseException;

/**
 * Checks a reported OS version against the minimum configured for its platform.
 */
public class PlatformRequirementChecker {
    private static final Logger log = LoggerFactory.getLogger(PlatformRequirementChecker.class);
    static final String NO_MINIMUM_CONFIGURED = "no minimum configured";

    private final AppConfig config;

    public PlatformRequirementChecker(AppConfig config) {
        this.config = config;
    }

    public Set<String> supportedPlatforms() {
        Set<String> normalized = new LinkedHashSet<>();
        for (String platform : SetUtils.filter(config.getPlatforms().keySet(), CommandLineUtils::isValidPlatformFlag)) {
            normalized.add(platform.toLowerCase(Locale.ROOT));
        }
        return normalized;
    }

    public Map<String, AppConfig.PlatformConfig> requirements() {
        return MapUtils.filter(config.getPlatforms(), (platform, platformConfig) ->
                CommandLineUtils.isValidPlatformFlag(platform)
                        && platformConfig != null
                        && platformConfig.getMinimumOsVersion() != null
                        && !platformConfig.getMinimumOsVersion().isBlank());
    }

    // throws IllegalStateException naming the platform whose minimum does not parse
    public void validate() {
        for (Map.Entry<String, AppConfig.PlatformConfig> entry : requirements().entrySet()) {
            minimumFor(entry.getKey(), entry.getValue());
        }
    }

    public RequirementCheck check(String platformFlag, String osVersion) {
        if (!CommandLineUtils.isValidPlatformFlag(platformFlag)) {
            throw new IllegalArgumentException("Unknown platform: " + platformFlag
                    + " (expected " + CommandLineUtils.IOS_FLAG + " or " + CommandLineUtils.ANDROID_FLAG + ")");
        }
        String platform = CommandLineUtils.isIOSFlag(platformFlag)
                ? CommandLineUtils.IOS_FLAG
                : CommandLineUtils.ANDROID_FLAG;
        Version actual = Version.parse(osVersion);

        Map.Entry<String, AppConfig.PlatformConfig> requirement = null;
        for (Map.Entry<String, AppConfig.PlatformConfig> entry : requirements().entrySet()) {
            if (platform.equals(entry.getKey().toLowerCase(Locale.ROOT))) {
                requirement = entry;
                break;
            }
        }
        if (requirement == null) {
            log.warn("No minimum OS version configured for platform {}; accepting {}", platform, actual);
            return new RequirementCheck(platform, actual, null, true, NO_MINIMUM_CONFIGURED);
        }

        Version minimum = minimumFor(requirement.getKey(), requirement.getValue());
        boolean satisfied = actual.sameOrNewer(minimum);
        String reason = satisfied
                ? actual + " meets minimum " + minimum
                : actual + " is older than minimum " + minimum;
        log.debug("platform={} actual={} minimum={} satisfied={}", platform, actual, minimum, satisfied);
        return new RequirementCheck(platform, actual, minimum, satisfied, reason);
    }

    private static Version minimumFor(String platform, AppConfig.PlatformConfig platformConfig) {
        try {
            return Version.parse(platformConfig.getMinimumOsVersion());
        } catch (VersionParseException e) {
            throw new IllegalStateException("Invalid minimumOsVersion for platform " + platform
                    + ": " + platformConfig.getMinimumOsVersion(), e);
        }
    }

    public record RequirementCheck(
            String platform,
            Version actual,
            Version minimum,
            boolean satisfied,
            String reason) {
    }
}
