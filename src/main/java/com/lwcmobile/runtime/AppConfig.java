package com.lwcmobile.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.lwcmobile.cli.CommandLineUtils;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private String defaultPlatform = CommandLineUtils.IOS_FLAG;
    private Map<String, PlatformConfig> platforms = new LinkedHashMap<>();

    public String getDefaultPlatform() {
        return defaultPlatform;
    }

    public void setDefaultPlatform(String defaultPlatform) {
        this.defaultPlatform = defaultPlatform == null ? CommandLineUtils.IOS_FLAG : defaultPlatform;
    }

    public Map<String, PlatformConfig> getPlatforms() {
        return platforms;
    }

    public void setPlatforms(Map<String, PlatformConfig> platforms) {
        this.platforms = platforms == null ? new LinkedHashMap<>() : platforms;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PlatformConfig {
        private String minimumOsVersion;

        public String getMinimumOsVersion() {
            return minimumOsVersion;
        }

        public void setMinimumOsVersion(String minimumOsVersion) {
            this.minimumOsVersion = minimumOsVersion;
        }
    }
}
