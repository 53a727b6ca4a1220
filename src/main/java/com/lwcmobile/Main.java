package com.lwcmobile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.lwcmobile.cli.CommandLineUtils;
import com.lwcmobile.runtime.AppConfig;
import com.lwcmobile.runtime.PlatformRequirementChecker;
import com.lwcmobile.versioning.VersionParseException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "lwc-mobile-check",
        mixinStandardHelpOptions = true,
        version = "lwc-mobile-check 0.1.0",
        description = "Checks a device OS version against the minimum supported for its platform.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_SATISFIED = 0;
    static final int EXIT_BELOW_MINIMUM = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_CONFIG_ERROR = 3;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = { "-p", "--platform" }, description = "Target platform (ios, android); defaults to the configured platform")
    String platform;

    @Option(names = "--os-version", description = "OS version to check, e.g. 13.0.4 or 13-0-4")
    String osVersion;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        log.info("Using config file: {}", configPath);
        AppConfig config;
        try {
            config = loadConfig(Path.of(configPath));
        } catch (IOException e) {
            log.error("Unable to read config file {}", configPath, e);
            return EXIT_CONFIG_ERROR;
        }
        PlatformRequirementChecker checker = new PlatformRequirementChecker(config);
        try {
            checker.validate();
        } catch (IllegalStateException e) {
            log.error("Invalid config file {}: {}", configPath, e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        String resolvedPlatform = CommandLineUtils.resolveFlag(platform, config.getDefaultPlatform());

        if (!CommandLineUtils.isValidPlatformFlag(resolvedPlatform)) {
            log.error("Invalid platform '{}'; expected {} or {}",
                    resolvedPlatform,
                    CommandLineUtils.IOS_FLAG,
                    CommandLineUtils.ANDROID_FLAG);
            return EXIT_USAGE;
        }
        if (osVersion == null || osVersion.isBlank()) {
            log.error("--os-version is required");
            return EXIT_USAGE;
        }

        log.debug("Configured platforms: {}", checker.supportedPlatforms());
        PlatformRequirementChecker.RequirementCheck check;
        try {
            check = checker.check(resolvedPlatform, osVersion);
        } catch (VersionParseException e) {
            log.error("Cannot check platform {}: {}", resolvedPlatform, e.getMessage());
            return EXIT_USAGE;
        }

        log.info("platform={} version={} minimum={} satisfied={} reason={}",
                check.platform(),
                check.actual(),
                check.minimum() == null ? "none" : check.minimum(),
                check.satisfied(),
                check.reason());
        return check.satisfied() ? EXIT_SATISFIED : EXIT_BELOW_MINIMUM;
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
