package com.lwcmobile.cli;

import java.util.Locale;

public final class CommandLineUtils {
    public static final String IOS_FLAG = "ios";
    public static final String ANDROID_FLAG = "android";

    private CommandLineUtils() {
    }

    public static boolean isIOSFlag(String input) {
        return input != null && IOS_FLAG.equals(input.toLowerCase(Locale.ROOT));
    }

    public static boolean isAndroidFlag(String input) {
        return input != null && ANDROID_FLAG.equals(input.toLowerCase(Locale.ROOT));
    }

    public static boolean isValidPlatformFlag(String input) {
        return isIOSFlag(input) || isAndroidFlag(input);
    }

    // null or an empty rendering falls back to defaultValue
    public static String resolveFlag(Object flag, String defaultValue) {
        if (flag == null) {
            return defaultValue;
        }
        String resolved = String.valueOf(flag);
        return resolved.isEmpty() ? defaultValue : resolved;
    }
}
