package com.lwcmobile.versioning;

public class VersionParseException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final String input;

    public VersionParseException(String input) {
        super("Invalid version string: " + input);
        this.input = input;
    }

    public VersionParseException(String input, Throwable cause) {
        super("Invalid version string: " + input, cause);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
