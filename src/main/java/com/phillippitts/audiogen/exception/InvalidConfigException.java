package com.phillippitts.audiogen.exception;

/**
 * Thrown when a configuration value or input contract precondition is violated
 * (e.g., a non-positive chunk length or an unreadable request catalog).
 * This is fatal for the whole run.
 */
public class InvalidConfigException extends AudioGenException {

    private final String setting;

    public InvalidConfigException(String setting, String reason) {
        super("Invalid configuration '" + setting + "': " + reason);
        this.setting = setting;
    }

    public InvalidConfigException(String setting, String reason, Throwable cause) {
        super("Invalid configuration '" + setting + "': " + reason, cause);
        this.setting = setting;
    }

    public String getSetting() {
        return setting;
    }
}
