package com.platform.servicehost.model;

import java.util.Locale;

/**
 * How the OS starts the service at boot.
 */
public enum StartMode {
    AUTOMATIC("Automatic"),
    MANUAL("Manual"),
    DISABLED("Disabled");

    private final String configValue;

    StartMode(String configValue) {
        this.configValue = configValue;
    }

    /**
     * Value written to the host-tool configuration.
     */
    public String getConfigValue() {
        return configValue;
    }

    /**
     * Lenient parse; blank or unknown input falls back to AUTOMATIC.
     */
    public static StartMode parse(String value) {
        if (value == null || value.isBlank()) {
            return AUTOMATIC;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "manual" -> MANUAL;
            case "disabled" -> DISABLED;
            default -> AUTOMATIC;
        };
    }
}
