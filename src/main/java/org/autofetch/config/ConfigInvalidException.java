package org.autofetch.config;

/**
 * Configuration could not be loaded or failed validation.
 * Fatal at startup; on a live reload the daemon keeps its previous schedule.
 */
public class ConfigInvalidException extends Exception {

    public ConfigInvalidException(String message) {
        super(message);
    }

    public ConfigInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
