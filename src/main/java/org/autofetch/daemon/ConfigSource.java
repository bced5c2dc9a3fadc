package org.autofetch.daemon;

import org.autofetch.config.ConfigInvalidException;
import org.autofetch.config.FetchConfig;

/**
 * Supplies the current configuration on startup and on every reload.
 */
@FunctionalInterface
public interface ConfigSource {

    FetchConfig load() throws ConfigInvalidException;
}
