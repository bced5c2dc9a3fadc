package org.autofetch.sources;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Descriptor of a job's source: implementation class name plus its configured properties.
 * This is what crosses the process boundary to a worker.
 */
public record DataSourceSpec(String type, Map<String, String> properties) {

    public DataSourceSpec {
        Objects.requireNonNull(type, "type");
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    @Override
    public String toString() {
        // property values may hold credentials
        return type + new TreeMap<>(properties).keySet();
    }
}
