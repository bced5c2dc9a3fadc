package org.autofetch.sources;

public interface FetchReporter {

    /** A file was retrieved from {@code source} and stored at {@code destination}. */
    void fileComplete(String source, String name, String destination);

    void fileError(String source, String message);
}
