package com.eainde.research.capability;

/**
 * Opaque search backend returning a short text summary for one search request.
 *
 * <p>Calls take seconds and may fail with any unchecked exception. Implementations must
 * be thread-safe: the engine calls them concurrently.</p>
 */
public interface SearchCapability {

    String search(String request);
}
