package com.intenovation.webmail;

/**
 * Interface for listeners that want to know when messages are cached,
 * skipped or could not be written.
 */
public interface CacheChangeListener {
    /**
     * Called after the cache handled a fetched message.
     * @param event The change event
     */
    void cacheChanged(CacheChangeEvent event);
}
