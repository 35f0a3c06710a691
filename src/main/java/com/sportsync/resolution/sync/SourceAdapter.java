package com.sportsync.resolution.sync;

import com.sportsync.resolution.core.model.SourceRecord;

import java.util.List;

/**
 * Fetches raw records from one external provider.
 */
public interface SourceAdapter {

    /**
     * Name of the source, as it appears on the records it returns.
     */
    String source();

    /**
     * Fetches the current batch of records of one data type ("games", "odds", "player_stats").
     *
     * @throws TransientSourceException on a network failure or retryable provider error
     */
    List<SourceRecord> fetch(String dataType);
}
