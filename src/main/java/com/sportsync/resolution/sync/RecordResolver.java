package com.sportsync.resolution.sync;

import com.sportsync.resolution.api.ResolutionResult;
import com.sportsync.resolution.core.model.SourceRecord;

/**
 * Resolves one ingested record, whatever its kind.
 */
@FunctionalInterface
public interface RecordResolver {

    ResolutionResult resolve(SourceRecord record);
}
