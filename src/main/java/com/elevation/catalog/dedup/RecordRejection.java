package com.elevation.catalog.dedup;

import com.elevation.catalog.core.model.SourceRecord;

/**
 * A source record excluded from the unified pool because it was malformed.
 *
 * @param sourceName name of the adapter the record came from
 * @param record     the rejected record
 * @param reason     why it was rejected
 */
public record RecordRejection(String sourceName, SourceRecord record, String reason) {}
