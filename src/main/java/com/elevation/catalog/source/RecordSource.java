package com.elevation.catalog.source;

import com.elevation.catalog.core.model.ProductClass;
import com.elevation.catalog.core.model.SourcePool;
import com.elevation.catalog.core.model.SourceRecord;

import java.util.List;

/**
 * A read-only pool of source records, e.g. an inventory index or a staging import.
 * Implementations must not be mutated by readers and must return the same records on every read.
 */
public interface RecordSource {

    /**
     * Human-readable name used in logs and reports.
     */
    String name();

    SourcePool pool();

    /**
     * Priority of this pool in the overlay; higher wins.
     */
    default int priority() {
        return pool().getDefaultPriority();
    }

    /**
     * Reads every record of the given product class.
     */
    List<SourceRecord> read(ProductClass productClass);
}
