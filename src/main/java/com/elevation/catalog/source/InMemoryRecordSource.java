package com.elevation.catalog.source;

import com.elevation.catalog.core.model.ProductClass;
import com.elevation.catalog.core.model.SourcePool;
import com.elevation.catalog.core.model.SourceRecord;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Record source backed by a fixed list, e.g. rows already fetched from an inventory database.
 */
public class InMemoryRecordSource implements RecordSource {

    private final String name;
    private final SourcePool pool;
    private final int priority;
    private final List<SourceRecord> records;

    public InMemoryRecordSource(String name, SourcePool pool, List<SourceRecord> records) {
        this(name, pool, pool.getDefaultPriority(), records);
    }

    public InMemoryRecordSource(String name, SourcePool pool, int priority, List<SourceRecord> records) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.pool = Objects.requireNonNull(pool, "pool is required");
        this.priority = priority;
        this.records = List.copyOf(records);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public SourcePool pool() {
        return pool;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public List<SourceRecord> read(ProductClass productClass) {
        return records.stream()
                .filter(r -> r.productClass() == productClass)
                .collect(Collectors.toList());
    }
}
