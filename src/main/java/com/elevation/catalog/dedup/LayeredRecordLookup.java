package com.elevation.catalog.dedup;

import com.elevation.catalog.core.model.RecordKey;
import com.elevation.catalog.core.model.UnifiedRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Ordered list of record layers queried highest priority first; the first layer holding a key wins.
 * Lower-priority records with the same key are never merged into the winner.
 */
public class LayeredRecordLookup {

    private final List<Layer> layers;

    public LayeredRecordLookup(List<Layer> layers) {
        List<Layer> ordered = new ArrayList<>(layers);
        // stable sort keeps registration order among equal priorities
        ordered.sort(Comparator.comparingInt(Layer::priority).reversed());
        this.layers = List.copyOf(ordered);
    }

    public Optional<Hit> lookup(RecordKey key) {
        for (Layer layer : layers) {
            UnifiedRecord record = layer.records().get(key);
            if (record != null) {
                return Optional.of(new Hit(layer.name(), record));
            }
        }
        return Optional.empty();
    }

    /**
     * Every key held by any layer, in key order.
     */
    public SortedSet<RecordKey> keys() {
        SortedSet<RecordKey> keys = new TreeSet<>();
        for (Layer layer : layers) {
            keys.addAll(layer.records().keySet());
        }
        return keys;
    }

    /**
     * Number of records hidden behind a higher-priority layer.
     */
    public long shadowedCount() {
        long total = layers.stream().mapToLong(l -> l.records().size()).sum();
        return total - keys().size();
    }

    public List<Layer> layers() {
        return layers;
    }

    /**
     * One pool's records, already unique per key.
     */
    public record Layer(String name, int priority, Map<RecordKey, UnifiedRecord> records) {
        public Layer {
            Objects.requireNonNull(name, "name is required");
            records = Map.copyOf(records);
        }
    }

    public record Hit(String layerName, UnifiedRecord record) {}
}
