package com.elevation.catalog.dedup;

import com.elevation.catalog.core.model.SourcePool;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Options for the union and deduplication engine.
 */
public class DedupOptions {

    private final List<SupersessionRule> supersessionRules;
    private final boolean collapseWithinPools;

    private DedupOptions(Builder builder) {
        this.supersessionRules = List.copyOf(builder.supersessionRules);
        this.collapseWithinPools = builder.collapseWithinPools;
    }

    public List<SupersessionRule> getSupersessionRules() {
        return supersessionRules;
    }

    public boolean isCollapseWithinPools() {
        return collapseWithinPools;
    }

    /**
     * Default options: 50cm records are superseded by the cloud-delivery index.
     */
    public static DedupOptions defaults() {
        return builder().build();
    }

    /**
     * Options without any supersession pass.
     */
    public static DedupOptions withoutSupersession() {
        return builder().clearSupersessionRules().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<SupersessionRule> supersessionRules =
                new ArrayList<>(List.of(new SupersessionRule("50cm", SourcePool.CLOUD_DELIVERY)));
        private boolean collapseWithinPools = true;

        public Builder supersessionRule(SupersessionRule rule) {
            supersessionRules.add(Objects.requireNonNull(rule, "rule is required"));
            return this;
        }

        public Builder clearSupersessionRules() {
            supersessionRules.clear();
            return this;
        }

        /**
         * When disabled, duplicate keys inside one pool are an error reported as rejections
         * instead of being collapsed by the tie-break.
         */
        public Builder collapseWithinPools(boolean collapseWithinPools) {
            this.collapseWithinPools = collapseWithinPools;
            return this;
        }

        public DedupOptions build() {
            return new DedupOptions(this);
        }
    }
}
