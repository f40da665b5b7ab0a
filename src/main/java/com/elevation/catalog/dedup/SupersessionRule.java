package com.elevation.catalog.dedup;

import com.elevation.catalog.core.model.SourcePool;

import java.util.Objects;

/**
 * Drops records of a legacy resolution class whose id also appears in a superseding pool,
 * regardless of variant, unless the record itself comes from that pool.
 *
 * @param resolution      resolution class the rule applies to, e.g. {@code 50cm}
 * @param supersedingPool pool whose ids supersede every other pool's records of that resolution
 */
public record SupersessionRule(String resolution, SourcePool supersedingPool) {

    public SupersessionRule {
        Objects.requireNonNull(resolution, "resolution is required");
        Objects.requireNonNull(supersedingPool, "supersedingPool is required");
    }
}
