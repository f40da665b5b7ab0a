package com.elevation.catalog.canonical;

/**
 * Two candidates that tied on every selection criterion; resolved by the final fallback.
 *
 * @param logicalIdentity identity whose group contained the tie
 * @param kept            the candidate that was kept
 * @param discarded       the candidate that lost the fallback
 * @param criterion       the fallback that decided
 */
public record SelectionConflict(String logicalIdentity, String kept, String discarded, String criterion) {}
