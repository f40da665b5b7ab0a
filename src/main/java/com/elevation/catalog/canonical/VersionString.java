package com.elevation.catalog.canonical;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A processing version compared as a dot-delimited tuple of integers:
 * {@code 4.10 > 4.2 > 4.1}, {@code 50 > 41}, and missing trailing parts count as zero.
 * A leading {@code v} is ignored. Versions that do not parse rank below every parseable one.
 *
 * <p>The natural order is total: numerically equal versions are ordered by their raw text,
 * so the greatest of a set is always unique.</p>
 */
public final class VersionString implements Comparable<VersionString> {

    private static final Comparator<String> RAW_ORDER = Comparator.nullsFirst(Comparator.naturalOrder());

    private final String raw;
    private final List<Long> parts;

    private VersionString(String raw, List<Long> parts) {
        this.raw = raw;
        this.parts = parts;
    }

    public static VersionString parse(String raw) {
        return new VersionString(raw, parseParts(raw));
    }

    private static List<Long> parseParts(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String text = raw.trim();
        if (text.startsWith("v") || text.startsWith("V")) {
            text = text.substring(1);
        }
        String[] tokens = text.split("\\.", -1);
        List<Long> parsed = new ArrayList<>(tokens.length);
        for (String token : tokens) {
            if (token.isEmpty() || !token.chars().allMatch(Character::isDigit)) {
                return null;
            }
            try {
                parsed.add(Long.parseLong(token));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return Collections.unmodifiableList(parsed);
    }

    public String raw() {
        return raw;
    }

    public boolean isParseable() {
        return parts != null;
    }

    /**
     * Integer parts, or an empty list when unparseable.
     */
    public List<Long> parts() {
        return parts != null ? parts : List.of();
    }

    /**
     * Compares only the integer tuples; unparseable versions are equal to each other and lower than any other.
     */
    public int compareNumeric(VersionString other) {
        if (parts == null || other.parts == null) {
            return Boolean.compare(parts != null, other.parts != null);
        }
        int length = Math.max(parts.size(), other.parts.size());
        for (int i = 0; i < length; i++) {
            long a = i < parts.size() ? parts.get(i) : 0L;
            long b = i < other.parts.size() ? other.parts.get(i) : 0L;
            if (a != b) {
                return Long.compare(a, b);
            }
        }
        return 0;
    }

    @Override
    public int compareTo(VersionString other) {
        int numeric = compareNumeric(other);
        return numeric != 0 ? numeric : RAW_ORDER.compare(raw, other.raw);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VersionString that = (VersionString) o;
        return Objects.equals(raw, that.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(raw);
    }

    @Override
    public String toString() {
        return raw;
    }
}
