package com.elevation.catalog.config;

import com.elevation.catalog.document.CatalogJson;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Fixed lookup tables of the catalog: collection id templates and titles, domain titles,
 * descriptions, providers and per-collection asset profiles.
 * Loaded once from the {@value #RESOURCE} classpath resource and never mutated.
 */
public record CatalogTables(
        List<String> stacExtensions,
        Map<String, String> collectionTemplates,
        Map<String, String> domainTitles,
        Map<String, String> collectionTitles,
        Map<String, String> descriptions,
        List<Provider> providers,
        Map<String, List<AssetDefinition>> assetProfiles,
        List<ProfileRule> profileRules
) {
    public static final String RESOURCE = "catalog-tables.json";

    public CatalogTables {
        stacExtensions = stacExtensions != null ? List.copyOf(stacExtensions) : List.of();
        collectionTemplates = Map.copyOf(collectionTemplates);
        domainTitles = domainTitles != null ? Map.copyOf(domainTitles) : Map.of();
        collectionTitles = collectionTitles != null ? Map.copyOf(collectionTitles) : Map.of();
        descriptions = descriptions != null ? Map.copyOf(descriptions) : Map.of();
        providers = providers != null ? List.copyOf(providers) : List.of();
        assetProfiles = Map.copyOf(assetProfiles);
        profileRules = List.copyOf(profileRules);
        for (ProfileRule rule : profileRules) {
            if (!assetProfiles.containsKey(rule.profile())) {
                throw new IllegalArgumentException("profile rule references unknown profile: " + rule.profile());
            }
        }
    }

    /**
     * Returns the tables bundled with the library.
     */
    public static CatalogTables defaults() {
        return Holder.DEFAULTS;
    }

    /**
     * @throws IllegalArgumentException if the tables are inconsistent
     */
    public static CatalogTables load(InputStream input) {
        try (InputStream in = input) {
            return CatalogJson.mapper().readValue(in, CatalogTables.class);
        } catch (ValueInstantiationException e) {
            throw new IllegalArgumentException("Invalid catalog tables: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read catalog tables", e);
        }
    }

    public String collectionTemplate(String kind) {
        String template = collectionTemplates.get(kind);
        if (template == null) {
            throw new IllegalArgumentException("No collection template for kind: " + kind);
        }
        return template;
    }

    public String domainTitle(String domain) {
        String title = domainTitles.get(domain);
        if (title != null) {
            return title;
        }
        return domain.isEmpty() ? domain : domain.substring(0, 1).toUpperCase(Locale.ROOT) + domain.substring(1);
    }

    /**
     * Title of a resolution collection; derived from its id parts when not listed.
     */
    public String collectionTitle(String collectionId, String domain, String kind, String release, String resolution) {
        String title = collectionTitles.get(collectionId);
        if (title != null) {
            return title;
        }
        String kindTitle = kind.substring(0, 1).toUpperCase(Locale.ROOT) + kind.substring(1);
        String version = release.startsWith("v") ? release.substring(1) : release;
        return domainTitle(domain) + " " + resolution + " DEM " + kindTitle + ", version " + version;
    }

    public String kindTitle(String domain, String kind) {
        return domainTitle(domain) + " " + kind;
    }

    public String releaseTitle(String domain, String kind, String release) {
        return kindTitle(domain, kind) + " " + release;
    }

    /**
     * Title of a spatial partition: {@code Tile Catalog 44_74} for mosaic supertiles,
     * {@code Geocell n67w132} otherwise.
     */
    public String partitionTitle(String kind, String partition) {
        return ("mosaics".equals(kind) ? "Tile Catalog " : "Geocell ") + partition;
    }

    public String description(String kind) {
        return descriptions.get(kind);
    }

    /**
     * Asset definitions for one collection, filtered to the project.
     * The first matching profile rule wins.
     */
    public List<AssetDefinition> assetsFor(String project, String kind, String release, String resolution) {
        for (ProfileRule rule : profileRules) {
            if (rule.matches(project, kind, release, resolution)) {
                return assetProfiles.get(rule.profile()).stream()
                        .filter(a -> a.appliesTo(project))
                        .collect(Collectors.toList());
            }
        }
        throw new IllegalArgumentException("No asset profile for " + project + "/" + kind + "/" + release + "/" + resolution);
    }

    /**
     * Selects an asset profile; null fields match anything.
     */
    public record ProfileRule(String project, String kind, String release, String resolution, String profile) {
        boolean matches(String project, String kind, String release, String resolution) {
            return (this.project == null || this.project.equals(project))
                    && (this.kind == null || this.kind.equals(kind))
                    && (this.release == null || this.release.equals(release))
                    && (this.resolution == null || this.resolution.equals(resolution));
        }
    }

    public record Provider(String name, String description, List<String> roles, String url) {}

    private static final class Holder {
        private static final CatalogTables DEFAULTS = loadBundled();

        private static CatalogTables loadBundled() {
            InputStream in = CatalogTables.class.getClassLoader().getResourceAsStream(RESOURCE);
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            return load(in);
        }
    }
}
