package com.elevation.catalog.item;

import com.elevation.catalog.config.CatalogOptions;
import com.elevation.catalog.config.CatalogTables;
import com.elevation.catalog.core.model.MosaicInfo;
import com.elevation.catalog.core.model.ProcessingMetadata;
import com.elevation.catalog.core.model.RasterAssetInfo;
import com.elevation.catalog.core.model.ReleasePublication;
import com.elevation.catalog.core.model.SourceRecord;
import com.elevation.catalog.document.Geometry;
import com.elevation.catalog.geo.GeographicReprojector;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assembles the flat property map of an item. Keys outside the common set are namespaced
 * {@code proj:} (raster projection) and {@code pgc:} (processing provenance).
 * Missing joined values are written as nulls.
 */
public class PropertiesAssembler {

    static final DateTimeFormatter DATETIME = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'")
            .withZone(ZoneOffset.UTC);

    private final CatalogOptions options;
    private final CatalogTables tables;

    public PropertiesAssembler(CatalogOptions options, CatalogTables tables) {
        this.options = options;
        this.tables = tables;
    }

    public Map<String, Object> strip(ReleasePublication publication, SourceRecord record, RasterAssetInfo dem) {
        ProcessingMetadata md = record.metadata();
        Map<String, Object> props = common(publication, "strips", md);
        props.put("instruments", Arrays.asList(md.sensor1(), md.sensor2()));
        props.put("constellation", options.getConstellation());
        acquisitionDates(props, record);
        projection(props, dem);

        props.put("pgc:rmse", md.rmse());
        props.put("pgc:is_lsf", record.alternateVariant());
        props.put("pgc:geocell", record.spatialPartition());
        props.put("pgc:pairname", md.pairname());
        props.put("pgc:image_ids", Arrays.asList(md.catalogId1(), md.catalogId2()));
        props.put("pgc:is_xtrack", md.crossTrack());
        props.put("pgc:stripdemid", record.versionedIdentity());
        props.put("pgc:s2s_version", md.s2sVersion());
        props.put("pgc:avg_sun_elevs", Arrays.asList(md.avgSunElevation1(), md.avgSunElevation2()));
        props.put("pgc:setsm_version", md.algorithmVersion());
        props.put("pgc:cloud_area_sqkm", md.cloudAreaSqkm());
        props.put("pgc:valid_area_sqkm", md.validAreaSqkm());
        props.put("pgc:water_area_sqkm", md.waterAreaSqkm());
        props.put("pgc:cloud_area_percent", md.cloudAreaPercent());
        props.put("pgc:valid_area_percent", md.validAreaPercent());
        props.put("pgc:water_area_percent", md.waterAreaPercent());
        props.put("pgc:avg_convergence_angle", md.avgConvergenceAngle());
        props.put("pgc:masked_matchtag_density", md.maskedDensity());
        props.put("pgc:valid_area_matchtag_density", md.validDensity());
        props.put("pgc:avg_expected_height_accuracy", md.avgExpectedHeightAccuracy());
        return props;
    }

    public Map<String, Object> scene(ReleasePublication publication, SourceRecord record, RasterAssetInfo dem) {
        ProcessingMetadata md = record.metadata();
        Map<String, Object> props = common(publication, "scenes", md);
        props.put("instruments", Arrays.asList(md.sensor1(), md.sensor2()));
        props.put("constellation", options.getConstellation());
        acquisitionDates(props, record);
        projection(props, dem);

        props.put("pgc:is_dsp", record.alternateVariant());
        props.put("pgc:geocell", record.spatialPartition());
        props.put("pgc:pairname", md.pairname());
        props.put("pgc:image_ids", Arrays.asList(md.catalogId1(), md.catalogId2()));
        props.put("pgc:scenedemid", record.versionedIdentity());
        props.put("pgc:avg_sun_elevs", Arrays.asList(md.avgSunElevation1(), md.avgSunElevation2()));
        props.put("pgc:setsm_version", md.algorithmVersion());
        props.put("pgc:avg_convergence_angle", md.avgConvergenceAngle());
        props.put("pgc:avg_expected_height_accuracy", md.avgExpectedHeightAccuracy());
        return props;
    }

    public Map<String, Object> mosaic(ReleasePublication publication, SourceRecord record,
                                      RasterAssetInfo dem, MosaicInfo info) {
        ProcessingMetadata md = record.metadata();
        Map<String, Object> props = common(publication, "mosaics", md);
        props.put("constellation", options.getConstellation());
        Instant start = info != null ? info.startDatetime() : null;
        Instant end = info != null ? info.endDatetime() : null;
        props.put("datetime", format(start));
        props.put("start_datetime", format(start));
        props.put("end_datetime", format(end));
        projection(props, dem);

        props.put("pgc:pairname_ids", info != null ? info.pairnameIds() : null);
        props.put("pgc:supertile", record.spatialPartition());
        props.put("pgc:tile", md.tile());
        props.put("pgc:release_version", publication.releaseVersion());
        props.put("pgc:data_perc", md.dataPercent() != null ? GeographicReprojector.round(md.dataPercent()) : null);
        props.put("pgc:num_components", info != null ? info.pairnameIds().size() : null);
        return props;
    }

    /**
     * The {@code gsd} and {@code proj:*} fields of a raster asset info row, all null when the row is missing.
     */
    public static Map<String, Object> projectionFields(RasterAssetInfo info) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("gsd", info != null ? info.gsd() : null);
        fields.put("proj:code", info != null ? info.projCode() : null);
        fields.put("proj:shape", info != null ? info.projShape() : null);
        fields.put("proj:transform", info != null ? info.projTransform() : null);
        fields.put("proj:bbox", info != null ? info.projBbox() : null);
        fields.put("proj:geometry", info != null && info.projGeometry() != null
                ? Geometry.of(info.projGeometry()) : null);
        fields.put("proj:centroid", info != null ? centroid(info) : null);
        return fields;
    }

    private static Map<String, Double> centroid(RasterAssetInfo info) {
        if (info.projCentroid() == null || info.projCentroid().size() != 2) {
            return null;
        }
        Map<String, Double> centroid = new LinkedHashMap<>();
        centroid.put("lat", GeographicReprojector.round(info.projCentroid().get(0)));
        centroid.put("lon", GeographicReprojector.round(info.projCentroid().get(1)));
        return centroid;
    }

    private Map<String, Object> common(ReleasePublication publication, String kind, ProcessingMetadata md) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("title", publication.itemId());
        props.put("created", format(md.creationDate()));
        props.put("license", options.getLicense());
        props.put("published", format(publication.releaseDate()));
        props.put("description", tables.description(kind));
        return props;
    }

    private static void acquisitionDates(Map<String, Object> props, SourceRecord record) {
        Instant start = earliest(record.acquisitionStart(), record.acquisitionEnd());
        Instant end = latest(record.acquisitionStart(), record.acquisitionEnd());
        props.put("datetime", format(start));
        props.put("start_datetime", format(start));
        props.put("end_datetime", format(end));
    }

    private static void projection(Map<String, Object> props, RasterAssetInfo dem) {
        props.putAll(projectionFields(dem));
    }

    static String format(Instant instant) {
        return instant != null ? DATETIME.format(instant) : null;
    }

    private static Instant earliest(Instant a, Instant b) {
        if (a == null || b == null) {
            return a != null ? a : b;
        }
        return a.isBefore(b) ? a : b;
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null || b == null) {
            return a != null ? a : b;
        }
        return a.isAfter(b) ? a : b;
    }
}
