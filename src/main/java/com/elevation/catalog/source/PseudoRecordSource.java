package com.elevation.catalog.source;

import com.elevation.catalog.core.model.ProcessingMetadata;
import com.elevation.catalog.core.model.ProductClass;
import com.elevation.catalog.core.model.SourcePool;
import com.elevation.catalog.core.model.SourceRecord;
import com.elevation.catalog.geo.Geocells;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fallback source that synthesizes strip records from DEM file names when no indexed record exists.
 *
 * <p>Recognized names look like
 * {@code WV01_20200101_1020010012345600_1020010065432100_2m_lsf_seg1_v4.1_dem.tif}:
 * the {@code lsf_} marker flags the alternate variant and the version token is optional.
 * When the parent directory is a geocell name it becomes the spatial partition.
 * Names that do not match are logged and reported through {@link #getUnparsedLocations()}.</p>
 */
public class PseudoRecordSource implements RecordSource {
    private static final Logger log = LoggerFactory.getLogger(PseudoRecordSource.class);

    static final Pattern STRIP_NAME = Pattern.compile(
            "(?<pairname>(?<sensor>[A-Z][A-Z\\d]{2}\\d)_(?<timestamp>\\d{8})_(?<catid1>[A-Z0-9]{16})_(?<catid2>[A-Z0-9]{16}))_"
                    + "(?<res>(\\d+|0\\.\\d+)c?m)_"
                    + "(?<lsf>lsf_)?"
                    + "(?<partnum>[SEG\\d]+)_"
                    + "(v(?<version>[\\d/.]+)_)?"
                    + "dem(_water-masked|_cloud-masked|_cloud-water-masked|_masked)?\\.(tif|jpg)$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern XTRACK_SENSOR = Pattern.compile("[wqg]\\d[wqg]\\d", Pattern.CASE_INSENSITIVE);
    private static final DateTimeFormatter ACQ_DATE = DateTimeFormatter.BASIC_ISO_DATE;
    private static final String DEFAULT_VERSION = "0";

    private final String name;
    private final List<String> locations;
    private final Clock clock;
    private final List<String> unparsed = new ArrayList<>();

    public PseudoRecordSource(String name, Collection<String> locations) {
        this(name, locations, Clock.systemUTC());
    }

    public PseudoRecordSource(String name, Collection<String> locations, Clock clock) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.locations = List.copyOf(locations);
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public SourcePool pool() {
        return SourcePool.PSEUDO;
    }

    @Override
    public synchronized List<SourceRecord> read(ProductClass productClass) {
        if (productClass != ProductClass.STRIP) {
            return List.of();
        }
        unparsed.clear();
        Instant indexedAt = clock.instant();
        List<SourceRecord> records = new ArrayList<>();
        for (String location : locations) {
            Optional<SourceRecord> parsed = parse(location, indexedAt);
            if (parsed.isPresent()) {
                records.add(parsed.get());
            } else {
                unparsed.add(location);
                log.warn("pseudo.name.unrecognized source={} location={}", name, location);
            }
        }
        log.debug("source.read source={} productClass={} records={} unparsed={}",
                name, productClass, records.size(), unparsed.size());
        return records;
    }

    public synchronized List<String> getUnparsedLocations() {
        return List.copyOf(unparsed);
    }

    Optional<SourceRecord> parse(String location, Instant indexedAt) {
        String fileName = fileName(location);
        Matcher m = STRIP_NAME.matcher(fileName);
        if (!m.matches()) {
            return Optional.empty();
        }
        Instant acquired;
        try {
            acquired = LocalDate.parse(m.group("timestamp"), ACQ_DATE).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
        String pairname = m.group("pairname");
        String resolution = m.group("res");
        String sensor = m.group("sensor");
        String version = m.group("version") != null ? m.group("version") : DEFAULT_VERSION;
        String parent = parentName(location);

        ProcessingMetadata metadata = ProcessingMetadata.builder()
                .pairname(pairname)
                .sensors(sensor, sensor)
                .catalogIds(m.group("catid1"), m.group("catid2"))
                .crossTrack(XTRACK_SENSOR.matcher(sensor).matches())
                .algorithmVersion("SETSM")
                .build();

        return Optional.of(SourceRecord.builder()
                .productClass(ProductClass.STRIP)
                .sceneOrStripId(fileName.substring(0, fileName.toLowerCase().indexOf("_dem")))
                .logicalIdentity(pairname + "_" + resolution)
                .version(version)
                .alternateVariant(m.group("lsf") != null)
                .resolution(resolution)
                .location(location)
                .indexedAt(indexedAt)
                .pool(SourcePool.PSEUDO)
                .spatialPartition(Geocells.isGeocell(parent) ? parent : null)
                .acquisition(acquired, acquired)
                .metadata(metadata)
                .build());
    }

    private static String fileName(String location) {
        int slash = Math.max(location.lastIndexOf('/'), location.lastIndexOf('\\'));
        return slash >= 0 ? location.substring(slash + 1) : location;
    }

    private static String parentName(String location) {
        String normalized = location.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        if (slash <= 0) {
            return null;
        }
        String dir = normalized.substring(0, slash);
        return dir.substring(dir.lastIndexOf('/') + 1);
    }
}
