package com.elevation.catalog.testutil;

import com.elevation.catalog.core.model.Footprint;
import com.elevation.catalog.core.model.ProcessingMetadata;
import com.elevation.catalog.core.model.ProductClass;
import com.elevation.catalog.core.model.ReleasePublication;
import com.elevation.catalog.core.model.SourcePool;
import com.elevation.catalog.core.model.SourceRecord;
import com.elevation.catalog.core.model.UnifiedRecord;

import java.time.Instant;

/**
 * Shared fixtures: a strip pair near geocell {@code n67w132} and a mosaic tile.
 */
public final class TestRecords {

    public static final String PAIR = "WV01_20200101_1020010012345600_1020010065432100";
    public static final String STRIP_IDENTITY = PAIR + "_2m";
    public static final String SEG1 = "SETSM_s2s041_" + PAIR + "_2m_seg1";
    public static final String SEG2 = "SETSM_s2s041_" + PAIR + "_2m_seg2";
    public static final String GEOCELL = "n67w132";
    public static final Instant INDEXED = Instant.parse("2024-01-01T00:00:00Z");
    public static final Instant ACQUIRED = Instant.parse("2020-01-01T21:35:10Z");

    public static final String TILE = "44_74_2_2_2m_v4.1";
    public static final String SUPERTILE = "44_74";

    private TestRecords() {
    }

    public static Footprint box() {
        return Footprint.box(Footprint.WGS84, -131.8, 67.2, -131.4, 67.6);
    }

    public static ProcessingMetadata stripMetadata() {
        return ProcessingMetadata.builder()
                .pairname(PAIR)
                .sensors("WV01", "WV01")
                .catalogIds("1020010012345600", "1020010065432100")
                .algorithmVersion("4.3.11")
                .s2sVersion("4.1")
                .crossTrack(false)
                .rmse(0.42)
                .avgSunElevations(12.5, 12.6)
                .creationDate(Instant.parse("2023-06-01T10:00:00Z"))
                .build();
    }

    public static SourceRecord.Builder strip(String stripId, String version) {
        return SourceRecord.builder()
                .productClass(ProductClass.STRIP)
                .sceneOrStripId(stripId)
                .logicalIdentity(STRIP_IDENTITY)
                .version(version)
                .resolution("2m")
                .location("/mnt/pgc/data/elev/dem/setsm/ArcticDEM/region/" + stripId + "_dem.tif")
                .indexedAt(INDEXED)
                .pool(SourcePool.ON_HAND)
                .spatialPartition(GEOCELL)
                .footprint(box())
                .acquisition(ACQUIRED, ACQUIRED.plusSeconds(30))
                .metadata(stripMetadata());
    }

    public static UnifiedRecord unified(SourceRecord record) {
        return UnifiedRecord.of(record);
    }

    public static SourceRecord.Builder mosaicTile() {
        return SourceRecord.builder()
                .productClass(ProductClass.MOSAIC)
                .sceneOrStripId(TILE)
                .logicalIdentity(TILE)
                .version("4.1")
                .resolution("2m")
                .location("/mnt/pgc/data/elev/dem/setsm/ArcticDEM/mosaic/v4.1/2m/44_74/" + TILE + "_dem.tif")
                .indexedAt(INDEXED)
                .pool(SourcePool.ON_HAND)
                .spatialPartition(SUPERTILE)
                .footprint(Footprint.box("EPSG:3413", -2700000, -1300000, -2650000, -1250000))
                .metadata(ProcessingMetadata.builder()
                        .tile("44_74_2_2")
                        .dataPercent(97.1234567)
                        .creationDate(Instant.parse("2023-03-01T00:00:00Z"))
                        .build());
    }

    public static ReleasePublication stripPublication(String itemId) {
        return new ReleasePublication(itemId, STRIP_IDENTITY, ProductClass.STRIP, "arcticdem", "s2s041",
                "public", Instant.parse("2024-02-01T00:00:00Z"));
    }

    public static ReleasePublication mosaicPublication() {
        return new ReleasePublication(TILE, TILE, ProductClass.MOSAIC, "arcticdem", "4.1",
                "public", Instant.parse("2024-02-01T00:00:00Z"));
    }
}
