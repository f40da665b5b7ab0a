package com.elevation.catalog.geo;

import com.elevation.catalog.core.model.Coordinate;
import com.elevation.catalog.core.model.Footprint;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.ProjCoordinate;
import org.locationtech.proj4j.Proj4jException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reprojects footprints into geographic WGS84 ({@code EPSG:4326}, lon/lat order).
 * Transforms are created once per source CRS and reused.
 */
public class GeographicReprojector {

    private static final int DECIMALS = 6;

    private final CRSFactory crsFactory = new CRSFactory();
    private final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();
    private final CoordinateReferenceSystem wgs84 = crsFactory.createFromName(Footprint.WGS84);
    private final Map<String, CoordinateTransform> transforms = new ConcurrentHashMap<>();

    /**
     * Returns the footprint unchanged when already geographic, otherwise a reprojected copy
     * with coordinates rounded to six decimals.
     *
     * @throws IllegalArgumentException if the CRS is unknown to the EPSG registry or a vertex cannot be transformed
     */
    public Footprint toGeographic(Footprint footprint) {
        if (footprint.isGeographic()) {
            return footprint;
        }
        CoordinateTransform transform = transformFor(footprint.crs());
        List<List<Coordinate>> polygons = new ArrayList<>(footprint.polygons().size());
        for (List<Coordinate> ring : footprint.polygons()) {
            List<Coordinate> projected = new ArrayList<>(ring.size());
            for (Coordinate c : ring) {
                ProjCoordinate dst = new ProjCoordinate();
                try {
                    transform.transform(new ProjCoordinate(c.x(), c.y()), dst);
                } catch (Proj4jException e) {
                    throw new IllegalArgumentException("Cannot reproject " + c + " from " + footprint.crs(), e);
                }
                projected.add(Coordinate.of(round(dst.x), round(dst.y)));
            }
            polygons.add(projected);
        }
        return new Footprint(Footprint.WGS84, polygons);
    }

    /**
     * Geographic centroid of the footprint, as the mean of its vertices (closing vertex excluded).
     */
    public Coordinate geographicCenter(Footprint footprint) {
        Footprint geographic = toGeographic(footprint);
        double sumX = 0;
        double sumY = 0;
        int count = 0;
        for (List<Coordinate> ring : geographic.polygons()) {
            for (int i = 0; i < ring.size() - 1; i++) {
                sumX += ring.get(i).x();
                sumY += ring.get(i).y();
                count++;
            }
        }
        return Coordinate.of(sumX / count, sumY / count);
    }

    private CoordinateTransform transformFor(String crs) {
        return transforms.computeIfAbsent(crs, name -> {
            try {
                CoordinateReferenceSystem source = crsFactory.createFromName(name);
                return transformFactory.createTransform(source, wgs84);
            } catch (Proj4jException e) {
                throw new IllegalArgumentException("Unsupported footprint CRS: " + name, e);
            }
        });
    }

    /**
     * Rounds half-up to six decimals.
     */
    public static double round(double value) {
        return BigDecimal.valueOf(value).setScale(DECIMALS, RoundingMode.HALF_UP).doubleValue();
    }
}
