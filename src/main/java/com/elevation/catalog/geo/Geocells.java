package com.elevation.catalog.geo;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * One-degree geocell names such as {@code n67w132}: the cell containing a point,
 * named by the floor of its latitude and longitude.
 */
public final class Geocells {

    private static final Pattern GEOCELL = Pattern.compile("[ns]\\d{2}[ew]\\d{3}");

    private Geocells() {
    }

    public static String of(double lat, double lon) {
        char latLetter = lat >= 0 ? 'n' : 's';
        char lonLetter = lon >= 0 ? 'e' : 'w';
        return String.format(Locale.ROOT, "%c%02d%c%03d",
                latLetter, (int) Math.abs(Math.floor(lat)),
                lonLetter, (int) Math.abs(Math.floor(lon)));
    }

    public static boolean isGeocell(String name) {
        return name != null && GEOCELL.matcher(name).matches();
    }
}
