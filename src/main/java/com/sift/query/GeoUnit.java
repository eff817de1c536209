package com.sift.query;

import java.util.Locale;

/**
 * Distance units accepted by geo filters
 */
public enum GeoUnit {
    M,
    KM,
    MI,
    FT;

    public String getKeyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a unit given as an enum constant or its case-insensitive name
     */
    public static GeoUnit from(Object value) {
        if (value instanceof GeoUnit) {
            return (GeoUnit) value;
        }
        return GeoUnit.valueOf(String.valueOf(value).toUpperCase(Locale.ROOT));
    }
}
