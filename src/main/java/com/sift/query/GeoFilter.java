package com.sift.query;

import java.util.List;

/**
 * Radius filter around a point on a GEO field
 */
public final class GeoFilter {
    private final String field;
    private final double longitude;
    private final double latitude;
    private final double radius;
    private final GeoUnit unit;

    public GeoFilter(String field, double longitude, double latitude, double radius, GeoUnit unit) {
        this.field = field;
        this.longitude = longitude;
        this.latitude = latitude;
        this.radius = radius;
        this.unit = unit;
    }

    public String getField() {
        return field;
    }

    public double getLongitude() {
        return longitude;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getRadius() {
        return radius;
    }

    public GeoUnit getUnit() {
        return unit;
    }

    /**
     * Query-text form, e.g. {@code @home:[-122.4 37.7 10 km]}
     */
    public String toQueryText() {
        return "@" + field + ":[" + QuerySyntax.literal(longitude) + " " + QuerySyntax.literal(latitude)
                + " " + QuerySyntax.literal(radius) + " " + unit.getKeyword() + "]";
    }

    public List<String> serialize() {
        return List.of("GEOFILTER", field, QuerySyntax.literal(longitude), QuerySyntax.literal(latitude),
                QuerySyntax.literal(radius), unit.getKeyword());
    }
}
