package com.areakeeper;

import java.util.List;
import java.util.Map;

/** GeoJSON fixtures shared by the geometry, schema and corpus tests. */
final class GeoFixtures {

    private GeoFixtures() {}

    /** Axis-aligned box, exterior ring counter-clockwise. */
    static Map<String, Object> box(double minLon, double minLat, double maxLon, double maxLat) {
        return Map.of("type", "Polygon", "coordinates", List.of(List.of(
            List.of(minLon, minLat), List.of(maxLon, minLat), List.of(maxLon, maxLat),
            List.of(minLon, maxLat), List.of(minLon, minLat))));
    }

    /** Same box with its exterior ring wound clockwise. */
    static Map<String, Object> clockwiseBox(double minLon, double minLat, double maxLon, double maxLat) {
        return Map.of("type", "Polygon", "coordinates", List.of(List.of(
            List.of(minLon, minLat), List.of(minLon, maxLat), List.of(maxLon, maxLat),
            List.of(maxLon, minLat), List.of(minLon, minLat))));
    }

    static String clockwiseBoxJson(double minLon, double minLat, double maxLon, double maxLat) {
        return "{\"type\":\"Polygon\",\"coordinates\":[[["
            + minLon + "," + minLat + "],[" + minLon + "," + maxLat + "],["
            + maxLon + "," + maxLat + "],[" + maxLon + "," + minLat + "],["
            + minLon + "," + minLat + "]]]}";
    }
}
