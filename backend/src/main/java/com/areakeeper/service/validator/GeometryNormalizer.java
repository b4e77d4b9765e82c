package com.areakeeper.service.validator;

import com.areakeeper.domain.ErrorKind;
import com.areakeeper.domain.ValidationError;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.Nullable;
import jakarta.inject.Singleton;
import org.locationtech.jts.algorithm.Area;
import org.locationtech.jts.geom.Coordinate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates a GeoJSON Polygon/MultiPolygon boundary, rewinds its rings and derives its surface area.
 *
 * Steps:
 *   1. parse (JSON string or already-parsed object)          → FORMAT_INVALID on failure
 *   2. type must be Polygon or MultiPolygon                     → GEOMETRY_INVALID otherwise
 *   3. rings closed, ≥ 4 positions, finite lon/lat in range,
 *      no edge longer than 180° of longitude (antimeridian)    → GEOMETRY_INVALID otherwise
 *   4. exterior rings counter-clockwise, holes clockwise (right-hand rule)
 *   5. area on the WGS84 ellipsoid via {@link AlbersEqualArea}, in km², rounded half-up to 2 places
 *
 * Applying it to its own output yields the same geometry and area.
 */
@Singleton
public class GeometryNormalizer {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String POLYGON = "Polygon";
    private static final String MULTI_POLYGON = "MultiPolygon";

    /** Rewound geometry and derived area, or the reason the input was rejected. */
    public record Outcome(
        @Nullable Map<String, Object> geometry,
        @Nullable BigDecimal areaKm2,
        @Nullable ValidationError error
    ) {
        static Outcome ok(Map<String, Object> geometry, BigDecimal areaKm2) {
            return new Outcome(geometry, areaKm2, null);
        }

        static Outcome fail(ErrorKind kind, String message) {
            return new Outcome(null, null, new ValidationError(FieldOutcome.UNATTRIBUTED, kind, message));
        }

        public boolean isValid() {
            return error == null;
        }
    }

    /** Thrown internally while walking the coordinate tree; never escapes {@link #normalize}. */
    private static final class InvalidGeometry extends Exception {
        InvalidGeometry(String message) {
            super(message, null, false, false);
        }
    }

    public Outcome normalize(@Nullable Object raw) {
        JsonNode root;
        try {
            root = parse(raw);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return Outcome.fail(ErrorKind.FORMAT_INVALID, "Invalid JSON format");
        }
        if (root == null || !root.isObject()) {
            return Outcome.fail(ErrorKind.FORMAT_INVALID, "Invalid GeoJSON: must be a JSON object");
        }

        String type = root.path("type").asText("");
        if (!POLYGON.equals(type) && !MULTI_POLYGON.equals(type)) {
            return Outcome.fail(ErrorKind.GEOMETRY_INVALID,
                "Invalid GeoJSON: only Polygon and MultiPolygon types are accepted, got '" + type + "'");
        }

        List<List<double[][]>> polygons;
        try {
            polygons = readPolygons(type, root.get("coordinates"));
        } catch (InvalidGeometry e) {
            return Outcome.fail(ErrorKind.GEOMETRY_INVALID, "Invalid GeoJSON: " + e.getMessage());
        }

        polygons.forEach(GeometryNormalizer::rewind);
        BigDecimal areaKm2 = BigDecimal.valueOf(areaSquareMeters(polygons) / 1_000_000.0)
            .setScale(2, RoundingMode.HALF_UP);
        return Outcome.ok(toGeoJson(root, type, polygons), areaKm2);
    }

    // ── Parsing & structural checks ─────────────────────────────────────────

    @Nullable
    private JsonNode parse(@Nullable Object raw) throws JsonProcessingException {
        if (raw == null) return null;
        if (raw instanceof JsonNode node) return node;
        if (raw instanceof String s) return MAPPER.readTree(s);
        return MAPPER.valueToTree(raw);
    }

    private List<List<double[][]>> readPolygons(String type, @Nullable JsonNode coordinates) throws InvalidGeometry {
        if (coordinates == null || !coordinates.isArray()) {
            throw new InvalidGeometry("coordinates must be an array");
        }
        if (coordinates.isEmpty()) {
            throw new InvalidGeometry("geometry is empty");
        }
        List<List<double[][]>> polygons = new ArrayList<>();
        if (POLYGON.equals(type)) {
            polygons.add(readPolygon(coordinates));
        } else {
            for (JsonNode polygon : coordinates) {
                if (!polygon.isArray() || polygon.isEmpty()) {
                    throw new InvalidGeometry("MultiPolygon contains an empty polygon");
                }
                polygons.add(readPolygon(polygon));
            }
        }
        return polygons;
    }

    private List<double[][]> readPolygon(JsonNode rings) throws InvalidGeometry {
        if (!rings.isArray() || rings.isEmpty()) {
            throw new InvalidGeometry("polygon has no rings");
        }
        List<double[][]> result = new ArrayList<>();
        for (JsonNode ring : rings) {
            result.add(readRing(ring));
        }
        return result;
    }

    private double[][] readRing(JsonNode ring) throws InvalidGeometry {
        if (!ring.isArray() || ring.size() < 4) {
            throw new InvalidGeometry("each ring needs at least 4 positions");
        }
        double[][] positions = new double[ring.size()][];
        for (int i = 0; i < ring.size(); i++) {
            positions[i] = readPosition(ring.get(i));
            if (i > 0 && Math.abs(positions[i][0] - positions[i - 1][0]) > 180) {
                throw new InvalidGeometry("ring crosses the antimeridian");
            }
        }
        double[] first = positions[0];
        double[] last = positions[positions.length - 1];
        if (first[0] != last[0] || first[1] != last[1]) {
            throw new InvalidGeometry("ring is not closed");
        }
        if (Area.ofRingSigned(toCoordinates(positions)) == 0) {
            throw new InvalidGeometry("ring has zero area");
        }
        return positions;
    }

    private double[] readPosition(JsonNode position) throws InvalidGeometry {
        if (!position.isArray() || position.size() < 2) {
            throw new InvalidGeometry("position must be an array of at least 2 numbers");
        }
        double[] values = new double[position.size()];
        for (int i = 0; i < position.size(); i++) {
            JsonNode value = position.get(i);
            if (!value.isNumber() || !Double.isFinite(value.asDouble())) {
                throw new InvalidGeometry("coordinates must be finite numbers");
            }
            values[i] = value.asDouble();
        }
        if (values[0] < -180 || values[0] > 180) {
            throw new InvalidGeometry("longitude out of range [-180, 180]: " + values[0]);
        }
        if (values[1] < -90 || values[1] > 90) {
            throw new InvalidGeometry("latitude out of range [-90, 90]: " + values[1]);
        }
        return values;
    }

    // ── Winding ─────────────────────────────────────────────────────────────

    /** Exterior ring counter-clockwise, holes clockwise. JTS signed area is positive for CW rings. */
    private static void rewind(List<double[][]> polygon) {
        for (int i = 0; i < polygon.size(); i++) {
            double[][] ring = polygon.get(i);
            boolean clockwise = Area.ofRingSigned(toCoordinates(ring)) > 0;
            boolean exterior = i == 0;
            if (exterior == clockwise) {
                polygon.set(i, reversed(ring));
            }
        }
    }

    private static double[][] reversed(double[][] ring) {
        double[][] copy = new double[ring.length][];
        for (int i = 0; i < ring.length; i++) {
            copy[i] = ring[ring.length - 1 - i];
        }
        return copy;
    }

    // ── Area ────────────────────────────────────────────────────────────────

    private static double areaSquareMeters(List<List<double[][]>> polygons) {
        double minLat = Double.POSITIVE_INFINITY;
        double maxLat = Double.NEGATIVE_INFINITY;
        double minLon = Double.POSITIVE_INFINITY;
        double maxLon = Double.NEGATIVE_INFINITY;
        for (List<double[][]> polygon : polygons) {
            for (double[] p : polygon.get(0)) {
                minLon = Math.min(minLon, p[0]);
                maxLon = Math.max(maxLon, p[0]);
                minLat = Math.min(minLat, p[1]);
                maxLat = Math.max(maxLat, p[1]);
            }
        }
        AlbersEqualArea projection = new AlbersEqualArea(minLat, maxLat, (minLon + maxLon) / 2);

        double total = 0;
        for (List<double[][]> polygon : polygons) {
            double area = Area.ofRing(project(projection, polygon.get(0)));
            for (int i = 1; i < polygon.size(); i++) {
                area -= Area.ofRing(project(projection, polygon.get(i)));
            }
            total += Math.max(0, area);
        }
        return total;
    }

    private static Coordinate[] project(AlbersEqualArea projection, double[][] ring) {
        Coordinate[] projected = new Coordinate[ring.length];
        for (int i = 0; i < ring.length; i++) {
            projected[i] = projection.project(ring[i][0], ring[i][1]);
        }
        return projected;
    }

    private static Coordinate[] toCoordinates(double[][] ring) {
        Coordinate[] coordinates = new Coordinate[ring.length];
        for (int i = 0; i < ring.length; i++) {
            coordinates[i] = new Coordinate(ring[i][0], ring[i][1]);
        }
        return coordinates;
    }

    // ── Output ──────────────────────────────────────────────────────────────

    @SuppressWarnings("unchecked")
    private Map<String, Object> toGeoJson(JsonNode root, String type, List<List<double[][]>> polygons) {
        Map<String, Object> geometry = new LinkedHashMap<>();
        geometry.put("type", type);
        geometry.put("coordinates", POLYGON.equals(type) ? polygonToList(polygons.get(0)) : polygons.stream()
            .map(GeometryNormalizer::polygonToList)
            .toList());
        Map<String, Object> members = MAPPER.convertValue(root, LinkedHashMap.class);
        members.forEach(geometry::putIfAbsent);
        return geometry;
    }

    private static List<List<List<Double>>> polygonToList(List<double[][]> polygon) {
        List<List<List<Double>>> rings = new ArrayList<>();
        for (double[][] ring : polygon) {
            List<List<Double>> positions = new ArrayList<>();
            for (double[] p : ring) {
                List<Double> position = new ArrayList<>();
                for (double v : p) position.add(v);
                positions.add(position);
            }
            rings.add(positions);
        }
        return rings;
    }
}
