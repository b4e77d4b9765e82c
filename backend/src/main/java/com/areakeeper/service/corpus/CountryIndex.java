package com.areakeeper.service.corpus;

import com.areakeeper.domain.AreaType;
import com.areakeeper.domain.NormalizedRecord;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.index.strtree.STRtree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Spatial index of country boundaries for centroid-in-polygon lookups.
 * Only normalized (already validated and rewound) geometries are indexed.
 */
final class CountryIndex {

    private static final Logger log = LoggerFactory.getLogger(CountryIndex.class);
    private static final GeometryFactory FACTORY = new GeometryFactory();

    record Country(String id, String name, Geometry boundary) {}

    private final STRtree tree = new STRtree();
    private final int size;

    private CountryIndex(List<NormalizedRecord> countries) {
        int indexed = 0;
        for (NormalizedRecord country : countries) {
            Optional<Geometry> boundary = country.tag(NormalizedRecord.GEO_JSON).flatMap(CountryIndex::toGeometry);
            if (boundary.isEmpty()) continue;
            if (!boundary.get().isValid()) {
                log.warn("Skipping country {}: boundary is not a valid polygon", country.id());
                continue;
            }
            String name = country.text("name").orElse("Unknown");
            tree.insert(boundary.get().getEnvelopeInternal(), new Country(country.id(), name, boundary.get()));
            indexed++;
        }
        tree.build();
        this.size = indexed;
        log.info("Country index: {}/{} countries have a usable boundary", indexed, countries.size());
    }

    static CountryIndex build(List<NormalizedRecord> records) {
        return new CountryIndex(records.stream().filter(r -> r.type() == AreaType.COUNTRY).toList());
    }

    int size() {
        return size;
    }

    /** Country whose boundary contains the centroid of {@code geoJson}. */
    Optional<Country> locate(Object geoJson) {
        if (size == 0) return Optional.empty();
        Optional<Geometry> geometry = toGeometry(geoJson);
        if (geometry.isEmpty()) return Optional.empty();

        Point centroid = geometry.get().getCentroid();
        for (Object candidate : tree.query(centroid.getEnvelopeInternal())) {
            Country country = (Country) candidate;
            if (country.boundary().contains(centroid)) {
                return Optional.of(country);
            }
        }
        return Optional.empty();
    }

    // ── GeoJSON → JTS ───────────────────────────────────────────────────────

    @SuppressWarnings("unchecked")
    static Optional<Geometry> toGeometry(Object geoJson) {
        if (!(geoJson instanceof Map<?, ?> map)) return Optional.empty();
        Object coordinates = map.get("coordinates");
        if (!(coordinates instanceof List<?> list)) return Optional.empty();
        if ("Polygon".equals(map.get("type"))) {
            return Optional.of(polygon((List<List<List<Number>>>) list));
        }
        if ("MultiPolygon".equals(map.get("type"))) {
            List<List<List<List<Number>>>> parts = (List<List<List<List<Number>>>>) list;
            Polygon[] polygons = parts.stream().map(CountryIndex::polygon).toArray(Polygon[]::new);
            return Optional.of(FACTORY.createMultiPolygon(polygons));
        }
        return Optional.empty();
    }

    private static Polygon polygon(List<List<List<Number>>> rings) {
        LinearRing shell = ring(rings.get(0));
        LinearRing[] holes = rings.subList(1, rings.size()).stream()
            .map(CountryIndex::ring)
            .toArray(LinearRing[]::new);
        return FACTORY.createPolygon(shell, holes);
    }

    private static LinearRing ring(List<List<Number>> positions) {
        Coordinate[] coordinates = positions.stream()
            .map(p -> new Coordinate(p.get(0).doubleValue(), p.get(1).doubleValue()))
            .toArray(Coordinate[]::new);
        return FACTORY.createLinearRing(coordinates);
    }
}
