package com.areakeeper.dto;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders normalized tag values in their JSON form (dates as {@code YYYY-MM-DD}).
 */
final class WireTags {

    private WireTags() {}

    static Map<String, Object> of(Map<String, Object> tags) {
        Map<String, Object> wire = new LinkedHashMap<>();
        tags.forEach((k, v) -> wire.put(k, value(v)));
        return wire;
    }

    private static Object value(Object v) {
        if (v instanceof LocalDate date) {
            return date.toString();
        }
        if (v instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            map.forEach((k, inner) -> nested.put(String.valueOf(k), value(inner)));
            return nested;
        }
        if (v instanceof List<?> list) {
            List<Object> items = new ArrayList<>(list.size());
            list.forEach(item -> items.add(value(item)));
            return items;
        }
        return v;
    }
}
