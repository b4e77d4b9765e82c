package com.areakeeper.service.validator;

import com.areakeeper.domain.AreaType;
import com.areakeeper.domain.FieldSpec;
import com.areakeeper.domain.ValueKind;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.areakeeper.domain.FieldSpec.optional;
import static com.areakeeper.domain.FieldSpec.required;

/**
 * Known tags per {@link AreaType}. Built once; the returned lists are immutable.
 *
 * Area type → required tags:
 *   community → name, population, population:date
 *   country   → name
 */
@Singleton
public class AreaSchemaRegistry {

    public static final List<String> CONTINENTS = List.of(
        "africa", "asia", "europe", "north-america", "oceania", "south-america");

    private static final List<String> CONTACT_URLS = List.of(
        "twitter", "website", "telegram", "signal", "whatsapp", "meetup", "discord", "instagram",
        "youtube", "facebook", "linkedin", "rss", "github", "matrix", "geyser");

    private final Map<AreaType, List<FieldSpec>> specs = new EnumMap<>(AreaType.class);

    public AreaSchemaRegistry() {
        specs.put(AreaType.COMMUNITY, List.copyOf(communityFields()));
        specs.put(AreaType.COUNTRY, List.copyOf(countryFields()));
    }

    public List<FieldSpec> fieldsFor(AreaType type) {
        return specs.get(type);
    }

    private static List<FieldSpec> communityFields() {
        List<FieldSpec> fields = new ArrayList<>();
        fields.add(required("name", ValueKind.TEXT));
        fields.add(required("population", ValueKind.INTEGER));
        fields.add(required("population:date", ValueKind.DATE));
        fields.add(optional("url_alias", ValueKind.TEXT));
        fields.add(FieldSpec.select("continent", false, CONTINENTS));
        fields.add(optional("icon:square", ValueKind.TEXT));
        fields.add(optional("geo_json", ValueKind.GEOMETRY));
        fields.add(optional("area_km2", ValueKind.NUMBER));
        fields.add(optional("verified:date", ValueKind.DATE));
        fields.add(optional("organization", ValueKind.TEXT));
        fields.add(optional("language", ValueKind.TEXT));
        fields.add(optional("description", ValueKind.TEXT));
        fields.add(optional("contact:email", ValueKind.EMAIL));
        fields.add(optional("contact:phone", ValueKind.PHONE));
        fields.add(optional("contact:nostr", ValueKind.TEXT));
        for (String network : CONTACT_URLS) {
            fields.add(optional("contact:" + network, ValueKind.URL));
        }
        fields.add(optional("tips:lightning_address", ValueKind.TEXT));
        return fields;
    }

    private static List<FieldSpec> countryFields() {
        return List.of(
            required("name", ValueKind.TEXT),
            optional("population", ValueKind.INTEGER),
            optional("capital", ValueKind.TEXT),
            optional("url_alias", ValueKind.TEXT),
            optional("icon:square", ValueKind.TEXT),
            optional("geo_json", ValueKind.GEOMETRY),
            optional("area_km2", ValueKind.NUMBER),
            optional("verified:date", ValueKind.DATE)
        );
    }
}
