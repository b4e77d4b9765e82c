package com.areakeeper.service.validator;

import com.areakeeper.domain.AreaRecord;
import com.areakeeper.domain.FieldSpec;
import com.areakeeper.domain.NormalizedRecord;
import com.areakeeper.domain.ValidationError;
import com.areakeeper.domain.ValueKind;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.areakeeper.domain.NormalizedRecord.AREA_KM2;

/**
 * Validates every known tag of an area against its type's {@link FieldSpec}s.
 *
 * All errors are collected; validation does not stop at the first one. Tags without a field spec
 * pass through untouched. When the geometry is valid, {@code area_km2} is always replaced by the
 * area derived from it, so the two never disagree.
 */
@Singleton
public class SchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

    private final AreaSchemaRegistry registry;
    private final FieldValidator fieldValidator;
    private final GeometryNormalizer geometryNormalizer;

    @Inject
    public SchemaValidator(AreaSchemaRegistry registry,
                           FieldValidator fieldValidator,
                           GeometryNormalizer geometryNormalizer) {
        this.registry = registry;
        this.fieldValidator = fieldValidator;
        this.geometryNormalizer = geometryNormalizer;
    }

    public SchemaValidationResult validate(AreaRecord record) {
        List<FieldSpec> specs = registry.fieldsFor(record.type());
        Map<String, Object> normalized = new LinkedHashMap<>(record.tags());
        List<ValidationError> errors = new ArrayList<>();

        GeometryNormalizer.Outcome geometry = null;
        for (FieldSpec spec : specs) {
            Object raw = record.tags().get(spec.key());
            if (raw == null) {
                normalized.remove(spec.key());
                if (spec.required()) {
                    errors.add(ValidationError.missing(spec.key()));
                }
                continue;
            }

            if (spec.valueKind() == ValueKind.GEOMETRY) {
                geometry = geometryNormalizer.normalize(raw);
                if (geometry.isValid()) {
                    normalized.put(spec.key(), geometry.geometry());
                } else {
                    errors.add(geometry.error().forField(spec.key()));
                }
                continue;
            }

            FieldOutcome outcome = fieldValidator.validate(spec.valueKind(), raw, spec.allowedValues());
            if (outcome.isValid()) {
                normalized.put(spec.key(), outcome.value());
            } else {
                errors.add(outcome.error().forField(spec.key()));
            }
        }

        if (geometry != null && geometry.isValid()) {
            // Derived area wins over whatever was supplied, valid or not.
            errors.removeIf(e -> AREA_KM2.equals(e.field()));
            normalized.put(AREA_KM2, geometry.areaKm2());
        }

        if (!errors.isEmpty()) {
            log.debug("Area {} failed validation with {} error(s)", record.id(), errors.size());
            return SchemaValidationResult.invalid(errors);
        }
        return SchemaValidationResult.valid(new NormalizedRecord(
            record.id(), record.type(), normalized,
            record.createdAt(), record.updatedAt(), record.deletedAt()));
    }
}
