package com.areakeeper.dto;

import com.areakeeper.domain.NormalizedRecord;
import com.areakeeper.domain.ValidationError;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

import java.util.List;
import java.util.Map;

@Serdeable
@Schema(description = "Schema validation result; tags are the normalized tags when valid")
public record ValidationResponse(
    String areaId,
    boolean valid,
    List<ValidationError> errors,
    @Nullable Map<String, Object> tags
) {

    public static ValidationResponse of(String areaId, @Nullable NormalizedRecord record, List<ValidationError> errors) {
        return new ValidationResponse(areaId, errors.isEmpty(), errors,
            record != null ? WireTags.of(record.tags()) : null);
    }
}
