package com.areakeeper.dto;

import com.areakeeper.domain.AreaRecord;
import com.areakeeper.domain.AreaType;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;

@Serdeable
@Schema(description = "Raw area record as held by the external store")
public record AreaRequest(
    @NotBlank
    @Schema(description = "Area id in the external store", example = "1234")
    String id,

    @NotBlank
    @Schema(description = "Area type", allowableValues = {"community", "country"})
    String type,

    @NotNull
    @Schema(description = "Tag mapping; geo_json may be a JSON string or an object")
    Map<String, Object> tags,

    @Nullable OffsetDateTime createdAt,
    @Nullable OffsetDateTime updatedAt,
    @Nullable OffsetDateTime deletedAt
) {

    public Optional<AreaType> areaType() {
        return AreaType.fromTag(type);
    }

    public AreaRecord toRecord(AreaType areaType) {
        return new AreaRecord(id, areaType, tags, createdAt, updatedAt, deletedAt);
    }
}
