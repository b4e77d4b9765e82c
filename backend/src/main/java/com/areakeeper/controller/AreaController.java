package com.areakeeper.controller;

import com.areakeeper.dto.AreaRequest;
import com.areakeeper.dto.FixResponse;
import com.areakeeper.dto.LintReportResponse;
import com.areakeeper.dto.ValidationResponse;
import com.areakeeper.service.AreaService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.*;
import io.micronaut.validation.Validated;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.inject.Inject;
import jakarta.validation.Valid;

@Controller("/api/v1/areas")
@Validated
@Tag(name = "areas")
public class AreaController {

    @Inject
    AreaService areaService;

    @Post("/validate")
    @Operation(summary = "Validate and normalize an area record")
    public HttpResponse<ValidationResponse> validate(@Valid @Body AreaRequest req) {
        return HttpResponse.ok(areaService.validate(req));
    }

    @Post("/lint")
    @Operation(summary = "Validate an area record and report its lint issues")
    public HttpResponse<LintReportResponse> lint(@Valid @Body AreaRequest req) {
        return HttpResponse.ok(areaService.lint(req));
    }

    @Post("/fix/{ruleId}")
    @Operation(summary = "Apply a lint rule's autofix and return the re-validated record")
    public HttpResponse<FixResponse> fix(String ruleId, @Valid @Body AreaRequest req) {
        return HttpResponse.ok(areaService.applyFix(ruleId, req));
    }
}
