package com.areakeeper;

import com.areakeeper.dto.AreaAuditResponse;
import com.areakeeper.dto.AreaRequest;
import com.areakeeper.dto.LintRuleResponse;
import com.areakeeper.dto.LintSummaryResponse;
import com.areakeeper.service.corpus.CountryRef;
import io.micronaut.core.type.Argument;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.assertj.core.api.AssertionsForClassTypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@MicronautTest
class LintControllerTest {

    @Inject
    @Client("/")
    HttpClient client;

    private LintSummaryResponse audit;

    private AreaRequest community(String id, String name, Map<String, Object> extra) {
        Map<String, Object> tags = new LinkedHashMap<>();
        tags.put("name", name);
        tags.put("population", 250);
        tags.put("population:date", "2024-06-30");
        tags.putAll(extra);
        return new AreaRequest(id, "community", tags, null, null, null);
    }

    @BeforeEach
    void runAudit() {
        List<AreaRequest> corpus = List.of(
            new AreaRequest("cc-1", "country", Map.of("name", "Freedonia", "geo_json", GeoFixtures.box(0, 0, 10, 10)),
                null, null, null),
            community("10", "Harbor", Map.of("url_alias", "harbor", "geo_json", GeoFixtures.box(1, 1, 2, 2))),
            community("11", "Hills", Map.of("url_alias", "harbor")),
            new AreaRequest("12", "planet", Map.of("name", "Mars"), null, null, null));

        audit = client.toBlocking().retrieve(HttpRequest.POST("/api/v1/lint/audit", corpus),
            LintSummaryResponse.class);
    }

    @Test
    void audit_skipsUnknownTypes() {
        assertThat(audit.totalAllAreas()).isEqualTo(3);
        assertThat(audit.skippedAreaIds()).containsExactly("12");
        assertThat(audit.issuesByRule()).containsEntry("url-alias-clash", 2);
    }

    @Test
    void rules_listsRegistryThenCorpusRule() {
        List<LintRuleResponse> rules = client.toBlocking().retrieve(
            HttpRequest.GET("/api/v1/lint/rules"), Argument.listOf(LintRuleResponse.class));

        assertThat(rules).extracting(LintRuleResponse::id).containsExactly(
            "icon-missing", "icon-legacy-url", "verified-stale", "geometry-missing", "url-alias-clash");
        assertThat(rules).filteredOn(LintRuleResponse::fixable)
            .extracting(LintRuleResponse::id).containsExactly("verified-stale");
        assertThat(rules.get(4).corpusWide()).isTrue();
    }

    @Test
    void results_filteredByRuleAndTag() {
        List<AreaAuditResponse> clashes = client.toBlocking().retrieve(
            HttpRequest.GET("/api/v1/lint/results?rule=url-alias-clash&issuesOnly=true"),
            Argument.listOf(AreaAuditResponse.class));
        List<AreaAuditResponse> harbor = client.toBlocking().retrieve(
            HttpRequest.GET("/api/v1/lint/results?tag=name%3DHa*&tag=url_alias"),
            Argument.listOf(AreaAuditResponse.class));

        assertThat(clashes).extracting(AreaAuditResponse::areaId).containsExactly("10", "11");
        assertThat(harbor).extracting(AreaAuditResponse::areaId).containsExactly("10");
        assertThat(harbor.get(0).countryName()).isEqualTo("Freedonia");
    }

    @Test
    void results_unknownSeverity_returns400() {
        assertThatThrownBy(() ->
            client.toBlocking().exchange(HttpRequest.GET("/api/v1/lint/results?severity=fatal"))
        ).isInstanceOfSatisfying(HttpClientResponseException.class, ex ->
            AssertionsForClassTypes.assertThat(ex.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST)
        );
    }

    @Test
    void summary_bySeverity() {
        LintSummaryResponse summary = client.toBlocking().retrieve(
            HttpRequest.GET("/api/v1/lint/summary?severity=info&type=community"), LintSummaryResponse.class);

        assertThat(summary.totalAreas()).isEqualTo(2);
        assertThat(summary.issuesBySeverity()).containsEntry("info", 1).containsEntry("error", 0);
    }

    @Test
    void tagsAndCountries() {
        List<String> tags = client.toBlocking().retrieve(
            HttpRequest.GET("/api/v1/lint/tags"), Argument.listOf(String.class));
        List<CountryRef> countries = client.toBlocking().retrieve(
            HttpRequest.GET("/api/v1/lint/countries"), Argument.listOf(CountryRef.class));

        assertThat(tags).contains("url_alias").doesNotContain("geo_json");
        assertThat(countries).containsExactly(new CountryRef("cc-1", "Freedonia"));
    }

    @Test
    void invalidateCache_returns204() {
        HttpResponse<?> response = client.toBlocking().exchange(HttpRequest.DELETE("/api/v1/lint/cache/10"));

        AssertionsForClassTypes.assertThat(response.getStatus()).isEqualTo(HttpStatus.NO_CONTENT);
    }
}
