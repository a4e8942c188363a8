package com.headcount.controller.rest;

import com.headcount.service.core.catalog.AnalysisCatalog;
import com.headcount.service.core.filter.FilterValueCatalogService;
import com.headcount.service.core.query.SnapshotDates;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Everything a client needs to build an analysis form. */
@RestController
@RequestMapping(path = "/api/analysis", produces = MediaType.APPLICATION_JSON_VALUE)
@Slf4j
public class AnalysisOptionsController {

    private final AnalysisCatalog catalog;
    private final FilterValueCatalogService filterValues;

    public AnalysisOptionsController(AnalysisCatalog catalog, FilterValueCatalogService filterValues) {
        this.catalog = catalog;
        this.filterValues = filterValues;
    }

    @GetMapping("/options")
    public AnalysisOptions options(
            @RequestParam(value = "activeOnly", required = false, defaultValue = "true") boolean activeOnly,
            @RequestParam(value = "snapshotDate", required = false) String snapshotDate) {
        LocalDate snapshot = SnapshotDates.parse(snapshotDate);
        log.debug("GET analysis options: activeOnly={}, snapshotDate={}", activeOnly, snapshot);

        List<Option> metrics = catalog.metrics().stream()
                .map(m -> new Option(m.id(), m.label()))
                .toList();
        List<Option> dimensions = new ArrayList<>();
        catalog.dimensions().forEach(d -> dimensions.add(new Option(d.id(), d.label())));
        dimensions.add(new Option(AnalysisCatalog.TOTAL_GROUP, AnalysisCatalog.TOTAL_GROUP_LABEL));
        List<Option> filterDimensions = catalog.filterableDimensions().stream()
                .map(d -> new Option(d.id(), d.label()))
                .toList();
        return new AnalysisOptions(
                metrics, dimensions, filterDimensions, filterValues.listValues(activeOnly, snapshot));
    }

    public record Option(String id, String label) {}

    public record AnalysisOptions(
            List<Option> metrics,
            List<Option> dimensions,
            List<Option> filterDimensions,
            Map<String, List<String>> filterValues) {}
}
