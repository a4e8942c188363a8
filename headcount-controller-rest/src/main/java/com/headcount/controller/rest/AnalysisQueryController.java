package com.headcount.controller.rest;

import com.headcount.service.core.query.AnalysisQueryService;
import com.headcount.service.core.query.AnalysisRequest;
import com.headcount.service.core.query.AnalysisResult;
import com.headcount.service.core.query.FilterSpec;
import com.headcount.service.core.query.SnapshotDates;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api/analysis", produces = MediaType.APPLICATION_JSON_VALUE)
public class AnalysisQueryController {

    private final AnalysisQueryService queryService;

    public AnalysisQueryController(AnalysisQueryService queryService) {
        this.queryService = queryService;
    }

    @PostMapping(path = "/query", consumes = MediaType.APPLICATION_JSON_VALUE)
    public AnalysisResult query(@RequestBody AnalysisQueryBody body) {
        if (body == null) throw new IllegalArgumentException("analysis request body is required");
        AnalysisRequest request = new AnalysisRequest(
                body.metric(),
                body.groupBy(),
                body.splitBy(),
                toFilterSpec(body.filters()),
                body.activeOnly() == null || body.activeOnly(),
                SnapshotDates.parse(body.snapshotDate()));
        return queryService.execute(request);
    }

    /**
     * A filter value may be a single string, a comma separated string, or an array of strings. Blank
     * entries are ignored.
     */
    static FilterSpec toFilterSpec(Map<String, Object> filters) {
        if (filters == null || filters.isEmpty()) return FilterSpec.empty();
        Map<String, List<String>> normalized = new LinkedHashMap<>();
        filters.forEach((key, raw) -> normalized.put(key, values(raw)));
        return new FilterSpec(normalized);
    }

    private static List<String> values(Object raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) return out;
        if (raw instanceof Collection<?> items) {
            for (Object item : items) {
                if (item == null) continue;
                String v = item.toString().trim();
                if (!v.isEmpty()) out.add(v);
            }
            return out;
        }
        for (String part : raw.toString().split(",")) {
            String v = part.trim();
            if (!v.isEmpty()) out.add(v);
        }
        return out;
    }

    public record AnalysisQueryBody(
            String metric,
            String groupBy,
            String splitBy,
            Map<String, Object> filters,
            Boolean activeOnly,
            String snapshotDate) {}
}
