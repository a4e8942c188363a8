package com.headcount.service.core.filter;

import com.headcount.service.core.catalog.AnalysisCatalog;
import com.headcount.service.core.catalog.DimensionDefinition;
import com.headcount.service.core.query.PopulationPredicate;
import com.headcount.service.core.repo.FilterValueRepository;
import com.headcount.service.core.sql.SqlDialect;
import com.headcount.service.core.sql.SqlFragment;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Lists the values each filterable dimension currently holds, for choice lists. Does not validate
 * anything; unknown filter values are simply matched by nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FilterValueCatalogService {

    private final AnalysisCatalog catalog;
    private final FilterValueRepository repository;
    private final SqlDialect dialect;

    public Map<String, List<String>> listValues(boolean activeOnly, LocalDate snapshotDate) {
        SqlFragment population = PopulationPredicate.of(dialect, activeOnly, snapshotDate);
        Map<String, List<String>> values = new LinkedHashMap<>();
        for (DimensionDefinition dim : catalog.filterableDimensions()) {
            values.put(dim.id(), repository.distinctValues(dim.column(), population));
        }
        log.debug(
                "Listed filter values for {} dimensions (activeOnly={}, snapshotDate={})",
                values.size(),
                activeOnly,
                snapshotDate);
        return values;
    }
}
